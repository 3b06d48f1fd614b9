package com.poc.integration.model;

/**
 * Communication preferences of a customer.
 */
public record Preferences(boolean newsletter, boolean sms) {}
