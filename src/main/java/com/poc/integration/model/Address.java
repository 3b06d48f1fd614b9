package com.poc.integration.model;

/**
 * Postal address of a customer.
 */
public record Address(String street, String city, String state, String zipCode) {}
