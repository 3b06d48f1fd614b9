package com.poc.integration.gate;

/**
 * What a caller does when all license slots are taken.
 */
public enum AdmissionPolicy {
    /** Wait for a slot, up to the acquire timeout. */
    BLOCK,
    /** Fail immediately with {@link WouldThrottleException}. */
    REJECT
}
