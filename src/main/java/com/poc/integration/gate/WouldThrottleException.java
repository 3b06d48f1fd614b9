package com.poc.integration.gate;

import com.poc.integration.IntegrationException;

/**
 * No license slot was free, either immediately (REJECT) or within the acquire timeout (BLOCK).
 */
public class WouldThrottleException extends IntegrationException {

    public WouldThrottleException(String message) {
        super(message);
    }
}
