package com.poc.integration.gate;

import com.poc.integration.IntegrationException;

/**
 * More callers held a slot than the license ceiling allows. Never expected; treated as fatal.
 */
public class GateInvariantViolationException extends IntegrationException {

    public GateInvariantViolationException(String message) {
        super(message);
    }
}
