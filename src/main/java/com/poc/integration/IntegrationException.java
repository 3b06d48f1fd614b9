package com.poc.integration;

/**
 * Base class for failures raised by the integration core.
 * Unchecked, so callers only catch the conditions they can act on.
 */
public class IntegrationException extends RuntimeException {

    public IntegrationException(String message) {
        super(message);
    }

    public IntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
