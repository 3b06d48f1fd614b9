package com.poc.integration.virtualization;

import com.poc.integration.IntegrationException;

/**
 * The virtualization server rejected a request or could not be reached.
 */
public class VirtualizationException extends IntegrationException {

    public VirtualizationException(String message) {
        super(message);
    }

    public VirtualizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
