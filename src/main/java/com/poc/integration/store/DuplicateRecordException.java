package com.poc.integration.store;

import com.poc.integration.IntegrationException;

/**
 * An insert collided with an existing identifier or unique field.
 */
public class DuplicateRecordException extends IntegrationException {

    private final String customerId;

    public DuplicateRecordException(String customerId, String message, Throwable cause) {
        super(message, cause);
        this.customerId = customerId;
    }

    public String getCustomerId() {
        return customerId;
    }
}
