package com.poc.integration.encryption;

import com.poc.integration.IntegrationException;

/**
 * Thrown when a query fails local validation against the field's encryption spec.
 * Raised before any store is contacted.
 */
public class InvalidQueryException extends IntegrationException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
