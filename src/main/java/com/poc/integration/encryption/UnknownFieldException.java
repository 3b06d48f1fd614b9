package com.poc.integration.encryption;

import com.poc.integration.IntegrationException;

/**
 * Thrown when a field has no entry in the field encryption table.
 */
public class UnknownFieldException extends IntegrationException {

    private final String field;

    public UnknownFieldException(String field) {
        super("Unknown field: " + field);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
