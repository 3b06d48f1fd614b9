package com.poc.integration.store;

import com.poc.integration.IntegrationException;

/**
 * The record store could not be reached or did not answer within the call deadline.
 */
public class RecordStoreUnavailableException extends IntegrationException {

    public RecordStoreUnavailableException(String message) {
        super(message);
    }

    public RecordStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
