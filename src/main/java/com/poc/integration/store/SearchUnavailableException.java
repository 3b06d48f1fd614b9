package com.poc.integration.store;

import com.poc.integration.IntegrationException;

/**
 * The search store could not be reached or did not answer within the call deadline.
 */
public class SearchUnavailableException extends IntegrationException {

    public SearchUnavailableException(String message) {
        super(message);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
