package com.poc.integration.model;

/**
 * Decides which stores take part in a search request. Fixed for the lifetime of a request.
 */
public enum OperatingMode {
    /** Search store returns identifiers, record store supplies the full records. */
    HYBRID("hybrid"),
    /** Search store returns and decrypts the full records itself. */
    SEARCH_STORE_ONLY("search_store_only");

    private final String label;

    OperatingMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
