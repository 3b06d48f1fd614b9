package com.poc.integration.model;

/**
 * Sentinel value for a projection field the current operating mode cannot supply.
 */
public enum Unavailable {
    NOT_IN_MODE;

    @Override
    public String toString() {
        return "<not available in this mode>";
    }
}
