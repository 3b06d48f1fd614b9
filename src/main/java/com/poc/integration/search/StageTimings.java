package com.poc.integration.search;

/**
 * Elapsed time per search stage in milliseconds. Never negative.
 *
 * @param searchMs         search store query
 * @param fetchOrDecryptMs record store fetch (hybrid) or result decryption and shaping (search store only)
 * @param totalMs          whole request including validation
 */
public record StageTimings(double searchMs, double fetchOrDecryptMs, double totalMs) {

    public StageTimings {
        searchMs = Math.max(0.0, searchMs);
        fetchOrDecryptMs = Math.max(0.0, fetchOrDecryptMs);
        totalMs = Math.max(0.0, totalMs);
    }

    static double elapsedMs(long startNanos, long endNanos) {
        return (endNanos - startNanos) / 1_000_000.0;
    }
}
