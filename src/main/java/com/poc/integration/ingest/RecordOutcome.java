package com.poc.integration.ingest;

/**
 * Per-record result of a dual-store write.
 */
public enum RecordOutcome {
    /** Present in both stores. */
    COMMITTED,
    /** Record store write failed; the search store entry was removed again. */
    ROLLED_BACK,
    /** Not written, or left in a state that needs attention (see orphaned identifiers). */
    FAILED
}
