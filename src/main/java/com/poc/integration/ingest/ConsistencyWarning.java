package com.poc.integration.ingest;

/**
 * The two stores disagreed on how many of a batch's committed records they hold.
 * A count of -1 means the store could not be counted.
 */
public record ConsistencyWarning(
    int batchNumber,
    long committed,
    long searchStoreCount,
    long recordStoreCount,
    String message
) {

    @Override
    public String toString() {
        return String.format("Batch %d: committed=%d, searchStore=%d, recordStore=%d (%s)",
            batchNumber, committed, searchStoreCount, recordStoreCount, message);
    }
}
