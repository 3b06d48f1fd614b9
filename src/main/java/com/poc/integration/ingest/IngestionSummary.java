package com.poc.integration.ingest;

import java.util.List;

/**
 * Result of an ingestion run.
 *
 * @param storesAgree      both stores hold exactly the committed identifiers, by independent counts
 * @param searchStoreCount committed identifiers found in the search store, -1 if it could not be counted
 * @param recordStoreCount committed identifiers found in the record store, -1 if it could not be counted
 * @param orphanedIds      identifiers left in the search store because the compensating delete failed
 * @param halted           remaining batches were skipped after a consistency warning
 */
public record IngestionSummary(
    long generated,
    long committed,
    long rolledBack,
    long failed,
    List<ConsistencyWarning> warnings,
    boolean storesAgree,
    long searchStoreCount,
    long recordStoreCount,
    List<String> orphanedIds,
    boolean halted,
    long elapsedMs,
    double throughput,
    double p95LatencyMs
) {

    public IngestionSummary {
        warnings = List.copyOf(warnings);
        orphanedIds = List.copyOf(orphanedIds);
    }

    public boolean isAccounted() {
        return committed + rolledBack + failed == generated;
    }
}
