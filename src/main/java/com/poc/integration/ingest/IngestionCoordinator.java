package com.poc.integration.ingest;

import com.poc.integration.IntegrationException;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.store.DuplicateRecordException;
import com.poc.integration.store.RecordStore;
import com.poc.integration.store.SearchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;

/**
 * Writes customers into both stores, search store first.
 *
 * <p>A record reaches the record store only after its search store insert succeeded, and a
 * failed record store insert is followed by a compensating search store delete. Each record's
 * failure is contained to that record. After every sub-batch both stores are counted for the
 * batch's committed identifiers; a mismatch becomes a {@link ConsistencyWarning}.
 */
public class IngestionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private static final int COUNT_CHUNK_SIZE = 1000;

    private final SearchStore searchStore;
    private final RecordStore recordStore;
    private final Duration callTimeout;
    private final int threads;
    private final boolean haltOnInconsistency;
    private final ProgressListener progressListener;

    public interface ProgressListener {
        void onProgress(long processed, long total, double throughput);

        void onWarning(ConsistencyWarning warning);
    }

    public IngestionCoordinator(SearchStore searchStore, RecordStore recordStore, Duration callTimeout) {
        this(searchStore, recordStore, callTimeout, 1, false, null);
    }

    public IngestionCoordinator(SearchStore searchStore, RecordStore recordStore, Duration callTimeout,
                                int threads, boolean haltOnInconsistency, ProgressListener progressListener) {
        if (threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got " + threads);
        }
        this.searchStore = searchStore;
        this.recordStore = recordStore;
        this.callTimeout = callTimeout;
        this.threads = threads;
        this.haltOnInconsistency = haltOnInconsistency;
        this.progressListener = progressListener;
    }

    /**
     * Generates and ingests {@code count} records in sub-batches of {@code batchSize}.
     */
    public IngestionSummary ingest(RecordSource source, long count, int batchSize) throws InterruptedException {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive, got " + batchSize);
        }
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative, got " + count);
        }

        IngestionMetrics metrics = new IngestionMetrics();
        AtomicBoolean halted = new AtomicBoolean(false);
        AtomicLong processed = new AtomicLong();

        int batchCount = (int) ((count + batchSize - 1) / batchSize);
        log.info("Starting ingestion of {} records in {} batches of up to {} ({} threads)",
            count, batchCount, batchSize, threads);

        metrics.start();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<IngestionBatch>> futures = new ArrayList<>(batchCount);

        try {
            for (int b = 0; b < batchCount; b++) {
                int batchNumber = b + 1;
                long start = (long) b * batchSize;
                long end = Math.min(count, start + batchSize);
                futures.add(executor.submit(() -> {
                    if (halted.get()) {
                        return null;
                    }
                    List<CustomerRecord> records = new ArrayList<>((int) (end - start));
                    for (long seq = start; seq < end; seq++) {
                        records.add(source.next(seq));
                    }
                    IngestionBatch batch = new IngestionBatch(batchNumber, records);
                    ConsistencyWarning warning = process(batch, metrics);
                    long done = processed.addAndGet(batch.size());
                    if (progressListener != null) {
                        progressListener.onProgress(done, count, metrics.getThroughput());
                    }
                    if (warning != null && haltOnInconsistency) {
                        halted.set(true);
                        log.warn("Halting ingestion after inconsistency in batch {}", batchNumber);
                    }
                    return batch;
                }));
            }

            List<IngestionBatch> batches = new ArrayList<>(batchCount);
            for (Future<IngestionBatch> future : futures) {
                IngestionBatch batch = future.get();
                if (batch != null) {
                    batches.add(batch);
                }
            }
            metrics.complete();
            log.debug("{}", metrics);
            return summarize(batches, halted.get(), metrics);
        } catch (ExecutionException e) {
            throw new IntegrationException("Ingestion worker failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Writes one batch and validates it. Returns the batch's consistency warning, or null.
     */
    ConsistencyWarning process(IngestionBatch batch, IngestionMetrics metrics) {
        batch.consume();

        List<CustomerRecord> records = batch.getRecords();
        for (int i = 0; i < records.size(); i++) {
            long startNanos = System.nanoTime();
            batch.recordOutcome(i, writeRecord(records.get(i), batch));
            metrics.recordWrite((System.nanoTime() - startNanos) / 1000);
        }
        metrics.recordBatch();

        Map<RecordOutcome, Long> counts = batch.countByOutcome();
        log.debug("Batch {}: committed={}, rolledBack={}, failed={}", batch.getBatchNumber(),
            counts.get(RecordOutcome.COMMITTED), counts.get(RecordOutcome.ROLLED_BACK), counts.get(RecordOutcome.FAILED));

        ConsistencyWarning warning = validate(batch);
        batch.setConsistencyWarning(warning);
        if (warning != null) {
            log.warn("Consistency warning: {}", warning);
            if (progressListener != null) {
                progressListener.onWarning(warning);
            }
        }
        return warning;
    }

    private RecordOutcome writeRecord(CustomerRecord record, IngestionBatch batch) {
        String id = record.id();

        try {
            searchStore.insert(record, callTimeout);
        } catch (DuplicateRecordException e) {
            log.warn("Search store already holds {}; record skipped", id);
            return RecordOutcome.FAILED;
        } catch (RuntimeException e) {
            log.warn("Search store insert failed for {}: {}", id, e.getMessage());
            return RecordOutcome.FAILED;
        }

        try {
            recordStore.insert(record, callTimeout);
            return RecordOutcome.COMMITTED;
        } catch (DuplicateRecordException e) {
            log.warn("Record store already holds {}; removing search store entry", id);
            compensate(id, batch);
            return RecordOutcome.FAILED;
        } catch (RuntimeException e) {
            log.warn("Record store insert failed for {}: {}; rolling back search store insert", id, e.getMessage());
            return compensate(id, batch) ? RecordOutcome.ROLLED_BACK : RecordOutcome.FAILED;
        }
    }

    // Returns false if the search store entry could not be removed.
    private boolean compensate(String id, IngestionBatch batch) {
        try {
            searchStore.delete(id, callTimeout);
            return true;
        } catch (RuntimeException e) {
            log.error("Compensating delete failed for {}; entry is orphaned in the search store", id, e);
            batch.recordOrphan(id);
            return false;
        }
    }

    private ConsistencyWarning validate(IngestionBatch batch) {
        List<String> committed = batch.getCommittedIds();
        if (committed.isEmpty() && batch.getOrphanedIds().isEmpty()) {
            return null;
        }

        long searchCount = safeCount(committed, ids -> searchStore.countExisting(ids, callTimeout), "search store");
        long recordCount = safeCount(committed, ids -> recordStore.countExisting(ids, callTimeout), "record store");

        if (searchCount == committed.size() && recordCount == committed.size() && batch.getOrphanedIds().isEmpty()) {
            return null;
        }

        String message;
        if (searchCount < 0 || recordCount < 0) {
            message = "store count unavailable";
        } else if (!batch.getOrphanedIds().isEmpty()) {
            message = batch.getOrphanedIds().size() + " orphaned search store entries";
        } else {
            message = "store counts differ from committed records";
        }
        return new ConsistencyWarning(batch.getBatchNumber(), committed.size(), searchCount, recordCount, message);
    }

    private IngestionSummary summarize(List<IngestionBatch> batches, boolean halted, IngestionMetrics metrics) {
        long generated = 0;
        long committed = 0;
        long rolledBack = 0;
        long failed = 0;
        List<String> allCommitted = new ArrayList<>();
        List<String> orphaned = new ArrayList<>();
        List<ConsistencyWarning> warnings = new ArrayList<>();

        for (IngestionBatch batch : batches) {
            Map<RecordOutcome, Long> counts = batch.countByOutcome();
            generated += batch.size();
            committed += counts.get(RecordOutcome.COMMITTED);
            rolledBack += counts.get(RecordOutcome.ROLLED_BACK);
            failed += counts.get(RecordOutcome.FAILED);
            allCommitted.addAll(batch.getCommittedIds());
            orphaned.addAll(batch.getOrphanedIds());
        }

        for (IngestionBatch batch : batches) {
            batch.getConsistencyWarning().ifPresent(warnings::add);
        }

        long searchCount = safeCount(allCommitted, ids -> searchStore.countExisting(ids, callTimeout), "search store");
        long recordCount = safeCount(allCommitted, ids -> recordStore.countExisting(ids, callTimeout), "record store");
        boolean storesAgree = searchCount == allCommitted.size() && recordCount == allCommitted.size();

        IngestionSummary summary = new IngestionSummary(generated, committed, rolledBack, failed, warnings,
            storesAgree, searchCount, recordCount, orphaned, halted,
            metrics.getElapsedTimeMs(), metrics.getThroughput(), metrics.getP95LatencyMs());

        log.info("Ingestion complete: generated={}, committed={}, rolledBack={}, failed={}, storesAgree={}",
            generated, committed, rolledBack, failed, storesAgree);
        return summary;
    }

    private long safeCount(List<String> ids, ToLongFunction<List<String>> counter, String storeName) {
        if (ids.isEmpty()) {
            return 0;
        }
        try {
            long total = 0;
            for (int i = 0; i < ids.size(); i += COUNT_CHUNK_SIZE) {
                total += counter.applyAsLong(ids.subList(i, Math.min(ids.size(), i + COUNT_CHUNK_SIZE)));
            }
            return total;
        } catch (RuntimeException e) {
            log.warn("Could not count {}: {}", storeName, e.getMessage());
            return -1;
        }
    }
}
