package com.poc.integration.ingest;

import com.poc.integration.model.CustomerRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A group of generated records and the outcome of each. Handed to the coordinator once.
 */
public class IngestionBatch {

    private final int batchNumber;
    private final List<CustomerRecord> records;
    // Indexed like records; an identifier may appear more than once
    private final RecordOutcome[] outcomes;
    private final List<String> orphanedIds = new ArrayList<>();
    private ConsistencyWarning consistencyWarning;
    private boolean consumed;

    public IngestionBatch(int batchNumber, List<CustomerRecord> records) {
        this.batchNumber = batchNumber;
        this.records = List.copyOf(records);
        this.outcomes = new RecordOutcome[this.records.size()];
    }

    /**
     * Claims the batch for processing.
     *
     * @throws IllegalStateException if the batch was already processed
     */
    void consume() {
        if (consumed) {
            throw new IllegalStateException("Batch " + batchNumber + " has already been ingested");
        }
        consumed = true;
    }

    void recordOutcome(int position, RecordOutcome outcome) {
        outcomes[position] = outcome;
    }

    void recordOrphan(String customerId) {
        orphanedIds.add(customerId);
    }

    void setConsistencyWarning(ConsistencyWarning consistencyWarning) {
        this.consistencyWarning = consistencyWarning;
    }

    public Optional<ConsistencyWarning> getConsistencyWarning() {
        return Optional.ofNullable(consistencyWarning);
    }

    public int getBatchNumber() {
        return batchNumber;
    }

    public List<CustomerRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    /**
     * Outcome of the record at {@code position}, or null if it has not been written.
     */
    public RecordOutcome getOutcome(int position) {
        return outcomes[position];
    }

    public List<RecordOutcome> getOutcomes() {
        return Collections.unmodifiableList(Arrays.asList(outcomes));
    }

    public List<String> getCommittedIds() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < outcomes.length; i++) {
            if (outcomes[i] == RecordOutcome.COMMITTED) {
                ids.add(records.get(i).id());
            }
        }
        return ids;
    }

    public List<String> getOrphanedIds() {
        return Collections.unmodifiableList(orphanedIds);
    }

    public Map<RecordOutcome, Long> countByOutcome() {
        Map<RecordOutcome, Long> counts = new EnumMap<>(RecordOutcome.class);
        for (RecordOutcome outcome : RecordOutcome.values()) {
            counts.put(outcome, 0L);
        }
        for (RecordOutcome outcome : outcomes) {
            if (outcome != null) {
                counts.merge(outcome, 1L, Long::sum);
            }
        }
        return counts;
    }
}
