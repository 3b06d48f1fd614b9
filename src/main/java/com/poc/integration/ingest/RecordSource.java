package com.poc.integration.ingest;

import com.poc.integration.model.CustomerRecord;

/**
 * Produces the record for a sequence number. Called from ingestion worker threads.
 */
@FunctionalInterface
public interface RecordSource {

    CustomerRecord next(long sequenceNumber);
}
