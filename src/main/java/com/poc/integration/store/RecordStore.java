package com.poc.integration.store;

import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.CustomerRecord;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative store holding the full encrypted-at-rest customer record.
 * Records are only ever addressed by identifier.
 *
 * <p>Every call is blocking and takes a deadline. Exceeding it, or losing the connection,
 * raises {@link RecordStoreUnavailableException}.
 */
public interface RecordStore {

    /**
     * Full projections keyed by identifier. Identifiers not present in the store are
     * omitted from the map.
     */
    Map<String, CustomerProjection> fetchMany(Collection<String> customerIds, Duration timeout);

    default Optional<CustomerProjection> fetchOne(String customerId, Duration timeout) {
        return Optional.ofNullable(fetchMany(List.of(customerId), timeout).get(customerId));
    }

    /**
     * Writes the customer and its orders atomically.
     *
     * @throws DuplicateRecordException if the identifier or a unique field already exists
     */
    void insert(CustomerRecord record, Duration timeout);

    /**
     * Removes the customer and its orders. Deleting an absent identifier succeeds.
     */
    void delete(String customerId, Duration timeout);

    long countExisting(Collection<String> customerIds, Duration timeout);

    long countAll(Duration timeout);

    void clear(Duration timeout);
}
