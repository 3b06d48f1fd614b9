package com.poc.integration.store;

import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.QueryKind;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.CustomerRecord;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Encrypted, query-capable store holding the searchable projection of each customer
 * (and, decrypt-on-read, the remaining shared fields).
 *
 * <p>Every call is blocking and takes a deadline. Exceeding it, or losing the connection,
 * raises {@link SearchUnavailableException}. An empty result is never an error.
 */
public interface SearchStore {

    /**
     * Identifiers of the customers matching the query, in store order.
     */
    List<String> findIdentifiers(FieldEncryptionSpec spec, QueryKind kind, String value,
                                 int limit, Duration timeout);

    /**
     * Decrypted projections of the matching customers, in store order.
     * Record-store-only fields carry the unavailable sentinel.
     */
    List<CustomerProjection> findProjections(FieldEncryptionSpec spec, QueryKind kind, String value,
                                             int limit, Duration timeout);

    /**
     * @throws DuplicateRecordException if the identifier already exists
     */
    void insert(CustomerRecord record, Duration timeout);

    /**
     * Removes the customer. Deleting an absent identifier succeeds.
     */
    void delete(String customerId, Duration timeout);

    /**
     * Number of the given identifiers currently present in the store.
     */
    long countExisting(Collection<String> customerIds, Duration timeout);

    long countAll(Duration timeout);

    void clear(Duration timeout);
}
