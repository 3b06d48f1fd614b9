package com.poc.integration.search;

import com.poc.integration.encryption.EncryptionAlgorithmRouter;
import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.InvalidQueryException;
import com.poc.integration.encryption.QueryKind;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.OperatingMode;
import com.poc.integration.store.RecordStore;
import com.poc.integration.store.RecordStoreUnavailableException;
import com.poc.integration.store.SearchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a field search in one of two operating modes.
 *
 * <ul>
 *   <li>{@link OperatingMode#HYBRID}: identifiers from the search store, full records from the
 *       record store. If the record store fails the identifiers are still returned, marked partial.</li>
 *   <li>{@link OperatingMode#SEARCH_STORE_ONLY}: decrypted projections straight from the search
 *       store, with record-store-only fields set to the unavailable sentinel.</li>
 * </ul>
 *
 * Queries are validated before any store is called. Results keep search store order.
 * A search store failure is never answered from the record store.
 */
public class SearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private final EncryptionAlgorithmRouter router;
    private final SearchStore searchStore;
    private final RecordStore recordStore;
    private final Duration callTimeout;
    private final int defaultLimit;
    private final int maxLimit;

    public SearchOrchestrator(EncryptionAlgorithmRouter router, SearchStore searchStore, RecordStore recordStore,
                              Duration callTimeout, int defaultLimit, int maxLimit) {
        this.router = router;
        this.searchStore = searchStore;
        this.recordStore = recordStore;
        this.callTimeout = callTimeout;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * Searches with the field's default query kind and the default limit.
     */
    public SearchResult search(String field, String value, OperatingMode mode) {
        return search(field, value, mode, defaultLimit);
    }

    public SearchResult search(String field, String value, OperatingMode mode, int limit) {
        QueryKind kind = router.defaultKind(field);
        return search(field, kind, value, mode, limit);
    }

    public SearchResult search(String field, QueryKind kind, String value, OperatingMode mode, int limit) {
        long startNanos = System.nanoTime();

        if (mode == null) {
            throw new InvalidQueryException("Operating mode is required");
        }
        if (limit < 1 || limit > maxLimit) {
            throw new InvalidQueryException("Limit must be between 1 and " + maxLimit + " (got " + limit + ")");
        }
        FieldEncryptionSpec spec = router.validate(field, kind, value);

        log.debug("Executing {} search: field='{}', kind={}, limit={}", mode.getLabel(), field, kind, limit);

        return switch (mode) {
            case HYBRID -> searchHybrid(spec, kind, value, limit, startNanos);
            case SEARCH_STORE_ONLY -> searchStoreOnly(spec, kind, value, limit, startNanos);
        };
    }

    /**
     * Direct record store lookup by identifier.
     */
    public Optional<CustomerProjection> findById(String customerId) {
        if (customerId == null || customerId.isBlank()) {
            throw new InvalidQueryException("Customer id cannot be empty");
        }
        return recordStore.fetchOne(customerId, callTimeout);
    }

    private SearchResult searchHybrid(FieldEncryptionSpec spec, QueryKind kind, String value, int limit,
                                      long startNanos) {
        long searchStart = System.nanoTime();
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(
            searchStore.findIdentifiers(spec, kind, value, limit, callTimeout)));
        long searchEnd = System.nanoTime();

        if (ids.isEmpty()) {
            return new SearchResult(OperatingMode.HYBRID, spec.field(), kind, List.of(), false, List.of(),
                new StageTimings(StageTimings.elapsedMs(searchStart, searchEnd), 0.0,
                    StageTimings.elapsedMs(startNanos, System.nanoTime())));
        }

        List<SearchResultEntry> entries = new ArrayList<>(ids.size());
        List<String> warnings = new ArrayList<>();
        boolean partial = false;

        long fetchStart = System.nanoTime();
        Map<String, CustomerProjection> records;
        boolean recordStoreAvailable = true;
        try {
            records = recordStore.fetchMany(ids, callTimeout);
        } catch (RecordStoreUnavailableException e) {
            log.warn("Record store unavailable, returning {} identifiers only: {}", ids.size(), e.getMessage());
            records = Map.of();
            recordStoreAvailable = false;
            partial = true;
            warnings.add("Record store unavailable: " + e.getMessage());
        }
        long fetchEnd = System.nanoTime();

        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            CustomerProjection projection = records.get(id);
            if (projection != null) {
                entries.add(SearchResultEntry.of(projection));
            } else {
                entries.add(SearchResultEntry.identifierOnly(id));
                if (recordStoreAvailable) {
                    missing.add(id);
                }
            }
        }
        if (!missing.isEmpty()) {
            partial = true;
            warnings.add("Missing from record store: " + String.join(", ", missing));
            log.warn("{} identifiers found in search store but missing from record store", missing.size());
        }

        return new SearchResult(OperatingMode.HYBRID, spec.field(), kind, entries, partial, warnings,
            new StageTimings(StageTimings.elapsedMs(searchStart, searchEnd),
                StageTimings.elapsedMs(fetchStart, fetchEnd),
                StageTimings.elapsedMs(startNanos, System.nanoTime())));
    }

    private SearchResult searchStoreOnly(FieldEncryptionSpec spec, QueryKind kind, String value, int limit,
                                         long startNanos) {
        long searchStart = System.nanoTime();
        List<CustomerProjection> projections = searchStore.findProjections(spec, kind, value, limit, callTimeout);
        long searchEnd = System.nanoTime();

        Map<String, SearchResultEntry> unique = new LinkedHashMap<>();
        for (CustomerProjection projection : projections) {
            unique.putIfAbsent(projection.getCustomerId(),
                SearchResultEntry.of(projection.withRecordStoreOnlyUnavailable()));
        }
        long shapeEnd = System.nanoTime();

        return new SearchResult(OperatingMode.SEARCH_STORE_ONLY, spec.field(), kind,
            new ArrayList<>(unique.values()), false, List.of(),
            new StageTimings(StageTimings.elapsedMs(searchStart, searchEnd),
                StageTimings.elapsedMs(searchEnd, shapeEnd),
                StageTimings.elapsedMs(startNanos, System.nanoTime())));
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }
}
