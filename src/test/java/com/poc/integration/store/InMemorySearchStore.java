package com.poc.integration.store;

import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.QueryKind;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.CustomerRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Search store stand-in that matches plaintext values the way the encrypted operators would.
 * Failures can be injected per identifier or for the whole store.
 */
public class InMemorySearchStore implements SearchStore {

    private final Map<String, CustomerRecord> records = new LinkedHashMap<>();
    private final Set<String> failInsertIds = new HashSet<>();
    private final Set<String> failDeleteIds = new HashSet<>();
    private final List<String> extraIdentifiers = new ArrayList<>();
    private final AtomicInteger queryCalls = new AtomicInteger();
    private volatile boolean unavailable;
    private volatile boolean countUnavailable;

    public synchronized void put(CustomerRecord record) {
        records.put(record.id(), record);
    }

    public synchronized boolean contains(String id) {
        return records.containsKey(id);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized void failInsertFor(String id) {
        failInsertIds.add(id);
    }

    public synchronized void failDeleteFor(String id) {
        failDeleteIds.add(id);
    }

    /**
     * Identifiers appended to every identifier search, e.g. to simulate duplicates or strays.
     */
    public synchronized void appendIdentifiers(String... ids) {
        extraIdentifiers.addAll(List.of(ids));
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void setCountUnavailable(boolean countUnavailable) {
        this.countUnavailable = countUnavailable;
    }

    public int getQueryCalls() {
        return queryCalls.get();
    }

    @Override
    public synchronized List<String> findIdentifiers(FieldEncryptionSpec spec, QueryKind kind, String value,
                                                     int limit, Duration timeout) {
        queryCalls.incrementAndGet();
        checkAvailable();
        List<String> ids = new ArrayList<>();
        for (CustomerRecord record : matching(spec, kind, value, limit)) {
            ids.add(record.id());
        }
        ids.addAll(extraIdentifiers);
        return ids;
    }

    @Override
    public synchronized List<CustomerProjection> findProjections(FieldEncryptionSpec spec, QueryKind kind,
                                                                 String value, int limit, Duration timeout) {
        queryCalls.incrementAndGet();
        checkAvailable();
        List<CustomerProjection> projections = new ArrayList<>();
        for (CustomerRecord record : matching(spec, kind, value, limit)) {
            projections.add(record.toProjection().withRecordStoreOnlyUnavailable());
        }
        return projections;
    }

    @Override
    public synchronized void insert(CustomerRecord record, Duration timeout) {
        checkAvailable();
        if (failInsertIds.contains(record.id())) {
            throw new SearchUnavailableException("Injected insert failure for " + record.id());
        }
        if (records.containsKey(record.id())) {
            throw new DuplicateRecordException(record.id(), "Duplicate " + record.id(), null);
        }
        records.put(record.id(), record);
    }

    @Override
    public synchronized void delete(String customerId, Duration timeout) {
        if (failDeleteIds.contains(customerId)) {
            throw new SearchUnavailableException("Injected delete failure for " + customerId);
        }
        records.remove(customerId);
    }

    @Override
    public synchronized long countExisting(Collection<String> customerIds, Duration timeout) {
        if (countUnavailable) {
            throw new SearchUnavailableException("Injected count failure");
        }
        return customerIds.stream().filter(records::containsKey).count();
    }

    @Override
    public synchronized long countAll(Duration timeout) {
        return records.size();
    }

    @Override
    public synchronized void clear(Duration timeout) {
        records.clear();
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new SearchUnavailableException("Search store unavailable");
        }
    }

    private List<CustomerRecord> matching(FieldEncryptionSpec spec, QueryKind kind, String value, int limit) {
        List<CustomerRecord> result = new ArrayList<>();
        for (CustomerRecord record : records.values()) {
            if (result.size() >= limit) {
                break;
            }
            String stored = valueOf(record, spec.field());
            if (stored != null && matches(stored, kind, value, spec.caseSensitive())) {
                result.add(record);
            }
        }
        return result;
    }

    private static String valueOf(CustomerRecord record, String field) {
        return switch (field) {
            case "name" -> record.fullName();
            case "email" -> record.email();
            case "phone" -> record.phone();
            case "category" -> record.category();
            case "status" -> record.status();
            default -> null;
        };
    }

    private static boolean matches(String stored, QueryKind kind, String value, boolean caseSensitive) {
        if (kind == QueryKind.EQUALITY) {
            return stored.equals(value);
        }
        String s = caseSensitive ? stored : stored.toLowerCase(Locale.ROOT);
        String v = caseSensitive ? value : value.toLowerCase(Locale.ROOT);
        return switch (kind) {
            case PREFIX -> s.startsWith(v);
            case SUFFIX -> s.endsWith(v);
            case SUBSTRING -> s.contains(v);
            default -> false;
        };
    }
}
