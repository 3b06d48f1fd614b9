package com.poc.integration.search;

import com.poc.integration.encryption.QueryKind;
import com.poc.integration.model.OperatingMode;

import java.util.List;

/**
 * Customers matching one search, in search store order, with unique identifiers.
 *
 * @param partial  some entries carry only an identifier, see {@code warnings}
 * @param warnings human-readable reasons the result is partial
 */
public record SearchResult(
    OperatingMode mode,
    String field,
    QueryKind queryKind,
    List<SearchResultEntry> entries,
    boolean partial,
    List<String> warnings,
    StageTimings timings
) {

    public SearchResult {
        entries = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<String> customerIds() {
        return entries.stream().map(SearchResultEntry::customerId).toList();
    }
}
