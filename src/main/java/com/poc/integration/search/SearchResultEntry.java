package com.poc.integration.search;

import com.poc.integration.model.CustomerProjection;

import java.util.Optional;

/**
 * One matching customer. The projection is absent when only the identifier could be returned.
 */
public record SearchResultEntry(String customerId, CustomerProjection projection) {

    public static SearchResultEntry identifierOnly(String customerId) {
        return new SearchResultEntry(customerId, null);
    }

    public static SearchResultEntry of(CustomerProjection projection) {
        return new SearchResultEntry(projection.getCustomerId(), projection);
    }

    public Optional<CustomerProjection> getProjection() {
        return Optional.ofNullable(projection);
    }

    public boolean isIdentifierOnly() {
        return projection == null;
    }
}
