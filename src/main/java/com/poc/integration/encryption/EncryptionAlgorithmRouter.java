package com.poc.integration.encryption;

/**
 * Maps a field to its encryption registration and validates queries against it.
 *
 * <p>Holds no mutable state; a single instance is shared by all callers. Validation never
 * touches a store, so an oversized or unsupported query fails here with a precise message
 * instead of as a store-level error.
 */
public class EncryptionAlgorithmRouter {

    private final FieldEncryptionTable table;

    public EncryptionAlgorithmRouter(FieldEncryptionTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Field encryption table cannot be null");
        }
        this.table = table;
    }

    public FieldEncryptionSpec resolve(String field) {
        if (field == null) {
            throw new UnknownFieldException(null);
        }
        FieldEncryptionSpec spec = table.get(field);
        if (spec == null) {
            throw new UnknownFieldException(field);
        }
        return spec;
    }

    /**
     * Validates a query and returns the resolved spec for the field.
     *
     * @throws UnknownFieldException if the field is not registered
     * @throws InvalidQueryException if the operator or value is not acceptable for the field
     */
    public FieldEncryptionSpec validate(String field, QueryKind kind, String value) {
        FieldEncryptionSpec spec = resolve(field);

        if (kind == null) {
            throw new InvalidQueryException("Query kind cannot be null");
        }
        if (!spec.supports(kind)) {
            throw new InvalidQueryException(
                "Field '" + field + "' does not support " + kind + " queries (registered: " + spec.algorithms() + ")");
        }
        if (value == null || value.isEmpty()) {
            throw new InvalidQueryException("Search value for field '" + field + "' cannot be empty");
        }

        if (kind.getRequiredAlgorithm().isPreview()) {
            int length = value.length();
            if (length < spec.minQueryLength()) {
                throw new InvalidQueryException(String.format(
                    "%s query on '%s' must be at least %d characters (got %d)",
                    kind, field, spec.minQueryLength(), length));
            }
            if (length > spec.maxQueryLength()) {
                throw new InvalidQueryException(String.format(
                    "%s query on '%s' must be at most %d characters (got %d)",
                    kind, field, spec.maxQueryLength(), length));
            }
        }
        return spec;
    }

    /**
     * The operator used when a caller searches a field without naming one:
     * the field's first queryable algorithm class in declaration order.
     */
    public QueryKind defaultKind(String field) {
        FieldEncryptionSpec spec = resolve(field);
        for (AlgorithmClass algorithm : AlgorithmClass.values()) {
            if (algorithm.isQueryable() && spec.algorithms().contains(algorithm)) {
                return QueryKind.forAlgorithm(algorithm);
            }
        }
        throw new InvalidQueryException("Field '" + field + "' is not queryable");
    }

    public FieldEncryptionTable getTable() {
        return table;
    }
}
