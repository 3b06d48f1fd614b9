package com.poc.integration.encryption;

import java.util.EnumSet;
import java.util.Set;

/**
 * Encryption registration of a single searchable field.
 *
 * <p>The combination rules mirror the search store's own limits on encrypted fields:
 * <ul>
 *   <li>at most two algorithm classes per field</li>
 *   <li>SUBSTRING_PREVIEW and UNINDEXED must stand alone</li>
 *   <li>EQUALITY cannot be mixed with a preview class</li>
 * </ul>
 * which leaves PREFIX_PREVIEW + SUFFIX_PREVIEW as the only legal pair. A store that relaxes
 * these rules is accommodated by changing the field table, not the router.
 *
 * @param field          API-facing field name (e.g. "name", "email")
 * @param path           document path in the search store (e.g. "searchable_name")
 * @param bsonType       BSON type of the stored value ("string", "object")
 * @param algorithms     registered algorithm classes
 * @param minQueryLength minimum query length for preview classes
 * @param maxQueryLength maximum query length for preview classes
 * @param maxLength      maximum stored value length for preview classes
 * @param caseSensitive  whether preview matching is case sensitive
 */
public record FieldEncryptionSpec(
    String field,
    String path,
    String bsonType,
    Set<AlgorithmClass> algorithms,
    int minQueryLength,
    int maxQueryLength,
    int maxLength,
    boolean caseSensitive
) {

    public static final int MAX_ALGORITHMS_PER_FIELD = 2;

    public FieldEncryptionSpec {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be empty");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Store path cannot be empty for field " + field);
        }
        if (bsonType == null || bsonType.isBlank()) {
            bsonType = "string";
        }
        if (algorithms == null || algorithms.isEmpty()) {
            throw new IllegalArgumentException("Field " + field + " must register at least one algorithm class");
        }
        algorithms = Set.copyOf(EnumSet.copyOf(algorithms));
        validateCombination(field, algorithms);

        if (hasPreview(algorithms)) {
            if (minQueryLength < 1 || maxQueryLength < minQueryLength) {
                throw new IllegalArgumentException(
                    "Field " + field + " has invalid query length bounds [" + minQueryLength + ", " + maxQueryLength + "]");
            }
            if (maxLength < maxQueryLength) {
                throw new IllegalArgumentException(
                    "Field " + field + " max length " + maxLength + " is below max query length " + maxQueryLength);
            }
        }
    }

    /**
     * Equality-only registration.
     */
    public static FieldEncryptionSpec equality(String field, String path) {
        return new FieldEncryptionSpec(field, path, "string", Set.of(AlgorithmClass.EQUALITY), 0, 0, 0, true);
    }

    /**
     * Encrypted but not queryable; the store only decrypts it on read.
     */
    public static FieldEncryptionSpec unindexed(String field, String path, String bsonType) {
        return new FieldEncryptionSpec(field, path, bsonType, Set.of(AlgorithmClass.UNINDEXED), 0, 0, 0, true);
    }

    /**
     * Preview registration (prefix, suffix or substring) with case-insensitive matching.
     */
    public static FieldEncryptionSpec preview(String field, String path, Set<AlgorithmClass> algorithms,
                                              int minQueryLength, int maxQueryLength, int maxLength) {
        return new FieldEncryptionSpec(field, path, "string", algorithms, minQueryLength, maxQueryLength, maxLength, false);
    }

    public boolean supports(QueryKind kind) {
        return algorithms.contains(kind.getRequiredAlgorithm());
    }

    public boolean isQueryable() {
        return algorithms.stream().anyMatch(AlgorithmClass::isQueryable);
    }

    public boolean hasPreview() {
        return hasPreview(algorithms);
    }

    private static boolean hasPreview(Set<AlgorithmClass> algorithms) {
        return algorithms.stream().anyMatch(AlgorithmClass::isPreview);
    }

    private static void validateCombination(String field, Set<AlgorithmClass> algorithms) {
        if (algorithms.size() > MAX_ALGORITHMS_PER_FIELD) {
            throw new IllegalArgumentException(
                "Field " + field + " registers " + algorithms.size() + " algorithm classes, at most "
                    + MAX_ALGORITHMS_PER_FIELD + " allowed");
        }
        if (algorithms.size() == 1) {
            return;
        }
        if (algorithms.contains(AlgorithmClass.SUBSTRING_PREVIEW)) {
            throw new IllegalArgumentException(
                "Field " + field + ": SUBSTRING_PREVIEW cannot be combined with another algorithm class");
        }
        if (algorithms.contains(AlgorithmClass.UNINDEXED)) {
            throw new IllegalArgumentException(
                "Field " + field + ": UNINDEXED cannot be combined with another algorithm class");
        }
        if (algorithms.contains(AlgorithmClass.EQUALITY)) {
            throw new IllegalArgumentException(
                "Field " + field + ": EQUALITY cannot be combined with a preview algorithm class");
        }
    }
}
