package com.poc.integration.encryption;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static table of searchable field registrations, keyed by API field name.
 * Immutable once built; every entry has passed {@link FieldEncryptionSpec} validation.
 */
public final class FieldEncryptionTable {

    private final Map<String, FieldEncryptionSpec> specs;

    private FieldEncryptionTable(Map<String, FieldEncryptionSpec> specs) {
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
    }

    public static FieldEncryptionTable of(Collection<FieldEncryptionSpec> specs) {
        Map<String, FieldEncryptionSpec> byField = new LinkedHashMap<>();
        Map<String, String> byPath = new LinkedHashMap<>();
        for (FieldEncryptionSpec spec : specs) {
            if (byField.putIfAbsent(spec.field(), spec) != null) {
                throw new IllegalArgumentException("Duplicate field registration: " + spec.field());
            }
            String previous = byPath.putIfAbsent(spec.path(), spec.field());
            if (previous != null) {
                throw new IllegalArgumentException(
                    "Fields " + previous + " and " + spec.field() + " map to the same path " + spec.path());
            }
        }
        return new FieldEncryptionTable(byField);
    }

    /**
     * The registrations used by the customers collection:
     * name by substring, email by prefix, phone/category/status by equality,
     * address and preferences encrypted without an index.
     */
    public static FieldEncryptionTable defaultTable() {
        return of(List.of(
            FieldEncryptionSpec.preview("name", "searchable_name",
                EnumSet.of(AlgorithmClass.SUBSTRING_PREVIEW), 2, 10, 60),
            FieldEncryptionSpec.preview("email", "searchable_email",
                EnumSet.of(AlgorithmClass.PREFIX_PREVIEW), 1, 50, 100),
            FieldEncryptionSpec.equality("phone", "searchable_phone"),
            FieldEncryptionSpec.equality("category", "metadata.category"),
            FieldEncryptionSpec.equality("status", "metadata.status"),
            FieldEncryptionSpec.unindexed("address", "address", "object"),
            FieldEncryptionSpec.unindexed("preferences", "preferences", "object")
        ));
    }

    /**
     * Builds a table from the {@code fields} section of the YAML configuration.
     *
     * <pre>
     * fields:
     *   name:
     *     path: searchable_name
     *     bsonType: string
     *     algorithms: [SUBSTRING_PREVIEW]
     *     minQueryLength: 2
     *     maxQueryLength: 10
     *     maxLength: 60
     * </pre>
     */
    @SuppressWarnings("unchecked")
    public static FieldEncryptionTable fromMap(Map<String, Object> fields) {
        List<FieldEncryptionSpec> specs = new ArrayList<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            String field = entry.getKey();
            Map<String, Object> def = (Map<String, Object>) entry.getValue();

            Set<AlgorithmClass> algorithms = EnumSet.noneOf(AlgorithmClass.class);
            Object declared = def.get("algorithms");
            if (declared instanceof List<?> list) {
                for (Object name : list) {
                    algorithms.add(AlgorithmClass.valueOf(name.toString().toUpperCase()));
                }
            }

            specs.add(new FieldEncryptionSpec(
                field,
                (String) def.getOrDefault("path", field),
                (String) def.getOrDefault("bsonType", "string"),
                algorithms,
                intValue(def, "minQueryLength"),
                intValue(def, "maxQueryLength"),
                intValue(def, "maxLength"),
                Boolean.TRUE.equals(def.get("caseSensitive"))
            ));
        }
        return of(specs);
    }

    private static int intValue(Map<String, Object> def, String key) {
        Object value = def.get(key);
        return value instanceof Number number ? number.intValue() : 0;
    }

    public FieldEncryptionSpec get(String field) {
        return specs.get(field);
    }

    public Collection<FieldEncryptionSpec> specs() {
        return specs.values();
    }

    public Set<String> fieldNames() {
        return specs.keySet();
    }

    public int size() {
        return specs.size();
    }
}
