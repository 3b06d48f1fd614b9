package com.poc.integration.virtualization;

import com.poc.integration.model.OperatingMode;

import java.util.Locale;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Searches published by the virtualization server.
 *
 * <p>The server's REST views only filter on exact field values. Prefix and substring searches
 * read the base customer view and filter the rows here.
 */
public enum VirtualQuery {

    EMAIL_PREFIX("email", "bv_alloydb_customers", null, false,
        (row, value) -> text(row, "email").startsWith(value)),
    NAME_SUBSTRING("name", "bv_alloydb_customers", null, false,
        (row, value) -> text(row, "full_name").toLowerCase(Locale.ROOT).contains(value.toLowerCase(Locale.ROOT))),
    PHONE("phone", "bv_alloydb_customers", "phone", false, null),
    CATEGORY("category", "category_search", "category", true, null),
    STATUS("status", "status_search", "status", true, null),
    CUSTOMER_ID("customer_id", "get_customer", "customer_id", false, null);

    private static final String SEARCH_STORE_SUFFIX = "_mongodb";

    private final String field;
    private final String view;
    private final String parameter;
    private final boolean hasSearchStoreView;
    private final BiPredicate<Map<String, Object>, String> rowFilter;

    VirtualQuery(String field, String view, String parameter, boolean hasSearchStoreView,
                 BiPredicate<Map<String, Object>, String> rowFilter) {
        this.field = field;
        this.view = view;
        this.parameter = parameter;
        this.hasSearchStoreView = hasSearchStoreView;
        this.rowFilter = rowFilter;
    }

    public static VirtualQuery forField(String field) {
        for (VirtualQuery query : values()) {
            if (query.field.equals(field)) {
                return query;
            }
        }
        throw new IllegalArgumentException("No virtualization search for field " + field);
    }

    public String getField() {
        return field;
    }

    /**
     * View to call. Category and status have a variant served from the search store alone.
     */
    public String viewFor(OperatingMode mode) {
        if (hasSearchStoreView && mode == OperatingMode.SEARCH_STORE_ONLY) {
            return view + SEARCH_STORE_SUFFIX;
        }
        return view;
    }

    public Map<String, String> parameters(String value) {
        return parameter == null ? Map.of() : Map.of(parameter, value);
    }

    public boolean matches(Map<String, Object> row, String value) {
        return rowFilter == null || rowFilter.test(row, value);
    }

    private static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? "" : value.toString();
    }
}
