package com.poc.integration.model;

/**
 * Every attribute of a customer projection, in response order.
 *
 * <p>Fields tagged {@link Availability#RECORD_STORE_ONLY} are derived from data the search
 * store does not hold (orders), so they can only be filled when the record store takes part
 * in a request.
 */
public enum CustomerField {
    FULL_NAME("full_name", Availability.SHARED),
    EMAIL("email", Availability.SHARED),
    PHONE("phone", Availability.SHARED),
    ADDRESS("address", Availability.SHARED),
    PREFERENCES("preferences", Availability.SHARED),
    TIER("tier", Availability.SHARED),
    CATEGORY("category", Availability.SHARED),
    STATUS("status", Availability.SHARED),
    LOYALTY_POINTS("loyalty_points", Availability.SHARED),
    LAST_PURCHASE_DATE("last_purchase_date", Availability.SHARED),
    LIFETIME_VALUE("lifetime_value", Availability.SHARED),
    ORDER_COUNT("order_count", Availability.RECORD_STORE_ONLY),
    TOTAL_ORDER_VALUE("total_order_value", Availability.RECORD_STORE_ONLY);

    public enum Availability {
        SHARED,
        RECORD_STORE_ONLY
    }

    private final String key;
    private final Availability availability;

    CustomerField(String key, Availability availability) {
        this.key = key;
        this.availability = availability;
    }

    public String getKey() {
        return key;
    }

    public Availability getAvailability() {
        return availability;
    }

    public boolean isRecordStoreOnly() {
        return availability == Availability.RECORD_STORE_ONLY;
    }
}
