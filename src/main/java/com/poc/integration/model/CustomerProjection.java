package com.poc.integration.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A customer as returned by a search, keyed by {@link CustomerField}.
 *
 * <p>The key set is always the complete field list, whichever store produced the projection.
 * Fields a store cannot supply hold {@link Unavailable#NOT_IN_MODE} instead of being omitted,
 * so results from different operating modes have the same shape.
 */
public final class CustomerProjection {

    private final String customerId;
    private final Map<CustomerField, Object> values;

    private CustomerProjection(String customerId, Map<CustomerField, Object> values) {
        this.customerId = customerId;
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder(String customerId) {
        return new Builder(customerId);
    }

    public String getCustomerId() {
        return customerId;
    }

    public Object get(CustomerField field) {
        return values.get(field);
    }

    public boolean isAvailable(CustomerField field) {
        return values.get(field) != Unavailable.NOT_IN_MODE;
    }

    public Map<CustomerField, Object> getValues() {
        return values;
    }

    /**
     * Copy with every record-store-only field replaced by the unavailable sentinel.
     */
    public CustomerProjection withRecordStoreOnlyUnavailable() {
        Builder builder = new Builder(customerId);
        values.forEach(builder::set);
        return builder.markRecordStoreOnlyUnavailable().build();
    }

    /**
     * Response-style view: {@code customer_id} followed by every field key in enum order.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("customer_id", customerId);
        for (Map.Entry<CustomerField, Object> entry : values.entrySet()) {
            map.put(entry.getKey().getKey(), entry.getValue());
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CustomerProjection that = (CustomerProjection) o;
        return customerId.equals(that.customerId) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(customerId, values);
    }

    @Override
    public String toString() {
        return "CustomerProjection{" +
                "customerId='" + customerId + '\'' +
                ", values=" + values +
                '}';
    }

    public static final class Builder {

        private final String customerId;
        private final Map<CustomerField, Object> values = new EnumMap<>(CustomerField.class);

        private Builder(String customerId) {
            if (customerId == null || customerId.isBlank()) {
                throw new IllegalArgumentException("Customer id cannot be empty");
            }
            this.customerId = customerId;
        }

        public Builder set(CustomerField field, Object value) {
            values.put(field, normalize(value));
            return this;
        }

        /**
         * Fills every record-store-only field with the unavailable sentinel.
         */
        public Builder markRecordStoreOnlyUnavailable() {
            for (CustomerField field : CustomerField.values()) {
                if (field.isRecordStoreOnly()) {
                    values.put(field, Unavailable.NOT_IN_MODE);
                }
            }
            return this;
        }

        public CustomerProjection build() {
            for (CustomerField field : CustomerField.values()) {
                if (!values.containsKey(field)) {
                    throw new IllegalStateException("Projection for " + customerId + " is missing field " + field);
                }
            }
            return new CustomerProjection(customerId, new EnumMap<>(values));
        }

        // Stores return decimals with differing scales; money is compared at two places.
        private static Object normalize(Object value) {
            if (value instanceof BigDecimal decimal) {
                return decimal.setScale(2, RoundingMode.HALF_UP);
            }
            return value;
        }
    }
}
