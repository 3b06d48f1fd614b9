package com.poc.integration.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Canonical customer record as generated before ingestion.
 * The identifier is a UUID string shared by both stores.
 */
public record CustomerRecord(
    String id,
    String fullName,
    String email,
    String phone,
    Address address,
    Preferences preferences,
    String tier,
    String category,
    String status,
    int loyaltyPoints,
    BigDecimal lifetimeValue,
    String lastPurchaseDate,
    List<CustomerOrder> orders
) {

    public CustomerRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Customer id cannot be empty");
        }
        lifetimeValue = lifetimeValue == null ? null : lifetimeValue.setScale(2, RoundingMode.HALF_UP);
        orders = orders == null ? List.of() : List.copyOf(orders);
    }

    public BigDecimal totalOrderValue() {
        return orders.stream()
            .map(CustomerOrder::totalAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Full projection as the record store would return it, including order aggregates.
     */
    public CustomerProjection toProjection() {
        return CustomerProjection.builder(id)
            .set(CustomerField.FULL_NAME, fullName)
            .set(CustomerField.EMAIL, email)
            .set(CustomerField.PHONE, phone)
            .set(CustomerField.ADDRESS, address)
            .set(CustomerField.PREFERENCES, preferences)
            .set(CustomerField.TIER, tier)
            .set(CustomerField.CATEGORY, category)
            .set(CustomerField.STATUS, status)
            .set(CustomerField.LOYALTY_POINTS, loyaltyPoints)
            .set(CustomerField.LAST_PURCHASE_DATE, lastPurchaseDate)
            .set(CustomerField.LIFETIME_VALUE, lifetimeValue)
            .set(CustomerField.ORDER_COUNT, orders.size())
            .set(CustomerField.TOTAL_ORDER_VALUE, totalOrderValue())
            .build();
    }
}
