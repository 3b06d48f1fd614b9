package com.poc.integration.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * An order placed by a customer. Orders live only in the record store.
 */
public record CustomerOrder(
    String orderId,
    String orderNumber,
    LocalDate orderDate,
    BigDecimal totalAmount,
    String status,
    List<OrderItem> items
) {

    public CustomerOrder {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
