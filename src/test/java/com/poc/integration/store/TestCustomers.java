package com.poc.integration.store;

import com.poc.integration.model.Address;
import com.poc.integration.model.CustomerOrder;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.model.OrderItem;
import com.poc.integration.model.Preferences;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Fixed customer records for store and orchestration tests.
 */
public final class TestCustomers {

    private TestCustomers() {
    }

    public static CustomerRecord customer(String id, String fullName, String email) {
        return customer(id, fullName, email, "+1-555-1234", "retail", "active");
    }

    public static CustomerRecord customer(String id, String fullName, String email, String phone,
                                          String category, String status) {
        OrderItem item = new OrderItem("Widget A", new BigDecimal("29.99"), 2);
        CustomerOrder order = new CustomerOrder("order-" + id, "ORD-10001", LocalDate.of(2024, 3, 1),
            new BigDecimal("59.98"), "completed", List.of(item));

        return new CustomerRecord(
            id,
            fullName,
            email,
            phone,
            new Address("1 Main St", "Springfield", "IL", "62701"),
            new Preferences(true, false),
            "gold",
            category,
            status,
            120,
            new BigDecimal("1500.00"),
            "2024-03-01T10:15:30",
            List.of(order)
        );
    }
}
