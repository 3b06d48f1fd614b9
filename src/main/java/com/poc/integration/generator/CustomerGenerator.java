package com.poc.integration.generator;

import com.poc.integration.model.Address;
import com.poc.integration.model.CustomerOrder;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.model.OrderItem;
import com.poc.integration.model.Preferences;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Generates customer records with one to five orders each.
 *
 * <p>The sequence number is folded into the email address so emails stay unique across a run.
 */
public class CustomerGenerator {

    static final List<String> TIERS = List.of("bronze", "silver", "gold", "platinum", "premium");
    static final List<String> CATEGORIES = List.of("retail", "enterprise", "government");
    static final List<String> STATUSES = List.of("active", "inactive", "pending");
    static final List<String> ORDER_STATUSES = List.of("completed", "pending", "shipped");

    private static final List<Product> PRODUCTS = List.of(
        new Product("Widget A", new BigDecimal("29.99")),
        new Product("Gadget B", new BigDecimal("49.99")),
        new Product("Tool C", new BigDecimal("89.99")),
        new Product("Device D", new BigDecimal("129.99")),
        new Product("Equipment E", new BigDecimal("199.99"))
    );

    // Queryable name values are capped at 60 characters by the substring index.
    private static final int MAX_NAME_LENGTH = 60;

    private record Product(String name, BigDecimal price) {}

    private final RandomDataProvider random;

    public CustomerGenerator(RandomDataProvider random) {
        this.random = random;
    }

    public CustomerRecord generate(long sequenceNumber) {
        String id = UUID.randomUUID().toString();
        String firstName = random.firstName();
        String lastName = random.lastName();

        String fullName = firstName + " " + lastName;
        if (fullName.length() > MAX_NAME_LENGTH) {
            fullName = fullName.substring(0, MAX_NAME_LENGTH);
        }
        String email = (firstName + "." + lastName).toLowerCase(Locale.ROOT)
            + (sequenceNumber + 1) + "@example.com";

        Address address = new Address(random.streetAddress(), random.city(), random.usState(), random.zipCode());
        Preferences preferences = new Preferences(random.randomBoolean(), random.randomBoolean());

        return new CustomerRecord(
            id,
            fullName,
            email,
            random.phoneNumber(),
            address,
            preferences,
            random.randomChoice(TIERS),
            random.randomChoice(CATEGORIES),
            random.randomChoice(STATUSES),
            random.randomInt(0, 1000),
            random.money(100, 10000),
            random.recentDateTime(365),
            generateOrders()
        );
    }

    public List<CustomerRecord> generate(long startSequence, int count) {
        List<CustomerRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            records.add(generate(startSequence + i));
        }
        return records;
    }

    private List<CustomerOrder> generateOrders() {
        int orderCount = random.randomInt(1, 5);
        List<CustomerOrder> orders = new ArrayList<>(orderCount);

        for (int i = 0; i < orderCount; i++) {
            int itemCount = random.randomInt(1, 3);
            List<OrderItem> items = new ArrayList<>(itemCount);
            BigDecimal total = BigDecimal.ZERO;

            for (int j = 0; j < itemCount; j++) {
                Product product = random.randomChoice(PRODUCTS);
                OrderItem item = new OrderItem(product.name(), product.price(), random.randomInt(1, 3));
                items.add(item);
                total = total.add(item.total());
            }

            orders.add(new CustomerOrder(
                UUID.randomUUID().toString(),
                "ORD-" + random.randomInt(10000, 99999),
                random.recentDate(365),
                total.setScale(2, RoundingMode.HALF_UP),
                random.randomChoice(ORDER_STATUSES),
                items
            ));
        }
        return orders;
    }
}
