package com.poc.integration.generator;

import com.poc.integration.model.CustomerOrder;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.model.OrderItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerGeneratorTest {

    private CustomerGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CustomerGenerator(new RandomDataProvider());
    }

    @Test
    void shouldGenerateRecordWithUuidAndValueDomains() {
        CustomerRecord record = generator.generate(0);

        assertThat(UUID.fromString(record.id()).toString()).isEqualTo(record.id());
        assertThat(CustomerGenerator.TIERS).contains(record.tier());
        assertThat(CustomerGenerator.CATEGORIES).contains(record.category());
        assertThat(CustomerGenerator.STATUSES).contains(record.status());
        assertThat(record.loyaltyPoints()).isBetween(0, 1000);
        assertThat(record.lifetimeValue()).isBetween(new BigDecimal("100.00"), new BigDecimal("10000.00"));
        assertThat(record.phone()).matches("\\+1-555-\\d{4}");
        assertThat(record.address().zipCode()).matches("\\d{5}");
    }

    @Test
    void shouldFoldSequenceIntoEmail() {
        CustomerRecord record = generator.generate(41);

        assertThat(record.email()).endsWith("42@example.com");
        assertThat(record.email()).isLowerCase();
    }

    @Test
    void shouldKeepNameWithinSubstringIndexLimit() {
        for (CustomerRecord record : generator.generate(0, 200)) {
            assertThat(record.fullName().length()).isLessThanOrEqualTo(60);
        }
    }

    @Test
    void shouldGenerateOneToFiveConsistentOrders() {
        for (CustomerRecord record : generator.generate(0, 100)) {
            assertThat(record.orders()).hasSizeBetween(1, 5);
            for (CustomerOrder order : record.orders()) {
                assertThat(order.items()).hasSizeBetween(1, 3);
                BigDecimal itemTotal = order.items().stream()
                    .map(OrderItem::total)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
                assertThat(order.totalAmount()).isEqualByComparingTo(itemTotal);
                assertThat(CustomerGenerator.ORDER_STATUSES).contains(order.status());
            }
        }
    }

    @Test
    void shouldGenerateUniqueIdsAndEmails() {
        List<CustomerRecord> records = generator.generate(0, 500);

        Set<String> ids = records.stream().map(CustomerRecord::id).collect(Collectors.toSet());
        Set<String> emails = records.stream().map(CustomerRecord::email).collect(Collectors.toSet());
        assertThat(ids).hasSize(500);
        assertThat(emails).hasSize(500);
    }
}
