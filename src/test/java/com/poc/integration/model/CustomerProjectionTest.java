package com.poc.integration.model;

import com.poc.integration.store.TestCustomers;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomerProjectionTest {

    @Test
    void shouldComputeOrderAggregatesFromRecord() {
        CustomerProjection projection = TestCustomers.customer("c-1", "Alice", "a@example.com").toProjection();

        assertThat(projection.get(CustomerField.ORDER_COUNT)).isEqualTo(1);
        assertThat(projection.get(CustomerField.TOTAL_ORDER_VALUE)).isEqualTo(new BigDecimal("59.98"));
    }

    @Test
    void shouldListCustomerIdFirstThenFieldsInOrder() {
        CustomerProjection projection = TestCustomers.customer("c-1", "Alice", "a@example.com").toProjection();

        assertThat(projection.toMap().keySet()).startsWith("customer_id", "full_name", "email")
            .endsWith("order_count", "total_order_value")
            .hasSize(CustomerField.values().length + 1);
    }

    @Test
    void shouldReplaceOnlyRecordStoreFieldsWithSentinel() {
        CustomerProjection full = TestCustomers.customer("c-1", "Alice", "a@example.com").toProjection();

        CustomerProjection reduced = full.withRecordStoreOnlyUnavailable();

        assertThat(reduced.isAvailable(CustomerField.ORDER_COUNT)).isFalse();
        assertThat(reduced.isAvailable(CustomerField.EMAIL)).isTrue();
        assertThat(reduced.get(CustomerField.EMAIL)).isEqualTo(full.get(CustomerField.EMAIL));
        assertThat(full.isAvailable(CustomerField.ORDER_COUNT)).isTrue();
    }

    @Test
    void shouldCompareMoneyRegardlessOfScale() {
        CustomerProjection base = TestCustomers.customer("c-1", "Alice", "a@example.com").toProjection();

        CustomerProjection a = copyWith(base, CustomerField.LIFETIME_VALUE, new BigDecimal("10.5"));
        CustomerProjection b = copyWith(base, CustomerField.LIFETIME_VALUE, new BigDecimal("10.500"));

        assertThat(a).isEqualTo(b);
        assertThat(a.get(CustomerField.LIFETIME_VALUE)).isEqualTo(new BigDecimal("10.50"));
    }

    @Test
    void shouldRefuseIncompleteProjection() {
        assertThatThrownBy(() -> CustomerProjection.builder("c-1").set(CustomerField.EMAIL, "a@example.com").build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("missing field");
    }

    @Test
    void shouldRequireCustomerId() {
        assertThatThrownBy(() -> CustomerProjection.builder(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static CustomerProjection copyWith(CustomerProjection source, CustomerField field, Object value) {
        CustomerProjection.Builder builder = CustomerProjection.builder(source.getCustomerId());
        source.getValues().forEach(builder::set);
        return builder.set(field, value).build();
    }
}
