package com.poc.integration.store.jdbc;

import com.poc.integration.model.Address;
import com.poc.integration.model.CustomerField;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.Preferences;
import com.poc.integration.store.DuplicateRecordException;
import com.poc.integration.store.RecordStoreUnavailableException;
import com.poc.integration.store.TestCustomers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcRecordStoreTest {

    private static final Duration TIMEOUT = Duration.ofMillis(1500);
    private static final String KEY = "test-key";

    private StubDataSource dataSource;
    private JdbcRecordStore store;

    @BeforeEach
    void setUp() {
        dataSource = new StubDataSource();
        store = new JdbcRecordStore(dataSource, KEY);
    }

    @Nested
    class Insert {

        @Test
        void shouldWriteCustomerAndOrdersInOneTransaction() {
            // When
            store.insert(TestCustomers.customer("3f1c1a7e-0000-4000-8000-000000000001", "Alice Johnson",
                "alice@example.com"), TIMEOUT);

            // Then
            assertThat(dataSource.preparedSql)
                .containsExactly(JdbcRecordStore.INSERT_CUSTOMER_SQL, JdbcRecordStore.INSERT_ORDER_SQL);
            assertThat(dataSource.committed).isTrue();
            assertThat(dataSource.rolledBack).isFalse();
            assertThat(dataSource.queryTimeouts).containsOnly(2);
        }

        @Test
        void shouldReportUniqueViolationAsDuplicate() {
            // Given
            dataSource.failStatement("INSERT INTO customers",
                new SQLException("duplicate key value violates unique constraint", "23505"));

            // When / Then
            assertThatThrownBy(() -> store.insert(TestCustomers.customer("c-1", "Alice", "a@example.com"), TIMEOUT))
                .isInstanceOfSatisfying(DuplicateRecordException.class,
                    e -> assertThat(e.getCustomerId()).isEqualTo("c-1"));
            assertThat(dataSource.rolledBack).isTrue();
            assertThat(dataSource.committed).isFalse();
        }

        @Test
        void shouldRollBackWhenOrderInsertFails() {
            // Given
            dataSource.failStatement("INSERT INTO orders", new SQLException("deadlock detected", "40P01"));

            // When / Then
            assertThatThrownBy(() -> store.insert(TestCustomers.customer("c-1", "Alice", "a@example.com"), TIMEOUT))
                .isInstanceOf(RecordStoreUnavailableException.class)
                .hasMessageContaining("deadlock");
            assertThat(dataSource.rolledBack).isTrue();
        }

        @Test
        void shouldReportUnreachableDatabase() {
            dataSource.failConnections(new SQLException("Connection refused", "08001"));

            assertThatThrownBy(() -> store.insert(TestCustomers.customer("c-1", "Alice", "a@example.com"), TIMEOUT))
                .isInstanceOf(RecordStoreUnavailableException.class);
        }
    }

    @Nested
    class Fetch {

        @Test
        void shouldNotOpenConnectionForEmptyIdList() {
            assertThat(store.fetchMany(List.of(), TIMEOUT)).isEmpty();
            assertThat(dataSource.connectionsOpened).isZero();
        }

        @Test
        void shouldMapDecryptedRows() {
            // Given
            Map<String, Object> row = new HashMap<>();
            row.put("customer_id", "c-1");
            row.put("full_name", "Alice Johnson");
            row.put("email", "alice@example.com");
            row.put("phone", "+1-555-1234");
            row.put("address", "{\"street\": \"1 Main St\", \"city\": \"Springfield\", \"state\": \"IL\", "
                + "\"zip_code\": \"62701\"}");
            row.put("preferences", "{\"newsletter\": true, \"sms\": false}");
            row.put("tier", "gold");
            row.put("category", "retail");
            row.put("status", "active");
            row.put("loyalty_points", 120);
            row.put("last_purchase_date", "2024-03-01T10:15:30");
            row.put("lifetime_value", new BigDecimal("1500.0"));
            row.put("order_count", 2);
            row.put("total_order_value", null);
            dataSource.resultRows = List.of(row);

            // When
            Map<String, CustomerProjection> result = store.fetchMany(List.of("c-1", "c-2"), TIMEOUT);

            // Then
            assertThat(result).containsOnlyKeys("c-1");
            CustomerProjection projection = result.get("c-1");
            assertThat(projection.get(CustomerField.ADDRESS))
                .isEqualTo(new Address("1 Main St", "Springfield", "IL", "62701"));
            assertThat(projection.get(CustomerField.PREFERENCES)).isEqualTo(new Preferences(true, false));
            assertThat(projection.get(CustomerField.LIFETIME_VALUE)).isEqualTo(new BigDecimal("1500.00"));
            assertThat(projection.get(CustomerField.ORDER_COUNT)).isEqualTo(2);
            assertThat(projection.get(CustomerField.TOTAL_ORDER_VALUE)).isEqualTo(new BigDecimal("0.00"));
            assertThat(dataSource.lastParameters.get(1)).isEqualTo(KEY);
        }

        @Test
        void shouldWrapQueryFailure() {
            dataSource.failStatement("SELECT", new SQLException("canceling statement due to statement timeout", "57014"));

            assertThatThrownBy(() -> store.fetchMany(List.of("c-1"), TIMEOUT))
                .isInstanceOf(RecordStoreUnavailableException.class)
                .hasMessageContaining("statement timeout");
        }
    }

    @Nested
    class Counting {

        @Test
        void shouldCountExistingIds() {
            dataSource.resultRows = List.of(Map.of("count", 3L));

            assertThat(store.countExisting(List.of("a", "b", "c"), TIMEOUT)).isEqualTo(3);
            assertThat(dataSource.preparedSql).containsExactly(JdbcRecordStore.COUNT_EXISTING_SQL);
        }

        @Test
        void shouldReturnZeroWithoutQueryForNoIds() {
            assertThat(store.countExisting(List.of(), TIMEOUT)).isZero();
            assertThat(dataSource.connectionsOpened).isZero();
        }
    }

    @Test
    void shouldRoundQueryTimeoutUpToWholeSeconds() {
        assertThat(JdbcRecordStore.timeoutSeconds(Duration.ofMillis(1))).isEqualTo(1);
        assertThat(JdbcRecordStore.timeoutSeconds(Duration.ZERO)).isEqualTo(1);
        assertThat(JdbcRecordStore.timeoutSeconds(Duration.ofMillis(1000))).isEqualTo(1);
        assertThat(JdbcRecordStore.timeoutSeconds(Duration.ofMillis(1001))).isEqualTo(2);
    }

    @Test
    void shouldRequireEncryptionKey() {
        assertThatThrownBy(() -> new JdbcRecordStore(dataSource, ""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
