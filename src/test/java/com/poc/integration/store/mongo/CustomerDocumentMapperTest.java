package com.poc.integration.store.mongo;

import com.poc.integration.encryption.FieldEncryptionTable;
import com.poc.integration.model.CustomerField;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.CustomerRecord;
import com.poc.integration.model.Unavailable;
import com.poc.integration.store.TestCustomers;
import org.bson.Document;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomerDocumentMapperTest {

    private final CustomerDocumentMapper mapper = new CustomerDocumentMapper(FieldEncryptionTable.defaultTable());
    private final CustomerRecord record = TestCustomers.customer("c-1", "Alice Johnson", "alice@example.com");

    @Nested
    class ToDocument {

        @Test
        void shouldPlaceFieldsAtEncryptedPaths() {
            Document doc = mapper.toDocument(record);

            assertThat(doc.getString(CustomerDocumentMapper.ID_FIELD)).isEqualTo("c-1");
            assertThat(doc.getString("searchable_name")).isEqualTo("Alice Johnson");
            assertThat(doc.getString("searchable_email")).isEqualTo("alice@example.com");
            Document metadata = doc.get("metadata", Document.class);
            assertThat(metadata.getString("category")).isEqualTo("retail");
            assertThat(metadata.getString("lifetime_value")).isEqualTo("1500.00");
            assertThat(doc.get("address", Document.class).getString("zip_code")).isEqualTo("62701");
            assertThat(doc).containsKeys("created_at", "updated_at");
        }

        @Test
        void shouldNotStoreOrders() {
            Document doc = mapper.toDocument(record);

            assertThat(doc).doesNotContainKeys("orders", "order_count");
        }
    }

    @Nested
    class ToProjection {

        @Test
        void shouldReadBackSharedFieldsAndMarkOrderFieldsUnavailable() {
            // Given
            Document doc = mapper.toDocument(record);

            // When
            CustomerProjection projection = mapper.toProjection(doc);

            // Then
            CustomerProjection expected = record.toProjection().withRecordStoreOnlyUnavailable();
            assertThat(projection).isEqualTo(expected);
            assertThat(projection.get(CustomerField.ORDER_COUNT)).isEqualTo(Unavailable.NOT_IN_MODE);
            assertThat(projection.get(CustomerField.LIFETIME_VALUE)).isEqualTo(new BigDecimal("1500.00"));
        }

        @Test
        void shouldTolerateMissingOptionalFields() {
            Document doc = new Document(CustomerDocumentMapper.ID_FIELD, "c-2")
                .append("searchable_name", "Bob");

            CustomerProjection projection = mapper.toProjection(doc);

            assertThat(projection.get(CustomerField.FULL_NAME)).isEqualTo("Bob");
            assertThat(projection.get(CustomerField.ADDRESS)).isNull();
            assertThat(projection.get(CustomerField.LOYALTY_POINTS)).isEqualTo(0);
        }
    }

    @Test
    void shouldRejectUnknownField() {
        assertThatThrownBy(() -> mapper.pathOf("ssn"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
