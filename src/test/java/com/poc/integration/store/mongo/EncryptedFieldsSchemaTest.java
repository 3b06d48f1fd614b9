package com.poc.integration.store.mongo;

import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.FieldEncryptionTable;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptedFieldsSchemaTest {

    private final FieldEncryptionTable table = FieldEncryptionTable.defaultTable();

    private Map<String, BsonBinary> keyIds() {
        Map<String, BsonBinary> keyIds = new HashMap<>();
        for (String field : table.fieldNames()) {
            keyIds.put(field, new BsonBinary(UUID.randomUUID()));
        }
        return keyIds;
    }

    private BsonDocument fieldAt(BsonDocument schema, String path) {
        for (BsonValue value : schema.getArray("fields")) {
            BsonDocument field = value.asDocument();
            if (field.getString("path").getValue().equals(path)) {
                return field;
            }
        }
        throw new AssertionError("No field at " + path);
    }

    @Test
    void shouldDescribeSubstringIndex() {
        BsonDocument schema = EncryptedFieldsSchema.build(table, keyIds());

        BsonDocument query = fieldAt(schema, "searchable_name").getArray("queries").get(0).asDocument();
        assertThat(query.getString("queryType").getValue()).isEqualTo("substringPreview");
        assertThat(query.getInt32("strMinQueryLength").getValue()).isEqualTo(2);
        assertThat(query.getInt32("strMaxQueryLength").getValue()).isEqualTo(10);
        assertThat(query.getInt32("strMaxLength").getValue()).isEqualTo(60);
        assertThat(query.getBoolean("caseSensitive").getValue()).isFalse();
    }

    @Test
    void shouldOmitMaxLengthForPrefixIndex() {
        BsonDocument schema = EncryptedFieldsSchema.build(table, keyIds());

        BsonDocument query = fieldAt(schema, "searchable_email").getArray("queries").get(0).asDocument();
        assertThat(query.getString("queryType").getValue()).isEqualTo("prefixPreview");
        assertThat(query.containsKey("strMaxLength")).isFalse();
    }

    @Test
    void shouldRegisterUnindexedFieldsWithoutQueries() {
        BsonDocument schema = EncryptedFieldsSchema.build(table, keyIds());

        BsonDocument address = fieldAt(schema, "address");
        assertThat(address.getString("bsonType").getValue()).isEqualTo("object");
        assertThat(address.containsKey("queries")).isFalse();
        assertThat(fieldAt(schema, "metadata.status").getArray("queries").get(0).asDocument()
            .getString("queryType").getValue()).isEqualTo("equality");
    }

    @Test
    void shouldRequireKeyForEveryField() {
        Map<String, BsonBinary> keyIds = keyIds();
        keyIds.remove("phone");

        assertThatThrownBy(() -> EncryptedFieldsSchema.build(table, keyIds))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("phone");
    }

    @Test
    void shouldDeriveKeyAltNameFromPath() {
        assertThat(EncryptedFieldsSchema.keyAltName(FieldEncryptionSpec.equality("category", "metadata.category")))
            .isEqualTo("customer_metadata_category_key");
    }
}
