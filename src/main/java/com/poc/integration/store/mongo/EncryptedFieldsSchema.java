package com.poc.integration.store.mongo;

import com.poc.integration.encryption.AlgorithmClass;
import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.FieldEncryptionTable;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;

import java.util.Map;

/**
 * Builds the Queryable Encryption {@code encryptedFields} document from the field table.
 *
 * <p>The same document is used to create the encrypted collection and, keyed by namespace,
 * as the client-side encrypted fields map for automatic encryption.
 */
public final class EncryptedFieldsSchema {

    private static final int CONTENTION = 0;

    private EncryptedFieldsSchema() {
    }

    /**
     * Key alternate name for a field's data encryption key, e.g. {@code customer_searchable_name_key}.
     */
    public static String keyAltName(FieldEncryptionSpec spec) {
        return "customer_" + spec.path().replace('.', '_') + "_key";
    }

    /**
     * @param table  field registrations
     * @param keyIds data key id per field name
     */
    public static BsonDocument build(FieldEncryptionTable table, Map<String, BsonBinary> keyIds) {
        BsonArray fields = new BsonArray();

        for (FieldEncryptionSpec spec : table.specs()) {
            BsonBinary keyId = keyIds.get(spec.field());
            if (keyId == null) {
                throw new IllegalArgumentException("No data encryption key for field " + spec.field());
            }

            BsonDocument field = new BsonDocument()
                .append("path", new BsonString(spec.path()))
                .append("bsonType", new BsonString(spec.bsonType()))
                .append("keyId", keyId);

            BsonArray queries = new BsonArray();
            for (AlgorithmClass algorithm : spec.algorithms()) {
                if (algorithm.isQueryable()) {
                    queries.add(query(spec, algorithm));
                }
            }
            if (!queries.isEmpty()) {
                field.append("queries", queries);
            }
            fields.add(field);
        }

        return new BsonDocument("fields", fields);
    }

    private static BsonDocument query(FieldEncryptionSpec spec, AlgorithmClass algorithm) {
        BsonDocument query = new BsonDocument()
            .append("queryType", new BsonString(algorithm.getQueryType()))
            .append("contention", new BsonInt64(CONTENTION));

        if (algorithm.isPreview()) {
            query.append("strMinQueryLength", new BsonInt32(spec.minQueryLength()))
                .append("strMaxQueryLength", new BsonInt32(spec.maxQueryLength()))
                .append("caseSensitive", BsonBoolean.valueOf(spec.caseSensitive()))
                .append("diacriticSensitive", BsonBoolean.FALSE);
            // Prefix and suffix indexes are bounded by query length only.
            if (algorithm == AlgorithmClass.SUBSTRING_PREVIEW) {
                query.append("strMaxLength", new BsonInt32(spec.maxLength()));
            }
        }
        return query;
    }
}
