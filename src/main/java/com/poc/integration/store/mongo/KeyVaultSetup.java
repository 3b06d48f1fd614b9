package com.poc.integration.store.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoNamespace;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CreateCollectionOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.vault.DataKeyOptions;
import com.mongodb.client.vault.ClientEncryption;
import com.poc.integration.encryption.FieldEncryptionSpec;
import com.poc.integration.encryption.FieldEncryptionTable;
import com.poc.integration.store.SearchUnavailableException;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prepares the key vault and the encrypted customers collection.
 *
 * <p>One data encryption key is kept per encrypted field, found by its alternate name.
 * Keys are created on first use and reused afterwards, so setup can be run repeatedly.
 */
public class KeyVaultSetup {

    private static final Logger log = LoggerFactory.getLogger(KeyVaultSetup.class);

    public static final String KMS_PROVIDER = "local";

    private static final int MASTER_KEY_BYTES = 96;

    private final MongoClient client;
    private final ClientEncryption clientEncryption;
    private final FieldEncryptionTable table;
    private final MongoNamespace keyVaultNamespace;

    public KeyVaultSetup(MongoClient client, ClientEncryption clientEncryption,
                         FieldEncryptionTable table, String keyVaultNamespace) {
        this.client = client;
        this.clientEncryption = clientEncryption;
        this.table = table;
        this.keyVaultNamespace = new MongoNamespace(keyVaultNamespace);
    }

    /**
     * Reads the base64 local master key, generating and saving a new one if the file is absent.
     */
    public static byte[] loadOrCreateMasterKey(Path keyFile) {
        try {
            if (Files.exists(keyFile)) {
                String encoded = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                byte[] key = Base64.getDecoder().decode(encoded);
                if (key.length != MASTER_KEY_BYTES) {
                    throw new IllegalStateException("Master key in " + keyFile + " must be "
                        + MASTER_KEY_BYTES + " bytes, found " + key.length);
                }
                return key;
            }

            byte[] key = new byte[MASTER_KEY_BYTES];
            new SecureRandom().nextBytes(key);
            Files.writeString(keyFile, Base64.getEncoder().encodeToString(key), StandardCharsets.UTF_8);
            log.warn("Generated new local master key at {}", keyFile.toAbsolutePath());
            return key;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read master key file " + keyFile, e);
        }
    }

    public static Map<String, Map<String, Object>> kmsProviders(byte[] masterKey) {
        return Map.of(KMS_PROVIDER, Map.of("key", masterKey));
    }

    /**
     * Data key id per field name, creating any key that does not exist yet.
     */
    public Map<String, BsonBinary> ensureDataKeys() {
        ensureKeyVaultIndex();

        Map<String, BsonBinary> keyIds = new LinkedHashMap<>();
        for (FieldEncryptionSpec spec : table.specs()) {
            String altName = EncryptedFieldsSchema.keyAltName(spec);
            BsonDocument existing = clientEncryption.getKeyByAltName(altName);
            BsonBinary keyId;
            if (existing != null) {
                keyId = existing.getBinary("_id");
                log.debug("Reusing data key {} for field {}", altName, spec.field());
            } else {
                keyId = clientEncryption.createDataKey(KMS_PROVIDER,
                    new DataKeyOptions().keyAltNames(List.of(altName)));
                log.info("Created data key {} for field {}", altName, spec.field());
            }
            keyIds.put(spec.field(), keyId);
        }
        return keyIds;
    }

    /**
     * Creates the encrypted collection if it does not exist, with a unique index on the
     * shared identifier.
     *
     * @param dropExisting drop the collection and its metadata collections first
     * @return the encrypted fields document the collection was created with
     */
    public BsonDocument createEncryptedCollection(String databaseName, String collectionName,
                                                  Map<String, BsonDocument> encryptedFieldsMap,
                                                  boolean dropExisting) {
        String namespace = databaseName + "." + collectionName;
        BsonDocument encryptedFields = encryptedFieldsMap.get(namespace);
        if (encryptedFields == null) {
            throw new IllegalArgumentException("No encrypted fields for " + namespace);
        }

        try {
            MongoDatabase database = client.getDatabase(databaseName);
            boolean exists = database.listCollectionNames().into(new ArrayList<>()).contains(collectionName);

            if (exists && dropExisting) {
                log.info("Dropping existing collection: {}", namespace);
                database.getCollection(collectionName).drop();
                exists = false;
            }

            if (!exists) {
                log.info("Creating encrypted collection: {}", namespace);
                database.createCollection(collectionName,
                    new CreateCollectionOptions().encryptedFields(encryptedFields));
            }

            database.getCollection(collectionName).createIndex(
                Indexes.ascending(CustomerDocumentMapper.ID_FIELD),
                new IndexOptions().unique(true).name("uniq_" + CustomerDocumentMapper.ID_FIELD));
            return encryptedFields;
        } catch (MongoException e) {
            throw new SearchUnavailableException("Failed to create encrypted collection " + namespace, e);
        }
    }

    private void ensureKeyVaultIndex() {
        MongoCollection<Document> keyVault = client.getDatabase(keyVaultNamespace.getDatabaseName())
            .getCollection(keyVaultNamespace.getCollectionName());
        keyVault.createIndex(Indexes.ascending("keyAltNames"),
            new IndexOptions()
                .unique(true)
                .partialFilterExpression(Filters.exists("keyAltNames")));
    }
}
