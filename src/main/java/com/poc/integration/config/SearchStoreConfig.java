package com.poc.integration.config;

import com.mongodb.AutoEncryptionSettings;
import com.mongodb.ClientEncryptionSettings;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.vault.ClientEncryption;
import com.mongodb.client.vault.ClientEncryptions;
import org.bson.BsonDocument;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Connection settings for the MongoDB search store and its Queryable Encryption setup.
 */
public class SearchStoreConfig {

    private String connectionString = "mongodb://localhost:27017/?directConnection=true";
    private String database = "poc_database";
    private String collection = "customers";
    private String keyVaultNamespace = "encryption.__keyVault";
    private String masterKeyFile = ".encryption_key";
    private String cryptSharedLibPath = "/usr/local/lib/mongo_crypt/mongo_crypt_v1.so";
    private int connectionPoolSize = 10;
    private int connectionTimeoutMs = 30000;
    private int socketTimeoutMs = 60000;

    public SearchStoreConfig() {
    }

    public SearchStoreConfig(String connectionString, String database) {
        this.connectionString = connectionString;
        this.database = database;
    }

    /**
     * Client without automatic encryption, for key vault and collection administration.
     */
    public MongoClient createClient() {
        return MongoClients.create(baseSettings().build());
    }

    /**
     * Client that encrypts queries and inserts and decrypts results for the given fields.
     *
     * @param encryptedFieldsMap encrypted fields document per {@code db.collection} namespace
     */
    public MongoClient createEncryptedClient(Map<String, Map<String, Object>> kmsProviders,
                                             Map<String, BsonDocument> encryptedFieldsMap) {
        Map<String, Object> extraOptions = new HashMap<>();
        if (cryptSharedLibPath != null && !cryptSharedLibPath.isBlank()) {
            extraOptions.put("cryptSharedLibPath", cryptSharedLibPath);
            extraOptions.put("cryptSharedLibRequired", true);
        }

        AutoEncryptionSettings autoEncryption = AutoEncryptionSettings.builder()
            .keyVaultNamespace(keyVaultNamespace)
            .kmsProviders(kmsProviders)
            .encryptedFieldsMap(encryptedFieldsMap)
            .extraOptions(extraOptions)
            .build();

        return MongoClients.create(baseSettings().autoEncryptionSettings(autoEncryption).build());
    }

    public ClientEncryption createClientEncryption(Map<String, Map<String, Object>> kmsProviders) {
        ClientEncryptionSettings settings = ClientEncryptionSettings.builder()
            .keyVaultMongoClientSettings(baseSettings().build())
            .keyVaultNamespace(keyVaultNamespace)
            .kmsProviders(kmsProviders)
            .build();
        return ClientEncryptions.create(settings);
    }

    public String getNamespace() {
        return database + "." + collection;
    }

    private MongoClientSettings.Builder baseSettings() {
        ConnectionString connString = new ConnectionString(connectionString);

        return MongoClientSettings.builder()
            .applyConnectionString(connString)
            .applyToConnectionPoolSettings(builder -> builder
                .maxSize(connectionPoolSize)
                .minSize(1)
                .maxWaitTime(connectionTimeoutMs, TimeUnit.MILLISECONDS))
            .applyToSocketSettings(builder -> builder
                .connectTimeout(connectionTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(socketTimeoutMs, TimeUnit.MILLISECONDS));
    }

    // Getters and setters
    public String getConnectionString() {
        return connectionString;
    }

    public void setConnectionString(String connectionString) {
        this.connectionString = connectionString;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public String getKeyVaultNamespace() {
        return keyVaultNamespace;
    }

    public void setKeyVaultNamespace(String keyVaultNamespace) {
        this.keyVaultNamespace = keyVaultNamespace;
    }

    public String getMasterKeyFile() {
        return masterKeyFile;
    }

    public void setMasterKeyFile(String masterKeyFile) {
        this.masterKeyFile = masterKeyFile;
    }

    public String getCryptSharedLibPath() {
        return cryptSharedLibPath;
    }

    public void setCryptSharedLibPath(String cryptSharedLibPath) {
        this.cryptSharedLibPath = cryptSharedLibPath;
    }

    public int getConnectionPoolSize() {
        return connectionPoolSize;
    }

    public void setConnectionPoolSize(int connectionPoolSize) {
        this.connectionPoolSize = connectionPoolSize;
    }

    public int getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public void setConnectionTimeoutMs(int connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    public int getSocketTimeoutMs() {
        return socketTimeoutMs;
    }

    public void setSocketTimeoutMs(int socketTimeoutMs) {
        this.socketTimeoutMs = socketTimeoutMs;
    }
}
