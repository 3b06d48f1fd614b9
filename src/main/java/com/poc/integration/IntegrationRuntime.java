package com.poc.integration;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.vault.ClientEncryption;
import com.poc.integration.config.IntegrationConfig;
import com.poc.integration.config.RecordStoreConfig;
import com.poc.integration.config.SearchStoreConfig;
import com.poc.integration.config.VirtualizationConfig;
import com.poc.integration.encryption.EncryptionAlgorithmRouter;
import com.poc.integration.encryption.FieldEncryptionTable;
import com.poc.integration.encryption.QueryKind;
import com.poc.integration.gate.LicenseGate;
import com.poc.integration.gate.LicenseUsageSnapshot;
import com.poc.integration.generator.CustomerGenerator;
import com.poc.integration.generator.RandomDataProvider;
import com.poc.integration.ingest.IngestionCoordinator;
import com.poc.integration.ingest.IngestionSummary;
import com.poc.integration.ingest.RecordSource;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.OperatingMode;
import com.poc.integration.search.SearchOrchestrator;
import com.poc.integration.search.SearchResult;
import com.poc.integration.store.RecordStore;
import com.poc.integration.store.SearchStore;
import com.poc.integration.store.jdbc.JdbcRecordStore;
import com.poc.integration.store.mongo.CustomerDocumentMapper;
import com.poc.integration.store.mongo.EncryptedFieldsSchema;
import com.poc.integration.store.mongo.KeyVaultSetup;
import com.poc.integration.store.mongo.MongoSearchStore;
import com.poc.integration.virtualization.GatedVirtualizationClient;
import com.poc.integration.virtualization.RestVirtualizationAdapter;
import com.poc.integration.virtualization.VirtualizationAdapter;
import com.poc.integration.virtualization.VirtualizationResult;
import com.zaxxer.hikari.HikariDataSource;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;

/**
 * Wires the stores, router, orchestrator, coordinator and license gate from one configuration
 * and exposes the operations the CLI drives.
 *
 * <p>One runtime is shared by all callers in the process; it holds the only license gate.
 */
public class IntegrationRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IntegrationRuntime.class);

    public record StoreCounts(long searchStore, long recordStore) {}

    private final IntegrationConfig config;
    private final SearchStore searchStore;
    private final RecordStore recordStore;
    private final SearchOrchestrator orchestrator;
    private final LicenseGate licenseGate;
    private final GatedVirtualizationClient virtualizationClient;
    private final Deque<AutoCloseable> resources = new ArrayDeque<>();

    private KeyVaultSetup keyVaultSetup;
    private Map<String, BsonDocument> encryptedFieldsMap;

    public IntegrationRuntime(IntegrationConfig config, SearchStore searchStore, RecordStore recordStore,
                              VirtualizationAdapter virtualizationAdapter) {
        this.config = config;
        this.searchStore = searchStore;
        this.recordStore = recordStore;

        EncryptionAlgorithmRouter router = new EncryptionAlgorithmRouter(config.getFields());
        this.orchestrator = new SearchOrchestrator(router, searchStore, recordStore,
            config.getCallTimeout(), config.getDefaultLimit(), config.getMaxLimit());
        this.licenseGate = new LicenseGate(config.getLicenseCeiling(), config.getAdmissionPolicy(),
            config.getAcquireTimeout());
        this.virtualizationClient = virtualizationAdapter == null ? null
            : new GatedVirtualizationClient(virtualizationAdapter, licenseGate, config.getMaxRowsPerQuery(),
                Duration.ofMillis(config.getVirtualization().getRequestTimeoutMs()));
    }

    /**
     * Connects to both stores with automatic encryption. Data keys are created if missing.
     */
    public static IntegrationRuntime connect(IntegrationConfig config) {
        SearchStoreConfig searchConfig = config.getSearchStore();
        RecordStoreConfig recordConfig = config.getRecordStore();
        VirtualizationConfig virtConfig = config.getVirtualization();
        FieldEncryptionTable table = config.getFields();

        Deque<AutoCloseable> opened = new ArrayDeque<>();
        try {
            byte[] masterKey = KeyVaultSetup.loadOrCreateMasterKey(Path.of(searchConfig.getMasterKeyFile()));
            Map<String, Map<String, Object>> kmsProviders = KeyVaultSetup.kmsProviders(masterKey);

            MongoClient adminClient = searchConfig.createClient();
            opened.push(adminClient);
            ClientEncryption clientEncryption = searchConfig.createClientEncryption(kmsProviders);
            opened.push(clientEncryption);

            KeyVaultSetup keyVaultSetup = new KeyVaultSetup(adminClient, clientEncryption, table,
                searchConfig.getKeyVaultNamespace());
            Map<String, BsonBinary> keyIds = keyVaultSetup.ensureDataKeys();
            Map<String, BsonDocument> encryptedFieldsMap =
                Map.of(searchConfig.getNamespace(), EncryptedFieldsSchema.build(table, keyIds));

            MongoClient encryptedClient = searchConfig.createEncryptedClient(kmsProviders, encryptedFieldsMap);
            opened.push(encryptedClient);
            MongoCollection<Document> collection = encryptedClient
                .getDatabase(searchConfig.getDatabase())
                .getCollection(searchConfig.getCollection());
            SearchStore searchStore = new MongoSearchStore(collection, new CustomerDocumentMapper(table));

            HikariDataSource dataSource = recordConfig.createDataSource(config.getCallTimeout());
            opened.push(dataSource);
            RecordStore recordStore = new JdbcRecordStore(dataSource, recordConfig.resolveEncryptionKey());

            VirtualizationAdapter virtualization = RestVirtualizationAdapter.create(
                virtConfig.getBaseUrl(), virtConfig.getUsername(), virtConfig.getPassword(),
                virtConfig.getConnectTimeoutMs());

            IntegrationRuntime runtime = new IntegrationRuntime(config, searchStore, recordStore, virtualization);
            runtime.keyVaultSetup = keyVaultSetup;
            runtime.encryptedFieldsMap = encryptedFieldsMap;
            runtime.resources.addAll(opened);
            log.info("Connected to search store {} and record store {}",
                searchConfig.getNamespace(), recordConfig.getJdbcUrl());
            return runtime;
        } catch (RuntimeException e) {
            closeAll(opened);
            throw e;
        }
    }

    /**
     * Creates the encrypted collection and the record store schema.
     */
    public void setupStores(boolean dropExisting) {
        if (keyVaultSetup == null) {
            throw new IllegalStateException("Store setup needs a runtime created by connect()");
        }
        SearchStoreConfig searchConfig = config.getSearchStore();
        keyVaultSetup.createEncryptedCollection(searchConfig.getDatabase(), searchConfig.getCollection(),
            encryptedFieldsMap, dropExisting);
        if (recordStore instanceof JdbcRecordStore jdbcStore) {
            jdbcStore.initializeSchema(config.getCallTimeout());
        }
    }

    public SearchResult search(String field, String value, OperatingMode mode) {
        return orchestrator.search(field, value, mode);
    }

    public SearchResult search(String field, String value, OperatingMode mode, int limit) {
        return orchestrator.search(field, value, mode, limit);
    }

    public SearchResult search(String field, QueryKind kind, String value, OperatingMode mode, int limit) {
        return orchestrator.search(field, kind, value, mode, limit);
    }

    public Optional<CustomerProjection> findById(String customerId) {
        return orchestrator.findById(customerId);
    }

    public IngestionSummary ingest(int batchSize, long count) throws InterruptedException {
        return ingest(batchSize, count, null);
    }

    public IngestionSummary ingest(int batchSize, long count, IngestionCoordinator.ProgressListener listener)
            throws InterruptedException {
        CustomerGenerator generator = new CustomerGenerator(new RandomDataProvider());
        return ingest(generator::generate, batchSize, count, listener);
    }

    public IngestionSummary ingest(RecordSource source, int batchSize, long count,
                                   IngestionCoordinator.ProgressListener listener) throws InterruptedException {
        IngestionCoordinator coordinator = new IngestionCoordinator(searchStore, recordStore,
            config.getCallTimeout(), config.getThreads(), config.isHaltOnInconsistency(), listener);
        return coordinator.ingest(source, count, batchSize);
    }

    public VirtualizationResult virtualSearch(String field, String value, OperatingMode mode) {
        return requireVirtualization().search(field, value, mode);
    }

    public VirtualizationResult virtualGet(String customerId) {
        return requireVirtualization().getCustomer(customerId);
    }

    public LicenseUsageSnapshot licenseStats() {
        return licenseGate.stats();
    }

    public void resetLicenseStats() {
        licenseGate.reset();
    }

    /**
     * Removes every customer from both stores, search store first.
     */
    public void clearStores() {
        searchStore.clear(config.getCallTimeout());
        recordStore.clear(config.getCallTimeout());
    }

    public StoreCounts countStores() {
        return new StoreCounts(searchStore.countAll(config.getCallTimeout()),
            recordStore.countAll(config.getCallTimeout()));
    }

    public IntegrationConfig getConfig() {
        return config;
    }

    public LicenseGate getLicenseGate() {
        return licenseGate;
    }

    private GatedVirtualizationClient requireVirtualization() {
        if (virtualizationClient == null) {
            throw new IllegalStateException("No virtualization server configured");
        }
        return virtualizationClient;
    }

    @Override
    public void close() {
        closeAll(resources);
    }

    private static void closeAll(Deque<AutoCloseable> resources) {
        while (!resources.isEmpty()) {
            AutoCloseable resource = resources.pop();
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
