package com.poc.integration.config;

import com.poc.integration.encryption.FieldEncryptionTable;
import com.poc.integration.gate.AdmissionPolicy;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;

public class IntegrationConfig {

    // Store connections
    private SearchStoreConfig searchStore = new SearchStoreConfig();
    private RecordStoreConfig recordStore = new RecordStoreConfig();
    private VirtualizationConfig virtualization = new VirtualizationConfig();

    // Ingestion
    private int batchSize = 100;
    private int threads = 1;
    private boolean haltOnInconsistency = false;
    private int progressInterval = 1000;

    // Search
    private int defaultLimit = 100;
    private int maxLimit = 10000;

    // Per-call deadline for every store call
    private long callTimeoutMs = 5000;

    // License gate
    private int licenseCeiling = 3;
    private AdmissionPolicy admissionPolicy = AdmissionPolicy.BLOCK;
    private long acquireTimeoutMs = 30000;
    private int maxRowsPerQuery = 10000;

    private FieldEncryptionTable fields = FieldEncryptionTable.defaultTable();

    public IntegrationConfig() {
    }

    public static IntegrationConfig fromYaml(String filePath) throws IOException {
        Yaml yaml = new Yaml();
        try (InputStream input = new FileInputStream(filePath)) {
            Map<String, Object> data = yaml.load(input);
            return fromMap(data == null ? Map.of() : data);
        }
    }

    @SuppressWarnings("unchecked")
    private static IntegrationConfig fromMap(Map<String, Object> data) {
        IntegrationConfig config = new IntegrationConfig();

        if (data.containsKey("searchStore")) {
            Map<String, Object> search = (Map<String, Object>) data.get("searchStore");
            SearchStoreConfig store = config.searchStore;
            if (search.containsKey("connectionString")) {
                store.setConnectionString((String) search.get("connectionString"));
            }
            if (search.containsKey("database")) {
                store.setDatabase((String) search.get("database"));
            }
            if (search.containsKey("collection")) {
                store.setCollection((String) search.get("collection"));
            }
            if (search.containsKey("keyVaultNamespace")) {
                store.setKeyVaultNamespace((String) search.get("keyVaultNamespace"));
            }
            if (search.containsKey("masterKeyFile")) {
                store.setMasterKeyFile((String) search.get("masterKeyFile"));
            }
            if (search.containsKey("cryptSharedLibPath")) {
                store.setCryptSharedLibPath((String) search.get("cryptSharedLibPath"));
            }
            if (search.containsKey("connectionPoolSize")) {
                store.setConnectionPoolSize((Integer) search.get("connectionPoolSize"));
            }
        }

        if (data.containsKey("recordStore")) {
            Map<String, Object> record = (Map<String, Object>) data.get("recordStore");
            RecordStoreConfig store = config.recordStore;
            if (record.containsKey("jdbcUrl")) {
                store.setJdbcUrl((String) record.get("jdbcUrl"));
            }
            if (record.containsKey("username")) {
                store.setUsername((String) record.get("username"));
            }
            if (record.containsKey("password")) {
                store.setPassword(String.valueOf(record.get("password")));
            }
            if (record.containsKey("poolSize")) {
                store.setPoolSize((Integer) record.get("poolSize"));
            }
            if (record.containsKey("encryptionKey")) {
                store.setEncryptionKey((String) record.get("encryptionKey"));
            }
            if (record.containsKey("encryptionKeyFile")) {
                store.setEncryptionKeyFile((String) record.get("encryptionKeyFile"));
            }
        }

        if (data.containsKey("ingestion")) {
            Map<String, Object> ingestion = (Map<String, Object>) data.get("ingestion");
            if (ingestion.containsKey("batchSize")) {
                config.batchSize = (Integer) ingestion.get("batchSize");
            }
            if (ingestion.containsKey("threads")) {
                config.threads = (Integer) ingestion.get("threads");
            }
            if (ingestion.containsKey("haltOnInconsistency")) {
                config.haltOnInconsistency = (Boolean) ingestion.get("haltOnInconsistency");
            }
            if (ingestion.containsKey("progressInterval")) {
                config.progressInterval = (Integer) ingestion.get("progressInterval");
            }
        }

        if (data.containsKey("search")) {
            Map<String, Object> search = (Map<String, Object>) data.get("search");
            if (search.containsKey("defaultLimit")) {
                config.defaultLimit = (Integer) search.get("defaultLimit");
            }
            if (search.containsKey("maxLimit")) {
                config.maxLimit = (Integer) search.get("maxLimit");
            }
        }

        if (data.containsKey("callTimeoutMs")) {
            config.callTimeoutMs = ((Number) data.get("callTimeoutMs")).longValue();
        }

        if (data.containsKey("licenseGate")) {
            Map<String, Object> gate = (Map<String, Object>) data.get("licenseGate");
            if (gate.containsKey("ceiling")) {
                config.licenseCeiling = (Integer) gate.get("ceiling");
            }
            if (gate.containsKey("policy")) {
                config.admissionPolicy = AdmissionPolicy.valueOf(((String) gate.get("policy")).toUpperCase());
            }
            if (gate.containsKey("acquireTimeoutMs")) {
                config.acquireTimeoutMs = ((Number) gate.get("acquireTimeoutMs")).longValue();
            }
            if (gate.containsKey("maxRowsPerQuery")) {
                config.maxRowsPerQuery = (Integer) gate.get("maxRowsPerQuery");
            }
        }

        if (data.containsKey("virtualization")) {
            Map<String, Object> virt = (Map<String, Object>) data.get("virtualization");
            VirtualizationConfig target = config.virtualization;
            if (virt.containsKey("baseUrl")) {
                target.setBaseUrl((String) virt.get("baseUrl"));
            }
            if (virt.containsKey("username")) {
                target.setUsername((String) virt.get("username"));
            }
            if (virt.containsKey("password")) {
                target.setPassword(String.valueOf(virt.get("password")));
            }
            if (virt.containsKey("connectTimeoutMs")) {
                target.setConnectTimeoutMs((Integer) virt.get("connectTimeoutMs"));
            }
            if (virt.containsKey("requestTimeoutMs")) {
                target.setRequestTimeoutMs((Integer) virt.get("requestTimeoutMs"));
            }
        }

        if (data.containsKey("fields")) {
            config.fields = FieldEncryptionTable.fromMap((Map<String, Object>) data.get("fields"));
        }

        config.validate();
        return config;
    }

    /**
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public void validate() {
        if (batchSize < 1) {
            throw new IllegalArgumentException("ingestion.batchSize must be positive, got " + batchSize);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("ingestion.threads must be positive, got " + threads);
        }
        if (maxLimit < 1 || defaultLimit < 1 || defaultLimit > maxLimit) {
            throw new IllegalArgumentException("search.defaultLimit must be between 1 and search.maxLimit");
        }
        if (callTimeoutMs < 1) {
            throw new IllegalArgumentException("callTimeoutMs must be positive, got " + callTimeoutMs);
        }
        if (licenseCeiling < 1) {
            throw new IllegalArgumentException("licenseGate.ceiling must be positive, got " + licenseCeiling);
        }
        if (maxRowsPerQuery < 1) {
            throw new IllegalArgumentException("licenseGate.maxRowsPerQuery must be positive, got " + maxRowsPerQuery);
        }
    }

    public Duration getCallTimeout() {
        return Duration.ofMillis(callTimeoutMs);
    }

    public Duration getAcquireTimeout() {
        return Duration.ofMillis(acquireTimeoutMs);
    }

    // Getters and setters
    public SearchStoreConfig getSearchStore() {
        return searchStore;
    }

    public void setSearchStore(SearchStoreConfig searchStore) {
        this.searchStore = searchStore;
    }

    public RecordStoreConfig getRecordStore() {
        return recordStore;
    }

    public void setRecordStore(RecordStoreConfig recordStore) {
        this.recordStore = recordStore;
    }

    public VirtualizationConfig getVirtualization() {
        return virtualization;
    }

    public void setVirtualization(VirtualizationConfig virtualization) {
        this.virtualization = virtualization;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public boolean isHaltOnInconsistency() {
        return haltOnInconsistency;
    }

    public void setHaltOnInconsistency(boolean haltOnInconsistency) {
        this.haltOnInconsistency = haltOnInconsistency;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public void setProgressInterval(int progressInterval) {
        this.progressInterval = progressInterval;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public int getLicenseCeiling() {
        return licenseCeiling;
    }

    public void setLicenseCeiling(int licenseCeiling) {
        this.licenseCeiling = licenseCeiling;
    }

    public AdmissionPolicy getAdmissionPolicy() {
        return admissionPolicy;
    }

    public void setAdmissionPolicy(AdmissionPolicy admissionPolicy) {
        this.admissionPolicy = admissionPolicy;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public int getMaxRowsPerQuery() {
        return maxRowsPerQuery;
    }

    public void setMaxRowsPerQuery(int maxRowsPerQuery) {
        this.maxRowsPerQuery = maxRowsPerQuery;
    }

    public FieldEncryptionTable getFields() {
        return fields;
    }

    public void setFields(FieldEncryptionTable fields) {
        this.fields = fields;
    }
}
