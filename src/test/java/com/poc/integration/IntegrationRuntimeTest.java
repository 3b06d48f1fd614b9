package com.poc.integration;

import com.poc.integration.config.IntegrationConfig;
import com.poc.integration.gate.LicenseUsageSnapshot;
import com.poc.integration.ingest.IngestionSummary;
import com.poc.integration.model.OperatingMode;
import com.poc.integration.search.SearchResult;
import com.poc.integration.store.InMemoryRecordStore;
import com.poc.integration.store.InMemorySearchStore;
import com.poc.integration.store.TestCustomers;
import com.poc.integration.virtualization.VirtualizationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntegrationRuntimeTest {

    private InMemorySearchStore searchStore;
    private InMemoryRecordStore recordStore;
    private IntegrationRuntime runtime;

    @BeforeEach
    void setUp() {
        searchStore = new InMemorySearchStore();
        recordStore = new InMemoryRecordStore();
        IntegrationConfig config = new IntegrationConfig();
        config.setBatchSize(10);
        runtime = new IntegrationRuntime(config, searchStore, recordStore,
            (view, params, timeout) -> List.of(Map.of("customer_id", "c-1", "status", "active")));
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @Test
    void shouldIngestGeneratedCustomersAndFindThemInBothModes() throws InterruptedException {
        // Given
        IngestionSummary summary = runtime.ingest(
            seq -> TestCustomers.customer("id-" + seq, "Customer Number" + seq, "user" + seq + "@example.com"),
            10, 25, null);

        // When
        SearchResult hybrid = runtime.search("email", "user1", OperatingMode.HYBRID);
        SearchResult searchOnly = runtime.search("email", "user1", OperatingMode.SEARCH_STORE_ONLY);

        // Then
        assertThat(summary.committed()).isEqualTo(25);
        assertThat(summary.storesAgree()).isTrue();
        assertThat(hybrid.customerIds()).containsExactly("id-1", "id-10", "id-11", "id-12", "id-13", "id-14",
            "id-15", "id-16", "id-17", "id-18", "id-19");
        assertThat(searchOnly.customerIds()).isEqualTo(hybrid.customerIds());
        assertThat(runtime.findById("id-3")).isPresent();
    }

    @Test
    void shouldGenerateCustomersWhenNoSourceGiven() throws InterruptedException {
        IngestionSummary summary = runtime.ingest(10, 15);

        assertThat(summary.generated()).isEqualTo(15);
        assertThat(runtime.countStores()).isEqualTo(new IntegrationRuntime.StoreCounts(15, 15));
    }

    @Test
    void shouldClearBothStores() throws InterruptedException {
        runtime.ingest(10, 5);

        runtime.clearStores();

        assertThat(runtime.countStores()).isEqualTo(new IntegrationRuntime.StoreCounts(0, 0));
    }

    @Test
    void shouldShareOneLicenseGateAcrossVirtualCalls() {
        // When
        VirtualizationResult byStatus = runtime.virtualSearch("status", "active", OperatingMode.HYBRID);
        VirtualizationResult byId = runtime.virtualGet("c-1");

        // Then
        LicenseUsageSnapshot stats = runtime.licenseStats();
        assertThat(byStatus.rows()).hasSize(1);
        assertThat(byId.throttled()).isFalse();
        assertThat(stats.totalAcquired()).isEqualTo(2);
        assertThat(stats.current()).isZero();

        runtime.resetLicenseStats();
        assertThat(runtime.licenseStats().totalAcquired()).isZero();
    }

    @Test
    void shouldRequireConnectedRuntimeForStoreSetup() {
        assertThatThrownBy(() -> runtime.setupStores(false))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldFailVirtualCallsWithoutServer() {
        IntegrationRuntime withoutServer = new IntegrationRuntime(new IntegrationConfig(), searchStore, recordStore, null);

        assertThatThrownBy(() -> withoutServer.virtualGet("c-1"))
            .isInstanceOf(IllegalStateException.class);
    }
}
