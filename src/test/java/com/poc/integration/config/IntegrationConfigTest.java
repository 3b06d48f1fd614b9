package com.poc.integration.config;

import com.poc.integration.encryption.AlgorithmClass;
import com.poc.integration.gate.AdmissionPolicy;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntegrationConfigTest {

    @TempDir
    Path tempDir;

    private String write(String yaml) throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return file.toString();
    }

    @Nested
    class Defaults {

        @Test
        void shouldMatchDocumentedDefaults() {
            IntegrationConfig config = new IntegrationConfig();

            assertThat(config.getSearchStore().getNamespace()).isEqualTo("poc_database.customers");
            assertThat(config.getSearchStore().getKeyVaultNamespace()).isEqualTo("encryption.__keyVault");
            assertThat(config.getBatchSize()).isEqualTo(100);
            assertThat(config.getLicenseCeiling()).isEqualTo(3);
            assertThat(config.getAdmissionPolicy()).isEqualTo(AdmissionPolicy.BLOCK);
            assertThat(config.getCallTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(config.getFields().fieldNames()).contains("name", "email", "phone");
        }
    }

    @Nested
    class YamlLoading {

        @Test
        void shouldOverrideDefaultsFromFile() throws IOException {
            // Given
            String path = write("""
                searchStore:
                  connectionString: mongodb://search:27017
                  database: test_db
                recordStore:
                  jdbcUrl: jdbc:postgresql://records:5432/test
                  password: 12345
                ingestion:
                  batchSize: 50
                  threads: 4
                  haltOnInconsistency: true
                callTimeoutMs: 2500
                licenseGate:
                  ceiling: 5
                  policy: reject
                virtualization:
                  baseUrl: http://denodo:9090/views
                """);

            // When
            IntegrationConfig config = IntegrationConfig.fromYaml(path);

            // Then
            assertThat(config.getSearchStore().getConnectionString()).isEqualTo("mongodb://search:27017");
            assertThat(config.getSearchStore().getNamespace()).isEqualTo("test_db.customers");
            assertThat(config.getRecordStore().getJdbcUrl()).isEqualTo("jdbc:postgresql://records:5432/test");
            assertThat(config.getRecordStore().getPassword()).isEqualTo("12345");
            assertThat(config.getBatchSize()).isEqualTo(50);
            assertThat(config.getThreads()).isEqualTo(4);
            assertThat(config.isHaltOnInconsistency()).isTrue();
            assertThat(config.getCallTimeoutMs()).isEqualTo(2500);
            assertThat(config.getLicenseCeiling()).isEqualTo(5);
            assertThat(config.getAdmissionPolicy()).isEqualTo(AdmissionPolicy.REJECT);
            assertThat(config.getVirtualization().getBaseUrl()).isEqualTo("http://denodo:9090/views");
        }

        @Test
        void shouldReadFieldTable() throws IOException {
            String path = write("""
                fields:
                  email:
                    path: searchable_email
                    algorithms: [PREFIX_PREVIEW, SUFFIX_PREVIEW]
                    minQueryLength: 2
                    maxQueryLength: 30
                    maxLength: 100
                """);

            IntegrationConfig config = IntegrationConfig.fromYaml(path);

            assertThat(config.getFields().fieldNames()).containsExactly("email");
            assertThat(config.getFields().get("email").algorithms())
                .containsExactlyInAnyOrder(AlgorithmClass.PREFIX_PREVIEW, AlgorithmClass.SUFFIX_PREVIEW);
        }

        @Test
        void shouldAcceptEmptyFile() throws IOException {
            IntegrationConfig config = IntegrationConfig.fromYaml(write(""));

            assertThat(config.getBatchSize()).isEqualTo(100);
        }

        @Test
        void shouldRejectOutOfRangeValues() throws IOException {
            String path = write("""
                licenseGate:
                  ceiling: 0
                """);

            assertThatThrownBy(() -> IntegrationConfig.fromYaml(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ceiling");
        }

        @Test
        void shouldRejectDefaultLimitAboveMaximum() throws IOException {
            String path = write("""
                search:
                  defaultLimit: 500
                  maxLimit: 100
                """);

            assertThatThrownBy(() -> IntegrationConfig.fromYaml(path))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
