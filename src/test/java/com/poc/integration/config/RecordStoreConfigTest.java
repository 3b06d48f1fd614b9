package com.poc.integration.config;

import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RecordStoreConfigTest {

    private final RecordStoreConfig recordConfig = new RecordStoreConfig();

    @Nested
    class PoolTimeouts {

        @Test
        void shouldWaitForPooledConnectionNoLongerThanCallTimeout() {
            // When
            HikariConfig config = recordConfig.buildHikariConfig(Duration.ofMillis(5000));

            // Then
            assertThat(config.getConnectionTimeout()).isEqualTo(5000);
        }

        @Test
        void shouldRaiseVeryShortCallTimeoutToPoolMinimum() {
            HikariConfig config = recordConfig.buildHikariConfig(Duration.ofMillis(100));

            assertThat(config.getConnectionTimeout()).isEqualTo(RecordStoreConfig.MIN_CONNECTION_TIMEOUT_MS);
        }

        @Test
        void shouldBoundDriverConnectAndReadBySeconds() {
            // Given - 1500ms rounds up to 2 seconds
            HikariConfig config = recordConfig.buildHikariConfig(Duration.ofMillis(1500));

            // Then
            assertThat(config.getDataSourceProperties())
                .containsEntry("connectTimeout", "2")
                .containsEntry("socketTimeout", "3");
        }

        @Test
        void shouldUseAtLeastOneSecondForDriverTimeouts() {
            HikariConfig config = recordConfig.buildHikariConfig(Duration.ofMillis(300));

            assertThat(config.getDataSourceProperties())
                .containsEntry("connectTimeout", "1")
                .containsEntry("socketTimeout", "2");
        }
    }

    @Test
    void shouldCarryConnectionSettingsIntoPool() {
        // Given
        recordConfig.setJdbcUrl("jdbc:postgresql://db.internal:5432/poc");
        recordConfig.setUsername("svc");
        recordConfig.setPoolSize(4);

        // When
        HikariConfig config = recordConfig.buildHikariConfig(Duration.ofSeconds(5));

        // Then
        assertThat(config.getJdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:5432/poc");
        assertThat(config.getUsername()).isEqualTo("svc");
        assertThat(config.getMaximumPoolSize()).isEqualTo(4);
        assertThat(config.getPoolName()).isEqualTo("record-store");
    }
}
