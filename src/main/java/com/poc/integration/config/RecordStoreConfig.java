package com.poc.integration.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Connection settings for the PostgreSQL / AlloyDB record store.
 */
public class RecordStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(RecordStoreConfig.class);

    // HikariCP rejects smaller connection timeouts
    static final long MIN_CONNECTION_TIMEOUT_MS = 250;

    private String jdbcUrl = "jdbc:postgresql://localhost:5432/alloydb_poc";
    private String username = "postgres";
    private String password;
    private int poolSize = 10;
    private String encryptionKey;
    private String encryptionKeyFile = ".encryption_key";

    public HikariDataSource createDataSource(Duration callTimeout) {
        log.info("Creating connection pool to: {}", jdbcUrl);
        return new HikariDataSource(buildHikariConfig(callTimeout));
    }

    /**
     * Pool settings bounded by the per-call deadline: borrowing a connection, connecting and
     * reading a response each give up once {@code callTimeout} has passed.
     */
    HikariConfig buildHikariConfig(Duration callTimeout) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        if (username != null) {
            config.setUsername(username);
        }
        if (password != null) {
            config.setPassword(password);
        }
        config.setMaximumPoolSize(poolSize);
        config.setMinimumIdle(2);
        config.setIdleTimeout(60000);
        config.setMaxLifetime(300000);
        config.setConnectionTimeout(Math.max(MIN_CONNECTION_TIMEOUT_MS, callTimeout.toMillis()));
        config.setPoolName("record-store");

        // pgjdbc timeouts are whole seconds; the socket timeout leaves room for the server-side cancel
        long seconds = Math.max(1, (callTimeout.toMillis() + 999) / 1000);
        config.addDataSourceProperty("connectTimeout", String.valueOf(seconds));
        config.addDataSourceProperty("socketTimeout", String.valueOf(seconds + 1));
        return config;
    }

    /**
     * Symmetric pgcrypto key: the inline value if configured, otherwise the key file contents.
     */
    public String resolveEncryptionKey() {
        if (encryptionKey != null && !encryptionKey.isBlank()) {
            return encryptionKey;
        }
        Path keyFile = Path.of(encryptionKeyFile);
        try {
            return Files.readString(keyFile, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read record store encryption key from " + keyFile, e);
        }
    }

    // Getters and setters
    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public String getEncryptionKey() {
        return encryptionKey;
    }

    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }

    public String getEncryptionKeyFile() {
        return encryptionKeyFile;
    }

    public void setEncryptionKeyFile(String encryptionKeyFile) {
        this.encryptionKeyFile = encryptionKeyFile;
    }
}
