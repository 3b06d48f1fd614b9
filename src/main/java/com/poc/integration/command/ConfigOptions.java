package com.poc.integration.command;

import com.poc.integration.config.IntegrationConfig;
import picocli.CommandLine.Option;

import java.io.IOException;

/**
 * Connection options shared by every subcommand. Values given on the command line
 * override the ones read from the configuration file.
 */
public class ConfigOptions {

    @Option(names = {"-f", "--config-file"}, description = "YAML configuration file")
    String configFile;

    @Option(names = {"-c", "--connection-string"}, description = "Search store (MongoDB) connection string")
    String connectionString;

    @Option(names = {"-d", "--database"}, description = "Search store database name")
    String database;

    @Option(names = {"--jdbc-url"}, description = "Record store JDBC URL")
    String jdbcUrl;

    @Option(names = {"--db-user"}, description = "Record store user")
    String dbUser;

    @Option(names = {"--db-password"}, description = "Record store password")
    String dbPassword;

    @Option(names = {"--call-timeout-ms"}, description = "Deadline applied to every store call")
    Long callTimeoutMs;

    IntegrationConfig buildConfig() throws IOException {
        IntegrationConfig config = configFile != null
            ? IntegrationConfig.fromYaml(configFile)
            : new IntegrationConfig();

        if (connectionString != null) {
            config.getSearchStore().setConnectionString(connectionString);
        }
        if (database != null) {
            config.getSearchStore().setDatabase(database);
        }
        if (jdbcUrl != null) {
            config.getRecordStore().setJdbcUrl(jdbcUrl);
        }
        if (dbUser != null) {
            config.getRecordStore().setUsername(dbUser);
        }
        if (dbPassword != null) {
            config.getRecordStore().setPassword(dbPassword);
        }
        if (callTimeoutMs != null) {
            config.setCallTimeoutMs(callTimeoutMs);
        }

        config.validate();
        return config;
    }
}
