package com.poc.integration.command;

import com.poc.integration.IntegrationRuntime;
import com.poc.integration.config.IntegrationConfig;
import com.poc.integration.ingest.ConsistencyWarning;
import com.poc.integration.ingest.IngestionCoordinator;
import com.poc.integration.ingest.IngestionSummary;
import com.poc.integration.report.ConsoleReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "ingest",
    description = "Generate synthetic customers and write them to both stores",
    mixinStandardHelpOptions = true
)
public class IngestCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions options;

    @Option(names = {"-n", "--count"}, description = "Number of customers to generate", defaultValue = "1000")
    private long count;

    @Option(names = {"-b", "--batch-size"}, description = "Customers per batch")
    private Integer batchSize;

    @Option(names = {"-t", "--threads"}, description = "Number of batch worker threads")
    private Integer threads;

    @Option(names = {"--halt-on-inconsistency"}, description = "Stop ingesting after the first consistency warning")
    private Boolean haltOnInconsistency;

    @Option(names = {"--dry-run"}, description = "Show what would be ingested without writing", defaultValue = "false")
    private boolean dryRun;

    @Option(names = {"-q", "--quiet"}, description = "Suppress progress output", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            IntegrationConfig config = buildConfig();

            if (dryRun) {
                printDryRun(config);
                return 0;
            }

            return executeIngest(config);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private IntegrationConfig buildConfig() throws IOException {
        IntegrationConfig config = options.buildConfig();

        if (batchSize != null) {
            config.setBatchSize(batchSize);
        }
        if (threads != null) {
            config.setThreads(threads);
        }
        if (haltOnInconsistency != null) {
            config.setHaltOnInconsistency(haltOnInconsistency);
        }
        if (count <= 0) {
            throw new IllegalArgumentException("--count must be positive, got " + count);
        }

        config.validate();
        return config;
    }

    private void printDryRun(IntegrationConfig config) {
        long batches = (count + config.getBatchSize() - 1) / config.getBatchSize();

        System.out.println("\n=== DRY RUN - No data will be written ===\n");
        System.out.println("Configuration:");
        System.out.printf("  Search Store:      %s%n", config.getSearchStore().getNamespace());
        System.out.printf("  Record Store:      %s%n", config.getRecordStore().getJdbcUrl());
        System.out.printf("  Threads:           %d%n", config.getThreads());
        System.out.printf("  Batch Size:        %d%n", config.getBatchSize());
        System.out.printf("  Call Timeout:      %d ms%n", config.getCallTimeoutMs());
        System.out.printf("  Halt On Warning:   %s%n", config.isHaltOnInconsistency());
        System.out.println("\nCustomers to ingest:");
        System.out.printf("  Records:  %,d%n", count);
        System.out.printf("  Batches:  %,d%n", batches);
    }

    private int executeIngest(IntegrationConfig config) throws InterruptedException {
        ConsoleReporter reporter = new ConsoleReporter(quiet);
        reporter.printIngestHeader(config, count, config.getBatchSize());

        try (IntegrationRuntime runtime = IntegrationRuntime.connect(config)) {
            IngestionSummary summary = runtime.ingest(config.getBatchSize(), count,
                new IngestionCoordinator.ProgressListener() {
                    @Override
                    public void onProgress(long processed, long total, double throughput) {
                        if (!quiet) {
                            double pct = (processed * 100.0) / total;
                            System.out.printf("\r  customers %,12d / %,12d (%5.1f%%) - %,.0f records/sec",
                                processed, total, pct, throughput);
                        }
                    }

                    @Override
                    public void onWarning(ConsistencyWarning warning) {
                        if (!quiet) {
                            System.out.printf("%n  WARNING: %s%n", warning.message());
                        }
                    }
                });

            if (!quiet) {
                System.out.println();
            }
            reporter.printIngestSummary(summary);

            return summary.storesAgree() && !summary.halted() ? 0 : 2;
        }
    }
}
