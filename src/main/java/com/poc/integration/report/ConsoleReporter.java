package com.poc.integration.report;

import com.poc.integration.config.IntegrationConfig;
import com.poc.integration.gate.LicenseUsageSnapshot;
import com.poc.integration.ingest.ConsistencyWarning;
import com.poc.integration.ingest.IngestionSummary;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.model.OperatingMode;
import com.poc.integration.search.SearchResult;
import com.poc.integration.search.SearchResultEntry;
import com.poc.integration.search.StageTimings;
import com.poc.integration.virtualization.VirtualizationResult;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Console reporter for ingestion, search and license results.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final boolean quiet;
    private final PrintStream out;

    public ConsoleReporter(boolean quiet) {
        this(quiet, System.out);
    }

    public ConsoleReporter(boolean quiet, PrintStream out) {
        this.quiet = quiet;
        this.out = out;
    }

    public void printIngestHeader(IntegrationConfig config, long count, int batchSize) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.println("              Encrypted Dual-Store Integration - Ingestion");
        out.println(SEPARATOR);
        out.println();
        out.printf("Search Store:    %s%n", config.getSearchStore().getNamespace());
        out.printf("Record Store:    %s%n", config.getRecordStore().getJdbcUrl());
        out.printf("Started:         %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println();
        out.println("Configuration:");
        out.printf("  Records:         %,d%n", count);
        out.printf("  Batch Size:      %d%n", batchSize);
        out.printf("  Threads:         %d%n", config.getThreads());
        out.printf("  Call Timeout:    %d ms%n", config.getCallTimeoutMs());
        out.printf("  Halt On Warning: %s%n", config.isHaltOnInconsistency());
        out.println();
        out.println("Progress:");
    }

    public void printIngestSummary(IngestionSummary summary) {
        if (quiet) {
            out.printf("Ingested %,d records: %,d committed, %,d rolled back, %,d failed, stores agree: %s%n",
                summary.generated(), summary.committed(), summary.rolledBack(), summary.failed(),
                summary.storesAgree() ? "yes" : "NO");
            return;
        }

        out.println();
        out.println(SEPARATOR);
        out.println("                           Ingestion Summary");
        out.println(SEPARATOR);
        out.println();
        out.printf("  Generated:       %,12d%n", summary.generated());
        out.printf("  Committed:       %,12d%n", summary.committed());
        out.printf("  Rolled Back:     %,12d%n", summary.rolledBack());
        out.printf("  Failed:          %,12d%n", summary.failed());
        out.println(THIN_SEPARATOR);
        out.printf("  Search Store:    %12s%n", formatCount(summary.searchStoreCount()));
        out.printf("  Record Store:    %12s%n", formatCount(summary.recordStoreCount()));
        out.printf("  Stores Agree:    %12s%n", summary.storesAgree() ? "YES" : "NO");
        if (summary.halted()) {
            out.println("  Halted after a consistency warning; remaining batches skipped.");
        }
        out.println();

        if (!summary.warnings().isEmpty()) {
            out.println("Consistency Warnings:");
            for (ConsistencyWarning warning : summary.warnings()) {
                out.printf("  %s%n", warning);
            }
            out.println();
        }
        if (!summary.orphanedIds().isEmpty()) {
            out.println("Orphaned Search Store Entries:");
            summary.orphanedIds().forEach(id -> out.printf("  %s%n", id));
            out.println();
        }

        out.printf("Throughput:  %,.1f records/sec%n", summary.throughput());
        out.printf("P95 Latency: %.2f ms%n", summary.p95LatencyMs());
        out.printf("Total Time:  %s%n", formatDuration(summary.elapsedMs()));
        out.printf("Completed:   %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println(SEPARATOR);
    }

    public void printSearchResult(SearchResult result) {
        StageTimings timings = result.timings();

        if (quiet) {
            out.printf("%d results (%s, %s on %s) in %.2f ms%s%n",
                result.size(), result.mode().getLabel(), result.queryKind(), result.field(),
                timings.totalMs(), result.partial() ? " [PARTIAL]" : "");
            return;
        }

        out.println();
        out.println(SEPARATOR);
        out.printf("Search: %s query on '%s' (%s)%n", result.queryKind(), result.field(), result.mode().getLabel());
        out.println(SEPARATOR);

        for (SearchResultEntry entry : result.entries()) {
            out.println(THIN_SEPARATOR);
            if (entry.isIdentifierOnly()) {
                out.printf("customer_id: %s (identifier only)%n", entry.customerId());
            } else {
                printProjection(entry.projection());
            }
        }

        out.println(THIN_SEPARATOR);
        out.printf("Results:      %d%n", result.size());
        out.printf("Partial:      %s%n", result.partial());
        for (String warning : result.warnings()) {
            out.printf("Warning:      %s%n", warning);
        }
        out.printf("Search Stage: %.2f ms%n", timings.searchMs());
        out.printf("%-13s %.2f ms%n", result.mode() == OperatingMode.HYBRID
            ? "Fetch Stage:" : "Decrypt Stage:", timings.fetchOrDecryptMs());
        out.printf("Total:        %.2f ms%n", timings.totalMs());
        out.println(SEPARATOR);
    }

    public void printProjection(CustomerProjection projection) {
        for (Map.Entry<String, Object> entry : projection.toMap().entrySet()) {
            out.printf("%-20s %s%n", entry.getKey() + ":", entry.getValue());
        }
    }

    public void printVirtualizationResult(String view, VirtualizationResult result, LicenseUsageSnapshot stats) {
        out.println();
        out.println(SEPARATOR);
        out.printf("Virtualization: %s%n", view);
        out.println(SEPARATOR);

        if (result.throttled()) {
            out.println("THROTTLED: no license slot was available; the server was not called.");
        } else {
            for (Map<String, Object> row : result.rows()) {
                out.println(THIN_SEPARATOR);
                row.forEach((key, value) -> out.printf("%-20s %s%n", key + ":", value));
            }
            out.println(THIN_SEPARATOR);
            out.printf("Rows:         %d%s%n", result.rows().size(),
                result.rowLimitReached() ? " (row limit reached)" : "");
            out.printf("Duration:     %.2f ms%n", result.durationMs());
        }
        printLicenseStats(stats);
    }

    public void printLicenseStats(LicenseUsageSnapshot stats) {
        out.println();
        out.println("License Usage:");
        out.printf("  Ceiling:         %d%n", stats.ceiling());
        out.printf("  Current:         %d%n", stats.current());
        out.printf("  Peak:            %d%n", stats.peak());
        out.printf("  Acquired:        %,d%n", stats.totalAcquired());
        out.printf("  Throttled:       %,d%n", stats.totalThrottled());
        out.printf("  Violations:      %,d%n", stats.totalViolations());
    }

    private String formatCount(long count) {
        return count < 0 ? "unavailable" : String.format("%,d", count);
    }

    private String formatDuration(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60_000) {
            return String.format("%.1f seconds", millis / 1000.0);
        } else if (millis < 3600_000) {
            long minutes = millis / 60_000;
            long seconds = (millis % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        } else {
            long hours = millis / 3600_000;
            long minutes = (millis % 3600_000) / 60_000;
            return String.format("%d hr %d min", hours, minutes);
        }
    }
}
