package com.poc.integration.ingest;

import org.HdrHistogram.Histogram;

import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe metrics collection for dual-store ingestion.
 */
public class IngestionMetrics {

    private final LongAdder recordsProcessed = new LongAdder();
    private final LongAdder batchesCompleted = new LongAdder();
    private final Histogram recordLatencyHistogram;

    private volatile long startTimeNanos;
    private volatile long endTimeNanos;

    public IngestionMetrics() {
        // Latencies from 1 microsecond to 60 seconds with 3 significant digits
        this.recordLatencyHistogram = new Histogram(1, 60_000_000, 3);
    }

    public void start() {
        this.startTimeNanos = System.nanoTime();
    }

    public void complete() {
        this.endTimeNanos = System.nanoTime();
    }

    public void recordWrite(long latencyMicros) {
        recordsProcessed.increment();
        synchronized (recordLatencyHistogram) {
            recordLatencyHistogram.recordValue(Math.max(1, Math.min(latencyMicros, 60_000_000)));
        }
    }

    public void recordBatch() {
        batchesCompleted.increment();
    }

    public long getRecordsProcessed() {
        return recordsProcessed.sum();
    }

    public long getBatchesCompleted() {
        return batchesCompleted.sum();
    }

    public long getElapsedTimeMs() {
        long end = endTimeNanos > 0 ? endTimeNanos : System.nanoTime();
        return (end - startTimeNanos) / 1_000_000;
    }

    public double getThroughput() {
        long elapsedMs = getElapsedTimeMs();
        if (elapsedMs == 0) return 0;
        return (recordsProcessed.sum() * 1000.0) / elapsedMs;
    }

    public double getAvgLatencyMs() {
        synchronized (recordLatencyHistogram) {
            return recordLatencyHistogram.getMean() / 1000.0;
        }
    }

    public double getPercentileLatencyMs(double percentile) {
        synchronized (recordLatencyHistogram) {
            return recordLatencyHistogram.getValueAtPercentile(percentile) / 1000.0;
        }
    }

    public double getP95LatencyMs() {
        return getPercentileLatencyMs(95.0);
    }

    @Override
    public String toString() {
        return String.format(
            "IngestionMetrics{records=%d, batches=%d, elapsed=%dms, throughput=%.1f/sec, avgLatency=%.2fms, p95=%.2fms}",
            getRecordsProcessed(), getBatchesCompleted(), getElapsedTimeMs(), getThroughput(),
            getAvgLatencyMs(), getP95LatencyMs());
    }
}
