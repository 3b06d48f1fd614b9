package com.poc.integration.virtualization;

import com.poc.integration.gate.LicenseGate;
import com.poc.integration.gate.WouldThrottleException;
import com.poc.integration.model.OperatingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs virtualization calls through the license gate and caps the rows returned per query.
 */
public class GatedVirtualizationClient {

    private static final Logger log = LoggerFactory.getLogger(GatedVirtualizationClient.class);

    private final VirtualizationAdapter adapter;
    private final LicenseGate gate;
    private final int maxRowsPerQuery;
    private final Duration callTimeout;

    public GatedVirtualizationClient(VirtualizationAdapter adapter, LicenseGate gate,
                                     int maxRowsPerQuery, Duration callTimeout) {
        if (maxRowsPerQuery < 1) {
            throw new IllegalArgumentException("Row limit must be positive");
        }
        this.adapter = adapter;
        this.gate = gate;
        this.maxRowsPerQuery = maxRowsPerQuery;
        this.callTimeout = callTimeout;
    }

    public VirtualizationResult search(String field, String value, OperatingMode mode) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Search value cannot be empty");
        }
        VirtualQuery query = VirtualQuery.forField(field);
        return execute(query.viewFor(mode), query.parameters(value), query, value);
    }

    public VirtualizationResult getCustomer(String customerId) {
        VirtualQuery query = VirtualQuery.CUSTOMER_ID;
        return execute(query.viewFor(OperatingMode.HYBRID), query.parameters(customerId), query, customerId);
    }

    private VirtualizationResult execute(String view, Map<String, String> params, VirtualQuery query, String value) {
        LicenseGate.Permit permit;
        try {
            permit = gate.acquire();
        } catch (WouldThrottleException e) {
            log.warn("Virtualization call to {} throttled: {}", view, e.getMessage());
            return VirtualizationResult.throttledResult();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VirtualizationException("Interrupted while waiting for a license slot", e);
        }

        try (permit) {
            long startNanos = System.nanoTime();
            List<Map<String, Object>> rows = adapter.queryView(view, params, callTimeout);
            double durationMs = (System.nanoTime() - startNanos) / 1_000_000.0;

            List<Map<String, Object>> matching = new ArrayList<>();
            boolean truncated = false;
            for (Map<String, Object> row : rows) {
                if (!query.matches(row, value)) {
                    continue;
                }
                if (matching.size() == maxRowsPerQuery) {
                    truncated = true;
                    break;
                }
                matching.add(row);
            }
            if (truncated) {
                log.info("View {} returned more than {} rows; result truncated", view, maxRowsPerQuery);
            }
            return new VirtualizationResult(matching, durationMs, false, truncated);
        }
    }

    public LicenseGate getGate() {
        return gate;
    }
}
