package com.poc.integration.virtualization;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one gated virtualization call.
 *
 * @param rows            returned rows, at most the configured row limit
 * @param durationMs      time spent in the server call, 0 when throttled
 * @param throttled       no license slot was available and the server was not called
 * @param rowLimitReached rows were cut at the row limit
 */
public record VirtualizationResult(
    List<Map<String, Object>> rows,
    double durationMs,
    boolean throttled,
    boolean rowLimitReached
) {

    public VirtualizationResult {
        rows = List.copyOf(rows);
    }

    public static VirtualizationResult throttledResult() {
        return new VirtualizationResult(List.of(), 0.0, true, false);
    }
}
