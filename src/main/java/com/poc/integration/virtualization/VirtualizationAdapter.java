package com.poc.integration.virtualization;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only channel to the data-virtualization server, which itself federates both stores.
 * Every call occupies one license slot on the server, so callers go through
 * {@link GatedVirtualizationClient} rather than using an adapter directly.
 */
public interface VirtualizationAdapter {

    /**
     * Rows of a published view, filtered by exact-match parameters.
     *
     * @throws VirtualizationException if the view is unknown or the server fails
     */
    List<Map<String, Object>> queryView(String view, Map<String, String> params, Duration timeout);
}
