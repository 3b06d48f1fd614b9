package com.poc.integration.gate;

/**
 * Point-in-time copy of the gate counters.
 *
 * @param current         slots held right now
 * @param peak            highest number of slots held at once since the last reset
 * @param totalAcquired   successful acquisitions
 * @param totalThrottled  acquisitions that had to wait or were refused
 * @param totalViolations times the holder count exceeded the ceiling
 * @param ceiling         licensed concurrency
 */
public record LicenseUsageSnapshot(
    int current,
    int peak,
    long totalAcquired,
    long totalThrottled,
    long totalViolations,
    int ceiling
) {

    public boolean withinLicense() {
        return totalViolations == 0 && peak <= ceiling;
    }
}
