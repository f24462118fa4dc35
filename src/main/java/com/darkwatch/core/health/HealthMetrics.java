package com.darkwatch.core.health;

import java.time.Instant;

/**
 * Rolling health figures for one source over a time window. All zeros when the window
 * holds no observations.
 *
 * @param errorRate           failed / total
 * @param consecutiveFailures failing observations at the tail of the window
 * @param uptime              successful / total
 */
public record HealthMetrics(
    String sourceId,
    int totalChecks,
    int successfulChecks,
    int failedChecks,
    double errorRate,
    double averageResponseTimeMs,
    long maxResponseTimeMs,
    long minResponseTimeMs,
    int consecutiveFailures,
    double uptime,
    Instant lastCheck
) {
    static HealthMetrics empty(String sourceId) {
        return new HealthMetrics(sourceId, 0, 0, 0, 0.0, 0.0, 0, 0, 0, 0.0, Instant.EPOCH);
    }
}
