package com.darkwatch.core.model;

import java.time.Instant;

/**
 * Point-in-time health observation of one source.
 *
 * @param sourceId          observed source
 * @param healthy           outcome of the observation
 * @param lastCheck         when the observation was taken
 * @param responseTimeMs    latency of the observed call
 * @param consecutiveErrors failing observations in a row, reset by a passing one
 * @param lastError         message of the most recent failure, {@code null} when healthy
 */
public record HealthStatus(
    String sourceId,
    boolean healthy,
    Instant lastCheck,
    long responseTimeMs,
    int consecutiveErrors,
    String lastError
) {}
