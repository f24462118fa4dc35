package com.darkwatch.core.connector;

import com.darkwatch.core.model.HealthStatus;

import java.time.Clock;
import java.time.Instant;

/**
 * Mutable health state of one connector. Only a passing observation sets {@code healthy}.
 */
public class HealthTracker {

    private final String sourceId;
    private final Clock clock;

    private boolean healthy;
    private Instant lastCheck;
    private long responseTimeMs;
    private int consecutiveErrors;
    private String lastError;

    public HealthTracker(String sourceId, Clock clock) {
        this.sourceId = sourceId;
        this.clock = clock;
        this.lastCheck = clock.instant();
    }

    public synchronized void recordSuccess(long responseTimeMs) {
        this.healthy = true;
        this.lastCheck = clock.instant();
        this.responseTimeMs = responseTimeMs;
        this.consecutiveErrors = 0;
        this.lastError = null;
    }

    /**
     * @param responseTimeMs latency of the failed call, or a negative value to keep the last one
     */
    public synchronized void recordFailure(String error, long responseTimeMs) {
        this.healthy = false;
        this.lastCheck = clock.instant();
        if (responseTimeMs >= 0) {
            this.responseTimeMs = responseTimeMs;
        }
        this.consecutiveErrors++;
        this.lastError = error;
    }

    public synchronized HealthStatus snapshot() {
        return new HealthStatus(sourceId, healthy, lastCheck, responseTimeMs, consecutiveErrors, lastError);
    }
}
