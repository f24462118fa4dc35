package com.darkwatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for provider calls, fan-out and credential lifecycle.
 */
@Service
public class DarkwatchMetrics {

    private final MeterRegistry registry;

    public DarkwatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one completed provider request.
     *
     * @param outcome "success" or the error code that ended the request
     */
    public void recordRequest(String sourceId, String operation, String outcome, long ms) {
        Timer.builder("darkwatch.provider.requests")
                .tag("source", sourceId)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a retry. Rate-limit retries are tagged separately so they can be told apart
     * from transient failures.
     */
    public void recordRetry(String sourceId, boolean rateLimited) {
        Counter.builder("darkwatch.provider.retries")
                .description("Provider request retries")
                .tag("source", sourceId)
                .tag("reason", rateLimited ? "rate_limited" : "transient")
                .register(registry)
                .increment();
    }

    public void recordRateLimiterWait(String sourceId, Duration waited) {
        Timer.builder("darkwatch.ratelimiter.wait")
                .description("Time spent waiting for a rate limiter token")
                .tag("source", sourceId)
                .register(registry)
                .record(waited);
    }

    public void recordHealthCheck(String sourceId, boolean healthy) {
        Counter.builder("darkwatch.health.checks")
                .tag("source", sourceId)
                .tag("result", healthy ? "healthy" : "unhealthy")
                .register(registry)
                .increment();
    }

    /**
     * Records a connector branch that failed during a registry fan-out.
     *
     * @param category "credentials", "marketplaces", "breaches" or "keywords"
     */
    public void recordFanOutFailure(String category, String sourceId) {
        Counter.builder("darkwatch.fanout.failures")
                .description("Connector failures isolated during fan-out")
                .tag("category", category)
                .tag("source", sourceId)
                .register(registry)
                .increment();
    }

    public void recordDeduplicated(String category, int removed) {
        Counter.builder("darkwatch.fanout.duplicates")
                .tag("category", category)
                .register(registry)
                .increment(removed);
    }

    public void recordCredentialRotation(String secretId, boolean success) {
        Counter.builder("darkwatch.credentials.rotations")
                .tag("secret", secretId)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordAlert(String alertType, String sourceId) {
        Counter.builder("darkwatch.health.alerts")
                .tag("type", alertType)
                .tag("source", sourceId)
                .register(registry)
                .increment();
    }
}
