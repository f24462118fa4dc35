package com.darkwatch.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff policy applied to retryable provider failures.
 *
 * @param maxRetries        retries after the first attempt
 * @param baseDelay         delay before the first retry
 * @param maxDelay          upper bound for any single delay
 * @param backoffMultiplier growth factor per attempt
 * @param jitterFactor      fraction of each delay that may be randomly shaved off, {@code 0} disables jitter
 */
public record RetryConfig(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double backoffMultiplier,
    double jitterFactor
) {
    public RetryConfig {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
    }

    public RetryConfig(int maxRetries, Duration baseDelay, Duration maxDelay, double backoffMultiplier) {
        this(maxRetries, baseDelay, maxDelay, backoffMultiplier, 0.0);
    }
}
