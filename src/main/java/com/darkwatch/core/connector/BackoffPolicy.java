package com.darkwatch.core.connector;

import com.darkwatch.core.model.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: {@code min(baseDelay * multiplier^attempt, maxDelay)}, optionally
 * shortened by up to {@code jitterFactor} of itself.
 */
public class BackoffPolicy {

    private final RetryConfig config;
    private final DoubleSupplier random;

    public BackoffPolicy(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffPolicy(RetryConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    /**
     * @param attempt zero-based index of the failed attempt
     */
    public Duration delayFor(int attempt) {
        double base = config.baseDelay().toMillis() * Math.pow(config.backoffMultiplier(), attempt);
        double capped = Math.min(base, config.maxDelay().toMillis());
        if (config.jitterFactor() > 0) {
            capped -= capped * config.jitterFactor() * random.getAsDouble();
        }
        return Duration.ofMillis(Math.max(0, Math.round(capped)));
    }

    public int maxRetries() {
        return config.maxRetries();
    }
}
