package com.darkwatch.core.model;

/**
 * Per-source request budget.
 *
 * @param requestsPerMinute refill rate of the token bucket and ceiling of the minute window, must be positive
 * @param requestsPerHour   ceiling of the hour window, {@code 0} for unlimited
 * @param requestsPerDay    ceiling of the day window, {@code 0} for unlimited
 * @param burstCapacity     maximum tokens held by the bucket, at least 1
 */
public record RateLimitConfig(
    int requestsPerMinute,
    int requestsPerHour,
    int requestsPerDay,
    int burstCapacity
) {
    public RateLimitConfig {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive, got " + requestsPerMinute);
        }
        if (requestsPerHour < 0 || requestsPerDay < 0) {
            throw new IllegalArgumentException("hour and day ceilings must not be negative");
        }
        if (burstCapacity < 1) {
            throw new IllegalArgumentException("burstCapacity must be at least 1, got " + burstCapacity);
        }
    }
}
