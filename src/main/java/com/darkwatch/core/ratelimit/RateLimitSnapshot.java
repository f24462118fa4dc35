package com.darkwatch.core.ratelimit;

import java.time.Duration;

/**
 * Read-only view of a {@link RateLimiter} for dashboards and the CLI.
 */
public record RateLimitSnapshot(
    double availableTokens,
    int requestsLastMinute,
    int requestsLastHour,
    int requestsLastDay,
    Duration nextPermitIn
) {}
