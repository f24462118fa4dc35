package com.darkwatch.core.credentials;

import java.time.Instant;

public record VerificationStats(
    int totalCached,
    int valid,
    int invalid,
    double hitRate,
    Instant lastVerification
) {}
