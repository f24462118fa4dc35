package com.darkwatch.core.credentials;

import java.time.Instant;

/**
 * @param fromCache whether the outcome was served from the verification cache
 * @param error     probe failure message, {@code null} when the probe completed
 */
public record VerificationResult(
    String secretId,
    boolean valid,
    Instant timestamp,
    boolean fromCache,
    String error,
    long responseTimeMs
) {}
