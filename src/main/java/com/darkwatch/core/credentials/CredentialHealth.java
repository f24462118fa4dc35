package com.darkwatch.core.credentials;

import java.time.Instant;

/**
 * Lifecycle view of one managed secret.
 *
 * @param nextRotation scheduled rotation time, {@code null} when auto rotation is off
 */
public record CredentialHealth(
    String secretId,
    boolean valid,
    Instant lastChecked,
    Instant nextRotation,
    boolean rotationEnabled
) {}
