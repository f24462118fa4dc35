package com.darkwatch.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Registration-time description of one external threat intelligence provider.
 * Rate-limit and retry settings are fixed once a connector is built from it.
 *
 * @param id              stable source identifier, also the tag carried by every result
 * @param name            display name
 * @param providerType    vendor backing this source
 * @param baseUrl         provider API root
 * @param rateLimits      request budget
 * @param retry           backoff policy
 * @param credentialRef   secret id in the vault
 * @param timeout         per-attempt HTTP timeout
 * @param requestDeadline upper bound for one logical request including retries and backoff
 * @param enabled         whether the source is registered at startup
 */
public record Source(
    String id,
    String name,
    ProviderType providerType,
    String baseUrl,
    RateLimitConfig rateLimits,
    RetryConfig retry,
    String credentialRef,
    Duration timeout,
    Duration requestDeadline,
    boolean enabled
) {
    public Source {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(providerType, "providerType");
        Objects.requireNonNull(rateLimits, "rateLimits");
        Objects.requireNonNull(retry, "retry");
        Objects.requireNonNull(credentialRef, "credentialRef");
        if (id.isBlank()) {
            throw new IllegalArgumentException("source id must not be blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
        if (requestDeadline == null) {
            requestDeadline = Duration.ofMinutes(2);
        }
    }
}
