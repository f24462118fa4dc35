package com.darkwatch.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * API key material for one source. {@link #toString()} never renders secret values.
 *
 * @param apiKey            primary key
 * @param secret            companion secret, may be {@code null}
 * @param token             bearer or account token, may be {@code null}
 * @param additionalHeaders extra request headers required by the provider
 * @param expiresAt         provider-side expiry hint, may be {@code null}
 */
public record Credentials(
    String apiKey,
    String secret,
    String token,
    Map<String, String> additionalHeaders,
    Instant expiresAt
) {
    public Credentials {
        additionalHeaders = additionalHeaders == null ? Map.of() : Map.copyOf(additionalHeaders);
    }

    public static Credentials ofApiKey(String apiKey) {
        return new Credentials(apiKey, null, null, Map.of(), null);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public Credentials withApiKey(String newApiKey) {
        return new Credentials(newApiKey, secret, token, additionalHeaders, expiresAt);
    }

    @Override
    public String toString() {
        return "Credentials[apiKey=" + mask(apiKey)
                + ", secret=" + mask(secret)
                + ", token=" + mask(token)
                + ", additionalHeaders=" + additionalHeaders.keySet()
                + ", expiresAt=" + expiresAt + "]";
    }

    private static String mask(String value) {
        return value == null ? "null" : "****";
    }
}
