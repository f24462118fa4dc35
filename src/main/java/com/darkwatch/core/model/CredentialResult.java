package com.darkwatch.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One exposed credential, normalized across providers.
 */
public record CredentialResult(
    String id,
    String sourceId,
    String email,
    String username,
    String domain,
    String passwordHash,
    String plainTextPassword,
    String breachName,
    Instant breachDate,
    Instant discoveredDate,
    double confidence,
    int riskScore,
    Map<String, Object> metadata
) {
    public CredentialResult {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public String toString() {
        return "CredentialResult[id=" + id + ", sourceId=" + sourceId + ", email=" + email
                + ", username=" + username + ", domain=" + domain + ", breachName=" + breachName
                + ", riskScore=" + riskScore + "]";
    }
}
