package com.darkwatch.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Search for exposed credentials.
 *
 * @param emails           email addresses to look up
 * @param domains          domains whose accounts should be returned
 * @param usernames        usernames to look up
 * @param apiKeyHashes     hashes of API keys that may have leaked
 * @param timeRange        required discovery window
 * @param includePasswords whether providers may return plaintext passwords
 * @param minConfidence    minimum provider confidence in [0, 1], {@code null} for the connector default
 */
public record CredentialQuery(
    List<String> emails,
    List<String> domains,
    List<String> usernames,
    List<String> apiKeyHashes,
    DateRange timeRange,
    boolean includePasswords,
    Double minConfidence
) {
    public CredentialQuery {
        Objects.requireNonNull(timeRange, "timeRange");
        emails = emails == null ? List.of() : List.copyOf(emails);
        domains = domains == null ? List.of() : List.copyOf(domains);
        usernames = usernames == null ? List.of() : List.copyOf(usernames);
        apiKeyHashes = apiKeyHashes == null ? List.of() : List.copyOf(apiKeyHashes);
        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0)) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]");
        }
    }

    public static CredentialQuery forEmails(List<String> emails, DateRange timeRange) {
        return new CredentialQuery(emails, List.of(), List.of(), List.of(), timeRange, false, null);
    }
}
