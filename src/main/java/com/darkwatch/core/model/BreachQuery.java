package com.darkwatch.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Search breach repositories.
 *
 * @param emails           email addresses to look up
 * @param domains          domains to look up
 * @param breachNames      substrings of breach names to keep, empty for all
 * @param timeRange        required breach window
 * @param includePasswords whether providers may return plaintext passwords
 * @param verifiedOnly     keep only breaches the provider has verified
 */
public record BreachQuery(
    List<String> emails,
    List<String> domains,
    List<String> breachNames,
    DateRange timeRange,
    boolean includePasswords,
    boolean verifiedOnly
) {
    public BreachQuery {
        Objects.requireNonNull(timeRange, "timeRange");
        emails = emails == null ? List.of() : List.copyOf(emails);
        domains = domains == null ? List.of() : List.copyOf(domains);
        breachNames = breachNames == null ? List.of() : List.copyOf(breachNames);
    }
}
