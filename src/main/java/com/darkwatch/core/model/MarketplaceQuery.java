package com.darkwatch.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Search dark web marketplaces for listings mentioning the given terms.
 *
 * @param keywords        free-text terms
 * @param domains         domains the listings may reference
 * @param categories      marketplace categories to restrict to
 * @param timeRange       required discovery window
 * @param minRiskScore    minimum risk score in [0, 100], {@code null} for no filter
 * @param includeMetadata whether provider metadata should be kept on results
 */
public record MarketplaceQuery(
    List<String> keywords,
    List<String> domains,
    List<String> categories,
    DateRange timeRange,
    Integer minRiskScore,
    boolean includeMetadata
) {
    public MarketplaceQuery {
        Objects.requireNonNull(timeRange, "timeRange");
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        domains = domains == null ? List.of() : List.copyOf(domains);
        categories = categories == null ? List.of() : List.copyOf(categories);
        if (minRiskScore != null && (minRiskScore < 0 || minRiskScore > 100)) {
            throw new IllegalArgumentException("minRiskScore must be within [0, 100]");
        }
    }
}
