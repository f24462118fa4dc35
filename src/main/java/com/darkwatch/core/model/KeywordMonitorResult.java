package com.darkwatch.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of keyword hits returned by one source for one monitoring request.
 */
public record KeywordMonitorResult(
    String id,
    List<String> keywords,
    String sourceId,
    List<KeywordMatch> matches,
    long totalMatches,
    Instant lastUpdated
) {
    public KeywordMonitorResult {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        matches = matches == null ? List.of() : List.copyOf(matches);
    }
}
