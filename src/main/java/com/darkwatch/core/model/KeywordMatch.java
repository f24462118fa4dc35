package com.darkwatch.core.model;

import java.time.Instant;

/**
 * A single hit for a monitored keyword.
 */
public record KeywordMatch(
    String id,
    String content,
    String url,
    String title,
    Instant discoveredDate,
    int riskScore,
    String context
) {}
