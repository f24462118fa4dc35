package com.darkwatch.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A breach event as reported by one provider.
 */
public record BreachResult(
    String id,
    String sourceId,
    String breachName,
    Instant breachDate,
    Instant discoveredDate,
    long affectedRecords,
    List<String> dataTypes,
    String description,
    boolean verified,
    int riskScore,
    List<String> affectedEmails,
    List<String> affectedDomains,
    Map<String, Object> metadata
) {
    public BreachResult {
        dataTypes = dataTypes == null ? List.of() : List.copyOf(dataTypes);
        affectedEmails = affectedEmails == null ? List.of() : List.copyOf(affectedEmails);
        affectedDomains = affectedDomains == null ? List.of() : List.copyOf(affectedDomains);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
