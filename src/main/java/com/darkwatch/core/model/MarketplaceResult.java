package com.darkwatch.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A marketplace listing that references monitored assets.
 */
public record MarketplaceResult(
    String id,
    String sourceId,
    String title,
    String description,
    String url,
    String marketplace,
    String category,
    BigDecimal price,
    String currency,
    String seller,
    Instant discoveredDate,
    Instant lastSeen,
    int riskScore,
    List<String> keywords,
    Map<String, Object> metadata
) {
    public MarketplaceResult {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
