package com.darkwatch.core.health;

import java.time.Instant;

public record SystemHealthSummary(
    int totalSources,
    int healthySources,
    int unhealthySources,
    double overallUptime,
    double averageResponseTimeMs,
    int totalErrors,
    Instant lastUpdate
) {}
