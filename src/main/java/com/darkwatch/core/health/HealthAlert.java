package com.darkwatch.core.health;

import com.darkwatch.core.model.HealthStatus;

import java.util.Map;

/**
 * One threshold crossing.
 *
 * @param details alert-specific figures, e.g. the observed error rate and its threshold
 */
public record HealthAlert(
    HealthAlertType type,
    String sourceId,
    HealthStatus currentStatus,
    Map<String, Object> details
) {
    public HealthAlert {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
