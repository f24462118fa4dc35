package com.darkwatch.core.health;

/**
 * @param errorRate           fraction of failing observations among the last ten that raises an alert
 * @param responseTimeMs      response time at or above which an alert is raised
 * @param consecutiveFailures failure streak length that raises an alert
 */
public record HealthAlertThresholds(double errorRate, long responseTimeMs, int consecutiveFailures) {

    public static final HealthAlertThresholds DEFAULTS = new HealthAlertThresholds(0.1, 5000, 3);

    public HealthAlertThresholds {
        if (errorRate < 0.0 || errorRate > 1.0) {
            throw new IllegalArgumentException("errorRate threshold must be within [0, 1]");
        }
        if (responseTimeMs <= 0) {
            throw new IllegalArgumentException("responseTimeMs threshold must be positive");
        }
        if (consecutiveFailures < 1) {
            throw new IllegalArgumentException("consecutiveFailures threshold must be at least 1");
        }
    }
}
