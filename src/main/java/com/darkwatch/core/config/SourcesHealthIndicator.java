package com.darkwatch.core.config;

import com.darkwatch.core.registry.ConnectorRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of the registry: UP while at least one source is healthy or none are registered.
 */
@Component
public class SourcesHealthIndicator implements HealthIndicator {

    private final ConnectorRegistry registry;

    public SourcesHealthIndicator(ConnectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        var stats = registry.registryStats();
        var builder = stats.totalConnectors() == 0 || stats.healthyConnectors() > 0 ? Health.up() : Health.down();
        builder.withDetail("total", stats.totalConnectors())
                .withDetail("healthy", stats.healthyConnectors())
                .withDetail("unhealthy", stats.unhealthyConnectors())
                .withDetail("lastHealthCheck", stats.lastHealthCheck().toString());
        registry.allHealthStatuses().forEach(status -> builder.withDetail(status.sourceId(),
                status.healthy() ? "healthy" : "unhealthy: " + status.lastError()));
        return builder.build();
    }
}
