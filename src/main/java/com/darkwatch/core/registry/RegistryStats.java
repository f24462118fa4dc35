package com.darkwatch.core.registry;

import java.time.Instant;

/**
 * @param lastHealthCheck most recent health observation across all connectors, epoch when none
 */
public record RegistryStats(int totalConnectors, int healthyConnectors, int unhealthyConnectors, Instant lastHealthCheck) {}
