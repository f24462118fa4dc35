package com.darkwatch.core.registry;

import com.darkwatch.core.connector.ConnectorException;
import com.darkwatch.core.connector.ThreatIntelConnector;
import com.darkwatch.core.health.HealthMonitor;
import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.BreachQuery;
import com.darkwatch.core.model.BreachResult;
import com.darkwatch.core.model.CredentialQuery;
import com.darkwatch.core.model.CredentialResult;
import com.darkwatch.core.model.HealthStatus;
import com.darkwatch.core.model.KeywordMonitorResult;
import com.darkwatch.core.model.MarketplaceQuery;
import com.darkwatch.core.model.MarketplaceResult;
import com.darkwatch.core.model.ProviderType;
import com.darkwatch.core.scheduler.BackgroundScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Holds the registered connectors and fans queries out to the healthy ones.
 * <p>
 * Fan-out is all-settle: every branch is awaited, and a branch that throws, fails or times
 * out contributes nothing instead of failing the aggregate. Successful results are
 * concatenated in registration order and then deduplicated.
 */
public class ConnectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    static final String HEALTH_TASK = "registry-health-checks";

    private final Map<String, ThreatIntelConnector> connectors = new LinkedHashMap<>();
    private final Map<String, HealthStatus> healthStatuses = new ConcurrentHashMap<>();
    private final HealthMonitor healthMonitor;
    private final BackgroundScheduler scheduler;
    private final DarkwatchMetrics metrics;
    private final Duration branchTimeout;

    public ConnectorRegistry(HealthMonitor healthMonitor, BackgroundScheduler scheduler,
                             DarkwatchMetrics metrics, Duration branchTimeout) {
        this.healthMonitor = healthMonitor;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.branchTimeout = branchTimeout;
    }

    /**
     * Initializes the connector and registers it. When initialization fails nothing is
     * registered and the returned future fails with the cause.
     */
    public CompletableFuture<Void> register(String sourceId, ThreatIntelConnector connector) {
        return connector.initialize().handle((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("Failed to register connector for source {}: {}", sourceId, cause.getMessage());
                throw cause instanceof RuntimeException re ? re : new CompletionException(cause);
            }
            ThreatIntelConnector previous;
            synchronized (connectors) {
                previous = connectors.put(sourceId, connector);
            }
            var status = connector.sourceHealth();
            healthStatuses.put(sourceId, status);
            if (healthMonitor != null) {
                healthMonitor.record(status);
            }
            if (previous != null && previous != connector) {
                log.warn("Connector for source {} replaced", sourceId);
                closeQuietly(sourceId, previous);
            }
            log.info("Registered connector for source {} (healthy={})", sourceId, status.healthy());
            return null;
        });
    }

    public boolean unregister(String sourceId) {
        ThreatIntelConnector removed;
        synchronized (connectors) {
            removed = connectors.remove(sourceId);
        }
        healthStatuses.remove(sourceId);
        if (removed != null) {
            closeQuietly(sourceId, removed);
            log.info("Unregistered connector for source {}", sourceId);
        }
        return removed != null;
    }

    public Optional<ThreatIntelConnector> connector(String sourceId) {
        synchronized (connectors) {
            return Optional.ofNullable(connectors.get(sourceId));
        }
    }

    public List<ThreatIntelConnector> allConnectors() {
        synchronized (connectors) {
            return List.copyOf(connectors.values());
        }
    }

    public List<ThreatIntelConnector> connectorsByType(ProviderType type) {
        return allConnectors().stream()
                .filter(c -> c.source().providerType() == type)
                .toList();
    }

    public List<ThreatIntelConnector> healthyConnectors() {
        return allConnectors().stream()
                .filter(c -> {
                    var status = healthStatuses.get(c.sourceId());
                    return status != null && status.healthy();
                })
                .toList();
    }

    public Optional<HealthStatus> healthStatus(String sourceId) {
        return Optional.ofNullable(healthStatuses.get(sourceId));
    }

    public List<HealthStatus> allHealthStatuses() {
        return allConnectors().stream()
                .map(c -> healthStatuses.get(c.sourceId()))
                .filter(s -> s != null)
                .toList();
    }

    public CompletableFuture<List<CredentialResult>> searchCredentials(CredentialQuery query) {
        return gather("credentials", c -> c.searchCredentials(query))
                .thenApply(results -> dedup("credentials", results, ResultDeduplicator::credentials));
    }

    public CompletableFuture<List<MarketplaceResult>> searchMarketplaces(MarketplaceQuery query) {
        return gather("marketplaces", c -> c.searchMarketplaces(query))
                .thenApply(results -> dedup("marketplaces", results, ResultDeduplicator::marketplaces));
    }

    public CompletableFuture<List<BreachResult>> searchBreachDatabases(BreachQuery query) {
        return gather("breaches", c -> c.searchBreachDatabases(query))
                .thenApply(results -> dedup("breaches", results, ResultDeduplicator::breaches));
    }

    /**
     * One aggregate per source whose monitoring call succeeded.
     */
    public CompletableFuture<List<KeywordMonitorResult>> monitorKeywords(List<String> keywords) {
        return settle("keywords", c -> c.monitorKeywords(keywords));
    }

    /**
     * Health checks every registered connector concurrently, refreshes the health map and
     * feeds each observation to the {@link HealthMonitor}.
     */
    public CompletableFuture<Void> performHealthChecks() {
        var checks = new ArrayList<CompletableFuture<Void>>();
        for (var connector : allConnectors()) {
            String sourceId = connector.sourceId();
            CompletableFuture<HealthStatus> check;
            try {
                check = connector.performHealthCheck();
            } catch (RuntimeException e) {
                check = CompletableFuture.failedFuture(e);
            }
            checks.add(check.handle((status, error) -> {
                if (error != null) {
                    log.error("Health check failed for connector {}: {}", sourceId, unwrap(error).getMessage());
                    status = connector.sourceHealth();
                }
                if (status != null && isRegistered(sourceId, connector)) {
                    healthStatuses.put(sourceId, status);
                    if (healthMonitor != null) {
                        healthMonitor.record(status);
                    }
                }
                return null;
            }));
        }
        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]));
    }

    public void startHealthMonitoring(Duration interval) {
        scheduler.scheduleAtFixedRate(HEALTH_TASK, () -> performHealthChecks().join(), interval, interval);
        log.info("Periodic health checks every {}", interval);
    }

    public void stopHealthMonitoring() {
        scheduler.cancel(HEALTH_TASK);
    }

    public boolean isHealthMonitoring() {
        return scheduler.isScheduled(HEALTH_TASK);
    }

    public RegistryStats registryStats() {
        var statuses = allHealthStatuses();
        int total;
        synchronized (connectors) {
            total = connectors.size();
        }
        int healthy = (int) statuses.stream().filter(HealthStatus::healthy).count();
        Instant last = statuses.stream()
                .map(HealthStatus::lastCheck)
                .filter(i -> i != null)
                .max(Instant::compareTo)
                .orElse(Instant.EPOCH);
        return new RegistryStats(total, healthy, total - healthy, last);
    }

    /**
     * Stops health monitoring, closes every connector and forgets them.
     */
    public void destroy() {
        stopHealthMonitoring();
        Map<String, ThreatIntelConnector> snapshot;
        synchronized (connectors) {
            snapshot = new LinkedHashMap<>(connectors);
            connectors.clear();
        }
        healthStatuses.clear();
        snapshot.forEach(this::closeQuietly);
        log.info("Connector registry destroyed ({} connectors closed)", snapshot.size());
    }

    /**
     * {@link #settle} for list-valued searches: flattens the branches in registration order and
     * drops null elements, counting a branch that returned any as faulty.
     */
    private <T> CompletableFuture<List<T>> gather(String category,
                                                  Function<ThreatIntelConnector, CompletableFuture<List<T>>> call) {
        return this.<List<T>>settle(category, connector -> {
            CompletableFuture<List<T>> branch = call.apply(connector);
            return branch == null ? null : branch.thenApply(list -> withoutNulls(category, connector.sourceId(), list));
        }).thenApply(lists -> flatten(lists));
    }

    private <T> List<T> withoutNulls(String category, String sourceId, List<T> results) {
        if (results == null) {
            return List.of();
        }
        var kept = results.stream().filter(Objects::nonNull).toList();
        if (kept.size() < results.size()) {
            log.warn("{} search on {} returned {} null results, dropped", category, sourceId,
                    results.size() - kept.size());
            if (metrics != null) {
                metrics.recordFanOutFailure(category, sourceId);
            }
        }
        return kept;
    }

    private <R> CompletableFuture<List<R>> settle(String category, Function<ThreatIntelConnector, CompletableFuture<R>> call) {
        var targets = healthyConnectors();
        var branches = new ArrayList<CompletableFuture<Optional<R>>>(targets.size());
        for (var connector : targets) {
            String sourceId = connector.sourceId();
            CompletableFuture<R> branch;
            try {
                branch = call.apply(connector);
                if (branch == null) {
                    branch = CompletableFuture.failedFuture(new IllegalStateException("connector returned no future"));
                }
            } catch (RuntimeException e) {
                branch = CompletableFuture.failedFuture(e);
            }
            branches.add(branch.copy()
                    .orTimeout(branchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((result, error) -> {
                        refreshHealth(sourceId, connector);
                        if (error != null) {
                            recordBranchFailure(category, sourceId, unwrap(error));
                            return Optional.<R>empty();
                        }
                        return Optional.ofNullable(result);
                    }));
        }
        return CompletableFuture.allOf(branches.toArray(new CompletableFuture[0]))
                .thenApply(v -> branches.stream()
                        .map(CompletableFuture::join)
                        .flatMap(Optional::stream)
                        .toList());
    }

    private void recordBranchFailure(String category, String sourceId, Throwable cause) {
        if (cause instanceof TimeoutException) {
            log.warn("{} search on {} timed out after {}", category, sourceId, branchTimeout);
        } else if (cause instanceof ConnectorException ce) {
            log.warn("{} search on {} failed: {} ({})", category, sourceId, ce.getMessage(), ce.getErrorCode());
        } else {
            log.warn("{} search on {} failed: {}", category, sourceId, cause.toString());
        }
        if (metrics != null) {
            metrics.recordFanOutFailure(category, sourceId);
        }
    }

    private void refreshHealth(String sourceId, ThreatIntelConnector connector) {
        try {
            var status = connector.sourceHealth();
            if (status != null && isRegistered(sourceId, connector)) {
                healthStatuses.put(sourceId, status);
            }
        } catch (RuntimeException e) {
            log.warn("Could not read health of {}: {}", sourceId, e.getMessage());
        }
    }

    private boolean isRegistered(String sourceId, ThreatIntelConnector connector) {
        synchronized (connectors) {
            return connectors.get(sourceId) == connector;
        }
    }

    private <T> List<T> dedup(String category, List<T> results, Function<List<T>, List<T>> deduplicator) {
        var unique = deduplicator.apply(results);
        int removed = results.size() - unique.size();
        if (removed > 0) {
            log.debug("Removed {} duplicate {} results", removed, category);
            if (metrics != null) {
                metrics.recordDeduplicated(category, removed);
            }
        }
        return unique;
    }

    private static <T> List<T> flatten(List<List<T>> lists) {
        var all = new ArrayList<T>();
        lists.forEach(all::addAll);
        return all;
    }

    private void closeQuietly(String sourceId, ThreatIntelConnector connector) {
        try {
            connector.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connector {}: {}", sourceId, e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
