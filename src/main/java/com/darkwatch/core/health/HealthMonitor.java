package com.darkwatch.core.health;

import com.darkwatch.core.metrics.DarkwatchMetrics;
import com.darkwatch.core.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps a bounded observation history per source, derives rolling metrics from it and
 * raises threshold alerts to registered listeners.
 * <p>
 * Listeners run on the recording thread. A listener that throws is logged and skipped;
 * it never affects other listeners or the recorded history.
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final int MAX_HISTORY = 100;
    static final int ERROR_RATE_SAMPLE = 10;
    static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    private final Map<String, ArrayDeque<HealthStatus>> history = new ConcurrentHashMap<>();
    private final Map<HealthAlertType, CopyOnWriteArrayList<HealthAlertListener>> listeners =
            new EnumMap<>(HealthAlertType.class);
    private final Clock clock;
    private final DarkwatchMetrics metrics;
    private volatile HealthAlertThresholds thresholds;

    public HealthMonitor() {
        this(HealthAlertThresholds.DEFAULTS, Clock.systemUTC(), null);
    }

    public HealthMonitor(HealthAlertThresholds thresholds, Clock clock, DarkwatchMetrics metrics) {
        this.thresholds = thresholds;
        this.clock = clock;
        this.metrics = metrics;
        for (var type : HealthAlertType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Appends an observation, dropping the oldest beyond {@link #MAX_HISTORY}, then evaluates alerts.
     */
    public void record(HealthStatus status) {
        List<HealthStatus> snapshot;
        var entries = history.computeIfAbsent(status.sourceId(), k -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addLast(status);
            while (entries.size() > MAX_HISTORY) {
                entries.removeFirst();
            }
            snapshot = new ArrayList<>(entries);
        }
        evaluateAlerts(status, snapshot);
    }

    public Optional<HealthStatus> currentHealth(String sourceId) {
        var entries = history.get(sourceId);
        if (entries == null) {
            return Optional.empty();
        }
        synchronized (entries) {
            return Optional.ofNullable(entries.peekLast());
        }
    }

    /**
     * Most recent observations, oldest first.
     *
     * @param limit maximum entries to return, {@code 0} or less for all
     */
    public List<HealthStatus> history(String sourceId, int limit) {
        var all = entries(sourceId);
        if (limit > 0 && all.size() > limit) {
            return List.copyOf(all.subList(all.size() - limit, all.size()));
        }
        return List.copyOf(all);
    }

    public HealthMetrics metrics(String sourceId) {
        return metrics(sourceId, DEFAULT_WINDOW);
    }

    public HealthMetrics metrics(String sourceId, Duration window) {
        Instant cutoff = clock.instant().minus(window);
        var recent = entries(sourceId).stream()
                .filter(s -> s.lastCheck() != null && !s.lastCheck().isBefore(cutoff))
                .toList();
        if (recent.isEmpty()) {
            return HealthMetrics.empty(sourceId);
        }

        int total = recent.size();
        int successful = (int) recent.stream().filter(HealthStatus::healthy).count();
        int failed = total - successful;
        long sum = 0;
        long max = Long.MIN_VALUE;
        long min = Long.MAX_VALUE;
        for (var status : recent) {
            sum += status.responseTimeMs();
            max = Math.max(max, status.responseTimeMs());
            min = Math.min(min, status.responseTimeMs());
        }
        return new HealthMetrics(
                sourceId,
                total,
                successful,
                failed,
                (double) failed / total,
                (double) sum / total,
                max,
                min,
                trailingFailures(recent),
                (double) successful / total,
                recent.get(total - 1).lastCheck());
    }

    /**
     * Aggregates over every source with history. A source counts as healthy when its window
     * ends in a success and its error rate is below the alert threshold.
     */
    public SystemHealthSummary systemHealth() {
        var sourceIds = List.copyOf(history.keySet());
        if (sourceIds.isEmpty()) {
            return new SystemHealthSummary(0, 0, 0, 0.0, 0.0, 0, clock.instant());
        }
        double errorThreshold = thresholds.errorRate();
        int healthy = 0;
        int totalErrors = 0;
        int totalChecks = 0;
        double weightedResponse = 0.0;
        for (var sourceId : sourceIds) {
            var m = metrics(sourceId);
            if (m.consecutiveFailures() == 0 && m.errorRate() < errorThreshold) {
                healthy++;
            }
            totalErrors += m.failedChecks();
            totalChecks += m.totalChecks();
            weightedResponse += m.averageResponseTimeMs() * m.totalChecks();
        }
        return new SystemHealthSummary(
                sourceIds.size(),
                healthy,
                sourceIds.size() - healthy,
                totalChecks > 0 ? (double) (totalChecks - totalErrors) / totalChecks : 0.0,
                totalChecks > 0 ? weightedResponse / totalChecks : 0.0,
                totalErrors,
                clock.instant());
    }

    /**
     * @return handle that removes the listener again
     */
    public Subscription registerAlertCallback(HealthAlertType type, HealthAlertListener listener) {
        var list = listeners.get(type);
        list.add(listener);
        return () -> list.remove(listener);
    }

    public void updateThresholds(HealthAlertThresholds newThresholds) {
        this.thresholds = newThresholds;
        log.info("Health alert thresholds updated: {}", newThresholds);
    }

    public HealthAlertThresholds thresholds() {
        return thresholds;
    }

    public void clearHistory(String sourceId) {
        history.remove(sourceId);
    }

    public void clearHistory() {
        history.clear();
    }

    /**
     * Handle for cancelling an alert registration.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void evaluateAlerts(HealthStatus current, List<HealthStatus> entries) {
        var limits = thresholds;
        String sourceId = current.sourceId();

        var sample = entries.subList(Math.max(0, entries.size() - ERROR_RATE_SAMPLE), entries.size());
        double errorRate = (double) sample.stream().filter(s -> !s.healthy()).count() / sample.size();
        if (errorRate >= limits.errorRate()) {
            fire(HealthAlertType.HIGH_ERROR_RATE, current,
                    Map.of("errorRate", errorRate, "threshold", limits.errorRate()));
        }

        if (current.responseTimeMs() >= limits.responseTimeMs()) {
            fire(HealthAlertType.HIGH_RESPONSE_TIME, current,
                    Map.of("responseTimeMs", current.responseTimeMs(), "threshold", limits.responseTimeMs()));
        }

        int streak = trailingFailures(entries);
        if (streak >= limits.consecutiveFailures()) {
            fire(HealthAlertType.CONSECUTIVE_FAILURES, current,
                    Map.of("consecutiveFailures", streak, "threshold", limits.consecutiveFailures()));
        }

        if (current.healthy() && entries.size() >= 2 && !entries.get(entries.size() - 2).healthy()) {
            log.info("Source {} recovered", sourceId);
            fire(HealthAlertType.SOURCE_RECOVERED, current, Map.of());
        }
    }

    private void fire(HealthAlertType type, HealthStatus current, Map<String, Object> details) {
        var alert = new HealthAlert(type, current.sourceId(), current, details);
        if (metrics != null) {
            metrics.recordAlert(type.name().toLowerCase(Locale.ROOT), current.sourceId());
        }
        for (var listener : listeners.get(type)) {
            try {
                listener.onAlert(alert);
            } catch (Exception e) {
                log.warn("Health alert listener threw processing {} for {}: {}",
                        type, current.sourceId(), e.getMessage(), e);
            }
        }
    }

    private List<HealthStatus> entries(String sourceId) {
        var entries = history.get(sourceId);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    private static int trailingFailures(List<HealthStatus> entries) {
        int count = 0;
        for (int i = entries.size() - 1; i >= 0 && !entries.get(i).healthy(); i--) {
            count++;
        }
        return count;
    }
}
