package com.darkwatch.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Named, cancelable background tasks (health-check loops, credential rotation timers).
 * <p>
 * Scheduling under a name that is already in use replaces the previous task. A task that
 * throws is logged and, for periodic tasks, keeps its schedule. {@link #cancelAll()} and
 * {@link #shutdown()} stop everything so nothing fires after teardown.
 */
public class BackgroundScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final ScheduledExecutorService executor;
    private final ConcurrentHashMap<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public BackgroundScheduler(int threads) {
        var counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "darkwatch-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs {@code task} every {@code period}, first after {@code initialDelay}.
     */
    public void scheduleAtFixedRate(String name, Runnable task, Duration initialDelay, Duration period) {
        var future = executor.scheduleAtFixedRate(guarded(name, task),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
        replace(name, future);
        log.debug("Scheduled periodic task '{}' every {}", name, period);
    }

    /**
     * Runs {@code task} once after {@code delay}.
     */
    public void scheduleOnce(String name, Runnable task, Duration delay) {
        var self = new AtomicReference<ScheduledFuture<?>>();
        var future = executor.schedule(() -> {
            try {
                guarded(name, task).run();
            } finally {
                tasks.remove(name, self.get());
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        self.set(future);
        replace(name, future);
        log.debug("Scheduled task '{}' in {}", name, delay);
    }

    public boolean cancel(String name) {
        var future = tasks.remove(name);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.debug("Cancelled task '{}'", name);
        return true;
    }

    public boolean isScheduled(String name) {
        var future = tasks.get(name);
        return future != null && !future.isDone();
    }

    public Set<String> scheduledNames() {
        return Set.copyOf(tasks.keySet());
    }

    /**
     * Cancels every task whose name starts with {@code prefix}.
     */
    public int cancelAll(String prefix) {
        int cancelled = 0;
        for (var name : Set.copyOf(tasks.keySet())) {
            if (name.startsWith(prefix) && cancel(name)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public void cancelAll() {
        cancelAll("");
    }

    public void shutdown() {
        cancelAll();
        executor.shutdownNow();
        log.info("Background scheduler shut down");
    }

    private void replace(String name, ScheduledFuture<?> future) {
        var previous = tasks.put(name, future);
        if (previous != null && previous != future) {
            previous.cancel(false);
        }
    }

    private static Runnable guarded(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Background task '{}' failed: {}", name, e.getMessage(), e);
            }
        };
    }
}
