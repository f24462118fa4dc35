package com.darkwatch.core.ratelimit;

import com.darkwatch.core.model.RateLimitConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Token bucket with burst capacity, combined with minute, hour and day sliding windows.
 * <p>
 * The bucket refills continuously at one token per {@code 60000 / requestsPerMinute} ms and
 * never holds more than {@code burstCapacity}. Independently of the bucket, a log of accepted
 * request timestamps enforces the three window ceilings. A request is admitted only when the
 * bucket has a whole token and no window is saturated. Hour and day ceilings of {@code 0} are
 * unlimited.
 * <p>
 * Thread-safe. Waiting callers sleep outside the monitor and re-evaluate after waking, so
 * concurrent callers queue on the limiter instead of bypassing it.
 */
public class RateLimiter {

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 3_600_000L;
    private static final long DAY_MS = 86_400_000L;

    private final RateLimitConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final double refillIntervalMs;

    private final Deque<Long> requestLog = new ArrayDeque<>();
    private double tokens;
    private long lastRefillMs;

    public RateLimiter(RateLimitConfig config) {
        this(config, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimiter(RateLimitConfig config, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.refillIntervalMs = (double) MINUTE_MS / config.requestsPerMinute();
        this.tokens = config.burstCapacity();
        this.lastRefillMs = clock.millis();
    }

    /**
     * Blocks until a token is available, then consumes it.
     *
     * @return total time spent waiting
     */
    public Duration acquire() throws InterruptedException {
        long waitedMs = 0;
        while (true) {
            long waitMs;
            synchronized (this) {
                long now = clock.millis();
                advance(now);
                waitMs = computeWaitMs(now);
                if (waitMs <= 0) {
                    consume(now);
                    return Duration.ofMillis(waitedMs);
                }
            }
            sleeper.sleep(Duration.ofMillis(waitMs));
            waitedMs += waitMs;
        }
    }

    /**
     * Like {@link #acquire()}, but gives up without sleeping as soon as the projected total
     * wait would reach {@code maxWait}.
     *
     * @return {@code true} once a token was consumed, {@code false} when the wait would not fit
     */
    public boolean tryAcquire(Duration maxWait) throws InterruptedException {
        long budgetMs = maxWait.toMillis();
        long waitedMs = 0;
        while (true) {
            long waitMs;
            synchronized (this) {
                long now = clock.millis();
                advance(now);
                waitMs = computeWaitMs(now);
                if (waitMs <= 0) {
                    consume(now);
                    return true;
                }
            }
            if (waitedMs + waitMs >= budgetMs) {
                return false;
            }
            sleeper.sleep(Duration.ofMillis(waitMs));
            waitedMs += waitMs;
        }
    }

    /**
     * Consumes a token if one is available right now.
     */
    public synchronized boolean tryAcquire() {
        long now = clock.millis();
        advance(now);
        if (computeWaitMs(now) > 0) {
            return false;
        }
        consume(now);
        return true;
    }

    /**
     * Non-consuming check whether a request would be admitted right now.
     */
    public synchronized boolean canProceed() {
        long now = clock.millis();
        advance(now);
        return computeWaitMs(now) <= 0;
    }

    /**
     * Projected wait before the next request would be admitted.
     */
    public synchronized Duration waitTime() {
        long now = clock.millis();
        advance(now);
        return Duration.ofMillis(Math.max(0, computeWaitMs(now)));
    }

    public synchronized RateLimitSnapshot snapshot() {
        long now = clock.millis();
        advance(now);
        return new RateLimitSnapshot(
                tokens,
                countSince(now - MINUTE_MS),
                countSince(now - HOUR_MS),
                countSince(now - DAY_MS),
                Duration.ofMillis(Math.max(0, computeWaitMs(now))));
    }

    /**
     * Restores the full burst and forgets all request history.
     */
    public synchronized void reset() {
        requestLog.clear();
        tokens = config.burstCapacity();
        lastRefillMs = clock.millis();
    }

    public RateLimitConfig config() {
        return config;
    }

    private void advance(long now) {
        long elapsed = now - lastRefillMs;
        if (elapsed > 0) {
            tokens = Math.min(config.burstCapacity(), tokens + elapsed / refillIntervalMs);
            lastRefillMs = now;
        }
        long cutoff = now - DAY_MS;
        while (!requestLog.isEmpty() && requestLog.peekFirst() <= cutoff) {
            requestLog.pollFirst();
        }
    }

    private void consume(long now) {
        tokens -= 1.0;
        requestLog.addLast(now);
    }

    private long computeWaitMs(long now) {
        long wait = 0;
        if (tokens < 1.0) {
            wait = (long) Math.ceil((1.0 - tokens) * refillIntervalMs);
        }
        wait = Math.max(wait, windowWaitMs(now, MINUTE_MS, config.requestsPerMinute()));
        wait = Math.max(wait, windowWaitMs(now, HOUR_MS, config.requestsPerHour()));
        wait = Math.max(wait, windowWaitMs(now, DAY_MS, config.requestsPerDay()));
        return wait;
    }

    /**
     * Time until enough entries age out of the window for one more request, 0 when not saturated.
     */
    private long windowWaitMs(long now, long windowMs, int limit) {
        if (limit <= 0) {
            return 0;
        }
        long windowStart = now - windowMs;
        int inWindow = countSince(windowStart);
        if (inWindow < limit) {
            return 0;
        }
        // the (inWindow - limit + 1)-th oldest entry inside the window must age out
        int toSkip = inWindow - limit;
        for (Iterator<Long> it = requestLog.iterator(); it.hasNext(); ) {
            long ts = it.next();
            if (ts <= windowStart) {
                continue;
            }
            if (toSkip == 0) {
                return Math.max(1, ts + windowMs - now);
            }
            toSkip--;
        }
        return 1;
    }

    private int countSince(long windowStart) {
        int count = 0;
        for (Iterator<Long> it = requestLog.descendingIterator(); it.hasNext(); ) {
            if (it.next() <= windowStart) {
                break;
            }
            count++;
        }
        return count;
    }
}
