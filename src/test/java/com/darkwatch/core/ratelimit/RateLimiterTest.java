package com.darkwatch.core.ratelimit;

import com.darkwatch.core.model.RateLimitConfig;
import com.darkwatch.support.MutableClock;
import com.darkwatch.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RateLimiter}.
 */
class RateLimiterTest {

    private MutableClock clock;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        sleeper = new RecordingSleeper(clock);
    }

    private RateLimiter limiter(int rpm, int rph, int rpd, int burst) {
        return new RateLimiter(new RateLimitConfig(rpm, rph, rpd, burst), clock, sleeper);
    }

    // -- Token bucket ---------------------------------------------------

    @Nested
    @DisplayName("Token bucket")
    class BucketTests {

        @Test
        @DisplayName("admits exactly the burst capacity at once")
        void burstIsUpperBound() {
            var limiter = limiter(60, 0, 0, 5);

            for (int i = 0; i < 5; i++) {
                assertTrue(limiter.tryAcquire(), "request " + i + " should be admitted");
            }
            assertFalse(limiter.tryAcquire());
            assertFalse(limiter.canProceed());
        }

        @Test
        @DisplayName("reports the refill interval as wait once drained")
        void waitTimeAfterDrain() {
            var limiter = limiter(60, 0, 0, 1);
            assertTrue(limiter.tryAcquire());

            assertEquals(Duration.ofSeconds(1), limiter.waitTime());

            clock.advance(Duration.ofMillis(500));
            assertEquals(Duration.ofMillis(500), limiter.waitTime());
        }

        @Test
        @DisplayName("refills one token per interval and never beyond burst")
        void refillCappedAtBurst() {
            var limiter = limiter(60, 0, 0, 3);
            for (int i = 0; i < 3; i++) {
                limiter.tryAcquire();
            }

            clock.advance(Duration.ofMinutes(10));

            assertEquals(3.0, limiter.snapshot().availableTokens(), 0.0001);
        }

        @Test
        @DisplayName("canProceed does not consume a token")
        void canProceedIsReadOnly() {
            var limiter = limiter(60, 0, 0, 1);

            assertTrue(limiter.canProceed());
            assertTrue(limiter.canProceed());
            assertTrue(limiter.tryAcquire());
            assertFalse(limiter.canProceed());
        }
    }

    // -- Blocking acquire -----------------------------------------------

    @Nested
    @DisplayName("acquire")
    class AcquireTests {

        @Test
        @DisplayName("returns immediately while tokens are available")
        void noWaitWithTokens() throws Exception {
            var limiter = limiter(60, 0, 0, 2);

            assertEquals(Duration.ZERO, limiter.acquire());
            assertTrue(sleeper.sleeps().isEmpty());
        }

        @Test
        @DisplayName("waits one refill interval per request after the burst")
        void waitsAfterBurst() throws Exception {
            var limiter = limiter(60, 0, 0, 2);

            for (int i = 0; i < 10; i++) {
                limiter.acquire();
            }

            assertEquals(Duration.ofSeconds(8), sleeper.total());
            assertEquals(8, sleeper.sleeps().size());
        }

        @Test
        @DisplayName("the waited time is returned to the caller")
        void returnsWaitedTime() throws Exception {
            var limiter = limiter(30, 0, 0, 1);
            limiter.acquire();

            assertEquals(Duration.ofSeconds(2), limiter.acquire());
        }

        @Test
        @DisplayName("a bounded acquire sleeps when the wait fits the budget")
        void boundedAcquireWithinBudget() throws Exception {
            var limiter = limiter(30, 0, 0, 1);
            limiter.acquire();

            assertTrue(limiter.tryAcquire(Duration.ofSeconds(5)));
            assertEquals(Duration.ofSeconds(2), sleeper.total());
        }

        @Test
        @DisplayName("a bounded acquire gives up without sleeping when the wait reaches the budget")
        void boundedAcquirePastBudget() throws Exception {
            var limiter = limiter(60, 0, 1, 5);
            limiter.acquire();

            assertFalse(limiter.tryAcquire(Duration.ofMinutes(1)));
            assertFalse(limiter.tryAcquire(limiter.waitTime()));
            assertTrue(sleeper.sleeps().isEmpty());
            assertEquals(1, limiter.snapshot().requestsLastDay());
        }
    }

    // -- Sliding windows ------------------------------------------------

    @Nested
    @DisplayName("Sliding windows")
    class WindowTests {

        @Test
        @DisplayName("minute window caps a burst larger than the per-minute rate")
        void minuteWindowCapsBurst() {
            var limiter = limiter(2, 0, 0, 5);

            assertTrue(limiter.tryAcquire());
            assertTrue(limiter.tryAcquire());
            assertFalse(limiter.tryAcquire());
            assertEquals(Duration.ofMinutes(1), limiter.waitTime());
        }

        @Test
        @DisplayName("hour ceiling is never exceeded even with a full bucket")
        void hourCeiling() throws Exception {
            var limiter = limiter(60, 3, 0, 10);

            for (int i = 0; i < 3; i++) {
                assertTrue(limiter.tryAcquire());
            }
            assertFalse(limiter.tryAcquire());
            assertEquals(Duration.ofHours(1), limiter.waitTime());

            limiter.acquire();
            assertEquals(Duration.ofHours(1), sleeper.total());
            assertEquals(1, limiter.snapshot().requestsLastHour());
        }

        @Test
        @DisplayName("day ceiling holds across many hours of steady traffic")
        void dayCeiling() throws Exception {
            var limiter = limiter(60, 0, 5, 1);

            for (int i = 0; i < 5; i++) {
                limiter.acquire();
                clock.advance(Duration.ofHours(1));
            }

            assertFalse(limiter.canProceed());
            assertEquals(5, limiter.snapshot().requestsLastDay());
            assertEquals(Duration.ofHours(19), limiter.waitTime());
        }

        @Test
        @DisplayName("zero hour and day ceilings mean unlimited")
        void zeroMeansUnlimited() {
            var limiter = limiter(6000, 0, 0, 500);

            int admitted = 0;
            for (int i = 0; i < 500; i++) {
                if (limiter.tryAcquire()) {
                    admitted++;
                }
            }

            assertEquals(500, admitted);
        }
    }

    // -- Snapshot and reset ---------------------------------------------

    @Nested
    @DisplayName("Snapshot and reset")
    class SnapshotTests {

        @Test
        @DisplayName("snapshot counts requests per window")
        void snapshotCounts() {
            var limiter = limiter(60, 100, 1000, 5);
            limiter.tryAcquire();
            clock.advance(Duration.ofMinutes(2));
            limiter.tryAcquire();

            var snapshot = limiter.snapshot();

            assertEquals(1, snapshot.requestsLastMinute());
            assertEquals(2, snapshot.requestsLastHour());
            assertEquals(2, snapshot.requestsLastDay());
            assertEquals(Duration.ZERO, snapshot.nextPermitIn());
        }

        @Test
        @DisplayName("reset restores the burst and clears history")
        void resetRestores() {
            var limiter = limiter(60, 2, 0, 2);
            limiter.tryAcquire();
            limiter.tryAcquire();
            assertFalse(limiter.canProceed());

            limiter.reset();

            assertTrue(limiter.canProceed());
            assertEquals(0, limiter.snapshot().requestsLastHour());
        }
    }

    // -- Concurrency ----------------------------------------------------

    @Test
    @DisplayName("concurrent callers never exceed the burst without refill")
    void concurrentCallersRespectBurst() throws Exception {
        var limiter = limiter(60, 0, 0, 10);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        var admitted = new AtomicInteger();
        var start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 50; i++) {
                pool.submit(() -> {
                    start.await();
                    if (limiter.tryAcquire()) {
                        admitted.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(10, admitted.get());
    }

    @Test
    @DisplayName("rejects a non-positive per-minute rate")
    void rejectsZeroRate() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimitConfig(0, 0, 0, 1));
    }
}
