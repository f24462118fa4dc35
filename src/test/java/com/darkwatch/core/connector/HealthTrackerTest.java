package com.darkwatch.core.connector;

import com.darkwatch.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link HealthTracker}.
 */
class HealthTrackerTest {

    private final MutableClock clock = MutableClock.at("2024-03-01T12:00:00Z");

    @Test
    @DisplayName("starts unhealthy until the first success")
    void startsUnhealthy() {
        var tracker = new HealthTracker("a", clock);

        assertFalse(tracker.snapshot().healthy());

        tracker.recordSuccess(42);
        assertTrue(tracker.snapshot().healthy());
        assertEquals(42, tracker.snapshot().responseTimeMs());
    }

    @Test
    @DisplayName("counts consecutive failures and resets on success")
    void consecutiveFailures() {
        var tracker = new HealthTracker("a", clock);
        tracker.recordSuccess(10);
        tracker.recordFailure("boom", 20);
        clock.advance(Duration.ofSeconds(5));
        tracker.recordFailure("boom again", -1);

        var status = tracker.snapshot();
        assertEquals(2, status.consecutiveErrors());
        assertEquals("boom again", status.lastError());
        assertEquals(20, status.responseTimeMs());
        assertEquals(clock.instant(), status.lastCheck());

        tracker.recordSuccess(5);
        assertEquals(0, tracker.snapshot().consecutiveErrors());
        assertNull(tracker.snapshot().lastError());
    }
}
