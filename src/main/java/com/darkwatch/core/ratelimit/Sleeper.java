package com.darkwatch.core.ratelimit;

import java.time.Duration;

/**
 * Suspends the calling thread. Swapped for a virtual clock in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
