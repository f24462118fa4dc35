package com.darkwatch.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Inclusive time range every query must carry. There is no implicit "all time".
 */
public record DateRange(Instant start, Instant end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("range start " + start + " is after end " + end);
        }
    }

    public static DateRange lastDays(Instant now, int days) {
        return new DateRange(now.minus(Duration.ofDays(days)), now);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
