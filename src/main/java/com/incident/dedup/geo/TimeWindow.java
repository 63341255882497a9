package com.incident.dedup.geo;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval used as a temporal candidate filter.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
    }

    /**
     * Window of {@code ± hours} around the given instant.
     */
    public static TimeWindow around(Instant center, double hours) {
        Objects.requireNonNull(center, "center is required");
        if (hours < 0) {
            throw new IllegalArgumentException("hours must be >= 0");
        }
        Duration half = Duration.ofMillis(Math.round(hours * 60 * 60 * 1000));
        return new TimeWindow(center.minus(half), center.plus(half));
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
