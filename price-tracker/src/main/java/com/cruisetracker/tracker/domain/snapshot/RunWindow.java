package com.cruisetracker.tracker.domain.snapshot;

import java.time.Duration;
import java.time.Instant;

/**
 * Buckets capture instants by run granularity, aligned to the epoch.
 */
public record RunWindow(Duration granularity) {

    public RunWindow {
        if (granularity == null || granularity.isNegative() || granularity.isZero()) {
            throw new IllegalArgumentException("Run granularity must be positive, was " + granularity);
        }
    }

    public Instant startOf(Instant instant) {
        var size = granularity.toMillis();
        var millis = instant.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, size) * size);
    }

    public boolean sameWindow(Instant a, Instant b) {
        return startOf(a).equals(startOf(b));
    }
}
