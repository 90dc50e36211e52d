package com.cruisetracker.tracker.domain.trend;

import java.time.Duration;

public record BaselinePolicy(int maxObservations, Duration maxAge, int minSamples) {

    public BaselinePolicy {
        if (maxObservations < 1) {
            throw new IllegalArgumentException("maxObservations must be >= 1, was " + maxObservations);
        }
        if (minSamples < 2) {
            throw new IllegalArgumentException("minSamples must be >= 2 for a sample standard deviation, was " + minSamples);
        }
    }
}
