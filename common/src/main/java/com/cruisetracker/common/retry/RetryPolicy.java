package com.cruisetracker.common.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff: attempt {@code n} (1-based) that fails waits
 * {@code min(maxDelay, baseDelay * multiplier^(n-1))} before attempt {@code n+1}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier) {

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, was " + multiplier);
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public Duration delayAfterAttempt(int attempt) {
        double scaled = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long millis = (long) Math.min(scaled, maxDelay.toMillis());
        return Duration.ofMillis(millis);
    }
}
