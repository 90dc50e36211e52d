package com.cruisetracker.common.retry;

/**
 * Result of a {@link RetryExecutor} run. Exactly one of {@code value} and {@code failure} is set.
 * {@code exhausted} is true when the last failure was still retryable but the attempt budget ran out.
 */
public record RetryOutcome<T>(T value, Exception failure, int attempts, boolean exhausted) {

    public static <T> RetryOutcome<T> success(T value, int attempts) {
        return new RetryOutcome<>(value, null, attempts, false);
    }

    public static <T> RetryOutcome<T> failure(Exception failure, int attempts, boolean exhausted) {
        return new RetryOutcome<>(null, failure, attempts, exhausted);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
