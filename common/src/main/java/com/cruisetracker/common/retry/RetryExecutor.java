package com.cruisetracker.common.retry;

import java.time.Duration;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a call under a {@link RetryPolicy}. The executor knows nothing about what is
 * being retried; callers decide which failures are retryable.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public RetryExecutor(RetryPolicy policy) {
        this(policy, Sleeper.THREAD);
    }

    public <T> RetryOutcome<T> execute(String operation, RetryableCall<T> call, Predicate<Exception> retryable) {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return RetryOutcome.success(call.call(), attempt);
            } catch (Exception e) {
                lastFailure = e;
                if (!retryable.test(e)) {
                    log.debug("{} failed on attempt {} with non-retryable error: {}", operation, attempt, e.getMessage());
                    return RetryOutcome.failure(e, attempt, false);
                }
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                Duration delay = policy.delayAfterAttempt(attempt);
                log.debug("{} failed on attempt {}/{}: {}. Retrying in {}ms",
                        operation, attempt, policy.maxAttempts(), e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted while backing off after attempt {}", operation, attempt);
                    return RetryOutcome.failure(e, attempt, true);
                }
            }
        }
        log.warn("{} gave up after {} attempts: {}", operation, policy.maxAttempts(), lastFailure.getMessage());
        return RetryOutcome.failure(lastFailure, policy.maxAttempts(), true);
    }

    public RetryPolicy policy() {
        return policy;
    }

    @FunctionalInterface
    public interface RetryableCall<T> {
        T call() throws Exception;
    }
}
