package com.cruisetracker.tracker.domain.fetch;

import com.cruisetracker.common.id.UlidGenerator;
import com.cruisetracker.common.retry.RetryExecutor;
import com.cruisetracker.common.retry.RetryOutcome;
import com.cruisetracker.tracker.domain.exceptions.PermanentFetchException;
import com.cruisetracker.tracker.domain.exceptions.TransientFetchException;
import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Retrieves one page per call under a per-host rate limit and a global in-flight bound.
 * Failures come back as a classified {@link FetchError}; only storage failures propagate.
 * Every call records a {@link RawCapture}, successful or not.
 */
@Slf4j
public class Fetcher {

    private final PageClient client;
    private final SnapshotStore snapshotStore;
    private final HostRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final Semaphore inFlight;
    private final Clock clock;

    public Fetcher(PageClient client, SnapshotStore snapshotStore, FetchPolicy policy,
                   HostRateLimiter rateLimiter, RetryExecutor retryExecutor, Clock clock) {
        this.client = client;
        this.snapshotStore = snapshotStore;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.inFlight = new Semaphore(policy.maxInFlight(), true);
        this.clock = clock;
    }

    public FetchOutcome fetch(FetchTarget target) {
        var lastResponse = new AtomicReference<PageResponse>();
        RetryOutcome<PageResponse> outcome = retryExecutor.execute(
                "fetch " + target.itineraryId(),
                () -> attempt(target, lastResponse),
                Fetcher::isRetryable);
        if (outcome.failure() instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }

        var response = lastResponse.get();
        var capture = RawCapture.builder()
                .id(UlidGenerator.generate())
                .itineraryId(target.itineraryId())
                .url(target.url().toString())
                .httpStatus(response == null ? 0 : response.status())
                .content(response == null || response.body() == null ? "" : response.body())
                .attempts(outcome.attempts())
                .error(outcome.isSuccess() ? null : describe(outcome.failure()))
                .capturedAt(clock.instant())
                .build();
        snapshotStore.recordCapture(capture);

        if (outcome.isSuccess()) {
            log.info("fetch.completed: itinerary={}, status={}, attempts={}",
                    target.itineraryId(), capture.httpStatus(), capture.attempts());
            return FetchOutcome.success(capture);
        }
        var error = classify(outcome.failure(), capture.httpStatus());
        log.warn("fetch.failed: itinerary={}, kind={}, status={}, attempts={}, reason={}",
                target.itineraryId(), error.kind(), capture.httpStatus(), capture.attempts(), error.message());
        return FetchOutcome.failure(capture, error);
    }

    private PageResponse attempt(FetchTarget target, AtomicReference<PageResponse> lastResponse)
            throws IOException, InterruptedException {
        inFlight.acquire();
        PageResponse response;
        try {
            // spacing is measured between request starts, so the slot is taken under the permit
            rateLimiter.acquire(target.host());
            response = client.get(target);
        } finally {
            inFlight.release();
        }
        lastResponse.set(response);

        var status = response.status();
        log.debug("fetch.attempt: itinerary={}, status={}", target.itineraryId(), status);
        if (status == 429 || status >= 500) {
            throw TransientFetchException.httpStatus(status);
        }
        if (status < 200 || status >= 300) {
            throw PermanentFetchException.httpStatus(status);
        }
        if (response.body() == null || response.body().isBlank()) {
            throw PermanentFetchException.emptyBody(status);
        }
        return response;
    }

    private static boolean isRetryable(Exception e) {
        return e instanceof TransientFetchException || e instanceof IOException;
    }

    private static FetchError classify(Exception failure, int httpStatus) {
        if (failure instanceof PermanentFetchException) {
            return FetchError.permanentFailure(failure.getMessage(), httpStatus);
        }
        return FetchError.transientFailure(describe(failure), httpStatus);
    }

    private static String describe(Exception failure) {
        if (failure == null) {
            return null;
        }
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }
}
