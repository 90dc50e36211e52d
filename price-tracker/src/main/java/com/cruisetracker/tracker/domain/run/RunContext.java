package com.cruisetracker.tracker.domain.run;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable, thread-safe state of one run. Created per run and reduced to a {@link RunSummary} at the end.
 */
public class RunContext {

    private final String runId;
    private final Instant startedAt;
    private final int tracked;
    private final Map<RunCounter, AtomicInteger> counters = new EnumMap<>(RunCounter.class);
    private final Queue<ItineraryFailure> failures = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public RunContext(String runId, Instant startedAt, int tracked) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.tracked = tracked;
        for (var counter : RunCounter.values()) {
            counters.put(counter, new AtomicInteger());
        }
    }

    public String runId() {
        return runId;
    }

    public void increment(RunCounter counter) {
        counters.get(counter).incrementAndGet();
    }

    public int count(RunCounter counter) {
        return counters.get(counter).get();
    }

    public void fail(String itineraryId, RunStage stage, String reason) {
        failures.add(new ItineraryFailure(itineraryId, stage, reason));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public RunSummary toSummary(Instant finishedAt, RunPolicy policy) {
        var fetched = count(RunCounter.FETCHED);
        var extractionFailed = count(RunCounter.EXTRACTION_FAILED);
        var structureChange = fetched >= policy.structureChangeMinSamples()
                && fetched > 0
                && (double) extractionFailed / fetched >= policy.structureChangeThreshold();
        return RunSummary.builder()
                .runId(runId)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .tracked(tracked)
                .fetched(fetched)
                .fetchFailedTransient(count(RunCounter.FETCH_FAILED_TRANSIENT))
                .fetchFailedPermanent(count(RunCounter.FETCH_FAILED_PERMANENT))
                .extractionFailed(extractionFailed)
                .deduplicated(count(RunCounter.DEDUPLICATED))
                .newSnapshots(count(RunCounter.NEW_SNAPSHOTS))
                .persistenceFailed(count(RunCounter.PERSISTENCE_FAILED))
                .dealsDetected(count(RunCounter.DEALS_DETECTED))
                .notificationsSent(count(RunCounter.NOTIFICATIONS_SENT))
                .notificationsSuppressed(count(RunCounter.NOTIFICATIONS_SUPPRESSED))
                .notificationsFailed(count(RunCounter.NOTIFICATIONS_FAILED))
                .skipped(tracked - count(RunCounter.PROCESSED))
                .failures(failures.stream().toList())
                .siteStructureChangeSuspected(structureChange)
                .build();
    }
}
