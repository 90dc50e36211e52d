package com.cruisetracker.tracker.domain.run;

import com.cruisetracker.common.id.UlidGenerator;
import com.cruisetracker.tracker.domain.deal.DealDetector;
import com.cruisetracker.tracker.domain.exceptions.SnapshotWriteFailedException;
import com.cruisetracker.tracker.domain.extraction.SelectorConfigSource;
import com.cruisetracker.tracker.domain.extraction.StrategyChainExtractor;
import com.cruisetracker.tracker.domain.extraction.StrategyChainFactory;
import com.cruisetracker.tracker.domain.fetch.FetchErrorKind;
import com.cruisetracker.tracker.domain.fetch.Fetcher;
import com.cruisetracker.tracker.domain.itinerary.TrackedItinerary;
import com.cruisetracker.tracker.domain.notification.NotificationDispatcher;
import com.cruisetracker.tracker.domain.snapshot.AppendResult;
import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import com.cruisetracker.tracker.domain.trend.TrendAnalyzer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Runs one scrape cycle: fetch, extract, store, analyze, detect and notify for every tracked itinerary
 * on a fixed worker pool. A failure at any stage is recorded against its itinerary and never stops
 * the others. Itineraries not started before the run timeout are skipped.
 */
@Slf4j
public class RunOrchestrator {

    private static final Duration INTERRUPTED_WORKER_WAIT = Duration.ofSeconds(2);

    private final Fetcher fetcher;
    private final SelectorConfigSource selectorConfigSource;
    private final StrategyChainFactory strategyChainFactory;
    private final SnapshotStore snapshotStore;
    private final TrendAnalyzer trendAnalyzer;
    private final DealDetector dealDetector;
    private final NotificationDispatcher notificationDispatcher;
    private final RunPolicy policy;
    private final Clock clock;

    public RunOrchestrator(Fetcher fetcher, SelectorConfigSource selectorConfigSource,
                           StrategyChainFactory strategyChainFactory, SnapshotStore snapshotStore,
                           TrendAnalyzer trendAnalyzer, DealDetector dealDetector,
                           NotificationDispatcher notificationDispatcher, RunPolicy policy, Clock clock) {
        this.fetcher = fetcher;
        this.selectorConfigSource = selectorConfigSource;
        this.strategyChainFactory = strategyChainFactory;
        this.snapshotStore = snapshotStore;
        this.trendAnalyzer = trendAnalyzer;
        this.dealDetector = dealDetector;
        this.notificationDispatcher = notificationDispatcher;
        this.policy = policy;
        this.clock = clock;
    }

    public RunSummary run(List<TrackedItinerary> itineraries) {
        var context = new RunContext(UlidGenerator.generate(), clock.instant(), itineraries.size());
        var extractor = strategyChainFactory.create(selectorConfigSource.current());
        log.info("run.started: runId={}, tracked={}, workers={}, strategies={}",
                context.runId(), itineraries.size(), policy.workers(), extractor.strategyNames());

        var executor = Executors.newFixedThreadPool(policy.workers(), new CustomizableThreadFactory("scrape-worker-"));
        try {
            for (var itinerary : itineraries) {
                executor.submit(() -> process(itinerary, extractor, context));
            }
            executor.shutdown();
            if (!executor.awaitTermination(policy.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                context.cancel();
                log.warn("run.timeout: runId={}, timeout={}, waiting up to {} for in-flight itineraries",
                        context.runId(), policy.timeout(), policy.inFlightGrace());
                if (!executor.awaitTermination(policy.inFlightGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("run.grace-expired: runId={}, interrupting remaining workers", context.runId());
                    executor.shutdownNow();
                    // interrupted workers still record their outcome before the summary is built
                    if (!executor.awaitTermination(INTERRUPTED_WORKER_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.warn("run.workers-unresponsive: runId={}, summary may omit their itineraries",
                                context.runId());
                    }
                }
            }
        } catch (InterruptedException e) {
            context.cancel();
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            log.warn("run.interrupted: runId={}", context.runId());
        }

        var summary = context.toSummary(clock.instant(), policy);
        logSummary(summary);
        return summary;
    }

    void process(TrackedItinerary itinerary, StrategyChainExtractor extractor, RunContext context) {
        if (context.isCancelled()) {
            log.debug("Skipping itinerary {} after run cancellation", itinerary.id());
            return;
        }
        var stage = RunStage.FETCH;
        try {
            var fetched = fetcher.fetch(itinerary.toFetchTarget());
            if (!fetched.isSuccess()) {
                context.increment(fetched.error().kind() == FetchErrorKind.TRANSIENT
                        ? RunCounter.FETCH_FAILED_TRANSIENT
                        : RunCounter.FETCH_FAILED_PERMANENT);
                context.fail(itinerary.id(), RunStage.FETCH, fetched.error().kind() + ": " + fetched.error().message());
                return;
            }
            context.increment(RunCounter.FETCHED);

            stage = RunStage.EXTRACTION;
            var extraction = extractor.extract(fetched.capture(), itinerary.hints());
            if (!extraction.isSuccess()) {
                context.increment(RunCounter.EXTRACTION_FAILED);
                context.fail(itinerary.id(), RunStage.EXTRACTION, extraction.error().describe());
                return;
            }

            stage = RunStage.PERSISTENCE;
            var snapshot = extraction.snapshot();
            if (snapshotStore.append(snapshot) == AppendResult.DEDUPLICATED) {
                context.increment(RunCounter.DEDUPLICATED);
                return;
            }
            context.increment(RunCounter.NEW_SNAPSHOTS);

            stage = RunStage.ANALYSIS;
            var baseline = trendAnalyzer.baselineBefore(snapshot.itineraryKey(), snapshot.capturedAt());
            var deal = dealDetector.detect(snapshot, baseline);
            if (deal.isEmpty()) {
                return;
            }
            context.increment(RunCounter.DEALS_DETECTED);

            stage = RunStage.NOTIFICATION;
            switch (notificationDispatcher.dispatch(deal.get())) {
                case SENT -> context.increment(RunCounter.NOTIFICATIONS_SENT);
                case SUPPRESSED -> context.increment(RunCounter.NOTIFICATIONS_SUPPRESSED);
                case FAILED -> {
                    context.increment(RunCounter.NOTIFICATIONS_FAILED);
                    context.fail(itinerary.id(), RunStage.NOTIFICATION, "delivery failed for deal " + deal.get().id());
                }
            }
        } catch (SnapshotWriteFailedException e) {
            log.error("run.persistence-failed: itinerary={}, stage={}, reason={}", itinerary.id(), stage, e.getMessage(), e);
            context.increment(RunCounter.PERSISTENCE_FAILED);
            context.fail(itinerary.id(), RunStage.PERSISTENCE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("run.itinerary-failed: itinerary={}, stage={}, reason={}", itinerary.id(), stage, e.getMessage(), e);
            context.fail(itinerary.id(), stage, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            context.increment(RunCounter.PROCESSED);
        }
    }

    private void logSummary(RunSummary summary) {
        var message = "run.completed: runId={}, tracked={}, fetched={}, fetchFailedTransient={}, fetchFailedPermanent={}, "
                + "extractionFailed={}, deduplicated={}, newSnapshots={}, persistenceFailed={}, dealsDetected={}, "
                + "sent={}, suppressed={}, notificationFailed={}, skipped={}, siteStructureChangeSuspected={}";
        Object[] args = {summary.runId(), summary.tracked(), summary.fetched(), summary.fetchFailedTransient(),
                summary.fetchFailedPermanent(), summary.extractionFailed(), summary.deduplicated(),
                summary.newSnapshots(), summary.persistenceFailed(), summary.dealsDetected(),
                summary.notificationsSent(), summary.notificationsSuppressed(), summary.notificationsFailed(),
                summary.skipped(), summary.siteStructureChangeSuspected()};
        if (summary.siteStructureChangeSuspected()) {
            log.warn(message, args);
        } else {
            log.info(message, args);
        }
        summary.failures().forEach(failure -> log.info("run.failure: itinerary={}, stage={}, reason={}",
                failure.itineraryId(), failure.stage(), failure.reason()));
    }
}
