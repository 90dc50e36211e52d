package com.cruisetracker.tracker.application.cli;

import com.cruisetracker.tracker.domain.run.RunSummary;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RunMetricsRecorder {

    private final Counter runsCompletedCounter;
    private final Counter snapshotsStoredCounter;
    private final Counter snapshotsDeduplicatedCounter;
    private final Counter fetchFailedCounter;
    private final Counter extractionFailedCounter;
    private final Counter dealsDetectedCounter;
    private final Counter notificationsSentCounter;
    private final Counter notificationsSuppressedCounter;
    private final Counter notificationsFailedCounter;

    public void record(RunSummary summary) {
        runsCompletedCounter.increment();
        snapshotsStoredCounter.increment(summary.newSnapshots());
        snapshotsDeduplicatedCounter.increment(summary.deduplicated());
        fetchFailedCounter.increment(summary.fetchFailedTransient() + summary.fetchFailedPermanent());
        extractionFailedCounter.increment(summary.extractionFailed());
        dealsDetectedCounter.increment(summary.dealsDetected());
        notificationsSentCounter.increment(summary.notificationsSent());
        notificationsSuppressedCounter.increment(summary.notificationsSuppressed());
        notificationsFailedCounter.increment(summary.notificationsFailed());
    }
}
