package com.cruisetracker.tracker.domain.run;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record RunSummary(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        int tracked,
        int fetched,
        int fetchFailedTransient,
        int fetchFailedPermanent,
        int extractionFailed,
        int deduplicated,
        int newSnapshots,
        int persistenceFailed,
        int dealsDetected,
        int notificationsSent,
        int notificationsSuppressed,
        int notificationsFailed,
        int skipped,
        List<ItineraryFailure> failures,
        boolean siteStructureChangeSuspected
) {

    public RunSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
