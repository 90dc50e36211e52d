package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import java.util.List;

/**
 * Outcome of running the strategy chain over one capture: a snapshot candidate, or the reasons every
 * strategy gave up. {@code attempts} lists the strategies tried before the winner, if any.
 */
public record ExtractionResult(Snapshot snapshot, ExtractionError error, List<StrategyAttempt> attempts) {

    public static ExtractionResult success(Snapshot snapshot, List<StrategyAttempt> attempts) {
        return new ExtractionResult(snapshot, null, List.copyOf(attempts));
    }

    public static ExtractionResult failure(ExtractionError error) {
        return new ExtractionResult(null, error, error.attempts());
    }

    public boolean isSuccess() {
        return snapshot != null;
    }
}
