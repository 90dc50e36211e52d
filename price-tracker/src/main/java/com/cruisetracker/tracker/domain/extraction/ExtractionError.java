package com.cruisetracker.tracker.domain.extraction;

import java.util.List;

public record ExtractionError(ExtractionErrorKind kind, List<StrategyAttempt> attempts) {

    public ExtractionError {
        attempts = List.copyOf(attempts);
    }

    public static ExtractionError noStrategyMatched(List<StrategyAttempt> attempts) {
        return new ExtractionError(ExtractionErrorKind.NO_STRATEGY_MATCHED, attempts);
    }

    public String describe() {
        return kind + " " + attempts;
    }
}
