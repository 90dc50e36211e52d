package com.cruisetracker.tracker.domain.extraction;

import java.util.List;

public record StrategyAttempt(String strategy, AttemptStatus status, List<String> reasons) {

    public StrategyAttempt {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static StrategyAttempt notApplicable(String strategy, String reason) {
        return new StrategyAttempt(strategy, AttemptStatus.NOT_APPLICABLE, reason == null ? List.of() : List.of(reason));
    }

    public static StrategyAttempt validationFailed(String strategy, List<String> reasons) {
        return new StrategyAttempt(strategy, AttemptStatus.VALIDATION_FAILED, reasons);
    }

    @Override
    public String toString() {
        return reasons.isEmpty() ? strategy + ":" + status : strategy + ":" + status + reasons;
    }
}
