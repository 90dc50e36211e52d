package com.cruisetracker.tracker.domain.extraction;

public enum ExtractionErrorKind {
    NO_STRATEGY_MATCHED,
    VALIDATION_FAILED
}
