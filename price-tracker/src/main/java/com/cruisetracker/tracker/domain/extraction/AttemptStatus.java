package com.cruisetracker.tracker.domain.extraction;

public enum AttemptStatus {
    NOT_APPLICABLE,
    VALIDATION_FAILED
}
