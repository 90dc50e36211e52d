package com.cruisetracker.tracker.domain.notification;

public enum DispatchOutcome {
    SENT,
    SUPPRESSED,
    FAILED
}
