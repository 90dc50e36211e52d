package com.cruisetracker.tracker.domain.snapshot;

public enum AppendResult {
    STORED,
    DEDUPLICATED
}
