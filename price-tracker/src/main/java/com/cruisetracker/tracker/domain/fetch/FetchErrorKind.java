package com.cruisetracker.tracker.domain.fetch;

public enum FetchErrorKind {
    TRANSIENT,
    PERMANENT
}
