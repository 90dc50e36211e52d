package com.cruisetracker.tracker.domain.run;

public enum RunCounter {
    FETCHED,
    FETCH_FAILED_TRANSIENT,
    FETCH_FAILED_PERMANENT,
    EXTRACTION_FAILED,
    DEDUPLICATED,
    NEW_SNAPSHOTS,
    PERSISTENCE_FAILED,
    DEALS_DETECTED,
    NOTIFICATIONS_SENT,
    NOTIFICATIONS_SUPPRESSED,
    NOTIFICATIONS_FAILED,
    PROCESSED
}
