package com.cruisetracker.tracker.domain.run;

public enum RunStage {
    FETCH,
    EXTRACTION,
    PERSISTENCE,
    ANALYSIS,
    NOTIFICATION
}
