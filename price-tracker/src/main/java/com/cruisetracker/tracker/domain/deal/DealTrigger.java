package com.cruisetracker.tracker.domain.deal;

public enum DealTrigger {
    RECORD_LOW,
    STATISTICAL_DIP,
    BOTH
}
