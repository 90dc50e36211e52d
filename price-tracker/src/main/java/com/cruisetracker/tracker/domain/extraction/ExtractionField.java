package com.cruisetracker.tracker.domain.extraction;

public enum ExtractionField {
    PRICE,
    CURRENCY,
    SHIP,
    DEPARTURE_PORT,
    NIGHTS,
    SAIL_DATE,
    CABIN_CATEGORY
}
