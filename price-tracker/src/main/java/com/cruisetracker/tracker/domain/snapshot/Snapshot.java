package com.cruisetracker.tracker.domain.snapshot;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;

@Builder(toBuilder = true)
public record Snapshot(
        String id,
        ItineraryKey itineraryKey,
        BigDecimal price,
        String currency,
        String ship,
        String departurePort,
        int nights,
        LocalDate sailDate,
        CabinCategory cabinCategory,
        Instant capturedAt,
        String sourceStrategy
) {
}
