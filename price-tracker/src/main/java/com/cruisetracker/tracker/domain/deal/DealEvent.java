package com.cruisetracker.tracker.domain.deal;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.cruisetracker.tracker.domain.trend.Baseline;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record DealEvent(
        String id,
        ItineraryKey itineraryKey,
        Snapshot triggeringSnapshot,
        Baseline baselineAtDetection,
        BigDecimal dropRatio,
        BigDecimal score,
        DealTrigger trigger,
        Instant detectedAt
) {
}
