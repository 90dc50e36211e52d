package com.cruisetracker.tracker.domain.trend;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record Baseline(
        ItineraryKey itineraryKey,
        BigDecimal rollingMinimum,
        BigDecimal mean,
        BigDecimal standardDeviation,
        int sampleCount,
        Instant windowStart,
        Instant windowEnd,
        boolean insufficientData
) {
}
