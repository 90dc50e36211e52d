package com.cruisetracker.tracker.domain.notification;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record NotificationRecord(
        String id,
        ItineraryKey itineraryKey,
        String dealEventId,
        BigDecimal score,
        NotificationStatus status,
        int attempts,
        Instant sentAt,
        Instant dedupWindowEnd,
        String failureReason
) {
}
