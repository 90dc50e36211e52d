package com.cruisetracker.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;

/**
 * Outbound deal notification. {@code dealEventId} doubles as the idempotency key for
 * downstream mailers.
 */
@Builder(toBuilder = true)
public record DealAlert(
        @JsonProperty("deal_event_id") String dealEventId,
        @JsonProperty("itinerary_key") String itineraryKey,
        String ship,
        @JsonProperty("departure_port") String departurePort,
        @JsonProperty("sail_date") LocalDate sailDate,
        int nights,
        @JsonProperty("cabin_category") String cabinCategory,
        BigDecimal price,
        String currency,
        @JsonProperty("rolling_minimum") BigDecimal rollingMinimum,
        @JsonProperty("baseline_mean") BigDecimal baselineMean,
        @JsonProperty("drop_ratio") BigDecimal dropRatio,
        BigDecimal score,
        String trigger,
        @JsonProperty("captured_at") Instant capturedAt,
        @JsonProperty("detected_at") Instant detectedAt) {}
