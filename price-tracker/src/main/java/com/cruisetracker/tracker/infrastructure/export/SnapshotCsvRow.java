package com.cruisetracker.tracker.infrastructure.export;

import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"captured_at", "snapshot_id", "itinerary_key", "ship", "departure_port", "sail_date",
        "nights", "cabin_category", "price", "currency", "source_strategy"})
public record SnapshotCsvRow(
        @JsonProperty("captured_at") String capturedAt,
        @JsonProperty("snapshot_id") String snapshotId,
        @JsonProperty("itinerary_key") String itineraryKey,
        @JsonProperty("ship") String ship,
        @JsonProperty("departure_port") String departurePort,
        @JsonProperty("sail_date") String sailDate,
        @JsonProperty("nights") int nights,
        @JsonProperty("cabin_category") String cabinCategory,
        @JsonProperty("price") String price,
        @JsonProperty("currency") String currency,
        @JsonProperty("source_strategy") String sourceStrategy
) {

    static SnapshotCsvRow from(Snapshot snapshot) {
        return new SnapshotCsvRow(
                snapshot.capturedAt().toString(),
                snapshot.id(),
                snapshot.itineraryKey().value(),
                snapshot.ship(),
                snapshot.departurePort(),
                snapshot.sailDate().toString(),
                snapshot.nights(),
                snapshot.cabinCategory().name(),
                snapshot.price().toPlainString(),
                snapshot.currency(),
                snapshot.sourceStrategy());
    }
}
