package com.cruisetracker.tracker.domain.run;

public record ItineraryFailure(String itineraryId, RunStage stage, String reason) {
}
