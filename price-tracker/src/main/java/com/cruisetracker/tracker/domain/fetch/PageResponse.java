package com.cruisetracker.tracker.domain.fetch;

public record PageResponse(int status, String body) {
}
