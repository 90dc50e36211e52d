package com.cruisetracker.tracker.domain.fetch;

import java.time.Instant;
import lombok.Builder;

/**
 * Unparsed fetched content and its fetch metadata. Recorded for every fetch, including failed
 * ones ({@code httpStatus} 0 when no response arrived).
 */
@Builder(toBuilder = true)
public record RawCapture(
        String id,
        String itineraryId,
        String url,
        int httpStatus,
        String content,
        int attempts,
        String error,
        Instant capturedAt
) {
}
