package com.cruisetracker.tracker.domain.itinerary;

import com.cruisetracker.tracker.domain.extraction.ExtractionHints;
import com.cruisetracker.tracker.domain.fetch.FetchTarget;
import java.net.URI;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;

/**
 * A sailing the operator asked to follow: where to fetch it and what the page is expected to describe.
 */
@Builder(toBuilder = true)
public record TrackedItinerary(
        String id,
        URI url,
        Map<String, String> headers,
        LocalDate sailDate,
        CabinCategory cabinCategory
) {

    public TrackedItinerary {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public FetchTarget toFetchTarget() {
        return new FetchTarget(id, url, headers);
    }

    public ExtractionHints hints() {
        return new ExtractionHints(sailDate, cabinCategory);
    }
}
