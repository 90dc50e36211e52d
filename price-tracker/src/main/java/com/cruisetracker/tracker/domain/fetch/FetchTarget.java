package com.cruisetracker.tracker.domain.fetch;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

public record FetchTarget(String itineraryId, URI url, Map<String, String> headers) {

    public FetchTarget {
        Objects.requireNonNull(itineraryId, "itineraryId");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String host() {
        return url.getHost() == null ? "" : url.getHost();
    }
}
