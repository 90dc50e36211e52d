package com.cruisetracker.tracker.domain.fetch;

import java.io.IOException;

/**
 * Domain port for a single HTTP round trip. Implementations return every status code
 * as a {@link PageResponse} and throw {@link IOException} only when no response arrived.
 */
public interface PageClient {

    PageResponse get(FetchTarget target) throws IOException;
}
