package com.cruisetracker.tracker.infrastructure.http;

import com.cruisetracker.tracker.domain.fetch.FetchTarget;
import com.cruisetracker.tracker.domain.fetch.PageClient;
import com.cruisetracker.tracker.domain.fetch.PageResponse;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Plain GET over {@link RestClient}. Every status is returned to the caller for classification;
 * only connection-level failures surface as {@link IOException}.
 */
@Component
public class RestClientPageClient implements PageClient {

    private final RestClient restClient;

    public RestClientPageClient(@Qualifier("pageRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public PageResponse get(FetchTarget target) throws IOException {
        try {
            return restClient.get()
                    .uri(target.url())
                    .headers(headers -> target.headers().forEach(headers::set))
                    .exchange((request, response) -> new PageResponse(
                            response.getStatusCode().value(),
                            decode(response.getBody().readAllBytes(), response.getHeaders().getContentType(), target.url())));
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException(e.getMessage(), e);
        }
    }

    /**
     * Uses the charset declared in {@code Content-Type}; otherwise the one jsoup detects from a
     * byte-order mark or {@code <meta charset>}, which falls back to UTF-8.
     */
    static String decode(byte[] body, MediaType contentType, URI url) throws IOException {
        if (contentType != null && contentType.getCharset() != null) {
            return new String(body, contentType.getCharset());
        }
        try (var in = new ByteArrayInputStream(body)) {
            var charset = Jsoup.parse(in, null, url.toString()).charset();
            return new String(body, charset);
        }
    }
}
