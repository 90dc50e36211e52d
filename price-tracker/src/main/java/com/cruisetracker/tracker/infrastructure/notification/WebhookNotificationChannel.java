package com.cruisetracker.tracker.infrastructure.notification;

import com.cruisetracker.common.event.DealAlert;
import com.cruisetracker.common.json.JacksonConfig;
import com.cruisetracker.tracker.domain.exceptions.NotificationTransportException;
import com.cruisetracker.tracker.domain.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.databind.ObjectMapper;

/**
 * POSTs the alert as JSON to {@code NOTIFY_WEBHOOK_URL} with the bearer token from {@code NOTIFY_WEBHOOK_TOKEN}.
 * The deal event id travels as the {@code Idempotency-Key} header.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "tracker.notification", name = "channel", havingValue = "webhook")
public class WebhookNotificationChannel implements NotificationChannel {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final RestClient restClient;
    private final NotificationCredentials credentials;
    private final ObjectMapper objectMapper;

    public WebhookNotificationChannel(@Qualifier("webhookRestClient") RestClient restClient, NotificationCredentials credentials) {
        if (!credentials.hasWebhook()) {
            throw new IllegalStateException("Webhook channel selected but " + NotificationCredentials.WEBHOOK_URL_ENV + " is not set");
        }
        this.restClient = restClient;
        this.credentials = credentials;
        this.objectMapper = JacksonConfig.createObjectMapper();
        log.info("Webhook channel configured with {}", credentials);
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public void deliver(DealAlert alert) {
        int status;
        try {
            status = restClient.post()
                    .uri(credentials.webhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(IDEMPOTENCY_HEADER, alert.dealEventId())
                    .headers(headers -> {
                        if (credentials.webhookToken() != null) {
                            headers.setBearerAuth(credentials.webhookToken());
                        }
                    })
                    .body(objectMapper.writeValueAsString(alert))
                    .exchange((request, response) -> response.getStatusCode().value());
        } catch (RestClientException e) {
            throw NotificationTransportException.of(name(), e);
        }
        if (status < 200 || status >= 300) {
            throw NotificationTransportException.rejected(name(), status);
        }
    }
}
