package com.cruisetracker.tracker.infrastructure.notification;

import java.net.URI;
import java.util.Map;

/**
 * Webhook credentials read once from the environment at start-up. {@link #toString()} never
 * reveals the token.
 */
public record NotificationCredentials(URI webhookUrl, String webhookToken) {

    static final String WEBHOOK_URL_ENV = "NOTIFY_WEBHOOK_URL";
    static final String WEBHOOK_TOKEN_ENV = "NOTIFY_WEBHOOK_TOKEN";

    public static NotificationCredentials fromEnvironment(Map<String, String> environment) {
        var url = environment.get(WEBHOOK_URL_ENV);
        var token = environment.get(WEBHOOK_TOKEN_ENV);
        return new NotificationCredentials(
                url == null || url.isBlank() ? null : URI.create(url.trim()),
                token == null || token.isBlank() ? null : token.trim());
    }

    public boolean hasWebhook() {
        return webhookUrl != null;
    }

    @Override
    public String toString() {
        return "NotificationCredentials[webhookUrl=" + (webhookUrl == null ? "unset" : webhookUrl.getHost())
                + ", webhookToken=" + (webhookToken == null ? "unset" : "****") + "]";
    }
}
