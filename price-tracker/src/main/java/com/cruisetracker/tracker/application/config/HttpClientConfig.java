package com.cruisetracker.tracker.application.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClient pageRestClient(TrackerProperties properties) {
        var fetch = properties.fetch();
        return RestClient.builder()
                .requestFactory(requestFactory(fetch.connectTimeout(), fetch.readTimeout()))
                .defaultHeader(HttpHeaders.USER_AGENT, fetch.userAgent())
                .build();
    }

    @Bean
    public RestClient webhookRestClient(TrackerProperties properties) {
        var timeout = properties.notification().deliveryTimeout();
        return RestClient.builder()
                .requestFactory(requestFactory(timeout, timeout))
                .build();
    }

    private static JdkClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        var factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
