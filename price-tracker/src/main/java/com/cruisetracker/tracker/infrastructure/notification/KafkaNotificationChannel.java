package com.cruisetracker.tracker.infrastructure.notification;

import com.cruisetracker.common.event.DealAlert;
import com.cruisetracker.common.kafka.KafkaTopics;
import com.cruisetracker.tracker.application.config.TrackerProperties;
import com.cruisetracker.tracker.domain.exceptions.NotificationTransportException;
import com.cruisetracker.tracker.domain.notification.NotificationChannel;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes deal alerts to {@link KafkaTopics#DEAL_ALERTS}, keyed by itinerary key, and waits for the
 * broker acknowledgement so that a failed send can be retried by the dispatcher.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "tracker.notification", name = "channel", havingValue = "kafka", matchIfMissing = true)
public class KafkaNotificationChannel implements NotificationChannel {

    private final KafkaTemplate<String, DealAlert> kafkaTemplate;
    private final Duration deliveryTimeout;

    public KafkaNotificationChannel(KafkaTemplate<String, DealAlert> kafkaTemplate, TrackerProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.deliveryTimeout = properties.notification().deliveryTimeout();
    }

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public void deliver(DealAlert alert) {
        try {
            var result = kafkaTemplate.send(KafkaTopics.DEAL_ALERTS, alert.itineraryKey(), alert)
                    .get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Produced DealAlert {} to partition {}", alert.dealEventId(), result.getRecordMetadata().partition());
        } catch (ExecutionException e) {
            throw NotificationTransportException.of(name(), e.getCause() == null ? e : e.getCause());
        } catch (TimeoutException | KafkaException e) {
            throw NotificationTransportException.of(name(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw NotificationTransportException.of(name(), e);
        }
    }
}
