package com.cruisetracker.tracker.infrastructure.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import com.cruisetracker.common.event.DealAlert;
import com.cruisetracker.common.kafka.KafkaTopics;
import com.cruisetracker.tracker.domain.exceptions.NotificationTransportException;
import com.cruisetracker.tracker.support.TestProperties;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
class KafkaNotificationChannelTest {

    private static final String KEY = "OASIS-OF-THE-SEAS|CAPE-LIBERTY-NJ|2026-06-07|INTERIOR";

    private static final DealAlert ALERT = DealAlert.builder()
            .dealEventId("01JDEALEVENT")
            .itineraryKey(KEY)
            .ship("Oasis of the Seas")
            .departurePort("Cape Liberty, NJ")
            .sailDate(LocalDate.of(2026, 6, 7))
            .nights(7)
            .cabinCategory("INTERIOR")
            .price(new BigDecimal("799.00"))
            .currency("USD")
            .rollingMinimum(new BigDecimal("1000.00"))
            .score(new BigDecimal("0.2010"))
            .trigger("RECORD_LOW")
            .capturedAt(Instant.parse("2026-02-01T06:00:00Z"))
            .detectedAt(Instant.parse("2026-02-01T06:00:05Z"))
            .build();

    @Mock
    private KafkaTemplate<String, DealAlert> kafkaTemplate;

    private KafkaNotificationChannel channel;

    @BeforeEach
    void setUp() {
        // delivery timeout in the test defaults is 200ms
        channel = new KafkaNotificationChannel(kafkaTemplate, TestProperties.defaults());
    }

    @Test
    void shouldPublishKeyedByItinerary() {
        // given
        var record = new ProducerRecord<>(KafkaTopics.DEAL_ALERTS, KEY, ALERT);
        var metadata = new RecordMetadata(new TopicPartition(KafkaTopics.DEAL_ALERTS, 0), 0L, 0, 0L, 0, 0);
        given(kafkaTemplate.send(KafkaTopics.DEAL_ALERTS, KEY, ALERT))
                .willReturn(CompletableFuture.completedFuture(new SendResult<>(record, metadata)));

        // when / then
        assertThatCode(() -> channel.deliver(ALERT)).doesNotThrowAnyException();
        then(kafkaTemplate).should().send(KafkaTopics.DEAL_ALERTS, KEY, ALERT);
    }

    @Test
    void shouldWrapBrokerFailure() {
        // given
        given(kafkaTemplate.send(KafkaTopics.DEAL_ALERTS, KEY, ALERT))
                .willReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        // when / then
        assertThatThrownBy(() -> channel.deliver(ALERT))
                .isInstanceOf(NotificationTransportException.class)
                .hasMessageContaining("broker unavailable");
    }

    @Test
    void shouldGiveUpWhenAcknowledgementTimesOut() {
        // given
        given(kafkaTemplate.send(KafkaTopics.DEAL_ALERTS, KEY, ALERT)).willReturn(new CompletableFuture<>());

        // when / then
        assertThatThrownBy(() -> channel.deliver(ALERT))
                .isInstanceOf(NotificationTransportException.class)
                .hasMessageContaining("kafka");
    }
}
