package com.cruisetracker.tracker.infrastructure.notification;

import com.cruisetracker.common.event.DealAlert;
import com.cruisetracker.tracker.domain.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Dry-run channel: the alert is only logged.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "tracker.notification", name = "channel", havingValue = "log")
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void deliver(DealAlert alert) {
        log.info("deal.alert: id={}, ship={}, port={}, sailDate={}, cabin={}, price={} {}, min={}, score={}, trigger={}",
                alert.dealEventId(), alert.ship(), alert.departurePort(), alert.sailDate(), alert.cabinCategory(),
                alert.price(), alert.currency(), alert.rollingMinimum(), alert.score(), alert.trigger());
    }
}
