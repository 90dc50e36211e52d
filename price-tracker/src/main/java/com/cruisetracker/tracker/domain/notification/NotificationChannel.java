package com.cruisetracker.tracker.domain.notification;

import com.cruisetracker.common.event.DealAlert;

/**
 * Transport for deal alerts. Implementations throw
 * {@link com.cruisetracker.tracker.domain.exceptions.NotificationTransportException} on any delivery failure.
 */
public interface NotificationChannel {

    String name();

    void deliver(DealAlert alert);
}
