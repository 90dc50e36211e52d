package com.cruisetracker.tracker.domain.exceptions;

public class NotificationTransportException extends RuntimeException {

    private NotificationTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NotificationTransportException of(String channel, Throwable cause) {
        return new NotificationTransportException("Delivery over " + channel + " failed: " + cause.getMessage(), cause);
    }

    public static NotificationTransportException rejected(String channel, int status) {
        return new NotificationTransportException("Delivery over " + channel + " rejected with status " + status, null);
    }
}
