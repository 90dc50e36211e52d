package com.cruisetracker.tracker.domain.notification;

public enum NotificationStatus {
    SENT,
    FAILED
}
