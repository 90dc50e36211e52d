package com.cruisetracker.tracker.infrastructure.db.notification;

import com.cruisetracker.tracker.domain.notification.NotificationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "notification_records")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRecordRow {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "itinerary_key", nullable = false)
    private String itineraryKey;

    @Column(name = "deal_event_id", nullable = false, length = 26)
    private String dealEventId;

    @Column(nullable = false, precision = 8, scale = 4)
    private BigDecimal score;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private NotificationStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    @Column(name = "dedup_window_end", nullable = false)
    private Instant dedupWindowEnd;

    @Column(name = "failure_reason", length = 1024)
    private String failureReason;
}
