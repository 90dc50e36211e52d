package com.cruisetracker.tracker.infrastructure.db.notification;

import com.cruisetracker.tracker.domain.notification.NotificationStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationRecordJpaRepository extends JpaRepository<NotificationRecordRow, String> {

    Optional<NotificationRecordRow> findFirstByItineraryKeyAndStatusOrderBySentAtDesc(String itineraryKey, NotificationStatus status);

    List<NotificationRecordRow> findByStatusAndDedupWindowEndAfterOrderBySentAtDesc(NotificationStatus status, Instant now);
}
