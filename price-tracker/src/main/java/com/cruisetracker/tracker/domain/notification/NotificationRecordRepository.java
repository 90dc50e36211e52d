package com.cruisetracker.tracker.domain.notification;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface NotificationRecordRepository {

    void save(NotificationRecord record);

    Optional<NotificationRecord> findLatestSent(ItineraryKey key);

    /** SENT records whose dedup window is still open at {@code now}. */
    List<NotificationRecord> findActiveSent(Instant now);
}
