package com.cruisetracker.tracker.support;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.notification.NotificationRecord;
import com.cruisetracker.tracker.domain.notification.NotificationRecordRepository;
import com.cruisetracker.tracker.domain.notification.NotificationStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class InMemoryNotificationRecordRepository implements NotificationRecordRepository {

    private final List<NotificationRecord> records = new ArrayList<>();

    @Override
    public synchronized void save(NotificationRecord record) {
        records.add(record);
    }

    @Override
    public synchronized Optional<NotificationRecord> findLatestSent(ItineraryKey key) {
        return records.stream()
                .filter(r -> r.itineraryKey().equals(key) && r.status() == NotificationStatus.SENT)
                .max(Comparator.comparing(NotificationRecord::sentAt));
    }

    @Override
    public synchronized List<NotificationRecord> findActiveSent(Instant now) {
        return records.stream()
                .filter(r -> r.status() == NotificationStatus.SENT && r.dedupWindowEnd().isAfter(now))
                .toList();
    }

    public synchronized List<NotificationRecord> all() {
        return List.copyOf(records);
    }
}
