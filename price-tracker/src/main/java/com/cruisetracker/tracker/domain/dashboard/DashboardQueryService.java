package com.cruisetracker.tracker.domain.dashboard;

import com.cruisetracker.tracker.domain.deal.DealEvent;
import com.cruisetracker.tracker.domain.deal.DealEventRepository;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.notification.NotificationRecord;
import com.cruisetracker.tracker.domain.notification.NotificationRecordRepository;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only queries for a dashboard or report.
 */
@Service
@RequiredArgsConstructor
public class DashboardQueryService {

    private static final Comparator<NotificationRecord> LATEST_SENT =
            Comparator.comparing(NotificationRecord::sentAt).thenComparing(NotificationRecord::id);

    private final SnapshotStore snapshotStore;
    private final DealEventRepository dealEventRepository;
    private final NotificationRecordRepository notificationRecordRepository;
    private final Clock clock;

    public List<Snapshot> latestSnapshots() {
        return snapshotStore.latestPerItinerary();
    }

    public List<Snapshot> history(ItineraryKey key) {
        return snapshotStore.history(key);
    }

    /**
     * Deals whose SENT notification is still inside its dedup window, newest first. A deeper deal
     * notified later for the same itinerary supersedes the earlier one.
     */
    public List<DealEvent> currentDeals() {
        var ids = notificationRecordRepository.findActiveSent(clock.instant()).stream()
                .collect(Collectors.toMap(NotificationRecord::itineraryKey, Function.identity(),
                        BinaryOperator.maxBy(LATEST_SENT)))
                .values().stream()
                .map(NotificationRecord::dealEventId)
                .toList();
        if (ids.isEmpty()) {
            return List.of();
        }
        return dealEventRepository.findByIds(ids).stream()
                .sorted(Comparator.comparing(DealEvent::detectedAt).reversed())
                .toList();
    }
}
