package com.cruisetracker.tracker.domain.notification;

import com.cruisetracker.common.event.DealAlert;
import com.cruisetracker.common.id.UlidGenerator;
import com.cruisetracker.common.retry.RetryExecutor;
import com.cruisetracker.tracker.domain.deal.DealEvent;
import com.cruisetracker.tracker.domain.exceptions.NotificationTransportException;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers deals with per-itinerary suppression: while a SENT alert's dedup window is open, a new deal
 * for the same key goes out only if its score beats the sent one by more than the margin.
 * FAILED records never suppress.
 */
@Slf4j
public class NotificationDispatcher {

    private final NotificationChannel channel;
    private final NotificationRecordRepository recordRepository;
    private final DispatchPolicy policy;
    private final RetryExecutor retryExecutor;
    private final Clock clock;
    private final ConcurrentMap<ItineraryKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public NotificationDispatcher(NotificationChannel channel, NotificationRecordRepository recordRepository,
                                  DispatchPolicy policy, RetryExecutor retryExecutor, Clock clock) {
        this.channel = channel;
        this.recordRepository = recordRepository;
        this.policy = policy;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
    }

    public DispatchOutcome dispatch(DealEvent deal) {
        var lock = locks.computeIfAbsent(deal.itineraryKey(), k -> new ReentrantLock());
        lock.lock();
        try {
            return dispatchLocked(deal);
        } finally {
            lock.unlock();
        }
    }

    private DispatchOutcome dispatchLocked(DealEvent deal) {
        var now = clock.instant();
        var active = recordRepository.findLatestSent(deal.itineraryKey())
                .filter(record -> record.dedupWindowEnd().isAfter(now));
        if (active.isPresent() && deal.score().compareTo(active.get().score().add(policy.scoreMargin())) <= 0) {
            log.info("notification.suppressed: deal={}, key={}, score={}, previousScore={}, windowEnd={}",
                    deal.id(), deal.itineraryKey(), deal.score(), active.get().score(), active.get().dedupWindowEnd());
            return DispatchOutcome.SUPPRESSED;
        }

        var alert = toAlert(deal);
        var outcome = retryExecutor.execute(
                "notify " + deal.id() + " via " + channel.name(),
                () -> {
                    channel.deliver(alert);
                    return alert.dealEventId();
                },
                e -> e instanceof NotificationTransportException);

        var completedAt = clock.instant();
        var record = NotificationRecord.builder()
                .id(UlidGenerator.generate())
                .itineraryKey(deal.itineraryKey())
                .dealEventId(deal.id())
                .score(deal.score())
                .attempts(outcome.attempts())
                .sentAt(completedAt);

        if (outcome.isSuccess()) {
            recordRepository.save(record
                    .status(NotificationStatus.SENT)
                    .dedupWindowEnd(completedAt.plus(policy.dedupWindow()))
                    .build());
            log.info("notification.sent: deal={}, key={}, channel={}, attempts={}",
                    deal.id(), deal.itineraryKey(), channel.name(), outcome.attempts());
            return DispatchOutcome.SENT;
        }

        recordRepository.save(record
                .status(NotificationStatus.FAILED)
                .dedupWindowEnd(completedAt)
                .failureReason(outcome.failure().getMessage())
                .build());
        log.warn("notification.failed: deal={}, key={}, channel={}, attempts={}, reason={}",
                deal.id(), deal.itineraryKey(), channel.name(), outcome.attempts(), outcome.failure().getMessage());
        return DispatchOutcome.FAILED;
    }

    static DealAlert toAlert(DealEvent deal) {
        var snapshot = deal.triggeringSnapshot();
        var baseline = deal.baselineAtDetection();
        return DealAlert.builder()
                .dealEventId(deal.id())
                .itineraryKey(deal.itineraryKey().value())
                .ship(snapshot.ship())
                .departurePort(snapshot.departurePort())
                .sailDate(snapshot.sailDate())
                .nights(snapshot.nights())
                .cabinCategory(snapshot.cabinCategory().name())
                .price(snapshot.price())
                .currency(snapshot.currency())
                .rollingMinimum(baseline.rollingMinimum())
                .baselineMean(baseline.mean())
                .dropRatio(deal.dropRatio())
                .score(deal.score())
                .trigger(deal.trigger().name())
                .capturedAt(snapshot.capturedAt())
                .detectedAt(deal.detectedAt())
                .build();
    }
}
