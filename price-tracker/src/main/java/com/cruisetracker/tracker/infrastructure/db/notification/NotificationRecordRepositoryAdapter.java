package com.cruisetracker.tracker.infrastructure.db.notification;

import com.cruisetracker.tracker.domain.exceptions.SnapshotWriteFailedException;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.notification.NotificationRecord;
import com.cruisetracker.tracker.domain.notification.NotificationRecordRepository;
import com.cruisetracker.tracker.domain.notification.NotificationStatus;
import com.cruisetracker.tracker.infrastructure.db.notification.mapper.NotificationRecordRowMapper;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class NotificationRecordRepositoryAdapter implements NotificationRecordRepository {

    private static final int MAX_REASON_LENGTH = 1024;

    private final NotificationRecordJpaRepository jpaRepository;
    private final NotificationRecordRowMapper mapper;

    @Override
    @Transactional
    public void save(NotificationRecord record) {
        var row = mapper.toRow(record);
        if (row.getFailureReason() != null && row.getFailureReason().length() > MAX_REASON_LENGTH) {
            row.setFailureReason(row.getFailureReason().substring(0, MAX_REASON_LENGTH));
        }
        try {
            jpaRepository.save(row);
        } catch (DataAccessException e) {
            throw SnapshotWriteFailedException.of("notification record", record.id(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<NotificationRecord> findLatestSent(ItineraryKey key) {
        return jpaRepository.findFirstByItineraryKeyAndStatusOrderBySentAtDesc(key.value(), NotificationStatus.SENT)
                .map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<NotificationRecord> findActiveSent(Instant now) {
        return jpaRepository.findByStatusAndDedupWindowEndAfterOrderBySentAtDesc(NotificationStatus.SENT, now).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
