package com.cruisetracker.tracker.infrastructure.db.capture;

import com.cruisetracker.tracker.domain.exceptions.SnapshotWriteFailedException;
import com.cruisetracker.tracker.domain.fetch.RawCapture;
import com.cruisetracker.tracker.domain.snapshot.RawCaptureRepository;
import com.cruisetracker.tracker.infrastructure.db.capture.mapper.RawCaptureRowMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class RawCaptureRepositoryAdapter implements RawCaptureRepository {

    private static final int MAX_ERROR_LENGTH = 1024;

    private final RawCaptureJpaRepository jpaRepository;
    private final RawCaptureRowMapper mapper;

    @Override
    @Transactional
    public void insert(RawCapture capture) {
        var row = mapper.toRow(capture);
        if (row.getError() != null && row.getError().length() > MAX_ERROR_LENGTH) {
            row.setError(row.getError().substring(0, MAX_ERROR_LENGTH));
        }
        try {
            jpaRepository.insert(row);
        } catch (DataAccessException e) {
            throw SnapshotWriteFailedException.of("raw capture", capture.id(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<RawCapture> findByItinerary(String itineraryId) {
        return jpaRepository.findByItineraryIdOrderByCapturedAtAsc(itineraryId).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
