package com.cruisetracker.tracker.infrastructure.db.snapshot;

import com.cruisetracker.tracker.domain.exceptions.SnapshotStoreUnavailableException;
import com.cruisetracker.tracker.domain.exceptions.SnapshotWriteFailedException;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.cruisetracker.tracker.domain.snapshot.SnapshotRepository;
import com.cruisetracker.tracker.infrastructure.db.snapshot.mapper.SnapshotRowMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class SnapshotRepositoryAdapter implements SnapshotRepository {

    private final SnapshotJpaRepository jpaRepository;
    private final SnapshotRowMapper mapper;

    @Override
    @Transactional
    public boolean insert(Snapshot snapshot, String dedupKey) {
        var row = mapper.toRow(snapshot);
        row.setDedupKey(dedupKey);
        try {
            return jpaRepository.insertIdempotent(row) > 0;
        } catch (DataAccessException e) {
            throw SnapshotWriteFailedException.of("snapshot", snapshot.id(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Snapshot> findLatest(ItineraryKey key) {
        return jpaRepository.findFirstByItineraryKeyOrderByCapturedAtDescIdDesc(key.value()).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Snapshot> findBetween(ItineraryKey key, Instant from, Instant to) {
        return jpaRepository.findBetween(key.value(), from, to).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Snapshot> findAll(ItineraryKey key) {
        return jpaRepository.findByItineraryKeyOrderByCapturedAtAscIdAsc(key.value()).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Snapshot> findRecent(ItineraryKey key, Instant notBefore, Instant before, int limit) {
        var newestFirst = jpaRepository.findRecentDescending(key.value(), notBefore, before, PageRequest.of(0, limit));
        var snapshots = new ArrayList<Snapshot>(newestFirst.size());
        newestFirst.forEach(row -> snapshots.add(mapper.toDomain(row)));
        Collections.reverse(snapshots);
        return snapshots;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Snapshot> findLatestPerItinerary() {
        return jpaRepository.findLatestPerItinerary().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Snapshot> findAllOrdered() {
        return jpaRepository.findAllByOrderByCapturedAtAscIdAsc().stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public void verifyAvailable() {
        try {
            jpaRepository.count();
        } catch (DataAccessException e) {
            throw SnapshotStoreUnavailableException.of(e);
        }
    }
}
