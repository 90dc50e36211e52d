package com.cruisetracker.tracker.infrastructure.db.deal;

import com.cruisetracker.tracker.domain.deal.DealEvent;
import com.cruisetracker.tracker.domain.deal.DealEventRepository;
import com.cruisetracker.tracker.domain.exceptions.SnapshotWriteFailedException;
import com.cruisetracker.tracker.infrastructure.db.deal.mapper.DealEventRowMapper;
import com.cruisetracker.tracker.infrastructure.db.snapshot.SnapshotJpaRepository;
import com.cruisetracker.tracker.infrastructure.db.snapshot.SnapshotRow;
import com.cruisetracker.tracker.infrastructure.db.snapshot.mapper.SnapshotRowMapper;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class DealEventRepositoryAdapter implements DealEventRepository {

    private final DealEventJpaRepository jpaRepository;
    private final SnapshotJpaRepository snapshotJpaRepository;
    private final DealEventRowMapper mapper;
    private final SnapshotRowMapper snapshotMapper;

    @Override
    @Transactional
    public void save(DealEvent event) {
        try {
            jpaRepository.insertIdempotent(mapper.toRow(event));
        } catch (DataAccessException e) {
            throw SnapshotWriteFailedException.of("deal event", event.id(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DealEvent> findByIds(Collection<String> ids) {
        var rows = jpaRepository.findAllById(ids);
        var snapshotIds = rows.stream().map(DealEventRow::getSnapshotId).toList();
        var snapshots = snapshotJpaRepository.findAllById(snapshotIds).stream()
                .collect(Collectors.toMap(SnapshotRow::getId, Function.identity()));
        return rows.stream()
                .filter(row -> snapshots.containsKey(row.getSnapshotId()))
                .map(row -> mapper.toDomain(row, snapshotMapper.toDomain(snapshots.get(row.getSnapshotId()))))
                .toList();
    }
}
