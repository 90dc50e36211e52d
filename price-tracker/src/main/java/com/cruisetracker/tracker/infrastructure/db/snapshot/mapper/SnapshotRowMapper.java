package com.cruisetracker.tracker.infrastructure.db.snapshot.mapper;

import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.cruisetracker.tracker.infrastructure.db.ItineraryKeyMapper;
import com.cruisetracker.tracker.infrastructure.db.snapshot.SnapshotRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring", uses = ItineraryKeyMapper.class)
public interface SnapshotRowMapper {

    @Mapping(target = "dedupKey", ignore = true)
    SnapshotRow toRow(Snapshot snapshot);

    Snapshot toDomain(SnapshotRow row);
}
