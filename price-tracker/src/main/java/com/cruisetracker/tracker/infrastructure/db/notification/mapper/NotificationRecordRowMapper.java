package com.cruisetracker.tracker.infrastructure.db.notification.mapper;

import com.cruisetracker.tracker.domain.notification.NotificationRecord;
import com.cruisetracker.tracker.infrastructure.db.ItineraryKeyMapper;
import com.cruisetracker.tracker.infrastructure.db.notification.NotificationRecordRow;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring", uses = ItineraryKeyMapper.class)
public interface NotificationRecordRowMapper {

    NotificationRecordRow toRow(NotificationRecord record);

    NotificationRecord toDomain(NotificationRecordRow row);
}
