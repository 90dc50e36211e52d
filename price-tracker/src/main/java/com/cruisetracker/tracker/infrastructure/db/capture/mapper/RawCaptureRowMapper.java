package com.cruisetracker.tracker.infrastructure.db.capture.mapper;

import com.cruisetracker.tracker.domain.fetch.RawCapture;
import com.cruisetracker.tracker.infrastructure.db.capture.RawCaptureRow;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface RawCaptureRowMapper {

    RawCaptureRow toRow(RawCapture capture);

    RawCapture toDomain(RawCaptureRow row);
}
