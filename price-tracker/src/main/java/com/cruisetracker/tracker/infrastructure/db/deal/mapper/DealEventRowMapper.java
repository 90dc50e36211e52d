package com.cruisetracker.tracker.infrastructure.db.deal.mapper;

import com.cruisetracker.tracker.domain.deal.DealEvent;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.cruisetracker.tracker.domain.trend.Baseline;
import com.cruisetracker.tracker.infrastructure.db.ItineraryKeyMapper;
import com.cruisetracker.tracker.infrastructure.db.deal.DealEventRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring", uses = ItineraryKeyMapper.class)
public interface DealEventRowMapper {

    @Mapping(target = "snapshotId", source = "triggeringSnapshot.id")
    @Mapping(target = "rollingMinimum", source = "baselineAtDetection.rollingMinimum")
    @Mapping(target = "baselineMean", source = "baselineAtDetection.mean")
    @Mapping(target = "baselineStddev", source = "baselineAtDetection.standardDeviation")
    @Mapping(target = "baselineSamples", source = "baselineAtDetection.sampleCount")
    @Mapping(target = "baselineWindowStart", source = "baselineAtDetection.windowStart")
    @Mapping(target = "baselineWindowEnd", source = "baselineAtDetection.windowEnd")
    DealEventRow toRow(DealEvent event);

    /**
     * The baseline is rebuilt from its persisted summary; the triggering snapshot is loaded separately.
     */
    default DealEvent toDomain(DealEventRow row, Snapshot triggeringSnapshot) {
        var key = ItineraryKey.parse(row.getItineraryKey());
        return DealEvent.builder()
                .id(row.getId())
                .itineraryKey(key)
                .triggeringSnapshot(triggeringSnapshot)
                .baselineAtDetection(Baseline.builder()
                        .itineraryKey(key)
                        .rollingMinimum(row.getRollingMinimum())
                        .mean(row.getBaselineMean())
                        .standardDeviation(row.getBaselineStddev())
                        .sampleCount(row.getBaselineSamples())
                        .windowStart(row.getBaselineWindowStart())
                        .windowEnd(row.getBaselineWindowEnd())
                        .insufficientData(false)
                        .build())
                .dropRatio(row.getDropRatio())
                .score(row.getScore())
                .trigger(row.getTrigger())
                .detectedAt(row.getDetectedAt())
                .build();
    }
}
