package com.cruisetracker.tracker.infrastructure.db.deal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface DealEventJpaRepository extends JpaRepository<DealEventRow, String> {

    @Modifying
    @Query(value = "INSERT INTO deal_events (id, itinerary_key, snapshot_id, rolling_minimum, baseline_mean, baseline_stddev, baseline_samples, baseline_window_start, baseline_window_end, drop_ratio, score, deal_trigger, detected_at) " +
            "VALUES (:#{#row.id}, :#{#row.itineraryKey}, :#{#row.snapshotId}, :#{#row.rollingMinimum}, :#{#row.baselineMean}, :#{#row.baselineStddev}, :#{#row.baselineSamples}, :#{#row.baselineWindowStart}, :#{#row.baselineWindowEnd}, :#{#row.dropRatio}, :#{#row.score}, :#{#row.trigger.name()}, :#{#row.detectedAt}) " +
            "ON CONFLICT (id) DO NOTHING", nativeQuery = true)
    void insertIdempotent(DealEventRow row);
}
