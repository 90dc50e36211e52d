package com.cruisetracker.tracker.infrastructure.db.snapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface SnapshotJpaRepository extends JpaRepository<SnapshotRow, String> {

    @Modifying
    @Query(value = "INSERT INTO snapshots (id, itinerary_key, price, currency, ship, departure_port, nights, sail_date, cabin_category, captured_at, source_strategy, dedup_key) " +
            "VALUES (:#{#row.id}, :#{#row.itineraryKey}, :#{#row.price}, :#{#row.currency}, :#{#row.ship}, :#{#row.departurePort}, :#{#row.nights}, :#{#row.sailDate}, :#{#row.cabinCategory.name()}, :#{#row.capturedAt}, :#{#row.sourceStrategy}, :#{#row.dedupKey}) " +
            "ON CONFLICT (dedup_key) DO NOTHING", nativeQuery = true)
    int insertIdempotent(SnapshotRow row);

    Optional<SnapshotRow> findFirstByItineraryKeyOrderByCapturedAtDescIdDesc(String itineraryKey);

    @Query("SELECT s FROM SnapshotRow s WHERE s.itineraryKey = :itineraryKey " +
            "AND s.capturedAt >= :from AND s.capturedAt < :to ORDER BY s.capturedAt ASC, s.id ASC")
    List<SnapshotRow> findBetween(String itineraryKey, Instant from, Instant to);

    List<SnapshotRow> findByItineraryKeyOrderByCapturedAtAscIdAsc(String itineraryKey);

    @Query("SELECT s FROM SnapshotRow s WHERE s.itineraryKey = :itineraryKey " +
            "AND s.capturedAt >= :notBefore AND s.capturedAt < :before ORDER BY s.capturedAt DESC, s.id DESC")
    List<SnapshotRow> findRecentDescending(String itineraryKey, Instant notBefore, Instant before, Pageable pageable);

    @Query(value = "SELECT DISTINCT ON (itinerary_key) * FROM snapshots " +
            "ORDER BY itinerary_key, captured_at DESC, id DESC", nativeQuery = true)
    List<SnapshotRow> findLatestPerItinerary();

    List<SnapshotRow> findAllByOrderByCapturedAtAscIdAsc();
}
