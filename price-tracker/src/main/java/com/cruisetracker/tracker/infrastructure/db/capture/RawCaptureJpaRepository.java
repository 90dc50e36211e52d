package com.cruisetracker.tracker.infrastructure.db.capture;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface RawCaptureJpaRepository extends JpaRepository<RawCaptureRow, String> {

    @Modifying
    @Query(value = "INSERT INTO raw_captures (id, itinerary_id, url, http_status, content, attempts, error, captured_at) " +
            "VALUES (:#{#row.id}, :#{#row.itineraryId}, :#{#row.url}, :#{#row.httpStatus}, :#{#row.content}, :#{#row.attempts}, :#{#row.error}, :#{#row.capturedAt})",
            nativeQuery = true)
    void insert(RawCaptureRow row);

    List<RawCaptureRow> findByItineraryIdOrderByCapturedAtAsc(String itineraryId);
}
