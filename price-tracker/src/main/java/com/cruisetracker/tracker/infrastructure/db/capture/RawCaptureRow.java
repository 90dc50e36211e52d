package com.cruisetracker.tracker.infrastructure.db.capture;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "raw_captures")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawCaptureRow {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "itinerary_id", nullable = false, length = 128)
    private String itineraryId;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(name = "http_status", nullable = false)
    private int httpStatus;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(nullable = false)
    private int attempts;

    @Column(length = 1024)
    private String error;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;
}
