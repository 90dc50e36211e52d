package com.cruisetracker.tracker.infrastructure.db.snapshot;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "snapshots")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotRow {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "itinerary_key", nullable = false)
    private String itineraryKey;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, length = 128)
    private String ship;

    @Column(name = "departure_port", nullable = false, length = 128)
    private String departurePort;

    @Column(nullable = false)
    private int nights;

    @Column(name = "sail_date", nullable = false)
    private LocalDate sailDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "cabin_category", nullable = false, length = 16)
    private CabinCategory cabinCategory;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    @Column(name = "source_strategy", nullable = false, length = 32)
    private String sourceStrategy;

    @Column(name = "dedup_key", nullable = false, unique = true, length = 512)
    private String dedupKey;
}
