package com.cruisetracker.tracker.infrastructure.db.deal;

import com.cruisetracker.tracker.domain.deal.DealTrigger;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "deal_events")
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DealEventRow {

    @Id
    @Column(length = 26)
    private String id;

    @Column(name = "itinerary_key", nullable = false)
    private String itineraryKey;

    @Column(name = "snapshot_id", nullable = false, length = 26)
    private String snapshotId;

    @Column(name = "rolling_minimum", nullable = false, precision = 12, scale = 2)
    private BigDecimal rollingMinimum;

    @Column(name = "baseline_mean", nullable = false, precision = 14, scale = 4)
    private BigDecimal baselineMean;

    @Column(name = "baseline_stddev", nullable = false, precision = 14, scale = 4)
    private BigDecimal baselineStddev;

    @Column(name = "baseline_samples", nullable = false)
    private int baselineSamples;

    @Column(name = "baseline_window_start", nullable = false)
    private Instant baselineWindowStart;

    @Column(name = "baseline_window_end", nullable = false)
    private Instant baselineWindowEnd;

    @Column(name = "drop_ratio", nullable = false, precision = 8, scale = 4)
    private BigDecimal dropRatio;

    @Column(nullable = false, precision = 8, scale = 4)
    private BigDecimal score;

    @Enumerated(EnumType.STRING)
    @Column(name = "deal_trigger", nullable = false, length = 16)
    private DealTrigger trigger;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;
}
