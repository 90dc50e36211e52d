package com.cruisetracker.tracker.domain.trend;

import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Computes baselines from snapshot history on demand. Nothing is cached or persisted.
 */
public class TrendAnalyzer {

    private static final MathContext PRECISION = MathContext.DECIMAL64;
    private static final int STAT_SCALE = 4;

    private final SnapshotStore snapshotStore;
    private final BaselinePolicy policy;
    private final Clock clock;

    public TrendAnalyzer(SnapshotStore snapshotStore, BaselinePolicy policy, Clock clock) {
        this.snapshotStore = snapshotStore;
        this.policy = policy;
        this.clock = clock;
    }

    /** Baseline over history up to and including the current instant. */
    public Baseline baseline(ItineraryKey key) {
        var now = clock.instant();
        return compute(key, now.minus(policy.maxAge()), now.plusMillis(1));
    }

    /** Baseline over history strictly before {@code reference}; the snapshot at {@code reference} is excluded. */
    public Baseline baselineBefore(ItineraryKey key, Instant reference) {
        return compute(key, reference.minus(policy.maxAge()), reference);
    }

    static Baseline summarize(ItineraryKey key, List<Snapshot> window, int minSamples) {
        if (window.size() < minSamples) {
            return Baseline.builder()
                    .itineraryKey(key)
                    .sampleCount(window.size())
                    .windowStart(window.isEmpty() ? null : window.get(0).capturedAt())
                    .windowEnd(window.isEmpty() ? null : window.get(window.size() - 1).capturedAt())
                    .insufficientData(true)
                    .build();
        }

        var n = BigDecimal.valueOf(window.size());
        var minimum = window.get(0).price();
        var sum = BigDecimal.ZERO;
        for (var snapshot : window) {
            minimum = minimum.min(snapshot.price());
            sum = sum.add(snapshot.price());
        }
        var mean = sum.divide(n, PRECISION);

        var squares = BigDecimal.ZERO;
        for (var snapshot : window) {
            var deviation = snapshot.price().subtract(mean);
            squares = squares.add(deviation.multiply(deviation));
        }
        var variance = squares.divide(n.subtract(BigDecimal.ONE), PRECISION);
        var stddev = variance.sqrt(PRECISION);

        return Baseline.builder()
                .itineraryKey(key)
                .rollingMinimum(minimum)
                .mean(mean.setScale(STAT_SCALE, RoundingMode.HALF_EVEN))
                .standardDeviation(stddev.setScale(STAT_SCALE, RoundingMode.HALF_EVEN))
                .sampleCount(window.size())
                .windowStart(window.get(0).capturedAt())
                .windowEnd(window.get(window.size() - 1).capturedAt())
                .insufficientData(false)
                .build();
    }

    private Baseline compute(ItineraryKey key, Instant notBefore, Instant before) {
        var window = snapshotStore.recent(key, notBefore, before, policy.maxObservations());
        return summarize(key, window, policy.minSamples());
    }
}
