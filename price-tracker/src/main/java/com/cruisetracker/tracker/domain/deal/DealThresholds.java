package com.cruisetracker.tracker.domain.deal;

import java.math.BigDecimal;

/**
 * @param thresholdRatio   fractional drop below the rolling minimum that counts as a record low
 * @param stddevMultiplier k in {@code mean - k * stddev}; zero disables the statistical rule
 */
public record DealThresholds(BigDecimal thresholdRatio, BigDecimal stddevMultiplier) {

    public DealThresholds {
        if (thresholdRatio.signum() < 0 || thresholdRatio.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("thresholdRatio must be in [0, 1), was " + thresholdRatio);
        }
        if (stddevMultiplier.signum() < 0) {
            throw new IllegalArgumentException("stddevMultiplier must be >= 0, was " + stddevMultiplier);
        }
    }
}
