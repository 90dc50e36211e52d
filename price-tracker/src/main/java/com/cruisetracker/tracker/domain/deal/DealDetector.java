package com.cruisetracker.tracker.domain.deal;

import com.cruisetracker.common.id.UlidGenerator;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import com.cruisetracker.tracker.domain.trend.Baseline;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a new snapshot is a deal relative to the baseline that preceded it.
 *
 * <p>Ratio rule: {@code price <= rollingMinimum * (1 - thresholdRatio)}.
 * Statistical rule: {@code price <= mean - k * stddev}, only when both k and stddev are positive.
 */
@Slf4j
public class DealDetector {

    private static final int RATIO_SCALE = 4;

    private final DealThresholds thresholds;
    private final DealEventRepository dealEventRepository;
    private final Clock clock;

    public DealDetector(DealThresholds thresholds, DealEventRepository dealEventRepository, Clock clock) {
        this.thresholds = thresholds;
        this.dealEventRepository = dealEventRepository;
        this.clock = clock;
    }

    public Optional<DealEvent> evaluate(Snapshot snapshot, Baseline baseline) {
        if (baseline.insufficientData()) {
            return Optional.empty();
        }
        var price = snapshot.price();
        var recordLow = price.compareTo(baseline.rollingMinimum().multiply(BigDecimal.ONE.subtract(thresholds.thresholdRatio()))) <= 0;
        var statisticalDip = thresholds.stddevMultiplier().signum() > 0
                && baseline.standardDeviation().signum() > 0
                && price.compareTo(baseline.mean().subtract(thresholds.stddevMultiplier().multiply(baseline.standardDeviation()))) <= 0;

        if (!recordLow && !statisticalDip) {
            return Optional.empty();
        }
        var trigger = recordLow && statisticalDip ? DealTrigger.BOTH
                : recordLow ? DealTrigger.RECORD_LOW
                : DealTrigger.STATISTICAL_DIP;

        return Optional.of(DealEvent.builder()
                .id(UlidGenerator.generate())
                .itineraryKey(snapshot.itineraryKey())
                .triggeringSnapshot(snapshot)
                .baselineAtDetection(baseline)
                .dropRatio(relativeDrop(baseline.mean(), price))
                .score(relativeDrop(baseline.rollingMinimum(), price))
                .trigger(trigger)
                .detectedAt(clock.instant())
                .build());
    }

    /**
     * Evaluates and, when a deal fires, persists it before returning.
     */
    public Optional<DealEvent> detect(Snapshot snapshot, Baseline baseline) {
        var deal = evaluate(snapshot, baseline);
        deal.ifPresent(event -> {
            dealEventRepository.save(event);
            log.info("deal.detected: id={}, key={}, price={}, min={}, mean={}, score={}, trigger={}",
                    event.id(), event.itineraryKey(), snapshot.price(), baseline.rollingMinimum(),
                    baseline.mean(), event.score(), event.trigger());
        });
        return deal;
    }

    private static BigDecimal relativeDrop(BigDecimal reference, BigDecimal price) {
        if (reference.signum() <= 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        var drop = reference.subtract(price).divide(reference, MathContext.DECIMAL64);
        return drop.max(BigDecimal.ZERO).setScale(RATIO_SCALE, RoundingMode.HALF_EVEN);
    }
}
