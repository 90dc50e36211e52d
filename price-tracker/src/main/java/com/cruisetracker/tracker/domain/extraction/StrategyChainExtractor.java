package com.cruisetracker.tracker.domain.extraction;

import com.cruisetracker.common.id.UlidGenerator;
import com.cruisetracker.tracker.domain.fetch.RawCapture;
import com.cruisetracker.tracker.domain.itinerary.ItineraryKey;
import com.cruisetracker.tracker.domain.snapshot.Snapshot;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Tries each strategy in order and turns the first valid candidate into a {@link Snapshot}.
 * The strategy list is fixed for the lifetime of the extractor; a new one is built per run.
 */
@Slf4j
public class StrategyChainExtractor {

    private final List<ExtractionStrategy> strategies;

    public StrategyChainExtractor(List<ExtractionStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction strategy is required");
        }
        this.strategies = List.copyOf(strategies);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(ExtractionStrategy::name).toList();
    }

    public ExtractionResult extract(RawCapture capture, ExtractionHints hints) {
        var effectiveHints = hints == null ? ExtractionHints.none() : hints;
        var referenceDate = LocalDate.ofInstant(capture.capturedAt(), ZoneOffset.UTC);
        var attempts = new ArrayList<StrategyAttempt>();

        for (var strategy : strategies) {
            Optional<CandidateFields> candidate;
            try {
                candidate = strategy.attempt(capture.content(), effectiveHints);
            } catch (RuntimeException e) {
                log.debug("Strategy {} threw on capture {}: {}", strategy.name(), capture.id(), e.getMessage());
                attempts.add(StrategyAttempt.notApplicable(strategy.name(), e.getClass().getSimpleName() + ": " + e.getMessage()));
                continue;
            }
            if (candidate.isEmpty()) {
                attempts.add(StrategyAttempt.notApplicable(strategy.name(), null));
                continue;
            }

            var fields = candidate.get().withHints(effectiveHints);
            var violations = strategy.validate(fields, referenceDate);
            if (!violations.isEmpty()) {
                log.debug("Strategy {} rejected for capture {}: {}", strategy.name(), capture.id(), violations);
                attempts.add(StrategyAttempt.validationFailed(strategy.name(), violations));
                continue;
            }

            var snapshot = toSnapshot(fields, capture, strategy.name());
            log.debug("extraction.matched: itinerary={}, strategy={}, key={}",
                    capture.itineraryId(), strategy.name(), snapshot.itineraryKey());
            return ExtractionResult.success(snapshot, attempts);
        }

        var error = ExtractionError.noStrategyMatched(attempts);
        log.warn("extraction.failed: itinerary={}, capture={}, diagnostics={}",
                capture.itineraryId(), capture.id(), error.attempts());
        return ExtractionResult.failure(error);
    }

    private static Snapshot toSnapshot(CandidateFields fields, RawCapture capture, String strategyName) {
        return Snapshot.builder()
                .id(UlidGenerator.generate(capture.capturedAt()))
                .itineraryKey(new ItineraryKey(fields.ship(), fields.departurePort(), fields.sailDate(), fields.cabinCategory()))
                .price(fields.price().setScale(2, RoundingMode.HALF_UP))
                .currency(fields.currency().toUpperCase(Locale.ROOT))
                .ship(fields.ship())
                .departurePort(fields.departurePort())
                .nights(fields.nights())
                .sailDate(fields.sailDate())
                .cabinCategory(fields.cabinCategory())
                .capturedAt(capture.capturedAt())
                .sourceStrategy(strategyName)
                .build();
    }
}
