package com.cruisetracker.tracker.domain.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.cruisetracker.tracker.domain.fetch.RawCapture;
import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import com.cruisetracker.tracker.support.Fixtures;
import com.cruisetracker.tracker.support.TestSnapshots;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StrategyChainExtractorTest {

    private static final Instant CAPTURED_AT = Instant.parse("2026-03-01T10:15:00Z");
    private static final ExtractionHints INTERIOR_HINTS =
            new ExtractionHints(TestSnapshots.SAIL_DATE, CabinCategory.INTERIOR);

    private final CandidateValidator validator = new CandidateValidator(Period.ofYears(3));
    private final StrategyChainExtractor extractor =
            new StrategyChainFactory(validator).create(Fixtures.bundledSelectors());

    private static RawCapture capture(String content) {
        return RawCapture.builder()
                .id("cap-1")
                .itineraryId("oasis-interior")
                .url("https://www.example.com/cruise/OA07")
                .httpStatus(200)
                .content(content)
                .attempts(1)
                .capturedAt(CAPTURED_AT)
                .build();
    }

    @Test
    void shouldRunStrategiesInFixedOrder() {
        assertThat(extractor.strategyNames()).containsExactly("structured", "dom", "regex");
    }

    @Test
    void shouldRejectEmptyChain() {
        assertThatThrownBy(() -> new StrategyChainExtractor(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    class Success {

        @Test
        void shouldBuildSnapshotFromStructuredJsonWithHints() {
            // when
            var result = extractor.extract(capture(Fixtures.read("oasis-structured.json")), INTERIOR_HINTS);

            // then
            assertThat(result.isSuccess()).isTrue();
            var snapshot = result.snapshot();
            assertThat(snapshot.itineraryKey()).isEqualTo(TestSnapshots.OASIS_INTERIOR);
            assertThat(snapshot.price()).isEqualByComparingTo("799");
            assertThat(snapshot.currency()).isEqualTo("USD");
            assertThat(snapshot.ship()).isEqualTo("Oasis of the Seas");
            assertThat(snapshot.departurePort()).isEqualTo("Cape Liberty, NJ");
            assertThat(snapshot.nights()).isEqualTo(7);
            assertThat(snapshot.sailDate()).isEqualTo(TestSnapshots.SAIL_DATE);
            assertThat(snapshot.capturedAt()).isEqualTo(CAPTURED_AT);
            assertThat(snapshot.sourceStrategy()).isEqualTo("structured");
            assertThat(snapshot.id()).hasSize(26);
            assertThat(result.attempts()).isEmpty();
        }

        @Test
        void shouldPreferExtractedSailDateOverHint() {
            // given
            var json = "{\"price\": \"$799\", \"ship\": \"Oasis of the Seas\", \"departure_port\": \"Cape Liberty, NJ\","
                    + " \"nights\": 7, \"sail_date\": \"2026-07-01\"}";

            // when
            var result = extractor.extract(capture(json), INTERIOR_HINTS);

            // then
            assertThat(result.snapshot().sailDate()).isEqualTo(LocalDate.of(2026, 7, 1));
        }

        @Test
        void shouldFallBackToDomWhenNoStructuredDataIsEmbedded() {
            // when
            var result = extractor.extract(capture(Fixtures.read("oasis-card.html")),
                    new ExtractionHints(null, CabinCategory.BALCONY));

            // then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.snapshot().sourceStrategy()).isEqualTo("dom");
            assertThat(result.snapshot().itineraryKey()).isEqualTo(TestSnapshots.OASIS_BALCONY);
            assertThat(result.snapshot().price()).isEqualByComparingTo("1299.00");
            assertThat(result.attempts()).extracting(StrategyAttempt::strategy, StrategyAttempt::status)
                    .containsExactly(tuple("structured", AttemptStatus.NOT_APPLICABLE));
        }

        @Test
        void shouldStoreEachTrackedCabinWithItsOwnCardPrice() {
            // when
            var interior = extractor.extract(capture(Fixtures.read("oasis-four-cabins.html")), INTERIOR_HINTS);
            var balcony = extractor.extract(capture(Fixtures.read("oasis-four-cabins.html")),
                    new ExtractionHints(TestSnapshots.SAIL_DATE, CabinCategory.BALCONY));

            // then
            assertThat(interior.snapshot().itineraryKey()).isEqualTo(TestSnapshots.OASIS_INTERIOR);
            assertThat(interior.snapshot().price()).isEqualByComparingTo("799.00");
            assertThat(balcony.snapshot().itineraryKey()).isEqualTo(TestSnapshots.OASIS_BALCONY);
            assertThat(balcony.snapshot().price()).isEqualByComparingTo("1299.00");
            assertThat(balcony.snapshot().sourceStrategy()).isEqualTo("dom");
        }

        @Test
        void shouldFallBackToRegexWhenMarkupChanged() {
            // when
            var result = extractor.extract(capture(Fixtures.read("oasis-text.html")), ExtractionHints.none());

            // then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.snapshot().sourceStrategy()).isEqualTo("regex");
            assertThat(result.snapshot().itineraryKey()).isEqualTo(TestSnapshots.OASIS_INTERIOR);
            assertThat(result.snapshot().price()).isEqualByComparingTo("1099.00");
            assertThat(result.snapshot().currency()).isEqualTo("GBP");
            assertThat(result.attempts()).extracting(StrategyAttempt::strategy).containsExactly("structured", "dom");
        }

        @Test
        void shouldTreatThrowingStrategyAsNotApplicable() {
            // given
            var chain = new StrategyChainExtractor(List.of(
                    new ThrowingStrategy(),
                    new DomPathStrategy(Fixtures.bundledSelectors().dom(), "GBP", validator)));

            // when
            var result = chain.extract(capture(Fixtures.read("oasis-card.html")),
                    new ExtractionHints(null, CabinCategory.BALCONY));

            // then
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.snapshot().sourceStrategy()).isEqualTo("dom");
            assertThat(result.attempts()).hasSize(1);
            assertThat(result.attempts().get(0).status()).isEqualTo(AttemptStatus.NOT_APPLICABLE);
            assertThat(result.attempts().get(0).reasons()).containsExactly("IllegalStateException: selector engine broke");
        }
    }

    @Nested
    class Failure {

        @Test
        void shouldReportNoStrategyMatchedWithDiagnostics() {
            // when
            var result = extractor.extract(capture(Fixtures.read("redesigned-page.html")), INTERIOR_HINTS);

            // then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.snapshot()).isNull();
            assertThat(result.error().kind()).isEqualTo(ExtractionErrorKind.NO_STRATEGY_MATCHED);
            assertThat(result.error().attempts()).extracting(StrategyAttempt::strategy)
                    .containsExactly("structured", "dom", "regex");
            assertThat(result.error().attempts()).extracting(StrategyAttempt::status)
                    .containsOnly(AttemptStatus.NOT_APPLICABLE);
        }

        @Test
        void shouldRecordValidationReasonsPerStrategy() {
            // given
            var json = "{\"price\": \"$799\", \"ship\": \"Oasis of the Seas\", \"departure_port\": \"Cape Liberty, NJ\","
                    + " \"nights\": 99}";

            // when
            var result = extractor.extract(capture(json), INTERIOR_HINTS);

            // then
            assertThat(result.isSuccess()).isFalse();
            var structured = result.error().attempts().get(0);
            assertThat(structured.strategy()).isEqualTo("structured");
            assertThat(structured.status()).isEqualTo(AttemptStatus.VALIDATION_FAILED);
            assertThat(structured.reasons()).containsExactly("nights outside [1, 60]: 99");
            assertThat(result.error().describe()).startsWith("NO_STRATEGY_MATCHED");
        }

        @Test
        void shouldRejectSailDateInThePast() {
            // when
            var result = extractor.extract(capture(Fixtures.read("oasis-structured.json")),
                    new ExtractionHints(LocalDate.of(2025, 12, 1), CabinCategory.INTERIOR));

            // then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.error().attempts().get(0).reasons())
                    .containsExactly("sail date 2025-12-01 is before capture date 2026-03-01");
        }
    }

    private static final class ThrowingStrategy implements ExtractionStrategy {

        @Override
        public String name() {
            return "structured";
        }

        @Override
        public Set<ExtractionField> producibleFields() {
            return Set.of(ExtractionField.PRICE);
        }

        @Override
        public Optional<CandidateFields> attempt(String content, ExtractionHints hints) {
            throw new IllegalStateException("selector engine broke");
        }

        @Override
        public List<String> validate(CandidateFields candidate, LocalDate referenceDate) {
            return List.of();
        }
    }
}
