package com.cruisetracker.tracker.domain.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.cruisetracker.tracker.domain.itinerary.CabinCategory;
import com.cruisetracker.tracker.support.Fixtures;
import java.time.LocalDate;
import java.time.Period;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DomPathStrategyTest {

    private final SelectorConfig selectors = Fixtures.bundledSelectors();
    private final DomPathStrategy strategy = new DomPathStrategy(
            selectors.dom(), selectors.defaultCurrency(), new CandidateValidator(Period.ofYears(3)));

    @Test
    void shouldReadCruiseCard() {
        // when
        var candidate = strategy.attempt(Fixtures.read("oasis-card.html"), ExtractionHints.none());

        // then
        assertThat(candidate).isPresent();
        var fields = candidate.get();
        assertThat(fields.price()).isEqualByComparingTo("1299");
        assertThat(fields.currency()).isEqualTo("GBP");
        assertThat(fields.ship()).isEqualTo("Oasis of the Seas");
        assertThat(fields.departurePort()).isEqualTo("Cape Liberty, NJ");
        assertThat(fields.nights()).isEqualTo(7);
        assertThat(fields.sailDate()).isEqualTo(LocalDate.of(2026, 6, 7));
        assertThat(fields.cabinCategory()).isNull();
    }

    @Test
    void shouldNotApplyWhenContainerIsMissing() {
        assertThat(strategy.attempt(Fixtures.read("oasis-text.html"), ExtractionHints.none())).isEmpty();
        assertThat(strategy.attempt(Fixtures.read("redesigned-page.html"), ExtractionHints.none())).isEmpty();
    }

    @Test
    void shouldNotApplyWhenPriceElementIsMissing() {
        // given
        var html = "<div data-testid=\"cruise-card-container-X\"><div data-testid=\"cruise-ship-label-X\">Oasis of the Seas</div></div>";

        // then
        assertThat(strategy.attempt(html, ExtractionHints.none())).isEmpty();
    }

    @Nested
    class CabinScoping {

        @ParameterizedTest
        @CsvSource({
                "INTERIOR, 799",
                "OCEAN_VIEW, 999",
                "BALCONY, 1299",
                "SUITE, 2500"
        })
        void shouldReadPriceFromHintedCabinCard(CabinCategory cabin, String expectedPrice) {
            // when
            var candidate = strategy.attempt(Fixtures.read("oasis-four-cabins.html"), new ExtractionHints(null, cabin));

            // then
            assertThat(candidate).hasValueSatisfying(fields -> {
                assertThat(fields.price()).isEqualByComparingTo(expectedPrice);
                assertThat(fields.cabinCategory()).isEqualTo(cabin);
            });
        }

        @Test
        void shouldNotApplyWhenHintedCabinCardIsMissing() {
            // when
            var candidate = strategy.attempt(Fixtures.read("oasis-card.html"), new ExtractionHints(null, CabinCategory.INTERIOR));

            // then
            assertThat(candidate).isEmpty();
        }

        @Test
        void shouldNotAttributeUnscopedPriceToHintedCabin() {
            // given
            var dom = selectors.dom();
            var withoutCards = new SelectorConfig.Dom(dom.container(), dom.price(), null, null, dom.ship(),
                    dom.departurePort(), dom.nights(), dom.sailDate(), dom.cabin());
            var unscoped = new DomPathStrategy(withoutCards, "GBP", new CandidateValidator(Period.ofYears(3)));

            // when
            var candidate = unscoped.attempt(Fixtures.read("oasis-four-cabins.html"), new ExtractionHints(null, CabinCategory.BALCONY));

            // then
            assertThat(candidate).isEmpty();
        }
    }
}
