package com.cruisetracker.tracker.domain.trend;

import static com.cruisetracker.tracker.support.TestSnapshots.OASIS_BALCONY;
import static com.cruisetracker.tracker.support.TestSnapshots.OASIS_INTERIOR;
import static com.cruisetracker.tracker.support.TestSnapshots.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cruisetracker.tracker.domain.snapshot.RunWindow;
import com.cruisetracker.tracker.domain.snapshot.SnapshotStore;
import com.cruisetracker.tracker.support.InMemoryRawCaptureRepository;
import com.cruisetracker.tracker.support.InMemorySnapshotRepository;
import com.cruisetracker.tracker.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TrendAnalyzerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T06:00:00Z");

    private final InMemorySnapshotRepository snapshotRepository = new InMemorySnapshotRepository();
    private final MutableClock clock = new MutableClock(NOW);
    private final TrendAnalyzer analyzer = new TrendAnalyzer(
            new SnapshotStore(snapshotRepository, new InMemoryRawCaptureRepository(), new RunWindow(Duration.ofHours(6))),
            new BaselinePolicy(30, Duration.ofDays(90), 3),
            clock);

    private void seed(String price, Duration ago) {
        snapshotRepository.seed(snapshot(OASIS_INTERIOR, price, NOW.minus(ago)));
    }

    @Nested
    class Statistics {

        @Test
        void shouldUseSampleStandardDeviation() {
            // given
            var window = List.of(
                    snapshot(OASIS_INTERIOR, "1000.00", NOW.minus(Duration.ofDays(3))),
                    snapshot(OASIS_INTERIOR, "1100.00", NOW.minus(Duration.ofDays(2))),
                    snapshot(OASIS_INTERIOR, "1200.00", NOW.minus(Duration.ofDays(1))));

            // when
            var baseline = TrendAnalyzer.summarize(OASIS_INTERIOR, window, 3);

            // then
            assertThat(baseline.insufficientData()).isFalse();
            assertThat(baseline.sampleCount()).isEqualTo(3);
            assertThat(baseline.rollingMinimum()).isEqualByComparingTo("1000");
            assertThat(baseline.mean()).isEqualByComparingTo("1100");
            assertThat(baseline.standardDeviation()).isEqualByComparingTo("100");
            assertThat(baseline.windowStart()).isEqualTo(NOW.minus(Duration.ofDays(3)));
            assertThat(baseline.windowEnd()).isEqualTo(NOW.minus(Duration.ofDays(1)));
        }

        @Test
        void shouldReportZeroDeviationForFlatHistory() {
            // given
            var window = List.of(
                    snapshot(OASIS_INTERIOR, "1000.00", NOW.minus(Duration.ofDays(2))),
                    snapshot(OASIS_INTERIOR, "1000.00", NOW.minus(Duration.ofDays(1))));

            // when
            var baseline = TrendAnalyzer.summarize(OASIS_INTERIOR, window, 2);

            // then
            assertThat(baseline.standardDeviation()).isEqualByComparingTo("0");
            assertThat(baseline.mean()).isEqualByComparingTo("1000");
        }

        @Test
        void shouldFlagInsufficientData() {
            // given
            var window = List.of(
                    snapshot(OASIS_INTERIOR, "1000.00", NOW.minus(Duration.ofDays(2))),
                    snapshot(OASIS_INTERIOR, "900.00", NOW.minus(Duration.ofDays(1))));

            // when
            var baseline = TrendAnalyzer.summarize(OASIS_INTERIOR, window, 3);

            // then
            assertThat(baseline.insufficientData()).isTrue();
            assertThat(baseline.sampleCount()).isEqualTo(2);
            assertThat(baseline.rollingMinimum()).isNull();
            assertThat(baseline.mean()).isNull();
        }

        @Test
        void shouldRejectPolicyThatCannotYieldSampleDeviation() {
            assertThatThrownBy(() -> new BaselinePolicy(30, Duration.ofDays(90), 1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Windows {

        @Test
        void shouldIncludeSnapshotAtCurrentInstant() {
            // given
            seed("1000.00", Duration.ofDays(2));
            seed("1000.00", Duration.ofDays(1));
            seed("700.00", Duration.ZERO);

            // when
            var baseline = analyzer.baseline(OASIS_INTERIOR);

            // then
            assertThat(baseline.sampleCount()).isEqualTo(3);
            assertThat(baseline.rollingMinimum()).isEqualByComparingTo("700");
        }

        @Test
        void shouldExcludeTriggeringSnapshotFromPrecedingBaseline() {
            // given
            seed("1000.00", Duration.ofDays(3));
            seed("1050.00", Duration.ofDays(2));
            seed("1100.00", Duration.ofDays(1));
            seed("700.00", Duration.ZERO);

            // when
            var baseline = analyzer.baselineBefore(OASIS_INTERIOR, NOW);

            // then
            assertThat(baseline.sampleCount()).isEqualTo(3);
            assertThat(baseline.rollingMinimum()).isEqualByComparingTo("1000");
            assertThat(baseline.mean()).isEqualByComparingTo("1050");
        }

        @Test
        void shouldKeepOnlyMostRecentObservations() {
            // given
            var bounded = new TrendAnalyzer(
                    new SnapshotStore(snapshotRepository, new InMemoryRawCaptureRepository(), new RunWindow(Duration.ofHours(6))),
                    new BaselinePolicy(3, Duration.ofDays(90), 2),
                    clock);
            seed("500.00", Duration.ofDays(5));
            seed("900.00", Duration.ofDays(4));
            seed("1000.00", Duration.ofDays(3));
            seed("1100.00", Duration.ofDays(2));

            // when
            var baseline = bounded.baseline(OASIS_INTERIOR);

            // then
            assertThat(baseline.sampleCount()).isEqualTo(3);
            assertThat(baseline.rollingMinimum()).isEqualByComparingTo("900");
        }

        @Test
        void shouldIgnoreObservationsOlderThanMaxAge() {
            // given
            seed("500.00", Duration.ofDays(120));
            seed("1000.00", Duration.ofDays(30));
            seed("1000.00", Duration.ofDays(20));
            seed("1000.00", Duration.ofDays(10));

            // when
            var baseline = analyzer.baseline(OASIS_INTERIOR);

            // then
            assertThat(baseline.sampleCount()).isEqualTo(3);
            assertThat(baseline.rollingMinimum()).isEqualByComparingTo("1000");
        }

        @Test
        void shouldReportInsufficientDataForUnknownItinerary() {
            // given
            seed("1000.00", Duration.ofDays(1));

            // when
            var baseline = analyzer.baseline(OASIS_BALCONY);

            // then
            assertThat(baseline.insufficientData()).isTrue();
            assertThat(baseline.sampleCount()).isZero();
        }
    }
}
