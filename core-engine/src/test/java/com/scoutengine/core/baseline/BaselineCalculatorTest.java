package com.scoutengine.core.baseline;

import com.scoutengine.core.model.Baseline;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.WindowKind;
import com.scoutengine.core.testing.Observations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link BaselineCalculator}.
 */
class BaselineCalculatorTest {

    private BaselineCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new BaselineCalculator();
    }

    @Test
    @DisplayName("Should average the periods preceding the current one")
    void shouldComputeTrailingBaseline() {
        MetricSeries series = monthly(1000, 900, 750, 500);

        Optional<Baseline> baseline = calculator.trailing(series, 3);

        assertThat(baseline).isPresent();
        assertThat(baseline.get().getMean()).isCloseTo(883.333, within(0.001));
        assertThat(baseline.get().getSampleCount()).isEqualTo(3);
        assertThat(baseline.get().getWindowKind()).isEqualTo(WindowKind.TRAILING_PERIODS);
    }

    @Test
    @DisplayName("Should only use the last windowSize preceding periods")
    void shouldLimitTrailingWindow() {
        MetricSeries series = monthly(1, 10, 20, 30, 999);

        Baseline baseline = calculator.trailing(series, 3).orElseThrow();

        assertThat(baseline.getMean()).isEqualTo(20.0);
        assertThat(baseline.getStddev()).isCloseTo(Math.sqrt(200.0 / 3), within(1e-9));
    }

    @Test
    @DisplayName("Should be undefined with fewer preceding periods than minSamples")
    void shouldBeUndefinedOnShortHistory() {
        assertThat(calculator.trailing(monthly(100, 90, 80), 3)).isEmpty();
        assertThat(calculator.trailing(monthly(100), 3)).isEmpty();
        assertThat(calculator.trailing(MetricSeries.empty("p1", "page", "sessions"), 3)).isEmpty();
    }

    @Test
    @DisplayName("Should be undefined when the window is smaller than minSamples")
    void shouldBeUndefinedWhenWindowTooSmall() {
        assertThat(calculator.compute(monthly(1, 2, 3, 4, 5, 6), WindowKind.TRAILING_PERIODS, 2, 3)).isEmpty();
    }

    @Test
    @DisplayName("Should never produce a baseline from fewer samples than required")
    void shouldBeSound() {
        for (int size = 0; size <= 8; size++) {
            double[] values = new double[size];
            for (int i = 0; i < size; i++) {
                values[i] = 100 + i;
            }
            MetricSeries series = monthly(values);
            for (int window = 1; window <= 6; window++) {
                for (int min = 1; min <= 4; min++) {
                    Optional<Baseline> b = calculator.compute(series, WindowKind.TRAILING_PERIODS, window, min);
                    if (b.isPresent()) {
                        assertThat(b.get().getSampleCount()).isGreaterThanOrEqualTo(min).isLessThanOrEqualTo(window);
                        assertThat(b.get().getMean()).isFinite();
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Should match the same month in prior years for monthly periods")
    void shouldComputePriorYearBaselineByMonth() {
        List<MetricObservation> observations = new ArrayList<>();
        observations.addAll(Observations.monthly("r", "revenue", "revenue", YearMonth.of(2022, 3), 100, 50));
        observations.addAll(Observations.monthly("r", "revenue", "revenue", YearMonth.of(2023, 3), 200, 60));
        observations.add(Observations.month("r", "revenue", "revenue", YearMonth.of(2024, 3), 90));
        MetricSeries series = MetricSeries.of(observations);

        Baseline baseline = calculator.compute(series, WindowKind.SAME_PERIOD_PRIOR_YEAR, 3, 2).orElseThrow();

        assertThat(baseline.getMean()).isEqualTo(150.0);
        assertThat(baseline.getSampleCount()).isEqualTo(2);
        assertThat(baseline.getWindowKind()).isEqualTo(WindowKind.SAME_PERIOD_PRIOR_YEAR);
    }

    @Test
    @DisplayName("Should match the same day in prior years for daily periods")
    void shouldComputePriorYearBaselineByDay() {
        MetricSeries series = MetricSeries.of(List.of(
                Observations.day("r", "revenue", "revenue", LocalDate.of(2022, 11, 25), 10),
                Observations.day("r", "revenue", "revenue", LocalDate.of(2022, 11, 26), 999),
                Observations.day("r", "revenue", "revenue", LocalDate.of(2023, 11, 25), 30),
                Observations.day("r", "revenue", "revenue", LocalDate.of(2024, 11, 25), 5)));

        Baseline baseline = calculator.compute(series, WindowKind.SAME_PERIOD_PRIOR_YEAR, 2, 2).orElseThrow();

        assertThat(baseline.getMean()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Should require at least two prior years")
    void shouldRequireTwoPriorYears() {
        List<MetricObservation> observations = new ArrayList<>();
        observations.add(Observations.month("r", "revenue", "revenue", YearMonth.of(2023, 3), 200));
        observations.add(Observations.month("r", "revenue", "revenue", YearMonth.of(2024, 3), 90));

        assertThat(calculator.compute(MetricSeries.of(observations), WindowKind.SAME_PERIOD_PRIOR_YEAR, 3, 1))
                .isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries monthly(double... values) {
        return MetricSeries.of("p1", "page", "sessions",
                Observations.monthly("p1", "page", "sessions", YearMonth.of(2024, 1), values));
    }
}
