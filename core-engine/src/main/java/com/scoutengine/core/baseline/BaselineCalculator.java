package com.scoutengine.core.baseline;

import com.scoutengine.core.model.Baseline;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.WindowKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Computes comparison baselines from a metric series.
 *
 * <h3>Windows</h3>
 * <ul>
 * <li>{@link WindowKind#TRAILING_PERIODS}: up to {@code windowSize} periods
 * immediately before the current one</li>
 * <li>{@link WindowKind#SAME_PERIOD_PRIOR_YEAR}: one period per prior year at
 * the same calendar position (same month for monthly or longer periods,
 * same month-day otherwise), at most {@code windowSize} years back</li>
 * </ul>
 *
 * <h3>Minimum samples</h3>
 * <p>
 * The result is empty (undefined) when fewer than {@code minSamples}
 * qualifying periods exist, when {@code windowSize < minSamples}, or, for the
 * prior-year window, when fewer than {@value #MIN_PRIOR_YEARS} years qualify.
 * Callers must not compare against an undefined baseline.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineCalculator.class);

    /** Default minimum number of samples for a trailing baseline. */
    public static final int DEFAULT_MIN_SAMPLES = 3;

    /** Minimum qualifying years for a same-period-prior-year baseline. */
    static final int MIN_PRIOR_YEARS = 2;

    /** Periods at least this long are matched by month rather than by day. */
    private static final long MONTHLY_PERIOD_DAYS = 28;

    /**
     * Compute a baseline for the current (last) period of {@code series}.
     *
     * @param series     the metric series; must not be {@code null}
     * @param kind       window kind; must not be {@code null}
     * @param windowSize number of periods (trailing) or years (prior year)
     * @param minSamples minimum number of qualifying samples
     * @return the baseline, or empty if undefined
     */
    public Optional<Baseline> compute(MetricSeries series, WindowKind kind, int windowSize, int minSamples) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(kind, "window kind must not be null");
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }

        if (series.isEmpty() || windowSize < minSamples) {
            LOG.trace("Baseline undefined for {}/{}: size={} windowSize={} minSamples={}",
                    series.getEntityId(), series.getMetricName(), series.size(), windowSize, minSamples);
            return Optional.empty();
        }

        return switch (kind) {
            case TRAILING_PERIODS -> trailing(series, windowSize, minSamples);
            case SAME_PERIOD_PRIOR_YEAR -> samePeriodPriorYear(series, windowSize, minSamples);
        };
    }

    /**
     * Trailing baseline using the rule defaults of
     * {@value #DEFAULT_MIN_SAMPLES} minimum samples.
     */
    public Optional<Baseline> trailing(MetricSeries series, int windowSize) {
        return compute(series, WindowKind.TRAILING_PERIODS, windowSize, DEFAULT_MIN_SAMPLES);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<Baseline> trailing(MetricSeries series, int windowSize, int minSamples) {
        List<MetricObservation> history = series.history();
        int from = Math.max(0, history.size() - windowSize);
        int count = history.size() - from;
        if (count < minSamples) {
            LOG.trace("Trailing baseline undefined for {}/{}: {} sample(s) < {}",
                    series.getEntityId(), series.getMetricName(), count, minSamples);
            return Optional.empty();
        }
        double[] samples = new double[count];
        for (int i = 0; i < count; i++) {
            samples[i] = history.get(from + i).getValue();
        }
        return Optional.of(Baseline.of(WindowKind.TRAILING_PERIODS, samples));
    }

    private Optional<Baseline> samePeriodPriorYear(MetricSeries series, int windowSize, int minSamples) {
        MetricObservation current = series.current().orElseThrow();
        LocalDate currentStart = current.getPeriodStart();
        boolean matchByMonth = current.lengthInDays() >= MONTHLY_PERIOD_DAYS;
        int oldestYear = currentStart.getYear() - windowSize;

        // One sample per prior year; a later observation for the same year wins.
        Map<Integer, Double> byYear = new TreeMap<>();
        for (MetricObservation o : series.history()) {
            LocalDate start = o.getPeriodStart();
            int year = start.getYear();
            if (year >= currentStart.getYear() || year < oldestYear) {
                continue;
            }
            boolean samePosition = matchByMonth
                    ? start.getMonth() == currentStart.getMonth()
                    : MonthDay.from(start).equals(MonthDay.from(currentStart));
            if (samePosition) {
                byYear.put(year, o.getValue());
            }
        }

        int required = Math.max(MIN_PRIOR_YEARS, minSamples);
        if (byYear.size() < required) {
            LOG.trace("Prior-year baseline undefined for {}/{}: {} qualifying year(s) < {}",
                    series.getEntityId(), series.getMetricName(), byYear.size(), required);
            return Optional.empty();
        }
        double[] samples = byYear.values().stream().mapToDouble(Double::doubleValue).toArray();
        return Optional.of(Baseline.of(WindowKind.SAME_PERIOD_PRIOR_YEAR, samples));
    }
}
