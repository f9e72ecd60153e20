package com.scoutengine.core.rule;

import com.scoutengine.core.model.Baseline;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.Trend;
import com.scoutengine.core.util.SafeMath;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Everything a rule may read about one metric of one entity: the series, its
 * baseline (if defined), its trend, and the entity's rank among peers.
 *
 * @since 1.0.0
 */
public final class MetricContext {

    private final MetricSeries series;
    private final Baseline baseline;
    private final Trend trend;
    private final Double peerPercentile;

    public MetricContext(MetricSeries series, Optional<Baseline> baseline, Trend trend, OptionalDouble peerPercentile) {
        this.series = Objects.requireNonNull(series, "series must not be null");
        this.baseline = Objects.requireNonNull(baseline, "baseline must not be null").orElse(null);
        this.trend = Objects.requireNonNull(trend, "trend must not be null");
        this.peerPercentile = Objects.requireNonNull(peerPercentile, "peerPercentile must not be null").isPresent()
                ? peerPercentile.getAsDouble()
                : null;
    }

    public String getMetricName() {
        return series.getMetricName();
    }

    public MetricSeries getSeries() {
        return series;
    }

    public Optional<MetricObservation> currentObservation() {
        return series.current();
    }

    /**
     * @return the current-period value, or empty if the series has no data
     */
    public OptionalDouble currentValue() {
        return series.current()
                .map(o -> OptionalDouble.of(o.getValue()))
                .orElse(OptionalDouble.empty());
    }

    public Optional<Baseline> getBaseline() {
        return Optional.ofNullable(baseline);
    }

    public Trend getTrend() {
        return trend;
    }

    public OptionalDouble getPeerPercentile() {
        return peerPercentile != null ? OptionalDouble.of(peerPercentile) : OptionalDouble.empty();
    }

    /**
     * @return {@code (current - mean) / mean}, or empty when the current value
     *         or baseline is undefined or the mean is near zero
     */
    public OptionalDouble deviation() {
        OptionalDouble current = currentValue();
        if (current.isEmpty() || baseline == null) {
            return OptionalDouble.empty();
        }
        return SafeMath.percentChange(current.getAsDouble(), baseline.getMean());
    }

    /**
     * @return {@code (current - mean) / stddev}, or empty when undefined or
     *         the baseline has no spread
     */
    public OptionalDouble zScore() {
        OptionalDouble current = currentValue();
        if (current.isEmpty() || baseline == null) {
            return OptionalDouble.empty();
        }
        return SafeMath.divide(current.getAsDouble() - baseline.getMean(), baseline.getStddev());
    }

    @Override
    public String toString() {
        return "MetricContext{" +
                "metric='" + series.getMetricName() + '\'' +
                ", current=" + currentValue() +
                ", baseline=" + baseline +
                ", trend=" + trend +
                ", peerPercentile=" + peerPercentile +
                '}';
    }
}
