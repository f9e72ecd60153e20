package com.scoutengine.core.trend;

import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.Trend;
import com.scoutengine.core.model.TrendPattern;
import com.scoutengine.core.util.SafeMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Classifies the shape of recent change in a metric series.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Take the last {@code lookback} observations and compute
 * period-over-period percentage deltas, most recent first
 * ({@code d0, d1, d2} for the default lookback of
 * {@value #DEFAULT_LOOKBACK}). A delta whose base value is zero is
 * undefined and counts as flat.</li>
 * <li>The direction is the sign of {@code d0}. A flat {@code d0} is
 * {@link TrendPattern#STABLE}.</li>
 * <li>The run length counts consecutive deltas from {@code d0} backwards with
 * the same sign. A flat delta breaks the run.</li>
 * <li>A run shorter than {@value #MIN_RUN_FOR_TREND} is {@code STABLE}.</li>
 * <li>With all deltas defined, magnitudes strictly growing towards the present
 * give {@code ACCELERATING_*}, strictly shrinking give
 * {@code DECELERATING_*}; anything else is the bare {@code DECLINING} or
 * {@code IMPROVING}.</li>
 * </ol>
 *
 * <p>
 * Series shorter than {@code lookback} are classified {@code STABLE} with a run
 * length of 0. {@code STABLE} always reports a run length of 0. The classifier
 * never throws on short or flat input.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(TrendClassifier.class);

    public static final int DEFAULT_LOOKBACK = 4;

    static final int MIN_RUN_FOR_TREND = 2;

    private final int lookback;

    public TrendClassifier() {
        this(DEFAULT_LOOKBACK);
    }

    /**
     * @param lookback number of trailing observations to inspect; at least 3
     *                 so that acceleration can be judged
     */
    public TrendClassifier(int lookback) {
        if (lookback < 3) {
            throw new IllegalArgumentException("lookback must be >= 3, got: " + lookback);
        }
        this.lookback = lookback;
    }

    public int getLookback() {
        return lookback;
    }

    /**
     * Classify the trend at the end of {@code series}.
     *
     * @param series the series; must not be {@code null}
     * @return the trend, {@link Trend#stable()} on insufficient history
     */
    public Trend classify(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.size() < lookback) {
            LOG.trace("Trend for {}/{} is STABLE: {} observation(s) < lookback {}",
                    series.getEntityId(), series.getMetricName(), series.size(), lookback);
            return Trend.stable();
        }
        return classify(series.lastValues(lookback));
    }

    /**
     * Classify a raw window of values, oldest first.
     *
     * @param values window values; only the last {@code lookback} are used
     * @return the trend
     */
    public Trend classify(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < lookback) {
            return Trend.stable();
        }

        int deltaCount = lookback - 1;
        int offset = values.length - lookback;
        // deltas[0] is the most recent change
        OptionalDouble[] deltas = new OptionalDouble[deltaCount];
        for (int i = 0; i < deltaCount; i++) {
            int newer = offset + lookback - 1 - i;
            deltas[i] = SafeMath.percentChange(values[newer], values[newer - 1]);
        }

        int direction = sign(deltas[0]);
        if (direction == 0) {
            return Trend.stable();
        }

        int run = 0;
        for (OptionalDouble d : deltas) {
            if (sign(d) != direction) {
                break;
            }
            run++;
        }
        run = Math.min(run, lookback);

        if (run < MIN_RUN_FOR_TREND) {
            return Trend.stable();
        }

        boolean declining = direction < 0;
        return Trend.of(refine(deltas, declining), run);
    }

    private static TrendPattern refine(OptionalDouble[] deltas, boolean declining) {
        for (OptionalDouble d : deltas) {
            if (d.isEmpty()) {
                return declining ? TrendPattern.DECLINING : TrendPattern.IMPROVING;
            }
        }
        boolean accelerating = true;
        boolean decelerating = true;
        for (int i = 0; i < deltas.length - 1; i++) {
            double newer = Math.abs(deltas[i].getAsDouble());
            double older = Math.abs(deltas[i + 1].getAsDouble());
            accelerating &= newer > older;
            decelerating &= newer < older;
        }
        if (accelerating) {
            return declining ? TrendPattern.ACCELERATING_DECLINE : TrendPattern.ACCELERATING_IMPROVEMENT;
        }
        if (decelerating) {
            return declining ? TrendPattern.DECELERATING_DECLINE : TrendPattern.DECELERATING_IMPROVEMENT;
        }
        return declining ? TrendPattern.DECLINING : TrendPattern.IMPROVING;
    }

    private static int sign(OptionalDouble delta) {
        if (delta.isEmpty()) {
            return 0;
        }
        double d = delta.getAsDouble();
        if (Math.abs(d) < SafeMath.EPSILON) {
            return 0;
        }
        return d < 0 ? -1 : 1;
    }
}
