package com.scoutengine.core.rule;

import com.scoutengine.core.model.Baseline;
import com.scoutengine.core.model.ComparisonOperator;
import com.scoutengine.core.model.ConditionSubject;
import com.scoutengine.core.model.TrendPattern;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * One compiled rule condition: a comparison of a metric quantity against a
 * constant, or a trend-pattern membership test.
 *
 * <p>
 * A condition whose quantity is undefined (no current value, undefined
 * baseline, zero mean or zero spread, no peer rank) evaluates to
 * {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Condition implements RulePredicate {

    private final ConditionSubject subject;
    private final String metric;
    private final ComparisonOperator operator;
    private final double value;
    private final Set<TrendPattern> patterns;

    private Condition(ConditionSubject subject, String metric, ComparisonOperator operator,
                      double value, Set<TrendPattern> patterns) {
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.operator = operator;
        this.value = value;
        this.patterns = patterns;
    }

    /**
     * @throws IllegalArgumentException if {@code subject} is {@code TREND}
     */
    public static Condition compare(ConditionSubject subject, String metric, ComparisonOperator operator, double value) {
        if (subject == ConditionSubject.TREND) {
            throw new IllegalArgumentException("Use Condition.trendIn(...) for trend conditions");
        }
        return new Condition(subject, metric, Objects.requireNonNull(operator, "operator must not be null"),
                value, Set.of());
    }

    public static Condition trendIn(String metric, Set<TrendPattern> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("Trend condition requires at least one pattern");
        }
        return new Condition(ConditionSubject.TREND, metric, null, 0,
                Collections.unmodifiableSet(EnumSet.copyOf(patterns)));
    }

    @Override
    public boolean test(EvaluationContext context) {
        MetricContext m = context.require(metric);
        if (subject == ConditionSubject.TREND) {
            return patterns.contains(m.getTrend().getPattern());
        }
        OptionalDouble quantity = quantity(m);
        return quantity.isPresent() && operator.test(quantity.getAsDouble(), value);
    }

    private OptionalDouble quantity(MetricContext m) {
        return switch (subject) {
            case CURRENT -> m.currentValue();
            case BASELINE_MEAN -> m.getBaseline()
                    .map(b -> OptionalDouble.of(b.getMean()))
                    .orElse(OptionalDouble.empty());
            case DEVIATION -> m.deviation();
            case ZSCORE -> m.zScore();
            case PEER_PERCENTILE -> m.getPeerPercentile();
            case RUN_LENGTH -> OptionalDouble.of(m.getTrend().getConsecutiveRunLength());
            case TREND -> throw new IllegalStateException("unreachable");
        };
    }

    /**
     * @return {@code true} if this condition reads a {@link Baseline}
     */
    public boolean requiresBaseline() {
        return subject.requiresBaseline();
    }

    public ConditionSubject getSubject() {
        return subject;
    }

    public String getMetric() {
        return metric;
    }

    @Override
    public String toString() {
        if (subject == ConditionSubject.TREND) {
            return metric + ".trend in " + patterns;
        }
        return metric + "." + subject.name().toLowerCase(Locale.ROOT)
                + " " + operator.symbol() + " " + value;
    }
}
