package com.scoutengine.core.scoring;

import com.scoutengine.core.model.Priority;
import com.scoutengine.core.model.Trend;
import com.scoutengine.core.model.TrendPattern;
import com.scoutengine.core.rule.FiringResult;
import com.scoutengine.core.util.SafeMath;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Turns a {@link FiringResult} into confidence, impact, urgency and priority.
 *
 * <h3>Formulas</h3>
 * <ul>
 * <li>{@code confidence = clamp(baseConfidence + 0.07 * min(run, 4), 0, 0.95)}</li>
 * <li>{@code impact = clamp(dW * min(|dev| * 100 * impactScale, 100) + tW * percentile * 100, 0, 100)};
 * an undefined deviation counts as 0, a missing percentile as 0.5</li>
 * <li>{@code urgency = clamp(tier(pattern) + 20 * min(|dev|, 1), 0, 100)};
 * crisis rules never drop below {@value #CRISIS_URGENCY_FLOOR}</li>
 * </ul>
 *
 * <p>
 * Priority is a pure, total function of the three scores
 * ({@link #priorityFor(double, double, double)}); no rule can override it.
 * </p>
 *
 * @since 1.0.0
 */
public class OpportunityScorer {

    static final double RUN_CONFIDENCE_STEP = 0.07;
    static final int MAX_RUN_FOR_CONFIDENCE = 4;
    static final double MAX_CONFIDENCE = 0.95;
    static final double MISSING_PERCENTILE = 0.5;
    static final double DEVIATION_URGENCY_WEIGHT = 20.0;
    static final double CRISIS_URGENCY_FLOOR = 85.0;

    static final double HIGH_URGENCY = 80.0;
    static final double HIGH_IMPACT = 70.0;
    static final double HIGH_CONFIDENCE = 0.85;
    static final double MEDIUM_URGENCY = 55.0;
    static final double MEDIUM_IMPACT = 40.0;

    private final ScoringWeights weights;

    public OpportunityScorer() {
        this(ScoringWeights.defaults());
    }

    public OpportunityScorer(ScoringWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    /**
     * Score a firing using the traffic percentile it carries.
     */
    public Scores score(FiringResult firing) {
        Objects.requireNonNull(firing, "firing must not be null");
        return score(firing, firing.getTrafficPercentile());
    }

    /**
     * Score a firing against an explicit traffic percentile.
     *
     * @param firing            the firing; must not be {@code null}
     * @param trafficPercentile entity rank in {@code [0, 1]} among its peers,
     *                          or empty if unknown
     * @return the scores
     */
    public Scores score(FiringResult firing, OptionalDouble trafficPercentile) {
        Objects.requireNonNull(firing, "firing must not be null");
        Objects.requireNonNull(trafficPercentile, "trafficPercentile must not be null");

        Trend trend = firing.getTrend();
        double absDeviation = Math.abs(firing.getDeviationPct().orElse(0.0));

        double confidence = confidence(firing.getRule().getBaseConfidence(), trend.getConsecutiveRunLength());
        double impact = impact(absDeviation, firing.getRule().getImpactScale(),
                trafficPercentile.orElse(MISSING_PERCENTILE));
        double urgency = urgency(trend.getPattern(), absDeviation, firing.getRule().isCrisis());

        return new Scores(confidence, impact, urgency, priorityFor(confidence, impact, urgency));
    }

    // ---------------------------------------------------------------
    // Components
    // ---------------------------------------------------------------

    static double confidence(double baseConfidence, int runLength) {
        int run = Math.max(0, Math.min(runLength, MAX_RUN_FOR_CONFIDENCE));
        return SafeMath.clamp(baseConfidence + RUN_CONFIDENCE_STEP * run, 0.0, MAX_CONFIDENCE);
    }

    double impact(double absDeviation, double impactScale, double percentile) {
        double deviationPart = Math.min(absDeviation * 100.0 * impactScale, 100.0);
        double trafficPart = SafeMath.clamp(percentile, 0.0, 1.0) * 100.0;
        return SafeMath.clamp(weights.getDeviationWeight() * deviationPart
                + weights.getTrafficWeight() * trafficPart, 0.0, 100.0);
    }

    static double urgency(TrendPattern pattern, double absDeviation, boolean crisis) {
        double urgency = SafeMath.clamp(tier(pattern) + DEVIATION_URGENCY_WEIGHT * Math.min(absDeviation, 1.0),
                0.0, 100.0);
        return crisis ? Math.max(urgency, CRISIS_URGENCY_FLOOR) : urgency;
    }

    static double tier(TrendPattern pattern) {
        return switch (pattern) {
            case ACCELERATING_DECLINE -> 80;
            case DECLINING -> 60;
            case DECELERATING_DECLINE -> 50;
            case ACCELERATING_IMPROVEMENT -> 35;
            case DECELERATING_IMPROVEMENT -> 25;
            case IMPROVING, STABLE -> 20;
        };
    }

    /**
     * Map scores to a priority. Total over all inputs, including NaN, which
     * fails every comparison and therefore lands on {@link Priority#LOW}.
     */
    public static Priority priorityFor(double confidence, double impact, double urgency) {
        if (urgency >= HIGH_URGENCY || (impact >= HIGH_IMPACT && confidence >= HIGH_CONFIDENCE)) {
            return Priority.HIGH;
        }
        if (urgency >= MEDIUM_URGENCY || impact >= MEDIUM_IMPACT) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }
}
