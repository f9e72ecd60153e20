package com.scoutengine.core.scoring;

import java.util.Objects;

/**
 * Relative weight of deviation magnitude and traffic percentile in the impact
 * score.
 *
 * <p>
 * Both weights must lie in {@code [0, 1]} and at least one must be positive.
 * They are not normalised; impact is clamped to {@code [0, 100]} regardless.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoringWeights {

    public static final double DEFAULT_DEVIATION_WEIGHT = 0.6;
    public static final double DEFAULT_TRAFFIC_WEIGHT = 0.4;

    private static final ScoringWeights DEFAULTS = new ScoringWeights(DEFAULT_DEVIATION_WEIGHT, DEFAULT_TRAFFIC_WEIGHT);

    private final double deviationWeight;
    private final double trafficWeight;

    private ScoringWeights(double deviationWeight, double trafficWeight) {
        this.deviationWeight = deviationWeight;
        this.trafficWeight = trafficWeight;
    }

    /**
     * @throws IllegalArgumentException if a weight is outside {@code [0, 1]}
     *                                  or both are zero
     */
    public static ScoringWeights of(double deviationWeight, double trafficWeight) {
        requireUnit(deviationWeight, "deviationWeight");
        requireUnit(trafficWeight, "trafficWeight");
        if (deviationWeight + trafficWeight <= 0) {
            throw new IllegalArgumentException("At least one impact weight must be positive");
        }
        return new ScoringWeights(deviationWeight, trafficWeight);
    }

    public static ScoringWeights defaults() {
        return DEFAULTS;
    }

    private static void requireUnit(double value, String name) {
        if (!(value >= 0 && value <= 1)) {
            throw new IllegalArgumentException(name + " must be in [0, 1], got: " + value);
        }
    }

    public double getDeviationWeight() {
        return deviationWeight;
    }

    public double getTrafficWeight() {
        return trafficWeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScoringWeights that))
            return false;
        return Double.compare(deviationWeight, that.deviationWeight) == 0
                && Double.compare(trafficWeight, that.trafficWeight) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviationWeight, trafficWeight);
    }

    @Override
    public String toString() {
        return "ScoringWeights{deviation=" + deviationWeight + ", traffic=" + trafficWeight + '}';
    }
}
