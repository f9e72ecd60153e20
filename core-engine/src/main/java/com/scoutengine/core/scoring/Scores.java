package com.scoutengine.core.scoring;

import com.scoutengine.core.model.Priority;

import java.util.Objects;

/**
 * The four scores attached to an opportunity.
 *
 * @since 1.0.0
 */
public final class Scores {

    private final double confidence;
    private final double impact;
    private final double urgency;
    private final Priority priority;

    public Scores(double confidence, double impact, double urgency, Priority priority) {
        this.confidence = confidence;
        this.impact = impact;
        this.urgency = urgency;
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
    }

    /** @return confidence in {@code [0, 0.95]} */
    public double getConfidence() {
        return confidence;
    }

    /** @return potential impact in {@code [0, 100]} */
    public double getImpact() {
        return impact;
    }

    /** @return urgency in {@code [0, 100]} */
    public double getUrgency() {
        return urgency;
    }

    public Priority getPriority() {
        return priority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Scores that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && Double.compare(impact, that.impact) == 0
                && Double.compare(urgency, that.urgency) == 0
                && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(confidence, impact, urgency, priority);
    }

    @Override
    public String toString() {
        return "Scores{" +
                "confidence=" + confidence +
                ", impact=" + impact +
                ", urgency=" + urgency +
                ", priority=" + priority +
                '}';
    }
}
