package com.scoutengine.core.model;

import java.util.Objects;

/**
 * Classified trend: a {@link TrendPattern} plus the number of consecutive
 * periods that moved in the same direction.
 *
 * @since 1.0.0
 */
public final class Trend {

    private static final Trend STABLE = new Trend(TrendPattern.STABLE, 0);

    private final TrendPattern pattern;
    private final int consecutiveRunLength;

    private Trend(TrendPattern pattern, int consecutiveRunLength) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        if (consecutiveRunLength < 0) {
            throw new IllegalArgumentException("consecutiveRunLength must be >= 0, got: " + consecutiveRunLength);
        }
        this.consecutiveRunLength = consecutiveRunLength;
    }

    public static Trend of(TrendPattern pattern, int consecutiveRunLength) {
        if (pattern == TrendPattern.STABLE && consecutiveRunLength == 0) {
            return STABLE;
        }
        return new Trend(pattern, consecutiveRunLength);
    }

    /**
     * @return the shared {@code STABLE / 0} trend
     */
    public static Trend stable() {
        return STABLE;
    }

    public TrendPattern getPattern() {
        return pattern;
    }

    public int getConsecutiveRunLength() {
        return consecutiveRunLength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Trend that))
            return false;
        return consecutiveRunLength == that.consecutiveRunLength && pattern == that.pattern;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, consecutiveRunLength);
    }

    @Override
    public String toString() {
        return pattern + "(" + consecutiveRunLength + ")";
    }
}
