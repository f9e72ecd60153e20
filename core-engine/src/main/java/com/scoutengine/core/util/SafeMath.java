package com.scoutengine.core.util;

import java.util.OptionalDouble;

/**
 * Guarded arithmetic for ratios against baselines.
 *
 * <p>
 * A denominator that is non-finite or within {@value #EPSILON} of zero makes
 * the result <em>undefined</em> ({@link OptionalDouble#empty()}) instead of
 * NaN or infinity.
 * </p>
 *
 * @since 1.0.0
 */
public final class SafeMath {

    /** Denominators smaller than this in magnitude are treated as zero. */
    public static final double EPSILON = 1e-9;

    private SafeMath() {
        // utility class - not instantiable
    }

    /**
     * @return {@code numerator / denominator}, or empty if the denominator is
     *         near zero or either operand is not finite
     */
    public static OptionalDouble divide(double numerator, double denominator) {
        if (!Double.isFinite(numerator) || !Double.isFinite(denominator) || Math.abs(denominator) < EPSILON) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(numerator / denominator);
    }

    /**
     * Relative change from {@code base} to {@code value} as a fraction
     * ({@code -0.25} is a 25% drop).
     *
     * @return the change, or empty if {@code base} is near zero
     */
    public static OptionalDouble percentChange(double value, double base) {
        return divide(value - base, base);
    }

    public static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
