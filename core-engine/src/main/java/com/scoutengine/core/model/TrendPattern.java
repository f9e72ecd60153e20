package com.scoutengine.core.model;

import java.util.Locale;

/**
 * Qualitative shape of recent period-over-period change.
 *
 * @since 1.0.0
 */
public enum TrendPattern {
    STABLE,
    IMPROVING,
    DECLINING,
    ACCELERATING_IMPROVEMENT,
    ACCELERATING_DECLINE,
    DECELERATING_IMPROVEMENT,
    DECELERATING_DECLINE;

    public boolean isDecline() {
        return this == DECLINING || this == ACCELERATING_DECLINE || this == DECELERATING_DECLINE;
    }

    public boolean isImprovement() {
        return this == IMPROVING || this == ACCELERATING_IMPROVEMENT || this == DECELERATING_IMPROVEMENT;
    }

    /**
     * Parse a configuration value, tolerating case and hyphens.
     *
     * @param value pattern name, e.g. {@code accelerating_decline}
     * @return matching pattern
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static TrendPattern fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Trend pattern must not be blank");
        }
        return TrendPattern.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
