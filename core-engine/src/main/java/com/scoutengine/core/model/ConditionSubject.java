package com.scoutengine.core.model;

import java.util.Locale;

/**
 * The quantity a rule condition reads.
 *
 * @since 1.0.0
 */
public enum ConditionSubject {

    /** Current-period value of the metric. */
    CURRENT(false),

    /** Baseline mean of the metric. */
    BASELINE_MEAN(true),

    /** {@code (current - mean) / mean}, as a fraction. */
    DEVIATION(true),

    /** {@code (current - mean) / stddev}. */
    ZSCORE(true),

    /** Rank of the entity's current value among peers of the same type, in [0,1]. */
    PEER_PERCENTILE(false),

    /** Consecutive same-direction periods of the metric's trend. */
    RUN_LENGTH(false),

    /** Trend pattern of the metric; matched against a set of patterns. */
    TREND(false);

    private final boolean requiresBaseline;

    ConditionSubject(boolean requiresBaseline) {
        this.requiresBaseline = requiresBaseline;
    }

    public boolean requiresBaseline() {
        return requiresBaseline;
    }

    public static ConditionSubject fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Condition subject must not be blank");
        }
        return ConditionSubject.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
