package com.scoutengine.core.model;

import java.util.Locale;

/**
 * How a {@link Baseline} selects its comparison periods.
 *
 * @since 1.0.0
 */
public enum WindowKind {

    /** The N periods immediately preceding the current one. */
    TRAILING_PERIODS,

    /** The same calendar position in previous years. */
    SAME_PERIOD_PRIOR_YEAR;

    /**
     * Parse a configuration value. Accepts the enum name in any case plus the
     * short forms {@code trailing} and {@code yoy}.
     *
     * @param value configuration string
     * @return matching kind
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static WindowKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return TRAILING_PERIODS;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "trailing", "trailing_periods", "trailing_n_periods" -> TRAILING_PERIODS;
            case "yoy", "prior_year", "same_period_prior_year" -> SAME_PERIOD_PRIOR_YEAR;
            default -> throw new IllegalArgumentException(
                    "Unknown window kind: '" + value + "'. Supported: trailing, same_period_prior_year");
        };
    }
}
