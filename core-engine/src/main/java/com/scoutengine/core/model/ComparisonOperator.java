package com.scoutengine.core.model;

import java.util.Locale;

/**
 * Numeric comparison used by rule conditions.
 *
 * @since 1.0.0
 */
public enum ComparisonOperator {
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ("=="),
    NE("!=");

    /** Tolerance used by {@link #EQ} and {@link #NE}. */
    static final double EPSILON = 1e-9;

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} if {@code left <op> right} holds
     */
    public boolean test(double left, double right) {
        return switch (this) {
            case GT -> left > right;
            case GTE -> left >= right;
            case LT -> left < right;
            case LTE -> left <= right;
            case EQ -> Math.abs(left - right) <= EPSILON;
            case NE -> Math.abs(left - right) > EPSILON;
        };
    }

    /**
     * Parse either the enum name ({@code gt}) or the symbol ({@code >}).
     *
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static ComparisonOperator fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Comparison operator must not be blank");
        }
        String v = value.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(v)) {
                return op;
            }
        }
        return ComparisonOperator.valueOf(v.toUpperCase(Locale.ROOT));
    }
}
