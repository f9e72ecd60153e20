package com.scoutengine.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Three-tier priority of an {@link Opportunity}. Declared in ascending order,
 * so {@link #compareTo(Enum)} ranks {@code HIGH} above {@code LOW}.
 *
 * @since 1.0.0
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
