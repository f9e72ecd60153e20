package com.scoutengine.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an {@link Opportunity}. The engine only ever creates
 * {@link #NEW}; later transitions belong to the consuming application.
 *
 * @since 1.0.0
 */
public enum OpportunityStatus {
    NEW,
    ACKNOWLEDGED,
    RESOLVED,
    DISMISSED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
