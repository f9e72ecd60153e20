package com.scoutengine.core.source;

import java.util.Objects;

/**
 * Current value of a metric for one entity, as seen by its cohort.
 *
 * @since 1.0.0
 */
public final class PeerValue {

    private final String entityId;
    private final double value;

    public PeerValue(String entityId, double value) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.value = value;
    }

    public static PeerValue of(String entityId, double value) {
        return new PeerValue(entityId, value);
    }

    public String getEntityId() {
        return entityId;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeerValue that))
            return false;
        return Double.compare(value, that.value) == 0 && entityId.equals(that.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, value);
    }

    @Override
    public String toString() {
        return entityId + "=" + value;
    }
}
