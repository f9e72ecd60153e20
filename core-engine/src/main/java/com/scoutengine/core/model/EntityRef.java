package com.scoutengine.core.model;

import java.util.Objects;

/**
 * Identifies a tracked entity (page, campaign, keyword, email, aggregate).
 *
 * @since 1.0.0
 */
public final class EntityRef {

    private final String entityId;
    private final String entityType;

    public EntityRef(String entityId, String entityType) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(entityType, "entityType must not be null");
    }

    public static EntityRef of(String entityId, String entityType) {
        return new EntityRef(entityId, entityType);
    }

    public String getEntityId() {
        return entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityRef that))
            return false;
        return entityId.equals(that.entityId) && entityType.equals(that.entityType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, entityType);
    }

    @Override
    public String toString() {
        return entityType + ":" + entityId;
    }
}
