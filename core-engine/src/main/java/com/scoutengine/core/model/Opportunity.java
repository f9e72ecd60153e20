package com.scoutengine.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scored, evidence-backed record produced when a rule fires for an entity.
 *
 * <p>
 * Serialized to JSON and handed to an opportunity sink. The engine creates
 * each instance once per firing and never mutates it afterwards; status
 * transitions past {@link OpportunityStatus#NEW} belong to the consumer.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code entityId}, {@code entityType},
 * {@code ruleId}, {@code category}, {@code priority} and {@code detectedAt}
 * are required; omitting any of them throws {@link NullPointerException} at
 * build time. Scores are range-checked.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Opportunity implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String organizationId;
    private final String entityId;
    private final String entityType;
    private final String ruleId;
    private final String area;
    private final String category;
    private final String type;
    private final Priority priority;
    private final OpportunityStatus status;
    private final String title;
    private final String description;
    private final Map<String, Object> evidence;
    private final double confidenceScore;
    private final double potentialImpactScore;
    private final double urgencyScore;
    private final Instant detectedAt;
    private final List<String> recommendedActions;
    private final String estimatedEffort;
    private final String estimatedTimeline;

    private Opportunity(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.organizationId = b.organizationId;
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(b.entityType, "entityType must not be null");
        this.ruleId = Objects.requireNonNull(b.ruleId, "ruleId must not be null");
        this.area = b.area;
        this.category = Objects.requireNonNull(b.category, "category must not be null");
        this.type = b.type;
        this.priority = Objects.requireNonNull(b.priority, "priority must not be null");
        this.status = OpportunityStatus.NEW;
        this.title = b.title;
        this.description = b.description;
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(b.evidence));
        this.confidenceScore = requireRange(b.confidenceScore, 0.0, 1.0, "confidenceScore");
        this.potentialImpactScore = requireRange(b.potentialImpactScore, 0.0, 100.0, "potentialImpactScore");
        this.urgencyScore = requireRange(b.urgencyScore, 0.0, 100.0, "urgencyScore");
        this.detectedAt = Objects.requireNonNull(b.detectedAt, "detectedAt must not be null");
        this.recommendedActions = List.copyOf(b.recommendedActions);
        this.estimatedEffort = b.estimatedEffort;
        this.estimatedTimeline = b.estimatedTimeline;
    }

    private static double requireRange(double value, double min, double max, String name) {
        if (!(value >= min && value <= max)) {
            throw new IllegalArgumentException(name + " must be in [" + min + ", " + max + "], got: " + value);
        }
        return value;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Opportunity} instances.
     */
    public static class Builder {
        private String id;
        private String organizationId;
        private String entityId;
        private String entityType;
        private String ruleId;
        private String area;
        private String category;
        private String type;
        private Priority priority;
        private String title;
        private String description;
        private Map<String, Object> evidence = Map.of();
        private double confidenceScore;
        private double potentialImpactScore;
        private double urgencyScore;
        private Instant detectedAt;
        private List<String> recommendedActions = List.of();
        private String estimatedEffort;
        private String estimatedTimeline;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder area(String area) {
            this.area = area;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(Map<String, Object> evidence) {
            this.evidence = evidence != null ? evidence : Map.of();
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder potentialImpactScore(double potentialImpactScore) {
            this.potentialImpactScore = potentialImpactScore;
            return this;
        }

        public Builder urgencyScore(double urgencyScore) {
            this.urgencyScore = urgencyScore;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder recommendedActions(List<String> recommendedActions) {
            this.recommendedActions = recommendedActions != null ? recommendedActions : List.of();
            return this;
        }

        public Builder estimatedEffort(String estimatedEffort) {
            this.estimatedEffort = estimatedEffort;
            return this;
        }

        public Builder estimatedTimeline(String estimatedTimeline) {
            this.estimatedTimeline = estimatedTimeline;
            return this;
        }

        /**
         * @return a new {@link Opportunity}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if a score is out of range
         */
        public Opportunity build() {
            return new Opportunity(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getArea() {
        return area;
    }

    public String getCategory() {
        return category;
    }

    public String getType() {
        return type;
    }

    public Priority getPriority() {
        return priority;
    }

    public OpportunityStatus getStatus() {
        return status;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return unmodifiable evidence map, in insertion order
     */
    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public double getPotentialImpactScore() {
        return potentialImpactScore;
    }

    public double getUrgencyScore() {
        return urgencyScore;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    public String getEstimatedEffort() {
        return estimatedEffort;
    }

    public String getEstimatedTimeline() {
        return estimatedTimeline;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Opportunity that))
            return false;
        return id.equals(that.id) && detectedAt.equals(that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, detectedAt);
    }

    @Override
    public String toString() {
        return "Opportunity{" +
                "id='" + id + '\'' +
                ", entityId='" + entityId + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", category='" + category + '\'' +
                ", priority=" + priority +
                ", urgency=" + urgencyScore +
                ", impact=" + potentialImpactScore +
                ", confidence=" + confidenceScore +
                '}';
    }
}
