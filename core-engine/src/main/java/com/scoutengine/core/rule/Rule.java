package com.scoutengine.core.rule;

import com.scoutengine.core.model.WindowKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, compiled detection rule.
 *
 * <p>
 * Rules are normally compiled from YAML {@link com.scoutengine.core.model.DetectionRule}s
 * by {@link RuleFactory}, but can also be assembled in code with a custom
 * {@link RulePredicate}. Either way the rule declares which metrics need a
 * defined baseline; the {@link RuleEvaluator} refuses to evaluate the rule
 * when any of them is undefined.
 * </p>
 *
 * @since 1.0.0
 */
public final class Rule {

    private final String id;
    private final String area;
    private final String category;
    private final String type;
    private final Set<String> entityTypes;
    private final List<String> metrics;
    private final String trafficMetric;
    private final WindowKind windowKind;
    private final int windowSize;
    private final int minSamples;
    private final RulePredicate predicate;
    private final Set<String> requiredBaselines;
    private final EvidenceExtractor evidenceExtractor;
    private final double baseConfidence;
    private final boolean crisis;
    private final double impactScale;
    private final String title;
    private final String description;
    private final List<String> recommendedActions;
    private final String estimatedEffort;
    private final String estimatedTimeline;

    private Rule(Builder b) {
        this.id = requireNonBlank(b.id, "id");
        this.area = b.area;
        this.category = requireNonBlank(b.category, "category");
        this.type = b.type != null ? b.type : b.id;
        if (b.entityTypes.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + id + "' applies to no entity types");
        }
        if (b.metrics.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + id + "' references no metrics");
        }
        this.entityTypes = Collections.unmodifiableSet(new LinkedHashSet<>(b.entityTypes));
        this.metrics = List.copyOf(new LinkedHashSet<>(b.metrics));
        this.trafficMetric = b.trafficMetric;
        this.windowKind = Objects.requireNonNull(b.windowKind, "windowKind must not be null");
        if (b.windowSize < 1 || b.minSamples < 1) {
            throw new IllegalArgumentException("Rule '" + id + "' requires windowSize and minSamples >= 1");
        }
        this.windowSize = b.windowSize;
        this.minSamples = b.minSamples;
        this.predicate = Objects.requireNonNull(b.predicate, "predicate must not be null");
        for (String m : b.requiredBaselines) {
            if (!metrics.contains(m)) {
                throw new IllegalArgumentException("Rule '" + id + "' requires a baseline for undeclared metric '" + m + "'");
            }
        }
        this.requiredBaselines = Collections.unmodifiableSet(new LinkedHashSet<>(b.requiredBaselines));
        this.evidenceExtractor = b.evidenceExtractor != null ? b.evidenceExtractor : EvidenceExtractor.NONE;
        if (b.baseConfidence < 0 || b.baseConfidence > 1) {
            throw new IllegalArgumentException("Rule '" + id + "' baseConfidence must be in [0, 1]");
        }
        this.baseConfidence = b.baseConfidence;
        this.crisis = b.crisis;
        if (!(b.impactScale > 0)) {
            throw new IllegalArgumentException("Rule '" + id + "' impactScale must be > 0");
        }
        this.impactScale = b.impactScale;
        this.title = b.title;
        this.description = b.description;
        this.recommendedActions = List.copyOf(b.recommendedActions);
        this.estimatedEffort = b.estimatedEffort;
        this.estimatedTimeline = b.estimatedTimeline;
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rule " + name + " must not be null or blank");
        }
        return value;
    }

    /**
     * @return {@code true} if the rule applies to entities of {@code entityType}
     */
    public boolean appliesTo(String entityType) {
        return entityTypes.contains(entityType);
    }

    public String primaryMetric() {
        return metrics.get(0);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
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

    public Set<String> getEntityTypes() {
        return entityTypes;
    }

    /**
     * @return referenced metrics, primary first
     */
    public List<String> getMetrics() {
        return metrics;
    }

    public String getTrafficMetric() {
        return trafficMetric;
    }

    public WindowKind getWindowKind() {
        return windowKind;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public RulePredicate getPredicate() {
        return predicate;
    }

    public Set<String> getRequiredBaselines() {
        return requiredBaselines;
    }

    public EvidenceExtractor getEvidenceExtractor() {
        return evidenceExtractor;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public boolean isCrisis() {
        return crisis;
    }

    public double getImpactScale() {
        return impactScale;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
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
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Rule}. {@code id}, {@code category}, at least
     * one entity type, at least one metric and a predicate are required.
     */
    public static class Builder {
        private String id;
        private String area;
        private String category;
        private String type;
        private final List<String> entityTypes = new ArrayList<>();
        private final List<String> metrics = new ArrayList<>();
        private String trafficMetric;
        private WindowKind windowKind = WindowKind.TRAILING_PERIODS;
        private int windowSize = 3;
        private int minSamples = 3;
        private RulePredicate predicate;
        private final Set<String> requiredBaselines = new LinkedHashSet<>();
        private EvidenceExtractor evidenceExtractor;
        private double baseConfidence = 0.70;
        private boolean crisis;
        private double impactScale = 1.0;
        private String title;
        private String description;
        private List<String> recommendedActions = List.of();
        private String estimatedEffort;
        private String estimatedTimeline;

        public Builder id(String id) {
            this.id = id;
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

        public Builder entityTypes(String... entityTypes) {
            this.entityTypes.addAll(List.of(entityTypes));
            return this;
        }

        public Builder entityTypes(List<String> entityTypes) {
            this.entityTypes.addAll(entityTypes);
            return this;
        }

        public Builder metrics(String... metrics) {
            this.metrics.addAll(List.of(metrics));
            return this;
        }

        public Builder metrics(List<String> metrics) {
            this.metrics.addAll(metrics);
            return this;
        }

        public Builder trafficMetric(String trafficMetric) {
            this.trafficMetric = trafficMetric;
            return this;
        }

        public Builder window(WindowKind windowKind, int windowSize) {
            this.windowKind = windowKind;
            this.windowSize = windowSize;
            return this;
        }

        public Builder minSamples(int minSamples) {
            this.minSamples = minSamples;
            return this;
        }

        public Builder predicate(RulePredicate predicate) {
            this.predicate = predicate;
            return this;
        }

        /**
         * Declare that the rule must not fire unless {@code metric} has a
         * defined baseline.
         */
        public Builder requireBaseline(String metric) {
            this.requiredBaselines.add(metric);
            return this;
        }

        public Builder evidenceExtractor(EvidenceExtractor evidenceExtractor) {
            this.evidenceExtractor = evidenceExtractor;
            return this;
        }

        public Builder baseConfidence(double baseConfidence) {
            this.baseConfidence = baseConfidence;
            return this;
        }

        public Builder crisis(boolean crisis) {
            this.crisis = crisis;
            return this;
        }

        public Builder impactScale(double impactScale) {
            this.impactScale = impactScale;
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
         * @throws IllegalArgumentException if the configuration is invalid
         * @throws NullPointerException     if the predicate is missing
         */
        public Rule build() {
            return new Rule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Rule that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Rule{" +
                "id='" + id + '\'' +
                ", category='" + category + '\'' +
                ", metrics=" + metrics +
                ", window=" + windowKind + "/" + windowSize +
                '}';
    }
}
