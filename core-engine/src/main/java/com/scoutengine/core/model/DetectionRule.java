package com.scoutengine.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single opportunity-detection rule loaded from configuration.
 *
 * <p>
 * A rule names the entity types it applies to, the metrics it reads (the
 * first one is the <em>primary</em> metric whose deviation and trend drive
 * scoring), how its baseline is built, and a list of {@link ConditionSpec}s
 * that must all hold for the rule to fire.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Unique rule id, also part of every opportunity id the rule produces. */
    private String id;

    /** Business area the rule belongs to: email, revenue, pages, traffic, seo, advertising, content. */
    private String area;

    /** Opportunity category; opportunities are deduplicated per entity and category. */
    private String category;

    /** Opportunity type label, e.g. {@code accelerating_decay}. Defaults to the rule id. */
    private String type;

    private List<String> entityTypes = new ArrayList<>();

    /** Metrics the rule reads; the first is the primary metric. */
    private List<String> metrics = new ArrayList<>();

    /** Metric used to rank the entity among its peers for impact scoring. */
    private String trafficMetric;

    // --- Baseline ---
    private String window = "trailing";
    private int windowSize = 3;
    private int minSamples = 3;

    // --- Scoring ---
    private double baseConfidence = 0.70;
    private boolean crisis;
    private double impactScale = 1.0;

    private List<ConditionSpec> conditions = new ArrayList<>();

    // --- Presentation ---
    private String title;
    private String description;
    private List<String> recommendedActions = new ArrayList<>();
    private String estimatedEffort;
    private String estimatedTimeline;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields are present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (category == null || category.isBlank()) {
            errors.add("Rule '" + id + "' requires 'category'");
        }
        if (entityTypes == null || entityTypes.isEmpty()) {
            errors.add("Rule '" + id + "' requires at least one entry in 'entityTypes'");
        }
        if (metrics == null || metrics.isEmpty()) {
            errors.add("Rule '" + id + "' requires at least one entry in 'metrics'");
        }
        try {
            WindowKind.fromConfig(window);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + id + "': " + e.getMessage());
        }
        if (windowSize < 1) {
            errors.add("Rule '" + id + "' requires 'windowSize' >= 1, got: " + windowSize);
        }
        if (minSamples < 1) {
            errors.add("Rule '" + id + "' requires 'minSamples' >= 1, got: " + minSamples);
        }
        if (baseConfidence < 0 || baseConfidence > 1) {
            errors.add("Rule '" + id + "' requires 'baseConfidence' in [0, 1], got: " + baseConfidence);
        }
        if (!(impactScale > 0)) {
            errors.add("Rule '" + id + "' requires 'impactScale' > 0, got: " + impactScale);
        }
        if (conditions == null || conditions.isEmpty()) {
            errors.add("Rule '" + id + "' requires at least one condition");
        } else {
            for (ConditionSpec condition : conditions) {
                if (condition == null) {
                    errors.add("Rule '" + id + "' has a null condition");
                } else {
                    errors.addAll(condition.validate(id, metrics));
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectionRule: " + String.join("; ", errors));
        }
    }

    /**
     * @return the primary metric, or {@code null} if none are declared
     */
    public String primaryMetric() {
        return metrics == null || metrics.isEmpty() ? null : metrics.get(0);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getArea() {
        return area;
    }

    /**
     * Set the business area, normalised to lowercase.
     *
     * @param area business area name
     */
    public void setArea(String area) {
        this.area = area != null ? area.toLowerCase(Locale.ROOT) : null;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public List<String> getEntityTypes() {
        return entityTypes;
    }

    public void setEntityTypes(List<String> entityTypes) {
        this.entityTypes = entityTypes != null ? new ArrayList<>(entityTypes) : new ArrayList<>();
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<String> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    public String getTrafficMetric() {
        return trafficMetric;
    }

    public void setTrafficMetric(String trafficMetric) {
        this.trafficMetric = trafficMetric;
    }

    public String getWindow() {
        return window;
    }

    public void setWindow(String window) {
        this.window = window;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public void setBaseConfidence(double baseConfidence) {
        this.baseConfidence = baseConfidence;
    }

    public boolean isCrisis() {
        return crisis;
    }

    public void setCrisis(boolean crisis) {
        this.crisis = crisis;
    }

    public double getImpactScale() {
        return impactScale;
    }

    public void setImpactScale(double impactScale) {
        this.impactScale = impactScale;
    }

    public List<ConditionSpec> getConditions() {
        return conditions;
    }

    public void setConditions(List<ConditionSpec> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getRecommendedActions() {
        return recommendedActions;
    }

    public void setRecommendedActions(List<String> recommendedActions) {
        this.recommendedActions = recommendedActions != null ? new ArrayList<>(recommendedActions) : new ArrayList<>();
    }

    public String getEstimatedEffort() {
        return estimatedEffort;
    }

    public void setEstimatedEffort(String estimatedEffort) {
        this.estimatedEffort = estimatedEffort;
    }

    public String getEstimatedTimeline() {
        return estimatedTimeline;
    }

    public void setEstimatedTimeline(String estimatedTimeline) {
        this.estimatedTimeline = estimatedTimeline;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionRule that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category);
    }

    @Override
    public String toString() {
        return "DetectionRule{" +
                "id='" + id + '\'' +
                ", area='" + area + '\'' +
                ", category='" + category + '\'' +
                ", entityTypes=" + entityTypes +
                ", metrics=" + metrics +
                ", window='" + window + '\'' +
                ", windowSize=" + windowSize +
                ", minSamples=" + minSamples +
                ", conditions=" + conditions.size() +
                '}';
    }
}
