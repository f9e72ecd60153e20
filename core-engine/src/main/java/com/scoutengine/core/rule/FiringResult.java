package com.scoutengine.core.rule;

import com.scoutengine.core.model.EntityRef;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.Trend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Outcome of a rule firing for one entity: the deviation of the primary metric,
 * its trend, the evidence map and the variables available to message
 * templates.
 *
 * @since 1.0.0
 */
public final class FiringResult {

    private final Rule rule;
    private final EntityRef entity;
    private final MetricObservation currentObservation;
    private final Double deviationPct;
    private final Trend trend;
    private final Double trafficPercentile;
    private final Map<String, Object> evidence;
    private final Map<String, String> templateVariables;

    public FiringResult(Rule rule, EntityRef entity, MetricObservation currentObservation, OptionalDouble deviationPct,
                        Trend trend, OptionalDouble trafficPercentile, Map<String, Object> evidence,
                        Map<String, String> templateVariables) {
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.currentObservation = Objects.requireNonNull(currentObservation, "currentObservation must not be null");
        this.deviationPct = deviationPct.isPresent() ? deviationPct.getAsDouble() : null;
        this.trend = Objects.requireNonNull(trend, "trend must not be null");
        this.trafficPercentile = trafficPercentile.isPresent() ? trafficPercentile.getAsDouble() : null;
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        this.templateVariables = Collections.unmodifiableMap(new LinkedHashMap<>(templateVariables));
    }

    public Rule getRule() {
        return rule;
    }

    public EntityRef getEntity() {
        return entity;
    }

    /**
     * @return the primary metric's current-period observation
     */
    public MetricObservation getCurrentObservation() {
        return currentObservation;
    }

    /**
     * @return {@code (current - mean) / mean} of the primary metric as a
     *         fraction, or empty if undefined
     */
    public OptionalDouble getDeviationPct() {
        return deviationPct != null ? OptionalDouble.of(deviationPct) : OptionalDouble.empty();
    }

    public Trend getTrend() {
        return trend;
    }

    public OptionalDouble getTrafficPercentile() {
        return trafficPercentile != null ? OptionalDouble.of(trafficPercentile) : OptionalDouble.empty();
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    public Map<String, String> getTemplateVariables() {
        return templateVariables;
    }

    @Override
    public String toString() {
        return "FiringResult{" +
                "rule=" + rule.getId() +
                ", entity=" + entity +
                ", deviationPct=" + deviationPct +
                ", trend=" + trend +
                '}';
    }
}
