package com.scoutengine.core.rule;

import com.scoutengine.core.model.EntityRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Inputs for evaluating one rule against one entity: a {@link MetricContext}
 * per metric the rule references, and the entity's traffic percentile.
 *
 * @since 1.0.0
 */
public final class EvaluationContext {

    private final EntityRef entity;
    private final Map<String, MetricContext> metrics;
    private final Double trafficPercentile;

    public EvaluationContext(EntityRef entity, Map<String, MetricContext> metrics, OptionalDouble trafficPercentile) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(metrics, "metrics must not be null")));
        this.trafficPercentile = trafficPercentile != null && trafficPercentile.isPresent()
                ? trafficPercentile.getAsDouble()
                : null;
    }

    public EntityRef getEntity() {
        return entity;
    }

    public Map<String, MetricContext> getMetrics() {
        return metrics;
    }

    public Optional<MetricContext> metric(String metricName) {
        return Optional.ofNullable(metrics.get(metricName));
    }

    /**
     * @throws IllegalStateException if the metric was not loaded for this
     *                               evaluation
     */
    public MetricContext require(String metricName) {
        MetricContext ctx = metrics.get(metricName);
        if (ctx == null) {
            throw new IllegalStateException("Metric '" + metricName + "' not loaded for " + entity);
        }
        return ctx;
    }

    public OptionalDouble getTrafficPercentile() {
        return trafficPercentile != null ? OptionalDouble.of(trafficPercentile) : OptionalDouble.empty();
    }
}
