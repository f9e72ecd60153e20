package com.scoutengine.core.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Micrometer meters of the detection engine.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 * <li>{@code scout.evaluations} - counter of (entity, rule) evaluations,
 * tagged {@code outcome} = fired | declined | skipped | no_match</li>
 * <li>{@code scout.opportunities} - counter of opportunities returned after
 * deduplication</li>
 * <li>{@code scout.run.duration} - timer of whole detection runs</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class EngineMetrics {

    /** Outcome of evaluating one rule for one entity. */
    public enum Outcome {
        FIRED,
        DECLINED,
        SKIPPED,
        NO_MATCH;

        String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Map<Outcome, Counter> evaluations = new EnumMap<>(Outcome.class);
    private final Counter opportunities;
    private final Timer runDuration;

    public EngineMetrics(MeterRegistry registry) {
        Objects.requireNonNull(registry, "registry must not be null");
        for (Outcome outcome : Outcome.values()) {
            evaluations.put(outcome, Counter.builder("scout.evaluations")
                    .description("Rule evaluations per entity")
                    .tag("outcome", outcome.tag())
                    .register(registry));
        }
        this.opportunities = Counter.builder("scout.opportunities")
                .description("Opportunities emitted after deduplication")
                .register(registry);
        this.runDuration = Timer.builder("scout.run.duration")
                .description("Duration of detection runs")
                .register(registry);
    }

    public void record(Outcome outcome) {
        evaluations.get(outcome).increment();
    }

    public void recordOpportunities(int count) {
        opportunities.increment(count);
    }

    public Timer runDuration() {
        return runDuration;
    }
}
