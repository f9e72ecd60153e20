package com.scoutengine.core.rule;

import com.scoutengine.core.model.Baseline;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.Trend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Decides whether a {@link Rule} fires for one entity.
 *
 * <h3>Refusal</h3>
 * <p>
 * A rule is <em>declined</em>, never evaluated, when its primary metric has no
 * current value, when any other metric it references has no observation for
 * the primary metric's current period, or when any baseline it requires is
 * undefined. This is what
 * keeps rules from ever comparing against, or dividing by, a baseline built
 * from too few samples.
 * </p>
 *
 * <h3>Firing</h3>
 * <p>
 * When the predicate holds, the evaluator records the primary metric's guarded
 * deviation {@code (current - mean) / mean} and assembles the evidence map.
 * Exceptions thrown by the predicate or by a custom evidence extractor are
 * wrapped in {@link RuleEvaluationException}.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEvaluator.class);

    /** Number of trailing values recorded as {@code recent_values} evidence. */
    static final int RECENT_VALUES = 4;

    /**
     * Explain why {@code rule} cannot be evaluated for this context.
     *
     * @return a reason, or empty if the rule can be evaluated
     */
    public Optional<String> declineReason(Rule rule, EvaluationContext context) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Optional<MetricContext> primary = context.metric(rule.primaryMetric());
        if (primary.isEmpty() || primary.get().currentObservation().isEmpty()) {
            return Optional.of("no current value for '" + rule.primaryMetric() + "'");
        }
        MetricObservation current = primary.get().currentObservation().get();
        for (String metric : rule.getMetrics()) {
            Optional<MetricObservation> other = context.metric(metric).flatMap(MetricContext::currentObservation);
            if (other.isEmpty() || !samePeriod(current, other.get())) {
                return Optional.of("no '" + metric + "' observation for period "
                        + current.getPeriodStart() + ".." + current.getPeriodEnd());
            }
        }
        for (String metric : rule.getRequiredBaselines()) {
            Optional<MetricContext> m = context.metric(metric);
            if (m.isEmpty() || m.get().getBaseline().isEmpty()) {
                return Optional.of("baseline undefined for '" + metric + "'");
            }
        }
        return Optional.empty();
    }

    /**
     * Evaluate {@code rule} against {@code context}.
     *
     * @param rule    the rule; must not be {@code null}
     * @param context per-metric inputs; must not be {@code null}
     * @return the firing, or empty if the rule declined or did not match
     * @throws RuleEvaluationException if the predicate or evidence extractor
     *                                 throws
     */
    public Optional<FiringResult> evaluate(Rule rule, EvaluationContext context) {
        Optional<String> declined = declineReason(rule, context);
        String entityId = context.getEntity().getEntityId();
        if (declined.isPresent()) {
            LOG.trace("Rule [{}] declined for {}: {}", rule.getId(), entityId, declined.get());
            return Optional.empty();
        }

        boolean matched;
        try {
            matched = rule.getPredicate().test(context);
        } catch (RuntimeException e) {
            throw new RuleEvaluationException(rule.getId(), entityId, e);
        }
        if (!matched) {
            return Optional.empty();
        }

        MetricContext primary = context.require(rule.primaryMetric());
        MetricObservation current = primary.currentObservation().orElseThrow();
        OptionalDouble deviation = primary.deviation();
        Trend trend = primary.getTrend();

        Map<String, Object> evidence = standardEvidence(rule, context, primary, deviation);
        try {
            evidence.putAll(rule.getEvidenceExtractor().extract(context));
        } catch (RuntimeException e) {
            throw new RuleEvaluationException(rule.getId(), entityId, e);
        }

        LOG.debug("Rule [{}] fired for {}: {}={} deviation={} trend={}",
                rule.getId(), entityId, primary.getMetricName(), current.getValue(),
                deviation.isPresent() ? deviation.getAsDouble() : "undefined", trend);

        return Optional.of(new FiringResult(rule, context.getEntity(), current, deviation, trend,
                context.getTrafficPercentile(), evidence, templateVariables(context, primary, deviation)));
    }

    private static boolean samePeriod(MetricObservation a, MetricObservation b) {
        return a.getPeriodStart().equals(b.getPeriodStart()) && a.getPeriodEnd().equals(b.getPeriodEnd());
    }

    // ---------------------------------------------------------------
    // Evidence
    // ---------------------------------------------------------------

    private static Map<String, Object> standardEvidence(Rule rule, EvaluationContext context,
                                                        MetricContext primary, OptionalDouble deviation) {
        MetricObservation current = primary.currentObservation().orElseThrow();
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("metric", primary.getMetricName());
        evidence.put("current_value", current.getValue());
        evidence.put("period_start", current.getPeriodStart().toString());
        evidence.put("period_end", current.getPeriodEnd().toString());
        primary.getBaseline().ifPresent(b -> putBaseline(evidence, b));
        if (deviation.isPresent()) {
            evidence.put("deviation_pct", round2(deviation.getAsDouble() * 100));
        }
        evidence.put("trend_pattern", primary.getTrend().getPattern().name().toLowerCase(Locale.ROOT));
        evidence.put("consecutive_periods", primary.getTrend().getConsecutiveRunLength());

        List<Double> recent = new ArrayList<>();
        for (double v : primary.getSeries().lastValues(RECENT_VALUES)) {
            recent.add(v);
        }
        evidence.put("recent_values", List.copyOf(recent));
        context.getTrafficPercentile().ifPresent(p -> evidence.put("traffic_percentile", round2(p)));

        for (String metric : rule.getMetrics()) {
            if (metric.equals(primary.getMetricName())) {
                continue;
            }
            context.metric(metric).ifPresent(m -> {
                m.currentValue().ifPresent(v -> evidence.put(metric + "_current", v));
                m.deviation().ifPresent(d -> evidence.put(metric + "_deviation_pct", round2(d * 100)));
            });
        }
        return evidence;
    }

    private static void putBaseline(Map<String, Object> evidence, Baseline b) {
        evidence.put("baseline_mean", round2(b.getMean()));
        evidence.put("baseline_stddev", round2(b.getStddev()));
        evidence.put("baseline_sample_count", b.getSampleCount());
        evidence.put("baseline_window", b.getWindowKind().name().toLowerCase(Locale.ROOT));
    }

    private static Map<String, String> templateVariables(EvaluationContext context, MetricContext primary,
                                                         OptionalDouble deviation) {
        MetricObservation current = primary.currentObservation().orElseThrow();
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("entity_id", context.getEntity().getEntityId());
        vars.put("entity_type", context.getEntity().getEntityType());
        vars.put("metric", primary.getMetricName());
        vars.put("current", formatNumber(current.getValue()));
        vars.put("period_start", current.getPeriodStart().toString());
        vars.put("period_end", current.getPeriodEnd().toString());
        primary.getBaseline().ifPresent(b -> vars.put("baseline", formatNumber(b.getMean())));
        if (deviation.isPresent()) {
            double pct = deviation.getAsDouble() * 100;
            vars.put("deviation", String.format(Locale.ROOT, "%+.1f%%", pct));
            vars.put("abs_deviation", String.format(Locale.ROOT, "%.1f%%", Math.abs(pct)));
        }
        vars.put("trend", primary.getTrend().getPattern().name().toLowerCase(Locale.ROOT).replace('_', ' '));
        vars.put("run_length", Integer.toString(primary.getTrend().getConsecutiveRunLength()));
        for (MetricContext m : context.getMetrics().values()) {
            m.currentValue().ifPresent(v -> vars.put(m.getMetricName() + "_current", formatNumber(v)));
        }
        return vars;
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ROOT, "%,.0f", value);
        }
        return String.format(Locale.ROOT, "%,.2f", value);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
