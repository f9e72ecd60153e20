package com.scoutengine.core.rule;

import com.scoutengine.core.model.ComparisonOperator;
import com.scoutengine.core.model.ConditionSpec;
import com.scoutengine.core.model.ConditionSubject;
import com.scoutengine.core.model.DetectionRule;
import com.scoutengine.core.model.TrendPattern;
import com.scoutengine.core.model.WindowKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles {@link DetectionRule} configurations into immutable {@link Rule}s.
 *
 * <p>
 * The compiled predicate is the conjunction of the rule's conditions. Every
 * metric read by a baseline-dependent condition ({@code baseline_mean},
 * {@code deviation}, {@code zscore}) becomes a required baseline.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RuleFactory.class);

    private RuleFactory() {
        // utility class - not instantiable
    }

    /**
     * Compile a rule.
     *
     * @param config the rule configuration; must not be {@code null}
     * @return the compiled rule
     * @throws NullPointerException  if {@code config} is {@code null}
     * @throws IllegalStateException if the configuration is invalid
     */
    public static Rule create(DetectionRule config) {
        Objects.requireNonNull(config, "DetectionRule must not be null");
        config.validate();

        String primary = config.primaryMetric();
        List<Condition> conditions = new ArrayList<>();
        for (ConditionSpec spec : config.getConditions()) {
            conditions.add(compile(spec, primary));
        }

        Rule.Builder builder = Rule.builder()
                .id(config.getId())
                .area(config.getArea())
                .category(config.getCategory())
                .type(config.getType())
                .entityTypes(config.getEntityTypes())
                .metrics(config.getMetrics())
                .trafficMetric(config.getTrafficMetric())
                .window(WindowKind.fromConfig(config.getWindow()), config.getWindowSize())
                .minSamples(config.getMinSamples())
                .predicate(allOf(conditions))
                .baseConfidence(config.getBaseConfidence())
                .crisis(config.isCrisis())
                .impactScale(config.getImpactScale())
                .title(config.getTitle())
                .description(config.getDescription())
                .recommendedActions(config.getRecommendedActions())
                .estimatedEffort(config.getEstimatedEffort())
                .estimatedTimeline(config.getEstimatedTimeline());

        for (Condition c : conditions) {
            if (c.requiresBaseline()) {
                builder.requireBaseline(c.getMetric());
            }
        }
        return builder.build();
    }

    /**
     * Compile every rule in the list.
     *
     * @param configs rule configurations; must not be {@code null}
     * @return unmodifiable list of compiled rules
     */
    public static List<Rule> createAll(List<DetectionRule> configs) {
        Objects.requireNonNull(configs, "Rules list must not be null");
        LOG.info("Compiling {} detection rule(s)", configs.size());
        List<Rule> rules = configs.stream()
                .map(RuleFactory::create)
                .toList();
        return Collections.unmodifiableList(rules);
    }

    static Condition compile(ConditionSpec spec, String primaryMetric) {
        ConditionSubject subject = ConditionSubject.fromConfig(spec.getSubject());
        String metric = spec.getMetric() != null ? spec.getMetric() : primaryMetric;
        if (subject == ConditionSubject.TREND) {
            Set<TrendPattern> patterns = EnumSet.noneOf(TrendPattern.class);
            for (String p : spec.getPatterns()) {
                patterns.add(TrendPattern.fromConfig(p));
            }
            return Condition.trendIn(metric, patterns);
        }
        return Condition.compare(subject, metric, ComparisonOperator.fromConfig(spec.getOperator()), spec.getValue());
    }

    private static RulePredicate allOf(List<Condition> conditions) {
        List<Condition> frozen = List.copyOf(conditions);
        return ctx -> {
            for (Condition c : frozen) {
                if (!c.test(ctx)) {
                    return false;
                }
            }
            return true;
        };
    }
}
