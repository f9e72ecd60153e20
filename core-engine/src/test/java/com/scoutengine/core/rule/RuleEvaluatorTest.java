package com.scoutengine.core.rule;

import com.scoutengine.core.baseline.BaselineCalculator;
import com.scoutengine.core.model.ComparisonOperator;
import com.scoutengine.core.model.ConditionSubject;
import com.scoutengine.core.model.EntityRef;
import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.TrendPattern;
import com.scoutengine.core.model.WindowKind;
import com.scoutengine.core.testing.Observations;
import com.scoutengine.core.trend.TrendClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RuleEvaluator}.
 */
class RuleEvaluatorTest {

    private static final EntityRef PAGE_42 = EntityRef.of("page_42", "page");

    private final RuleEvaluator evaluator = new RuleEvaluator();
    private final BaselineCalculator baselines = new BaselineCalculator();
    private final TrendClassifier trends = new TrendClassifier();

    @Test
    @DisplayName("Should fire on a decaying page and record the evidence")
    void shouldFireWithEvidence() {
        Rule rule = decayRule();
        EvaluationContext ctx = context(rule, PAGE_42, Map.of("sessions", series("sessions", 1000, 900, 750, 500)));

        Optional<FiringResult> firing = evaluator.evaluate(rule, ctx);

        assertThat(firing).isPresent();
        FiringResult result = firing.get();
        assertThat(result.getDeviationPct().getAsDouble()).isCloseTo(-0.434, within(0.001));
        assertThat(result.getTrend().getPattern()).isEqualTo(TrendPattern.ACCELERATING_DECLINE);
        assertThat(result.getEvidence())
                .containsEntry("metric", "sessions")
                .containsEntry("current_value", 500.0)
                .containsEntry("deviation_pct", -43.4)
                .containsEntry("baseline_sample_count", 3)
                .containsEntry("baseline_window", "trailing_periods")
                .containsEntry("trend_pattern", "accelerating_decline")
                .containsEntry("consecutive_periods", 3)
                .containsEntry("recent_values", List.of(1000.0, 900.0, 750.0, 500.0))
                .containsEntry("period_start", "2024-04-01");
        assertThat(result.getTemplateVariables())
                .containsEntry("deviation", "-43.4%")
                .containsEntry("abs_deviation", "43.4%")
                .containsEntry("current", "500")
                .containsEntry("baseline", "883.33")
                .containsEntry("trend", "accelerating decline");
    }

    @Test
    @DisplayName("Should decline when the required baseline is undefined")
    void shouldDeclineOnUndefinedBaseline() {
        Rule rule = decayRule();
        EvaluationContext ctx = context(rule, PAGE_42, Map.of("sessions", series("sessions", 900, 500)));

        assertThat(evaluator.declineReason(rule, ctx)).get().asString().contains("baseline undefined");
        assertThat(evaluator.evaluate(rule, ctx)).isEmpty();
    }

    @Test
    @DisplayName("Should decline when the primary metric has no current value")
    void shouldDeclineWithoutCurrentValue() {
        Rule rule = decayRule();
        EvaluationContext ctx = context(rule, PAGE_42,
                Map.of("sessions", MetricSeries.empty("page_42", "page", "sessions")));

        assertThat(evaluator.declineReason(rule, ctx)).get().asString().contains("no current value");
    }

    @Test
    @DisplayName("Should not fire, nor throw, against a zero-mean baseline")
    void shouldNotFireOnZeroMean() {
        Rule rule = decayRule();
        EvaluationContext ctx = context(rule, PAGE_42, Map.of("sessions", series("sessions", 0, 0, 0, 0)));

        assertThat(evaluator.declineReason(rule, ctx)).isEmpty();
        assertThat(evaluator.evaluate(rule, ctx)).isEmpty();
    }

    @Test
    @DisplayName("Should fire a current-value rule without any history")
    void shouldFireWithoutBaselineWhenNoneRequired() {
        Rule rule = Rule.builder()
                .id("paid_waste")
                .category("paid_waste")
                .entityTypes("campaign")
                .metrics("cost", "conversions")
                .predicate(Condition.compare(ConditionSubject.CURRENT, "cost", ComparisonOperator.GT, 100)
                        .and(Condition.compare(ConditionSubject.CURRENT, "conversions", ComparisonOperator.EQ, 0)))
                .build();
        EntityRef campaign = EntityRef.of("cmp_1", "campaign");
        Map<String, MetricSeries> data = new LinkedHashMap<>();
        data.put("cost", MetricSeries.of("cmp_1", "campaign", "cost",
                Observations.monthly("cmp_1", "campaign", "cost", YearMonth.of(2024, 4), 250)));
        data.put("conversions", MetricSeries.of("cmp_1", "campaign", "conversions",
                Observations.monthly("cmp_1", "campaign", "conversions", YearMonth.of(2024, 4), 0)));

        FiringResult firing = evaluator.evaluate(rule, context(rule, campaign, data)).orElseThrow();

        assertThat(firing.getDeviationPct()).isEmpty();
        assertThat(firing.getEvidence()).containsEntry("conversions_current", 0.0).doesNotContainKey("baseline_mean");
        assertThat(firing.getTemplateVariables()).containsEntry("cost_current", "250");
    }

    @Test
    @DisplayName("Should decline when a secondary metric lacks the primary metric's current period")
    void shouldDeclineOnMisalignedPeriods() {
        Rule rule = Rule.builder()
                .id("paid_waste")
                .category("paid_waste")
                .entityTypes("campaign")
                .metrics("cost", "conversions")
                .predicate(Condition.compare(ConditionSubject.CURRENT, "cost", ComparisonOperator.GT, 100)
                        .and(Condition.compare(ConditionSubject.CURRENT, "conversions", ComparisonOperator.EQ, 0)))
                .build();
        EntityRef campaign = EntityRef.of("cmp_1", "campaign");
        Map<String, MetricSeries> data = new LinkedHashMap<>();
        data.put("cost", MetricSeries.of("cmp_1", "campaign", "cost",
                Observations.monthly("cmp_1", "campaign", "cost", YearMonth.of(2024, 1), 500, 500, 500)));
        data.put("conversions", MetricSeries.of("cmp_1", "campaign", "conversions",
                Observations.monthly("cmp_1", "campaign", "conversions", YearMonth.of(2024, 1), 9, 9, 9, 9, 9, 0)));
        EvaluationContext ctx = context(rule, campaign, data);

        assertThat(evaluator.declineReason(rule, ctx)).hasValueSatisfying(reason -> assertThat(reason)
                .contains("no 'conversions' observation for period 2024-03-01..2024-03-31"));
        assertThat(evaluator.evaluate(rule, ctx)).isEmpty();
    }

    @Test
    @DisplayName("Should record recent values as an immutable list")
    void shouldFreezeRecentValues() {
        Rule rule = decayRule();
        EvaluationContext ctx = context(rule, PAGE_42, Map.of("sessions", series("sessions", 1000, 900, 750, 500)));

        Object recent = evaluator.evaluate(rule, ctx).orElseThrow().getEvidence().get("recent_values");

        assertThat(recent).isInstanceOf(List.class);
        assertThatThrownBy(() -> ((List<?>) recent).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should wrap predicate failures with the rule and entity")
    void shouldWrapPredicateFailures() {
        Rule rule = Rule.builder()
                .id("boom")
                .category("c")
                .entityTypes("page")
                .metrics("sessions")
                .predicate(ctx -> {
                    throw new ArithmeticException("bad math");
                })
                .build();
        EvaluationContext ctx = context(rule, PAGE_42, Map.of("sessions", series("sessions", 1, 2, 3, 4)));

        assertThatThrownBy(() -> evaluator.evaluate(rule, ctx))
                .isInstanceOf(RuleEvaluationException.class)
                .hasCauseInstanceOf(ArithmeticException.class)
                .satisfies(e -> {
                    RuleEvaluationException ree = (RuleEvaluationException) e;
                    assertThat(ree.getRuleId()).isEqualTo("boom");
                    assertThat(ree.getEntityId()).isEqualTo("page_42");
                });
    }

    @Test
    @DisplayName("Should merge custom evidence over the standard keys")
    void shouldMergeCustomEvidence() {
        Rule rule = Rule.builder()
                .id("custom")
                .category("c")
                .entityTypes("page")
                .metrics("sessions")
                .predicate(ctx -> true)
                .evidenceExtractor(ctx -> Map.of("note", "hand-built"))
                .build();
        EvaluationContext ctx = context(rule, PAGE_42, Map.of("sessions", series("sessions", 7)));

        assertThat(evaluator.evaluate(rule, ctx)).get()
                .satisfies(f -> assertThat(f.getEvidence()).containsEntry("note", "hand-built")
                        .containsEntry("trend_pattern", "stable"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Rule decayRule() {
        return Rule.builder()
                .id("decay")
                .category("content_decay")
                .entityTypes("page")
                .metrics("sessions")
                .window(WindowKind.TRAILING_PERIODS, 3)
                .minSamples(3)
                .predicate(Condition.compare(ConditionSubject.DEVIATION, "sessions", ComparisonOperator.LT, -0.2)
                        .and(Condition.trendIn("sessions", EnumSet.of(
                                TrendPattern.DECLINING, TrendPattern.ACCELERATING_DECLINE))))
                .requireBaseline("sessions")
                .build();
    }

    private static MetricSeries series(String metric, double... values) {
        return MetricSeries.of("page_42", "page", metric,
                Observations.monthly("page_42", "page", metric, YearMonth.of(2024, 5 - values.length), values));
    }

    private EvaluationContext context(Rule rule, EntityRef entity, Map<String, MetricSeries> data) {
        Map<String, MetricContext> metrics = new LinkedHashMap<>();
        data.forEach((metric, s) -> metrics.put(metric, new MetricContext(s,
                baselines.compute(s, rule.getWindowKind(), rule.getWindowSize(), rule.getMinSamples()),
                trends.classify(s), OptionalDouble.empty())));
        return new EvaluationContext(entity, metrics, OptionalDouble.empty());
    }
}
