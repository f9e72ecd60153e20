package com.scoutengine.core.rule;

import com.scoutengine.core.config.RulesLoader;
import com.scoutengine.core.model.ConditionSpec;
import com.scoutengine.core.model.DetectionRule;
import com.scoutengine.core.model.WindowKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleFactory}.
 */
class RuleFactoryTest {

    @Test
    @DisplayName("Should compile a YAML rule and require the baselines its conditions read")
    void shouldCompileRule() {
        DetectionRule config = rule("decay", List.of("sessions", "conversions"),
                condition("deviation", null, "lt", -0.2),
                condition("current", "conversions", "gte", 1));
        config.setWindow("yoy");
        config.setWindowSize(3);
        config.setMinSamples(2);

        Rule rule = RuleFactory.create(config);

        assertThat(rule.getId()).isEqualTo("decay");
        assertThat(rule.getType()).isEqualTo("decay");
        assertThat(rule.primaryMetric()).isEqualTo("sessions");
        assertThat(rule.getWindowKind()).isEqualTo(WindowKind.SAME_PERIOD_PRIOR_YEAR);
        assertThat(rule.getRequiredBaselines()).containsExactly("sessions");
        assertThat(rule.appliesTo("page")).isTrue();
        assertThat(rule.appliesTo("campaign")).isFalse();
    }

    @Test
    @DisplayName("Should not require any baseline for current-value rules")
    void shouldNotRequireBaselineForCurrentValueRules() {
        Rule rule = RuleFactory.create(rule("waste", List.of("cost"), condition("current", null, ">", 100)));

        assertThat(rule.getRequiredBaselines()).isEmpty();
    }

    @Test
    @DisplayName("Should compile a trend condition")
    void shouldCompileTrendCondition() {
        ConditionSpec spec = new ConditionSpec();
        spec.setSubject("trend");
        spec.setPatterns(List.of("declining", "accelerating-decline"));

        Condition condition = RuleFactory.compile(spec, "sessions");

        assertThat(condition.getMetric()).isEqualTo("sessions");
        assertThat(condition.requiresBaseline()).isFalse();
        assertThat(condition.toString()).contains("ACCELERATING_DECLINE");
    }

    @Test
    @DisplayName("Should reject an invalid rule with every problem listed")
    void shouldRejectInvalidRule() {
        DetectionRule config = rule("bad", List.of("sessions"), condition("deviation", "revenue", "approx", 1));
        config.setBaseConfidence(1.5);

        assertThatThrownBy(() -> RuleFactory.create(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid DetectionRule")
                .hasMessageContaining("undeclared metric 'revenue'")
                .hasMessageContaining("invalid operator 'approx'")
                .hasMessageContaining("baseConfidence");
    }

    @Test
    @DisplayName("Should compile every rule of the bundled catalog")
    void shouldCompileBundledCatalog() {
        List<Rule> rules = RuleFactory.createAll(RulesLoader.fromClasspath("rules.yml").getRules());

        assertThat(rules).extracting(Rule::getId).contains(
                "content_decay_multitimeframe", "revenue_drop", "revenue_spike", "paid_waste", "scale_winners");
        assertThat(rules).filteredOn(Rule::isCrisis).extracting(Rule::getId).containsExactly("revenue_drop");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static DetectionRule rule(String id, List<String> metrics, ConditionSpec... conditions) {
        DetectionRule rule = new DetectionRule();
        rule.setId(id);
        rule.setArea("Content");
        rule.setCategory("content_decay");
        rule.setEntityTypes(List.of("page"));
        rule.setMetrics(metrics);
        rule.setConditions(List.of(conditions));
        return rule;
    }

    private static ConditionSpec condition(String subject, String metric, String operator, double value) {
        ConditionSpec spec = new ConditionSpec();
        spec.setSubject(subject);
        spec.setMetric(metric);
        spec.setOperator(operator);
        spec.setValue(value);
        return spec;
    }
}
