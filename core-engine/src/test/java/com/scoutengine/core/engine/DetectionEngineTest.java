package com.scoutengine.core.engine;

import com.scoutengine.core.config.DetectorCategories;
import com.scoutengine.core.config.EngineConfig;
import com.scoutengine.core.config.RulesLoader;
import com.scoutengine.core.model.EntityRef;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.Opportunity;
import com.scoutengine.core.model.PeriodRange;
import com.scoutengine.core.model.Priority;
import com.scoutengine.core.rule.Rule;
import com.scoutengine.core.rule.RuleFactory;
import com.scoutengine.core.source.InMemoryMetricSource;
import com.scoutengine.core.testing.Observations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DetectionEngine}.
 */
class DetectionEngineTest {

    private static final PeriodRange PERIOD = PeriodRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 4, 30));
    private static final Instant NOW = Instant.parse("2024-05-01T06:00:00Z");
    private static final EntityRef PAGE_42 = EntityRef.of("page_42", "page");
    private static final EntityRef PAGE_7 = EntityRef.of("page_7", "page");
    private static final EntityRef CAMP_1 = EntityRef.of("camp_1", "campaign");
    private static final PeriodRange FIRST_HALF =
            PeriodRange.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30));

    private List<Rule> rules;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        rules = RuleFactory.createAll(RulesLoader.fromClasspath("test-rules.yml").getRules());
        registry = new SimpleMeterRegistry();
    }

    @Test
    @DisplayName("Should raise a HIGH priority opportunity for an accelerating decline")
    void shouldDetectContentDecay() {
        DetectionResult result = engine(snapshot(), EngineConfig.defaults()).run(request(PAGE_42, PAGE_7));

        assertThat(result.getOpportunities()).hasSize(1);
        Opportunity o = result.getOpportunities().get(0);
        assertThat(o.getEntityId()).isEqualTo("page_42");
        assertThat(o.getRuleId()).isEqualTo("test_decay");
        assertThat(o.getOrganizationId()).isEqualTo("org_1");
        assertThat(o.getPriority()).isEqualTo(Priority.HIGH);
        assertThat(o.getUrgencyScore()).isGreaterThanOrEqualTo(80.0);
        assertThat(o.getConfidenceScore()).isCloseTo(0.91, within(1e-9));
        assertThat(o.getPotentialImpactScore()).isCloseTo(0.6 * 43.4 + 0.4 * 100, within(0.05));
        assertThat(o.getTitle()).isEqualTo("Decay: page_42 -43.4%");
        assertThat(o.getRecommendedActions()).containsExactly("Refresh page_42");
        assertThat(o.getEvidence())
                .containsEntry("trend_pattern", "accelerating_decline")
                .containsEntry("traffic_percentile", 1.0);
        assertThat(o.getDetectedAt()).isEqualTo(NOW);
        assertThat(o.getId()).isEqualTo(OpportunityIds.of("page_42", "test_decay",
                LocalDate.of(2024, 4, 1), LocalDate.of(2024, 4, 30)));

        assertThat(result.getEvaluatedCount()).isEqualTo(2);
        assertThat(result.getFiredCount()).isEqualTo(1);
        assertThat(result.getDeclinedCount()).isEqualTo(1);
        assertThat(result.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("Should raise nothing for an entity with a single period of data")
    void shouldNotFireWithoutHistory() {
        DetectionResult result = engine(snapshot(), EngineConfig.defaults()).run(request(PAGE_7));

        assertThat(result.getOpportunities()).isEmpty();
        assertThat(result.getDeclinedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should produce identical output for identical input")
    void shouldBeIdempotent() {
        DetectionEngine engine = engine(snapshot(), EngineConfig.defaults());

        List<Opportunity> first = engine.run(request(PAGE_42, PAGE_7)).getOpportunities();
        List<Opportunity> second = engine.run(request(PAGE_42, PAGE_7)).getOpportunities();

        assertThat(second).isEqualTo(first);
        assertThat(second.get(0).getEvidence()).isEqualTo(first.get(0).getEvidence());
    }

    @Test
    @DisplayName("Should keep only the strongest opportunity per entity and category")
    void shouldDeduplicateByCategory() {
        Rule narrow = alwaysFires("decay_narrow", 1.0);
        Rule wide = alwaysFires("decay_wide", 2.0);
        DetectionRequest request = DetectionRequest.builder()
                .entity(PAGE_42)
                .rule(narrow)
                .rule(wide)
                .period(PERIOD)
                .build();

        DetectionResult result = engine(snapshot(), EngineConfig.defaults()).run(request);

        assertThat(result.getFiredCount()).isEqualTo(2);
        assertThat(result.getSuppressedCount()).isEqualTo(1);
        assertThat(result.getOpportunities()).singleElement()
                .extracting(Opportunity::getRuleId).isEqualTo("decay_wide");
    }

    @Test
    @DisplayName("Should rank by priority, then urgency, then impact")
    void shouldRankOpportunities() {
        List<Opportunity> list = new ArrayList<>(List.of(
                opportunity("a", Priority.MEDIUM, 60, 90),
                opportunity("b", Priority.HIGH, 81, 10),
                opportunity("c", Priority.HIGH, 95, 10),
                opportunity("d", Priority.HIGH, 81, 50),
                opportunity("e", Priority.LOW, 20, 5)));

        list.sort(DetectionEngine.RANKING);

        assertThat(list).extracting(Opportunity::getId).containsExactly("c", "d", "b", "a", "e");
    }

    @Test
    @DisplayName("Should skip a malformed series without aborting the run")
    void shouldIsolateMalformedSeries() {
        List<MetricObservation> observations = new ArrayList<>(snapshotObservations());
        observations.add(Observations.month("page_bad", "page", "sessions", YearMonth.of(2024, 3), 10));
        observations.add(Observations.month("page_bad", "page", "sessions", YearMonth.of(2024, 2), 20));

        DetectionResult result = engine(InMemoryMetricSource.of(observations), EngineConfig.defaults())
                .run(request(EntityRef.of("page_bad", "page"), PAGE_42));

        assertThat(result.getSkippedCount()).isEqualTo(1);
        assertThat(result.getOpportunities()).extracting(Opportunity::getEntityId).containsExactly("page_42");
    }

    @Test
    @DisplayName("Should skip a throwing rule without affecting other rules")
    void shouldIsolateThrowingRule() {
        Rule boom = Rule.builder()
                .id("boom")
                .category("broken")
                .entityTypes("page")
                .metrics("sessions")
                .predicate(ctx -> {
                    throw new IllegalStateException("boom");
                })
                .build();
        List<Rule> withBoom = new ArrayList<>(rules);
        withBoom.add(boom);
        DetectionRequest request = DetectionRequest.builder()
                .entity(PAGE_42)
                .rules(withBoom)
                .period(PERIOD)
                .build();

        DetectionResult result = engine(snapshot(), EngineConfig.defaults()).run(request);

        assertThat(result.getSkippedCount()).isEqualTo(1);
        assertThat(result.getOpportunities()).extracting(Opportunity::getRuleId).containsExactly("test_decay");
    }

    @Test
    @DisplayName("Should stop before the first batch when already cancelled")
    void shouldHonourCancellation() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        DetectionResult result = engine(snapshot(), EngineConfig.defaults()).run(request(PAGE_42, PAGE_7), signal);

        assertThat(result.isCancelled()).isTrue();
        assertThat(result.getOpportunities()).isEmpty();
        assertThat(result.getEvaluatedCount()).isZero();
    }

    @Test
    @DisplayName("Should process every entity across several small batches")
    void shouldProcessAllBatches() {
        List<MetricObservation> observations = new ArrayList<>();
        List<EntityRef> pages = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            String id = "page_" + (100 + i);
            observations.addAll(Observations.monthly(id, "page", "sessions", YearMonth.of(2024, 1),
                    1000, 900, 750, 500));
            pages.add(EntityRef.of(id, "page"));
        }
        EngineConfig config = EngineConfig.builder().concurrency(3).batchSize(2).build();
        DetectionRequest request = DetectionRequest.builder()
                .entities(pages)
                .rules(rules)
                .period(PERIOD)
                .build();

        DetectionResult result = engine(InMemoryMetricSource.of(observations), config).run(request);

        assertThat(result.getOpportunities()).hasSize(7);
        assertThat(result.getEvaluatedCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should only run rules in enabled business areas")
    void shouldFilterByCategory() {
        EngineConfig config = EngineConfig.builder()
                .enabledCategories(DetectorCategories.of(List.of("advertising")))
                .build();

        DetectionResult result = engine(snapshot(), config).run(request(PAGE_42));

        assertThat(result.getOpportunities()).isEmpty();
        assertThat(result.getEvaluatedCount()).isZero();
    }

    @Test
    @DisplayName("Should not pair values from different periods when metrics end at different times")
    void shouldDeclineWhenMetricsEndInDifferentPeriods() {
        List<MetricObservation> observations = new ArrayList<>(
                Observations.monthly("camp_1", "campaign", "cost", YearMonth.of(2024, 1), 500, 500, 500));
        observations.addAll(Observations.monthly("camp_1", "campaign", "conversions", YearMonth.of(2024, 1),
                9, 9, 9, 9, 9, 0));

        DetectionResult result = engine(InMemoryMetricSource.of(observations), EngineConfig.defaults())
                .run(request(FIRST_HALF, CAMP_1));

        assertThat(result.getOpportunities()).isEmpty();
        assertThat(result.getEvaluatedCount()).isEqualTo(1);
        assertThat(result.getDeclinedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should decline an entity whose data stops before the run period ends")
    void shouldDeclineStaleEntity() {
        DetectionResult result = engine(snapshot(), EngineConfig.defaults()).run(request(FIRST_HALF, PAGE_42));

        assertThat(result.getOpportunities()).isEmpty();
        assertThat(result.getDeclinedCount()).isEqualTo(1);
        assertThat(result.getFiredCount()).isZero();
    }

    @Test
    @DisplayName("Should fire on the period ending with the run period")
    void shouldFireOnRunPeriod() {
        List<MetricObservation> observations = new ArrayList<>(
                Observations.monthly("camp_1", "campaign", "cost", YearMonth.of(2024, 1),
                        500, 500, 500, 500, 500, 500));
        observations.addAll(Observations.monthly("camp_1", "campaign", "conversions", YearMonth.of(2024, 1),
                9, 9, 9, 9, 9, 0));

        DetectionResult result = engine(InMemoryMetricSource.of(observations), EngineConfig.defaults())
                .run(request(FIRST_HALF, CAMP_1));

        assertThat(result.getOpportunities()).singleElement().satisfies(o -> {
            assertThat(o.getRuleId()).isEqualTo("test_waste");
            assertThat(o.getEvidence())
                    .containsEntry("period_start", "2024-06-01")
                    .containsEntry("period_end", "2024-06-30")
                    .containsEntry("current_value", 500.0)
                    .containsEntry("conversions_current", 0.0);
        });
    }

    @Test
    @DisplayName("Should record evaluation outcomes and run duration")
    void shouldRecordMetrics() {
        engine(snapshot(), EngineConfig.defaults()).run(request(PAGE_42, PAGE_7));

        assertThat(registry.get("scout.evaluations").tag("outcome", "fired").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scout.evaluations").tag("outcome", "declined").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scout.opportunities").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scout.run.duration").timer().count()).isEqualTo(1L);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DetectionEngine engine(InMemoryMetricSource source, EngineConfig config) {
        return new DetectionEngine(source, config, Clock.fixed(NOW, ZoneOffset.UTC), registry);
    }

    private DetectionRequest request(EntityRef... entities) {
        return request(PERIOD, entities);
    }

    private DetectionRequest request(PeriodRange period, EntityRef... entities) {
        return DetectionRequest.builder()
                .entities(List.of(entities))
                .rules(rules)
                .period(period)
                .organizationId("org_1")
                .build();
    }

    private static List<MetricObservation> snapshotObservations() {
        List<MetricObservation> observations = new ArrayList<>(
                Observations.monthly("page_42", "page", "sessions", YearMonth.of(2024, 1), 1000, 900, 750, 500));
        observations.add(Observations.month("page_7", "page", "sessions", YearMonth.of(2024, 4), 120));
        return observations;
    }

    private static InMemoryMetricSource snapshot() {
        return InMemoryMetricSource.of(snapshotObservations());
    }

    private static Rule alwaysFires(String id, double impactScale) {
        return Rule.builder()
                .id(id)
                .area("content")
                .category("content_decay")
                .entityTypes("page")
                .metrics("sessions")
                .trafficMetric("sessions")
                .predicate(ctx -> true)
                .requireBaseline("sessions")
                .impactScale(impactScale)
                .build();
    }

    private static Opportunity opportunity(String id, Priority priority, double urgency, double impact) {
        return Opportunity.builder()
                .id(id)
                .entityId(id)
                .entityType("page")
                .ruleId("r")
                .category("c")
                .priority(priority)
                .confidenceScore(0.5)
                .potentialImpactScore(impact)
                .urgencyScore(urgency)
                .detectedAt(NOW)
                .build();
    }
}
