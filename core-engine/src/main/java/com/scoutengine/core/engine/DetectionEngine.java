package com.scoutengine.core.engine;

import com.scoutengine.core.baseline.BaselineCalculator;
import com.scoutengine.core.baseline.PeerPercentileRanker;
import com.scoutengine.core.config.EngineConfig;
import com.scoutengine.core.engine.EngineMetrics.Outcome;
import com.scoutengine.core.model.Baseline;
import com.scoutengine.core.model.EntityRef;
import com.scoutengine.core.model.MalformedSeriesException;
import com.scoutengine.core.model.MetricObservation;
import com.scoutengine.core.model.MetricSeries;
import com.scoutengine.core.model.Opportunity;
import com.scoutengine.core.model.PeriodRange;
import com.scoutengine.core.model.Trend;
import com.scoutengine.core.rule.EvaluationContext;
import com.scoutengine.core.rule.FiringResult;
import com.scoutengine.core.rule.MessageTemplate;
import com.scoutengine.core.rule.MetricContext;
import com.scoutengine.core.rule.Rule;
import com.scoutengine.core.rule.RuleEvaluationException;
import com.scoutengine.core.rule.RuleEvaluator;
import com.scoutengine.core.scoring.OpportunityScorer;
import com.scoutengine.core.scoring.Scores;
import com.scoutengine.core.source.MetricSource;
import com.scoutengine.core.trend.TrendClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every applicable rule against every requested entity and returns the
 * resulting opportunities, deduplicated and ranked.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>Rules outside the enabled business areas are dropped.</li>
 * <li>Entities are processed in batches of {@code batchSize} on a fixed pool
 * of {@code concurrency} workers. The {@link CancellationSignal} is checked
 * between batches.</li>
 * <li>Per entity, each metric's series is fetched and its trend classified
 * once; baselines are computed per rule because rules choose their own
 * window. The current period of a run is the one ending on the request
 * period's end date: a series that stops earlier has no current value, and
 * every rule that reads it declines.</li>
 * <li>Firings are scored and turned into {@link Opportunity} records with a
 * deterministic id and the run's single {@code detectedAt} instant.</li>
 * <li>Opportunities sharing an entity and category are collapsed to the most
 * urgent one, then sorted by priority, urgency and impact.</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A malformed series, a throwing predicate or any other runtime failure while
 * evaluating one (entity, rule) pair is logged and counted as skipped. It
 * never aborts the run.
 * </p>
 *
 * <p>
 * The engine holds no per-run state; one instance can serve concurrent runs.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);

    /** Ranking of the final result: priority, urgency and impact descending, then id. */
    static final Comparator<Opportunity> RANKING = Comparator
            .comparing(Opportunity::getPriority).reversed()
            .thenComparing(Comparator.comparingDouble(Opportunity::getUrgencyScore).reversed())
            .thenComparing(Comparator.comparingDouble(Opportunity::getPotentialImpactScore).reversed())
            .thenComparing(Opportunity::getId);

    /** Which of two opportunities for the same entity and category survives: the smaller one. */
    static final Comparator<Opportunity> DEDUP_PREFERENCE = Comparator
            .comparingDouble(Opportunity::getUrgencyScore).reversed()
            .thenComparing(Comparator.comparingDouble(Opportunity::getPotentialImpactScore).reversed())
            .thenComparing(Comparator.comparingDouble(Opportunity::getConfidenceScore).reversed())
            .thenComparing(Opportunity::getRuleId);

    private final MetricSource source;
    private final EngineConfig config;
    private final Clock clock;
    private final EngineMetrics metrics;
    private final BaselineCalculator baselineCalculator;
    private final TrendClassifier trendClassifier;
    private final PeerPercentileRanker percentileRanker;
    private final RuleEvaluator evaluator;
    private final OpportunityScorer scorer;

    public DetectionEngine(MetricSource source, EngineConfig config) {
        this(source, config, Clock.systemUTC(), new SimpleMeterRegistry());
    }

    public DetectionEngine(MetricSource source, EngineConfig config, Clock clock, MeterRegistry registry) {
        this(source, config, clock, registry,
                new BaselineCalculator(),
                new TrendClassifier(config.getTrendLookback()),
                new PeerPercentileRanker(),
                new RuleEvaluator(),
                new OpportunityScorer(config.getScoringWeights()));
    }

    public DetectionEngine(MetricSource source, EngineConfig config, Clock clock, MeterRegistry registry,
                           BaselineCalculator baselineCalculator, TrendClassifier trendClassifier,
                           PeerPercentileRanker percentileRanker, RuleEvaluator evaluator,
                           OpportunityScorer scorer) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = new EngineMetrics(Objects.requireNonNull(registry, "registry must not be null"));
        this.baselineCalculator = Objects.requireNonNull(baselineCalculator, "baselineCalculator must not be null");
        this.trendClassifier = Objects.requireNonNull(trendClassifier, "trendClassifier must not be null");
        this.percentileRanker = Objects.requireNonNull(percentileRanker, "percentileRanker must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
    }

    public EngineConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    public DetectionResult run(DetectionRequest request) {
        return run(request, CancellationSignal.create());
    }

    /**
     * Execute a detection run.
     *
     * @param request entities, rules and period; must not be {@code null}
     * @param signal  checked between batches; must not be {@code null}
     * @return ranked opportunities and run counters
     */
    public DetectionResult run(DetectionRequest request, CancellationSignal signal) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(signal, "signal must not be null");

        Timer.Sample sample = Timer.start();
        List<Rule> rules = request.getRules().stream()
                .filter(r -> config.getEnabledCategories().isEnabled(r.getArea()))
                .toList();
        LOG.info("Starting detection run: {} entit(ies), {} of {} rule(s) enabled, period {}",
                request.getEntities().size(), rules.size(), request.getRules().size(), request.getPeriod());

        RunContext run = new RunContext(request, rules, clock.instant());
        List<Opportunity> firings = new ArrayList<>();
        Tally total = new Tally();
        boolean cancelled = false;

        ExecutorService pool = Executors.newFixedThreadPool(config.getConcurrency(), new WorkerThreadFactory());
        try {
            List<EntityRef> entities = request.getEntities();
            for (int from = 0; from < entities.size(); from += config.getBatchSize()) {
                if (signal.isCancelled()) {
                    LOG.info("Detection run cancelled after {} of {} entit(ies)", from, entities.size());
                    cancelled = true;
                    break;
                }
                List<EntityRef> batch = entities.subList(from, Math.min(from + config.getBatchSize(), entities.size()));
                List<Callable<EntityOutcome>> tasks = batch.stream()
                        .<Callable<EntityOutcome>>map(e -> () -> evaluateEntity(e, run))
                        .toList();
                try {
                    for (Future<EntityOutcome> future : pool.invokeAll(tasks)) {
                        EntityOutcome outcome = future.get();
                        firings.addAll(outcome.opportunities);
                        total.add(outcome.tally);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Detection run interrupted; returning completed batches");
                    cancelled = true;
                    break;
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Entity evaluation failed unexpectedly", e.getCause());
                }
            }
        } finally {
            pool.shutdownNow();
        }

        List<Opportunity> ranked = deduplicate(firings);
        ranked.sort(RANKING);
        int suppressed = firings.size() - ranked.size();

        metrics.recordOpportunities(ranked.size());
        long nanos = sample.stop(metrics.runDuration());
        LOG.info("Detection run finished in {} ms: {} opportunit(ies), evaluated={} fired={} declined={} "
                        + "skipped={} suppressed={} cancelled={}",
                nanos / 1_000_000, ranked.size(), total.evaluated, total.fired, total.declined,
                total.skipped, suppressed, cancelled);

        return new DetectionResult(ranked, total.evaluated, total.fired, total.declined, total.skipped,
                suppressed, cancelled);
    }

    // ---------------------------------------------------------------
    // Per-entity evaluation
    // ---------------------------------------------------------------

    private EntityOutcome evaluateEntity(EntityRef entity, RunContext run) {
        EntityOutcome outcome = new EntityOutcome();
        EntitySeries seriesCache = new EntitySeries(entity, run.request.getPeriod());

        for (Rule rule : run.rules) {
            if (!rule.appliesTo(entity.getEntityType())) {
                continue;
            }
            outcome.tally.evaluated++;
            try {
                EvaluationContext context = buildContext(entity, rule, seriesCache, run);
                Optional<String> declined = evaluator.declineReason(rule, context);
                if (declined.isPresent()) {
                    LOG.trace("Rule [{}] declined for {}: {}", rule.getId(), entity.getEntityId(), declined.get());
                    count(outcome, Outcome.DECLINED);
                    continue;
                }
                Optional<FiringResult> firing = evaluator.evaluate(rule, context);
                if (firing.isEmpty()) {
                    count(outcome, Outcome.NO_MATCH);
                    continue;
                }
                outcome.opportunities.add(toOpportunity(firing.get(), run));
                count(outcome, Outcome.FIRED);
            } catch (MalformedSeriesException e) {
                LOG.warn("Skipping rule [{}] for {}: malformed series '{}': {}",
                        rule.getId(), entity.getEntityId(), e.getMetricName(), e.getMessage());
                count(outcome, Outcome.SKIPPED);
            } catch (RuleEvaluationException e) {
                LOG.warn("Skipping rule [{}] for {}: {}", rule.getId(), entity.getEntityId(), e.getMessage(), e);
                count(outcome, Outcome.SKIPPED);
            } catch (RuntimeException e) {
                LOG.error("Unexpected failure evaluating rule [{}] for {}", rule.getId(), entity.getEntityId(), e);
                count(outcome, Outcome.SKIPPED);
            }
        }
        return outcome;
    }

    private void count(EntityOutcome outcome, Outcome kind) {
        switch (kind) {
            case FIRED -> outcome.tally.fired++;
            case DECLINED -> outcome.tally.declined++;
            case SKIPPED -> outcome.tally.skipped++;
            case NO_MATCH -> {
            }
        }
        metrics.record(kind);
    }

    private EvaluationContext buildContext(EntityRef entity, Rule rule, EntitySeries seriesCache, RunContext run) {
        Map<String, MetricContext> contexts = new LinkedHashMap<>();
        for (String metric : rule.getMetrics()) {
            MetricSeries series = seriesCache.series(metric);
            Optional<Baseline> baseline = baselineCalculator.compute(
                    series, rule.getWindowKind(), rule.getWindowSize(), rule.getMinSamples());
            Trend trend = seriesCache.trend(metric);
            contexts.put(metric, new MetricContext(series, baseline, trend, run.percentile(entity, metric)));
        }
        OptionalDouble traffic = rule.getTrafficMetric() != null
                ? run.percentile(entity, rule.getTrafficMetric())
                : OptionalDouble.empty();
        return new EvaluationContext(entity, contexts, traffic);
    }

    private Opportunity toOpportunity(FiringResult firing, RunContext run) {
        Rule rule = firing.getRule();
        Scores scores = scorer.score(firing);
        MetricObservation current = firing.getCurrentObservation();
        Map<String, String> vars = firing.getTemplateVariables();
        String entityId = firing.getEntity().getEntityId();

        String title = rule.getTitle() != null
                ? MessageTemplate.render(rule.getTitle(), vars)
                : humanize(rule.getType()) + ": " + entityId;
        String description = rule.getDescription() != null
                ? MessageTemplate.render(rule.getDescription(), vars)
                : null;

        return Opportunity.builder()
                .id(OpportunityIds.of(entityId, rule.getId(), current.getPeriodStart(), current.getPeriodEnd()))
                .organizationId(run.request.getOrganizationId())
                .entityId(entityId)
                .entityType(firing.getEntity().getEntityType())
                .ruleId(rule.getId())
                .area(rule.getArea())
                .category(rule.getCategory())
                .type(rule.getType())
                .priority(scores.getPriority())
                .title(title)
                .description(description)
                .evidence(firing.getEvidence())
                .confidenceScore(scores.getConfidence())
                .potentialImpactScore(scores.getImpact())
                .urgencyScore(scores.getUrgency())
                .detectedAt(run.detectedAt)
                .recommendedActions(rule.getRecommendedActions().stream()
                        .map(a -> MessageTemplate.render(a, vars))
                        .toList())
                .estimatedEffort(rule.getEstimatedEffort())
                .estimatedTimeline(rule.getEstimatedTimeline())
                .build();
    }

    private static String humanize(String type) {
        String words = type.replace('_', ' ').trim();
        return words.isEmpty() ? words : words.substring(0, 1).toUpperCase(Locale.ROOT) + words.substring(1);
    }

    // ---------------------------------------------------------------
    // Dedup
    // ---------------------------------------------------------------

    static List<Opportunity> deduplicate(List<Opportunity> firings) {
        Map<String, Opportunity> best = new LinkedHashMap<>();
        for (Opportunity candidate : firings) {
            String key = candidate.getEntityId() + '\u0000' + candidate.getCategory();
            best.merge(key, candidate, (kept, challenger) ->
                    DEDUP_PREFERENCE.compare(challenger, kept) < 0 ? challenger : kept);
        }
        return new ArrayList<>(best.values());
    }

    // ---------------------------------------------------------------
    // Run state
    // ---------------------------------------------------------------

    /** Immutable inputs of a run plus the shared peer-percentile cache. */
    private final class RunContext {
        private final DetectionRequest request;
        private final List<Rule> rules;
        private final Instant detectedAt;
        private final Map<String, Map<String, Double>> percentiles = new ConcurrentHashMap<>();

        RunContext(DetectionRequest request, List<Rule> rules, Instant detectedAt) {
            this.request = request;
            this.rules = rules;
            this.detectedAt = detectedAt;
        }

        OptionalDouble percentile(EntityRef entity, String metric) {
            Map<String, Double> ranks = percentiles.computeIfAbsent(
                    entity.getEntityType() + '\u0000' + metric,
                    k -> percentileRanker.rank(
                            source.fetchPeerValues(entity.getEntityType(), metric, request.getPeriod())));
            Double rank = ranks.get(entity.getEntityId());
            return rank != null ? OptionalDouble.of(rank) : OptionalDouble.empty();
        }
    }

    /** Series and trends of one entity, fetched at most once per metric. */
    private final class EntitySeries {
        private final EntityRef entity;
        private final PeriodRange period;
        private final Map<String, MetricSeries> series = new HashMap<>();
        private final Map<String, MalformedSeriesException> malformed = new HashMap<>();
        private final Map<String, Trend> trends = new HashMap<>();

        EntitySeries(EntityRef entity, PeriodRange period) {
            this.entity = entity;
            this.period = period;
        }

        MetricSeries series(String metric) {
            MalformedSeriesException failure = malformed.get(metric);
            if (failure != null) {
                throw failure;
            }
            MetricSeries cached = series.get(metric);
            if (cached != null) {
                return cached;
            }
            try {
                MetricSeries fetched = alignToRunPeriod(source.fetchSeries(entity, metric, period));
                series.put(metric, fetched);
                return fetched;
            } catch (MalformedSeriesException e) {
                malformed.put(metric, e);
                throw e;
            }
        }

        Trend trend(String metric) {
            return trends.computeIfAbsent(metric, m -> trendClassifier.classify(series(m)));
        }

        /**
         * A series whose last observation does not end on the run's end date
         * has no current period for this run and is treated as empty.
         */
        private MetricSeries alignToRunPeriod(MetricSeries fetched) {
            Optional<MetricObservation> current = fetched.current();
            if (current.isEmpty() || current.get().getPeriodEnd().equals(period.getEnd())) {
                return fetched;
            }
            LOG.trace("Series {}/{} ends {} before run period end {}; no current value",
                    entity.getEntityId(), fetched.getMetricName(), current.get().getPeriodEnd(), period.getEnd());
            return MetricSeries.empty(entity.getEntityId(), entity.getEntityType(), fetched.getMetricName());
        }
    }

    private static final class Tally {
        int evaluated;
        int fired;
        int declined;
        int skipped;

        void add(Tally other) {
            evaluated += other.evaluated;
            fired += other.fired;
            declined += other.declined;
            skipped += other.skipped;
        }
    }

    private static final class EntityOutcome {
        private final List<Opportunity> opportunities = new ArrayList<>();
        private final Tally tally = new Tally();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "scout-worker-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
