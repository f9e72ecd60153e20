package com.scoutengine.core.config;

import com.scoutengine.core.scoring.ScoringWeights;
import com.scoutengine.core.trend.TrendClassifier;

import java.util.Objects;
import java.util.function.Function;

/**
 * Typed, immutable configuration for the detection engine.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so a
 * scheduled job can be tuned without code changes.
 * </p>
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><th>Variable</th><th>Default</th></tr>
 * <tr><td>{@code SCOUT_CONCURRENCY}</td><td>4</td></tr>
 * <tr><td>{@code SCOUT_BATCH_SIZE}</td><td>100</td></tr>
 * <tr><td>{@code SCOUT_TREND_LOOKBACK}</td><td>4</td></tr>
 * <tr><td>{@code SCOUT_IMPACT_DEVIATION_WEIGHT}</td><td>0.6</td></tr>
 * <tr><td>{@code SCOUT_IMPACT_TRAFFIC_WEIGHT}</td><td>0.4</td></tr>
 * <tr><td>{@code SCOUT_PRODUCT_TYPE}</td><td>(none)</td></tr>
 * <tr><td>{@code ENABLED_DETECTOR_CATEGORIES}</td><td>all areas</td></tr>
 * </table>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    private final int concurrency;
    private final int batchSize;
    private final int trendLookback;
    private final ScoringWeights scoringWeights;
    private final DetectorCategories enabledCategories;

    private EngineConfig(Builder b) {
        this.concurrency = b.concurrency;
        this.batchSize = b.batchSize;
        this.trendLookback = b.trendLookback;
        this.scoringWeights = b.scoringWeights;
        this.enabledCategories = b.enabledCategories;
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link EngineConfig} from the process environment.
     *
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Build an {@link EngineConfig} from an arbitrary variable lookup.
     *
     * @param env returns the value of a variable, or {@code null} if unset
     */
    public static EngineConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .concurrency(Integer.parseInt(env(env, "SCOUT_CONCURRENCY", "4")))
                    .batchSize(Integer.parseInt(env(env, "SCOUT_BATCH_SIZE", "100")))
                    .trendLookback(Integer.parseInt(env(env, "SCOUT_TREND_LOOKBACK",
                            String.valueOf(TrendClassifier.DEFAULT_LOOKBACK))))
                    .scoringWeights(ScoringWeights.of(
                            Double.parseDouble(env(env, "SCOUT_IMPACT_DEVIATION_WEIGHT",
                                    String.valueOf(ScoringWeights.DEFAULT_DEVIATION_WEIGHT))),
                            Double.parseDouble(env(env, "SCOUT_IMPACT_TRAFFIC_WEIGHT",
                                    String.valueOf(ScoringWeights.DEFAULT_TRAFFIC_WEIGHT)))))
                    .enabledCategories(DetectorCategories.resolve(env, env.apply("SCOUT_PRODUCT_TYPE")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /** @return worker pool size */
    public int getConcurrency() {
        return concurrency;
    }

    /** @return entities per batch; cancellation is checked between batches */
    public int getBatchSize() {
        return batchSize;
    }

    public int getTrendLookback() {
        return trendLookback;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public DetectorCategories getEnabledCategories() {
        return enabledCategories;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link EngineConfig}.
     *
     * <p>
     * {@link #build()} validates that concurrency and batch size are positive
     * and that the trend lookback is at least 3.
     * </p>
     */
    public static class Builder {
        private int concurrency = 4;
        private int batchSize = 100;
        private int trendLookback = TrendClassifier.DEFAULT_LOOKBACK;
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private DetectorCategories enabledCategories = DetectorCategories.all();

        public Builder concurrency(int v) {
            this.concurrency = v;
            return this;
        }

        public Builder batchSize(int v) {
            this.batchSize = v;
            return this;
        }

        public Builder trendLookback(int v) {
            this.trendLookback = v;
            return this;
        }

        public Builder scoringWeights(ScoringWeights v) {
            this.scoringWeights = v;
            return this;
        }

        public Builder enabledCategories(DetectorCategories v) {
            this.enabledCategories = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public EngineConfig build() {
            Objects.requireNonNull(scoringWeights, "scoringWeights required");
            Objects.requireNonNull(enabledCategories, "enabledCategories required");
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
            }
            if (trendLookback < 3) {
                throw new IllegalArgumentException("trendLookback must be >= 3, got: " + trendLookback);
            }
            return new EngineConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "concurrency=" + concurrency +
                ", batchSize=" + batchSize +
                ", trendLookback=" + trendLookback +
                ", scoringWeights=" + scoringWeights +
                ", enabledCategories=" + enabledCategories +
                '}';
    }
}
