package com.scoutengine.core.config;

import com.scoutengine.core.scoring.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EngineConfig}.
 */
class EngineConfigTest {

    @Test
    @DisplayName("Should use defaults when no variables are set")
    void shouldUseDefaults() {
        EngineConfig config = EngineConfig.fromEnvironment(name -> null);

        assertThat(config.getConcurrency()).isEqualTo(4);
        assertThat(config.getBatchSize()).isEqualTo(100);
        assertThat(config.getTrendLookback()).isEqualTo(4);
        assertThat(config.getScoringWeights()).isEqualTo(ScoringWeights.defaults());
        assertThat(config.getEnabledCategories()).isEqualTo(DetectorCategories.all());
    }

    @Test
    @DisplayName("Should read overrides from the environment")
    void shouldReadOverrides() {
        Map<String, String> env = Map.of(
                "SCOUT_CONCURRENCY", "8",
                "SCOUT_BATCH_SIZE", "25",
                "SCOUT_TREND_LOOKBACK", "6",
                "SCOUT_IMPACT_DEVIATION_WEIGHT", "0.5",
                "SCOUT_IMPACT_TRAFFIC_WEIGHT", "0.5",
                "SCOUT_PRODUCT_TYPE", "content");

        EngineConfig config = EngineConfig.fromEnvironment(env::get);

        assertThat(config.getConcurrency()).isEqualTo(8);
        assertThat(config.getBatchSize()).isEqualTo(25);
        assertThat(config.getTrendLookback()).isEqualTo(6);
        assertThat(config.getScoringWeights()).isEqualTo(ScoringWeights.of(0.5, 0.5));
        assertThat(config.getEnabledCategories().isEnabled("revenue")).isFalse();
    }

    @Test
    @DisplayName("Should wrap unparsable numbers")
    void shouldWrapUnparsableNumbers() {
        Map<String, String> env = Map.of("SCOUT_CONCURRENCY", "many");

        assertThatThrownBy(() -> EngineConfig.fromEnvironment(env::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse numeric environment variable");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectOutOfRange() {
        assertThatThrownBy(() -> EngineConfig.builder().concurrency(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> EngineConfig.builder().trendLookback(2).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("trendLookback");
    }
}
