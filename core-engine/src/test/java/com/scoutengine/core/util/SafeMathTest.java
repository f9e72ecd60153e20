package com.scoutengine.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SafeMath}.
 */
class SafeMathTest {

    @Test
    @DisplayName("Should treat a near-zero denominator as undefined")
    void shouldGuardDivision() {
        assertThat(SafeMath.divide(1, 0)).isEmpty();
        assertThat(SafeMath.divide(1, 1e-12)).isEmpty();
        assertThat(SafeMath.divide(1, 4)).hasValue(0.25);
    }

    @Test
    @DisplayName("Should compute percent change as a fraction of the base")
    void shouldComputePercentChange() {
        assertThat(SafeMath.percentChange(500, 1000)).hasValue(-0.5);
        assertThat(SafeMath.percentChange(5, 0)).isEmpty();
    }

    @Test
    @DisplayName("Should clamp into range and map NaN to the lower bound")
    void shouldClamp() {
        assertThat(SafeMath.clamp(150, 0, 100)).isEqualTo(100.0);
        assertThat(SafeMath.clamp(-1, 0, 100)).isEqualTo(0.0);
        assertThat(SafeMath.clamp(Double.NaN, 0, 100)).isEqualTo(0.0);
    }
}
