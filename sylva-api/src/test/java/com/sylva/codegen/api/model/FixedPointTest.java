package com.sylva.codegen.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FixedPointTest {

    @Test
    @DisplayName("Should add values that stay inside the long range")
    void shouldAddInRange() {
        assertThat(FixedPoint.saturatingAdd(-1_000_000_000L, 2_000_000_000L)).isEqualTo(1_000_000_000L);
        assertThat(FixedPoint.saturatingAdd(Long.MAX_VALUE, Long.MIN_VALUE)).isEqualTo(-1L);
    }

    @Test
    @DisplayName("Should clamp to Long.MAX_VALUE on positive overflow")
    void shouldClampPositiveOverflow() {
        assertThat(FixedPoint.saturatingAdd(Long.MAX_VALUE, 1L)).isEqualTo(Long.MAX_VALUE);
        assertThat(FixedPoint.saturatingAdd(Long.MAX_VALUE - 5, Long.MAX_VALUE - 5)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Should clamp to Long.MIN_VALUE on negative overflow")
    void shouldClampNegativeOverflow() {
        assertThat(FixedPoint.saturatingAdd(Long.MIN_VALUE, -1L)).isEqualTo(Long.MIN_VALUE);
        assertThat(FixedPoint.saturatingAdd(-Long.MAX_VALUE, -Long.MAX_VALUE)).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    @DisplayName("Negative saturation bound is -2^63, one below the negated positive bound")
    void negativeBoundIsAsymmetric() {
        assertThat(FixedPoint.saturatingAdd(-Long.MAX_VALUE, -1L)).isEqualTo(Long.MIN_VALUE);
        assertThat(FixedPoint.saturatingAdd(-Long.MAX_VALUE, -2L)).isEqualTo(Long.MIN_VALUE);
        assertThat(FixedPoint.saturatingAdd(Long.MIN_VALUE, 1L)).isEqualTo(-Long.MAX_VALUE);
        assertThat(Long.MIN_VALUE).isNotEqualTo(-Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Precision multiplier is 10^10")
    void precisionMultiplierIsTenToTheTenth() {
        assertThat(FixedPoint.PRECISION_MULTIPLIER).isEqualTo((long) Math.pow(10, 10));
    }
}
