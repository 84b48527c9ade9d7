package org.javai.projective;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ExtendedRealTest {

    @Test
    void plus_saturatesAtInfinity() {
        assertThat(ExtendedReal.INFINITY.plus(ExtendedReal.of(3.0))).isEqualTo(ExtendedReal.INFINITY);
        assertThat(ExtendedReal.of(1.5).plus(ExtendedReal.of(2.0)).toDouble()).isEqualTo(3.5);
    }

    @Test
    void times_infinityByZeroIsZero() {
        assertThat(ExtendedReal.INFINITY.times(ExtendedReal.ZERO)).isEqualTo(ExtendedReal.ZERO);
        assertThat(ExtendedReal.ZERO.times(ExtendedReal.INFINITY)).isEqualTo(ExtendedReal.ZERO);
        assertThat(ExtendedReal.INFINITY.times(2.0).isInfinite()).isTrue();
    }

    @Test
    void of_rejectsNegativeAndNaN() {
        assertThatThrownBy(() -> ExtendedReal.of(-0.1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(">= 0");
        assertThatThrownBy(() -> ExtendedReal.of(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clamped_absorbsRoundingBelowZero() {
        assertThat(ExtendedReal.clamped(-1e-17)).isEqualTo(ExtendedReal.ZERO);
        assertThat(ExtendedReal.of(-0.0)).isEqualTo(ExtendedReal.ZERO);
    }

    @Test
    void isCloseTo_treatsInfinitiesSeparately() {
        assertThat(ExtendedReal.INFINITY.isCloseTo(ExtendedReal.INFINITY, 0.0)).isTrue();
        assertThat(ExtendedReal.INFINITY.isCloseTo(ExtendedReal.of(1e300), 1.0)).isFalse();
        assertThat(ExtendedReal.of(0.5).isCloseTo(ExtendedReal.of(0.5 + 1e-12), 1e-9)).isTrue();
    }

    @Test
    void ordering_andToString() {
        assertThat(ExtendedReal.ONE.min(ExtendedReal.INFINITY)).isEqualTo(ExtendedReal.ONE);
        assertThat(ExtendedReal.ONE.max(ExtendedReal.INFINITY)).isEqualTo(ExtendedReal.INFINITY);
        assertThat(ExtendedReal.INFINITY.toString()).isEqualTo("∞");
    }
}
