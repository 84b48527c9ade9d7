package org.javai.projective.space;

import java.util.List;
import org.javai.projective.ExtendedReal;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UniformMeasureTest {

    private final UniformMeasure lebesgue = UniformMeasure.unitInterval();

    @Test
    void measure_intervalIsItsLength() {
        assertThat(lebesgue.measure(CoordinateSet.interval(0.25, 0.75)).toDouble()).isCloseTo(0.5, within(1e-15));
        assertThat(lebesgue.measure(CoordinateSet.interval(-1.0, 0.1)).toDouble()).isCloseTo(0.1, within(1e-15));
        assertThat(lebesgue.measure(CoordinateSet.all())).isEqualTo(ExtendedReal.ONE);
    }

    @Test
    void measure_finiteSetsAreNull() {
        assertThat(lebesgue.measure(CoordinateSet.of(0.1, 0.2))).isEqualTo(ExtendedReal.ZERO);
    }

    @Test
    void measure_predicateSetByQuadrature() {
        double measured = lebesgue.measure(CoordinateSet.where(x -> x < 0.5)).toDouble();

        assertThat(measured).isCloseTo(0.5, within(1.0 / lebesgue.resolution()));
    }

    @Test
    void integrate_polynomial() {
        assertThat(lebesgue.integrate(x -> x * x).toDouble()).isCloseTo(1.0 / 3, within(1e-5));
    }

    @Test
    void averageOver_subInterval() {
        UniformMeasure wide = UniformMeasure.on(0.0, 4.0);

        assertThat(wide.averageOver(2.0, 4.0, x -> x).toDouble()).isCloseTo(3.0, within(1e-12));
        assertThatThrownBy(() -> wide.averageOver(3.0, 5.0, x -> x))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void partition_intoEqualIntervals() {
        List<CoordinateSet<Double>> parts = UniformMeasure.on(0.0, 2.0).partition(4);

        assertThat(parts).containsExactly(
                CoordinateSet.interval(0.0, 0.5),
                CoordinateSet.interval(0.5, 1.0),
                CoordinateSet.interval(1.0, 1.5),
                CoordinateSet.interval(1.5, 2.0));
    }

    @Test
    void on_rejectsDegenerateInterval() {
        assertThatThrownBy(() -> UniformMeasure.on(1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
