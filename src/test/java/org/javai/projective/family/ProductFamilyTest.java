package org.javai.projective.family;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.projective.DomainException;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Box;
import org.javai.projective.cylinder.BoxUnion;
import org.javai.projective.cylinder.PredicateSet;
import org.javai.projective.space.CoordinateSet;
import org.javai.projective.space.DiscreteMeasure;
import org.javai.projective.space.UniformMeasure;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProductFamilyTest {

    @Test
    void coordinate_isResolvedOnce() {
        AtomicInteger calls = new AtomicInteger();
        ProductFamily<Integer> family = ProductFamily.of(index -> {
            calls.incrementAndGet();
            return DiscreteMeasure.fairCoin();
        });

        family.coordinate(3);
        family.coordinate(3);

        assertThat(calls.get()).isEqualTo(1);
        assertThatThrownBy(() -> family.coordinate(-1)).isInstanceOf(DomainException.class);
    }

    @Test
    void of_leadingMeasuresThenRest() {
        ProductFamily<Integer> family = ProductFamily.of(List.of(DiscreteMeasure.geometric(0.5)), DiscreteMeasure.fairCoin());

        assertThat(family.coordinate(0).measure(CoordinateSet.atLeast(2)).toDouble()).isCloseTo(0.25, within(1e-11));
        assertThat(family.coordinate(1).measure(CoordinateSet.atLeast(1)).toDouble()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void marginal_measuresBoxUnionAndPredicateSetsConsistently() {
        ProductFamily<Double> lebesgue = ProductFamily.iid(UniformMeasure.unitInterval());
        Window window = Window.of(0, 1);
        Box<Double> lower = Box.of(window, Map.of(0, CoordinateSet.interval(0, 0.5)));
        Box<Double> left = Box.of(window, Map.of(1, CoordinateSet.interval(0, 0.5)));

        double union = lebesgue.marginal(window).measure(BoxUnion.of(window, List.of(lower, left))).toDouble();
        double predicate = lebesgue.marginal(window).measure(PredicateSet.of(window,
                point -> point.coordinate(0) <= 0.5 || point.coordinate(1) <= 0.5)).toDouble();

        assertThat(union).isCloseTo(0.75, within(1e-12));
        assertThat(predicate).isCloseTo(0.75, within(1e-3));
    }

    @Test
    void marginal_rejectsSetOverAnotherWindow() {
        ProductFamily<Integer> family = ProductFamily.iid(DiscreteMeasure.fairCoin());

        assertThatThrownBy(() -> family.marginal(Window.of(0)).measure(Box.on(1, CoordinateSet.of(0))))
                .isInstanceOf(DomainException.class);
    }
}
