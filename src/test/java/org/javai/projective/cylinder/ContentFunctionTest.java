package org.javai.projective.cylinder;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import org.javai.projective.DomainException;
import org.javai.projective.ExtendedReal;
import org.javai.projective.Verdict;
import org.javai.projective.Window;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.space.CoordinateSet;
import org.javai.projective.space.DiscreteMeasure;
import org.javai.projective.space.UniformMeasure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class ContentFunctionTest {

    private final ContentFunction<Double> lebesgue = new ContentFunction<>(ProductFamily.iid(UniformMeasure.unitInterval()));
    private final ContentFunction<Integer> geometric = new ContentFunction<>(ProductFamily.iid(DiscreteMeasure.geometric(0.5)));

    @Test
    void content_ofWholeSpaceIsOne() {
        assertThat(lebesgue.content(Cylinder.universe())).isEqualTo(ExtendedReal.ONE);
        assertThat(lebesgue.content(Window.prefix(5), Box.universe(Window.prefix(5)))).isEqualTo(ExtendedReal.ONE);
    }

    @Test
    void content_ofLebesgueBoxIsProductOfLengths() {
        Random random = new Random(17);
        for (int trial = 0; trial < 25; trial++) {
            int m = 1 + random.nextInt(5);
            Map<Integer, CoordinateSet<Double>> sides = new HashMap<>();
            double expected = 1.0;
            for (int i = 0; i < m; i++) {
                double a = random.nextDouble();
                double b = random.nextDouble();
                sides.put(i, CoordinateSet.interval(Math.min(a, b), Math.max(a, b)));
                expected *= Math.abs(b - a);
            }

            assertThat(lebesgue.content(Cylinder.box(sides)).toDouble()).isCloseTo(expected, within(1e-12));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 12})
    void content_ofGeometricTailIsTwoToTheMinusN(int n) {
        Cylinder<Integer> tail = Cylinder.of(Box.on(0, CoordinateSet.atLeast(n)));

        assertThat(geometric.content(tail).toDouble()).isCloseTo(Math.pow(2, -n), within(1e-11));
    }

    @Test
    void content_isProjectiveUnderRandomReindexing() {
        Random random = new Random(42);
        for (int trial = 0; trial < 40; trial++) {
            Window s = randomWindow(random, 6);
            Window t = s.union(randomWindow(random, 8));
            Map<Integer, CoordinateSet<Integer>> sides = new HashMap<>();
            for (int index : s.toArray()) {
                sides.put(index, CoordinateSet.atLeast(random.nextInt(3)));
            }
            Cylinder<Integer> cylinder = new Cylinder<>(s, Box.of(s, sides));

            ExtendedReal direct = geometric.content(cylinder);
            ExtendedReal reindexed = geometric.content(CylinderAlgebra.reindex(cylinder, t));

            assertThat(reindexed.isCloseTo(direct, 1e-12)).isTrue();
        }
    }

    @Test
    void content_ofPredicateSetMatchesItsBoxForm() {
        Cylinder<Integer> box = Cylinder.box(Map.of(0, CoordinateSet.of(0), 1, CoordinateSet.of(0, 1)));
        Cylinder<Integer> predicate = Cylinder.of(PredicateSet.of(Window.of(0, 1),
                point -> point.coordinate(0) == 0 && point.coordinate(1) <= 1));

        assertThat(geometric.content(predicate).toDouble())
                .isCloseTo(geometric.content(box).toDouble(), within(1e-12))
                .isCloseTo(0.375, within(1e-12));
    }

    @Test
    void checkRepresentation_holdsForProductFamily() {
        Cylinder<Double> small = Cylinder.box(Map.of(1, CoordinateSet.interval(0.2, 0.7)));
        Cylinder<Double> large = CylinderAlgebra.reindex(small, Window.prefix(4));

        Verdict<Cylinder<Double>> verdict = lebesgue.checkRepresentation(small, large);

        assertThat(verdict.isSatisfied()).isTrue();
    }

    @Test
    void checkRepresentation_rejectsCylindersThatAreNotReindexings() {
        ContentFunction<Integer> coins = new ContentFunction<>(ProductFamily.iid(DiscreteMeasure.fairCoin()));
        Cylinder<Integer> bothFaces = Cylinder.of(Box.on(0, CoordinateSet.of(0, 1)));

        assertThatThrownBy(() -> coins.checkRepresentation(bothFaces, Cylinder.universe()))
                .isInstanceOf(DomainException.class)
                .hasMessageContaining("cannot be compared");
    }

    @Test
    void checkAdditivity_holdsForDisjointBoxes() {
        Cylinder<Double> left = Cylinder.box(Map.of(0, CoordinateSet.interval(0, 0.25)));
        Cylinder<Double> right = Cylinder.box(Map.of(0, CoordinateSet.interval(0.5, 0.75), 1, CoordinateSet.interval(0, 0.5)));

        Verdict<Cylinder<Double>> verdict = lebesgue.checkAdditivity(left, right);

        assertThat(verdict.isSatisfied()).isTrue();
        assertThat(lebesgue.content(verdict.getOrThrow()).toDouble()).isCloseTo(0.375, within(1e-12));
    }

    @Test
    void content_ofOverlappingUnionCountsOverlapOnce() {
        Cylinder<Double> first = Cylinder.box(Map.of(0, CoordinateSet.interval(0, 0.5)));
        Cylinder<Double> second = Cylinder.box(Map.of(1, CoordinateSet.interval(0, 0.5)));

        double union = lebesgue.content(CylinderAlgebra.union(first, second)).toDouble();

        assertThat(union).isCloseTo(0.75, within(1e-12));
    }

    private static Window randomWindow(Random random, int bound) {
        int size = 1 + random.nextInt(3);
        int[] indices = new int[size];
        for (int i = 0; i < size; i++) {
            indices[i] = random.nextInt(bound);
        }
        return Window.of(indices);
    }
}
