package org.javai.projective;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.projective.cylinder.Box;
import org.javai.projective.cylinder.Cylinder;
import org.javai.projective.extension.ProductMeasure;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.family.WindowMeasure;
import org.javai.projective.ops.ConstructionReporter;
import org.javai.projective.space.CoordinateSet;
import org.javai.projective.space.UniformMeasure;
import org.javai.projective.witness.ContinuityVerdict;
import org.junit.jupiter.api.Test;

class ProjectiveLimitsTest {

    @Test
    void build_lebesgueMeasuresRectangles() {
        ProductMeasure<Double> lebesgue = ProjectiveLimits.build(ProductFamily.iid(UniformMeasure.unitInterval()));

        ExtendedReal area = lebesgue.measure(Cylinder.box(Map.of(
                0, CoordinateSet.interval(0, 0.5),
                1, CoordinateSet.interval(0.25, 0.75))));

        assertThat(area.toDouble()).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void project_givesTheWindowMarginal() {
        ProductMeasure<Double> lebesgue = ProjectiveLimits.build(ProductFamily.iid(UniformMeasure.unitInterval()));

        WindowMeasure<Double> projected = ProjectiveLimits.project(lebesgue, Window.of(3));

        assertThat(projected.measure(Box.on(3, CoordinateSet.interval(0.1, 0.4))).toDouble())
                .isCloseTo(0.3, within(1e-12));
    }

    @Test
    void build_passesReporterToContinuityChecks() {
        List<ContinuityVerdict<?>> verdicts = new ArrayList<>();
        ConstructionReporter reporter = new ConstructionReporter() {
            @Override
            public void reportContinuity(ContinuityVerdict<?> verdict) {
                verdicts.add(verdict);
            }
        };
        ProductFamily<Double> family = ProductFamily.iid(UniformMeasure.unitInterval());
        ProductMeasure<Double> lebesgue = ProjectiveLimits.build(family, family.settings(), reporter);

        List<Cylinder<Double>> shrinking = new ArrayList<>();
        for (int n = 0; n < 40; n++) {
            shrinking.add(Cylinder.box(Map.of(0, CoordinateSet.interval(0, Math.pow(2, -n)))));
        }

        assertThat(lebesgue.measureOfIntersection(shrinking)).isEqualTo(ExtendedReal.ZERO);
        assertThat(verdicts).hasSize(1);
        assertThat(verdicts.get(0).isVanishing()).isTrue();
    }

    @Test
    void build_rejectsNullFamily() {
        assertThatThrownBy(() -> ProjectiveLimits.build(null))
                .isInstanceOf(NullPointerException.class);
    }
}
