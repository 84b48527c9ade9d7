package org.javai.projective.witness;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.projective.DomainException;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.PartialAssignment;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Cylinder;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.marginal.MeasurableFunction;
import org.javai.projective.ops.ConstructionReporter;
import org.javai.projective.space.CoordinateSet;
import org.javai.projective.space.DiscreteMeasure;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WitnessExtractorTest {

    private final ProductFamily<Integer> geometric = ProductFamily.iid(DiscreteMeasure.geometric(0.5));
    private final ProductFamily<Integer> coin = ProductFamily.iid(DiscreteMeasure.fairCoin());

    @Test
    void build_rejectsLevelAboveVanishingContents() {
        WitnessProblem<Integer> problem = WitnessProblem.ofCylinders(DownwardContinuityTest.geometricTails(11), 0.1);

        assertThatThrownBy(() -> WitnessExtractor.builder(geometric).problem(problem).build())
                .isInstanceOf(InvariantViolationException.class)
                .extracting(e -> ((InvariantViolationException) e).violation().id().toString())
                .isEqualTo("witness:below_epsilon");
    }

    @Test
    void problem_rejectsInfiniteBoundAndNonPositiveEpsilon() {
        List<MeasurableFunction<Integer>> functions = List.of(MeasurableFunction.constant(1.0));

        assertThatThrownBy(() -> new WitnessProblem<>(functions, Double.POSITIVE_INFINITY, 0.5))
                .isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> new WitnessProblem<>(functions, 1.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WitnessProblem<>(List.<MeasurableFunction<Integer>>of(), 1.0, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void build_rejectsMarginalsAboveTheBound() {
        MeasurableFunction<Integer> twice = MeasurableFunction.of(Window.of(0), point -> 2.0);
        WitnessProblem<Integer> problem = new WitnessProblem<>(List.of(twice), 1.0, 0.5);

        assertThatThrownBy(() -> WitnessExtractor.builder(coin).problem(problem).build())
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("exceeds the bound");
    }

    @Test
    void build_rejectsIncreasingMarginals() {
        List<Cylinder<Integer>> increasing = List.of(
                Cylinder.box(Map.of(0, CoordinateSet.of(0))),
                Cylinder.universe());
        WitnessProblem<Integer> problem = WitnessProblem.ofCylinders(increasing, 0.25);

        assertThatThrownBy(() -> WitnessExtractor.builder(coin).problem(problem).build())
                .isInstanceOf(InvariantViolationException.class)
                .extracting(e -> ((InvariantViolationException) e).violation().id().toString())
                .isEqualTo("witness:not_antitone");
    }

    @Test
    void extract_fixesCoordinatesLazilyAndNeverRevisesThem() {
        WitnessExtractor<Integer> extractor = WitnessExtractor.builder(coin)
                .problem(WitnessProblem.ofCylinders(List.of(Cylinder.box(Map.of(2, CoordinateSet.of(1)))), 0.5))
                .build();

        WitnessSequence<Integer> witness = extractor.extract();

        assertThat(witness.length()).isZero();
        assertThat(witness.coordinate(2)).isEqualTo(1);
        assertThat(witness.length()).isEqualTo(3);
        PartialAssignment<Integer> prefix = witness.prefix(3);
        assertThat(witness.hasNext()).isTrue();
        witness.next();
        assertThat(witness.prefix(3)).isEqualTo(prefix);
        assertThat(witness.asPoint().coordinate(2)).isEqualTo(1);
    }

    @Test
    void extract_withOracle() {
        List<Integer> proposed = new ArrayList<>();
        WitnessExtractor<Integer> extractor = WitnessExtractor.builder(coin)
                .problem(WitnessProblem.ofCylinders(List.of(Cylinder.box(Map.of(0, CoordinateSet.of(1)))), 0.5))
                .selector(WitnessSelector.oracle(index -> {
                    proposed.add(index);
                    return 1;
                }))
                .build();

        assertThat(extractor.extract().prefix(2).values()).containsExactly(entry(0, 1), entry(1, 1));
        assertThat(proposed).containsExactly(0, 1);
    }

    @Test
    void step_rejectedOracleProposalIsAnInvariantViolation() {
        WitnessExtractor<Integer> extractor = WitnessExtractor.builder(coin)
                .problem(WitnessProblem.ofCylinders(List.of(Cylinder.box(Map.of(0, CoordinateSet.of(1)))), 0.5))
                .selector(WitnessSelector.oracle(index -> 0))
                .build();

        assertThatThrownBy(() -> extractor.step(PartialAssignment.empty()))
                .isInstanceOf(InvariantViolationException.class)
                .extracting(e -> ((InvariantViolationException) e).violation().id().toString())
                .isEqualTo("witness:no_admissible_value");
    }

    @Test
    void step_requiresAPrefix() {
        WitnessExtractor<Integer> extractor = WitnessExtractor.builder(coin)
                .problem(WitnessProblem.ofCylinders(List.of(Cylinder.universe()), 1.0))
                .build();

        assertThatThrownBy(() -> extractor.step(PartialAssignment.of(Map.of(1, 0))))
                .isInstanceOf(DomainException.class);
    }

    @Test
    void extract_reportsEveryFixedCoordinate() {
        List<Integer> reported = new ArrayList<>();
        ConstructionReporter reporter = new ConstructionReporter() {
            @Override
            public void reportWitnessCoordinate(int index, Object value, double bound) {
                reported.add(index);
            }
        };
        WitnessExtractor<Integer> extractor = WitnessExtractor.builder(geometric)
                .problem(WitnessProblem.ofCylinders(List.of(Cylinder.box(Map.of(1, CoordinateSet.atLeast(2)))), 0.25))
                .reporter(reporter)
                .build();

        PartialAssignment<Integer> prefix = extractor.extract().prefix(2);

        assertThat(reported).containsExactly(0, 1);
        assertThat(prefix.coordinate(1)).isGreaterThanOrEqualTo(2);
        assertThat(extractor.levels()).hasSize(1);
    }
}
