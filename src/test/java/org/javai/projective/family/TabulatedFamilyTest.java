package org.javai.projective.family;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.projective.DomainException;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.PartialAssignment;
import org.javai.projective.Verdict;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Box;
import org.javai.projective.space.CoordinateSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TabulatedFamilyTest {

    @Test
    void of_acceptsConsistentTables() {
        TabulatedFamily<Integer> family = TabulatedFamily.of(correlatedCoins(0.5));

        assertThat(family.marginal(Window.of(0)).measure(Box.on(0, CoordinateSet.of(1))).toDouble())
                .isCloseTo(0.5, within(1e-12));
    }

    @Test
    void of_rejectsTablesThatDisagreeOnCommonCoordinates() {
        assertThatThrownBy(() -> TabulatedFamily.of(correlatedCoins(0.3)))
                .isInstanceOf(InvariantViolationException.class)
                .extracting(e -> ((InvariantViolationException) e).violation().id().toString())
                .isEqualTo("projectivity:pushforward_mismatch");
    }

    @Test
    void of_rejectsOverlappingWindowsThatDisagree() {
        Map<Window, Map<PartialAssignment<Integer>, Double>> tables = new HashMap<>();
        tables.put(Window.of(0, 1), Map.of(PartialAssignment.of(Map.of(0, 0, 1, 1)), 1.0));
        tables.put(Window.of(1, 2), Map.of(PartialAssignment.of(Map.of(1, 0, 2, 0)), 1.0));

        assertThatThrownBy(() -> TabulatedFamily.of(tables))
                .isInstanceOf(InvariantViolationException.class)
                .extracting(e -> ((InvariantViolationException) e).violation().window())
                .isEqualTo(Window.of(1));
    }

    @Test
    void of_acceptsOverlappingWindowsThatAgree() {
        Map<Window, Map<PartialAssignment<Integer>, Double>> tables = new HashMap<>();
        tables.put(Window.of(0, 1), Map.of(
                PartialAssignment.of(Map.of(0, 0, 1, 1)), 0.5,
                PartialAssignment.of(Map.of(0, 1, 1, 0)), 0.5));
        tables.put(Window.of(1, 2), Map.of(
                PartialAssignment.of(Map.of(1, 0, 2, 0)), 0.5,
                PartialAssignment.of(Map.of(1, 1, 2, 1)), 0.5));

        TabulatedFamily<Integer> family = TabulatedFamily.of(tables);

        assertThat(family.marginal(Window.of(1)).measure(Box.on(1, CoordinateSet.of(1))).toDouble())
                .isCloseTo(0.5, within(1e-12));
    }

    @Test
    void checkProjectivity_reportsMismatchWithoutThrowing() {
        TabulatedFamily<Integer> family = TabulatedFamily.unchecked(correlatedCoins(0.3), ExtensionSettings.defaults());

        Verdict<TabulatedFamily<Integer>> verdict = family.checkProjectivity();

        assertThat(verdict.isViolated()).isTrue();
        Verdict.Violated<TabulatedFamily<Integer>> violated = (Verdict.Violated<TabulatedFamily<Integer>>) verdict;
        assertThat(violated.violation().window()).isEqualTo(Window.of(0));
        assertThat(violated.violation().discrepancy()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void of_rejectsUnnormalizedTable() {
        Map<Window, Map<PartialAssignment<Integer>, Double>> tables = new HashMap<>();
        tables.put(Window.of(0), Map.of(assignment(0), 0.5, assignment(1), 0.4));

        assertThatThrownBy(() -> TabulatedFamily.of(tables))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("total mass");
    }

    @Test
    void marginal_ofUntabulatedWindowPushesForwardFromSuperset() {
        TabulatedFamily<Integer> family = TabulatedFamily.of(correlatedCoins(0.5));

        WindowMeasure<Integer> second = family.marginal(Window.of(1));

        assertThat(second.measure(Box.on(1, CoordinateSet.of(0))).toDouble()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void marginal_withoutTabulatedSupersetIsADomainError() {
        TabulatedFamily<Integer> family = TabulatedFamily.of(correlatedCoins(0.5));

        assertThatThrownBy(() -> family.marginal(Window.of(2)))
                .isInstanceOf(DomainException.class);
    }

    @Test
    void of_rejectsRowsOverTheWrongWindow() {
        Map<Window, Map<PartialAssignment<Integer>, Double>> tables = new HashMap<>();
        tables.put(Window.of(0), Map.of(PartialAssignment.of(Map.of(1, 0)), 1.0));

        assertThatThrownBy(() -> TabulatedFamily.of(tables))
                .isInstanceOf(DomainException.class);
    }

    /**
     * Two perfectly correlated coins on {0, 1}, plus a table for {0} with P(x0 = 1) = p1.
     */
    private static Map<Window, Map<PartialAssignment<Integer>, Double>> correlatedCoins(double p1) {
        Map<Window, Map<PartialAssignment<Integer>, Double>> tables = new HashMap<>();
        tables.put(Window.of(0, 1), Map.of(
                PartialAssignment.prefix(List.of(0, 0)), 0.5,
                PartialAssignment.prefix(List.of(1, 1)), 0.5));
        tables.put(Window.of(0), Map.of(assignment(0), 1 - p1, assignment(1), p1));
        return tables;
    }

    private static PartialAssignment<Integer> assignment(int x0) {
        return PartialAssignment.prefix(List.of(x0));
    }
}
