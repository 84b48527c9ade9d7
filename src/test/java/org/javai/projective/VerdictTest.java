package org.javai.projective;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class VerdictTest {

    @Test
    void holds_getOrThrow_returnsValue() {
        Verdict<String> verdict = Verdict.holds("ok");

        assertThat(verdict.isSatisfied()).isTrue();
        assertThat(verdict.isViolated()).isFalse();
        assertThat(verdict.getOrThrow()).isEqualTo("ok");
    }

    @Test
    void holds_map_transformsValue() {
        Verdict<Integer> verdict = Verdict.holds(2).map(x -> x * 21);

        assertThat(verdict.getOrThrow()).isEqualTo(42);
    }

    @Test
    void violated_getOrThrow_throwsWithViolation() {
        Violation violation = violation();
        Verdict<String> verdict = Verdict.violated(violation);

        assertThat(verdict.isViolated()).isTrue();
        assertThatThrownBy(verdict::getOrThrow)
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("content differs")
                .extracting(e -> ((InvariantViolationException) e).violation())
                .isEqualTo(violation);
    }

    @Test
    void violated_mapAndFlatMap_propagateViolation() {
        Verdict<String> verdict = Verdict.<String>violated(violation())
                .map(String::trim)
                .flatMap(Verdict::holds);

        assertThat(verdict).isInstanceOf(Verdict.Violated.class);
        assertThat(verdict.getOrElse("fallback")).isEqualTo("fallback");
        assertThat(verdict.getOrElseGet(() -> "lazy")).isEqualTo("lazy");
    }

    @Test
    void violation_describesDiscrepancy() {
        Violation violation = violation();

        assertThat(violation.id().toString()).isEqualTo("content:representation_dependent");
        assertThat(violation.discrepancy()).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void violationId_rejectsBlankParts() {
        assertThatThrownBy(() -> ViolationId.of(" ", "name"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Violation violation() {
        return Violation.of("content", "representation_dependent", "content differs", Window.of(0), 0.5, 0.25);
    }
}
