package org.javai.projective.witness;

import java.util.List;
import java.util.Objects;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.Violation;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Cylinder;
import org.javai.projective.marginal.MeasurableFunction;

/**
 * The input to witness extraction: functions {@code f_0 … f_H}, each depending on a prefix
 * {@code [0, L(n))} of the coordinates, a uniform bound {@code C} and a level {@code ε > 0}.
 *
 * <p>The laws tying the functions to the family (marginals bounded by {@code C}, at least
 * {@code ε}, antitone in {@code n}) are checked when a {@link WitnessExtractor} is built.
 *
 * @param functions the sequence {@code f_0 … f_H}
 * @param upperBound the bound {@code C}
 * @param epsilon the level every marginal must reach
 */
public record WitnessProblem<X>(List<MeasurableFunction<X>> functions, double upperBound, double epsilon) {

    public WitnessProblem {
        Objects.requireNonNull(functions, "functions must not be null");
        if (functions.isEmpty()) {
            throw new IllegalArgumentException("functions must not be empty");
        }
        functions = List.copyOf(functions);
        if (Double.isNaN(epsilon) || epsilon <= 0) {
            throw new IllegalArgumentException("epsilon must be > 0, was: " + epsilon);
        }
        if (Double.isNaN(upperBound) || Double.isInfinite(upperBound)) {
            throw new InvariantViolationException(Violation.of("witness", "unbounded",
                    "upper bound must be finite, was: " + upperBound, Window.empty(), Double.MAX_VALUE, upperBound));
        }
    }

    /**
     * The problem for the indicators of a decreasing cylinder sequence, bounded by 1.
     */
    public static <X> WitnessProblem<X> ofCylinders(List<Cylinder<X>> cylinders, double epsilon) {
        Objects.requireNonNull(cylinders, "cylinders must not be null");
        List<MeasurableFunction<X>> indicators = cylinders.stream()
                .map(MeasurableFunction::indicator)
                .toList();
        return new WitnessProblem<>(indicators, 1.0, epsilon);
    }

    /**
     * The index {@code H} of the last function.
     */
    public int horizon() {
        return functions.size() - 1;
    }

    /**
     * {@code L(n)}: the length of the prefix {@code f_n} depends on.
     */
    public int length(int n) {
        return functions.get(n).support().prefixLength();
    }

    /**
     * The longest prefix any function depends on.
     */
    public int maxLength() {
        int max = 0;
        for (int n = 0; n < functions.size(); n++) {
            max = Math.max(max, length(n));
        }
        return max;
    }
}
