package org.javai.projective.witness;

import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.ToDoubleFunction;
import org.javai.projective.space.CoordinateMeasure;

/**
 * Chooses the next witness coordinate: a value {@code z} with {@code score(z) ≥ threshold},
 * where {@code score} is the remaining marginal after fixing the coordinate to {@code z}.
 *
 * <p>Because the average of {@code score} against the coordinate measure is at least the
 * threshold, such a value exists; a selector only has to find one.
 *
 * @param <X> the coordinate value type
 */
@FunctionalInterface
public interface WitnessSelector<X> {

    /**
     * @param index the coordinate being fixed
     * @param measure the coordinate measure at {@code index}
     * @param score the remaining marginal as a function of the chosen value
     * @param threshold the level the score must reach
     * @return an admissible value, or empty if the selector found none
     */
    Optional<X> select(int index, CoordinateMeasure<X> measure, ToDoubleFunction<X> score, double threshold);

    /**
     * A selector backed by a caller-supplied oracle proposing one value per coordinate. The
     * proposal is accepted only if its score reaches the threshold.
     */
    static <X> WitnessSelector<X> oracle(IntFunction<X> proposals) {
        Objects.requireNonNull(proposals, "proposals must not be null");
        return (index, measure, score, threshold) -> {
            X proposal = proposals.apply(index);
            if (proposal == null || score.applyAsDouble(proposal) < threshold) {
                return Optional.empty();
            }
            return Optional.of(proposal);
        };
    }
}
