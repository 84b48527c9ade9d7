package org.javai.projective.witness;

import java.util.List;
import java.util.Objects;
import org.javai.projective.PartialAssignment;

/**
 * The outcome of checking a decreasing cylinder sequence for downward continuity.
 * Either {@link Vanishing}: the contents tend to zero, or {@link Witnessed}: they stay above
 * {@code ε} and a point lying in every set of the sequence was constructed.
 *
 * @param <X> the coordinate value type
 */
public sealed interface ContinuityVerdict<X> permits ContinuityVerdict.Vanishing, ContinuityVerdict.Witnessed {

    /**
     * The content of each set in the sequence, in order.
     */
    List<Double> contents();

    boolean isVanishing();

    /**
     * The last content, which estimates the limit.
     */
    default double limit() {
        return contents().get(contents().size() - 1);
    }

    /**
     * The contents fell below the vanishing tolerance.
     */
    record Vanishing<X>(List<Double> contents) implements ContinuityVerdict<X> {

        public Vanishing {
            contents = List.copyOf(contents);
        }

        @Override
        public boolean isVanishing() {
            return true;
        }
    }

    /**
     * The contents stayed at or above {@code epsilon}; {@code witness} is a prefix of a point
     * in every set of the sequence, long enough to decide membership in each.
     */
    record Witnessed<X>(double epsilon, PartialAssignment<X> witness, List<Double> contents)
            implements ContinuityVerdict<X> {

        public Witnessed {
            Objects.requireNonNull(witness, "witness must not be null");
            contents = List.copyOf(contents);
        }

        @Override
        public boolean isVanishing() {
            return false;
        }
    }
}
