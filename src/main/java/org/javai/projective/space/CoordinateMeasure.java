package org.javai.projective.space;

import java.util.List;
import java.util.function.ToDoubleFunction;
import org.javai.projective.ExtendedReal;

/**
 * A probability measure {@code μ_n} on one coordinate space {@code X_n}.
 *
 * <p>Implementations are immutable. A measure that cannot evaluate a set it is handed
 * (for example an unsupported structured form) throws
 * {@link org.javai.projective.MeasurabilityException}.
 *
 * @param <X> the coordinate value type
 */
public interface CoordinateMeasure<X> {

    /**
     * Returns {@code μ(set)}.
     */
    ExtendedReal measure(CoordinateSet<X> set);

    /**
     * Returns {@code ∫ f dμ} for a non-negative {@code f}, saturating at {@code +∞}.
     *
     * @throws org.javai.projective.MeasurabilityException if {@code f} yields NaN or a negative value
     */
    ExtendedReal integrate(ToDoubleFunction<? super X> f);

    /**
     * Splits the space into at most {@code pieces} pairwise disjoint (up to null sets) measurable
     * sets whose union is the whole space. Used to probe additivity before extending a content.
     */
    List<CoordinateSet<X>> partition(int pieces);
}
