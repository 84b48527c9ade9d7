package org.javai.projective.family;

import org.javai.projective.ExtendedReal;
import org.javai.projective.Window;
import org.javai.projective.cylinder.MeasurableSet;

/**
 * A probability measure {@code μ_S} on the finite product {@code ∏_{n∈S} X_n}.
 *
 * @param <X> the coordinate value type
 */
public interface WindowMeasure<X> {

    /**
     * The window {@code S}.
     */
    Window window();

    /**
     * Returns {@code μ_S(set)}.
     *
     * @throws org.javai.projective.DomainException if {@code set} is not a set over {@link #window()}
     */
    ExtendedReal measure(MeasurableSet<X> set);
}
