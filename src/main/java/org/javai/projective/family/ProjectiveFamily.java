package org.javai.projective.family;

import org.javai.projective.Window;

/**
 * A projective family: one marginal probability measure per finite window, such that for
 * {@code S ⊆ T} the pushforward of {@code μ_T} onto {@code S} is {@code μ_S}.
 *
 * <p>Families are immutable and are passed explicitly to every stage of the construction.
 *
 * @param <X> the coordinate value type
 */
public interface ProjectiveFamily<X> {

    /**
     * Returns the marginal {@code μ_S}.
     *
     * @throws org.javai.projective.DomainException if the family does not define a marginal on {@code window}
     */
    WindowMeasure<X> marginal(Window window);
}
