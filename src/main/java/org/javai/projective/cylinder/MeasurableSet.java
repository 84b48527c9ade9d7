package org.javai.projective.cylinder;

import org.javai.projective.Point;
import org.javai.projective.Window;

/**
 * A measurable subset {@code A} of the finite product {@code ∏_{n∈S} X_n} over a window {@code S}.
 *
 * @param <X> the coordinate value type
 */
public sealed interface MeasurableSet<X> permits Box, BoxUnion, PredicateSet {

    /**
     * The window {@code S} the set lives on.
     */
    Window window();

    /**
     * Tests whether the restriction of {@code point} to {@link #window()} lies in this set.
     */
    boolean contains(Point<X> point);

    /**
     * Rewrites this set over a larger window as the preimage under the projection onto
     * the current window.
     *
     * @throws org.javai.projective.DomainException if {@code larger} does not contain the current window
     */
    MeasurableSet<X> reindex(Window larger);
}
