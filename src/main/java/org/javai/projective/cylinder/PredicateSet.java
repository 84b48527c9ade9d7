package org.javai.projective.cylinder;

import java.util.Objects;
import java.util.function.Predicate;
import org.javai.projective.DomainException;
import org.javai.projective.GuardedPoint;
import org.javai.projective.Point;
import org.javai.projective.Window;

/**
 * A set over a window given by a membership test.
 *
 * <p>The test may only read the coordinates of {@code window}; reading any other coordinate
 * means the set is not measurable with respect to the window and raises
 * {@link org.javai.projective.MeasurabilityException}.
 *
 * @param window the window {@code S}
 * @param membership the membership test
 */
public record PredicateSet<X>(Window window, Predicate<Point<X>> membership) implements MeasurableSet<X> {

    public PredicateSet {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(membership, "membership must not be null");
    }

    public static <X> PredicateSet<X> of(Window window, Predicate<Point<X>> membership) {
        return new PredicateSet<>(window, membership);
    }

    @Override
    public boolean contains(Point<X> point) {
        return membership.test(GuardedPoint.of(point, window, "set over " + window));
    }

    @Override
    public PredicateSet<X> reindex(Window larger) {
        if (!larger.containsAll(window)) {
            throw new DomainException("cannot reindex " + window + " onto " + larger + ": window would shrink");
        }
        // membership still reads only the original window
        Window original = window;
        return new PredicateSet<>(larger, point -> membership.test(GuardedPoint.of(point, original, "set over " + original)));
    }
}
