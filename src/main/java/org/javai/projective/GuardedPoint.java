package org.javai.projective;

import java.util.Objects;

/**
 * A view of a point that only exposes the coordinates of one window.
 *
 * <p>A set or function declared measurable with respect to a window must not look at any
 * other coordinate; evaluating it through this view turns such a read into a
 * {@link MeasurabilityException}.
 */
public final class GuardedPoint<X> implements Point<X> {

    private final Point<X> delegate;
    private final Window window;
    private final String owner;

    private GuardedPoint(Point<X> delegate, Window window, String owner) {
        this.delegate = delegate;
        this.window = window;
        this.owner = owner;
    }

    public static <X> Point<X> of(Point<X> point, Window window, String owner) {
        Objects.requireNonNull(point, "point must not be null");
        Objects.requireNonNull(window, "window must not be null");
        return new GuardedPoint<>(point, window, owner);
    }

    @Override
    public X coordinate(int index) {
        if (!window.contains(index)) {
            throw new MeasurabilityException(owner + " reads coordinate " + index + " outside its window " + window);
        }
        return delegate.coordinate(index);
    }
}
