package org.javai.projective.cylinder;

import java.util.Map;
import java.util.Objects;
import org.javai.projective.DomainException;
import org.javai.projective.Point;
import org.javai.projective.Window;
import org.javai.projective.space.CoordinateSet;

/**
 * The cylinder {@code {x : x|_S ∈ A}} of full points determined by a window {@code S} and
 * a measurable set {@code A} over it.
 *
 * @param window the window {@code S}
 * @param set the base set {@code A}, defined over {@code window}
 */
public record Cylinder<X>(Window window, MeasurableSet<X> set) {

    public Cylinder {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(set, "set must not be null");
        if (!set.window().equals(window)) {
            throw new DomainException("set over " + set.window() + " cannot define a cylinder over " + window);
        }
    }

    public static <X> Cylinder<X> of(MeasurableSet<X> set) {
        return new Cylinder<>(set.window(), set);
    }

    /**
     * The whole product space, as the cylinder over the empty window.
     */
    public static <X> Cylinder<X> universe() {
        return of(Box.universe(Window.empty()));
    }

    /**
     * The cylinder constraining each key of {@code sides} to its coordinate set.
     */
    public static <X> Cylinder<X> box(Map<Integer, CoordinateSet<X>> sides) {
        return of(Box.of(sides));
    }

    public boolean contains(Point<X> point) {
        return set.contains(point);
    }
}
