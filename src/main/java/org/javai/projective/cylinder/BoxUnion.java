package org.javai.projective.cylinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.javai.projective.DomainException;
import org.javai.projective.Point;
import org.javai.projective.Window;

/**
 * A finite union of boxes over one window. The boxes may overlap.
 *
 * @param window the window {@code S}
 * @param boxes the boxes, each over {@code window}
 */
public record BoxUnion<X>(Window window, List<Box<X>> boxes) implements MeasurableSet<X> {

    public BoxUnion {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(boxes, "boxes must not be null");
        for (Box<X> box : boxes) {
            if (!box.window().equals(window)) {
                throw new DomainException("box over " + box.window() + " cannot join a union over " + window);
            }
        }
        boxes = List.copyOf(boxes);
    }

    /**
     * Reindexes every box onto {@code window} and unites them.
     */
    public static <X> BoxUnion<X> of(Window window, List<Box<X>> boxes) {
        List<Box<X>> reindexed = new ArrayList<>();
        for (Box<X> box : boxes) {
            reindexed.add(box.reindex(window));
        }
        return new BoxUnion<>(window, reindexed);
    }

    @Override
    public boolean contains(Point<X> point) {
        for (Box<X> box : boxes) {
            if (box.contains(point)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public BoxUnion<X> reindex(Window larger) {
        if (!larger.containsAll(window)) {
            throw new DomainException("cannot reindex " + window + " onto " + larger + ": window would shrink");
        }
        return of(larger, boxes);
    }

    /**
     * Measures the union by inclusion-exclusion from a measure of single boxes.
     * Intersections that are empty or null are pruned together with all their refinements.
     */
    public double measureBy(ToDoubleFunction<Box<X>> boxMeasure) {
        return Math.max(0.0, inclusionExclusion(boxMeasure, 0, null, 0));
    }

    private double inclusionExclusion(ToDoubleFunction<Box<X>> boxMeasure, int start, Box<X> running, int depth) {
        double total = 0.0;
        for (int i = start; i < boxes.size(); i++) {
            Box<X> next = running == null ? boxes.get(i) : running.intersect(boxes.get(i));
            if (next.isEmpty()) {
                continue;
            }
            double measure = boxMeasure.applyAsDouble(next);
            if (measure == 0.0) {
                continue;
            }
            if (Double.isInfinite(measure)) {
                return Double.POSITIVE_INFINITY;
            }
            double sign = depth % 2 == 0 ? 1.0 : -1.0;
            total += sign * measure + inclusionExclusion(boxMeasure, i + 1, next, depth + 1);
        }
        return total;
    }
}
