package org.javai.projective.cylinder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.javai.projective.DomainException;
import org.javai.projective.Point;
import org.javai.projective.Window;
import org.javai.projective.space.CoordinateSet;

/**
 * A measurable rectangle {@code ∏_{n∈S} A_n}: one coordinate set per constrained index,
 * the whole coordinate space everywhere else in the window.
 *
 * <p>Sides equal to {@link CoordinateSet#all()} are dropped, so two boxes describing the same
 * rectangle with the same structured sides are equal.
 *
 * @param window the window {@code S}
 * @param sides constrained indices and their coordinate sets
 */
public record Box<X>(Window window, SortedMap<Integer, CoordinateSet<X>> sides) implements MeasurableSet<X> {

    public Box {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(sides, "sides must not be null");
        TreeMap<Integer, CoordinateSet<X>> normalized = new TreeMap<>();
        for (Map.Entry<Integer, CoordinateSet<X>> side : sides.entrySet()) {
            if (!window.contains(side.getKey())) {
                throw new DomainException("box side at index " + side.getKey() + " lies outside window " + window);
            }
            CoordinateSet<X> set = Objects.requireNonNull(side.getValue(), "side " + side.getKey() + " must not be null");
            if (!(set instanceof CoordinateSet.All)) {
                normalized.put(side.getKey(), set);
            }
        }
        sides = Collections.unmodifiableSortedMap(normalized);
    }

    /**
     * The whole product over {@code window}.
     */
    public static <X> Box<X> universe(Window window) {
        return new Box<>(window, new TreeMap<>());
    }

    public static <X> Box<X> of(Window window, Map<Integer, CoordinateSet<X>> sides) {
        return new Box<>(window, new TreeMap<>(sides));
    }

    /**
     * A box on the window formed by the keys of {@code sides}.
     */
    public static <X> Box<X> of(Map<Integer, CoordinateSet<X>> sides) {
        return of(Window.of(sides.keySet()), sides);
    }

    /**
     * The box {@code {x : x_index ∈ set}} on the window {@code {index}}.
     */
    public static <X> Box<X> on(int index, CoordinateSet<X> set) {
        return of(Window.of(index), Map.of(index, set));
    }

    public CoordinateSet<X> side(int index) {
        CoordinateSet<X> side = sides.get(index);
        return side != null ? side : CoordinateSet.all();
    }

    /**
     * Adds the constraint {@code x_index ∈ set}, growing the window when needed.
     */
    public Box<X> constrain(int index, CoordinateSet<X> set) {
        TreeMap<Integer, CoordinateSet<X>> updated = new TreeMap<>(sides);
        updated.put(index, CoordinateSet.intersect(side(index), set));
        return new Box<>(window.union(Window.of(index)), updated);
    }

    /**
     * Returns whether some side is structurally empty, which makes the whole box empty.
     */
    public boolean isEmpty() {
        return sides.values().stream().anyMatch(CoordinateSet::isEmpty);
    }

    public Box<X> intersect(Box<X> other) {
        TreeMap<Integer, CoordinateSet<X>> merged = new TreeMap<>(sides);
        for (Map.Entry<Integer, CoordinateSet<X>> side : other.sides.entrySet()) {
            merged.merge(side.getKey(), side.getValue(), CoordinateSet::intersect);
        }
        return new Box<>(window.union(other.window), merged);
    }

    @Override
    public boolean contains(Point<X> point) {
        for (Map.Entry<Integer, CoordinateSet<X>> side : sides.entrySet()) {
            if (!side.getValue().contains(point.coordinate(side.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Box<X> reindex(Window larger) {
        if (!larger.containsAll(window)) {
            throw new DomainException("cannot reindex " + window + " onto " + larger + ": window would shrink");
        }
        return new Box<>(larger, sides);
    }
}
