package org.javai.projective;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.IntFunction;

/**
 * A point defined on every index: a base assignment with explicit overrides layered on top.
 *
 * <p>{@link #unassigned()} is the point with no base values; it is used wherever a computation
 * must not depend on coordinates it has not explicitly fixed.
 */
public final class FullPoint<X> implements Point<X> {

    private final IntFunction<X> base;
    private final Map<Integer, X> overrides;

    private FullPoint(IntFunction<X> base, Map<Integer, X> overrides) {
        this.base = base;
        this.overrides = overrides;
    }

    public static <X> FullPoint<X> of(IntFunction<X> coordinates) {
        Objects.requireNonNull(coordinates, "coordinates must not be null");
        return new FullPoint<>(coordinates, Map.of());
    }

    public static <X> FullPoint<X> constant(X value) {
        Objects.requireNonNull(value, "value must not be null");
        return new FullPoint<>(index -> value, Map.of());
    }

    public static <X> FullPoint<X> unassigned() {
        return new FullPoint<>(index -> {
            throw new DomainException("coordinate " + index + " is unassigned");
        }, Map.of());
    }

    @Override
    public X coordinate(int index) {
        X value = overrides.get(index);
        if (value != null) {
            return value;
        }
        X fallback = base.apply(index);
        if (fallback == null) {
            throw new DomainException("coordinate " + index + " is unassigned");
        }
        return fallback;
    }

    public FullPoint<X> with(int index, X value) {
        Objects.requireNonNull(value, "value must not be null");
        Map<Integer, X> updated = new TreeMap<>(overrides);
        updated.put(index, value);
        return new FullPoint<>(base, updated);
    }

    /**
     * Returns the point that agrees with {@code assignment} on its window and with this point elsewhere.
     */
    public FullPoint<X> update(PartialAssignment<X> assignment) {
        if (assignment.window().isEmpty()) {
            return this;
        }
        Map<Integer, X> updated = new TreeMap<>(overrides);
        updated.putAll(assignment.values());
        return new FullPoint<>(base, updated);
    }

    public PartialAssignment<X> restrict(Window window) {
        Map<Integer, X> values = new TreeMap<>();
        for (Integer index : window.indices()) {
            values.put(index, coordinate(index));
        }
        return new PartialAssignment<>(window, values);
    }
}
