package org.javai.projective;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * A finite set of coordinate indices.
 *
 * <p>Windows are immutable and iterate their indices in ascending order.
 */
public final class Window {

    private static final Window EMPTY = new Window(new TreeSet<>());

    private final SortedSet<Integer> indices;

    private Window(SortedSet<Integer> indices) {
        this.indices = Collections.unmodifiableSortedSet(indices);
    }

    public static Window empty() {
        return EMPTY;
    }

    public static Window of(int... indices) {
        return of(IntStream.of(indices).boxed().collect(Collectors.toList()));
    }

    public static Window of(Collection<Integer> indices) {
        Objects.requireNonNull(indices, "indices must not be null");
        TreeSet<Integer> sorted = new TreeSet<>();
        for (Integer index : indices) {
            Objects.requireNonNull(index, "index must not be null");
            if (index < 0) {
                throw new IllegalArgumentException("index must be >= 0, was: " + index);
            }
            sorted.add(index);
        }
        return sorted.isEmpty() ? EMPTY : new Window(sorted);
    }

    /**
     * The indices {@code from, from + 1, ..., to - 1}; empty when {@code to <= from}.
     */
    public static Window range(int from, int to) {
        if (from < 0) {
            throw new IllegalArgumentException("from must be >= 0, was: " + from);
        }
        if (to <= from) {
            return EMPTY;
        }
        return of(IntStream.range(from, to).boxed().collect(Collectors.toList()));
    }

    /**
     * The indices {@code 0, ..., length - 1}.
     */
    public static Window prefix(int length) {
        return range(0, length);
    }

    public SortedSet<Integer> indices() {
        return indices;
    }

    public int size() {
        return indices.size();
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }

    public boolean contains(int index) {
        return indices.contains(index);
    }

    public boolean containsAll(Window other) {
        return indices.containsAll(other.indices);
    }

    /**
     * Length of the smallest prefix window containing this one.
     */
    public int prefixLength() {
        return isEmpty() ? 0 : indices.last() + 1;
    }

    public Window union(Window other) {
        if (containsAll(other)) {
            return this;
        }
        TreeSet<Integer> merged = new TreeSet<>(indices);
        merged.addAll(other.indices);
        return new Window(merged);
    }

    public Window intersect(Window other) {
        TreeSet<Integer> common = new TreeSet<>(indices);
        common.retainAll(other.indices);
        return common.isEmpty() ? EMPTY : new Window(common);
    }

    public Window minus(Window other) {
        TreeSet<Integer> rest = new TreeSet<>(indices);
        rest.removeAll(other.indices);
        return rest.isEmpty() ? EMPTY : new Window(rest);
    }

    public boolean isDisjointFrom(Window other) {
        return intersect(other).isEmpty();
    }

    public int[] toArray() {
        return indices.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Window other && indices.equals(other.indices);
    }

    @Override
    public int hashCode() {
        return indices.hashCode();
    }

    @Override
    public String toString() {
        return indices.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
    }
}
