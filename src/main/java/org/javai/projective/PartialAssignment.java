package org.javai.projective;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Coordinate values for exactly the indices of a window.
 *
 * <p>As a {@link Point}, reading a coordinate outside the window fails with
 * {@link DomainException}.
 *
 * @param window the assigned indices
 * @param values one value per index of {@code window}
 */
public record PartialAssignment<X>(Window window, Map<Integer, X> values) implements Point<X> {

    public PartialAssignment {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (!window.indices().equals(values.keySet())) {
            throw new DomainException("assignment keys " + values.keySet() + " do not match window " + window);
        }
        for (Map.Entry<Integer, X> entry : values.entrySet()) {
            Objects.requireNonNull(entry.getValue(), "value at index " + entry.getKey() + " must not be null");
        }
        values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public static <X> PartialAssignment<X> empty() {
        return new PartialAssignment<>(Window.empty(), Map.of());
    }

    public static <X> PartialAssignment<X> of(Map<Integer, X> values) {
        return new PartialAssignment<>(Window.of(values.keySet()), values);
    }

    /**
     * Assigns {@code values.get(i)} to index {@code i}.
     */
    public static <X> PartialAssignment<X> prefix(List<X> values) {
        Map<Integer, X> map = new TreeMap<>();
        for (int i = 0; i < values.size(); i++) {
            map.put(i, values.get(i));
        }
        return of(map);
    }

    @Override
    public X coordinate(int index) {
        X value = values.get(index);
        if (value == null) {
            throw new DomainException("coordinate " + index + " is outside window " + window);
        }
        return value;
    }

    public PartialAssignment<X> with(int index, X value) {
        Map<Integer, X> extended = new TreeMap<>(values);
        extended.put(index, value);
        return of(extended);
    }

    public PartialAssignment<X> restrict(Window subWindow) {
        if (!window.containsAll(subWindow)) {
            throw new DomainException("cannot restrict " + window + " to " + subWindow);
        }
        Map<Integer, X> restricted = new TreeMap<>();
        for (Integer index : subWindow.indices()) {
            restricted.put(index, values.get(index));
        }
        return new PartialAssignment<>(subWindow, restricted);
    }
}
