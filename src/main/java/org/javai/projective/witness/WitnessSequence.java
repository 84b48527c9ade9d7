package org.javai.projective.witness;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.javai.projective.DomainException;
import org.javai.projective.PartialAssignment;
import org.javai.projective.Point;

/**
 * The witness point, produced lazily. Each call to {@link #next()} fixes the next coordinate
 * from the prefix recorded so far; fixed coordinates are never revised.
 *
 * <p>The sequence is infinite, so {@link #hasNext()} is always {@code true}. Instances are
 * stateful and not thread-safe.
 */
public final class WitnessSequence<X> implements Iterator<X> {

    private final WitnessExtractor<X> extractor;
    private final List<X> fixed = new ArrayList<>();

    WitnessSequence(WitnessExtractor<X> extractor) {
        this.extractor = extractor;
    }

    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public X next() {
        X value = extractor.step(PartialAssignment.prefix(fixed));
        fixed.add(value);
        return value;
    }

    /**
     * Number of coordinates fixed so far.
     */
    public int length() {
        return fixed.size();
    }

    /**
     * Returns coordinate {@code index}, fixing the coordinates before it if needed.
     */
    public X coordinate(int index) {
        if (index < 0) {
            throw new DomainException("index must be >= 0, was: " + index);
        }
        while (fixed.size() <= index) {
            next();
        }
        return fixed.get(index);
    }

    /**
     * Returns the first {@code length} coordinates, fixing them if needed.
     */
    public PartialAssignment<X> prefix(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0, was: " + length);
        }
        if (length > 0) {
            coordinate(length - 1);
        }
        return PartialAssignment.prefix(fixed.subList(0, length));
    }

    /**
     * The witness as a point; reading a coordinate forces it and every coordinate before it.
     */
    public Point<X> asPoint() {
        return this::coordinate;
    }
}
