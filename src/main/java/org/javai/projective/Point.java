package org.javai.projective;

/**
 * A point of the product space, read one coordinate at a time.
 *
 * @param <X> the coordinate value type
 */
@FunctionalInterface
public interface Point<X> {

    /**
     * Returns the value of the coordinate at {@code index}.
     *
     * @throws DomainException if this point does not define the coordinate
     */
    X coordinate(int index);
}
