package org.javai.projective.space;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A measurable subset of a single coordinate space.
 *
 * <p>The structured forms ({@link All}, {@link Finite}, {@link Interval}, {@link AtLeast}) can be
 * measured exactly and compared structurally; {@link Where} and {@link Intersection} are measured
 * by enumeration or quadrature.
 *
 * @param <X> the coordinate value type
 */
public sealed interface CoordinateSet<X>
        permits CoordinateSet.All, CoordinateSet.Finite, CoordinateSet.Interval,
                CoordinateSet.AtLeast, CoordinateSet.Where, CoordinateSet.Intersection {

    boolean contains(X value);

    /**
     * Returns whether this set is structurally empty. A {@code false} answer does not prove
     * the set has points.
     */
    boolean isEmpty();

    /**
     * The whole coordinate space.
     */
    record All<X>() implements CoordinateSet<X> {

        @Override
        public boolean contains(X value) {
            return true;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }

    /**
     * A finite set of values.
     */
    record Finite<X>(Set<X> values) implements CoordinateSet<X> {

        public Finite {
            Objects.requireNonNull(values, "values must not be null");
            values = Set.copyOf(values);
        }

        @Override
        public boolean contains(X value) {
            return values.contains(value);
        }

        @Override
        public boolean isEmpty() {
            return values.isEmpty();
        }
    }

    /**
     * The closed real interval {@code [lo, hi]}; empty when {@code lo > hi}.
     */
    record Interval(double lo, double hi) implements CoordinateSet<Double> {

        public Interval {
            if (Double.isNaN(lo) || Double.isNaN(hi)) {
                throw new IllegalArgumentException("interval bounds must not be NaN");
            }
        }

        @Override
        public boolean contains(Double value) {
            return value >= lo && value <= hi;
        }

        @Override
        public boolean isEmpty() {
            return lo > hi;
        }

        public double length() {
            return isEmpty() ? 0.0 : hi - lo;
        }
    }

    /**
     * The natural numbers {@code >= bound}.
     */
    record AtLeast(int bound) implements CoordinateSet<Integer> {

        @Override
        public boolean contains(Integer value) {
            return value >= bound;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }

    /**
     * A set given by a membership test.
     */
    record Where<X>(Predicate<? super X> membership) implements CoordinateSet<X> {

        public Where {
            Objects.requireNonNull(membership, "membership must not be null");
        }

        @Override
        public boolean contains(X value) {
            return membership.test(value);
        }

        @Override
        public boolean isEmpty() {
            return false;
        }
    }

    /**
     * The intersection of two sets that have no simpler common form.
     */
    record Intersection<X>(CoordinateSet<X> left, CoordinateSet<X> right) implements CoordinateSet<X> {

        public Intersection {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public boolean contains(X value) {
            return left.contains(value) && right.contains(value);
        }

        @Override
        public boolean isEmpty() {
            return left.isEmpty() || right.isEmpty();
        }
    }

    static <X> CoordinateSet<X> all() {
        return new All<>();
    }

    @SafeVarargs
    static <X> CoordinateSet<X> of(X... values) {
        return new Finite<>(new LinkedHashSet<>(List.of(values)));
    }

    static <X> CoordinateSet<X> of(Set<X> values) {
        return new Finite<>(values);
    }

    static CoordinateSet<Double> interval(double lo, double hi) {
        return new Interval(lo, hi);
    }

    static CoordinateSet<Integer> atLeast(int bound) {
        return new AtLeast(bound);
    }

    static <X> CoordinateSet<X> where(Predicate<? super X> membership) {
        return new Where<>(membership);
    }

    /**
     * Intersects two sets, keeping the result in a structured form whenever one exists.
     */
    @SuppressWarnings("unchecked")
    static <X> CoordinateSet<X> intersect(CoordinateSet<X> a, CoordinateSet<X> b) {
        if (a instanceof All) {
            return b;
        }
        if (b instanceof All) {
            return a;
        }
        if (a instanceof Finite<X> finite) {
            return new Finite<>(filter(finite.values(), b));
        }
        if (b instanceof Finite<X> finite) {
            return new Finite<>(filter(finite.values(), a));
        }
        if (a instanceof Interval left && b instanceof Interval right) {
            return (CoordinateSet<X>) new Interval(Math.max(left.lo(), right.lo()), Math.min(left.hi(), right.hi()));
        }
        if (a instanceof AtLeast left && b instanceof AtLeast right) {
            return (CoordinateSet<X>) new AtLeast(Math.max(left.bound(), right.bound()));
        }
        return new Intersection<>(a, b);
    }

    private static <X> Set<X> filter(Set<X> values, CoordinateSet<X> other) {
        Set<X> kept = new LinkedHashSet<>();
        for (X value : values) {
            if (other.contains(value)) {
                kept.add(value);
            }
        }
        return kept;
    }
}
