package org.javai.projective;

/**
 * A value in the extended non-negative reals {@code [0, ∞]}.
 *
 * <p>Arithmetic saturates instead of failing: {@code ∞ + x = ∞} and {@code ∞ · 0 = 0}.
 * Content values, marginal integrals and measures of sets are all expressed in this type.
 *
 * @param value a non-negative double, or {@link Double#POSITIVE_INFINITY}
 */
public record ExtendedReal(double value) implements Comparable<ExtendedReal> {

    public static final ExtendedReal ZERO = new ExtendedReal(0.0);
    public static final ExtendedReal ONE = new ExtendedReal(1.0);
    public static final ExtendedReal INFINITY = new ExtendedReal(Double.POSITIVE_INFINITY);

    public ExtendedReal {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("value must not be NaN");
        }
        if (value < 0) {
            throw new IllegalArgumentException("value must be >= 0, was: " + value);
        }
        // normalize -0.0
        value = value == 0.0 ? 0.0 : value;
    }

    public static ExtendedReal of(double value) {
        return new ExtendedReal(value);
    }

    /**
     * Creates a value from a floating-point computation that may have drifted slightly
     * below zero through cancellation.
     */
    public static ExtendedReal clamped(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("value must not be NaN");
        }
        return new ExtendedReal(Math.max(0.0, value));
    }

    public boolean isInfinite() {
        return value == Double.POSITIVE_INFINITY;
    }

    public boolean isZero() {
        return value == 0.0;
    }

    public ExtendedReal plus(ExtendedReal other) {
        return new ExtendedReal(value + other.value);
    }

    public ExtendedReal times(ExtendedReal other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        return new ExtendedReal(value * other.value);
    }

    public ExtendedReal times(double factor) {
        return times(of(factor));
    }

    public ExtendedReal min(ExtendedReal other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public ExtendedReal max(ExtendedReal other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public double toDouble() {
        return value;
    }

    /**
     * Returns whether both values lie within {@code tolerance} of each other.
     * Two infinite values are always close; an infinite and a finite value never are.
     */
    public boolean isCloseTo(ExtendedReal other, double tolerance) {
        if (isInfinite() || other.isInfinite()) {
            return isInfinite() && other.isInfinite();
        }
        return Math.abs(value - other.value) <= tolerance;
    }

    @Override
    public int compareTo(ExtendedReal other) {
        return Double.compare(value, other.value);
    }

    @Override
    public String toString() {
        return isInfinite() ? "∞" : Double.toString(value);
    }
}
