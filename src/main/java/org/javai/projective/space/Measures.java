package org.javai.projective.space;

import org.javai.projective.ExtendedReal;
import org.javai.projective.MeasurabilityException;

/**
 * Shared helpers for coordinate measure implementations.
 */
final class Measures {

    private Measures() {
        // Utility class
    }

    /**
     * Validates one integrand value.
     */
    static double checkIntegrand(double value, Object at) {
        if (Double.isNaN(value)) {
            throw new MeasurabilityException("integrand is NaN at " + at);
        }
        if (value < 0) {
            throw new MeasurabilityException("integrand is negative (" + value + ") at " + at);
        }
        return value;
    }

    /**
     * Adds {@code weight * value} to {@code sum} with {@code ∞ · 0 = 0}.
     */
    static double accumulate(double sum, double weight, double value) {
        if (weight == 0.0) {
            return sum;
        }
        return sum + weight * value;
    }

    static ExtendedReal total(double sum) {
        return ExtendedReal.clamped(sum);
    }
}
