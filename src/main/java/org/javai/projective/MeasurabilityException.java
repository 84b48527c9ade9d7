package org.javai.projective;

/**
 * Thrown when a set or function is not measurable with respect to the window it declares:
 * it reads a coordinate outside that window, or yields a value that is not an extended
 * non-negative real.
 */
public class MeasurabilityException extends ProjectiveLimitException {

    public MeasurabilityException(String message) {
        super(message);
    }

    public MeasurabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
