package org.javai.projective;

import java.util.Objects;

/**
 * Describes a broken law: which one, where, and the two numbers that disagree.
 *
 * @param id The violation identifier (namespace:name)
 * @param message Human-readable description
 * @param window The window the law was checked on
 * @param expected The value the law requires
 * @param actual The value that was found
 */
public record Violation(
        ViolationId id,
        String message,
        Window window,
        double expected,
        double actual
) {

    public Violation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(window, "window must not be null");
    }

    public static Violation of(String namespace, String name, String message, Window window,
                               double expected, double actual) {
        return new Violation(ViolationId.of(namespace, name), message, window, expected, actual);
    }

    /**
     * Absolute gap between the required and the found value.
     */
    public double discrepancy() {
        return Math.abs(expected - actual);
    }
}
