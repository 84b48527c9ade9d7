package org.javai.projective;

/**
 * Base type of the precondition failures raised while building a product measure.
 * These are unchecked: they indicate malformed input or a broken invariant, not an
 * operational condition a caller would retry.
 */
public class ProjectiveLimitException extends RuntimeException {

    public ProjectiveLimitException(String message) {
        super(message);
    }

    public ProjectiveLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
