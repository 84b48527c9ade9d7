package org.javai.projective;

/**
 * Thrown when a marginal family or witness problem breaks one of the laws it must satisfy.
 * Also thrown by {@link Verdict#getOrThrow()} on a violated verdict.
 */
public class InvariantViolationException extends ProjectiveLimitException {

    private final Violation violation;

    public InvariantViolationException(Violation violation) {
        super("Invariant violated: " + violation.message());
        this.violation = violation;
    }

    public Violation violation() {
        return violation;
    }
}
