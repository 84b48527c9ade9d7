package org.javai.projective.ops;

import org.javai.projective.Violation;
import org.javai.projective.witness.ContinuityVerdict;

/**
 * Observes a construction as it runs.
 * Implementations might write structured logs or emit metrics.
 *
 * <p>Reporters never change the result of a construction: a reporter that throws is ignored
 * by the {@link CompositeConstructionReporter}, and the built-in reporters catch their own errors.
 */
public interface ConstructionReporter {

	/**
	 * Reports that the witness fixed a coordinate.
	 *
	 * @param index the coordinate that was fixed
	 * @param value the chosen value
	 * @param bound the value of the remaining marginal at the new prefix
	 */
	default void reportWitnessCoordinate(int index, Object value, double bound) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports the outcome of a downward continuity check.
	 */
	default void reportContinuity(ContinuityVerdict<?> verdict) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Reports a broken law found by a check.
	 */
	default void reportViolation(Violation violation) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing.
	 */
	static ConstructionReporter noOp() {
		return new ConstructionReporter() {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 */
	static ConstructionReporter composite(ConstructionReporter... reporters) {
		return CompositeConstructionReporter.of(reporters);
	}
}
