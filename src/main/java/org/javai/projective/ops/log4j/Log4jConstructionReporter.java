package org.javai.projective.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.projective.Violation;
import org.javai.projective.ops.ConstructionReporter;
import org.javai.projective.witness.ContinuityVerdict;

/**
 * Reports construction events using Log4j2.
 *
 * <p>Events are logged at a level that matches how much attention they need:
 * <ul>
 *   <li>witness coordinates → DEBUG</li>
 *   <li>continuity verdicts → INFO</li>
 *   <li>violations → WARN</li>
 * </ul>
 * Each event carries a marker ({@code WITNESS}, {@code CONTINUITY}, {@code VIOLATION}) so that
 * appenders can route or filter them.
 */
public class Log4jConstructionReporter implements ConstructionReporter {

	static final Marker WITNESS_MARKER = MarkerManager.getMarker("WITNESS");
	static final Marker CONTINUITY_MARKER = MarkerManager.getMarker("CONTINUITY");
	static final Marker VIOLATION_MARKER = MarkerManager.getMarker("VIOLATION");

	private final Logger logger;

	public Log4jConstructionReporter() {
		this(LogManager.getLogger("org.javai.projective.Construction"));
	}

	public Log4jConstructionReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jConstructionReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportWitnessCoordinate(int index, Object value, double bound) {
		logger.atDebug()
			.withMarker(WITNESS_MARKER)
			.log("Witness fixed coordinate {} = {} (remaining marginal {})", index, value, bound);
	}

	@Override
	public void reportContinuity(ContinuityVerdict<?> verdict) {
		logger.atLevel(Level.INFO)
			.withMarker(CONTINUITY_MARKER)
			.log(formatVerdict(verdict));
	}

	@Override
	public void reportViolation(Violation violation) {
		logger.atWarn()
			.withMarker(VIOLATION_MARKER)
			.log("Violation [{}] on {}: {} | expected={}, actual={}",
				violation.id(),
				violation.window(),
				violation.message(),
				violation.expected(),
				violation.actual());
	}

	static String formatVerdict(ContinuityVerdict<?> verdict) {
		if (verdict instanceof ContinuityVerdict.Witnessed<?> witnessed) {
			return "Continuity witnessed over %d sets: epsilon=%s, witness=%s"
				.formatted(witnessed.contents().size(), witnessed.epsilon(), witnessed.witness().values());
		}
		return "Continuity vanishing over %d sets: limit=%s"
			.formatted(verdict.contents().size(), verdict.limit());
	}
}
