package org.javai.projective.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import org.javai.projective.Violation;
import org.javai.projective.ops.ConstructionReporter;
import org.javai.projective.witness.ContinuityVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports construction events as JSON-lines metrics via SLF4J.
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"continuity","timestamp":"2024-01-20T10:30:00Z","trackingKey":"lebesgue.continuity","verdict":"witnessed","sets":12,"limit":0.578}
 * }</pre>
 */
public class MetricsConstructionReporter implements ConstructionReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.projective.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger FALLBACK = LoggerFactory.getLogger(MetricsConstructionReporter.class);

	private final String namespace;
	private final Logger logger;
	private final Clock clock;
	private final ObjectMapper mapper = new ObjectMapper();

	public MetricsConstructionReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * @param namespace prepended to tracking keys (may be null or empty)
	 */
	public MetricsConstructionReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	public MetricsConstructionReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsConstructionReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportWitnessCoordinate(int index, Object value, double bound) {
		try {
			ObjectNode event = event("witness_coordinate");
			event.put("index", index);
			event.put("value", String.valueOf(value));
			event.put("bound", bound);
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException | RuntimeException e) {
			// Reporting never interrupts a construction
			FALLBACK.debug("Metrics event dropped: {}", e.getMessage());
		}
	}

	@Override
	public void reportContinuity(ContinuityVerdict<?> verdict) {
		try {
			ObjectNode event = event("continuity");
			event.put("verdict", verdict.isVanishing() ? "vanishing" : "witnessed");
			event.put("sets", verdict.contents().size());
			event.put("limit", verdict.limit());
			if (verdict instanceof ContinuityVerdict.Witnessed<?> witnessed) {
				event.put("epsilon", witnessed.epsilon());
				event.put("witnessLength", witnessed.witness().window().size());
			}
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException | RuntimeException e) {
			// Reporting never interrupts a construction
			FALLBACK.debug("Metrics event dropped: {}", e.getMessage());
		}
	}

	@Override
	public void reportViolation(Violation violation) {
		try {
			ObjectNode event = event("violation");
			event.put("code", violation.id().toString());
			event.put("message", violation.message());
			event.put("window", violation.window().toString());
			event.put("expected", violation.expected());
			event.put("actual", violation.actual());
			logger.info(mapper.writeValueAsString(event));
		} catch (JsonProcessingException | RuntimeException e) {
			// Reporting never interrupts a construction
			FALLBACK.debug("Metrics event dropped: {}", e.getMessage());
		}
	}

	private ObjectNode event(String eventType) {
		ObjectNode event = mapper.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", trackingKey(eventType));
		return event;
	}

	String trackingKey(String eventType) {
		if (namespace == null) {
			return eventType;
		}
		return namespace + "." + eventType;
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
