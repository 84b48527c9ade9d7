package org.javai.projective.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import org.javai.projective.Violation;
import org.javai.projective.witness.ContinuityVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ConstructionReporter} that delegates to several reporters.
 *
 * <p>Every reporter receives every call. A reporter that throws is logged and skipped so
 * the remaining reporters still run.
 *
 * <pre>{@code
 * ConstructionReporter reporter = CompositeConstructionReporter.of(
 *     new Log4jConstructionReporter(),
 *     new MetricsConstructionReporter("lebesgue")
 * );
 * }</pre>
 */
public final class CompositeConstructionReporter implements ConstructionReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeConstructionReporter.class);

	private final List<ConstructionReporter> reporters;

	private CompositeConstructionReporter(List<ConstructionReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeConstructionReporter of(ConstructionReporter... reporters) {
		return new CompositeConstructionReporter(Arrays.asList(reporters));
	}

	public static CompositeConstructionReporter of(Collection<? extends ConstructionReporter> reporters) {
		return new CompositeConstructionReporter(new ArrayList<>(reporters));
	}

	@Override
	public void reportWitnessCoordinate(int index, Object value, double bound) {
		fanOut("reportWitnessCoordinate", reporter -> reporter.reportWitnessCoordinate(index, value, bound));
	}

	@Override
	public void reportContinuity(ContinuityVerdict<?> verdict) {
		fanOut("reportContinuity", reporter -> reporter.reportContinuity(verdict));
	}

	@Override
	public void reportViolation(Violation violation) {
		fanOut("reportViolation", reporter -> reporter.reportViolation(violation));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<ConstructionReporter> call) {
		for (ConstructionReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (RuntimeException e) {
				LOG.warn("ConstructionReporter.{} failed for {}: {}", method, reporter.getClass().getName(), e.getMessage());
			}
		}
	}
}
