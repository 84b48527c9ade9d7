package org.javai.projective.extension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.projective.DomainException;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.FullPoint;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.Verdict;
import org.javai.projective.Violation;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Box;
import org.javai.projective.cylinder.BoxUnion;
import org.javai.projective.cylinder.MeasurableSet;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.marginal.Marginalizer;
import org.javai.projective.marginal.MeasurableFunction;
import org.javai.projective.ops.ConstructionReporter;
import org.javai.projective.space.CoordinateSet;

/**
 * Checks that a {@link ProductMeasure} is a projective limit: its pushforward onto a window
 * agrees, on each probe set, with {@code ⨂_{n∈S} μ_n} computed from the coordinate measures.
 */
public final class ProjectiveLimitChecker {

    private static final String NAMESPACE = "projective_limit";

    private final ExtensionSettings settings;
    private final ConstructionReporter reporter;

    public ProjectiveLimitChecker() {
        this(ExtensionSettings.fromEnvironment(), ConstructionReporter.noOp());
    }

    public ProjectiveLimitChecker(ExtensionSettings settings, ConstructionReporter reporter) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * @throws DomainException if a probe is not a set over {@code window}
     */
    public <X> Verdict<Window> verify(ProductMeasure<X> measure, Window window, List<MeasurableSet<X>> probes) {
        Objects.requireNonNull(measure, "measure must not be null");
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(probes, "probes must not be null");
        for (MeasurableSet<X> probe : probes) {
            if (!probe.window().equals(window)) {
                throw new DomainException("probe over " + probe.window() + " cannot check the window " + window);
            }
            double actual = measure.project(window).measure(probe).toDouble();
            double expected = expected(measure.family(), window, probe);
            if (Math.abs(actual - expected) > settings.tolerance()) {
                Violation violation = Violation.of(NAMESPACE, "pushforward_mismatch",
                        "pushforward onto " + window + " disagrees with the product of the coordinate measures",
                        window, expected, actual);
                reporter.reportViolation(violation);
                return Verdict.violated(violation);
            }
        }
        return Verdict.holds(window);
    }

    /**
     * Verifies every window in {@code probes}, stopping at the first violation.
     */
    public <X> Verdict<List<Window>> verifyAll(ProductMeasure<X> measure, Map<Window, List<MeasurableSet<X>>> probes) {
        Objects.requireNonNull(probes, "probes must not be null");
        List<Window> verified = new ArrayList<>();
        for (Map.Entry<Window, List<MeasurableSet<X>>> entry : probes.entrySet()) {
            Verdict<Window> verdict = verify(measure, entry.getKey(), entry.getValue());
            if (verdict instanceof Verdict.Violated<Window> violated) {
                return Verdict.violated(violated.violation());
            }
            verified.add(entry.getKey());
        }
        return Verdict.holds(List.copyOf(verified));
    }

    /**
     * @throws InvariantViolationException on the first window that disagrees
     */
    public <X> ProductMeasure<X> requireConsistent(ProductMeasure<X> measure, Map<Window, List<MeasurableSet<X>>> probes) {
        verifyAll(measure, probes).getOrThrow();
        return measure;
    }

    private <X> double expected(ProductFamily<X> family, Window window, MeasurableSet<X> probe) {
        if (probe instanceof Box<X> box) {
            return product(family, box);
        }
        if (probe instanceof BoxUnion<X> union) {
            return Math.min(1.0, union.measureBy(box -> product(family, box)));
        }
        MeasurableFunction<X> indicator = MeasurableFunction.of(window, point -> probe.contains(point) ? 1.0 : 0.0);
        return new Marginalizer<>(family).marginal(window, indicator).apply(FullPoint.unassigned());
    }

    private static <X> double product(ProductFamily<X> family, Box<X> box) {
        double product = 1.0;
        for (Map.Entry<Integer, CoordinateSet<X>> side : box.sides().entrySet()) {
            product *= family.coordinate(side.getKey()).measure(side.getValue()).toDouble();
        }
        return product;
    }
}
