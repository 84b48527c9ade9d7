package org.javai.projective.witness;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.projective.ExtensionException;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.PartialAssignment;
import org.javai.projective.Point;
import org.javai.projective.Violation;
import org.javai.projective.cylinder.ContentFunction;
import org.javai.projective.cylinder.Cylinder;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.ops.ConstructionReporter;

/**
 * Checks that the content is continuous from above on a decreasing cylinder sequence
 * {@code A_0 ⊇ A_1 ⊇ … ⊇ A_H}: either the contents vanish, or a point lying in every
 * {@code A_n} is constructed, so the intersection is not empty.
 */
public final class DownwardContinuity<X> {

    private final ProductFamily<X> family;
    private final ContentFunction<X> content;
    private final ExtensionSettings settings;
    private final ConstructionReporter reporter;

    public DownwardContinuity(ProductFamily<X> family) {
        this(family, family.settings(), ConstructionReporter.noOp());
    }

    public DownwardContinuity(ProductFamily<X> family, ExtensionSettings settings, ConstructionReporter reporter) {
        this.family = Objects.requireNonNull(family, "family must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.content = new ContentFunction<>(family, settings);
    }

    public ProductFamily<X> family() {
        return family;
    }

    public ExtensionSettings settings() {
        return settings;
    }

    public ConstructionReporter reporter() {
        return reporter;
    }

    /**
     * Computes the contents of {@code sequence} and, unless they vanish, extracts a witness
     * for the indicators of the sets at level {@code ε} = the last content.
     *
     * @throws InvariantViolationException if the contents increase along the sequence
     * @throws ExtensionException if the extracted point escapes one of the sets
     */
    public ContinuityVerdict<X> check(List<Cylinder<X>> sequence) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        if (sequence.isEmpty()) {
            throw new IllegalArgumentException("sequence must not be empty");
        }
        List<Double> contents = new ArrayList<>();
        for (int n = 0; n < sequence.size(); n++) {
            double value = content.content(sequence.get(n)).toDouble();
            if (n > 0 && value > contents.get(n - 1) + settings.tolerance()) {
                Violation violation = Violation.of("continuity", "not_antitone",
                        "content of A_" + n + " exceeds that of A_" + (n - 1),
                        sequence.get(n).window(), contents.get(n - 1), value);
                reporter.reportViolation(violation);
                throw new InvariantViolationException(violation);
            }
            contents.add(value);
        }

        double limit = contents.get(contents.size() - 1);
        ContinuityVerdict<X> verdict;
        if (limit <= settings.vanishingTolerance()) {
            verdict = new ContinuityVerdict.Vanishing<>(contents);
        } else {
            verdict = witness(sequence, limit, contents);
        }
        reporter.reportContinuity(verdict);
        return verdict;
    }

    private ContinuityVerdict<X> witness(List<Cylinder<X>> sequence, double epsilon, List<Double> contents) {
        WitnessProblem<X> problem = WitnessProblem.ofCylinders(sequence, epsilon);
        WitnessSequence<X> witness = WitnessExtractor.builder(family)
                .problem(problem)
                .settings(settings)
                .reporter(reporter)
                .build()
                .extract();
        PartialAssignment<X> prefix = witness.prefix(problem.maxLength());
        Point<X> point = witness.asPoint();
        for (int n = 0; n < sequence.size(); n++) {
            if (!sequence.get(n).contains(point)) {
                throw new ExtensionException("witness " + prefix.values() + " escapes A_" + n
                        + " over " + sequence.get(n).window());
            }
        }
        return new ContinuityVerdict.Witnessed<>(epsilon, prefix, contents);
    }
}
