package org.javai.projective.witness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import org.javai.projective.DomainException;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.FullPoint;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.PartialAssignment;
import org.javai.projective.Violation;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Box;
import org.javai.projective.cylinder.BoxUnion;
import org.javai.projective.cylinder.MeasurableSet;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.marginal.Marginalizer;
import org.javai.projective.marginal.MeasurableFunction;
import org.javai.projective.ops.ConstructionReporter;
import org.javai.projective.space.CoordinateMeasure;
import org.javai.projective.space.CoordinateSet;
import org.javai.projective.space.UniformMeasure;

/**
 * Builds, one coordinate at a time, a point at which every function of a {@link WitnessProblem}
 * keeps its level: after fixing the prefix {@code y} on {@code [0, k)}, the marginal of
 * {@code f_n} over the remaining coordinates {@code [k, L(n))} is still at least {@code ε}.
 *
 * <p>The next coordinate is chosen for the last function {@code f_H}; the others follow because
 * the sequence is antitone, and are verified anyway. Without an explicit selector, values read
 * off the sides of a box-shaped last function are tried before the measure's default strategy.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * WitnessExtractor<Integer> extractor = WitnessExtractor.builder(family)
 *     .problem(WitnessProblem.ofCylinders(cylinders, 0.25))
 *     .build();
 * WitnessSequence<Integer> witness = extractor.extract();
 * PartialAssignment<Integer> prefix = witness.prefix(10);
 * }</pre>
 */
public final class WitnessExtractor<X> {

    private static final String NAMESPACE = "witness";

    private final ProductFamily<X> family;
    private final Marginalizer<X> marginalizer;
    private final WitnessProblem<X> problem;
    private final WitnessSelector<X> selector;
    private final ExtensionSettings settings;
    private final ConstructionReporter reporter;
    private final List<Double> levels;

    private WitnessExtractor(Builder<X> builder) {
        this.family = builder.family;
        this.marginalizer = new Marginalizer<>(builder.family);
        this.problem = builder.problem;
        this.settings = builder.settings;
        this.selector = builder.selector != null
                ? builder.selector
                : WitnessSelectors.preferring(this::landmarks, WitnessSelectors.adaptive(builder.settings));
        this.reporter = builder.reporter;
        this.levels = Collections.unmodifiableList(validate());
    }

    public static <X> Builder<X> builder(ProductFamily<X> family) {
        return new Builder<>(family);
    }

    public WitnessProblem<X> problem() {
        return problem;
    }

    /**
     * The full marginals {@code M_n = marginal([0, L(n)), f_n)}, one per function.
     */
    public List<Double> levels() {
        return levels;
    }

    /**
     * Returns a fresh witness sequence. Each call starts from the empty prefix.
     */
    public WitnessSequence<X> extract() {
        return new WitnessSequence<>(this);
    }

    /**
     * Chooses the coordinate that follows {@code prefix}.
     *
     * @param prefix the values already fixed, on {@code [0, k)}
     * @return the value of coordinate {@code k}
     * @throws DomainException if {@code prefix} is not defined on a prefix window
     * @throws InvariantViolationException if no admissible value exists or a function exceeds the bound
     */
    public X step(PartialAssignment<X> prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        int k = prefix.window().size();
        if (!prefix.window().equals(Window.prefix(k))) {
            throw new DomainException("witness prefix must cover [0, " + k + "), was: " + prefix.window());
        }
        FullPoint<X> base = FullPoint.<X>unassigned().update(prefix);
        int horizon = problem.horizon();
        MeasurableFunction<X> remaining = remainder(horizon, k);
        ToDoubleFunction<X> score = value -> remaining.apply(base.with(k, value));
        double threshold = problem.epsilon() - settings.tolerance();

        CoordinateMeasure<X> measure = family.coordinate(k);
        Optional<X> chosen = selector.select(k, measure, score, threshold);
        if (chosen.isEmpty()) {
            throw new InvariantViolationException(Violation.of(NAMESPACE, "no_admissible_value",
                    "no value of coordinate " + k + " keeps the remaining marginal at " + problem.epsilon(),
                    Window.prefix(k + 1), problem.epsilon(), 0.0));
        }
        X value = chosen.get();
        FullPoint<X> next = base.with(k, value);
        double bound = 0.0;
        for (int n = 0; n <= horizon; n++) {
            double level = remainder(n, k).apply(next);
            if (level > problem.upperBound() + settings.tolerance()) {
                throw violation("bound_exceeded", "f_" + n + " exceeds the bound after fixing coordinate " + k,
                        Window.prefix(k + 1), problem.upperBound(), level);
            }
            if (level < threshold) {
                throw violation("level_lost", "f_" + n + " falls below " + problem.epsilon()
                        + " after fixing coordinate " + k, Window.prefix(k + 1), problem.epsilon(), level);
            }
            if (n == horizon) {
                bound = level;
            }
        }
        reporter.reportWitnessCoordinate(k, value, bound);
        return value;
    }

    /**
     * {@code marginal([k + 1, L(n)), f_n)}.
     */
    private MeasurableFunction<X> remainder(int n, int k) {
        return marginalizer.marginal(Window.range(k + 1, problem.length(n)), problem.functions().get(n));
    }

    /**
     * Values of coordinate {@code k} read off the sides of a box-shaped last function: a point of
     * each interval side inside the support of a uniform coordinate, and the members of finite or
     * half-line sides. Such a value keeps a box indicator at its level however narrow the side.
     */
    @SuppressWarnings("unchecked")
    private List<X> landmarks(int k) {
        MeasurableFunction<X> last = problem.functions().get(problem.horizon());
        if (!(last instanceof MeasurableFunction.Indicator<X> indicator)) {
            return List.of();
        }
        MeasurableSet<X> set = indicator.cylinder().set();
        List<Box<X>> boxes;
        if (set instanceof Box<X> box) {
            boxes = List.of(box);
        } else if (set instanceof BoxUnion<X> union) {
            boxes = union.boxes();
        } else {
            return List.of();
        }
        CoordinateMeasure<X> measure = family.coordinate(k);
        List<X> result = new ArrayList<>();
        for (Box<X> box : boxes) {
            CoordinateSet<X> side = box.side(k);
            if (side instanceof CoordinateSet.Interval interval && !interval.isEmpty()) {
                double lo = interval.lo();
                double hi = interval.hi();
                if (measure instanceof UniformMeasure uniform) {
                    lo = Math.max(lo, uniform.lo());
                    hi = Math.min(hi, uniform.hi());
                }
                if (lo <= hi) {
                    result.add((X) (Object) (lo + (hi - lo) / 2));
                }
            } else if (side instanceof CoordinateSet.Finite<X> finite) {
                result.addAll(finite.values());
            } else if (side instanceof CoordinateSet.AtLeast atLeast) {
                result.add((X) (Object) atLeast.bound());
            }
        }
        return result;
    }

    private List<Double> validate() {
        List<Double> result = new ArrayList<>();
        double previous = Double.POSITIVE_INFINITY;
        for (int n = 0; n <= problem.horizon(); n++) {
            Window window = Window.prefix(problem.length(n));
            double level = marginalizer.marginal(window, problem.functions().get(n)).apply(FullPoint.unassigned());
            if (level > problem.upperBound() + settings.tolerance()) {
                throw violation("bound_exceeded", "marginal of f_" + n + " exceeds the bound",
                        window, problem.upperBound(), level);
            }
            if (level < problem.epsilon() - settings.tolerance()) {
                throw violation("below_epsilon", "marginal of f_" + n + " is below epsilon",
                        window, problem.epsilon(), level);
            }
            if (level > previous + settings.tolerance()) {
                throw violation("not_antitone", "marginal of f_" + n + " exceeds that of f_" + (n - 1),
                        window, previous, level);
            }
            result.add(level);
            previous = level;
        }
        return result;
    }

    private InvariantViolationException violation(String name, String message, Window window,
                                                  double expected, double actual) {
        Violation violation = Violation.of(NAMESPACE, name, message, window, expected, actual);
        reporter.reportViolation(violation);
        return new InvariantViolationException(violation);
    }

    /**
     * Builder for {@link WitnessExtractor}. The problem is required; settings default to those of
     * the family, the selector to {@link WitnessSelectors#adaptive(ExtensionSettings)}.
     */
    public static final class Builder<X> {

        private final ProductFamily<X> family;
        private WitnessProblem<X> problem;
        private WitnessSelector<X> selector;
        private ExtensionSettings settings;
        private ConstructionReporter reporter = ConstructionReporter.noOp();

        private Builder(ProductFamily<X> family) {
            this.family = Objects.requireNonNull(family, "family must not be null");
            this.settings = family.settings();
        }

        public Builder<X> problem(WitnessProblem<X> problem) {
            this.problem = Objects.requireNonNull(problem, "problem must not be null");
            return this;
        }

        public Builder<X> selector(WitnessSelector<X> selector) {
            this.selector = Objects.requireNonNull(selector, "selector must not be null");
            return this;
        }

        public Builder<X> settings(ExtensionSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            return this;
        }

        public Builder<X> reporter(ConstructionReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * @throws InvariantViolationException if the problem breaks one of its laws
         */
        public WitnessExtractor<X> build() {
            if (problem == null) {
                throw new IllegalStateException("problem must be set");
            }
            return new WitnessExtractor<>(this);
        }
    }
}
