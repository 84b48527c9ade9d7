package org.javai.projective.witness;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.ToDoubleFunction;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.space.CoordinateMeasure;
import org.javai.projective.space.DiscreteMeasure;
import org.javai.projective.space.UniformMeasure;

/**
 * The built-in {@link WitnessSelector} strategies.
 */
public final class WitnessSelectors {

    private WitnessSelectors() {
    }

    /**
     * Visits the atoms of a discrete measure in order and returns the first whose score reaches
     * the threshold. Atoms without mass are skipped.
     */
    public static <X> WitnessSelector<X> enumeration() {
        return (index, measure, score, threshold) -> {
            if (!(measure instanceof DiscreteMeasure<X> discrete)) {
                throw new IllegalArgumentException("enumeration needs a discrete measure at coordinate " + index
                        + ", was: " + measure);
            }
            for (DiscreteMeasure.Atom<X> atom : discrete.atoms()) {
                if (atom.mass() > 0 && score.applyAsDouble(atom.value()) >= threshold) {
                    return Optional.of(atom.value());
                }
            }
            return Optional.empty();
        };
    }

    /**
     * Repeatedly halves the interval of a uniform measure, keeping the half whose average score
     * is larger (the left half on ties), until it is narrower than the bisection width, then
     * tries its midpoint. If the midpoint falls short, cell midpoints are scanned on grids that
     * double in density down to the bisection width, for at most {@code maxAtoms} evaluations.
     * A set of admissible values narrower than one quadrature cell is found this way.
     */
    public static WitnessSelector<Double> bisection(ExtensionSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return (index, measure, score, threshold) -> {
            if (!(measure instanceof UniformMeasure uniform)) {
                throw new IllegalArgumentException("bisection needs a uniform measure at coordinate " + index
                        + ", was: " + measure);
            }
            double from = uniform.lo();
            double to = uniform.hi();
            while (to - from > settings.bisectionWidth()) {
                double mid = from + (to - from) / 2;
                double left = uniform.averageOver(from, mid, score).toDouble();
                double right = uniform.averageOver(mid, to, score).toDouble();
                if (left >= right) {
                    to = mid;
                } else {
                    from = mid;
                }
            }
            double candidate = from + (to - from) / 2;
            if (score.applyAsDouble(candidate) >= threshold) {
                return Optional.of(candidate);
            }
            return scan(uniform, score, threshold, settings);
        };
    }

    private static Optional<Double> scan(UniformMeasure uniform, ToDoubleFunction<Double> score, double threshold,
                                         ExtensionSettings settings) {
        double span = uniform.hi() - uniform.lo();
        long budget = settings.maxAtoms();
        for (long cells = uniform.resolution(); budget > 0; cells *= 2) {
            double width = span / cells;
            for (long i = 0; i < cells && budget > 0; i++, budget--) {
                double x = uniform.lo() + (i + 0.5) * width;
                if (score.applyAsDouble(x) >= threshold) {
                    return Optional.of(x);
                }
            }
            if (width <= settings.bisectionWidth()) {
                break;
            }
        }
        return Optional.empty();
    }

    /**
     * Tries the candidates proposed for each coordinate first, in order, keeping only values in
     * the support of the coordinate measure, and defers to {@code fallback} when none of them
     * reaches the threshold.
     */
    public static <X> WitnessSelector<X> preferring(IntFunction<? extends Collection<X>> candidates,
                                                    WitnessSelector<X> fallback) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(fallback, "fallback must not be null");
        return (index, measure, score, threshold) -> {
            for (X candidate : candidates.apply(index)) {
                if (inSupport(measure, candidate) && score.applyAsDouble(candidate) >= threshold) {
                    return Optional.of(candidate);
                }
            }
            return fallback.select(index, measure, score, threshold);
        };
    }

    private static <X> boolean inSupport(CoordinateMeasure<X> measure, X value) {
        if (measure instanceof UniformMeasure uniform) {
            return value instanceof Double x && x >= uniform.lo() && x <= uniform.hi();
        }
        if (measure instanceof DiscreteMeasure<X> discrete) {
            return discrete.atoms().stream().anyMatch(atom -> atom.mass() > 0 && atom.value().equals(value));
        }
        return true;
    }

    /**
     * Picks the strategy from the type of each coordinate measure: enumeration for discrete
     * measures, bisection for uniform ones.
     *
     * @throws IllegalArgumentException at selection time, for any other measure
     */
    @SuppressWarnings("unchecked")
    public static <X> WitnessSelector<X> adaptive(ExtensionSettings settings) {
        WitnessSelector<X> enumeration = enumeration();
        WitnessSelector<Double> bisection = bisection(settings);
        return (index, measure, score, threshold) -> {
            if (measure instanceof DiscreteMeasure) {
                return enumeration.select(index, measure, score, threshold);
            }
            if (measure instanceof UniformMeasure uniform) {
                ToDoubleFunction<Double> byValue = (ToDoubleFunction<Double>) (ToDoubleFunction<?>) score;
                return (Optional<X>) (Optional<?>) bisection.select(index, uniform, byValue, threshold);
            }
            throw new IllegalArgumentException("no witness selector for " + measure.getClass().getName()
                    + " at coordinate " + index + "; supply an oracle");
        };
    }

    /**
     * Returns the default strategy for a single measure.
     */
    @SuppressWarnings("unchecked")
    public static <X> WitnessSelector<X> defaultFor(CoordinateMeasure<X> measure, ExtensionSettings settings) {
        if (measure instanceof DiscreteMeasure) {
            return enumeration();
        }
        if (measure instanceof UniformMeasure) {
            return (WitnessSelector<X>) (WitnessSelector<?>) bisection(settings);
        }
        throw new IllegalArgumentException("no witness selector for " + measure.getClass().getName());
    }
}
