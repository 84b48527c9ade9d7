package org.javai.projective.space;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.javai.projective.ExtendedReal;
import org.javai.projective.ExtensionSettings;

/**
 * Normalized Lebesgue measure on a closed interval {@code [lo, hi]}.
 *
 * <p>Intervals, finite sets and the whole space are measured exactly; other sets and all
 * integrals use the composite midpoint rule with {@link ExtensionSettings#quadratureResolution()}
 * cells.
 */
public final class UniformMeasure implements CoordinateMeasure<Double> {

    private final double lo;
    private final double hi;
    private final int resolution;

    private UniformMeasure(double lo, double hi, int resolution) {
        this.lo = lo;
        this.hi = hi;
        this.resolution = resolution;
    }

    public static UniformMeasure on(double lo, double hi) {
        return on(lo, hi, ExtensionSettings.fromEnvironment());
    }

    public static UniformMeasure on(double lo, double hi, ExtensionSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        if (!Double.isFinite(lo) || !Double.isFinite(hi) || !(lo < hi)) {
            throw new IllegalArgumentException("interval must satisfy lo < hi with finite bounds, was: [" + lo + ", " + hi + "]");
        }
        return new UniformMeasure(lo, hi, settings.quadratureResolution());
    }

    /**
     * Lebesgue measure on {@code [0, 1]}.
     */
    public static UniformMeasure unitInterval() {
        return on(0.0, 1.0);
    }

    public double lo() {
        return lo;
    }

    public double hi() {
        return hi;
    }

    public int resolution() {
        return resolution;
    }

    @Override
    public ExtendedReal measure(CoordinateSet<Double> set) {
        Objects.requireNonNull(set, "set must not be null");
        if (set instanceof CoordinateSet.All) {
            return ExtendedReal.ONE;
        }
        if (set instanceof CoordinateSet.Finite) {
            return ExtendedReal.ZERO;
        }
        if (set instanceof CoordinateSet.Interval interval) {
            double overlap = Math.min(hi, interval.hi()) - Math.max(lo, interval.lo());
            return ExtendedReal.clamped(overlap / (hi - lo));
        }
        return integrate(value -> set.contains(value) ? 1.0 : 0.0);
    }

    @Override
    public ExtendedReal integrate(ToDoubleFunction<? super Double> f) {
        return averageOver(lo, hi, f);
    }

    /**
     * Average of {@code f} over {@code [from, to] ⊆ [lo, hi]} by the midpoint rule, i.e. the
     * integral against this measure conditioned on the sub-interval.
     */
    public ExtendedReal averageOver(double from, double to, ToDoubleFunction<? super Double> f) {
        Objects.requireNonNull(f, "f must not be null");
        if (from < lo || to > hi || !(from < to)) {
            throw new IllegalArgumentException("[" + from + ", " + to + "] is not a sub-interval of [" + lo + ", " + hi + "]");
        }
        double width = (to - from) / resolution;
        double sum = 0.0;
        for (int i = 0; i < resolution; i++) {
            double x = from + (i + 0.5) * width;
            double value = Measures.checkIntegrand(f.applyAsDouble(x), x);
            sum = Measures.accumulate(sum, 1.0 / resolution, value);
        }
        return Measures.total(sum);
    }

    /**
     * Equal-width closed intervals; neighbours share only an endpoint, a null set.
     */
    @Override
    public List<CoordinateSet<Double>> partition(int pieces) {
        if (pieces < 1) {
            throw new IllegalArgumentException("pieces must be >= 1, was: " + pieces);
        }
        List<CoordinateSet<Double>> parts = new ArrayList<>();
        double width = (hi - lo) / pieces;
        for (int i = 0; i < pieces; i++) {
            double right = i == pieces - 1 ? hi : lo + (i + 1) * width;
            parts.add(CoordinateSet.interval(lo + i * width, right));
        }
        return parts;
    }

    @Override
    public String toString() {
        return "Uniform[" + lo + ", " + hi + "]";
    }
}
