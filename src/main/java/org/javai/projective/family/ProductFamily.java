package org.javai.projective.family;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;
import org.javai.projective.DomainException;
import org.javai.projective.ExtendedReal;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.FullPoint;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Box;
import org.javai.projective.cylinder.BoxUnion;
import org.javai.projective.cylinder.Cylinder;
import org.javai.projective.cylinder.MeasurableSet;
import org.javai.projective.cylinder.PredicateSet;
import org.javai.projective.marginal.Marginalizer;
import org.javai.projective.marginal.MeasurableFunction;
import org.javai.projective.space.CoordinateMeasure;
import org.javai.projective.space.CoordinateSet;

/**
 * The product family {@code μ_S = ⨂_{n∈S} μ_n} of a countable sequence of coordinate measures.
 * Projective by construction: forgetting a coordinate integrates out a probability measure.
 *
 * <p>Boxes and unions of boxes are measured exactly from the coordinate measures; predicate
 * sets are measured by iterated integration.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ProductFamily<Double> lebesgue = ProductFamily.iid(UniformMeasure.unitInterval());
 * ProductFamily<Integer> mixed = ProductFamily.of(n -> n == 0 ? DiscreteMeasure.geometric(0.5) : DiscreteMeasure.fairCoin());
 * }</pre>
 */
public final class ProductFamily<X> implements ProjectiveFamily<X> {

    private final IntFunction<? extends CoordinateMeasure<X>> measures;
    private final Map<Integer, CoordinateMeasure<X>> resolved = new ConcurrentHashMap<>();
    private final ExtensionSettings settings;

    private ProductFamily(IntFunction<? extends CoordinateMeasure<X>> measures, ExtensionSettings settings) {
        this.measures = measures;
        this.settings = settings;
    }

    /**
     * A family whose n-th coordinate measure is {@code measures.apply(n)}. The function is
     * called at most once per index.
     */
    public static <X> ProductFamily<X> of(IntFunction<? extends CoordinateMeasure<X>> measures) {
        return of(measures, ExtensionSettings.fromEnvironment());
    }

    public static <X> ProductFamily<X> of(IntFunction<? extends CoordinateMeasure<X>> measures, ExtensionSettings settings) {
        Objects.requireNonNull(measures, "measures must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        return new ProductFamily<>(measures, settings);
    }

    /**
     * The family with the same coordinate measure at every index.
     */
    public static <X> ProductFamily<X> iid(CoordinateMeasure<X> measure) {
        Objects.requireNonNull(measure, "measure must not be null");
        return of(index -> measure);
    }

    public static <X> ProductFamily<X> iid(CoordinateMeasure<X> measure, ExtensionSettings settings) {
        Objects.requireNonNull(measure, "measure must not be null");
        return of(index -> measure, settings);
    }

    /**
     * The listed measures on the leading coordinates, then {@code rest} everywhere else.
     */
    public static <X> ProductFamily<X> of(List<? extends CoordinateMeasure<X>> leading, CoordinateMeasure<X> rest) {
        List<? extends CoordinateMeasure<X>> copy = List.copyOf(leading);
        Objects.requireNonNull(rest, "rest must not be null");
        return of(index -> index < copy.size() ? copy.get(index) : rest);
    }

    /**
     * Returns {@code μ_n}.
     */
    public CoordinateMeasure<X> coordinate(int index) {
        if (index < 0) {
            throw new DomainException("index must be >= 0, was: " + index);
        }
        return resolved.computeIfAbsent(index, i -> Objects.requireNonNull(
                measures.apply(i), "coordinate measure " + i + " must not be null"));
    }

    public ExtensionSettings settings() {
        return settings;
    }

    @Override
    public WindowMeasure<X> marginal(Window window) {
        Objects.requireNonNull(window, "window must not be null");
        return new ProductMarginal(window);
    }

    /**
     * {@code ∏_i μ_i(A_i)} over the constrained sides of {@code box}.
     */
    public ExtendedReal boxMeasure(Box<X> box) {
        ExtendedReal product = ExtendedReal.ONE;
        for (Map.Entry<Integer, CoordinateSet<X>> side : box.sides().entrySet()) {
            product = product.times(coordinate(side.getKey()).measure(side.getValue()));
            if (product.isZero()) {
                return ExtendedReal.ZERO;
            }
        }
        return product;
    }

    private final class ProductMarginal implements WindowMeasure<X> {

        private final Window window;

        private ProductMarginal(Window window) {
            this.window = window;
        }

        @Override
        public Window window() {
            return window;
        }

        @Override
        public ExtendedReal measure(MeasurableSet<X> set) {
            Objects.requireNonNull(set, "set must not be null");
            if (!set.window().equals(window)) {
                throw new DomainException("set over " + set.window() + " cannot be measured by the marginal on " + window);
            }
            if (set instanceof Box<X> box) {
                return boxMeasure(box);
            }
            if (set instanceof BoxUnion<X> union) {
                return ExtendedReal.clamped(Math.min(1.0, union.measureBy(box -> boxMeasure(box).toDouble())));
            }
            PredicateSet<X> predicate = (PredicateSet<X>) set;
            MeasurableFunction<X> indicator = MeasurableFunction.indicator(Cylinder.of(predicate));
            double value = new Marginalizer<>(ProductFamily.this).marginal(window, indicator).apply(FullPoint.unassigned());
            return ExtendedReal.clamped(Math.min(1.0, value));
        }

        @Override
        public String toString() {
            return "ProductMarginal" + window;
        }
    }
}
