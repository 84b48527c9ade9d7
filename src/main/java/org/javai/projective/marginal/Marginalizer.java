package org.javai.projective.marginal;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.projective.FullPoint;
import org.javai.projective.GuardedPoint;
import org.javai.projective.MeasurabilityException;
import org.javai.projective.Point;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Box;
import org.javai.projective.cylinder.BoxUnion;
import org.javai.projective.cylinder.MeasurableSet;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.space.CoordinateMeasure;
import org.javai.projective.space.CoordinateSet;

/**
 * Integrates functions over the coordinates of a window against the product family,
 * holding every other coordinate fixed:
 * {@code marginal(S, f)(x) = ∫ f(update(x, S, ·)) dμ_S}.
 *
 * <p>The result is again a {@link MeasurableFunction}, supported on {@code support(f) \ S}, and is
 * evaluated lazily. Indicators of box-shaped cylinders are integrated in closed form; all other
 * functions by iterated integration, one coordinate at a time in ascending index order.
 *
 * <p>Coordinates of {@code S} outside the support of {@code f} are skipped: integrating a function
 * that does not depend on a coordinate against a probability measure leaves it unchanged.
 */
public final class Marginalizer<X> {

    private final ProductFamily<X> family;

    public Marginalizer(ProductFamily<X> family) {
        this.family = Objects.requireNonNull(family, "family must not be null");
    }

    public ProductFamily<X> family() {
        return family;
    }

    /**
     * Returns {@code marginal(S, f)}; {@code f} itself when nothing is integrated out.
     */
    public MeasurableFunction<X> marginal(Window window, MeasurableFunction<X> f) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(f, "f must not be null");
        Window integrated = window.intersect(f.support());
        if (integrated.isEmpty()) {
            return f;
        }
        return new Marginal<>(this, integrated, f);
    }

    /**
     * Evaluates {@code marginal(S, f)} at {@code point}.
     */
    public double integrate(Window window, MeasurableFunction<X> f, Point<X> point) {
        return marginal(window, f).apply(point);
    }

    double evaluate(Window integrated, MeasurableFunction<X> f, Point<X> point) {
        if (f instanceof MeasurableFunction.Indicator<X> indicator) {
            Optional<Double> closed = closedForm(integrated, indicator.cylinder().set(), point);
            if (closed.isPresent()) {
                return closed.get();
            }
        }
        return iterate(integrated.toArray(), 0, f, FullPoint.of(point::coordinate));
    }

    private double iterate(int[] indices, int depth, MeasurableFunction<X> f, FullPoint<X> current) {
        if (depth == indices.length) {
            return checked(f.apply(current));
        }
        int index = indices[depth];
        CoordinateMeasure<X> measure = family.coordinate(index);
        return measure.integrate(value -> iterate(indices, depth + 1, f, current.with(index, value))).toDouble();
    }

    private Optional<Double> closedForm(Window integrated, MeasurableSet<X> set, Point<X> point) {
        if (set instanceof Box<X> box) {
            return Optional.of(boxFactor(integrated, box, point));
        }
        if (set instanceof BoxUnion<X> union) {
            return Optional.of(Math.min(1.0, union.measureBy(box -> boxFactor(integrated, box, point))));
        }
        return Optional.empty();
    }

    /**
     * {@code ∏ μ_i(A_i)} over integrated sides times {@code ∏ 1[x_i ∈ A_i]} over the fixed ones.
     */
    private double boxFactor(Window integrated, Box<X> box, Point<X> point) {
        double factor = 1.0;
        for (Map.Entry<Integer, CoordinateSet<X>> side : box.sides().entrySet()) {
            int index = side.getKey();
            if (integrated.contains(index)) {
                factor *= family.coordinate(index).measure(side.getValue()).toDouble();
            } else if (!side.getValue().contains(point.coordinate(index))) {
                return 0.0;
            }
            if (factor == 0.0) {
                return 0.0;
            }
        }
        return factor;
    }

    private static double checked(double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new MeasurabilityException("integrand value " + value + " is not in [0, ∞]");
        }
        return value;
    }

    /**
     * The lazily evaluated function {@code marginal(S, f)}.
     */
    static final class Marginal<X> implements MeasurableFunction<X> {

        private final Marginalizer<X> marginalizer;
        private final Window integrated;
        private final MeasurableFunction<X> inner;
        private final Window support;

        Marginal(Marginalizer<X> marginalizer, Window integrated, MeasurableFunction<X> inner) {
            this.marginalizer = marginalizer;
            this.integrated = integrated;
            this.inner = inner;
            this.support = inner.support().minus(integrated);
        }

        @Override
        public Window support() {
            return support;
        }

        public Window integrated() {
            return integrated;
        }

        @Override
        public double apply(Point<X> point) {
            Point<X> guarded = GuardedPoint.of(point, support, "marginal over " + integrated);
            return marginalizer.evaluate(integrated, inner, guarded);
        }

        @Override
        public String toString() {
            return "Marginal" + integrated + "(" + inner + ")";
        }
    }
}
