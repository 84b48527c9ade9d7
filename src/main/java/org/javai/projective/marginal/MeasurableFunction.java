package org.javai.projective.marginal;

import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.javai.projective.GuardedPoint;
import org.javai.projective.MeasurabilityException;
import org.javai.projective.Point;
import org.javai.projective.Window;
import org.javai.projective.cylinder.Cylinder;

/**
 * A non-negative function on the product space that depends only on the coordinates of its
 * {@link #support()}. Values are doubles in {@code [0, +∞]}.
 *
 * @param <X> the coordinate value type
 */
public interface MeasurableFunction<X> {

    /**
     * The window of coordinates the function may read.
     */
    Window support();

    /**
     * Evaluates the function.
     *
     * @throws MeasurabilityException if the function reads outside its support or yields a value
     *         that is NaN or negative
     */
    double apply(Point<X> point);

    /**
     * The indicator {@code 1_C} of a cylinder; its support is the cylinder's window.
     */
    record Indicator<X>(Cylinder<X> cylinder) implements MeasurableFunction<X> {

        public Indicator {
            Objects.requireNonNull(cylinder, "cylinder must not be null");
        }

        @Override
        public Window support() {
            return cylinder.window();
        }

        @Override
        public double apply(Point<X> point) {
            return cylinder.contains(point) ? 1.0 : 0.0;
        }
    }

    /**
     * A function given by a formula over its support.
     */
    record Formula<X>(Window support, ToDoubleFunction<Point<X>> formula) implements MeasurableFunction<X> {

        public Formula {
            Objects.requireNonNull(support, "support must not be null");
            Objects.requireNonNull(formula, "formula must not be null");
        }

        @Override
        public double apply(Point<X> point) {
            double value = formula.applyAsDouble(GuardedPoint.of(point, support, "function on " + support));
            if (Double.isNaN(value)) {
                throw new MeasurabilityException("function on " + support + " is NaN");
            }
            if (value < 0) {
                throw new MeasurabilityException("function on " + support + " is negative: " + value);
            }
            return value;
        }
    }

    static <X> MeasurableFunction<X> indicator(Cylinder<X> cylinder) {
        return new Indicator<>(cylinder);
    }

    static <X> MeasurableFunction<X> of(Window support, ToDoubleFunction<Point<X>> formula) {
        return new Formula<>(support, formula);
    }

    static <X> MeasurableFunction<X> constant(double value) {
        return new Formula<>(Window.empty(), point -> value);
    }
}
