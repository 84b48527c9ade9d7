package org.javai.projective.extension;

import java.util.List;
import java.util.Objects;
import org.javai.projective.DomainException;
import org.javai.projective.ExtendedReal;
import org.javai.projective.ExtensionException;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.Window;
import org.javai.projective.cylinder.ContentFunction;
import org.javai.projective.cylinder.Cylinder;
import org.javai.projective.cylinder.CylinderAlgebra;
import org.javai.projective.cylinder.MeasurableSet;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.family.WindowMeasure;
import org.javai.projective.witness.ContinuityVerdict;
import org.javai.projective.witness.DownwardContinuity;

/**
 * The product measure on the full product space, obtained by extending the content of
 * cylinder sets. Its pushforward onto any finite window is the product of the coordinate
 * measures on that window.
 */
public final class ProductMeasure<X> {

    private final ContentFunction<X> content;
    private final DownwardContinuity<X> continuity;

    ProductMeasure(ContentFunction<X> content, DownwardContinuity<X> continuity) {
        this.content = content;
        this.continuity = continuity;
    }

    public ProductFamily<X> family() {
        return continuity.family();
    }

    public ExtensionSettings settings() {
        return continuity.settings();
    }

    public ExtendedReal measure(Cylinder<X> cylinder) {
        return content.content(cylinder);
    }

    /**
     * Measure of the union of {@code cylinders}, checked against the sum of their measures.
     *
     * @throws ExtensionException if the union measures more than its parts
     */
    public ExtendedReal measureOfUnion(List<Cylinder<X>> cylinders) {
        Objects.requireNonNull(cylinders, "cylinders must not be null");
        if (cylinders.isEmpty()) {
            return ExtendedReal.ZERO;
        }
        Cylinder<X> union = cylinders.get(0);
        for (int i = 1; i < cylinders.size(); i++) {
            union = CylinderAlgebra.union(union, cylinders.get(i));
        }
        ExtendedReal whole = measure(union);
        ExtendedReal parts = outerMeasure(cylinders);
        if (whole.toDouble() > parts.toDouble() + settings().tolerance()) {
            throw new ExtensionException("union over " + union.window() + " measures " + whole
                    + ", more than the sum of its parts " + parts);
        }
        return whole;
    }

    /**
     * Measure of the intersection of a decreasing sequence: zero when the contents vanish,
     * otherwise the last content, with a point of the intersection as evidence.
     */
    public ExtendedReal measureOfIntersection(List<Cylinder<X>> decreasing) {
        ContinuityVerdict<X> verdict = continuity.check(decreasing);
        if (verdict.isVanishing()) {
            return ExtendedReal.ZERO;
        }
        return ExtendedReal.of(verdict.limit());
    }

    /**
     * The cost {@code Σ measure(C_i)} of a countable cover, an upper bound for the outer measure
     * of anything it covers.
     */
    public ExtendedReal outerMeasure(List<Cylinder<X>> cover) {
        Objects.requireNonNull(cover, "cover must not be null");
        ExtendedReal sum = ExtendedReal.ZERO;
        for (Cylinder<X> cylinder : cover) {
            sum = sum.plus(measure(cylinder));
        }
        return sum;
    }

    /**
     * The pushforward {@code A ↦ measure(cylinder(S, A))} onto {@code window}.
     */
    public WindowMeasure<X> project(Window window) {
        Objects.requireNonNull(window, "window must not be null");
        return new Projection<>(this, window);
    }

    private record Projection<X>(ProductMeasure<X> source, Window window) implements WindowMeasure<X> {

        @Override
        public ExtendedReal measure(MeasurableSet<X> set) {
            Objects.requireNonNull(set, "set must not be null");
            if (!set.window().equals(window)) {
                throw new DomainException("set over " + set.window() + " cannot be measured by the projection onto " + window);
            }
            return source.measure(CylinderAlgebra.cylinder(window, set));
        }
    }
}
