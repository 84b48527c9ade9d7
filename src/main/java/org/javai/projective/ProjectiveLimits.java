package org.javai.projective;

import java.util.Objects;
import org.javai.projective.cylinder.ContentFunction;
import org.javai.projective.extension.OuterMeasureExtension;
import org.javai.projective.extension.ProductMeasure;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.family.WindowMeasure;
import org.javai.projective.ops.ConstructionReporter;
import org.javai.projective.witness.DownwardContinuity;

/**
 * Entry point: builds the product measure of a family of coordinate measures.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ProductMeasure<Double> lebesgue = ProjectiveLimits.build(ProductFamily.iid(UniformMeasure.unitInterval()));
 * ExtendedReal area = lebesgue.measure(Cylinder.box(Map.of(
 *         0, CoordinateSet.interval(0, 0.5),
 *         1, CoordinateSet.interval(0.25, 0.75))));
 * }</pre>
 */
public final class ProjectiveLimits {

    private ProjectiveLimits() {
    }

    public static <X> ProductMeasure<X> build(ProductFamily<X> family) {
        Objects.requireNonNull(family, "family must not be null");
        return build(family, family.settings(), ConstructionReporter.noOp());
    }

    /**
     * @throws ExtensionException if the content cannot be extended
     */
    public static <X> ProductMeasure<X> build(ProductFamily<X> family, ExtensionSettings settings,
                                              ConstructionReporter reporter) {
        Objects.requireNonNull(family, "family must not be null");
        ContentFunction<X> content = new ContentFunction<>(family, settings);
        DownwardContinuity<X> continuity = new DownwardContinuity<>(family, settings, reporter);
        return OuterMeasureExtension.extend(content, continuity);
    }

    /**
     * The pushforward of {@code measure} onto {@code window}.
     */
    public static <X> WindowMeasure<X> project(ProductMeasure<X> measure, Window window) {
        Objects.requireNonNull(measure, "measure must not be null");
        return measure.project(window);
    }
}
