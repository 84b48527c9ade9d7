package org.javai.projective.extension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.projective.ExtendedReal;
import org.javai.projective.ExtensionException;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.cylinder.Box;
import org.javai.projective.cylinder.ContentFunction;
import org.javai.projective.cylinder.Cylinder;
import org.javai.projective.family.ProductFamily;
import org.javai.projective.space.CoordinateSet;
import org.javai.projective.witness.DownwardContinuity;

/**
 * Extends the content of cylinder sets to the product measure.
 *
 * <p>The extension is justified by finite additivity of the content together with downward
 * continuity. Before handing out the measure, normalization is checked, and additivity is
 * probed on the grid formed by partitioning each of the leading {@code probeDepth} coordinates
 * into {@code probePieces} sets.
 */
public final class OuterMeasureExtension {

    private OuterMeasureExtension() {
    }

    /**
     * @throws ExtensionException if the content is not normalized or the probe finds it not additive
     * @throws IllegalArgumentException if {@code content} and {@code continuity} use different families
     */
    public static <X> ProductMeasure<X> extend(ContentFunction<X> content, DownwardContinuity<X> continuity) {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(continuity, "continuity must not be null");
        if (content.family() != continuity.family()) {
            throw new IllegalArgumentException("content and continuity must be built on the same family");
        }
        ExtensionSettings settings = continuity.settings();

        ExtendedReal total = content.content(Cylinder.universe());
        if (!total.isCloseTo(ExtendedReal.ONE, settings.tolerance())) {
            throw new ExtensionException("content of the whole space is " + total + ", not 1");
        }
        probeAdditivity(content, continuity.family(), settings);
        return new ProductMeasure<>(content, continuity);
    }

    private static <X> void probeAdditivity(ContentFunction<X> content, ProductFamily<X> family,
                                            ExtensionSettings settings) {
        int depth = settings.probeDepth();
        if (depth == 0) {
            return;
        }
        List<List<CoordinateSet<X>>> partitions = new ArrayList<>();
        for (int i = 0; i < depth; i++) {
            partitions.add(family.coordinate(i).partition(settings.probePieces()));
        }
        double sum = sumOverGrid(content, partitions, 0, new HashMap<>());
        if (Math.abs(sum - 1.0) > settings.tolerance()) {
            throw new ExtensionException("contents of a partition of the first " + depth
                    + " coordinates sum to " + sum + ", not 1");
        }
    }

    private static <X> double sumOverGrid(ContentFunction<X> content, List<List<CoordinateSet<X>>> partitions,
                                          int index, Map<Integer, CoordinateSet<X>> sides) {
        if (index == partitions.size()) {
            return content.content(Cylinder.of(Box.of(sides))).toDouble();
        }
        double sum = 0.0;
        for (CoordinateSet<X> piece : partitions.get(index)) {
            Map<Integer, CoordinateSet<X>> next = new HashMap<>(sides);
            next.put(index, piece);
            sum += sumOverGrid(content, partitions, index + 1, next);
        }
        return sum;
    }
}
