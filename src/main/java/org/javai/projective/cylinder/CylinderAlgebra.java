package org.javai.projective.cylinder;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.projective.DomainException;
import org.javai.projective.Window;

/**
 * Operations on the semiring of cylinder sets.
 *
 * <p>Two cylinders over different windows are combined by first reindexing both onto the
 * union of their windows; the reindexed representations describe the same subsets of the
 * product space.
 */
public final class CylinderAlgebra {

    private CylinderAlgebra() {
        // Utility class
    }

    /**
     * Returns {@code cylinder(S, A)}.
     *
     * @throws DomainException if {@code A} is not a set over {@code S}
     */
    public static <X> Cylinder<X> cylinder(Window window, MeasurableSet<X> set) {
        return new Cylinder<>(window, set);
    }

    /**
     * Rewrites {@code A ⊆ ∏_{n∈S} X_n} as its preimage in {@code ∏_{n∈T} X_n}, so that
     * {@code cylinder(S, A) = cylinder(T, reindex(S, A, T))}.
     *
     * @throws DomainException if {@code A} is not over {@code S}, or {@code S ⊄ T}
     */
    public static <X> MeasurableSet<X> reindex(Window from, MeasurableSet<X> set, Window to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(set, "set must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (!set.window().equals(from)) {
            throw new DomainException("set over " + set.window() + " is not a set over " + from);
        }
        if (!to.containsAll(from)) {
            throw new DomainException("cannot reindex " + from + " onto " + to + ": window would shrink");
        }
        return set.reindex(to);
    }

    public static <X> Cylinder<X> reindex(Cylinder<X> cylinder, Window to) {
        return new Cylinder<>(to, reindex(cylinder.window(), cylinder.set(), to));
    }

    public static Window commonWindow(Cylinder<?> first, Cylinder<?> second) {
        return first.window().union(second.window());
    }

    /**
     * Intersects two cylinders over their common window. Box-shaped operands stay box-shaped.
     */
    public static <X> Cylinder<X> intersect(Cylinder<X> first, Cylinder<X> second) {
        Window common = commonWindow(first, second);
        Optional<List<Box<X>>> left = boxes(first.set());
        Optional<List<Box<X>>> right = boxes(second.set());
        if (left.isPresent() && right.isPresent()) {
            List<Box<X>> pieces = new ArrayList<>();
            for (Box<X> a : left.get()) {
                for (Box<X> b : right.get()) {
                    pieces.add(a.intersect(b).reindex(common));
                }
            }
            return Cylinder.of(pieces.size() == 1 ? pieces.get(0) : BoxUnion.of(common, pieces));
        }
        MeasurableSet<X> a = first.set();
        MeasurableSet<X> b = second.set();
        return Cylinder.of(PredicateSet.<X>of(common, point -> a.contains(point) && b.contains(point)));
    }

    /**
     * Unites two cylinders over their common window.
     */
    public static <X> Cylinder<X> union(Cylinder<X> first, Cylinder<X> second) {
        Window common = commonWindow(first, second);
        Optional<List<Box<X>>> left = boxes(first.set());
        Optional<List<Box<X>>> right = boxes(second.set());
        if (left.isPresent() && right.isPresent()) {
            List<Box<X>> pieces = new ArrayList<>(left.get());
            pieces.addAll(right.get());
            return Cylinder.of(BoxUnion.of(common, pieces));
        }
        MeasurableSet<X> a = first.set();
        MeasurableSet<X> b = second.set();
        return Cylinder.of(PredicateSet.<X>of(common, point -> a.contains(point) || b.contains(point)));
    }

    /**
     * Decides whether two box-shaped representations describe the same cylinder, by comparing
     * them structurally over the common window. Empty boxes are ignored, so any two
     * representations of the empty set compare equal.
     *
     * @throws DomainException if either set is defined by a predicate, which cannot be compared structurally
     */
    public static <X> boolean sameCylinder(Cylinder<X> first, Cylinder<X> second) {
        Window common = commonWindow(first, second);
        List<Box<X>> left = boxes(first.set()).orElseThrow(() -> notStructural(first));
        List<Box<X>> right = boxes(second.set()).orElseThrow(() -> notStructural(second));
        return normalized(left, common).equals(normalized(right, common));
    }

    private static <X> Set<Box<X>> normalized(List<Box<X>> boxes, Window window) {
        Set<Box<X>> result = new HashSet<>();
        for (Box<X> box : boxes) {
            if (!box.isEmpty()) {
                result.add(box.reindex(window));
            }
        }
        return result;
    }

    static <X> Optional<List<Box<X>>> boxes(MeasurableSet<X> set) {
        if (set instanceof Box<X> box) {
            return Optional.of(List.of(box));
        }
        if (set instanceof BoxUnion<X> union) {
            return Optional.of(union.boxes());
        }
        return Optional.empty();
    }

    private static DomainException notStructural(Cylinder<?> cylinder) {
        return new DomainException("cylinder over " + cylinder.window() + " is defined by a predicate and cannot be compared structurally");
    }
}
