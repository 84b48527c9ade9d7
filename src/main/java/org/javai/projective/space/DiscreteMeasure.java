package org.javai.projective.space;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.function.IntToDoubleFunction;
import java.util.function.ToDoubleFunction;
import org.javai.projective.ExtendedReal;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.Violation;
import org.javai.projective.Window;

/**
 * A probability measure concentrated on finitely or countably many atoms.
 *
 * <p>Atoms are visited in the order they are supplied. For a countable family the atoms are
 * enumerated until the remaining mass drops to {@link ExtensionSettings#tailTolerance()}; that
 * truncated prefix is the effective support used for every computation.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * DiscreteMeasure<Integer> coin = DiscreteMeasure.fairCoin();
 * DiscreteMeasure<Integer> geometric = DiscreteMeasure.geometric(0.5); // μ(k) = 2^-(k+1)
 * }</pre>
 */
public final class DiscreteMeasure<X> implements CoordinateMeasure<X> {

    /**
     * One point of the support and its mass.
     */
    public record Atom<X>(X value, double mass) {

        public Atom {
            Objects.requireNonNull(value, "value must not be null");
            if (Double.isNaN(mass) || mass < 0 || Double.isInfinite(mass)) {
                throw new IllegalArgumentException("mass must be finite and >= 0, was: " + mass);
            }
        }
    }

    private final List<Atom<X>> support;
    private final double tailMass;

    private DiscreteMeasure(List<Atom<X>> support, double tailMass) {
        this.support = Collections.unmodifiableList(support);
        this.tailMass = tailMass;
    }

    /**
     * Creates a measure with finitely many atoms, in iteration order of {@code masses}.
     *
     * @throws InvariantViolationException if the masses do not sum to one
     */
    public static <X> DiscreteMeasure<X> of(Map<X, Double> masses) {
        return of(masses, ExtensionSettings.fromEnvironment());
    }

    public static <X> DiscreteMeasure<X> of(Map<X, Double> masses, ExtensionSettings settings) {
        Objects.requireNonNull(masses, "masses must not be null");
        List<Atom<X>> atoms = new ArrayList<>();
        double total = 0.0;
        for (Map.Entry<X, Double> entry : masses.entrySet()) {
            Atom<X> atom = new Atom<>(entry.getKey(), entry.getValue());
            atoms.add(atom);
            total += atom.mass();
        }
        if (Math.abs(total - 1.0) > settings.tolerance()) {
            throw notNormalized("finite distribution has total mass " + total, total);
        }
        return new DiscreteMeasure<>(atoms, 0.0);
    }

    /**
     * Creates a measure with countably many atoms; {@code atomAt(i)} is the i-th atom.
     *
     * @throws InvariantViolationException if the mass is not exhausted within
     *         {@link ExtensionSettings#maxAtoms()} atoms, or exceeds one
     */
    public static <X> DiscreteMeasure<X> countable(IntFunction<Atom<X>> atomAt, ExtensionSettings settings) {
        Objects.requireNonNull(atomAt, "atomAt must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        List<Atom<X>> atoms = new ArrayList<>();
        double cumulative = 0.0;
        for (int i = 0; i < settings.maxAtoms(); i++) {
            Atom<X> atom = Objects.requireNonNull(atomAt.apply(i), "atom " + i + " must not be null");
            atoms.add(atom);
            cumulative += atom.mass();
            if (cumulative > 1.0 + settings.tolerance()) {
                throw notNormalized("countable distribution exceeds mass one after " + (i + 1) + " atoms", cumulative);
            }
            double remaining = 1.0 - cumulative;
            if (remaining <= settings.tailTolerance()) {
                return new DiscreteMeasure<>(atoms, Math.max(0.0, remaining));
            }
        }
        throw notNormalized("countable distribution still misses mass " + (1.0 - cumulative)
                + " after " + settings.maxAtoms() + " atoms", cumulative);
    }

    /**
     * A measure on the natural numbers with {@code μ(k) = mass(k)}.
     */
    public static DiscreteMeasure<Integer> naturals(IntToDoubleFunction mass) {
        return naturals(mass, ExtensionSettings.fromEnvironment());
    }

    public static DiscreteMeasure<Integer> naturals(IntToDoubleFunction mass, ExtensionSettings settings) {
        Objects.requireNonNull(mass, "mass must not be null");
        return countable(k -> new Atom<>(k, mass.applyAsDouble(k)), settings);
    }

    /**
     * The geometric distribution on the natural numbers, {@code μ(k) = p (1 - p)^k}.
     */
    public static DiscreteMeasure<Integer> geometric(double p) {
        return geometric(p, ExtensionSettings.fromEnvironment());
    }

    public static DiscreteMeasure<Integer> geometric(double p, ExtensionSettings settings) {
        if (!(p > 0 && p <= 1)) {
            throw new IllegalArgumentException("p must be in (0, 1], was: " + p);
        }
        return naturals(k -> p * Math.pow(1 - p, k), settings);
    }

    /**
     * The Bernoulli distribution on {@code {0, 1}} with {@code μ(1) = p}.
     */
    public static DiscreteMeasure<Integer> bernoulli(double p) {
        if (!(p >= 0 && p <= 1)) {
            throw new IllegalArgumentException("p must be in [0, 1], was: " + p);
        }
        Map<Integer, Double> masses = new LinkedHashMap<>();
        masses.put(0, 1 - p);
        masses.put(1, p);
        return of(masses);
    }

    public static DiscreteMeasure<Integer> fairCoin() {
        return bernoulli(0.5);
    }

    /**
     * The atoms carrying the measure, in enumeration order.
     */
    public List<Atom<X>> atoms() {
        return support;
    }

    /**
     * Mass left out by truncating a countable support; zero for finite measures.
     */
    public double tailMass() {
        return tailMass;
    }

    @Override
    public ExtendedReal measure(CoordinateSet<X> set) {
        Objects.requireNonNull(set, "set must not be null");
        if (set instanceof CoordinateSet.All) {
            return ExtendedReal.ONE;
        }
        double sum = 0.0;
        for (Atom<X> atom : support) {
            if (set.contains(atom.value())) {
                sum += atom.mass();
            }
        }
        return ExtendedReal.clamped(Math.min(1.0, sum));
    }

    @Override
    public ExtendedReal integrate(ToDoubleFunction<? super X> f) {
        Objects.requireNonNull(f, "f must not be null");
        double sum = 0.0;
        for (Atom<X> atom : support) {
            double value = Measures.checkIntegrand(f.applyAsDouble(atom.value()), atom.value());
            sum = Measures.accumulate(sum, atom.mass(), value);
        }
        return Measures.total(sum);
    }

    /**
     * Singletons of the leading atoms, then one set holding everything else.
     */
    @Override
    public List<CoordinateSet<X>> partition(int pieces) {
        if (pieces < 1) {
            throw new IllegalArgumentException("pieces must be >= 1, was: " + pieces);
        }
        if (pieces == 1) {
            return List.of(CoordinateSet.all());
        }
        List<CoordinateSet<X>> parts = new ArrayList<>();
        Set<X> singled = new LinkedHashSet<>();
        for (Atom<X> atom : support) {
            if (parts.size() == pieces - 1) {
                break;
            }
            parts.add(CoordinateSet.of(Set.of(atom.value())));
            singled.add(atom.value());
        }
        Set<X> excluded = Set.copyOf(singled);
        parts.add(CoordinateSet.where(value -> !excluded.contains(value)));
        return parts;
    }

    private static InvariantViolationException notNormalized(String message, double total) {
        return new InvariantViolationException(Violation.of(
                "coordinate_measure", "not_normalized", message, Window.empty(), 1.0, total));
    }
}
