package org.javai.projective.family;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.projective.DomainException;
import org.javai.projective.ExtendedReal;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.InvariantViolationException;
import org.javai.projective.PartialAssignment;
import org.javai.projective.Verdict;
import org.javai.projective.Violation;
import org.javai.projective.Window;
import org.javai.projective.cylinder.MeasurableSet;

/**
 * A family given by explicit joint probability tables on finitely many windows, for finite
 * coordinate spaces.
 *
 * <p>Unlike {@link ProductFamily}, nothing makes an arbitrary set of tables consistent, so
 * projectivity is checked when the family is created: for every pair of tabulated windows
 * {@code S} and {@code T}, the two tables pushed forward onto {@code S ∩ T} must agree. A window without a table is served by pushing forward the smallest
 * tabulated window containing it.
 */
public final class TabulatedFamily<X> implements ProjectiveFamily<X> {

    private static final String NAMESPACE = "projectivity";

    private final Map<Window, Map<PartialAssignment<X>, Double>> tables;
    private final ExtensionSettings settings;

    private TabulatedFamily(Map<Window, Map<PartialAssignment<X>, Double>> tables, ExtensionSettings settings) {
        this.tables = tables;
        this.settings = settings;
    }

    /**
     * Creates a family and checks that it is projective.
     *
     * @throws InvariantViolationException if a table is not a probability distribution or two
     *         tables disagree on their common coordinates
     * @throws DomainException if a table holds an assignment over the wrong window
     */
    public static <X> TabulatedFamily<X> of(Map<Window, Map<PartialAssignment<X>, Double>> tables) {
        return of(tables, ExtensionSettings.fromEnvironment());
    }

    public static <X> TabulatedFamily<X> of(Map<Window, Map<PartialAssignment<X>, Double>> tables,
                                            ExtensionSettings settings) {
        return unchecked(tables, settings).checkProjectivity().getOrThrow();
    }

    /**
     * Creates a family without checking projectivity; use {@link #checkProjectivity()} to inspect it.
     */
    public static <X> TabulatedFamily<X> unchecked(Map<Window, Map<PartialAssignment<X>, Double>> tables,
                                                   ExtensionSettings settings) {
        Objects.requireNonNull(tables, "tables must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        Map<Window, Map<PartialAssignment<X>, Double>> copy = new LinkedHashMap<>();
        for (Map.Entry<Window, Map<PartialAssignment<X>, Double>> table : tables.entrySet()) {
            for (Map.Entry<PartialAssignment<X>, Double> row : table.getValue().entrySet()) {
                if (!row.getKey().window().equals(table.getKey())) {
                    throw new DomainException("assignment over " + row.getKey().window()
                            + " listed in the table for " + table.getKey());
                }
                double mass = Objects.requireNonNull(row.getValue(), "mass must not be null");
                if (Double.isNaN(mass) || mass < 0) {
                    throw new IllegalArgumentException("mass must be >= 0, was: " + mass);
                }
            }
            copy.put(table.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(table.getValue())));
        }
        return new TabulatedFamily<>(Collections.unmodifiableMap(copy), settings);
    }

    /**
     * Checks normalization of every table, then pushes every pair of tables forward onto the
     * coordinates their windows share and compares the results. Nested windows are the special
     * case where one pushforward is the smaller table itself.
     */
    public Verdict<TabulatedFamily<X>> checkProjectivity() {
        for (Map.Entry<Window, Map<PartialAssignment<X>, Double>> table : tables.entrySet()) {
            double total = table.getValue().values().stream().mapToDouble(Double::doubleValue).sum();
            if (Math.abs(total - 1.0) > settings.tolerance()) {
                return Verdict.violated(Violation.of(NAMESPACE, "not_normalized",
                        "table on " + table.getKey() + " has total mass " + total, table.getKey(), 1.0, total));
            }
        }
        List<Window> windows = new ArrayList<>(tables.keySet());
        for (int i = 0; i < windows.size(); i++) {
            for (int j = i + 1; j < windows.size(); j++) {
                Window first = windows.get(i);
                Window second = windows.get(j);
                Window common = first.intersect(second);
                Optional<Violation> mismatch = compare(common,
                        pushForward(tables.get(first), common), pushForward(tables.get(second), common));
                if (mismatch.isPresent()) {
                    return Verdict.violated(mismatch.get());
                }
            }
        }
        return Verdict.holds(this);
    }

    private Optional<Violation> compare(Window window, Map<PartialAssignment<X>, Double> expected,
                                        Map<PartialAssignment<X>, Double> actual) {
        Map<PartialAssignment<X>, Double> keys = new LinkedHashMap<>(expected);
        actual.forEach(keys::putIfAbsent);
        for (PartialAssignment<X> assignment : keys.keySet()) {
            double want = expected.getOrDefault(assignment, 0.0);
            double got = actual.getOrDefault(assignment, 0.0);
            if (Math.abs(want - got) > settings.tolerance()) {
                return Optional.of(Violation.of(NAMESPACE, "pushforward_mismatch",
                        "tables disagree on " + window + " at " + assignment.values(),
                        window, want, got));
            }
        }
        return Optional.empty();
    }

    private static <X> Map<PartialAssignment<X>, Double> pushForward(Map<PartialAssignment<X>, Double> table, Window onto) {
        Map<PartialAssignment<X>, Double> result = new HashMap<>();
        for (Map.Entry<PartialAssignment<X>, Double> row : table.entrySet()) {
            result.merge(row.getKey().restrict(onto), row.getValue(), Double::sum);
        }
        return result;
    }

    public Map<Window, Map<PartialAssignment<X>, Double>> tables() {
        return tables;
    }

    @Override
    public WindowMeasure<X> marginal(Window window) {
        Objects.requireNonNull(window, "window must not be null");
        Map<PartialAssignment<X>, Double> table = tables.get(window);
        if (table == null) {
            Window source = tables.keySet().stream()
                    .filter(candidate -> candidate.containsAll(window))
                    .min((a, b) -> Integer.compare(a.size(), b.size()))
                    .orElseThrow(() -> new DomainException("no tabulated window contains " + window));
            table = pushForward(tables.get(source), window);
        }
        return new TableMeasure<>(window, table);
    }

    private record TableMeasure<X>(Window window, Map<PartialAssignment<X>, Double> table) implements WindowMeasure<X> {

        @Override
        public ExtendedReal measure(MeasurableSet<X> set) {
            Objects.requireNonNull(set, "set must not be null");
            if (!set.window().equals(window)) {
                throw new DomainException("set over " + set.window() + " cannot be measured by the marginal on " + window);
            }
            double sum = 0.0;
            for (Map.Entry<PartialAssignment<X>, Double> row : table.entrySet()) {
                if (set.contains(row.getKey())) {
                    sum += row.getValue();
                }
            }
            return ExtendedReal.clamped(Math.min(1.0, sum));
        }
    }
}
