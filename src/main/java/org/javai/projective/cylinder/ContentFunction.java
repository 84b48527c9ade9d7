package org.javai.projective.cylinder;

import java.util.Objects;
import org.javai.projective.DomainException;
import org.javai.projective.ExtendedReal;
import org.javai.projective.ExtensionSettings;
import org.javai.projective.Verdict;
import org.javai.projective.Violation;
import org.javai.projective.Window;
import org.javai.projective.family.ProjectiveFamily;

/**
 * The content of cylinder sets: {@code content(cylinder(S, A)) = μ_S(A)}.
 *
 * <p>Because the family is projective, the value does not depend on which window a cylinder
 * is represented over; {@link #checkRepresentation(Cylinder, Cylinder)} checks this for two
 * representations that reindex one another. The content is finitely additive on disjoint cylinders.
 */
public final class ContentFunction<X> {

    private static final String NAMESPACE = "content";

    private final ProjectiveFamily<X> family;
    private final ExtensionSettings settings;

    public ContentFunction(ProjectiveFamily<X> family) {
        this(family, ExtensionSettings.fromEnvironment());
    }

    public ContentFunction(ProjectiveFamily<X> family, ExtensionSettings settings) {
        this.family = Objects.requireNonNull(family, "family must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public ProjectiveFamily<X> family() {
        return family;
    }

    public ExtensionSettings settings() {
        return settings;
    }

    public ExtendedReal content(Cylinder<X> cylinder) {
        Objects.requireNonNull(cylinder, "cylinder must not be null");
        return family.marginal(cylinder.window()).measure(cylinder.set());
    }

    /**
     * Returns {@code content(cylinder(S, A))}.
     */
    public ExtendedReal content(Window window, MeasurableSet<X> set) {
        return content(CylinderAlgebra.cylinder(window, set));
    }

    /**
     * Checks that two representations of the same cylinder have the same content.
     *
     * <p>Only representations that are reindexings of one another can be recognized as the same
     * cylinder, using {@link CylinderAlgebra#sameCylinder(Cylinder, Cylinder)}. Sets that coincide
     * only because of the coordinate measures, such as {@code {0, 1}} and the whole space of a
     * fair coin, are not recognized.
     *
     * @throws DomainException if the two representations are not recognizably the same cylinder
     */
    public Verdict<Cylinder<X>> checkRepresentation(Cylinder<X> first, Cylinder<X> second) {
        if (!CylinderAlgebra.sameCylinder(first, second)) {
            throw new DomainException("cylinders over " + first.window() + " and " + second.window()
                    + " are not reindexings of one another and cannot be compared");
        }
        ExtendedReal a = content(first);
        ExtendedReal b = content(second);
        if (!a.isCloseTo(b, settings.tolerance())) {
            return Verdict.violated(Violation.of(NAMESPACE, "representation_dependent",
                    "content of " + first.window() + " and " + second.window() + " representations differ",
                    CylinderAlgebra.commonWindow(first, second), a.toDouble(), b.toDouble()));
        }
        return Verdict.holds(first);
    }

    /**
     * Checks {@code content(c₁ ∪ c₂) = content(c₁) + content(c₂)} for two cylinders the caller
     * knows to be disjoint.
     */
    public Verdict<Cylinder<X>> checkAdditivity(Cylinder<X> first, Cylinder<X> second) {
        Cylinder<X> union = CylinderAlgebra.union(first, second);
        ExtendedReal whole = content(union);
        ExtendedReal parts = content(first).plus(content(second));
        if (!whole.isCloseTo(parts, settings.tolerance())) {
            return Verdict.violated(Violation.of(NAMESPACE, "not_additive",
                    "content of the union differs from the sum of the parts", union.window(),
                    parts.toDouble(), whole.toDouble()));
        }
        return Verdict.holds(union);
    }
}
