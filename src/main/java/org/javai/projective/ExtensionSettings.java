package org.javai.projective;

import java.util.function.Function;

/**
 * Numeric settings shared by every stage of the construction.
 *
 * <p>Settings are read from system properties with environment-variable fallbacks by
 * {@link #fromEnvironment()}:
 * <ul>
 *   <li>{@code projective.quadrature.resolution} / {@code PROJECTIVE_QUADRATURE_RESOLUTION}</li>
 *   <li>{@code projective.tail.tolerance} / {@code PROJECTIVE_TAIL_TOLERANCE}</li>
 *   <li>{@code projective.max.atoms} / {@code PROJECTIVE_MAX_ATOMS}</li>
 *   <li>{@code projective.tolerance} / {@code PROJECTIVE_TOLERANCE}</li>
 *   <li>{@code projective.vanishing.tolerance} / {@code PROJECTIVE_VANISHING_TOLERANCE}</li>
 *   <li>{@code projective.bisection.width} / {@code PROJECTIVE_BISECTION_WIDTH}</li>
 *   <li>{@code projective.probe.depth} / {@code PROJECTIVE_PROBE_DEPTH}</li>
 *   <li>{@code projective.probe.pieces} / {@code PROJECTIVE_PROBE_PIECES}</li>
 * </ul>
 * Unset values keep their {@link #defaults() default}. Factories and constructors that take no
 * settings argument, such as {@code ProductFamily.iid(measure)} or {@code UniformMeasure.on(lo, hi)},
 * resolve them this way when they are called.
 *
 * @param quadratureResolution number of midpoint cells used to integrate over an interval
 * @param tailTolerance mass below which the tail of a countable distribution is ignored
 * @param maxAtoms upper limit on the atoms visited in a countable distribution
 * @param tolerance slack allowed when comparing two computed values
 * @param vanishingTolerance content below which a decreasing sequence counts as vanishing
 * @param bisectionWidth interval width at which bisection stops
 * @param probeDepth number of leading coordinates probed when extending a content
 * @param probePieces number of pieces each probed coordinate is partitioned into
 */
public record ExtensionSettings(
        int quadratureResolution,
        double tailTolerance,
        int maxAtoms,
        double tolerance,
        double vanishingTolerance,
        double bisectionWidth,
        int probeDepth,
        int probePieces
) {

    private static final ExtensionSettings DEFAULTS =
            new ExtensionSettings(256, 1e-12, 100_000, 1e-9, 1e-9, 1e-6, 3, 4);

    public ExtensionSettings {
        requirePositive(quadratureResolution, "quadratureResolution");
        requirePositive(maxAtoms, "maxAtoms");
        requirePositive(probePieces, "probePieces");
        if (probeDepth < 0) {
            throw new IllegalArgumentException("probeDepth must be >= 0, was: " + probeDepth);
        }
        requirePositive(tailTolerance, "tailTolerance");
        requirePositive(tolerance, "tolerance");
        requirePositive(vanishingTolerance, "vanishingTolerance");
        requirePositive(bisectionWidth, "bisectionWidth");
    }

    public static ExtensionSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Resolves every setting from system properties or environment variables, falling back
     * to the defaults.
     *
     * @throws IllegalArgumentException if a configured value cannot be parsed or is out of range
     */
    public static ExtensionSettings fromEnvironment() {
        return builder()
                .quadratureResolution(resolve("projective.quadrature.resolution", "PROJECTIVE_QUADRATURE_RESOLUTION",
                        Integer::parseInt, DEFAULTS.quadratureResolution))
                .tailTolerance(resolve("projective.tail.tolerance", "PROJECTIVE_TAIL_TOLERANCE",
                        Double::parseDouble, DEFAULTS.tailTolerance))
                .maxAtoms(resolve("projective.max.atoms", "PROJECTIVE_MAX_ATOMS",
                        Integer::parseInt, DEFAULTS.maxAtoms))
                .tolerance(resolve("projective.tolerance", "PROJECTIVE_TOLERANCE",
                        Double::parseDouble, DEFAULTS.tolerance))
                .vanishingTolerance(resolve("projective.vanishing.tolerance", "PROJECTIVE_VANISHING_TOLERANCE",
                        Double::parseDouble, DEFAULTS.vanishingTolerance))
                .bisectionWidth(resolve("projective.bisection.width", "PROJECTIVE_BISECTION_WIDTH",
                        Double::parseDouble, DEFAULTS.bisectionWidth))
                .probeDepth(resolve("projective.probe.depth", "PROJECTIVE_PROBE_DEPTH",
                        Integer::parseInt, DEFAULTS.probeDepth))
                .probePieces(resolve("projective.probe.pieces", "PROJECTIVE_PROBE_PIECES",
                        Integer::parseInt, DEFAULTS.probePieces))
                .build();
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Resolves one value from a system property or an environment variable.
     */
    static <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T fallback) {
        String value = System.getProperty(sysProp);
        if (value == null || value.isBlank()) {
            value = System.getenv(envVar);
        }
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid configuration: '" + value + "' for system property '" + sysProp +
                    "' or environment variable '" + envVar + "'", e);
        }
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be > 0, was: " + value);
        }
    }

    /**
     * Builder for {@link ExtensionSettings}; starts from the defaults or from an existing instance.
     */
    public static final class Builder {
        private int quadratureResolution;
        private double tailTolerance;
        private int maxAtoms;
        private double tolerance;
        private double vanishingTolerance;
        private double bisectionWidth;
        private int probeDepth;
        private int probePieces;

        private Builder(ExtensionSettings from) {
            this.quadratureResolution = from.quadratureResolution;
            this.tailTolerance = from.tailTolerance;
            this.maxAtoms = from.maxAtoms;
            this.tolerance = from.tolerance;
            this.vanishingTolerance = from.vanishingTolerance;
            this.bisectionWidth = from.bisectionWidth;
            this.probeDepth = from.probeDepth;
            this.probePieces = from.probePieces;
        }

        public Builder quadratureResolution(int quadratureResolution) {
            this.quadratureResolution = quadratureResolution;
            return this;
        }

        public Builder tailTolerance(double tailTolerance) {
            this.tailTolerance = tailTolerance;
            return this;
        }

        public Builder maxAtoms(int maxAtoms) {
            this.maxAtoms = maxAtoms;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder vanishingTolerance(double vanishingTolerance) {
            this.vanishingTolerance = vanishingTolerance;
            return this;
        }

        public Builder bisectionWidth(double bisectionWidth) {
            this.bisectionWidth = bisectionWidth;
            return this;
        }

        public Builder probeDepth(int probeDepth) {
            this.probeDepth = probeDepth;
            return this;
        }

        public Builder probePieces(int probePieces) {
            this.probePieces = probePieces;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public ExtensionSettings build() {
            return new ExtensionSettings(quadratureResolution, tailTolerance, maxAtoms, tolerance,
                    vanishingTolerance, bisectionWidth, probeDepth, probePieces);
        }
    }
}
