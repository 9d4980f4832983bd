package com.boxcoxep.core.math;

/**
 * Numeric knobs for {@link SimpsonQuadrature} and the transform operator.
 * The step count is stored already rounded up to an even number.
 */
public final class QuadratureSettings {

    public static final double DEFAULT_TRUNCATION_STD_DEVS = 6.0;
    public static final int DEFAULT_STEPS = 240;
    public static final double DEFAULT_MIN_VARIANCE = 1e-8;
    public static final double DEFAULT_POINT_MASS_VARIANCE = 1e-6;
    public static final double DEFAULT_FALLBACK_MEAN = 0.0;
    public static final double DEFAULT_FALLBACK_VARIANCE = 1e2;
    public static final double DEFAULT_PRECISION_FLOOR = 1e-12;

    private static final QuadratureSettings DEFAULTS = new QuadratureSettings(DEFAULT_TRUNCATION_STD_DEVS,
            DEFAULT_STEPS, DEFAULT_MIN_VARIANCE, DEFAULT_POINT_MASS_VARIANCE, DEFAULT_FALLBACK_MEAN,
            DEFAULT_FALLBACK_VARIANCE, DEFAULT_PRECISION_FLOOR);

    private final double truncationStdDevs;
    private final int steps;
    private final double minVariance;
    private final double pointMassVariance;
    private final double fallbackMean;
    private final double fallbackVariance;
    private final double precisionFloor;

    public QuadratureSettings(
            double truncationStdDevs,
            int steps,
            double minVariance,
            double pointMassVariance,
            double fallbackMean,
            double fallbackVariance,
            double precisionFloor) {
        if (!(truncationStdDevs > 0.0) || Double.isInfinite(truncationStdDevs)) {
            throw new IllegalArgumentException("truncationStdDevs must be positive, got: " + truncationStdDevs);
        }
        requirePositive(minVariance, "minVariance");
        requirePositive(pointMassVariance, "pointMassVariance");
        requirePositive(fallbackVariance, "fallbackVariance");
        requirePositive(precisionFloor, "precisionFloor");
        if (!Double.isFinite(fallbackMean)) {
            throw new IllegalArgumentException("fallbackMean must be finite, got: " + fallbackMean);
        }
        this.truncationStdDevs = truncationStdDevs;
        this.steps = MathUtil.evenSteps(steps);
        this.minVariance = minVariance;
        this.pointMassVariance = pointMassVariance;
        this.fallbackMean = fallbackMean;
        this.fallbackVariance = fallbackVariance;
        this.precisionFloor = precisionFloor;
    }

    public static QuadratureSettings defaults() {
        return DEFAULTS;
    }

    private static void requirePositive(double v, String name) {
        if (!(v > 0.0) || Double.isInfinite(v)) {
            throw new IllegalArgumentException(name + " must be positive and finite, got: " + v);
        }
    }

    public double getTruncationStdDevs() {
        return truncationStdDevs;
    }

    public int getSteps() {
        return steps;
    }

    public double getMinVariance() {
        return minVariance;
    }

    public double getPointMassVariance() {
        return pointMassVariance;
    }

    public double getFallbackMean() {
        return fallbackMean;
    }

    public double getFallbackVariance() {
        return fallbackVariance;
    }

    public double getPrecisionFloor() {
        return precisionFloor;
    }

    @Override
    public String toString() {
        return "QuadratureSettings{" +
                "truncationStdDevs=" + truncationStdDevs +
                ", steps=" + steps +
                ", minVariance=" + minVariance +
                ", pointMassVariance=" + pointMassVariance +
                ", fallbackMean=" + fallbackMean +
                ", fallbackVariance=" + fallbackVariance +
                ", precisionFloor=" + precisionFloor +
                '}';
    }
}
