package com.boxcoxep.core.belief;

import java.util.Objects;

/**
 * Immutable univariate Gaussian belief stored in natural parameters.
 *
 * Three states are distinguished:
 * proper (finite positive precision), point mass (infinite precision, carries a single value)
 * and uniform (zero precision and zero precision-weighted mean). Anything else with
 * non-positive precision is improper, which is legal for messages but has no mean/variance.
 */
public final class Gaussian {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);
    private static final Gaussian UNIFORM = new Gaussian(0.0, 0.0, Double.NaN);

    private final double meanTimesPrecision;
    private final double precision;
    // only meaningful when precision is +inf
    private final double point;

    private Gaussian(double meanTimesPrecision, double precision, double point) {
        this.meanTimesPrecision = meanTimesPrecision;
        this.precision = precision;
        this.point = point;
    }

    public static Gaussian uniform() {
        return UNIFORM;
    }

    public static Gaussian pointMass(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Point mass value must be finite, got: " + value);
        }
        return new Gaussian(0.0, Double.POSITIVE_INFINITY, value);
    }

    public static Gaussian fromMeanAndVariance(double mean, double variance) {
        if (!Double.isFinite(mean)) {
            throw new IllegalArgumentException("Mean must be finite, got: " + mean);
        }
        if (Double.isNaN(variance) || variance < 0.0) {
            throw new IllegalArgumentException("Variance must be non-negative, got: " + variance);
        }
        if (variance == 0.0) {
            return pointMass(mean);
        }
        if (Double.isInfinite(variance)) {
            return UNIFORM;
        }
        double prec = 1.0 / variance;
        return new Gaussian(mean * prec, prec, Double.NaN);
    }

    public static Gaussian fromNatural(double meanTimesPrecision, double precision) {
        if (Double.isNaN(meanTimesPrecision) || Double.isNaN(precision)) {
            throw new IllegalArgumentException(
                    "Natural parameters must not be NaN: mtp=" + meanTimesPrecision + ", prec=" + precision);
        }
        if (Double.isInfinite(precision)) {
            throw new IllegalArgumentException("Use pointMass() for infinite precision");
        }
        if (precision == 0.0 && meanTimesPrecision == 0.0) {
            return UNIFORM;
        }
        return new Gaussian(meanTimesPrecision, precision, Double.NaN);
    }

    public boolean isPointMass() {
        return precision == Double.POSITIVE_INFINITY;
    }

    public boolean isUniform() {
        return precision == 0.0 && meanTimesPrecision == 0.0;
    }

    public boolean isProper() {
        return precision > 0.0 && !isPointMass();
    }

    public double getPoint() {
        if (!isPointMass()) {
            throw new IllegalStateException("Not a point mass: " + this);
        }
        return point;
    }

    public double getPrecision() {
        return precision;
    }

    public double getMeanTimesPrecision() {
        return meanTimesPrecision;
    }

    public double getMean() {
        if (isPointMass()) {
            return point;
        }
        if (!isProper()) {
            throw new IllegalStateException("Improper belief has no mean: " + this);
        }
        return meanTimesPrecision / precision;
    }

    public double getVariance() {
        if (isPointMass()) {
            return 0.0;
        }
        if (!isProper()) {
            throw new IllegalStateException("Improper belief has no variance: " + this);
        }
        return 1.0 / precision;
    }

    /**
     * Log-density at {@code x}. Uniform beliefs return 0. Improper beliefs return the
     * unnormalized log of their exponential-family kernel.
     */
    public double getLogProb(double x) {
        if (isPointMass()) {
            return x == point ? 0.0 : Double.NEGATIVE_INFINITY;
        }
        if (isUniform()) {
            return 0.0;
        }
        if (!isProper()) {
            return x * (meanTimesPrecision - 0.5 * precision * x);
        }
        double mean = meanTimesPrecision / precision;
        double diff = x - mean;
        return -0.5 * (LOG_2PI - Math.log(precision)) - 0.5 * diff * diff * precision;
    }

    /**
     * Product of two beliefs (sum of natural parameters).
     */
    public Gaussian multiply(Gaussian other) {
        if (isPointMass()) {
            if (other.isPointMass() && other.point != point) {
                throw new IllegalArgumentException("Product of two different point masses: " + this + " * " + other);
            }
            return this;
        }
        if (other.isPointMass()) {
            return other;
        }
        return fromNatural(meanTimesPrecision + other.meanTimesPrecision, precision + other.precision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Gaussian)) {
            return false;
        }
        Gaussian that = (Gaussian) o;
        if (isPointMass() || that.isPointMass()) {
            return isPointMass() && that.isPointMass() && Double.compare(point, that.point) == 0;
        }
        return Double.compare(precision, that.precision) == 0
                && Double.compare(meanTimesPrecision, that.meanTimesPrecision) == 0;
    }

    @Override
    public int hashCode() {
        if (isPointMass()) {
            return Objects.hash(Double.POSITIVE_INFINITY, point);
        }
        return Objects.hash(precision, meanTimesPrecision);
    }

    @Override
    public String toString() {
        if (isPointMass()) {
            return "Gaussian.PointMass(" + point + ")";
        }
        if (isUniform()) {
            return "Gaussian.Uniform";
        }
        if (!isProper()) {
            return "Gaussian(mtp=" + meanTimesPrecision + ", prec=" + precision + ")";
        }
        return String.format("Gaussian(%.6g, %.6g)", getMean(), getVariance());
    }
}
