package com.boxcoxep.core.math;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The Box-Cox power transform and the scalar helpers built on it.
 *
 * All functions taking an observation {@code y} require {@code y > 0} and throw
 * {@link InvalidObservationException} otherwise.
 */
public final class BoxCoxMath {

    private static final Logger logger = LoggerFactory.getLogger(BoxCoxMath.class);

    /** Below this |lambda| the transform is evaluated as log(y). */
    public static final double TRANSFORM_ZERO_THRESHOLD = 1e-8;
    /** Below this |lambda| the derivative uses its Taylor limit. */
    public static final double DERIVATIVE_ZERO_THRESHOLD = 1e-6;

    private BoxCoxMath() {
    }

    /**
     * {@code (y^lambda - 1) / lambda}, or {@code ln y} near lambda = 0.
     */
    public static double transform(double y, double lambda) {
        InvalidObservationException.requirePositive(y, "Box-Cox observation");
        if (Math.abs(lambda) < TRANSFORM_ZERO_THRESHOLD) {
            return Math.log(y);
        }
        return (Math.pow(y, lambda) - 1.0) / lambda;
    }

    /**
     * d/d(lambda) of {@link #transform}. At lambda = 0 the limit is (ln y)^2 / 2.
     */
    public static double derivative(double y, double lambda) {
        InvalidObservationException.requirePositive(y, "Box-Cox observation");
        double logY = Math.log(y);
        if (Math.abs(lambda) < DERIVATIVE_ZERO_THRESHOLD) {
            return 0.5 * logY * logY;
        }
        double yPow = Math.exp(lambda * logY);
        double numerator = lambda * yPow * logY - (yPow - 1.0);
        return numerator / (lambda * lambda);
    }

    public static double invert(double y, double target, double initialGuess) {
        return invert(y, target, initialGuess, NewtonSettings.defaults());
    }

    /**
     * Finds lambda with {@code transform(y, lambda) == target} by damped Newton steps.
     * Best effort: returns the last iterate when the iteration cap is hit or the derivative
     * vanishes. Every iterate is clamped to [-bound, bound].
     */
    public static double invert(double y, double target, double initialGuess, NewtonSettings settings) {
        InvalidObservationException.requirePositive(y, "Box-Cox observation");
        double bound = settings.getLambdaBound();
        double lambda = initialGuess;
        for (int iter = 0; iter < settings.getMaxIterations(); iter++) {
            double residual = transform(y, lambda) - target;
            if (Math.abs(residual) < settings.getTolerance()) {
                return lambda;
            }

            double slope = derivative(y, lambda);
            if (Math.abs(slope) < settings.getMinDerivative()) {
                logger.debug("Newton inversion stopped at iter {}: derivative {} too small (y={}, lambda={})",
                        iter, slope, y, lambda);
                return lambda;
            }

            lambda = MathUtil.clamp(lambda - residual / slope, -bound, bound);
        }
        logger.debug("Newton inversion hit {} iterations without converging (y={}, target={})",
                settings.getMaxIterations(), y, target);
        return lambda;
    }

    /**
     * Value of the Jacobian reweighting factor, {@code exp((lambda - 1) * sumLog)}.
     */
    public static double jacobianWeight(double lambda, double sumLog) {
        return Math.exp((lambda - 1.0) * sumLog);
    }

    public static double sumLog(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            InvalidObservationException.requirePositive(value, "Observation");
            sum += Math.log(value);
        }
        return sum;
    }

    public static double geometricMean(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Geometric mean of an empty array");
        }
        return Math.exp(sumLog(values) / values.length);
    }

    /**
     * Divides every value by the geometric mean of the set, so the data have
     * geometric mean 1 and the transform becomes scale invariant.
     */
    public static double[] standardize(double[] values) {
        double geoMean = geometricMean(values);
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] / geoMean;
        }
        return out;
    }

    public static double[] transformAll(double[] values, double lambda) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = transform(values[i], lambda);
        }
        return out;
    }
}
