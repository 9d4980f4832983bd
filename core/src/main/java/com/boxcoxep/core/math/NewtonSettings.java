package com.boxcoxep.core.math;

/**
 * Bounds for the damped Newton inversion in {@link BoxCoxMath#invert}.
 */
public final class NewtonSettings {

    public static final int DEFAULT_MAX_ITERATIONS = 50;
    public static final double DEFAULT_TOLERANCE = 1e-8;
    public static final double DEFAULT_MIN_DERIVATIVE = 1e-10;
    public static final double DEFAULT_LAMBDA_BOUND = 20.0;

    private static final NewtonSettings DEFAULTS = new NewtonSettings(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE,
            DEFAULT_MIN_DERIVATIVE, DEFAULT_LAMBDA_BOUND);

    private final int maxIterations;
    private final double tolerance;
    private final double minDerivative;
    private final double lambdaBound;

    public NewtonSettings(int maxIterations, double tolerance, double minDerivative, double lambdaBound) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got: " + maxIterations);
        }
        if (!(tolerance > 0.0) || !(minDerivative > 0.0) || !(lambdaBound > 0.0)) {
            throw new IllegalArgumentException("tolerance, minDerivative and lambdaBound must be positive");
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.minDerivative = minDerivative;
        this.lambdaBound = lambdaBound;
    }

    public static NewtonSettings defaults() {
        return DEFAULTS;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getTolerance() {
        return tolerance;
    }

    public double getMinDerivative() {
        return minDerivative;
    }

    public double getLambdaBound() {
        return lambdaBound;
    }

    @Override
    public String toString() {
        return "NewtonSettings{maxIterations=" + maxIterations + ", tolerance=" + tolerance
                + ", minDerivative=" + minDerivative + ", lambdaBound=" + lambdaBound + '}';
    }
}
