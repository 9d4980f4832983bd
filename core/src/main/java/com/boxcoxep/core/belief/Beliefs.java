package com.boxcoxep.core.belief;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scalar helpers over {@link Gaussian} beliefs shared by the message operators.
 */
public final class Beliefs {

    private static final Logger logger = LoggerFactory.getLogger(Beliefs.class);

    public static final double DEFAULT_PRECISION_FLOOR = 1e-12;

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    private Beliefs() {
    }

    /**
     * Representative scalar of a belief: the point of a point mass, otherwise the mean.
     */
    public static double meanOf(Gaussian belief) {
        if (belief.isPointMass()) {
            return belief.getPoint();
        }
        return belief.getMean();
    }

    public static boolean isUninformative(Gaussian belief) {
        return belief.isUniform();
    }

    public static boolean isDegenerate(Gaussian belief) {
        return belief.isPointMass();
    }

    /**
     * Log-density at {@code x}; 0 for an uninformative belief so it acts as a no-op weight.
     */
    public static double logDensity(Gaussian belief, double x) {
        if (belief.isUniform()) {
            return 0.0;
        }
        return belief.getLogProb(x);
    }

    public static Gaussian fromMeanAndVariance(double mean, double variance) {
        return Gaussian.fromMeanAndVariance(mean, variance);
    }

    public static Gaussian fromNatural(double meanTimesPrecision, double precision) {
        return Gaussian.fromNatural(meanTimesPrecision, precision);
    }

    /**
     * Log-likelihood of a value under a belief used as a soft constraint.
     * A point mass is widened to a Gaussian of {@code pointMassVariance} around its point.
     */
    public static double logLikelihood(Gaussian belief, double x, double pointMassVariance) {
        if (belief.isUniform()) {
            return 0.0;
        }
        if (belief.isPointMass()) {
            double diff = x - belief.getPoint();
            return -0.5 * diff * diff / pointMassVariance - 0.5 * (LOG_2PI + Math.log(pointMassVariance));
        }
        return belief.getLogProb(x);
    }

    public static Gaussian divide(Gaussian marginal, Gaussian cavity, boolean forceProper) {
        return divide(marginal, cavity, forceProper, DEFAULT_PRECISION_FLOOR);
    }

    /**
     * Outgoing message {@code marginal / cavity}. With {@code forceProper}, a non-positive
     * precision difference is clamped to {@code precisionFloor} and the result is centred on
     * the marginal's mean.
     */
    public static Gaussian divide(Gaussian marginal, Gaussian cavity, boolean forceProper, double precisionFloor) {
        if (marginal.isPointMass()) {
            return marginal;
        }
        if (cavity.isPointMass()) {
            throw new IllegalArgumentException("Cannot divide " + marginal + " by point mass " + cavity);
        }
        if (cavity.isUniform()) {
            return marginal;
        }

        double precision = marginal.getPrecision() - cavity.getPrecision();
        double meanTimesPrecision = marginal.getMeanTimesPrecision() - cavity.getMeanTimesPrecision();

        if (forceProper && !(precision > 0.0)) {
            double center = marginal.isProper() ? marginal.getMean() : 0.0;
            if (logger.isDebugEnabled()) {
                logger.debug("Forcing proper ratio: precision {} clamped to {} (marginal={}, cavity={})",
                        precision, precisionFloor, marginal, cavity);
            }
            return Gaussian.fromNatural(center * precisionFloor, precisionFloor);
        }
        return Gaussian.fromNatural(meanTimesPrecision, precision);
    }
}
