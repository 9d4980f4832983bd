package com.boxcoxep.core.factor;

import com.boxcoxep.core.belief.Gaussian;
import com.boxcoxep.core.math.BoxCoxMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EP operator for the Jacobian term {@code exp((lambda - 1) * S)} of the Box-Cox likelihood,
 * S being the sum of the logs of the observations.
 *
 * The factor is log-linear in lambda, so every message is closed form: the message to lambda
 * is a pure shift of the precision-weighted mean, and the weight itself is log-normal when
 * lambda is Gaussian.
 */
public class BoxCoxJacobianOperator implements JacobianFactor {

    private static final Logger logger = LoggerFactory.getLogger(BoxCoxJacobianOperator.class);

    public static final double DEFAULT_MIN_VARIANCE = 1e-12;

    private final double minVariance;

    public BoxCoxJacobianOperator() {
        this(DEFAULT_MIN_VARIANCE);
    }

    public BoxCoxJacobianOperator(double minVariance) {
        if (!(minVariance > 0.0) || Double.isInfinite(minVariance)) {
            throw new IllegalArgumentException("minVariance must be positive, got: " + minVariance);
        }
        this.minVariance = minVariance;
    }

    public double getMinVariance() {
        return minVariance;
    }

    @Override
    public Gaussian messageToLambda(double sumLog, Gaussian lambda) {
        // exp(lambda * S) adds S to the precision-weighted mean and nothing to the precision
        return Gaussian.fromNatural(sumLog, 0.0);
    }

    @Override
    public Gaussian messageToWeight(Gaussian lambda, double sumLog) {
        if (lambda.isUniform()) {
            return Gaussian.uniform();
        }
        if (lambda.isPointMass()) {
            double weight = BoxCoxMath.jacobianWeight(lambda.getPoint(), sumLog);
            if (!Double.isFinite(weight)) {
                logger.debug("Jacobian weight overflowed (lambda={}, sumLog={}), returning uniform", lambda, sumLog);
                return Gaussian.uniform();
            }
            return Gaussian.pointMass(weight);
        }
        if (!lambda.isProper()) {
            logger.debug("Improper lambda {} has no moments, weight message is uniform", lambda);
            return Gaussian.uniform();
        }

        double mean = lambda.getMean();
        double variance = lambda.getVariance();
        double s2 = sumLog * sumLog;

        double meanWeight = Math.exp((mean - 1.0) * sumLog + 0.5 * variance * s2);
        double varianceWeight = meanWeight * meanWeight * Math.expm1(variance * s2);
        varianceWeight = Math.max(varianceWeight, minVariance);

        if (!Double.isFinite(meanWeight) || !Double.isFinite(varianceWeight)) {
            logger.debug("Log-normal weight moments overflowed (lambda={}, sumLog={}), returning uniform",
                    lambda, sumLog);
            return Gaussian.uniform();
        }
        return Gaussian.fromMeanAndVariance(meanWeight, varianceWeight);
    }

    @Override
    public double logAverageFactor(double sumLog, Gaussian lambda) {
        if (lambda.isUniform()) {
            return 0.0;
        }
        if (lambda.isPointMass()) {
            return (lambda.getPoint() - 1.0) * sumLog;
        }
        if (!lambda.isProper()) {
            return 0.0;
        }
        return (lambda.getMean() - 1.0) * sumLog + 0.5 * lambda.getVariance() * sumLog * sumLog;
    }
}
