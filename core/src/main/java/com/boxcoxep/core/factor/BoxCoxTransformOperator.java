package com.boxcoxep.core.factor;

import com.boxcoxep.core.belief.Beliefs;
import com.boxcoxep.core.belief.Gaussian;
import com.boxcoxep.core.math.BoxCoxMath;
import com.boxcoxep.core.math.IntegralStats;
import com.boxcoxep.core.math.InvalidObservationException;
import com.boxcoxep.core.math.QuadratureSettings;
import com.boxcoxep.core.math.SimpsonQuadrature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * EP operator for {@code z = BoxCox(y, lambda)} with y observed.
 *
 * Proper lambda beliefs go through {@link SimpsonQuadrature} and are moment matched; point
 * masses and uniform beliefs are answered in closed form. Stateless and thread safe.
 */
public class BoxCoxTransformOperator implements TransformFactor {

    private static final Logger logger = LoggerFactory.getLogger(BoxCoxTransformOperator.class);

    private final SimpsonQuadrature quadrature;
    private final QuadratureSettings settings;

    public BoxCoxTransformOperator() {
        this(QuadratureSettings.defaults());
    }

    public BoxCoxTransformOperator(QuadratureSettings settings) {
        this.quadrature = new SimpsonQuadrature(settings);
        this.settings = settings;
    }

    public QuadratureSettings getSettings() {
        return settings;
    }

    @Override
    public Gaussian messageToOutput(double y, Gaussian lambda) {
        InvalidObservationException.requirePositive(y, "Box-Cox observation");
        if (lambda.isPointMass()) {
            double transformed = BoxCoxMath.transform(y, lambda.getPoint());
            if (!Double.isFinite(transformed)) {
                logger.debug("Transform overflowed (y={}, lambda={}), output message is uniform", y, lambda);
                return Gaussian.uniform();
            }
            return Gaussian.pointMass(transformed);
        }
        if (lambda.isUniform()) {
            return Gaussian.uniform();
        }

        // The output's own belief is left out so the message does not feed back on itself
        IntegralStats stats = quadrature.computeIntegralStats(lambda, Gaussian.uniform(), y);
        double mean = stats.getZMean();
        double variance = stats.zVariance(settings.getMinVariance());
        if (logger.isTraceEnabled()) {
            logger.trace("messageToOutput y={} lambda={} -> mean={} variance={} (fallback={})",
                    y, lambda, mean, variance, stats.isFallback());
        }
        if (!Double.isFinite(mean) || !Double.isFinite(variance)) {
            logger.debug("Matched output moments overflowed (y={}, lambda={}), output message is uniform",
                    y, lambda);
            return Gaussian.uniform();
        }
        return Gaussian.fromMeanAndVariance(mean, variance);
    }

    @Override
    public Gaussian messageToLambda(Gaussian output, double y, Gaussian lambda) {
        InvalidObservationException.requirePositive(y, "Box-Cox observation");
        if (lambda.isUniform() || output.isUniform()) {
            return Gaussian.uniform();
        }
        if (lambda.isPointMass()) {
            return Gaussian.pointMass(lambda.getPoint());
        }

        IntegralStats stats = quadrature.computeIntegralStats(lambda, output, y);
        Gaussian posterior = Gaussian.fromMeanAndVariance(stats.getLambdaMean(),
                stats.lambdaVariance(settings.getMinVariance()));
        Gaussian message = Beliefs.divide(posterior, lambda, true, settings.getPrecisionFloor());
        if (logger.isTraceEnabled()) {
            logger.trace("messageToLambda y={} lambda={} output={} -> posterior={} message={} (fallback={})",
                    y, lambda, output, posterior, message, stats.isFallback());
        }
        return message;
    }

    @Override
    public double logAverageFactor(Gaussian output, double y, Gaussian lambda) {
        InvalidObservationException.requirePositive(y, "Box-Cox observation");
        if (lambda.isUniform()) {
            return 0.0;
        }
        if (lambda.isPointMass()) {
            double transformed = BoxCoxMath.transform(y, lambda.getPoint());
            return Beliefs.logLikelihood(output, transformed, settings.getPointMassVariance());
        }
        return quadrature.computeIntegralStats(lambda, output, y).getLogNormalizer();
    }
}
