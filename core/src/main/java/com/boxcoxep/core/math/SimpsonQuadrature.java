package com.boxcoxep.core.math;

import com.boxcoxep.core.belief.Beliefs;
import com.boxcoxep.core.belief.Gaussian;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composite Simpson integration of the lambda belief tilted by the likelihood of the
 * transformed value.
 *
 * For a lambda belief q(lambda), an output belief p(z) and an observation y it computes
 * Z = integral of q(lambda) * p(BoxCox(y, lambda)) over mean +/- k sigma, together with the
 * normalized first and second moments of lambda and of z = BoxCox(y, lambda).
 * Weights are accumulated relative to the largest log-weight on the grid so that the sum
 * does not underflow.
 */
public class SimpsonQuadrature {

    private static final Logger logger = LoggerFactory.getLogger(SimpsonQuadrature.class);

    private final QuadratureSettings settings;

    public SimpsonQuadrature(QuadratureSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.settings = settings;
    }

    public QuadratureSettings getSettings() {
        return settings;
    }

    public IntegralStats computeIntegralStats(Gaussian lambda, Gaussian z, double y) {
        InvalidObservationException.requirePositive(y, "Box-Cox observation");
        double pointMassVariance = settings.getPointMassVariance();

        // 1. Deterministic lambda: everything collapses onto a single transform value
        if (lambda.isPointMass()) {
            double lambdaVal = lambda.getPoint();
            double zVal = BoxCoxMath.transform(y, lambdaVal);
            double logLike = Beliefs.logLikelihood(z, zVal, pointMassVariance);
            return new IntegralStats(1.0, lambdaVal, lambdaVal * lambdaVal, zVal, zVal * zVal, logLike, false);
        }

        // 2. Integration window
        double meanLambda;
        double varianceLambda;
        if (lambda.isProper()) {
            meanLambda = lambda.getMean();
            varianceLambda = lambda.getVariance();
        } else {
            meanLambda = settings.getFallbackMean();
            varianceLambda = settings.getFallbackVariance();
        }
        varianceLambda = Math.max(varianceLambda, settings.getMinVariance());
        double halfWidth = settings.getTruncationStdDevs() * Math.sqrt(varianceLambda);
        double lower = meanLambda - halfWidth;
        int steps = settings.getSteps();
        double h = 2.0 * halfWidth / steps;

        // 3. Log-weights on the grid
        double[] lambdaVals = new double[steps + 1];
        double[] transformVals = new double[steps + 1];
        double[] logWeights = new double[steps + 1];
        for (int i = 0; i <= steps; i++) {
            double lambdaVal = lower + i * h;
            double transformVal = BoxCoxMath.transform(y, lambdaVal);
            lambdaVals[i] = lambdaVal;
            transformVals[i] = transformVal;
            logWeights[i] = Beliefs.logDensity(lambda, lambdaVal)
                    + Beliefs.logLikelihood(z, transformVal, pointMassVariance);
        }
        double maxLogWeight = MathUtil.max(logWeights);

        // 4. Simpson sums in the rescaled domain
        double sumW = 0.0;
        double sumLambda = 0.0;
        double sumLambda2 = 0.0;
        double sumZ = 0.0;
        double sumZ2 = 0.0;
        for (int i = 0; i <= steps; i++) {
            double weight = MathUtil.simpsonCoefficient(i, steps) * Math.exp(logWeights[i] - maxLogWeight);
            if (weight == 0.0) {
                continue;
            }
            double lambdaVal = lambdaVals[i];
            double zVal = transformVals[i];
            sumW += weight;
            sumLambda += weight * lambdaVal;
            sumLambda2 += weight * lambdaVal * lambdaVal;
            sumZ += weight * zVal;
            sumZ2 += weight * zVal * zVal;
        }

        double scale = h / 3.0;
        double integral = sumW * scale;

        // 5. Degenerate integral: moments from the lambda mean, clamped normalizer
        if (!(integral > 0.0) || Double.isInfinite(integral)
                || !Double.isFinite(sumZ2) || !Double.isFinite(sumLambda2)) {
            double fallbackZ = BoxCoxMath.transform(y, meanLambda);
            double clamped = Double.isNaN(integral) ? Double.MIN_VALUE : Math.max(Double.MIN_VALUE, integral);
            double logNormalizer = maxLogWeight + Math.log(clamped);
            if (logger.isDebugEnabled()) {
                logger.debug("Quadrature degenerate (integral={}, maxLogWeight={}) for y={}, lambda={}, z={}; "
                        + "falling back to lambda mean", integral, maxLogWeight, y, lambda, z);
            }
            return new IntegralStats(
                    Double.MIN_VALUE,
                    meanLambda,
                    meanLambda * meanLambda + varianceLambda,
                    fallbackZ,
                    fallbackZ * fallbackZ + settings.getMinVariance(),
                    logNormalizer,
                    true);
        }

        // 6. Normalize
        return new IntegralStats(
                integral,
                sumLambda * scale / integral,
                sumLambda2 * scale / integral,
                sumZ * scale / integral,
                sumZ2 * scale / integral,
                maxLogWeight + Math.log(integral),
                false);
    }
}
