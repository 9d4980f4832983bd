package com.boxcoxep.core.math;

/**
 * Moments of lambda and of the transformed value under the tilted lambda density,
 * produced fresh by every {@link SimpsonQuadrature#computeIntegralStats} call.
 */
public final class IntegralStats {

    private final double norm;
    private final double lambdaMean;
    private final double lambdaSecondMoment;
    private final double zMean;
    private final double zSecondMoment;
    private final double logNormalizer;
    private final boolean fallback;

    public IntegralStats(double norm, double lambdaMean, double lambdaSecondMoment, double zMean,
            double zSecondMoment, double logNormalizer, boolean fallback) {
        this.norm = norm;
        this.lambdaMean = lambdaMean;
        this.lambdaSecondMoment = lambdaSecondMoment;
        this.zMean = zMean;
        this.zSecondMoment = zSecondMoment;
        this.logNormalizer = logNormalizer;
        this.fallback = fallback;
    }

    public double getNorm() {
        return norm;
    }

    public double getLambdaMean() {
        return lambdaMean;
    }

    public double getLambdaSecondMoment() {
        return lambdaSecondMoment;
    }

    public double getZMean() {
        return zMean;
    }

    public double getZSecondMoment() {
        return zSecondMoment;
    }

    /**
     * Natural log of the normalizer. When {@link #isFallback()} is set this comes from a
     * clamped, near-zero integral and is only an approximation, not a verified bound.
     */
    public double getLogNormalizer() {
        return logNormalizer;
    }

    public boolean isFallback() {
        return fallback;
    }

    public double lambdaVariance(double floor) {
        return Math.max(lambdaSecondMoment - lambdaMean * lambdaMean, floor);
    }

    public double zVariance(double floor) {
        return Math.max(zSecondMoment - zMean * zMean, floor);
    }

    @Override
    public String toString() {
        return "IntegralStats{" +
                "norm=" + norm +
                ", lambdaMean=" + lambdaMean +
                ", lambdaSecondMoment=" + lambdaSecondMoment +
                ", zMean=" + zMean +
                ", zSecondMoment=" + zSecondMoment +
                ", logNormalizer=" + logNormalizer +
                ", fallback=" + fallback +
                '}';
    }
}
