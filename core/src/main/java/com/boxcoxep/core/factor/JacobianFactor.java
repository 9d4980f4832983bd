package com.boxcoxep.core.factor;

import com.boxcoxep.core.belief.Beliefs;
import com.boxcoxep.core.belief.Gaussian;

/**
 * Messages for the reweighting factor {@code w = exp((lambda - 1) * sumLog)}.
 */
public interface JacobianFactor {

    Gaussian messageToLambda(double sumLog, Gaussian lambda);

    default Gaussian messageToLambda(Gaussian sumLog, Gaussian lambda) {
        return messageToLambda(Beliefs.meanOf(sumLog), lambda);
    }

    Gaussian messageToWeight(Gaussian lambda, double sumLog);

    default Gaussian messageToWeight(Gaussian lambda, Gaussian sumLog) {
        return messageToWeight(lambda, Beliefs.meanOf(sumLog));
    }

    double logAverageFactor(double sumLog, Gaussian lambda);

    default double logAverageFactor(Gaussian sumLog, Gaussian lambda) {
        return logAverageFactor(Beliefs.meanOf(sumLog), lambda);
    }

    default double logEvidenceRatio(double sumLog, Gaussian lambda) {
        return logAverageFactor(sumLog, lambda);
    }

    default double logEvidenceRatio(Gaussian sumLog, Gaussian lambda) {
        return logAverageFactor(Beliefs.meanOf(sumLog), lambda);
    }
}
