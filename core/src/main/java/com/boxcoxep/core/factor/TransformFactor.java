package com.boxcoxep.core.factor;

import com.boxcoxep.core.belief.Beliefs;
import com.boxcoxep.core.belief.Gaussian;

/**
 * Messages for the deterministic factor {@code output = BoxCox(y, lambda)}.
 * The {@link Gaussian}-valued {@code y} overloads collapse the observation to its mean.
 */
public interface TransformFactor {

    Gaussian messageToOutput(double y, Gaussian lambda);

    default Gaussian messageToOutput(Gaussian y, Gaussian lambda) {
        return messageToOutput(Beliefs.meanOf(y), lambda);
    }

    Gaussian messageToLambda(Gaussian output, double y, Gaussian lambda);

    default Gaussian messageToLambda(Gaussian output, Gaussian y, Gaussian lambda) {
        return messageToLambda(output, Beliefs.meanOf(y), lambda);
    }

    double logAverageFactor(Gaussian output, double y, Gaussian lambda);

    default double logAverageFactor(Gaussian output, Gaussian y, Gaussian lambda) {
        return logAverageFactor(output, Beliefs.meanOf(y), lambda);
    }

    // deterministic factor: the evidence ratio equals the average factor
    default double logEvidenceRatio(Gaussian output, double y, Gaussian lambda) {
        return logAverageFactor(output, y, lambda);
    }

    default double logEvidenceRatio(Gaussian output, Gaussian y, Gaussian lambda) {
        return logAverageFactor(output, Beliefs.meanOf(y), lambda);
    }
}
