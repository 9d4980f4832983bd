package com.boxcoxep.core.inference;

import com.boxcoxep.core.belief.Gaussian;
import com.boxcoxep.core.factor.FactorArguments;

@FunctionalInterface
public interface MessageOperator {
    /**
     * Compute the outgoing message from a factor to one of its variables.
     * Must be a pure function of {@code args}.
     */
    Gaussian compute(FactorArguments args);
}
