package com.boxcoxep.core.inference;

import com.boxcoxep.core.factor.FactorArguments;

@FunctionalInterface
public interface EvidenceOperator {
    /**
     * Log-evidence contribution of a factor given the current beliefs of its arguments.
     */
    double logEvidence(FactorArguments args);
}
