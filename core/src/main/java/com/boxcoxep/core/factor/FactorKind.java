package com.boxcoxep.core.factor;

public enum FactorKind {
    // z = BoxCox(y, lambda)
    TRANSFORM,
    // w = exp((lambda - 1) * sumLog)
    JACOBIAN
}
