package com.boxcoxep.core.factor;

/**
 * Argument roles shared by the Box-Cox factors.
 */
public enum Role {
    /** The factor's value: the transformed z, or the Jacobian weight. */
    OUTPUT,
    LAMBDA,
    /** The observed input: y for the transform, the sum of logs for the Jacobian. */
    OBSERVATION
}
