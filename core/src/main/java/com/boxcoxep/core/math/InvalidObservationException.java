package com.boxcoxep.core.math;

/**
 * Thrown when an observation that has to go through a logarithm is not strictly positive
 * (or not finite).
 */
public class InvalidObservationException extends IllegalArgumentException {

    private final double value;

    public InvalidObservationException(String message, double value) {
        super(message + ", got: " + value);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    public static double requirePositive(double y, String what) {
        if (!(y > 0.0) || Double.isInfinite(y)) {
            throw new InvalidObservationException(what + " must be strictly positive and finite", y);
        }
        return y;
    }
}
