package com.boxcoxep.core.math;

public class MathUtil {

    /**
     * Composite Simpson coefficient for abscissa {@code i} of an even {@code steps} grid:
     * 1, 4, 2, 4, ..., 2, 4, 1.
     */
    public static double simpsonCoefficient(int i, int steps) {
        if (i == 0 || i == steps) {
            return 1.0;
        }
        return (i % 2 == 0) ? 2.0 : 4.0;
    }

    public static int evenSteps(int steps) {
        if (steps < 2) {
            throw new IllegalArgumentException("Simpson integration needs at least 2 steps, got: " + steps);
        }
        return (steps % 2 == 1) ? steps + 1 : steps;
    }

    public static double clamp(double x, double lo, double hi) {
        return Math.max(lo, Math.min(hi, x));
    }

    /**
     * Returns the maximum value in the array, or -inf for an empty one.
     */
    public static double max(double[] x) {
        double best = Double.NEGATIVE_INFINITY;
        for (double v : x) {
            if (v > best) {
                best = v;
            }
        }
        return best;
    }

}
