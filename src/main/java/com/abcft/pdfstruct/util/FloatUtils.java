package com.abcft.pdfstruct.util;

import org.apache.commons.math3.util.FastMath;

/**
 * Tolerant comparisons for layout coordinates.
 */
public final class FloatUtils {

    public static final double EPSILON = 0.01;

    private FloatUtils() {}

    public static boolean feq(double a, double b) {
        return feq(a, b, EPSILON);
    }

    public static boolean feq(double a, double b, double epsilon) {
        return FastMath.abs(a - b) < epsilon;
    }

    /**
     * a >= b within epsilon.
     */
    public static boolean fgte(double a, double b, double epsilon) {
        return feq(a, b, epsilon) || a > b;
    }

    /**
     * a <= b within epsilon.
     */
    public static boolean flte(double a, double b, double epsilon) {
        return feq(a, b, epsilon) || a < b;
    }

    public static boolean isFinite(double... values) {
        for (double v : values) {
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                return false;
            }
        }
        return true;
    }

}
