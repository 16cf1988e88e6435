package ai.fingerprint.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Arithmetic helpers. A missing value is represented by {@code null}, never by zero or NaN.
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * Divides {@code numerator} by every denominator in turn.
     *
     * @return null if any denominator is zero or missing, or the numerator is missing
     */
    public static Double safeDivide(Double numerator, double... denominators) {
        if (denominators.length == 0) {
            throw new IllegalArgumentException("At least one denominator is required");
        }
        if (numerator == null) {
            return null;
        }
        double result = numerator;
        for (double denominator : denominators) {
            if (denominator == 0) {
                return null;
            }
            result /= denominator;
        }
        return result;
    }

    public static Double safeDivide(Double numerator, Double denominator) {
        if (denominator == null) {
            return null;
        }
        return safeDivide(numerator, new double[]{denominator});
    }

    /**
     * Relative difference between {@code x1} and {@code x2}. The change is measured relative to
     * the magnitude of {@code x1}: going from -100 to -90 is a growth of 0.1.
     */
    public static Double growth(Double x2, Double x1) {
        if (x2 == null || x1 == null) {
            return null;
        }
        double sign = x1 < 0 ? -1 : 1;
        return safeDivide(sign * (x2 - x1), x1);
    }

    /**
     * floor(log10(|x|)), 0 for 0.
     */
    public static long orderOfMagnitude(double x) {
        if (x == 0) {
            return 0;
        }
        return (long) Math.floor(Math.log10(Math.abs(x)));
    }

    public static double roundToDecimals(int decimals, double x) {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            return x;
        }
        return BigDecimal.valueOf(x).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Largest multiple of {@code precision} not greater than {@code x}.
     */
    public static double floorTo(double precision, double x) {
        double scale = 1 / precision;
        return Math.floor(x * scale) / scale;
    }

    /**
     * Smallest multiple of {@code precision} not less than {@code x}.
     */
    public static double ceilTo(double precision, double x) {
        double scale = 1 / precision;
        return Math.ceil(x * scale) / scale;
    }

    /**
     * Converts NaN produced by estimators over too few values into a missing value.
     */
    public static Double finiteOrNull(double x) {
        return Double.isNaN(x) || Double.isInfinite(x) ? null : x;
    }

    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new ClassCastException(String.format("%s is not a number", value.getClass().getName()));
    }
}
