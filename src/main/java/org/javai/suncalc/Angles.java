package org.javai.suncalc;

/**
 * Angle conversions and the floored modulo used throughout the solar formulas.
 */
public final class Angles {

    private Angles() {} // Disallow instantiation

    public static double radians(double degrees) {
        return Math.PI * degrees / 180;
    }

    public static double degrees(double radians) {
        return 180 * radians / Math.PI;
    }

    /**
     * Modulo defined as floor division, so the result takes the sign of the divisor.
     * Unlike {@code %}, {@code modulo(-10, 360)} is {@code 350}.
     */
    public static double modulo(double dividend, double divisor) {
        return dividend - Math.floor(dividend / divisor) * divisor;
    }
}
