package org.javai.suncalc;

import static org.javai.suncalc.Angles.degrees;
import static org.javai.suncalc.Angles.modulo;
import static org.javai.suncalc.Angles.radians;

/**
 * Orbital elements of the sun for a time given in Julian centuries since J2000.0.
 *
 * <p>Low-precision NOAA solar calculator formulas, good to about a minute for dates within a few
 * centuries of 2000. Every method is a pure function of {@code t}.
 *
 * @see <a href="https://gml.noaa.gov/grad/solcalc/calcdetails.html">NOAA solar calculations</a>
 */
public final class Orbit {

    /** Java time on Jan 1, 2000 12:00 UTC. */
    public static final long J2000_EPOCH_MILLIS = 946_728_000_000L;

    /** One Julian century of 36525 days. */
    public static final long MILLIS_PER_CENTURY = 3_155_760_000_000L;

    /** Days in a Julian century. */
    static final double DAYS_PER_CENTURY = 36525;

    private Orbit() {} // Disallow instantiation

    /**
     * Fraction of Julian centuries elapsed since 2000-01-01T12:00:00Z.
     *
     * @param timestampMillis unix timestamp in milliseconds
     */
    public static double centuryFraction(long timestampMillis) {
        return (double) (timestampMillis - J2000_EPOCH_MILLIS) / MILLIS_PER_CENTURY;
    }

    /**
     * Same as {@link #centuryFraction(long)} for a fractional timestamp, which is first rounded to
     * the nearest millisecond.
     */
    public static double centuryFraction(double timestampMillis) {
        return centuryFraction(Math.round(timestampMillis));
    }

    /**
     * Sun's mean longitude in degrees, within [0, 360).
     */
    public static double meanLongitude(double t) {
        double l = modulo(280.46646 + t * (36000.76983 + t * 0.0003032), 360);
        return l < 0 ? l + 360 : l;
    }

    /**
     * Sun's mean anomaly in degrees. Not range-reduced.
     */
    public static double meanAnomaly(double t) {
        return 357.52911 + t * (35999.05029 - 0.0001537 * t);
    }

    /**
     * Eccentricity of Earth's orbit (unitless).
     */
    public static double orbitEccentricity(double t) {
        return 0.016708634 - t * (0.000042037 + 0.0000001267 * t);
    }

    public static double equationOfCenter(double t) {
        double m = radians(meanAnomaly(t));
        double sinm = Math.sin(m);
        double sin2m = Math.sin(m * 2);
        double sin3m = Math.sin(m * 3);

        return sinm * (1.914602 - t * (0.004817 + 0.000014 * t)) + sin2m * (0.019993 - 0.000101 * t)
                + sin3m * 0.000289;
    }

    public static double trueLongitude(double t) {
        return meanLongitude(t) + equationOfCenter(t);
    }

    /**
     * True longitude corrected for nutation and aberration.
     */
    public static double apparentLongitude(double t) {
        return trueLongitude(t) - 0.00569 - 0.00478 * Math.sin(radians(125.04 - 1934.136 * t));
    }

    /**
     * Obliquity of the ecliptic in degrees, including the nutation term.
     */
    public static double obliquityOfEcliptic(double t) {
        double e0 = 23 + (26 + (21.448 - t * (46.815 + t * (0.00059 - t * 0.001813))) / 60) / 60;
        double omega = 125.04 - 1934.136 * t;

        return e0 + 0.00256 * Math.cos(radians(omega));
    }

    /**
     * Solar declination in degrees; positive while the sun is over the northern hemisphere.
     */
    public static double declination(double t) {
        return degrees(Math.asin(Math.sin(radians(obliquityOfEcliptic(t))) * Math.sin(radians(apparentLongitude(t)))));
    }

    /**
     * Equation of time: apparent minus mean solar time, in minutes.
     */
    public static double equationOfTime(double t) {
        double epsilon = obliquityOfEcliptic(t);
        double l0 = meanLongitude(t);
        double e = orbitEccentricity(t);
        double m = meanAnomaly(t);
        double y = Math.pow(Math.tan(radians(epsilon) / 2), 2);
        double sin2l0 = Math.sin(2 * radians(l0));
        double sinm = Math.sin(radians(m));
        double cos2l0 = Math.cos(2 * radians(l0));
        double sin4l0 = Math.sin(4 * radians(l0));
        double sin2m = Math.sin(2 * radians(m));

        double etime = y * sin2l0 - 2 * e * sinm + 4 * e * y * sinm * cos2l0 - 0.5 * y * y * sin4l0
                - 1.25 * e * e * sin2m;

        // four minutes of time per degree of rotation
        return degrees(etime) * 4;
    }
}
