package org.javai.suncalc;

import static org.javai.suncalc.Angles.degrees;
import static org.javai.suncalc.Angles.radians;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import org.javai.suncalc.outcome.DomainError;
import org.javai.suncalc.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solar noon, sunrise, sunset and daylight duration for a date, latitude and longitude.
 *
 * <p>All times are UTC. Timestamps are unix milliseconds; a {@link LocalDate} stands for midnight
 * UTC of that date. Where the sun does not rise or set (polar day or polar night) sunrise and sunset
 * come back as {@link Outcome.Fail} carrying the {@link DomainError}.
 *
 * <pre>{@code
 * Outcome<Instant> rise = Sun.rise(LocalDate.of(2017, 1, 1), 50.0598054, 14.3251989);
 * // Ok[value=2017-01-01T07:01:40.231Z]
 * }</pre>
 */
public final class Sun {

    private static final Logger LOG = LoggerFactory.getLogger(Sun.class);

    private static final long MILLIS_PER_HOUR = 3_600_000L;

    /** Declination threshold separating polar day from polar night, matching the official zenith. */
    private static final double POLAR_DECLINATION_THRESHOLD = 0.833;

    private static final Duration FULL_DAY = Duration.ofHours(24);

    private Sun() {} // Disallow instantiation

    /**
     * Unix timestamp in milliseconds of solar noon on the day of {@code timestampMillis}.
     *
     * @param timestampMillis midnight UTC of the day, in unix milliseconds
     * @param longitude longitude in degrees, east positive
     */
    public static long noon(long timestampMillis, double longitude) {
        // First approximation
        double t = Orbit.centuryFraction(timestampMillis + (12 - longitude * 24 / 360) * MILLIS_PER_HOUR);

        // Exactly two corrections
        double o1 = 720 - longitude * 4 - Orbit.equationOfTime(t - longitude / (360 * Orbit.DAYS_PER_CENTURY));
        double o2 = 720 - longitude * 4 - Orbit.equationOfTime(t + o1 / (1440 * Orbit.DAYS_PER_CENTURY));

        return Math.round(timestampMillis + o2 * 1000 * 60);
    }

    /**
     * Solar noon of {@code date} at {@code longitude}.
     */
    public static Instant noon(LocalDate date, double longitude) {
        return Instant.ofEpochMilli(noon(midnightMillis(date), longitude));
    }

    public static Outcome<Instant> rise(LocalDate date, double latitude, double longitude) {
        return rise(midnightMillis(date), latitude, longitude, Zenith.OFFICIAL);
    }

    public static Outcome<Instant> rise(LocalDate date, double latitude, double longitude, Zenith zenith) {
        return rise(midnightMillis(date), latitude, longitude, zenith);
    }

    public static Outcome<Instant> rise(long timestampMillis, double latitude, double longitude) {
        return rise(timestampMillis, latitude, longitude, Zenith.OFFICIAL);
    }

    /**
     * Sunrise for the day of {@code timestampMillis}: solar noon shifted back by the hour angle.
     *
     * @return the sunrise, or the domain error when the sun does not cross {@code zenith} that day
     */
    public static Outcome<Instant> rise(long timestampMillis, double latitude, double longitude, Zenith zenith) {
        long noon = noon(timestampMillis, longitude);
        // the rise hour angle is negative, so adding it moves before noon
        return hourAngle(noon, latitude, zenith)
                .map(angle -> Instant.ofEpochMilli(Math.round(noon + angle * 4 * 1000 * 60)));
    }

    public static Outcome<Instant> set(LocalDate date, double latitude, double longitude) {
        return set(midnightMillis(date), latitude, longitude, Zenith.OFFICIAL);
    }

    public static Outcome<Instant> set(LocalDate date, double latitude, double longitude, Zenith zenith) {
        return set(midnightMillis(date), latitude, longitude, zenith);
    }

    public static Outcome<Instant> set(long timestampMillis, double latitude, double longitude) {
        return set(timestampMillis, latitude, longitude, Zenith.OFFICIAL);
    }

    /**
     * Sunset for the day of {@code timestampMillis}: solar noon shifted forward by the hour angle.
     *
     * @return the sunset, or the domain error when the sun does not cross {@code zenith} that day
     */
    public static Outcome<Instant> set(long timestampMillis, double latitude, double longitude, Zenith zenith) {
        long noon = noon(timestampMillis, longitude);
        return hourAngle(noon, latitude, zenith)
                .map(angle -> Instant.ofEpochMilli(Math.round(noon - angle * 4 * 1000 * 60)));
    }

    /**
     * Length of daylight on {@code date}, rounded to whole minutes.
     *
     * <p>Where the sun does not rise or set, the answer is exactly 24 hours or zero, decided by the
     * declination against the latitude's hemisphere. Longitude does not affect the result.
     *
     * @param date calendar date (UTC)
     * @param latitude latitude in degrees
     * @param longitude longitude in degrees, unused
     */
    public static Duration hours(LocalDate date, double latitude, double longitude) {
        long timestamp = midnightMillis(date);

        return hourAngle(timestamp, latitude).fold(
                delta -> Duration.ofMinutes(Math.round(8 * -delta)),
                error -> polarDaylight(timestamp, latitude));
    }

    /**
     * Noon, rise, set and daylight of {@code date} in one value.
     */
    public static SolarDay day(LocalDate date, double latitude, double longitude) {
        long timestamp = midnightMillis(date);
        return new SolarDay(
                date,
                latitude,
                longitude,
                Instant.ofEpochMilli(noon(timestamp, longitude)),
                rise(timestamp, latitude, longitude),
                set(timestamp, latitude, longitude),
                hours(date, latitude, longitude));
    }

    public static Outcome<Double> hourAngle(long timestampMillis, double latitude) {
        return hourAngle(timestampMillis, latitude, Zenith.OFFICIAL);
    }

    /**
     * Hour angle of sunrise in degrees, negative, for the declination at {@code timestampMillis}.
     * Sunset is the same angle with the sign flipped.
     *
     * @param timestampMillis time at which the declination is evaluated, usually solar noon
     * @param latitude latitude in degrees
     * @param zenith zenith angle that counts as sunrise
     * @return the angle, or a {@link DomainError} carrying the cosine ratio when it is outside (-1, 1)
     * @see <a href="https://en.wikipedia.org/wiki/Hour_angle">Hour angle</a>
     */
    public static Outcome<Double> hourAngle(long timestampMillis, double latitude, Zenith zenith) {
        Objects.requireNonNull(zenith, "zenith must not be null");
        double phi = radians(latitude);
        double theta = radians(Orbit.declination(Orbit.centuryFraction(timestampMillis)));

        double ratio = Math.cos(radians(zenith.degrees())) / (Math.cos(phi) * Math.cos(theta))
                - Math.tan(phi) * Math.tan(theta);

        if (ratio > -1 && ratio < 1) {
            return Outcome.ok(-degrees(Math.acos(ratio)));
        }

        DomainError error = DomainError.undefinedHourAngle(ratio);
        LOG.debug("No {} hour angle at {} ms for latitude {}: {}",
                zenith, timestampMillis, latitude, error.message());
        return Outcome.fail(error);
    }

    private static Duration polarDaylight(long timestampMillis, double latitude) {
        double declination = Orbit.declination(Orbit.centuryFraction(timestampMillis));

        // positive declination puts the sun over the northern hemisphere
        boolean polarDay = latitude < 0
                ? declination < POLAR_DECLINATION_THRESHOLD
                : declination > -POLAR_DECLINATION_THRESHOLD;

        LOG.debug("Polar {} at {} ms for latitude {} (declination {})",
                polarDay ? "day" : "night", timestampMillis, latitude, declination);
        return polarDay ? FULL_DAY : Duration.ZERO;
    }

    private static long midnightMillis(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
}
