package org.javai.suncalc;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import org.javai.suncalc.outcome.Outcome;
import org.javai.suncalc.outcome.PolarCondition;

/**
 * Solar noon, sunrise, sunset and daylight duration of one date at one place.
 *
 * @param date The calendar date (UTC)
 * @param latitude Latitude in degrees
 * @param longitude Longitude in degrees
 * @param noon Solar noon
 * @param rise Sunrise, or the domain error when the sun does not rise or set
 * @param set Sunset, or the domain error when the sun does not rise or set
 * @param daylight Length of the day
 */
public record SolarDay(
        LocalDate date,
        double latitude,
        double longitude,
        Instant noon,
        Outcome<Instant> rise,
        Outcome<Instant> set,
        Duration daylight
) {

    private static final Duration FULL_DAY = Duration.ofHours(24);

    public SolarDay {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(noon, "noon must not be null");
        Objects.requireNonNull(rise, "rise must not be null");
        Objects.requireNonNull(set, "set must not be null");
        Objects.requireNonNull(daylight, "daylight must not be null");
    }

    /**
     * Polar day or polar night when the sun neither rises nor sets, judged by the daylight duration.
     * Empty on an ordinary day.
     */
    public Optional<PolarCondition> polarCondition() {
        if (rise.isOk()) {
            return Optional.empty();
        }
        if (daylight.equals(FULL_DAY)) {
            return Optional.of(PolarCondition.POLAR_DAY);
        }
        if (daylight.isZero()) {
            return Optional.of(PolarCondition.POLAR_NIGHT);
        }
        return Optional.empty();
    }
}
