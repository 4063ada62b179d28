package org.javai.suncalc.outcome;

import java.util.Objects;

/**
 * The hour-angle cosine ratio fell outside (-1, 1), so {@code acos} is undefined and there is no
 * sunrise or sunset to report for the place and date.
 *
 * @param ratio The cosine ratio that was out of range (may be NaN for out-of-range latitudes)
 * @param message Human-readable description
 */
public record DomainError(double ratio, String message) {

    public DomainError {
        Objects.requireNonNull(message, "message must not be null");
        if (ratio > -1 && ratio < 1) {
            throw new IllegalArgumentException("ratio " + ratio + " is inside the domain of acos");
        }
    }

    /**
     * Creates the error for an hour-angle ratio outside the domain of {@code acos}.
     */
    public static DomainError undefinedHourAngle(double ratio) {
        return new DomainError(ratio, "acos is not defined for " + ratio);
    }

    /**
     * Reads the physical condition off the ratio: at or above 1 the sun stays below the horizon,
     * at or below -1 it stays above it.
     */
    public PolarCondition condition() {
        if (ratio >= 1) {
            return PolarCondition.POLAR_NIGHT;
        } else if (ratio <= -1) {
            return PolarCondition.POLAR_DAY;
        }
        return PolarCondition.UNDEFINED;
    }
}
