package org.javai.suncalc.outcome;

/**
 * Why a place has no sunrise or sunset on a given date.
 */
public enum PolarCondition {
    /**
     * The sun stays above the horizon for the whole day (midnight sun).
     */
    POLAR_DAY,

    /**
     * The sun stays below the horizon for the whole day.
     */
    POLAR_NIGHT,

    /**
     * The computation broke down numerically, typically a latitude outside [-90, 90].
     */
    UNDEFINED
}
