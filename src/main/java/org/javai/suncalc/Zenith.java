package org.javai.suncalc;

/**
 * Solar zenith angle at which the sun counts as rising or setting.
 */
public enum Zenith {
    /**
     * Upper limb on the horizon, including standard refraction and the sun's apparent radius.
     */
    OFFICIAL(90.833),

    /**
     * Centre of the sun 6 degrees below the horizon.
     */
    CIVIL(96),

    /**
     * Centre of the sun 12 degrees below the horizon.
     */
    NAUTICAL(102),

    /**
     * Centre of the sun 18 degrees below the horizon.
     */
    ASTRONOMICAL(108);

    private final double degrees;

    Zenith(double degrees) {
        this.degrees = degrees;
    }

    public double degrees() {
        return degrees;
    }
}
