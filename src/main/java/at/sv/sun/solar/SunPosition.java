package at.sv.sun.solar;

import java.util.Locale;

/**
 * Apparent position of the sun.
 *
 * @param azimuth   degrees clockwise from true north [0..360)
 * @param elevation degrees above (positive) or below (negative) the horizon
 */
public record SunPosition(double azimuth, double elevation) {

    public boolean isAboveHorizon() {
        return elevation > 0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "[azimuth=%.2f°, elevation=%.2f°]", azimuth, elevation);
    }
}
