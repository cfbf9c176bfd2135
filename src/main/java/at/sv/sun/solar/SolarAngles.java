package at.sv.sun.solar;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Equation of time and solar declination for a point in the year.
 * <p>
 * Both are truncated Fourier series of the fractional year, see:
 * <a href="https://gml.noaa.gov/grad/solcalc/solareqns.PDF">NOAA General Solar Position Calculations</a>
 *
 * @param equationOfTime difference between true and mean solar time, in minutes
 * @param declination    angle between the sun and the celestial equator, in radians
 */
public record SolarAngles(double equationOfTime, double declination) {

    private static final double FULL_CIRCLE = 2.0 * Math.PI;

    /**
     * @param fractionalYear the position in the year, in radians [0..2π]
     */
    public static SolarAngles forFractionalYear(double fractionalYear) {
        double cos = Math.cos(fractionalYear);
        double sin = Math.sin(fractionalYear);
        double cos2 = Math.cos(2 * fractionalYear);
        double sin2 = Math.sin(2 * fractionalYear);

        double equationOfTime = 229.18 * (0.000075 + 0.001868 * cos - 0.032077 * sin
                                          - 0.014615 * cos2 - 0.040849 * sin2);
        double declination = 0.006918 - 0.399912 * cos + 0.070257 * sin - 0.006758 * cos2 + 0.000907 * sin2
                             - 0.002697 * Math.cos(3 * fractionalYear) + 0.00148 * Math.sin(3 * fractionalYear);
        return new SolarAngles(equationOfTime, declination);
    }

    /**
     * Elapsed part of the calendar year of {@code dateTime}, in radians. Uses the actual year boundaries, so leap
     * years need no special treatment.
     */
    public static double fractionalYear(LocalDateTime dateTime) {
        LocalDateTime startOfYear = LocalDate.of(dateTime.getYear(), 1, 1).atStartOfDay();
        LocalDateTime startOfNextYear = startOfYear.plusYears(1);
        double elapsed = Duration.between(startOfYear, dateTime).toNanos();
        double yearLength = Duration.between(startOfYear, startOfNextYear).toNanos();
        return elapsed / yearLength * FULL_CIRCLE;
    }
}
