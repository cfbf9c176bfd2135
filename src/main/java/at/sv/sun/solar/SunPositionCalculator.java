package at.sv.sun.solar;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Calculates the apparent {@link SunPosition} for an exact point in time.
 */
@Slf4j
public class SunPositionCalculator {

    /**
     * The refraction term diverges towards -5.11°; below this true elevation it is held at its value here.
     */
    static final double MIN_REFRACTION_ELEVATION = -2.0;

    /**
     * @param localDateTime  the wall clock reading at {@code timezoneOffset}, only whole seconds are considered
     * @param timezoneOffset offset from UTC in minutes
     */
    public SunPosition calculate(LocalDateTime localDateTime, int timezoneOffset, ObserverLocation location) {
        SolarAngles angles = SolarAngles.forFractionalYear(SolarAngles.fractionalYear(localDateTime));
        double declination = angles.declination();
        LatitudeTrig latitude = location.latitudeTrig();

        double timeOffset = angles.equationOfTime() + 4 * location.longitudeDegrees() - timezoneOffset;
        double trueSolarTime = minutesOfDay(localDateTime.toLocalTime()) + timeOffset;
        double hourAngle = Math.toRadians(trueSolarTime * 0.25 - 180);
        double cosHourAngle = Math.cos(hourAngle);

        double cosZenith = latitude.sin() * Math.sin(declination)
                           + latitude.cos() * Math.cos(declination) * cosHourAngle;
        double zenith = Math.toDegrees(Math.acos(clamp(cosZenith)));
        double trueElevation = 90 - zenith;
        double elevation = trueElevation + refraction(trueElevation) + altitudeCorrection(location.altitude());

        double azimuth = 180 + Math.toDegrees(Math.atan2(Math.sin(hourAngle),
                cosHourAngle * latitude.sin() - Math.tan(declination) * latitude.cos()));

        SunPosition position = new SunPosition(normalizeAzimuth(azimuth), elevation);
        log.trace("Calculated {} for {}", position, localDateTime);
        return position;
    }

    /**
     * Empirical low elevation refraction term in degrees. Constant below {@link #MIN_REFRACTION_ELEVATION}, so the
     * apparent elevation stays continuous.
     */
    static double refraction(double trueElevation) {
        double elevation = Math.max(trueElevation, MIN_REFRACTION_ELEVATION);
        return -0.0167 / Math.tan(Math.toRadians(elevation + 10.3 / (elevation + 5.11)));
    }

    private static double altitudeCorrection(double altitude) {
        return SolarEventsCalculator.ALTITUDE_DIP_PER_METER * altitude;
    }

    private static double minutesOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute() + time.getSecond() / 60.0;
    }

    private static double clamp(double cosine) {
        return Math.max(-1.0, Math.min(1.0, cosine));
    }

    private static double normalizeAzimuth(double azimuth) {
        double normalized = azimuth % 360.0;
        return normalized < 0 ? normalized + 360.0 : normalized;
    }
}
