package at.sv.sun.solar;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

/**
 * Calculates the {@link SolarEvents} of a calendar day from the hour angles at which the sun crosses each
 * {@link Horizon}.
 * <p>
 * The solar angles are evaluated at the end of the requested day (the start of the following one). Event times are
 * derived as minutes from UTC midnight of the requested date, so they end up on the local day as long as the
 * timezone offset roughly matches the longitude.
 */
@Slf4j
public class SolarEventsCalculator {

    /**
     * Degrees the visible horizon drops per meter of observer altitude.
     */
    static final double ALTITUDE_DIP_PER_METER = 2.076e-4;

    public SolarEvents calculate(LocalDate date, ObserverLocation location) {
        SolarAngles angles = SolarAngles.forFractionalYear(
                SolarAngles.fractionalYear(date.plusDays(1).atStartOfDay()));

        Map<Horizon, HorizonCrossing> crossings = new EnumMap<>(Horizon.class);
        Map<Horizon, Double> hourAngles = new EnumMap<>(Horizon.class);
        for (Horizon horizon : Horizon.values()) {
            double cosHourAngle = cosHourAngle(horizon, angles.declination(), location);
            HorizonCrossing crossing = toCrossing(cosHourAngle);
            crossings.put(horizon, crossing);
            hourAngles.put(horizon, hourAngle(cosHourAngle, crossing));
            if (crossing != HorizonCrossing.CROSSES) {
                log.debug("Sun does not cross {} horizon on {}: {}", horizon, date, crossing);
            }
        }

        Instant midnight = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        double longitude = location.longitudeDegrees();
        Map<SolarEvent, Instant> instants = new EnumMap<>(SolarEvent.class);
        for (SolarEvent event : SolarEvent.values()) {
            double horizonHourAngle = event.getHorizon() == null ? 0.0 : hourAngles.get(event.getHorizon());
            double minutes = 720 - 4 * (longitude + event.hourAngle(horizonHourAngle)) - angles.equationOfTime();
            instants.put(event, plusMinutes(midnight, minutes));
        }

        SolarEvents events = new SolarEvents(date, angles, crossings, instants);
        log.trace("Calculated {}", events);
        return events;
    }

    private static double cosHourAngle(Horizon horizon, double declination, ObserverLocation location) {
        LatitudeTrig latitude = location.latitudeTrig();
        double cos = Math.cos(declination) * latitude.cos();
        double tan = Math.tan(declination) * latitude.tan();
        double altitude = Math.toRadians(ALTITUDE_DIP_PER_METER * location.altitude());
        return (horizon.getZenithCosine() - altitude) / cos - tan;
    }

    private static HorizonCrossing toCrossing(double cosHourAngle) {
        if (cosHourAngle < -1.0) {
            return HorizonCrossing.ALWAYS_ABOVE;
        }
        if (cosHourAngle > 1.0 || Double.isNaN(cosHourAngle)) {
            return HorizonCrossing.ALWAYS_BELOW;
        }
        return HorizonCrossing.CROSSES;
    }

    /**
     * Saturates to 180° if the sun stays above the horizon and to 0° if it never reaches it.
     */
    private static double hourAngle(double cosHourAngle, HorizonCrossing crossing) {
        return switch (crossing) {
            case CROSSES -> Math.toDegrees(Math.acos(cosHourAngle));
            case ALWAYS_ABOVE -> 180.0;
            case ALWAYS_BELOW -> 0.0;
        };
    }

    /**
     * Adds whole minutes plus the seconds of the fractional minute; fractions of a second are dropped.
     */
    private static Instant plusMinutes(Instant midnight, double minutes) {
        long wholeMinutes = (long) Math.floor(minutes);
        long seconds = (long) ((minutes - wholeMinutes) * 60);
        return midnight.plusSeconds(wholeMinutes * 60 + seconds);
    }
}
