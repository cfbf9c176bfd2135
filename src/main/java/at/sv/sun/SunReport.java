package at.sv.sun;

import at.sv.sun.solar.Horizon;
import at.sv.sun.solar.HorizonCrossing;
import at.sv.sun.solar.SolarEvent;
import at.sv.sun.solar.SolarEvents;
import at.sv.sun.solar.SunPosition;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Snapshot of a {@link SunCalculator}, serialized by the command line as JSON.
 */
public record SunReport(GeoLocation location,
                        OffsetDateTime time,
                        SunPosition position,
                        double dayLengthMinutes,
                        Map<String, OffsetDateTime> events,
                        Map<String, HorizonCrossing> horizons) {

    public static SunReport of(SunCalculator calculator) {
        SolarEvents solarEvents = calculator.getSolarEvents();
        ZoneOffset offset = calculator.getReferenceTime().getOffset();
        Map<String, OffsetDateTime> events = new LinkedHashMap<>();
        for (SolarEvent event : SolarEvent.values()) {
            events.put(event.getKeyword(), solarEvents.get(event, offset));
        }
        Map<String, HorizonCrossing> horizons = new LinkedHashMap<>();
        for (Horizon horizon : Horizon.values()) {
            horizons.put(horizon.name().toLowerCase(Locale.ENGLISH), solarEvents.getCrossing(horizon));
        }
        return new SunReport(calculator.getLocation(), calculator.getReferenceTime(), calculator.getSunPosition(),
                solarEvents.getDayLength().getSeconds() / 60.0, events, horizons);
    }
}
