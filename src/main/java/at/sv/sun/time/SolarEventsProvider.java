package at.sv.sun.time;

import at.sv.sun.solar.SolarEvent;
import at.sv.sun.solar.SolarEvents;

import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Solar events of arbitrary days at a fixed location.
 */
public interface SolarEventsProvider {

    SolarEvents getSolarEvents(LocalDate date);

    /**
     * @return the time of the event on the given local date, rendered at the provider's timezone offset
     */
    OffsetDateTime getTime(SolarEvent event, LocalDate date);

    /**
     * @return all events of the given local date in chronological order, one {@code keyword: HH:mm:ss} per line
     */
    String toDebugString(LocalDate date);

    void clearCache();
}
