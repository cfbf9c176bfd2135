package at.sv.sun.time;

import at.sv.sun.GeoLocation;
import at.sv.sun.solar.SolarEvent;
import at.sv.sun.solar.SolarEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.hamcrest.core.StringContains.containsString;

class SolarEventsProviderTest {

    private static final ZoneOffset OFFSET = ZoneOffset.ofHours(1);

    private LocalDate date;
    private SolarEventsProvider provider;

    private void assertTime(SolarEvent event, int hour, int minute, int second) {
        OffsetDateTime time = provider.getTime(event, date);
        OffsetDateTime expected = OffsetDateTime.of(date, LocalTime.of(hour, minute, second), OFFSET);
        assertThat("Offset differs", time.getOffset(), is(OFFSET));
        assertThat("Time differs: " + time, Duration.between(expected, time).abs().getSeconds(), lessThanOrEqualTo(2L));
    }

    @BeforeEach
    void setUp() {
        date = LocalDate.of(2021, 1, 1);
        provider = new SolarEventsProviderImpl(new GeoLocation(48.20, 16.39), OFFSET);
    }

    @Test
    void returnsCorrectTimes_dependingOnDate() {
        assertTime(SolarEvent.SUNRISE, 7, 44, 54);
        assertTime(SolarEvent.SUNSET, 16, 10, 40);
        assertTime(SolarEvent.CIVIL_DAWN, 7, 8, 33);
        assertTime(SolarEvent.NAUTICAL_DUSK, 17, 26, 39);
        date = date.plusDays(30);
        assertTime(SolarEvent.SUNRISE, 7, 23, 46);
        assertTime(SolarEvent.SUNSET, 16, 51, 26);
        assertTime(SolarEvent.CIVIL_DAWN, 6, 50, 12);
        assertTime(SolarEvent.NAUTICAL_DUSK, 18, 2, 29);
    }

    @Test
    void getSolarEvents_sameDate_returnsCachedInstance() {
        SolarEvents events = provider.getSolarEvents(date);

        assertThat(provider.getSolarEvents(date), sameInstance(events));
        assertThat(provider.getSolarEvents(date.plusDays(1)), not(sameInstance(events)));
        assertThat(events.getDate(), is(date));
    }

    @Test
    void clearCache_recalculates() {
        SolarEvents events = provider.getSolarEvents(date);

        provider.clearCache();

        SolarEvents recalculated = provider.getSolarEvents(date);
        assertThat(recalculated, not(sameInstance(events)));
        assertThat(recalculated.get(SolarEvent.SUNRISE), is(events.get(SolarEvent.SUNRISE)));
    }

    @Test
    void toDebugString_listsEventsInLocalTime() {
        String debug = provider.toDebugString(date);

        assertThat(debug, containsString("sunrise: 07:44:5"));
        assertThat(debug, containsString("solar_midnight: "));
        assertThat(debug.lines().count(), is(10L));
    }
}
