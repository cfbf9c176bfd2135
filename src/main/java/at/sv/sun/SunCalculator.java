package at.sv.sun;

import at.sv.sun.solar.ObserverLocation;
import at.sv.sun.solar.SolarEvent;
import at.sv.sun.solar.SolarEvents;
import at.sv.sun.solar.SolarEventsCalculator;
import at.sv.sun.solar.SunPosition;
import at.sv.sun.solar.SunPositionCalculator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Position of the sun and the times of the daily solar events for a location and a reference time, meant to be
 * polled from a render or update loop.
 * <p>
 * Results are cached in two tiers: the sun position is recalculated at most once per second of reference time, the
 * solar events at most once per local calendar day. Moving the location or changing the timezone offset
 * recalculates both immediately. All getters only read the cache.
 * <p>
 * The day is determined by the wall clock at the configured timezone offset. Instances are not thread safe.
 */
@Slf4j
public final class SunCalculator {

    static final double ANGLE_EPSILON = 1e-8;
    static final double ALTITUDE_EPSILON = 1e-2;
    private static final int MAX_OFFSET_MINUTES = 18 * 60;

    private final SolarEventsCalculator solarEventsCalculator;
    private final SunPositionCalculator sunPositionCalculator;

    private ObserverLocation location;
    private int timezoneOffset;
    private Instant referenceTime;

    private LocalDate solarEventsDate;
    private SolarEvents solarEvents;
    private SunPosition sunPosition;
    private boolean solarEventsDirty;
    private boolean sunPositionDirty;

    /**
     * Uses the current time of the clock as reference and the offset of its zone at that time.
     * The offset is resolved once and kept afterwards.
     */
    public SunCalculator(GeoLocation location, Clock clock) {
        this(location, requireNonNull(clock, "clock").instant(), clock.getZone());
    }

    private SunCalculator(GeoLocation location, Instant referenceTime, ZoneId zone) {
        this(location, referenceTime, zone.getRules().getOffset(referenceTime).getTotalSeconds() / 60);
    }

    public SunCalculator(GeoLocation location, ZonedDateTime referenceTime) {
        this(location, requireNonNull(referenceTime, "referenceTime").toInstant(),
                referenceTime.getOffset().getTotalSeconds() / 60);
    }

    /**
     * @param timezoneOffset offset from UTC of the location in minutes, e.g. 60 for CET
     */
    public SunCalculator(GeoLocation location, Instant referenceTime, int timezoneOffset) {
        this(location, referenceTime, timezoneOffset, new SolarEventsCalculator(), new SunPositionCalculator());
    }

    SunCalculator(GeoLocation location, Instant referenceTime, int timezoneOffset,
                  SolarEventsCalculator solarEventsCalculator, SunPositionCalculator sunPositionCalculator) {
        this.solarEventsCalculator = solarEventsCalculator;
        this.sunPositionCalculator = sunPositionCalculator;
        this.location = toObserverLocation(location);
        this.timezoneOffset = requireValidOffset(timezoneOffset);
        this.referenceTime = requireNonNull(referenceTime, "referenceTime");
        invalidateAll();
        recalculate();
    }

    /**
     * Changes the location, keeping the current timezone offset.
     *
     * @see #setLocation(GeoLocation, int)
     */
    public void setLocation(GeoLocation location) {
        setLocation(location, timezoneOffset);
    }

    /**
     * Changes the location and timezone offset. Recalculates everything if the location moved noticeably
     * (1e-8 rad for latitude and longitude, 1 cm for the altitude) or the offset changed, otherwise does nothing.
     */
    public void setLocation(GeoLocation location, int timezoneOffset) {
        ObserverLocation newLocation = toObserverLocation(location);
        requireValidOffset(timezoneOffset);
        if (!hasMoved(newLocation) && this.timezoneOffset == timezoneOffset) {
            return;
        }
        log.trace("Location changed to {} ({} min)", location, timezoneOffset);
        this.location = newLocation;
        this.timezoneOffset = timezoneOffset;
        invalidateAll();
        recalculate();
    }

    public void setTime(ZonedDateTime time) {
        setTime(requireNonNull(time, "time").toInstant());
    }

    /**
     * Changes the reference time. Sub-second changes are ignored. The sun position is recalculated on every new second,
     * the solar events only once the local calendar day changes.
     */
    public void setTime(Instant time) {
        requireNonNull(time, "time");
        if (time.truncatedTo(ChronoUnit.SECONDS).equals(referenceTime.truncatedTo(ChronoUnit.SECONDS))) {
            return;
        }
        referenceTime = time;
        sunPositionDirty = true;
        if (!localDateTime().toLocalDate().equals(solarEventsDate)) {
            solarEventsDirty = true;
        }
        recalculate();
    }

    private boolean hasMoved(ObserverLocation newLocation) {
        return Math.abs(newLocation.latitude() - location.latitude()) > ANGLE_EPSILON
               || Math.abs(newLocation.longitude() - location.longitude()) > ANGLE_EPSILON
               || Math.abs(newLocation.altitude() - location.altitude()) > ALTITUDE_EPSILON;
    }

    private void invalidateAll() {
        solarEventsDirty = true;
        sunPositionDirty = true;
    }

    private void recalculate() {
        LocalDateTime localDateTime = localDateTime();
        if (solarEventsDirty) {
            solarEventsDate = localDateTime.toLocalDate();
            solarEvents = solarEventsCalculator.calculate(solarEventsDate, location);
            solarEventsDirty = false;
        }
        if (sunPositionDirty) {
            sunPosition = sunPositionCalculator.calculate(localDateTime, timezoneOffset, location);
            sunPositionDirty = false;
        }
    }

    private LocalDateTime localDateTime() {
        return LocalDateTime.ofInstant(referenceTime.truncatedTo(ChronoUnit.SECONDS), toZoneOffset(timezoneOffset));
    }

    /**
     * @return latitude and longitude in degrees, altitude in meters
     */
    public GeoLocation getLocation() {
        return new GeoLocation(location.latitudeDegrees(), location.longitudeDegrees(), location.altitude());
    }

    /**
     * @return the offset from UTC in minutes used for the calculations
     */
    public int getTimezoneOffset() {
        return timezoneOffset;
    }

    public OffsetDateTime getReferenceTime() {
        return getReferenceTime(timezoneOffset);
    }

    /**
     * @param timezoneOffset offset from UTC in minutes to render the time in
     */
    public OffsetDateTime getReferenceTime(int timezoneOffset) {
        return referenceTime.atOffset(toZoneOffset(timezoneOffset));
    }

    public SunPosition getSunPosition() {
        return sunPosition;
    }

    public SolarEvents getSolarEvents() {
        return solarEvents;
    }

    public OffsetDateTime getEvent(SolarEvent event) {
        return getEvent(event, timezoneOffset);
    }

    /**
     * @param timezoneOffset offset from UTC in minutes to render the time in, does not trigger a recalculation
     */
    public OffsetDateTime getEvent(SolarEvent event, int timezoneOffset) {
        return solarEvents.get(requireNonNull(event, "event"), toZoneOffset(timezoneOffset));
    }

    public OffsetDateTime getSunrise() {
        return getEvent(SolarEvent.SUNRISE);
    }

    public OffsetDateTime getSunrise(int timezoneOffset) {
        return getEvent(SolarEvent.SUNRISE, timezoneOffset);
    }

    public OffsetDateTime getSunset() {
        return getEvent(SolarEvent.SUNSET);
    }

    public OffsetDateTime getSunset(int timezoneOffset) {
        return getEvent(SolarEvent.SUNSET, timezoneOffset);
    }

    public OffsetDateTime getSolarNoon() {
        return getEvent(SolarEvent.SOLAR_NOON);
    }

    public OffsetDateTime getSolarNoon(int timezoneOffset) {
        return getEvent(SolarEvent.SOLAR_NOON, timezoneOffset);
    }

    public OffsetDateTime getSolarMidnight() {
        return getEvent(SolarEvent.SOLAR_MIDNIGHT);
    }

    public OffsetDateTime getSolarMidnight(int timezoneOffset) {
        return getEvent(SolarEvent.SOLAR_MIDNIGHT, timezoneOffset);
    }

    /**
     * Civil dawn is when the sun is 6 degrees below the horizon before sunrise.
     */
    public OffsetDateTime getCivilDawn() {
        return getEvent(SolarEvent.CIVIL_DAWN);
    }

    public OffsetDateTime getCivilDawn(int timezoneOffset) {
        return getEvent(SolarEvent.CIVIL_DAWN, timezoneOffset);
    }

    /**
     * Civil dusk is when the sun is 6 degrees below the horizon after sunset.
     */
    public OffsetDateTime getCivilDusk() {
        return getEvent(SolarEvent.CIVIL_DUSK);
    }

    public OffsetDateTime getCivilDusk(int timezoneOffset) {
        return getEvent(SolarEvent.CIVIL_DUSK, timezoneOffset);
    }

    /**
     * Nautical dawn is when the sun is 12 degrees below the horizon before sunrise.
     */
    public OffsetDateTime getNauticalDawn() {
        return getEvent(SolarEvent.NAUTICAL_DAWN);
    }

    public OffsetDateTime getNauticalDawn(int timezoneOffset) {
        return getEvent(SolarEvent.NAUTICAL_DAWN, timezoneOffset);
    }

    /**
     * Nautical dusk is when the sun is 12 degrees below the horizon after sunset.
     */
    public OffsetDateTime getNauticalDusk() {
        return getEvent(SolarEvent.NAUTICAL_DUSK);
    }

    public OffsetDateTime getNauticalDusk(int timezoneOffset) {
        return getEvent(SolarEvent.NAUTICAL_DUSK, timezoneOffset);
    }

    /**
     * Astronomical dawn is when the sun is 18 degrees below the horizon before sunrise.
     */
    public OffsetDateTime getAstronomicalDawn() {
        return getEvent(SolarEvent.ASTRONOMICAL_DAWN);
    }

    public OffsetDateTime getAstronomicalDawn(int timezoneOffset) {
        return getEvent(SolarEvent.ASTRONOMICAL_DAWN, timezoneOffset);
    }

    /**
     * Astronomical dusk is when the sun is 18 degrees below the horizon after sunset.
     */
    public OffsetDateTime getAstronomicalDusk() {
        return getEvent(SolarEvent.ASTRONOMICAL_DUSK);
    }

    public OffsetDateTime getAstronomicalDusk(int timezoneOffset) {
        return getEvent(SolarEvent.ASTRONOMICAL_DUSK, timezoneOffset);
    }

    public String toDebugString() {
        return "location: " + getLocation() +
               "\ntime: " + getReferenceTime() +
               "\nposition: " + sunPosition +
               "\n" + solarEvents.toDebugString(toZoneOffset(timezoneOffset));
    }

    static ZoneOffset toZoneOffset(int timezoneOffset) {
        return ZoneOffset.ofTotalSeconds(requireValidOffset(timezoneOffset) * 60);
    }

    private static int requireValidOffset(int timezoneOffset) {
        if (Math.abs(timezoneOffset) > MAX_OFFSET_MINUTES) {
            throw new InvalidSolarInputException("Invalid timezone offset: '" + timezoneOffset +
                                                 "' min. Expected a value between -" + MAX_OFFSET_MINUTES + " and " +
                                                 MAX_OFFSET_MINUTES + ".");
        }
        return timezoneOffset;
    }

    private static ObserverLocation toObserverLocation(GeoLocation location) {
        requireNonNull(location, "location");
        return ObserverLocation.fromDegrees(location.latitude(), location.longitude(), location.altitude());
    }

    private static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new InvalidSolarInputException("Missing " + name + ".");
        }
        return value;
    }
}
