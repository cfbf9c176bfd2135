package at.sv.sun.time;

import at.sv.sun.GeoLocation;
import at.sv.sun.solar.ObserverLocation;
import at.sv.sun.solar.SolarEvent;
import at.sv.sun.solar.SolarEvents;
import at.sv.sun.solar.SolarEventsCalculator;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class SolarEventsProviderImpl implements SolarEventsProvider {

    private static final int DEFAULT_CACHE_SIZE = 366;

    private final ObserverLocation location;
    private final ZoneOffset offset;
    private final SolarEventsCalculator calculator;
    private final Cache<LocalDate, SolarEvents> cache;

    public SolarEventsProviderImpl(GeoLocation location, ZoneOffset offset) {
        this(location, offset, DEFAULT_CACHE_SIZE);
    }

    public SolarEventsProviderImpl(GeoLocation location, ZoneOffset offset, int maximumCacheSize) {
        this.location = ObserverLocation.fromDegrees(location.latitude(), location.longitude(), location.altitude());
        this.offset = offset;
        calculator = new SolarEventsCalculator();
        cache = Caffeine.newBuilder()
                        .maximumSize(maximumCacheSize)
                        .build();
    }

    @Override
    public SolarEvents getSolarEvents(LocalDate date) {
        return cache.get(date, d -> calculator.calculate(d, location));
    }

    @Override
    public OffsetDateTime getTime(SolarEvent event, LocalDate date) {
        return getSolarEvents(date).get(event, offset);
    }

    @Override
    public String toDebugString(LocalDate date) {
        return getSolarEvents(date).toDebugString(offset);
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }
}
