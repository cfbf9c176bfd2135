package at.sv.sun.solar;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable result of one daily calculation: the solar angles of the day and the instants of all
 * {@link SolarEvent}s.
 */
public final class SolarEvents {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    /**
     * The local calendar day the events were calculated for.
     */
    @Getter
    private final LocalDate date;
    /**
     * In minutes.
     */
    @Getter
    private final double equationOfTime;
    /**
     * In radians.
     */
    @Getter
    private final double declination;
    private final Map<Horizon, HorizonCrossing> crossings;
    private final Map<SolarEvent, Instant> instants;

    SolarEvents(LocalDate date, SolarAngles angles, Map<Horizon, HorizonCrossing> crossings,
                Map<SolarEvent, Instant> instants) {
        this.date = date;
        this.equationOfTime = angles.equationOfTime();
        this.declination = angles.declination();
        this.crossings = new EnumMap<>(crossings);
        this.instants = new EnumMap<>(instants);
    }

    public Instant get(SolarEvent event) {
        return instants.get(event);
    }

    public OffsetDateTime get(SolarEvent event, ZoneOffset offset) {
        return get(event).atOffset(offset);
    }

    public HorizonCrossing getCrossing(Horizon horizon) {
        return crossings.get(horizon);
    }

    /**
     * @return true if the sun crosses all horizons, i.e. every event is a real rise or set
     */
    public boolean isComplete() {
        return crossings.values().stream().allMatch(crossing -> crossing == HorizonCrossing.CROSSES);
    }

    /**
     * @return the time between sunrise and sunset; zero during polar night and a full day during polar day
     */
    public Duration getDayLength() {
        return Duration.between(get(SolarEvent.SUNRISE), get(SolarEvent.SUNSET));
    }

    public String toDebugString(ZoneOffset offset) {
        return Stream.of(SolarEvent.values())
                     .sorted(Comparator.comparing(this::get))
                     .map(event -> event.getKeyword() + ": " + TIME_FORMATTER.format(get(event, offset)))
                     .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return "SolarEvents{" +
               "date=" + date +
               ", sunrise=" + get(SolarEvent.SUNRISE) +
               ", sunset=" + get(SolarEvent.SUNSET) +
               ", crossings=" + crossings +
               '}';
    }
}
