package at.sv.sun.solar;

import lombok.Getter;

import java.util.Locale;

/**
 * The daily solar events, declared in chronological order for a day on which every horizon is crossed.
 */
public enum SolarEvent {
    ASTRONOMICAL_DAWN(Horizon.ASTRONOMICAL, Phase.DAWN),
    NAUTICAL_DAWN(Horizon.NAUTICAL, Phase.DAWN),
    CIVIL_DAWN(Horizon.CIVIL, Phase.DAWN),
    SUNRISE(Horizon.OFFICIAL, Phase.DAWN),
    SOLAR_NOON(null, Phase.NOON),
    SUNSET(Horizon.OFFICIAL, Phase.DUSK),
    CIVIL_DUSK(Horizon.CIVIL, Phase.DUSK),
    NAUTICAL_DUSK(Horizon.NAUTICAL, Phase.DUSK),
    ASTRONOMICAL_DUSK(Horizon.ASTRONOMICAL, Phase.DUSK),
    SOLAR_MIDNIGHT(null, Phase.MIDNIGHT);

    /**
     * The horizon crossed at this event, or {@code null} for the meridian transits.
     */
    @Getter
    private final Horizon horizon;
    private final Phase phase;

    SolarEvent(Horizon horizon, Phase phase) {
        this.horizon = horizon;
        this.phase = phase;
    }

    /**
     * Lower case name, e.g. {@code civil_dawn}.
     */
    public String getKeyword() {
        return name().toLowerCase(Locale.ENGLISH);
    }

    /**
     * @param horizonHourAngle the hour angle of this event's horizon in degrees, ignored for meridian transits
     * @return the signed hour angle in degrees at which this event happens; positive before noon
     */
    double hourAngle(double horizonHourAngle) {
        return switch (phase) {
            case DAWN -> horizonHourAngle;
            case DUSK -> -horizonHourAngle;
            case NOON -> 0.0;
            case MIDNIGHT -> -180.0;
        };
    }

    private enum Phase {
        DAWN, NOON, DUSK, MIDNIGHT
    }
}
