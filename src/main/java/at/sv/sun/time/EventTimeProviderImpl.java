package at.sv.sun.time;

import at.sv.sun.solar.SolarEvent;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class EventTimeProviderImpl implements EventTimeProvider {

    private final SolarEventsProvider solarEventsProvider;
    private final ZoneOffset offset;
    private final Map<String, LocalTime> timeCache;

    public EventTimeProviderImpl(SolarEventsProvider solarEventsProvider, ZoneOffset offset) {
        this.solarEventsProvider = solarEventsProvider;
        this.offset = offset;
        timeCache = new ConcurrentHashMap<>();
    }

    @Override
    public OffsetDateTime getTime(String input, LocalDate date) {
        if (input == null || input.isBlank()) {
            throw new InvalidEventTimeExpression("Missing time expression");
        }
        LocalTime time = tryParseTimeString(input);
        if (time != null) return OffsetDateTime.of(date, time, offset);
        try {
            if (isOffsetExpression(input)) {
                return parseOffsetExpression(input, date);
            }
            return parseEventKeyword(input, date);
        } catch (Exception e) {
            throw new InvalidEventTimeExpression("Failed to parse time expression '" + input + "': " + e.getMessage());
        }
    }

    private LocalTime tryParseTimeString(String input) {
        if (!Character.isDigit(input.charAt(0))) {
            return null;
        }

        return timeCache.computeIfAbsent(input, k -> {
            try {
                return LocalTime.parse(input);
            } catch (Exception ignore) {
                return null;
            }
        });
    }

    private boolean isOffsetExpression(String input) {
        return input.contains("+") || input.contains("-");
    }

    private OffsetDateTime parseOffsetExpression(String input, LocalDate date) {
        String[] parts = input.split("[+-]");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected '<keyword>+<minutes>' or '<keyword>-<minutes>'");
        }
        OffsetDateTime time = parseEventKeyword(parts[0].trim(), date);
        int minutes = Integer.parseInt(parts[1].trim());
        if (input.contains("+")) {
            return time.plusMinutes(minutes);
        } else {
            return time.minusMinutes(minutes);
        }
    }

    private OffsetDateTime parseEventKeyword(String input, LocalDate date) {
        return solarEventsProvider.getTime(toSolarEvent(input), date);
    }

    private static SolarEvent toSolarEvent(String input) {
        return switch (input.toLowerCase(Locale.ENGLISH)) {
            case "astronomical_start", "astronomical_dawn" -> SolarEvent.ASTRONOMICAL_DAWN;
            case "nautical_start", "nautical_dawn" -> SolarEvent.NAUTICAL_DAWN;
            case "civil_start", "civil_dawn" -> SolarEvent.CIVIL_DAWN;
            case "sunrise" -> SolarEvent.SUNRISE;
            case "noon", "solar_noon" -> SolarEvent.SOLAR_NOON;
            case "sunset" -> SolarEvent.SUNSET;
            case "civil_end", "civil_dusk" -> SolarEvent.CIVIL_DUSK;
            case "nautical_end", "nautical_dusk" -> SolarEvent.NAUTICAL_DUSK;
            case "astronomical_end", "astronomical_dusk" -> SolarEvent.ASTRONOMICAL_DUSK;
            case "midnight", "solar_midnight" -> SolarEvent.SOLAR_MIDNIGHT;
            default -> throw new IllegalArgumentException("Invalid sun keyword: '" + input + "'");
        };
    }
}
