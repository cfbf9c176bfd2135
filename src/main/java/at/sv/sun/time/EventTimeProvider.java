package at.sv.sun.time;

import java.time.LocalDate;
import java.time.OffsetDateTime;

public interface EventTimeProvider {
    /**
     * @param input a ISO_LOCAL_TIME formatted string, or a solar event keyword with an optional offset in minutes,
     *              e.g. {@code sunset-15}
     * @param date  the local date to resolve solar events for
     * @return the time corresponding to the input on the given date
     * @throws InvalidEventTimeExpression if the input is neither a valid
     *                                    {@link java.time.format.DateTimeFormatter#ISO_LOCAL_TIME} nor a supported
     *                                    keyword with optional offset.
     */
    OffsetDateTime getTime(String input, LocalDate date);
}
