package at.sv.sun;

/**
 * Signals a malformed location, time or timezone offset passed to the sun calculations.
 * Numeric edge cases of valid input, like a sun that never rises, never cause this exception.
 */
public final class InvalidSolarInputException extends IllegalArgumentException {

    public InvalidSolarInputException(String message) {
        super(message);
    }
}
