package at.sv.sun;

/**
 * Geographic location in degrees, with the observer's altitude above sea level in meters.
 * <p>
 * Latitudes outside [-90..90] are not rejected, but results are only meaningful between roughly -65 and 65 degrees,
 * where the sun rises and sets every day.
 */
public record GeoLocation(double latitude, double longitude, double altitude) {

    public GeoLocation {
        requireFinite("latitude", latitude);
        requireFinite("longitude", longitude);
        requireFinite("altitude", altitude);
    }

    public GeoLocation(double latitude, double longitude) {
        this(latitude, longitude, 0.0);
    }

    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude);
    }

    public static GeoLocation of(double latitude, double longitude, double altitude) {
        return new GeoLocation(latitude, longitude, altitude);
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidSolarInputException("Invalid " + name + ": '" + value + "'. Expected a finite number.");
        }
    }

    @Override
    public String toString() {
        return "[lat=" + latitude + ", long=" + longitude + ", alt=" + altitude + "m]";
    }
}
