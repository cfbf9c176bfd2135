package at.sv.sun.solar;

/**
 * The observer as seen by the calculators: latitude and longitude in radians, altitude in meters.
 */
public record ObserverLocation(double latitude, double longitude, double altitude, LatitudeTrig latitudeTrig) {

    public static ObserverLocation fromDegrees(double latitude, double longitude, double altitude) {
        double latitudeRadians = Math.toRadians(latitude);
        return new ObserverLocation(latitudeRadians, Math.toRadians(longitude), altitude,
                LatitudeTrig.of(latitudeRadians));
    }

    public double latitudeDegrees() {
        return Math.toDegrees(latitude);
    }

    public double longitudeDegrees() {
        return Math.toDegrees(longitude);
    }
}
