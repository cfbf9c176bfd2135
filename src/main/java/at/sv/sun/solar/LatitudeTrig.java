package at.sv.sun.solar;

/**
 * Sine, cosine and tangent of a latitude, kept next to the location so they are only evaluated when it moves.
 */
public record LatitudeTrig(double sin, double cos, double tan) {

    public static LatitudeTrig of(double latitude) {
        double sin = Math.sin(latitude);
        double cos = Math.cos(latitude);
        return new LatitudeTrig(sin, cos, sin / cos);
    }
}
