package at.sv.sun.frame;

import at.sv.sun.GeoLocation;

/**
 * User editable location, e.g. bound to sliders of the host application. Values may change between frames.
 */
public interface LocationSettings {

    double getLatitude();

    double getLongitude();

    double getAltitude();

    default GeoLocation toGeoLocation() {
        return new GeoLocation(getLatitude(), getLongitude(), getAltitude());
    }
}
