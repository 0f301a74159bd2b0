package at.sv.prayer.astronomy;

import at.sv.prayer.InvalidPropertyValue;

/**
 * A geographic location in degrees. Longitudes are positive towards the east.
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidPropertyValue("Invalid latitude '" + latitude + "'. Must be between -90 and 90 degrees.");
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidPropertyValue("Invalid longitude '" + longitude + "'. Must be between -180 and 180 degrees.");
        }
    }

    public Angle latitudeAngle() {
        return new Angle(latitude);
    }

    public Angle longitudeAngle() {
        return new Angle(longitude);
    }

    @Override
    public String toString() {
        return "[" + latitude + "," + longitude + ']';
    }
}
