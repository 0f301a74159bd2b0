package at.sv.prayer.parameters;

/**
 * Caps Fajr and Isha to a portion of the night in places where the twilight angles are reached late or not at all.
 */
public enum HighLatitudeRule {
    MIDDLE_OF_THE_NIGHT,
    SEVENTH_OF_THE_NIGHT,
    TWILIGHT_ANGLE;

    public static HighLatitudeRule recommended(double latitude) {
        if (latitude > 48.0) {
            return SEVENTH_OF_THE_NIGHT;
        }
        return MIDDLE_OF_THE_NIGHT;
    }
}
