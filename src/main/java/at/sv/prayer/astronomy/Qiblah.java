package at.sv.prayer.astronomy;

/**
 * Direction of the Kaaba in Makkah, as a great circle bearing clockwise from true north.
 */
public final class Qiblah {

    public static final Coordinates MAKKAH = new Coordinates(21.4225241, 39.8261818);

    private Qiblah() {
    }

    public static Angle direction(Coordinates coordinates) {
        double latitude = coordinates.latitudeAngle().radians();
        double makkahLatitude = MAKKAH.latitudeAngle().radians();
        double longitudeDelta = MAKKAH.longitudeAngle().minus(coordinates.longitudeAngle()).radians();
        double term1 = Math.sin(longitudeDelta);
        double term2 = Math.cos(latitude) * Math.tan(makkahLatitude);
        double term3 = Math.sin(latitude) * Math.cos(longitudeDelta);
        return Angle.ofRadians(Math.atan2(term1, term2 - term3)).unwound();
    }
}
