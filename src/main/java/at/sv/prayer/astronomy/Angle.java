package at.sv.prayer.astronomy;

/**
 * A plane angle stored in degrees. Arithmetic is degree-wise and never normalizes implicitly, use {@link #unwound()}
 * or {@link #quadrantShifted()} for that.
 */
public record Angle(double degrees) {

    public static Angle ofRadians(double radians) {
        return new Angle(Math.toDegrees(radians));
    }

    public double radians() {
        return Math.toRadians(degrees);
    }

    public Angle plus(Angle other) {
        return new Angle(degrees + other.degrees);
    }

    public Angle minus(Angle other) {
        return new Angle(degrees - other.degrees);
    }

    public Angle times(double factor) {
        return new Angle(degrees * factor);
    }

    public Angle dividedBy(double divisor) {
        if (divisor == 0.0) {
            throw new ArithmeticException("Division of angle " + degrees + " by zero");
        }
        return new Angle(degrees / divisor);
    }

    /**
     * @return the equivalent angle in [0, 360)
     */
    public Angle unwound() {
        return new Angle(normalizedToScale(degrees, 360.0));
    }

    /**
     * @return the equivalent angle in [-180, 180]
     */
    public Angle quadrantShifted() {
        if (degrees >= -180.0 && degrees <= 180.0) {
            return this;
        }
        return new Angle(degrees - 360.0 * roundHalfAwayFromZero(degrees / 360.0));
    }

    /**
     * Maps the value into the half-open interval between zero and {@code max}, which may also be negative.
     */
    static double normalizedToScale(double value, double max) {
        double normalized = value - max * Math.floor(value / max);
        return normalized == max ? 0.0 : normalized;
    }

    private static double roundHalfAwayFromZero(double value) {
        return Math.signum(value) * Math.round(Math.abs(value));
    }
}
