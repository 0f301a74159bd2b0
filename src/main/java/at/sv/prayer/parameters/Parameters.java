package at.sv.prayer.parameters;

import at.sv.prayer.InvalidPropertyValue;
import at.sv.prayer.time.Prayer;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Everything that determines how the prayer times of a day are derived from the position of the sun. Unset builder
 * properties fall back to their defaults, use {@link CalculationMethods#parameters(CalculationMethod)} to start from a
 * well known method.
 */
@Getter
@EqualsAndHashCode
public final class Parameters {

    private final CalculationMethod method;
    private final double fajrAngle;
    /**
     * Sun depression for Maghrib, zero means sunset.
     */
    private final double maghribAngle;
    private final double ishaAngle;
    /**
     * Fixed minutes between Maghrib and Isha. Takes precedence over the Isha angle if greater than zero.
     */
    private final int ishaInterval;
    private final Madhab madhab;
    private final HighLatitudeRule highLatitudeRule;
    private final TimeAdjustments adjustments;
    private final TimeAdjustments methodAdjustments;
    private final Rounding rounding;
    private final Shafaq shafaq;

    @Builder(toBuilder = true)
    private Parameters(CalculationMethod method, Double fajrAngle, Double maghribAngle, Double ishaAngle,
                       Integer ishaInterval, Madhab madhab, HighLatitudeRule highLatitudeRule,
                       TimeAdjustments adjustments, TimeAdjustments methodAdjustments, Rounding rounding,
                       Shafaq shafaq) {
        this.method = Objects.requireNonNullElse(method, CalculationMethod.OTHER);
        this.fajrAngle = assertValidAngle("fajrAngle", fajrAngle);
        this.maghribAngle = assertValidAngle("maghribAngle", maghribAngle);
        this.ishaAngle = assertValidAngle("ishaAngle", ishaAngle);
        this.ishaInterval = assertValidInterval(ishaInterval);
        this.madhab = Objects.requireNonNullElse(madhab, Madhab.SHAFI);
        this.highLatitudeRule = Objects.requireNonNullElse(highLatitudeRule, HighLatitudeRule.MIDDLE_OF_THE_NIGHT);
        this.adjustments = Objects.requireNonNullElse(adjustments, TimeAdjustments.NONE);
        this.methodAdjustments = Objects.requireNonNullElse(methodAdjustments, TimeAdjustments.NONE);
        this.rounding = Objects.requireNonNullElse(rounding, Rounding.NEAREST);
        this.shafaq = Objects.requireNonNullElse(shafaq, Shafaq.GENERAL);
    }

    /**
     * Shortcut for the parameters of a calculation method using the given madhab.
     */
    public static Parameters with(CalculationMethod method, Madhab madhab) {
        return CalculationMethods.parameters(method).toBuilder().madhab(madhab).build();
    }

    public NightPortions nightPortions() {
        return switch (highLatitudeRule) {
            case MIDDLE_OF_THE_NIGHT -> new NightPortions(1.0 / 2.0, 1.0 / 2.0);
            case SEVENTH_OF_THE_NIGHT -> new NightPortions(1.0 / 7.0, 1.0 / 7.0);
            case TWILIGHT_ANGLE -> new NightPortions(fajrAngle / 60.0, ishaAngle / 60.0);
        };
    }

    /**
     * @return the user and method adjustments for the prayer combined, in minutes
     */
    public int timeAdjustment(Prayer prayer) {
        return adjustments.minutesFor(prayer) + methodAdjustments.minutesFor(prayer);
    }

    private static double assertValidAngle(String property, Double angle) {
        if (angle == null) {
            return 0.0;
        }
        if (!Double.isFinite(angle) || angle < 0.0 || angle >= 90.0) {
            throw new InvalidPropertyValue("Invalid " + property + " '" + angle + "'. Must be within [0, 90) degrees.");
        }
        return angle;
    }

    private static int assertValidInterval(Integer ishaInterval) {
        if (ishaInterval == null) {
            return 0;
        }
        if (ishaInterval < 0) {
            throw new InvalidPropertyValue("Invalid ishaInterval '" + ishaInterval + "'. Must be >= 0 minutes.");
        }
        return ishaInterval;
    }

    @Override
    public String toString() {
        return "Parameters{" +
               "method=" + method +
               ", fajrAngle=" + fajrAngle +
               ", maghribAngle=" + maghribAngle +
               ", ishaAngle=" + ishaAngle +
               ", ishaInterval=" + ishaInterval +
               ", madhab=" + madhab +
               ", highLatitudeRule=" + highLatitudeRule +
               ", rounding=" + rounding +
               ", shafaq=" + shafaq +
               '}';
    }

    public static class ParametersBuilder {
        /**
         * Setting a positive interval disables the Isha angle.
         */
        public ParametersBuilder ishaInterval(Integer ishaInterval) {
            this.ishaInterval = ishaInterval;
            if (ishaInterval != null && ishaInterval > 0) {
                this.ishaAngle = 0.0;
            }
            return this;
        }
    }
}
