package at.sv.prayer.astronomy;

import lombok.AccessLevel;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Solar events of a single day at an observer location. The day is the one whose local mean noon falls on the date,
 * so close to the date line its events may lie on the neighbouring UTC day. All times are in UTC, rounded to the
 * minute.
 * <p>
 * Sunrise and sunset are {@code null} if the sun does not cross the horizon on that day, e.g. during polar day or
 * night. The same applies to {@link #timeForSolarAngle(Angle, boolean)} for altitudes the sun never reaches.
 */
@Getter
public final class SolarTime {

    /**
     * Apparent altitude of the sun's upper limb at rising and setting, including refraction.
     */
    private static final Angle SOLAR_ALTITUDE = new Angle(-50.0 / 60.0);

    private final LocalDate date;
    private final Coordinates observer;
    private final SolarCoordinates solar;
    @Getter(AccessLevel.NONE)
    private final SolarCoordinates previousSolar;
    @Getter(AccessLevel.NONE)
    private final SolarCoordinates nextSolar;
    private final double approximateTransit;
    private final ZonedDateTime transit;
    @Nullable
    private final ZonedDateTime sunrise;
    @Nullable
    private final ZonedDateTime sunset;

    public SolarTime(LocalDate date, Coordinates observer) {
        this.date = date;
        this.observer = observer;
        solar = SolarCoordinates.forJulianDay(julianDay(date));
        previousSolar = SolarCoordinates.forJulianDay(julianDay(date.minusDays(1)));
        nextSolar = SolarCoordinates.forJulianDay(julianDay(date.plusDays(1)));
        approximateTransit = nearLocalNoon(AstronomicalOps.approximateTransit(observer.longitudeAngle(),
                solar.apparentSiderealTime(), solar.rightAscension()), observer.longitude());
        double transitHours = AstronomicalOps.correctedTransit(approximateTransit, observer.longitudeAngle(),
                solar.apparentSiderealTime(), solar.rightAscension(), previousSolar.rightAscension(),
                nextSolar.rightAscension());
        transit = settingHour(transitHours, date);
        sunrise = timeForSolarAngle(SOLAR_ALTITUDE, false);
        sunset = timeForSolarAngle(SOLAR_ALTITUDE, true);
    }

    /**
     * @param angle the altitude of the sun, negative below the horizon
     * @param afterTransit whether to look for the descending (afternoon) or ascending (morning) crossing
     * @return the time the sun reaches the altitude, or {@code null} if it never does on this day
     */
    public @Nullable ZonedDateTime timeForSolarAngle(Angle angle, boolean afterTransit) {
        double hours = AstronomicalOps.correctedHourAngle(approximateTransit, angle, observer, afterTransit,
                solar.apparentSiderealTime(), solar.rightAscension(), previousSolar.rightAscension(),
                nextSolar.rightAscension(), solar.declination(), previousSolar.declination(),
                nextSolar.declination());
        return settingHour(hours, date);
    }

    /**
     * The afternoon time at which the shadow of an object is {@code shadowLength} times its height plus the length
     * of its shadow at noon.
     */
    public @Nullable ZonedDateTime afternoon(double shadowLength) {
        double tangent = Math.abs(observer.latitude() - solar.declination().degrees());
        double inverse = shadowLength + Math.tan(Math.toRadians(tangent));
        Angle angle = Angle.ofRadians(Math.atan(1.0 / inverse));
        return timeForSolarAngle(angle, true);
    }

    /**
     * Converts fractional hours since 0h UTC of the date into a time rounded to the nearest minute. Values outside of
     * [0, 24) roll over into the neighbouring days.
     */
    static @Nullable ZonedDateTime settingHour(double hours, LocalDate date) {
        if (!Double.isFinite(hours)) {
            return null;
        }
        double wholeHours = Math.floor(hours);
        double wholeMinutes = Math.floor((hours - wholeHours) * 60.0);
        double wholeSeconds = Math.floor((hours - (wholeHours + wholeMinutes / 60.0)) * 3600.0);
        long minutes = Math.round(wholeMinutes + wholeSeconds / 60.0);
        return date.atStartOfDay(ZoneOffset.UTC)
                   .plusHours((long) wholeHours)
                   .plusMinutes(minutes);
    }

    /**
     * Shifts the approximate transit, a fraction of the UTC day, by a whole day if it is more than half a day away from
     * the local mean noon of the date. Near the date line the transit of consecutive dates would otherwise jump between
     * the start and the end of the UTC day and two dates could describe the same solar day.
     */
    static double nearLocalNoon(double approximateTransit, double longitude) {
        double localNoon = 0.5 - longitude / 360.0;
        if (approximateTransit - localNoon >= 0.5) {
            return approximateTransit - 1.0;
        }
        if (approximateTransit - localNoon < -0.5) {
            return approximateTransit + 1.0;
        }
        return approximateTransit;
    }

    private static double julianDay(LocalDate date) {
        return AstronomicalOps.julianDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), 0.0);
    }
}
