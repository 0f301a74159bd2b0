package at.sv.prayer.astronomy;

import at.sv.prayer.parameters.Rounding;
import at.sv.prayer.parameters.Shafaq;

import java.time.ZonedDateTime;

/**
 * Low precision solar position formulas after Jean Meeus, "Astronomical Algorithms" (2nd edition). All functions
 * are pure, {@code T} always denotes the Julian century relative to J2000.0.
 */
public final class AstronomicalOps {

    private static final double J2000 = 2451545.0;
    private static final double DAYS_PER_CENTURY = 36525.0;

    private AstronomicalOps() {
    }

    /**
     * Geometric mean longitude of the sun, referred to the mean equinox of the date.
     */
    public static Angle meanSolarLongitude(double julianCentury) {
        double t = julianCentury;
        double term1 = 280.4664567;
        double term2 = 36000.76983 * t;
        double term3 = 0.0003032 * t * t;
        return new Angle(term1 + term2 + term3).unwound();
    }

    public static Angle meanLunarLongitude(double julianCentury) {
        double t = julianCentury;
        double term1 = 218.3165;
        double term2 = 481267.8813 * t;
        return new Angle(term1 + term2).unwound();
    }

    public static Angle ascendingLunarNodeLongitude(double julianCentury) {
        double t = julianCentury;
        double term1 = 125.04452;
        double term2 = 1934.136261 * t;
        double term3 = 0.0020708 * t * t;
        double term4 = t * t * t / 450000.0;
        return new Angle(term1 - term2 + term3 + term4).unwound();
    }

    public static Angle meanSolarAnomaly(double julianCentury) {
        double t = julianCentury;
        double term1 = 357.52911;
        double term2 = 35999.05029 * t;
        double term3 = 0.0001537 * t * t;
        return new Angle(term1 + term2 - term3).unwound();
    }

    /**
     * The difference between the true and the mean anomaly of the sun.
     */
    public static Angle solarEquationOfTheCenter(double julianCentury, Angle meanAnomaly) {
        double t = julianCentury;
        double m = meanAnomaly.radians();
        double term1 = (1.914602 - 0.004817 * t - 0.000014 * t * t) * Math.sin(m);
        double term2 = (0.019993 - 0.000101 * t) * Math.sin(2 * m);
        double term3 = 0.000289 * Math.sin(3 * m);
        return new Angle(term1 + term2 + term3);
    }

    /**
     * The true longitude corrected for nutation and aberration.
     */
    public static Angle apparentSolarLongitude(double julianCentury, Angle meanLongitude) {
        double t = julianCentury;
        double longitude = meanLongitude.plus(solarEquationOfTheCenter(t, meanSolarAnomaly(t))).degrees();
        double omega = Math.toRadians(125.04 - 1934.136 * t);
        return new Angle(longitude - 0.00569 - 0.00478 * Math.sin(omega)).unwound();
    }

    public static Angle meanObliquityOfTheEcliptic(double julianCentury) {
        double t = julianCentury;
        double term1 = 23.439291;
        double term2 = 0.013004167 * t;
        double term3 = 0.0000001639 * t * t;
        double term4 = 0.0000005036 * t * t * t;
        return new Angle(term1 - term2 - term3 + term4);
    }

    public static Angle apparentObliquityOfTheEcliptic(double julianCentury, Angle meanObliquity) {
        double omega = Math.toRadians(125.04 - 1934.136 * julianCentury);
        return new Angle(meanObliquity.degrees() + 0.00256 * Math.cos(omega));
    }

    /**
     * Mean sidereal time at Greenwich.
     */
    public static Angle meanSiderealTime(double julianCentury) {
        double t = julianCentury;
        double julianDay = t * DAYS_PER_CENTURY + J2000;
        double term1 = 280.46061837;
        double term2 = 360.98564736629 * (julianDay - J2000);
        double term3 = 0.000387933 * t * t;
        double term4 = t * t * t / 38710000.0;
        return new Angle(term1 + term2 + term3 - term4).unwound();
    }

    public static double nutationInLongitude(Angle solarLongitude, Angle lunarLongitude, Angle ascendingNode) {
        double l0 = solarLongitude.radians();
        double lp = lunarLongitude.radians();
        double omega = ascendingNode.radians();
        double term1 = (-17.2 / 3600.0) * Math.sin(omega);
        double term2 = (1.32 / 3600.0) * Math.sin(2 * l0);
        double term3 = (0.23 / 3600.0) * Math.sin(2 * lp);
        double term4 = (0.21 / 3600.0) * Math.sin(2 * omega);
        return term1 - term2 - term3 + term4;
    }

    public static double nutationInObliquity(Angle solarLongitude, Angle lunarLongitude, Angle ascendingNode) {
        double l0 = solarLongitude.radians();
        double lp = lunarLongitude.radians();
        double omega = ascendingNode.radians();
        double term1 = (9.2 / 3600.0) * Math.cos(omega);
        double term2 = (0.57 / 3600.0) * Math.cos(2 * l0);
        double term3 = (0.10 / 3600.0) * Math.cos(2 * lp);
        double term4 = (0.09 / 3600.0) * Math.cos(2 * omega);
        return term1 + term2 + term3 - term4;
    }

    /**
     * Mean sidereal time corrected by the nutation in longitude, projected onto the equator with the true obliquity.
     */
    public static Angle apparentSiderealTime(Angle meanSiderealTime, double nutationInLongitude, Angle meanObliquity,
                                             double nutationInObliquity) {
        double trueObliquity = Math.toRadians(meanObliquity.degrees() + nutationInObliquity);
        return new Angle(meanSiderealTime.degrees() + nutationInLongitude * Math.cos(trueObliquity));
    }

    /**
     * Altitude of a celestial body above the horizon.
     *
     * @param observerLatitude the latitude of the observer
     * @param declination the declination of the body
     * @param localHourAngle the local hour angle, measured westwards from the south
     */
    public static Angle altitudeOfCelestialBody(Angle observerLatitude, Angle declination, Angle localHourAngle) {
        double phi = observerLatitude.radians();
        double delta = declination.radians();
        double h = localHourAngle.radians();
        return Angle.ofRadians(Math.asin(Math.sin(phi) * Math.sin(delta) + Math.cos(phi) * Math.cos(delta) * Math.cos(h)));
    }

    /**
     * @return the fraction of the day (in [0, 1)) at which the body transits the local meridian
     */
    public static double approximateTransit(Angle longitude, Angle siderealTime, Angle rightAscension) {
        Angle westLongitude = longitude.times(-1);
        return Angle.normalizedToScale(rightAscension.plus(westLongitude).minus(siderealTime).degrees() / 360.0, 1.0);
    }

    /**
     * Refines the approximate transit with the interpolated right ascension of the surrounding days.
     *
     * @return the transit in hours since 0h UTC of the day
     */
    public static double correctedTransit(double approximateTransit, Angle longitude, Angle siderealTime,
                                          Angle rightAscension, Angle previousRightAscension,
                                          Angle nextRightAscension) {
        Angle westLongitude = longitude.times(-1);
        Angle theta = new Angle(siderealTime.degrees() + 360.985647 * approximateTransit).unwound();
        Angle alpha = interpolateAngles(rightAscension, previousRightAscension, nextRightAscension,
                approximateTransit).unwound();
        Angle hourAngle = theta.minus(westLongitude).minus(alpha).quadrantShifted();
        double correction = hourAngle.degrees() / -360.0;
        return (approximateTransit + correction) * 24.0;
    }

    /**
     * Time at which the sun reaches the given altitude before or after the transit. The result is {@code NaN} if the
     * sun never reaches the altitude on that day.
     *
     * @return hours since 0h UTC of the day
     */
    public static double correctedHourAngle(double approximateTransit, Angle angle, Coordinates coordinates,
                                            boolean afterTransit, Angle siderealTime,
                                            Angle rightAscension, Angle previousRightAscension,
                                            Angle nextRightAscension, Angle declination,
                                            Angle previousDeclination, Angle nextDeclination) {
        Angle latitude = coordinates.latitudeAngle();
        Angle westLongitude = coordinates.longitudeAngle().times(-1);
        double term1 = Math.sin(angle.radians()) - Math.sin(latitude.radians()) * Math.sin(declination.radians());
        double term2 = Math.cos(latitude.radians()) * Math.cos(declination.radians());
        Angle h0 = Angle.ofRadians(Math.acos(term1 / term2));
        double m = afterTransit ? approximateTransit + h0.degrees() / 360.0 : approximateTransit - h0.degrees() / 360.0;
        Angle theta = new Angle(siderealTime.degrees() + 360.985647 * m).unwound();
        Angle alpha = interpolateAngles(rightAscension, previousRightAscension, nextRightAscension, m).unwound();
        Angle delta = new Angle(interpolate(declination.degrees(), previousDeclination.degrees(),
                nextDeclination.degrees(), m));
        Angle hourAngle = theta.minus(westLongitude).minus(alpha);
        Angle altitude = altitudeOfCelestialBody(latitude, delta, hourAngle);
        double term3 = altitude.minus(angle).degrees();
        double term4 = 360.0 * Math.cos(delta.radians()) * Math.cos(latitude.radians()) * Math.sin(hourAngle.radians());
        return (m + term3 / term4) * 24.0;
    }

    /**
     * Second order interpolation between three tabular values one day apart.
     *
     * @param factor the interpolation factor, in days from the middle value
     */
    public static double interpolate(double value, double previousValue, double nextValue, double factor) {
        double a = value - previousValue;
        double b = nextValue - value;
        double c = b - a;
        return value + (factor / 2.0) * (a + b + factor * c);
    }

    /**
     * Like {@link #interpolate(double, double, double, double)}, but the differences are unwound so that the
     * interpolation works across 0°/360°.
     */
    public static Angle interpolateAngles(Angle value, Angle previousValue, Angle nextValue, double factor) {
        double a = value.minus(previousValue).unwound().degrees();
        double b = nextValue.minus(value).unwound().degrees();
        double c = b - a;
        return new Angle(value.degrees() + (factor / 2.0) * (a + b + factor * c));
    }

    public static double julianDay(int year, int month, int day, double hours) {
        int y = month > 2 ? year : year - 1;
        int m = month > 2 ? month : month + 12;
        double d = day + hours / 24.0;
        int a = y / 100;
        int b = 2 - a + a / 4;
        int i0 = (int) (365.25 * (y + 4716));
        int i1 = (int) (30.6001 * (m + 1));
        return i0 + i1 + d + b - 1524.5;
    }

    public static double julianCentury(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }

    public static boolean isLeapYear(int year) {
        if (year % 400 == 0) {
            return true;
        }
        return year % 4 == 0 && year % 100 != 0;
    }

    /**
     * Days elapsed since the winter solstice of the observer's hemisphere, in [0, days in year).
     */
    public static int daysSinceSolstice(int dayOfYear, int year, double latitude) {
        int daysInYear = isLeapYear(year) ? 366 : 365;
        if (latitude >= 0) {
            int days = dayOfYear + 10;
            return days >= daysInYear ? days - daysInYear : days;
        }
        int days = dayOfYear - (isLeapYear(year) ? 173 : 172);
        return days < 0 ? days + daysInYear : days;
    }

    /**
     * The earliest Fajr that is still considered valid for the season, following the Moonsighting Committee
     * observations.
     */
    public static ZonedDateTime seasonAdjustedMorningTwilight(double latitude, int dayOfYear, int year,
                                                              ZonedDateTime sunrise) {
        double lat = Math.abs(latitude);
        double a = 75.0 + 28.65 / 55.0 * lat;
        double b = 75.0 + 19.44 / 55.0 * lat;
        double c = 75.0 + 32.74 / 55.0 * lat;
        double d = 75.0 + 48.10 / 55.0 * lat;
        double minutes = twilightAdjustment(a, b, c, d, daysSinceSolstice(dayOfYear, year, latitude));
        return sunrise.plusSeconds(Math.round(minutes * -60.0));
    }

    /**
     * The latest Isha that is still considered valid for the season and the given twilight, rounded to the nearest
     * minute.
     */
    public static ZonedDateTime seasonAdjustedEveningTwilight(double latitude, int dayOfYear, int year,
                                                              ZonedDateTime sunset, Shafaq shafaq) {
        double lat = Math.abs(latitude);
        double a, b, c, d;
        switch (shafaq) {
            case AHMER -> {
                a = 62.0 + 17.40 / 55.0 * lat;
                b = 62.0 - 7.16 / 55.0 * lat;
                c = 62.0 + 5.12 / 55.0 * lat;
                d = 62.0 + 19.44 / 55.0 * lat;
            }
            case ABYAD -> {
                a = 75.0 + 25.60 / 55.0 * lat;
                b = 75.0 + 7.16 / 55.0 * lat;
                c = 75.0 + 36.84 / 55.0 * lat;
                d = 75.0 + 81.84 / 55.0 * lat;
            }
            default -> {
                a = 75.0 + 25.60 / 55.0 * lat;
                b = 75.0 + 2.050 / 55.0 * lat;
                c = 75.0 - 9.21 / 55.0 * lat;
                d = 75.0 + 6.14 / 55.0 * lat;
            }
        }
        double minutes = twilightAdjustment(a, b, c, d, daysSinceSolstice(dayOfYear, year, latitude));
        return Rounding.NEAREST.round(sunset.plusSeconds(Math.round(minutes * 60.0)));
    }

    /**
     * Piecewise linear interpolation of the twilight length in minutes between the values at the winter solstice
     * (a), the equinoxes (b, c) and the summer solstice (d).
     */
    static double twilightAdjustment(double a, double b, double c, double d, int daysSinceSolstice) {
        int dyy = daysSinceSolstice;
        if (dyy < 91) {
            return a + (b - a) / 91.0 * dyy;
        } else if (dyy < 137) {
            return b + (c - b) / 46.0 * (dyy - 91);
        } else if (dyy < 183) {
            return c + (d - c) / 46.0 * (dyy - 137);
        } else if (dyy < 229) {
            return d + (c - d) / 46.0 * (dyy - 183);
        } else if (dyy < 275) {
            return c + (b - c) / 46.0 * (dyy - 229);
        }
        return b + (a - b) / 91.0 * (dyy - 275);
    }
}
