package at.sv.prayer.astronomy;

/**
 * Position of the sun on the celestial sphere for a given Julian day.
 *
 * @param declination angle between the rays of the sun and the plane of the earth's equator
 * @param rightAscension angular distance on the celestial equator from the vernal equinox to the hour circle
 * @param apparentSiderealTime hour angle of the vernal equinox
 */
public record SolarCoordinates(Angle declination, Angle rightAscension, Angle apparentSiderealTime) {

    public static SolarCoordinates forJulianDay(double julianDay) {
        double t = AstronomicalOps.julianCentury(julianDay);
        Angle meanSolarLongitude = AstronomicalOps.meanSolarLongitude(t);
        Angle meanLunarLongitude = AstronomicalOps.meanLunarLongitude(t);
        Angle ascendingNode = AstronomicalOps.ascendingLunarNodeLongitude(t);
        double lambda = AstronomicalOps.apparentSolarLongitude(t, meanSolarLongitude).radians();

        Angle meanSiderealTime = AstronomicalOps.meanSiderealTime(t);
        double nutationInLongitude = AstronomicalOps.nutationInLongitude(meanSolarLongitude, meanLunarLongitude, ascendingNode);
        double nutationInObliquity = AstronomicalOps.nutationInObliquity(meanSolarLongitude, meanLunarLongitude, ascendingNode);

        Angle meanObliquity = AstronomicalOps.meanObliquityOfTheEcliptic(t);
        double epsilon = AstronomicalOps.apparentObliquityOfTheEcliptic(t, meanObliquity).radians();

        Angle declination = Angle.ofRadians(Math.asin(Math.sin(epsilon) * Math.sin(lambda)));
        Angle rightAscension = Angle.ofRadians(Math.atan2(Math.cos(epsilon) * Math.sin(lambda), Math.cos(lambda)))
                                    .unwound();
        Angle apparentSiderealTime = AstronomicalOps.apparentSiderealTime(meanSiderealTime, nutationInLongitude,
                meanObliquity, nutationInObliquity);
        return new SolarCoordinates(declination, rightAscension, apparentSiderealTime);
    }
}
