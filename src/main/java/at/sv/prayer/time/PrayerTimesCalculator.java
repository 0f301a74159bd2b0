package at.sv.prayer.time;

import at.sv.prayer.astronomy.Angle;
import at.sv.prayer.astronomy.AstronomicalOps;
import at.sv.prayer.astronomy.Coordinates;
import at.sv.prayer.astronomy.SolarTime;
import at.sv.prayer.parameters.CalculationMethod;
import at.sv.prayer.parameters.Parameters;
import at.sv.prayer.parameters.Rounding;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Derives the prayer times of a day from the solar events at the location. Intermediate values are in UTC.
 */
@RequiredArgsConstructor
final class PrayerTimesCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(PrayerTimesCalculator.class);

    /**
     * Above this latitude the Moonsighting Committee uses a seventh of the night instead of the twilight angles.
     */
    private static final double MOONSIGHTING_HIGH_LATITUDE = 55.0;

    private final Coordinates coordinates;
    private final Parameters parameters;

    PrayerTimes calculate(LocalDate date, ZoneId zone) {
        SolarTime yesterday = new SolarTime(date.minusDays(1), coordinates);
        SolarTime today = new SolarTime(date, coordinates);
        SolarTime tomorrow = new SolarTime(date.plusDays(1), coordinates);
        SolarTime dayAfterTomorrow = new SolarTime(date.plusDays(2), coordinates);

        ZonedDateTime fajr = round(fajr(today, nightLength(today, tomorrow)));
        ZonedDateTime sunrise = round(adjust(today.getSunrise(), Prayer.SUNRISE));
        ZonedDateTime dhuhr = round(adjust(today.getTransit(), Prayer.DHUHR));
        ZonedDateTime asr = round(adjust(today.afternoon(parameters.getMadhab().getShadowLength()), Prayer.ASR));
        ZonedDateTime maghrib = round(maghrib(today));
        ZonedDateTime isha = round(isha(today, nightLength(today, tomorrow)));
        ZonedDateTime fajrTomorrow = round(fajr(tomorrow, nightLength(tomorrow, dayAfterTomorrow)));
        ZonedDateTime maghribYesterday = round(maghrib(yesterday));

        if (sunrise == null || maghrib == null) {
            LOG.debug("The sun does not rise or set at {} on {}", coordinates, date);
        }

        return PrayerTimes.builder()
                          .date(date)
                          .zone(zone)
                          .midnightYesterday(portionOfNight(maghribYesterday, fajr, 1.0 / 2.0))
                          .qiyamYesterday(portionOfNight(maghribYesterday, fajr, 2.0 / 3.0))
                          .fajr(fajr)
                          .sunrise(sunrise)
                          .dhuhr(dhuhr)
                          .asr(asr)
                          .maghrib(maghrib)
                          .isha(isha)
                          .midnight(portionOfNight(maghrib, fajrTomorrow, 1.0 / 2.0))
                          .qiyam(portionOfNight(maghrib, fajrTomorrow, 2.0 / 3.0))
                          .fajrTomorrow(fajrTomorrow)
                          .sunriseTomorrow(round(adjust(tomorrow.getSunrise(), Prayer.SUNRISE)))
                          .build();
    }

    /**
     * The later of the twilight angle time and the earliest time allowed by the high latitude rule.
     */
    private @Nullable ZonedDateTime fajr(SolarTime solarTime, @Nullable Duration night) {
        ZonedDateTime sunrise = solarTime.getSunrise();
        if (sunrise == null) {
            return null;
        }
        ZonedDateTime fajr;
        if (isMoonsightingAtHighLatitude() && night != null) {
            fajr = sunrise.minusSeconds(night.getSeconds() / 7);
        } else {
            fajr = solarTime.timeForSolarAngle(new Angle(-parameters.getFajrAngle()), false);
        }

        ZonedDateTime safeFajr = null;
        if (isMoonsighting()) {
            LocalDate date = solarTime.getDate();
            safeFajr = AstronomicalOps.seasonAdjustedMorningTwilight(coordinates.latitude(), date.getDayOfYear(),
                    date.getYear(), sunrise);
        } else if (night != null) {
            double portion = parameters.nightPortions().fajr();
            safeFajr = sunrise.minusSeconds((long) (portion * night.getSeconds()));
        }

        if (fajr == null || safeFajr != null && fajr.isBefore(safeFajr)) {
            fajr = safeFajr;
        }
        return adjust(fajr, Prayer.FAJR);
    }

    /**
     * The earlier of the twilight angle time and the latest time allowed by the high latitude rule, or a fixed
     * interval after sunset.
     */
    private @Nullable ZonedDateTime isha(SolarTime solarTime, @Nullable Duration night) {
        ZonedDateTime sunset = solarTime.getSunset();
        if (sunset == null) {
            return null;
        }
        if (parameters.getIshaInterval() > 0) {
            return adjust(sunset.plusMinutes(parameters.getIshaInterval()), Prayer.ISHA);
        }

        ZonedDateTime safeIsha = null;
        if (isMoonsighting()) {
            LocalDate date = solarTime.getDate();
            safeIsha = AstronomicalOps.seasonAdjustedEveningTwilight(coordinates.latitude(), date.getDayOfYear(),
                    date.getYear(), sunset, parameters.getShafaq());
        } else if (night != null) {
            double portion = parameters.nightPortions().isha();
            safeIsha = sunset.plusSeconds((long) (portion * night.getSeconds()));
        }

        ZonedDateTime isha;
        if (isMoonsightingAtHighLatitude() && night != null) {
            isha = sunset.plusSeconds(night.getSeconds() / 7);
        } else {
            isha = solarTime.timeForSolarAngle(new Angle(-parameters.getIshaAngle()), true);
        }

        if (isha == null || safeIsha != null && isha.isAfter(safeIsha)) {
            isha = safeIsha;
        }
        return adjust(isha, Prayer.ISHA);
    }

    /**
     * Sunset, or the time the sun reaches the Maghrib angle if that is configured and later.
     */
    private @Nullable ZonedDateTime maghrib(SolarTime solarTime) {
        ZonedDateTime maghrib = solarTime.getSunset();
        if (maghrib != null && parameters.getMaghribAngle() > 0) {
            ZonedDateTime angleTime = solarTime.timeForSolarAngle(new Angle(-parameters.getMaghribAngle()), true);
            if (angleTime != null && angleTime.isAfter(maghrib)) {
                maghrib = angleTime;
            }
        }
        return adjust(maghrib, Prayer.MAGHRIB);
    }

    private static @Nullable Duration nightLength(SolarTime solarTime, SolarTime nextDay) {
        if (solarTime.getSunset() == null || nextDay.getSunrise() == null) {
            return null;
        }
        return Duration.between(solarTime.getSunset(), nextDay.getSunrise());
    }

    /**
     * @return the time the given fraction of the night between Maghrib and Fajr has passed, to the nearest minute
     */
    private static @Nullable ZonedDateTime portionOfNight(@Nullable ZonedDateTime maghrib, @Nullable ZonedDateTime fajr,
                                                          double fraction) {
        if (maghrib == null || fajr == null) {
            return null;
        }
        long nightSeconds = Duration.between(maghrib, fajr).getSeconds();
        return Rounding.NEAREST.round(maghrib.plusSeconds((long) (nightSeconds * fraction)));
    }

    private boolean isMoonsighting() {
        return parameters.getMethod() == CalculationMethod.MOONSIGHTING_COMMITTEE;
    }

    private boolean isMoonsightingAtHighLatitude() {
        return isMoonsighting() && coordinates.latitude() >= MOONSIGHTING_HIGH_LATITUDE;
    }

    private @Nullable ZonedDateTime adjust(@Nullable ZonedDateTime time, Prayer prayer) {
        return time == null ? null : time.plusMinutes(parameters.timeAdjustment(prayer));
    }

    private @Nullable ZonedDateTime round(@Nullable ZonedDateTime time) {
        return time == null ? null : parameters.getRounding().round(time);
    }
}
