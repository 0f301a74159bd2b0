package at.sv.prayer.time;

import at.sv.prayer.astronomy.Coordinates;
import at.sv.prayer.parameters.Parameters;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

public final class PrayerTimesProviderImpl implements PrayerTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Coordinates coordinates;
    private final Parameters parameters;
    private final ZoneId zone;

    public PrayerTimesProviderImpl(Coordinates coordinates, Parameters parameters, ZoneId zone) {
        this.coordinates = coordinates;
        this.parameters = parameters;
        this.zone = zone;
    }

    @Override
    public PrayerTimes getPrayerTimes(LocalDate date) {
        return new PrayerSchedule().on(date)
                                   .in(zone)
                                   .forLocation(coordinates)
                                   .withParameters(parameters)
                                   .calculate();
    }

    @Override
    public PrayerTimes getPrayerTimes(ZonedDateTime dateTime) {
        return getPrayerTimes(dateTime.withZoneSameInstant(zone).toLocalDate());
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        PrayerTimes times = getPrayerTimes(dateTime);
        return "midnight_yesterday: " + format(times.getMidnightYesterday()) +
               "\nqiyam_yesterday: " + format(times.getQiyamYesterday()) +
               "\nfajr: " + format(times.time(Prayer.FAJR)) +
               "\nsunrise: " + format(times.time(Prayer.SUNRISE)) +
               "\ndhuhr: " + format(times.time(Prayer.DHUHR)) +
               "\nasr: " + format(times.time(Prayer.ASR)) +
               "\nmaghrib: " + format(times.time(Prayer.MAGHRIB)) +
               "\nisha: " + format(times.time(Prayer.ISHA)) +
               "\nmidnight: " + format(times.getMidnight()) +
               "\nqiyam: " + format(times.time(Prayer.QIYAM)) +
               "\nfajr_tomorrow: " + format(times.getFajrTomorrow()) +
               "";
    }

    private String format(Optional<ZonedDateTime> time) {
        return time.map(TIME_FORMATTER::format).orElse("--:--:--");
    }
}
