package at.sv.prayer.time;

import at.sv.prayer.astronomy.Coordinates;
import at.sv.prayer.parameters.CalculationMethod;
import at.sv.prayer.parameters.CalculationMethods;
import at.sv.prayer.parameters.HighLatitudeRule;
import at.sv.prayer.parameters.Madhab;
import at.sv.prayer.parameters.Parameters;
import at.sv.prayer.parameters.TimeAdjustments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class PrayerTimesTest {

    private Coordinates raleigh;
    private PrayerTimes times;

    private static ZonedDateTime utc(int month, int day, int hour, int minute) {
        return ZonedDateTime.of(2015, month, day, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    private static void assertTime(Optional<ZonedDateTime> time, LocalDateTime expected) {
        assertThat(time).isPresent();
        assertThat(time.get().withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime()).isEqualTo(expected);
    }

    private static PrayerTimes calculate(LocalDate date, Coordinates coordinates, Parameters parameters) {
        return new PrayerSchedule().on(date)
                                   .forLocation(coordinates)
                                   .withParameters(parameters)
                                   .calculate();
    }

    @BeforeEach
    void setUp() {
        raleigh = new Coordinates(35.7750, -78.6336);
        times = calculate(LocalDate.of(2015, 7, 12), raleigh,
                Parameters.with(CalculationMethod.NORTH_AMERICA, Madhab.HANAFI));
    }

    @Test
    void northAmerica_hanafi_dailyTimes() {
        assertTime(times.time(Prayer.FAJR), LocalDateTime.of(2015, 7, 12, 8, 42));
        assertTime(times.time(Prayer.SUNRISE), LocalDateTime.of(2015, 7, 12, 10, 8));
        assertTime(times.time(Prayer.DHUHR), LocalDateTime.of(2015, 7, 12, 17, 21));
        assertTime(times.time(Prayer.ASR), LocalDateTime.of(2015, 7, 12, 22, 22));
        assertTime(times.time(Prayer.MAGHRIB), LocalDateTime.of(2015, 7, 13, 0, 32));
        assertTime(times.time(Prayer.ISHA), LocalDateTime.of(2015, 7, 13, 1, 57));
    }

    @Test
    void nightTimes_basedOnMaghribAndFajrOfNextDay() {
        assertTime(times.getFajrTomorrow(), LocalDateTime.of(2015, 7, 13, 8, 43));
        assertTime(times.getMidnight(), LocalDateTime.of(2015, 7, 13, 4, 38));
        assertTime(times.time(Prayer.QIYAM), LocalDateTime.of(2015, 7, 13, 5, 59));
        assertTime(times.time(Prayer.AFTER_MIDNIGHT), LocalDateTime.of(2015, 7, 13, 4, 38));
        assertThat(times.getQiyamYesterday()).isPresent();
        assertThat(times.getQiyamYesterday().get()).isBefore(times.time(Prayer.FAJR).get());
    }

    @Test
    void restrictedPeriods_twentyMinutes() {
        assertTime(times.time(Prayer.DURING_SUNRISE), LocalDateTime.of(2015, 7, 12, 10, 8));
        assertTime(times.time(Prayer.DURING_SUNSET), LocalDateTime.of(2015, 7, 13, 0, 12));
    }

    @ParameterizedTest
    @CsvSource({
            "7, 12, 3, 0, AFTER_MIDNIGHT",
            "7, 12, 8, 0, QIYAM",
            "7, 12, 8, 42, FAJR",
            "7, 12, 9, 0, FAJR",
            "7, 12, 10, 8, DURING_SUNRISE",
            "7, 12, 10, 20, DURING_SUNRISE",
            "7, 12, 10, 28, SUNRISE",
            "7, 12, 11, 0, SUNRISE",
            "7, 12, 19, 0, DHUHR",
            "7, 12, 22, 26, ASR",
            "7, 13, 0, 20, DURING_SUNSET",
            "7, 13, 1, 0, MAGHRIB",
            "7, 13, 2, 0, ISHA",
            "7, 13, 5, 0, AFTER_MIDNIGHT",
            "7, 13, 6, 30, QIYAM",
            "7, 13, 9, 0, FAJR",
    })
    void current(int month, int day, int hour, int minute, Prayer expected) {
        assertThat(times.current(utc(month, day, hour, minute))).isEqualTo(expected);
    }

    @Test
    void current_independentOfZoneOfGivenTime() {
        ZonedDateTime fajrInNewYork = utc(7, 12, 9, 0).withZoneSameInstant(ZoneId.of("America/New_York"));

        assertThat(times.current(fajrInNewYork)).isEqualTo(Prayer.FAJR);
    }

    @Test
    void next_andNextTime() {
        assertNext(utc(7, 12, 9, 0), Prayer.DURING_SUNRISE, LocalDateTime.of(2015, 7, 12, 10, 8));
        assertNext(utc(7, 12, 10, 20), Prayer.SUNRISE, LocalDateTime.of(2015, 7, 12, 10, 28));
        assertNext(utc(7, 12, 11, 0), Prayer.DHUHR, LocalDateTime.of(2015, 7, 12, 17, 21));
        assertNext(utc(7, 12, 19, 0), Prayer.ASR, LocalDateTime.of(2015, 7, 12, 22, 22));
        assertNext(utc(7, 12, 22, 26), Prayer.DURING_SUNSET, LocalDateTime.of(2015, 7, 13, 0, 12));
        assertNext(utc(7, 13, 0, 20), Prayer.MAGHRIB, LocalDateTime.of(2015, 7, 13, 0, 32));
        assertNext(utc(7, 13, 1, 0), Prayer.ISHA, LocalDateTime.of(2015, 7, 13, 1, 57));
        assertNext(utc(7, 13, 2, 0), Prayer.AFTER_MIDNIGHT, LocalDateTime.of(2015, 7, 13, 4, 38));
        assertNext(utc(7, 13, 5, 0), Prayer.QIYAM, LocalDateTime.of(2015, 7, 13, 5, 59));
        assertNext(utc(7, 13, 6, 30), Prayer.FAJR, LocalDateTime.of(2015, 7, 13, 8, 43));
        assertNext(utc(7, 12, 8, 0), Prayer.FAJR, LocalDateTime.of(2015, 7, 12, 8, 42));
    }

    @Test
    void next_beforeQiyamOfPreviousNight_isQiyam() {
        ZonedDateTime time = utc(7, 12, 3, 0);

        assertThat(times.next(time)).isEqualTo(Prayer.QIYAM);
        assertThat(times.nextTime(time)).isEqualTo(times.getQiyamYesterday());
    }

    @Test
    void next_afterFajrOfNextDay_isSunriseOfNextDay() {
        ZonedDateTime time = utc(7, 13, 9, 0);

        assertThat(times.next(time)).isEqualTo(Prayer.DURING_SUNRISE);
        assertThat(times.nextTime(time)).isPresent();
        assertThat(times.nextTime(time).get()).isAfter(time);
    }

    private void assertNext(ZonedDateTime time, Prayer expected, LocalDateTime expectedStart) {
        assertThat(times.next(time)).isEqualTo(expected);
        assertTime(times.nextTime(time), expectedStart);
    }

    @Test
    void timeRemaining() {
        assertThat(times.timeRemaining(utc(7, 12, 9, 0))).contains(Duration.ofMinutes(68));
        assertThat(times.timeRemaining(utc(7, 12, 10, 8))).contains(Duration.ofMinutes(20));
        assertThat(times.timeRemaining(utc(7, 13, 6, 30))).contains(Duration.ofHours(2).plusMinutes(13));
    }

    @Test
    void nextPeriodStartsWithTheNextPrayer_throughoutTheDay() {
        ZonedDateTime start = times.getQiyamYesterday().orElseThrow();
        ZonedDateTime end = times.getFajrTomorrow().orElseThrow();

        for (ZonedDateTime time = start; time.isBefore(end); time = time.plusMinutes(7)) {
            Optional<ZonedDateTime> nextTime = times.nextTime(time);
            assertThat(nextTime).as("next time at %s", time).isPresent();
            assertThat(nextTime.get()).as("next time at %s", time).isAfterOrEqualTo(time);
            assertThat(times.current(nextTime.get())).as("current at next time of %s", time)
                                                      .isEqualTo(times.next(time));
            assertThat(times.timeRemaining(time)).hasValueSatisfying(remaining ->
                    assertThat(remaining.isNegative()).isFalse());
        }
    }

    @Test
    void nextPeriodStartsWithTheNextPrayer_shortSummerNight() {
        PrayerTimes london = calculate(LocalDate.of(2024, 6, 19), new Coordinates(51.5074, -0.1278),
                CalculationMethods.parameters(CalculationMethod.MUSLIM_WORLD_LEAGUE));
        ZonedDateTime start = london.getQiyamYesterday().orElseThrow();
        ZonedDateTime end = london.getFajrTomorrow().orElseThrow();

        for (ZonedDateTime time = start; time.isBefore(end); time = time.plusMinutes(1)) {
            Optional<ZonedDateTime> nextTime = london.nextTime(time);
            assertThat(nextTime).as("next time at %s", time).isPresent();
            assertThat(nextTime.get()).as("next time at %s", time).isAfter(time);
            assertThat(london.current(nextTime.get())).as("current at next time of %s", time)
                                                       .isEqualTo(london.next(time));
        }
    }

    @Test
    void next_ishaAfterMidnight_skipsToAfterMidnight() {
        PrayerTimes london = calculate(LocalDate.of(2024, 6, 19), new Coordinates(51.5074, -0.1278),
                CalculationMethods.parameters(CalculationMethod.MUSLIM_WORLD_LEAGUE));
        ZonedDateTime afterMaghrib = london.time(Prayer.MAGHRIB).orElseThrow().plusMinutes(1);

        assertThat(london.getMidnight().orElseThrow()).isBefore(london.time(Prayer.ISHA).orElseThrow());
        assertThat(london.current(afterMaghrib)).isEqualTo(Prayer.MAGHRIB);
        assertThat(london.next(afterMaghrib)).isEqualTo(Prayer.AFTER_MIDNIGHT);
        assertThat(london.nextTime(afterMaghrib)).isEqualTo(london.getMidnight());
    }

    @ParameterizedTest
    @CsvSource({
            "-18.1416, 178.4419, Pacific/Fiji",
            "-18.0, -179.9, Etc/GMT+12",
    })
    void nearDateLine_timesAreOrderedEveryDay(double latitude, double longitude, String zone) {
        Coordinates observer = new Coordinates(latitude, longitude);
        ZoneId zoneId = ZoneId.of(zone);
        Parameters parameters = CalculationMethods.parameters(CalculationMethod.MUSLIM_WORLD_LEAGUE);

        for (LocalDate day = LocalDate.of(2024, 1, 1); day.getYear() == 2024; day = day.plusDays(1)) {
            PrayerTimes schedule = new PrayerSchedule().on(day)
                                                       .in(zoneId)
                                                       .forLocation(observer)
                                                       .withParameters(parameters)
                                                       .calculate();
            List<ZonedDateTime> ordered = List.of(
                    schedule.getMidnightYesterday().orElseThrow(),
                    schedule.getQiyamYesterday().orElseThrow(),
                    schedule.time(Prayer.FAJR).orElseThrow(),
                    schedule.time(Prayer.SUNRISE).orElseThrow(),
                    schedule.time(Prayer.DHUHR).orElseThrow(),
                    schedule.time(Prayer.ASR).orElseThrow(),
                    schedule.time(Prayer.MAGHRIB).orElseThrow(),
                    schedule.time(Prayer.ISHA).orElseThrow(),
                    schedule.getMidnight().orElseThrow(),
                    schedule.time(Prayer.QIYAM).orElseThrow(),
                    schedule.getFajrTomorrow().orElseThrow());
            for (int i = 1; i < ordered.size(); i++) {
                assertThat(ordered.get(i)).as("%s: %s", day, ordered).isAfter(ordered.get(i - 1));
            }
            assertThat(schedule.time(Prayer.DHUHR).orElseThrow().toLocalDate()).as("dhuhr on %s", day)
                                                                               .isEqualTo(day);
        }
    }

    @Test
    void midnightYesterday_isBeforeQiyamOfPreviousNight() {
        ZonedDateTime midnightYesterday = times.getMidnightYesterday().orElseThrow();
        ZonedDateTime qiyamYesterday = times.getQiyamYesterday().orElseThrow();

        assertThat(midnightYesterday).isBefore(qiyamYesterday);
        assertThat(midnightYesterday).isAfter(utc(7, 12, 4, 0)).isBefore(utc(7, 12, 5, 0));
        assertThat(times.current(midnightYesterday)).isEqualTo(Prayer.AFTER_MIDNIGHT);
    }

    @Test
    void times_areOrdered() {
        List<Prayer> order = List.of(Prayer.FAJR, Prayer.SUNRISE, Prayer.DHUHR, Prayer.ASR, Prayer.MAGHRIB,
                Prayer.ISHA, Prayer.AFTER_MIDNIGHT, Prayer.QIYAM);
        for (int i = 1; i < order.size(); i++) {
            assertThat(times.time(order.get(i)).orElseThrow())
                    .as("%s after %s", order.get(i), order.get(i - 1))
                    .isAfter(times.time(order.get(i - 1)).orElseThrow());
        }
        assertThat(times.getFajrTomorrow().orElseThrow()).isAfter(times.time(Prayer.QIYAM).orElseThrow());
    }

    @Test
    void times_areReturnedInScheduleZone() {
        ZoneId newYork = ZoneId.of("America/New_York");
        PrayerTimes local = new PrayerSchedule().on(LocalDate.of(2015, 7, 12))
                                                .in(newYork)
                                                .forLocation(raleigh)
                                                .withParameters(Parameters.with(CalculationMethod.NORTH_AMERICA,
                                                        Madhab.HANAFI))
                                                .calculate();

        ZonedDateTime fajr = local.time(Prayer.FAJR).orElseThrow();
        assertThat(fajr.getZone()).isEqualTo(newYork);
        assertThat(fajr.toLocalDateTime()).isEqualTo(LocalDateTime.of(2015, 7, 12, 4, 42));
        assertThat(local.time(Prayer.ISHA).orElseThrow().toLocalDateTime())
                .isEqualTo(LocalDateTime.of(2015, 7, 12, 21, 57));
        assertThat(local.getZone()).isEqualTo(newYork);
    }

    @Test
    void moonsightingCommittee_shafi() {
        PrayerTimes moonsighting = calculate(LocalDate.of(2016, 1, 31), raleigh,
                Parameters.with(CalculationMethod.MOONSIGHTING_COMMITTEE, Madhab.SHAFI));

        assertTime(moonsighting.time(Prayer.FAJR), LocalDateTime.of(2016, 1, 31, 10, 48));
        assertTime(moonsighting.time(Prayer.SUNRISE), LocalDateTime.of(2016, 1, 31, 12, 16));
        assertTime(moonsighting.time(Prayer.DHUHR), LocalDateTime.of(2016, 1, 31, 17, 33));
        assertTime(moonsighting.time(Prayer.ASR), LocalDateTime.of(2016, 1, 31, 20, 20));
        assertTime(moonsighting.time(Prayer.MAGHRIB), LocalDateTime.of(2016, 1, 31, 22, 43));
        assertTime(moonsighting.time(Prayer.ISHA), LocalDateTime.of(2016, 2, 1, 0, 5));
    }

    @Test
    void moonsightingCommittee_highLatitude_usesSeventhOfTheNight() {
        PrayerTimes oslo = calculate(LocalDate.of(2016, 1, 1), new Coordinates(59.9094, 10.7349),
                Parameters.with(CalculationMethod.MOONSIGHTING_COMMITTEE, Madhab.HANAFI));

        assertTime(oslo.time(Prayer.FAJR), LocalDateTime.of(2016, 1, 1, 6, 34));
        assertTime(oslo.time(Prayer.SUNRISE), LocalDateTime.of(2016, 1, 1, 8, 19));
        assertTime(oslo.time(Prayer.DHUHR), LocalDateTime.of(2016, 1, 1, 11, 25));
        assertTime(oslo.time(Prayer.ASR), LocalDateTime.of(2016, 1, 1, 12, 36));
        assertTime(oslo.time(Prayer.MAGHRIB), LocalDateTime.of(2016, 1, 1, 14, 25));
        assertTime(oslo.time(Prayer.ISHA), LocalDateTime.of(2016, 1, 1, 16, 2));
    }

    @Test
    void ishaInterval_fixedMinutesAfterMaghrib() {
        Parameters parameters = Parameters.with(CalculationMethod.NORTH_AMERICA, Madhab.HANAFI)
                                          .toBuilder()
                                          .ishaInterval(90)
                                          .build();

        PrayerTimes interval = calculate(LocalDate.of(2015, 7, 12), raleigh, parameters);

        assertThat(Duration.between(interval.time(Prayer.MAGHRIB).orElseThrow(),
                interval.time(Prayer.ISHA).orElseThrow())).isEqualTo(Duration.ofMinutes(90));
    }

    @Test
    void userAdjustments_areAddedToTimes() {
        Parameters parameters = Parameters.with(CalculationMethod.NORTH_AMERICA, Madhab.HANAFI)
                                          .toBuilder()
                                          .adjustments(TimeAdjustments.builder().fajr(2).asr(-3).build())
                                          .build();

        PrayerTimes adjusted = calculate(LocalDate.of(2015, 7, 12), raleigh, parameters);

        assertTime(adjusted.time(Prayer.FAJR), LocalDateTime.of(2015, 7, 12, 8, 44));
        assertTime(adjusted.time(Prayer.ASR), LocalDateTime.of(2015, 7, 12, 22, 19));
        assertTime(adjusted.time(Prayer.DHUHR), LocalDateTime.of(2015, 7, 12, 17, 21));
    }

    @Test
    void shafiAsr_isBeforeHanafiAsr() {
        PrayerTimes shafi = calculate(LocalDate.of(2015, 7, 12), raleigh,
                Parameters.with(CalculationMethod.NORTH_AMERICA, Madhab.SHAFI));

        assertThat(shafi.time(Prayer.ASR).orElseThrow()).isBefore(times.time(Prayer.ASR).orElseThrow());
        assertThat(shafi.time(Prayer.DHUHR)).isEqualTo(times.time(Prayer.DHUHR));
    }

    @Test
    void polarDay_sunDoesNotSet_noMaghrib() {
        PrayerTimes svalbard = calculate(LocalDate.of(2016, 6, 21), new Coordinates(78.2232, 15.6267),
                Parameters.with(CalculationMethod.MUSLIM_WORLD_LEAGUE, Madhab.SHAFI)
                          .toBuilder()
                          .highLatitudeRule(HighLatitudeRule.SEVENTH_OF_THE_NIGHT)
                          .build());

        assertThat(svalbard.time(Prayer.SUNRISE)).isEmpty();
        assertThat(svalbard.time(Prayer.MAGHRIB)).isEmpty();
        assertThat(svalbard.time(Prayer.ISHA)).isEmpty();
        assertThat(svalbard.time(Prayer.DURING_SUNSET)).isEmpty();
        assertThat(svalbard.getMidnight()).isEmpty();
        assertThat(svalbard.time(Prayer.DHUHR)).isPresent();

        ZonedDateTime noon = svalbard.time(Prayer.DHUHR).orElseThrow().plusMinutes(1);
        assertThatCode(() -> svalbard.current(noon)).doesNotThrowAnyException();
        assertThatCode(() -> svalbard.next(noon)).doesNotThrowAnyException();
        assertThat(svalbard.current(noon)).isEqualTo(Prayer.DHUHR);
    }
}
