package at.sv.prayer.time;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The prayer times of a single day, together with the neighbouring times needed to tell which period a given
 * instant belongs to.
 * <p>
 * The covered window reaches from the Qiyam of the previous night to the Fajr of the following day. All times are
 * returned in the zone of the schedule. Times the sun does not define at the location (e.g. during polar day) are
 * absent.
 */
@Builder(access = AccessLevel.PACKAGE)
public final class PrayerTimes {

    /**
     * Length of the restricted periods right after sunrise and right before Maghrib.
     */
    public static final Duration RESTRICTED_PERIOD = Duration.ofMinutes(20);

    @Getter
    private final LocalDate date;
    @Getter
    private final ZoneId zone;
    private final @Nullable ZonedDateTime midnightYesterday;
    private final @Nullable ZonedDateTime qiyamYesterday;
    private final @Nullable ZonedDateTime fajr;
    private final @Nullable ZonedDateTime sunrise;
    private final @Nullable ZonedDateTime dhuhr;
    private final @Nullable ZonedDateTime asr;
    private final @Nullable ZonedDateTime maghrib;
    private final @Nullable ZonedDateTime isha;
    private final @Nullable ZonedDateTime midnight;
    private final @Nullable ZonedDateTime qiyam;
    private final @Nullable ZonedDateTime fajrTomorrow;
    private final @Nullable ZonedDateTime sunriseTomorrow;

    /**
     * @return the start of the given period on this day
     */
    public Optional<ZonedDateTime> time(Prayer prayer) {
        return inZone(startOf(prayer));
    }

    /**
     * @return the middle of the night between Maghrib and the Fajr of the following day
     */
    public Optional<ZonedDateTime> getMidnight() {
        return inZone(midnight);
    }

    public Optional<ZonedDateTime> getFajrTomorrow() {
        return inZone(fajrTomorrow);
    }

    /**
     * @return the middle of the previous night, between Maghrib of the previous day and Fajr of this day
     */
    public Optional<ZonedDateTime> getMidnightYesterday() {
        return inZone(midnightYesterday);
    }

    /**
     * @return the start of the last third of the previous night, which precedes Fajr of this day
     */
    public Optional<ZonedDateTime> getQiyamYesterday() {
        return inZone(qiyamYesterday);
    }

    /**
     * Determines the period the given instant falls into. Instants before the Qiyam of the previous night are
     * treated as after midnight of the previous night, instants after Fajr of the following day as Fajr.
     */
    public Prayer current(ZonedDateTime time) {
        if (reached(time, fajrTomorrow)) {
            return Prayer.FAJR;
        }
        if (reached(time, qiyam)) {
            return Prayer.QIYAM;
        }
        if (reached(time, midnight)) {
            return Prayer.AFTER_MIDNIGHT;
        }
        if (reached(time, isha)) {
            return Prayer.ISHA;
        }
        if (reached(time, maghrib)) {
            return Prayer.MAGHRIB;
        }
        if (reached(time, startOf(Prayer.DURING_SUNSET))) {
            return Prayer.DURING_SUNSET;
        }
        if (reached(time, asr)) {
            return Prayer.ASR;
        }
        if (reached(time, dhuhr)) {
            return Prayer.DHUHR;
        }
        if (reached(time, sunrise)) {
            return reached(time, endOfSunrise()) ? Prayer.SUNRISE : Prayer.DURING_SUNRISE;
        }
        if (reached(time, fajr)) {
            return Prayer.FAJR;
        }
        if (reached(time, qiyamYesterday)) {
            return Prayer.QIYAM;
        }
        return Prayer.AFTER_MIDNIGHT;
    }

    /**
     * @return the period following the current one of the given instant
     */
    public Prayer next(ZonedDateTime time) {
        return transitionAfter(time).prayer();
    }

    /**
     * @return the start of the period following the current one, absent if the sun does not define it
     */
    public Optional<ZonedDateTime> nextTime(ZonedDateTime time) {
        return inZone(transitionAfter(time).start());
    }

    /**
     * @return the time left until {@link #nextTime(ZonedDateTime)}, never negative
     */
    public Optional<Duration> timeRemaining(ZonedDateTime time) {
        return nextTime(time).map(start -> {
            Duration remaining = Duration.between(time, start);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        });
    }

    private Transition transitionAfter(ZonedDateTime time) {
        Prayer current = current(time);
        Transition transition = plannedTransition(current, time);
        if (transition.start() != null && transition.start().isAfter(time)
                && current(transition.start()) == transition.prayer()) {
            return transition;
        }
        return boundaries().filter(Objects::nonNull)
                           .filter(boundary -> boundary.isAfter(time))
                           .sorted()
                           .filter(boundary -> current(boundary) != current)
                           .findFirst()
                           .map(boundary -> new Transition(current(boundary), boundary))
                           .orElse(transition);
    }

    /**
     * The regular order of the periods. Collapsed or inverted periods, e.g. Isha after Fajr of the next day during
     * short summer nights, are resolved by {@link #transitionAfter(ZonedDateTime)}.
     */
    private Transition plannedTransition(Prayer current, ZonedDateTime time) {
        return switch (current) {
            case QIYAM -> new Transition(Prayer.FAJR, reached(time, qiyam) ? fajrTomorrow : fajr);
            case FAJR -> new Transition(Prayer.DURING_SUNRISE, reached(time, fajrTomorrow) ? sunriseTomorrow : sunrise);
            case DURING_SUNRISE -> new Transition(Prayer.SUNRISE, endOfSunrise());
            case SUNRISE -> new Transition(Prayer.DHUHR, dhuhr);
            case DHUHR -> new Transition(Prayer.ASR, asr);
            case ASR -> new Transition(Prayer.DURING_SUNSET, startOf(Prayer.DURING_SUNSET));
            case DURING_SUNSET -> new Transition(Prayer.MAGHRIB, maghrib);
            case MAGHRIB -> new Transition(Prayer.ISHA, isha);
            case ISHA -> new Transition(Prayer.AFTER_MIDNIGHT, midnight);
            case AFTER_MIDNIGHT -> new Transition(Prayer.QIYAM, reached(time, midnight) ? qiyam : qiyamYesterday);
        };
    }

    private Stream<ZonedDateTime> boundaries() {
        return Stream.of(qiyamYesterday, fajr, sunrise, endOfSunrise(), dhuhr, asr, startOf(Prayer.DURING_SUNSET),
                maghrib, isha, midnight, qiyam, fajrTomorrow, sunriseTomorrow);
    }

    private @Nullable ZonedDateTime startOf(Prayer prayer) {
        return switch (prayer) {
            case FAJR -> fajr;
            case SUNRISE, DURING_SUNRISE -> sunrise;
            case DHUHR -> dhuhr;
            case ASR -> asr;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
            case QIYAM -> qiyam;
            case DURING_SUNSET -> maghrib == null ? null : maghrib.minus(RESTRICTED_PERIOD);
            case AFTER_MIDNIGHT -> midnight;
        };
    }

    private @Nullable ZonedDateTime endOfSunrise() {
        return sunrise == null ? null : sunrise.plus(RESTRICTED_PERIOD);
    }

    private static boolean reached(ZonedDateTime time, @Nullable ZonedDateTime boundary) {
        return boundary != null && !time.isBefore(boundary);
    }

    private Optional<ZonedDateTime> inZone(@Nullable ZonedDateTime time) {
        return Optional.ofNullable(time).map(t -> t.withZoneSameInstant(zone));
    }

    private record Transition(Prayer prayer, @Nullable ZonedDateTime start) {
    }
}
