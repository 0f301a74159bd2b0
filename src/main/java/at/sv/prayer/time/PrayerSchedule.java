package at.sv.prayer.time;

import at.sv.prayer.astronomy.Coordinates;
import at.sv.prayer.parameters.Parameters;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the inputs for the prayer times of a day:
 * <pre>
 * PrayerTimes times = new PrayerSchedule()
 *         .on(LocalDate.of(2015, 7, 12))
 *         .in(ZoneId.of("America/New_York"))
 *         .forLocation(new Coordinates(35.7750, -78.6336))
 *         .withParameters(Parameters.with(CalculationMethod.NORTH_AMERICA, Madhab.HANAFI))
 *         .calculate();
 * </pre>
 * The zone only affects how the times are presented, the calculation covers the solar day whose local mean noon falls
 * on the date. If no zone is set, UTC is used.
 */
public final class PrayerSchedule {

    private LocalDate date;
    private ZoneId zone = ZoneOffset.UTC;
    private Coordinates coordinates;
    private Parameters parameters;

    public PrayerSchedule on(LocalDate date) {
        this.date = date;
        return this;
    }

    /**
     * Uses the date and the zone of the given time.
     */
    public PrayerSchedule on(ZonedDateTime dateTime) {
        this.date = dateTime.toLocalDate();
        this.zone = dateTime.getZone();
        return this;
    }

    public PrayerSchedule in(ZoneId zone) {
        this.zone = zone;
        return this;
    }

    public PrayerSchedule forLocation(Coordinates coordinates) {
        this.coordinates = coordinates;
        return this;
    }

    public PrayerSchedule withParameters(Parameters parameters) {
        this.parameters = parameters;
        return this;
    }

    /**
     * @throws IncompleteScheduleInput if the date, the location or the parameters are missing
     */
    public PrayerTimes calculate() {
        assertComplete();
        return new PrayerTimesCalculator(coordinates, parameters).calculate(date, zone);
    }

    private void assertComplete() {
        List<String> missing = new ArrayList<>();
        if (date == null) {
            missing.add("date");
        }
        if (zone == null) {
            missing.add("zone");
        }
        if (coordinates == null) {
            missing.add("coordinates");
        }
        if (parameters == null) {
            missing.add("parameters");
        }
        if (!missing.isEmpty()) {
            throw new IncompleteScheduleInput("Missing required schedule input: " + String.join(", ", missing));
        }
    }
}
