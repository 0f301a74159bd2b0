package at.sv.prayer.time;

import java.time.LocalDate;
import java.time.ZonedDateTime;

public interface PrayerTimesProvider {

    PrayerTimes getPrayerTimes(LocalDate date);

    /**
     * @return the prayer times for the day of the given time, in the provider's zone
     */
    PrayerTimes getPrayerTimes(ZonedDateTime dateTime);

    default String toDebugString(ZonedDateTime dateTime) {
        return null;
    }
}
