package at.sv.prayer.time;

/**
 * Thrown by {@link PrayerSchedule#calculate()} if the date, the location or the parameters have not been set.
 */
public class IncompleteScheduleInput extends RuntimeException {
    public IncompleteScheduleInput(String message) {
        super(message);
    }
}
