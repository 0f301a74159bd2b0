package at.sv.prayer;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

public final class FormatUtil {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm");

    private FormatUtil() {
    }

    public static String formatTime(Optional<ZonedDateTime> time) {
        return time.map(TIME_FORMATTER::format).orElse("--:--");
    }

    /**
     * Formats a duration in whole hours and minutes, e.g. "1h 08m". Seconds are rounded to the nearest minute.
     */
    public static String formatDuration(Duration duration) {
        long minutes = Math.round(duration.getSeconds() / 60.0);
        return String.format(Locale.ROOT, "%dh %02dm", minutes / 60, minutes % 60);
    }

    public static String formatDegrees(double degrees) {
        return String.format(Locale.ROOT, "%.2f°", degrees);
    }
}
