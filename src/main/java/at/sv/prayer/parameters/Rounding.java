package at.sv.prayer.parameters;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * How the calculated prayer times are aligned to whole minutes.
 */
public enum Rounding {
    /**
     * Half a minute or more rounds up, anything below rounds down.
     */
    NEAREST,
    /**
     * Any time past the full minute moves to the next minute.
     */
    UP,
    NONE;

    public ZonedDateTime round(ZonedDateTime time) {
        ZonedDateTime minute = time.truncatedTo(ChronoUnit.MINUTES);
        return switch (this) {
            case NEAREST -> time.getSecond() >= 30 ? minute.plusMinutes(1) : minute;
            case UP -> time.isEqual(minute) ? time : minute.plusMinutes(1);
            case NONE -> time;
        };
    }
}
