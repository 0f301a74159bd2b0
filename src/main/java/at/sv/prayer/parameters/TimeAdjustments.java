package at.sv.prayer.parameters;

import at.sv.prayer.time.Prayer;
import lombok.Builder;

/**
 * Minutes added to each calculated prayer time, may be negative.
 */
@Builder(toBuilder = true)
public record TimeAdjustments(int fajr, int sunrise, int dhuhr, int asr, int maghrib, int isha) {

    public static final TimeAdjustments NONE = new TimeAdjustments(0, 0, 0, 0, 0, 0);

    /**
     * @return the adjustment for the given prayer, zero for the derived times like Qiyam
     */
    public int minutesFor(Prayer prayer) {
        return switch (prayer) {
            case FAJR -> fajr;
            case SUNRISE -> sunrise;
            case DHUHR -> dhuhr;
            case ASR -> asr;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
            default -> 0;
        };
    }
}
