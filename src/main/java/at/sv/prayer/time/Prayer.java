package at.sv.prayer.time;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * The periods of a prayer day. Besides the five daily prayers, sunrise and the night prayer (Qiyam), it contains the
 * restricted periods in which the preceding prayer should no longer be performed.
 */
public enum Prayer {
    FAJR("Fajr"),
    SUNRISE("Sunrise"),
    DHUHR("Dhuhr"),
    ASR("Asr"),
    MAGHRIB("Maghrib"),
    ISHA("Isha"),
    QIYAM("Qiyam"),
    DURING_SUNRISE("During Sunrise (Cannot perform Fajr)"),
    DURING_SUNSET("During Sunset (Cannot perform Asr)"),
    AFTER_MIDNIGHT("After Midnight (Cannot perform Isha)");

    private final String name;

    Prayer(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the display name on the given day, i.e. Dhuhr is called Jumu'ah on Fridays
     */
    public String getName(LocalDate date) {
        if (this == DHUHR && date.getDayOfWeek() == DayOfWeek.FRIDAY) {
            return "Jumu'ah";
        }
        return name;
    }

    public boolean isRestricted() {
        return this == DURING_SUNRISE || this == DURING_SUNSET || this == AFTER_MIDNIGHT;
    }

    public boolean isObligatory() {
        return this == FAJR || this == DHUHR || this == ASR || this == MAGHRIB || this == ISHA;
    }
}
