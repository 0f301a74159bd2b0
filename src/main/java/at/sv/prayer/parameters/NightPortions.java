package at.sv.prayer.parameters;

/**
 * Fractions of the night used as the earliest Fajr (before sunrise) and the latest Isha (after sunset).
 */
public record NightPortions(double fajr, double isha) {
}
