package at.sv.prayer.parameters;

/**
 * The twilight whose disappearance marks Isha, used by the Moonsighting Committee method.
 */
public enum Shafaq {
    /**
     * Blend of the red and white twilight, producing less extreme times at high latitudes.
     */
    GENERAL,
    /**
     * Red twilight, earlier Isha.
     */
    AHMER,
    /**
     * White twilight, later Isha.
     */
    ABYAD
}
