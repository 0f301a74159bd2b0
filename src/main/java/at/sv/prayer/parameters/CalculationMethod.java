package at.sv.prayer.parameters;

/**
 * Well known conventions for the twilight angles and minute adjustments. See {@link CalculationMethods} for the values.
 */
public enum CalculationMethod {
    MUSLIM_WORLD_LEAGUE,
    EGYPTIAN,
    KARACHI,
    UMM_AL_QURA,
    DUBAI,
    MOONSIGHTING_COMMITTEE,
    NORTH_AMERICA,
    KUWAIT,
    QATAR,
    SINGAPORE,
    TEHRAN,
    TURKEY,
    OTHER
}
