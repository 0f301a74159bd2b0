package at.sv.prayer;

import at.sv.prayer.parameters.CalculationMethod;
import at.sv.prayer.parameters.HighLatitudeRule;
import at.sv.prayer.parameters.Madhab;
import at.sv.prayer.parameters.Rounding;
import at.sv.prayer.parameters.Shafaq;
import lombok.Data;

import java.util.Map;

/**
 * JSON representation of the calculation parameters passed with {@code --config}. Every property is optional.
 */
@Data
final class ParametersFile {
    CalculationMethod method;
    Double fajr_angle;
    Double maghrib_angle;
    Double isha_angle;
    Integer isha_interval;
    Madhab madhab;
    HighLatitudeRule high_latitude_rule;
    Rounding rounding;
    Shafaq shafaq;
    Map<String, Integer> adjustments;
}
