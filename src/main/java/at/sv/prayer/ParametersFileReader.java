package at.sv.prayer;

import at.sv.prayer.parameters.CalculationMethod;
import at.sv.prayer.parameters.CalculationMethods;
import at.sv.prayer.parameters.Parameters;
import at.sv.prayer.parameters.TimeAdjustments;
import at.sv.prayer.time.Prayer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Reads calculation parameters from a JSON file, e.g.:
 * <pre>
 * {
 *   "method": "MOONSIGHTING_COMMITTEE",
 *   "madhab": "HANAFI",
 *   "shafaq": "AHMER",
 *   "adjustments": {"fajr": 2, "isha": -3}
 * }
 * </pre>
 * Properties not present in the file keep the values of the calculation method.
 */
public final class ParametersFileReader {

    private static final Logger LOG = LoggerFactory.getLogger(ParametersFileReader.class);

    private final ObjectMapper mapper;

    public ParametersFileReader() {
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws InvalidPropertyValue if the file is not valid JSON or contains invalid values
     * @throws UncheckedIOException if the file could not be read
     */
    public Parameters read(Path file) {
        return read(file, null);
    }

    /**
     * @param method if set, replaces the method of the file
     */
    public Parameters read(Path file, @Nullable CalculationMethod method) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read parameters file '" + file + "'", e);
        }
        return parse(content, method);
    }

    Parameters parse(String json, @Nullable CalculationMethod method) {
        ParametersFile file;
        try {
            file = mapper.readValue(json, ParametersFile.class);
        } catch (JsonProcessingException e) {
            throw new InvalidPropertyValue("Invalid parameters file: " + e.getOriginalMessage());
        }
        if (file == null) {
            throw new InvalidPropertyValue("Invalid parameters file: no content");
        }
        LOG.debug("Read parameters file: {}", file);
        return toParameters(file, method);
    }

    private Parameters toParameters(ParametersFile file, @Nullable CalculationMethod methodOverride) {
        CalculationMethod method = methodOverride;
        if (method == null) {
            method = file.getMethod() != null ? file.getMethod() : CalculationMethod.MUSLIM_WORLD_LEAGUE;
        }
        Parameters.ParametersBuilder builder = CalculationMethods.parameters(method).toBuilder();
        if (file.getFajr_angle() != null) {
            builder.fajrAngle(file.getFajr_angle());
        }
        if (file.getMaghrib_angle() != null) {
            builder.maghribAngle(file.getMaghrib_angle());
        }
        if (file.getIsha_angle() != null) {
            builder.ishaAngle(file.getIsha_angle());
        }
        if (file.getIsha_interval() != null) {
            builder.ishaInterval(file.getIsha_interval());
        }
        if (file.getMadhab() != null) {
            builder.madhab(file.getMadhab());
        }
        if (file.getHigh_latitude_rule() != null) {
            builder.highLatitudeRule(file.getHigh_latitude_rule());
        }
        if (file.getRounding() != null) {
            builder.rounding(file.getRounding());
        }
        if (file.getShafaq() != null) {
            builder.shafaq(file.getShafaq());
        }
        if (file.getAdjustments() != null) {
            builder.adjustments(toAdjustments(file.getAdjustments()));
        }
        return builder.build();
    }

    static TimeAdjustments toAdjustments(Map<String, Integer> minutes) {
        TimeAdjustments.TimeAdjustmentsBuilder builder = TimeAdjustments.NONE.toBuilder();
        minutes.forEach((name, value) -> {
            Prayer prayer = parsePrayer(name);
            int adjustment = value == null ? 0 : value;
            switch (prayer) {
                case FAJR -> builder.fajr(adjustment);
                case SUNRISE -> builder.sunrise(adjustment);
                case DHUHR -> builder.dhuhr(adjustment);
                case ASR -> builder.asr(adjustment);
                case MAGHRIB -> builder.maghrib(adjustment);
                case ISHA -> builder.isha(adjustment);
                default -> throw new InvalidPropertyValue("Unsupported adjustment '" + name + "'. " +
                                                          "Supported: fajr, sunrise, dhuhr, asr, maghrib, isha");
            }
        });
        return builder.build();
    }

    private static Prayer parsePrayer(String name) {
        try {
            return Prayer.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidPropertyValue("Unknown prayer '" + name + "' in adjustments. Please check your spelling.");
        }
    }
}
