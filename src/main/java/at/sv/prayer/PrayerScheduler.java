package at.sv.prayer;

import at.sv.prayer.astronomy.Coordinates;
import at.sv.prayer.parameters.CalculationMethod;
import at.sv.prayer.parameters.CalculationMethods;
import at.sv.prayer.parameters.HighLatitudeRule;
import at.sv.prayer.parameters.Madhab;
import at.sv.prayer.parameters.Parameters;
import at.sv.prayer.parameters.Rounding;
import at.sv.prayer.parameters.Shafaq;
import at.sv.prayer.time.Prayer;
import at.sv.prayer.time.PrayerTimes;
import at.sv.prayer.time.PrayerTimesProvider;
import at.sv.prayer.time.PrayerTimesProviderImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

@Command(name = "PrayerScheduler", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the Islamic prayer times of a day for the given location.")
public final class PrayerScheduler implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(PrayerScheduler.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180], positive towards the east.")
    double longitude;
    @Option(names = "--date",
            description = "The day to calculate the prayer times for, e.g. 2024-03-15. Default: today.")
    LocalDate date;
    @Option(names = "--zone",
            defaultValue = "${env:ZONE}",
            description = "The time zone the prayer times are shown in, e.g. Europe/Vienna. Default: system zone.")
    ZoneId zone;
    @Option(names = "--method",
            defaultValue = "${env:METHOD}",
            description = "The calculation method, one of: ${COMPLETION-CANDIDATES}. Default: MUSLIM_WORLD_LEAGUE, " +
                          "or the method of the --config file.")
    CalculationMethod method;
    @Option(names = "--madhab",
            defaultValue = "${env:MADHAB}",
            description = "The madhab used for Asr, one of: ${COMPLETION-CANDIDATES}. Default: SHAFI.")
    Madhab madhab;
    @Option(names = "--high-latitude-rule",
            description = "Caps Fajr and Isha to a portion of the night, one of: ${COMPLETION-CANDIDATES}. " +
                          "Default: MIDDLE_OF_THE_NIGHT.")
    HighLatitudeRule highLatitudeRule;
    @Option(names = "--recommended-high-latitude-rule",
            description = "Use the high latitude rule recommended for the latitude of your location.")
    boolean recommendedHighLatitudeRule;
    @Option(names = "--rounding",
            description = "How the times are aligned to minutes, one of: ${COMPLETION-CANDIDATES}.")
    Rounding rounding;
    @Option(names = "--shafaq",
            description = "The twilight used for Isha by the moonsighting committee, one of: ${COMPLETION-CANDIDATES}.")
    Shafaq shafaq;
    @Option(names = "--fajr-angle", paramLabel = "<degrees>",
            description = "Overrides the sun depression angle for Fajr.")
    Double fajrAngle;
    @Option(names = "--isha-angle", paramLabel = "<degrees>",
            description = "Overrides the sun depression angle for Isha.")
    Double ishaAngle;
    @Option(names = "--isha-interval", paramLabel = "<minutes>",
            description = "Uses a fixed interval after Maghrib for Isha instead of the Isha angle.")
    Integer ishaInterval;
    @Option(names = "--adjust", paramLabel = "<prayer=minutes>",
            description = "Adds the given minutes to a prayer time. Can be repeated, e.g. --adjust FAJR=2 --adjust ISHA=-3.")
    Map<Prayer, Integer> adjustments = new LinkedHashMap<>();
    @Option(names = "--config", paramLabel = "CONFIG_FILE",
            defaultValue = "${env:CONFIG_FILE}",
            description = "Optional JSON file with the calculation parameters. Command line options take precedence.")
    Path configFile;
    @Option(names = "--json",
            description = "Print the prayer times as JSON document.")
    boolean json;

    private final Supplier<ZonedDateTime> currentTime;

    public PrayerScheduler() {
        this(ZonedDateTime::now);
    }

    public PrayerScheduler(Supplier<ZonedDateTime> currentTime) {
        this.currentTime = currentTime;
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new PrayerScheduler())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        Coordinates coordinates = createCoordinates();
        Parameters parameters = createParameters();
        ZoneId zoneId = zone != null ? zone : ZoneId.systemDefault();
        LOG.debug("Using {} at {} in {}", parameters, coordinates, zoneId);

        PrayerTimesProvider provider = new PrayerTimesProviderImpl(coordinates, parameters, zoneId);
        ZonedDateTime now = currentTime.get().withZoneSameInstant(zoneId);
        LocalDate day = date != null ? date : now.toLocalDate();
        MDC.put("context", day.toString());
        PrayerTimes prayerTimes = provider.getPrayerTimes(day);
        if (prayerTimes.time(Prayer.SUNRISE).isEmpty() || prayerTimes.time(Prayer.MAGHRIB).isEmpty()) {
            LOG.warn("The sun does not rise or set on {} at this location. Some prayer times are not available.", day);
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Prayer times:\n{}", provider.toDebugString(day.atStartOfDay(zoneId)));
        }

        PrayerTimesFormatter formatter = new PrayerTimesFormatter();
        String output = json ? formatter.toJson(prayerTimes, coordinates, now)
                : formatter.format(prayerTimes, coordinates, now);
        spec.commandLine().getOut().println(output);
        spec.commandLine().getOut().flush();
        MDC.remove("context");
    }

    private void assertConfigurationParameters() {
        if (latitude < -90.0 || latitude > 90.0) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180.0 || longitude > 180.0) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (ishaInterval != null && ishaInterval < 0) {
            fail("--isha-interval must be >= 0");
        }
        if (highLatitudeRule != null && recommendedHighLatitudeRule) {
            fail("--high-latitude-rule and --recommended-high-latitude-rule cannot be combined");
        }
        if (configFile != null && !Files.isReadable(configFile)) {
            fail("Given config file '" + configFile.toAbsolutePath() + "' does not exist or is not readable!");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private Coordinates createCoordinates() {
        try {
            return new Coordinates(latitude, longitude);
        } catch (InvalidPropertyValue e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private Parameters createParameters() {
        try {
            return buildParameters();
        } catch (InvalidPropertyValue e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private Parameters buildParameters() {
        Parameters base;
        if (configFile != null) {
            base = new ParametersFileReader().read(configFile, method);
        } else {
            base = CalculationMethods.parameters(method != null ? method : CalculationMethod.MUSLIM_WORLD_LEAGUE);
        }
        Parameters.ParametersBuilder builder = base.toBuilder();
        if (madhab != null) {
            builder.madhab(madhab);
        }
        if (highLatitudeRule != null) {
            builder.highLatitudeRule(highLatitudeRule);
        }
        if (recommendedHighLatitudeRule) {
            builder.highLatitudeRule(HighLatitudeRule.recommended(latitude));
        }
        if (rounding != null) {
            builder.rounding(rounding);
        }
        if (shafaq != null) {
            builder.shafaq(shafaq);
        }
        if (fajrAngle != null) {
            builder.fajrAngle(fajrAngle);
        }
        if (ishaAngle != null) {
            builder.ishaAngle(ishaAngle);
        }
        if (ishaInterval != null) {
            builder.ishaInterval(ishaInterval);
        }
        if (!adjustments.isEmpty()) {
            Map<String, Integer> byName = new LinkedHashMap<>();
            adjustments.forEach((prayer, minutes) -> byName.put(prayer.name(), minutes));
            builder.adjustments(ParametersFileReader.toAdjustments(byName));
        }
        return builder.build();
    }
}
