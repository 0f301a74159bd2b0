package at.sv.prayer;

import at.sv.prayer.astronomy.Coordinates;
import at.sv.prayer.astronomy.Qiblah;
import at.sv.prayer.time.Prayer;
import at.sv.prayer.time.PrayerTimes;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the prayer times of a day for the command line, either as table or as JSON document.
 */
public final class PrayerTimesFormatter {

    private static final List<Prayer> DAILY_TIMES = List.of(Prayer.FAJR, Prayer.SUNRISE, Prayer.DHUHR, Prayer.ASR,
            Prayer.MAGHRIB, Prayer.ISHA, Prayer.QIYAM);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofLocalizedDate(FormatStyle.FULL)
                                                                             .withLocale(Locale.ENGLISH);

    private final ObjectMapper objectMapper;

    public PrayerTimesFormatter() {
        objectMapper = new ObjectMapper();
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String format(PrayerTimes times, Coordinates coordinates, ZonedDateTime now) {
        StringBuilder sb = new StringBuilder();
        sb.append(DATE_FORMATTER.format(times.getDate()))
          .append(" (").append(times.getZone()).append(")\n");
        for (Prayer prayer : DAILY_TIMES) {
            sb.append(String.format(Locale.ROOT, "%-10s %s%n", prayer.getName(times.getDate()),
                    FormatUtil.formatTime(times.time(prayer))));
        }
        sb.append(String.format(Locale.ROOT, "%-10s %s%n", "Midnight", FormatUtil.formatTime(times.getMidnight())));
        sb.append(String.format(Locale.ROOT, "%-10s %s%n", "Qiblah",
                FormatUtil.formatDegrees(Qiblah.direction(coordinates).degrees())));
        sb.append("\nCurrent: ").append(times.current(now).getName(times.getDate()));
        sb.append("\nNext:    ").append(times.next(now).getName(times.getDate()));
        times.nextTime(now).ifPresent(next -> sb.append(" at ").append(FormatUtil.formatTime(Optional.of(next))));
        times.timeRemaining(now).ifPresent(remaining -> sb.append(" (in ")
                                                         .append(FormatUtil.formatDuration(remaining))
                                                         .append(")"));
        return sb.toString();
    }

    public String toJson(PrayerTimes times, Coordinates coordinates, ZonedDateTime now) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("date", times.getDate().toString());
        document.put("zone", times.getZone().getId());
        Map<String, String> prayerTimes = new LinkedHashMap<>();
        for (Prayer prayer : DAILY_TIMES) {
            prayerTimes.put(prayer.name().toLowerCase(Locale.ROOT), isoOrNull(times.time(prayer)));
        }
        prayerTimes.put("midnight", isoOrNull(times.getMidnight()));
        prayerTimes.put("fajr_tomorrow", isoOrNull(times.getFajrTomorrow()));
        document.put("times", prayerTimes);
        document.put("qiblah", Qiblah.direction(coordinates).degrees());
        document.put("current", times.current(now).name());
        document.put("next", times.next(now).name());
        document.put("next_time", isoOrNull(times.nextTime(now)));
        document.put("remaining_minutes", times.timeRemaining(now).map(d -> d.toMinutes()).orElse(null));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize prayer times", e);
        }
    }

    private static String isoOrNull(Optional<ZonedDateTime> time) {
        return time.map(DateTimeFormatter.ISO_OFFSET_DATE_TIME::format).orElse(null);
    }
}
