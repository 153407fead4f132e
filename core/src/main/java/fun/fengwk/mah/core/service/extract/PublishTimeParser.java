package fun.fengwk.mah.core.service.extract;

import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the publish time formats seen on article pages into an {@link Instant}.
 *
 * <p>Accepted: epoch seconds or milliseconds, ISO-8601 with or without offset, {@code yyyy-MM-dd},
 * {@code yyyy-MM-dd HH:mm[:ss]}, {@code yyyy/MM/dd}, {@code yyyy年M月d日} and {@code yyyyMMdd}.
 * Local values are interpreted in the configured zone.
 *
 * @author fengwk
 */
public class PublishTimeParser {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATTERS = List.of(
        DateTimeFormatter.ofPattern("yyyy-M-d H:m:s"),
        DateTimeFormatter.ofPattern("yyyy-M-d H:m"),
        DateTimeFormatter.ofPattern("yyyy/M/d H:m:s"),
        DateTimeFormatter.ofPattern("yyyy/M/d H:m"),
        DateTimeFormatter.ofPattern("yyyy年M月d日 H:m:s"),
        DateTimeFormatter.ofPattern("yyyy年M月d日 H:m"),
        DateTimeFormatter.ofPattern("yyyy年M月d日H:m")
    );

    private static final List<DateTimeFormatter> DATE_FORMATTERS = List.of(
        DateTimeFormatter.ofPattern("yyyy-M-d"),
        DateTimeFormatter.ofPattern("yyyy/M/d"),
        DateTimeFormatter.ofPattern("yyyy年M月d日"),
        DateTimeFormatter.ofPattern("yyyy.M.d")
    );

    private final ZoneId zoneId;

    public PublishTimeParser(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    /**
     * @return parsed instant, or {@code null} when the value matches no known format
     */
    public Instant parse(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String text = value.trim().replace('\u00A0', ' ').replaceAll("\\s+", " ");
        if (DIGITS.matcher(text).matches()) {
            return parseDigits(text);
        }

        Instant iso = parseIso(text);
        if (iso != null) {
            return iso;
        }
        for (DateTimeFormatter formatter : DATE_TIME_FORMATTERS) {
            try {
                return LocalDateTime.parse(text, formatter).atZone(zoneId).toInstant();
            } catch (DateTimeParseException ignore) {
                // try next format
            }
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(text, formatter).atStartOfDay(zoneId).toInstant();
            } catch (DateTimeParseException ignore) {
                // try next format
            }
        }
        return null;
    }

    private Instant parseDigits(String text) {
        if (text.length() == 8) {
            try {
                return LocalDate.parse(text, DateTimeFormatter.BASIC_ISO_DATE).atStartOfDay(zoneId).toInstant();
            } catch (DateTimeParseException ex) {
                return null;
            }
        }
        long number;
        try {
            number = Long.parseLong(text);
        } catch (NumberFormatException ex) {
            return null;
        }
        if (text.length() >= 13) {
            return Instant.ofEpochMilli(number);
        }
        if (text.length() >= 9) {
            return Instant.ofEpochSecond(number);
        }
        return null;
    }

    private Instant parseIso(String text) {
        if (text.indexOf('T') < 0) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignore) {
            // not an offset date time
        }
        try {
            return LocalDateTime.parse(text).atZone(zoneId).toInstant();
        } catch (DateTimeParseException ignore) {
            return null;
        }
    }

}
