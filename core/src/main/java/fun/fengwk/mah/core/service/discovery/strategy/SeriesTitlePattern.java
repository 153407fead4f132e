package fun.fengwk.mah.core.service.discovery.strategy;

import fun.fengwk.mah.core.service.fetch.PageLink;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes series titles made of a shared prefix and a number or date, such as {@code 周报 #12},
 * {@code 周报(12)}, {@code 周报第12期}, {@code Weekly Vol.12}, {@code 日报 20240105} or {@code 日报 2024-01-05}.
 *
 * @author fengwk
 */
public final class SeriesTitlePattern {

    private static final Pattern DATE = Pattern.compile("(\\d{4})[-./年](\\d{1,2})[-./月](\\d{1,2})日?");

    private static final Pattern COMPACT_DATE = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(\\d{2})(\\d{2})(?!\\d)");

    private static final List<Pattern> NUMBERS = List.of(
        Pattern.compile("第\\s*(\\d+)\\s*[期篇章集讲回话节周]"),
        Pattern.compile("[#＃]\\s*(\\d+)"),
        Pattern.compile("[(（]\\s*(\\d+)\\s*[)）]"),
        Pattern.compile("(?i)vol\\.?\\s*(\\d+)"),
        Pattern.compile("(?i)\\bep\\.?\\s*(\\d+)"),
        Pattern.compile("(?i)\\bno\\.?\\s*(\\d+)")
    );

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s|｜:：,，\\-—_·]+$");

    private SeriesTitlePattern() {
    }

    /**
     * @return series key of the title, or {@code null} when the title carries no number or date
     */
    public static SeriesKey parse(String title) {
        if (!StringUtils.hasText(title)) {
            return null;
        }
        String text = title.trim();
        Matcher date = DATE.matcher(text);
        if (date.find()) {
            LocalDate value = toDate(date.group(1), date.group(2), date.group(3));
            if (value != null) {
                return SeriesKey.ofDate(prefix(text, date.start()), value);
            }
        }
        Matcher compactDate = COMPACT_DATE.matcher(text);
        if (compactDate.find()) {
            LocalDate value = toDate(compactDate.group(1), compactDate.group(2), compactDate.group(3));
            if (value != null) {
                return SeriesKey.ofDate(prefix(text, compactDate.start()), value);
            }
        }
        for (Pattern pattern : NUMBERS) {
            Matcher number = pattern.matcher(text);
            if (number.find()) {
                try {
                    return SeriesKey.ofNumber(prefix(text, number.start()), Long.parseLong(number.group(1)));
                } catch (NumberFormatException ex) {
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * Links whose titles are the neighbours of {@code source} in its series: numbers one apart, or the
     * closest earlier and later dates.
     */
    public static List<PageLink> selectSiblings(SeriesKey source, List<PageLink> links) {
        List<PageLink> siblings = new ArrayList<>();
        if (source == null) {
            return siblings;
        }
        PageLink earlier = null;
        LocalDate earlierDate = null;
        PageLink later = null;
        LocalDate laterDate = null;
        for (PageLink link : links) {
            SeriesKey key = parse(link.text());
            if (key == null || !source.sameSeries(key)) {
                continue;
            }
            if (source.isNumbered()) {
                if (Math.abs(key.number() - source.number()) == 1) {
                    siblings.add(link);
                }
                continue;
            }
            if (key.date().isBefore(source.date()) && (earlierDate == null || key.date().isAfter(earlierDate))) {
                earlier = link;
                earlierDate = key.date();
            } else if (key.date().isAfter(source.date()) && (laterDate == null || key.date().isBefore(laterDate))) {
                later = link;
                laterDate = key.date();
            }
        }
        if (earlier != null) {
            siblings.add(earlier);
        }
        if (later != null) {
            siblings.add(later);
        }
        return siblings;
    }

    private static String prefix(String title, int end) {
        String prefix = title.substring(0, end);
        prefix = TRAILING_PUNCTUATION.matcher(prefix).replaceAll("");
        return prefix.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private static LocalDate toDate(String year, String month, String day) {
        try {
            return LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Normalized prefix plus either a number or a date.
     */
    public record SeriesKey(String prefix, Long number, LocalDate date) {

        static SeriesKey ofNumber(String prefix, long number) {
            return new SeriesKey(prefix, number, null);
        }

        static SeriesKey ofDate(String prefix, LocalDate date) {
            return new SeriesKey(prefix, null, date);
        }

        public boolean isNumbered() {
            return number != null;
        }

        public boolean sameSeries(SeriesKey other) {
            return prefix.equals(other.prefix) && isNumbered() == other.isNumbered();
        }

    }

}
