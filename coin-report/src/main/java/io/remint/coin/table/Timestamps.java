package io.remint.coin.table;

import io.remint.coin.error.TimeParseException;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Permissive timestamp parsing for monitoring output and window bounds. Accepts
 * <ul>
 *   <li>epoch seconds ({@code 1000000000}, {@code 1000000000.25})</li>
 *   <li>compact {@code yyyyMMdd} and {@code yyyyMMddHHmmss}</li>
 *   <li>{@code yyyy-M-d} or {@code yyyy/M/d}, optionally with {@code [T| ]H:mm[:ss[.fraction]]}
 *       and an offset ({@code Z}, {@code +09:00}, {@code +0900}) or zone name ({@code GMT}, {@code JST})</li>
 *   <li>{@code date(1)} style {@code Fri Mar 20 15:30:00 JST 2009}</li>
 *   <li>RFC 1123</li>
 * </ul>
 * Values without zone information are read in the supplied zone.
 */
public final class Timestamps {
    private static final Pattern EPOCH_SECONDS = Pattern.compile("\\d{9,10}(\\.\\d+)?");
    private static final Pattern COMPACT_DATE = Pattern.compile("\\d{8}");
    private static final Pattern COMPACT_DATE_TIME = Pattern.compile("\\d{14}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final DateTimeFormatter COMPACT_DATE_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd");
    private static final DateTimeFormatter COMPACT_DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss");

    private static final List<DateTimeFormatter> FORMATS = List.of(
            dateFirst('-'),
            dateFirst('/'),
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("EEE MMM d HH:mm:ss[ zzz] uuuu")
                    .toFormatter(Locale.ENGLISH),
            DateTimeFormatter.RFC_1123_DATE_TIME);

    private Timestamps() {}

    public static Instant parse(String text, ZoneId zone) {
        if (text == null) throw new TimeParseException("null");
        String s = WHITESPACE.matcher(text.strip()).replaceAll(" ");
        if (s.isEmpty()) throw new TimeParseException(text);
        try {
            if (EPOCH_SECONDS.matcher(s).matches()) return epochSeconds(s);
            if (COMPACT_DATE_TIME.matcher(s).matches()) {
                return LocalDateTime.parse(s, COMPACT_DATE_TIME_FORMAT).atZone(zone).toInstant();
            }
            if (COMPACT_DATE.matcher(s).matches()) {
                return LocalDate.parse(s, COMPACT_DATE_FORMAT).atStartOfDay(zone).toInstant();
            }
        } catch (DateTimeException e) {
            throw new TimeParseException(text);
        }
        for (DateTimeFormatter f : FORMATS) {
            try {
                TemporalAccessor t = f.parseBest(s, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
                if (t instanceof ZonedDateTime z) return z.toInstant();
                if (t instanceof LocalDateTime l) return l.atZone(zone).toInstant();
                return ((LocalDate) t).atStartOfDay(zone).toInstant();
            } catch (DateTimeException e) {
                // try the next shape
            }
        }
        throw new TimeParseException(text);
    }

    private static Instant epochSeconds(String s) {
        BigDecimal seconds = new BigDecimal(s);
        long whole = seconds.longValue();
        long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
        return Instant.ofEpochSecond(whole, nanos);
    }

    private static DateTimeFormatter dateFirst(char sep) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendValue(ChronoField.YEAR, 4)
                .appendLiteral(sep)
                .appendValue(ChronoField.MONTH_OF_YEAR, 1, 2, SignStyle.NOT_NEGATIVE)
                .appendLiteral(sep)
                .appendValue(ChronoField.DAY_OF_MONTH, 1, 2, SignStyle.NOT_NEGATIVE)
                .optionalStart().appendLiteral(sep).optionalEnd()
                .optionalStart()
                    .optionalStart().appendLiteral('T').optionalEnd()
                    .optionalStart().appendLiteral(' ').optionalEnd()
                    .appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(':')
                    .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                    .optionalStart()
                        .appendLiteral(':')
                        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd()
                    .optionalEnd()
                    .optionalStart().appendLiteral(' ').optionalEnd()
                    .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                    .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
                    .optionalStart().appendZoneText(TextStyle.SHORT).optionalEnd()
                .optionalEnd()
                .toFormatter(Locale.ENGLISH);
    }
}
