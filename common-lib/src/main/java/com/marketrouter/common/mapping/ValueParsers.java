package com.marketrouter.common.mapping;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lenient parsing of provider cell values into numbers, booleans and timestamps.
 * Every method returns empty instead of throwing when the value does not parse.
 */
public final class ValueParsers {

    /** Strings providers use to mean "no value". */
    public static final Set<String> NULL_SENTINELS =
        Set.of("N/A", "null", "NULL", "", "nan", "NaN", "None", "--", "-");

    private static final Set<String> TRUE_VALUES  = Set.of("true", "yes", "y", "t", "是");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "n", "f", "否");

    private static final Pattern DATE_SHAPE = Pattern.compile(
        "^\\d{4}[-/.]\\d{1,2}[-/.]\\d{1,2}([ T]\\d{1,2}:\\d{2}(:\\d{2}(\\.\\d+)?)?)?.*$|^(19|20)\\d{6}$");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
        DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd"),
        DateTimeFormatter.ofPattern("yyyy.MM.dd"),
        DateTimeFormatter.ofPattern("yyyy-M-d"),
        DateTimeFormatter.ofPattern("yyyy/M/d"),
        DateTimeFormatter.BASIC_ISO_DATE
    );

    static final double EPOCH_MILLIS_FLOOR  = 1e11;
    static final double EPOCH_SECONDS_FLOOR = 1e9;

    private ValueParsers() {}

    public static boolean isNullLike(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d && d.isNaN()) {
            return true;
        }
        if (value instanceof Float f && f.isNaN()) {
            return true;
        }
        return value instanceof CharSequence cs && NULL_SENTINELS.contains(cs.toString().trim());
    }

    /**
     * Parses numbers, numeric strings with thousands separators, and percent strings
     * ("5.2%" becomes 5.2).
     */
    public static Optional<Double> parseNumber(Object value) {
        if (isNullLike(value) || value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        }
        String s = StringUtils.remove(value.toString().trim(), ',');
        s = StringUtils.removeEnd(s, "%").trim();
        if (!NumberUtils.isCreatable(s)) {
            return Optional.empty();
        }
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        } catch (NumberFormatException e) {
            // hex and octal literals are creatable but not decimal
            return Optional.empty();
        }
    }

    public static boolean isPercentString(Object value) {
        return value instanceof CharSequence cs && cs.toString().trim().endsWith("%");
    }

    public static Optional<Boolean> parseBoolean(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (isNullLike(value) || value instanceof Number) {
            return Optional.empty();
        }
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(s)) return Optional.of(Boolean.TRUE);
        if (FALSE_VALUES.contains(s)) return Optional.of(Boolean.FALSE);
        return Optional.empty();
    }

    /** True when a string looks like a date or date-time, without fully parsing it. */
    public static boolean looksLikeDate(Object value) {
        if (value instanceof TemporalAccessor || value instanceof Date) {
            return true;
        }
        return value instanceof CharSequence cs && DATE_SHAPE.matcher(cs.toString().trim()).matches()
            && parseDateTime(value).isPresent();
    }

    /**
     * Parses temporal objects, date/date-time strings in common layouts, and epoch
     * seconds or milliseconds. Zoned values are converted to UTC.
     */
    public static Optional<LocalDateTime> parseDateTime(Object value) {
        if (isNullLike(value)) {
            return Optional.empty();
        }
        if (value instanceof LocalDateTime ldt) return Optional.of(ldt);
        if (value instanceof LocalDate ld) return Optional.of(ld.atStartOfDay());
        if (value instanceof Instant i) return Optional.of(LocalDateTime.ofInstant(i, ZoneOffset.UTC));
        if (value instanceof OffsetDateTime o) return Optional.of(o.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        if (value instanceof ZonedDateTime z) return Optional.of(LocalDateTime.ofInstant(z.toInstant(), ZoneOffset.UTC));
        if (value instanceof Date d) return Optional.of(LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC));
        if (value instanceof Number n) {
            return fromEpoch(n.doubleValue());
        }

        String s = value.toString().trim();
        for (DateTimeFormatter f : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(s, f));
            } catch (DateTimeParseException e) {
                // try the next layout
            }
        }
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(s, f).atStartOfDay());
            } catch (DateTimeParseException e) {
                // try the next layout
            }
        }
        try {
            return Optional.of(OffsetDateTime.parse(s).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDateTime> fromEpoch(double epoch) {
        if (epoch >= 19_000_101 && epoch <= 21_001_231 && epoch == Math.rint(epoch)) {
            // yyyyMMdd stored as an integer
            return parseDateTime(String.valueOf((long) epoch));
        }
        if (epoch >= EPOCH_MILLIS_FLOOR) {
            return Optional.of(LocalDateTime.ofInstant(Instant.ofEpochMilli((long) epoch), ZoneOffset.UTC));
        }
        if (epoch >= EPOCH_SECONDS_FLOOR) {
            return Optional.of(LocalDateTime.ofInstant(Instant.ofEpochSecond((long) epoch), ZoneOffset.UTC));
        }
        return Optional.empty();
    }
}
