package com.energyweather.utils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient date reading for raw feeds. Unparseable input yields null, never an exception.
 * Values without an explicit zone are read as UTC.
 */
public final class DateParsing {
    private static final Set<String> NULL_TOKENS = Set.of("", "nan", "nat", "null", "none", "n/a", "na");

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ISO_DATE_TIME,
            strict("uuuu-MM-dd'T'HH"),
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm:ssXXX"),
            strict("uuuu-MM-dd HH:mm"),
            strict("uuuu/MM/dd"),
            strict("MM/dd/uuuu")
    );

    private DateParsing() {
    }

    /** Calendar date of the value, time of day discarded. */
    public static LocalDate parseDate(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof LocalDate d) {
            return d;
        }
        if (raw instanceof LocalDateTime dt) {
            return dt.toLocalDate();
        }
        if (raw instanceof OffsetDateTime odt) {
            return odt.toLocalDate();
        }
        if (raw instanceof ZonedDateTime zdt) {
            return zdt.toLocalDate();
        }
        if (raw instanceof Instant instant) {
            return instant.atZone(ZoneOffset.UTC).toLocalDate();
        }
        if (!(raw instanceof CharSequence)) {
            return null;
        }
        TemporalAccessor parsed = parse(raw.toString());
        return parsed == null ? null : parsed.query(TemporalQueries.localDate());
    }

    /** Point in time of the value. Date-only values resolve to midnight UTC. */
    public static Instant parseInstant(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof LocalDate d) {
            return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (raw instanceof LocalDateTime dt) {
            return dt.toInstant(ZoneOffset.UTC);
        }
        if (raw instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (raw instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (!(raw instanceof CharSequence)) {
            return null;
        }
        TemporalAccessor parsed = parse(raw.toString());
        if (parsed == null) {
            return null;
        }
        LocalDate date = parsed.query(TemporalQueries.localDate());
        if (date == null) {
            return null;
        }
        LocalTime time = parsed.query(TemporalQueries.localTime());
        ZoneId zone = parsed.query(TemporalQueries.zone());
        LocalDateTime local = LocalDateTime.of(date, time == null ? LocalTime.MIDNIGHT : time);
        return local.atZone(zone == null ? ZoneOffset.UTC : zone).toInstant();
    }

    public static boolean isNullToken(String raw) {
        return raw == null || NULL_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    private static TemporalAccessor parse(String raw) {
        if (isNullToken(raw)) {
            return null;
        }
        String text = raw.trim();
        for (DateTimeFormatter format : FORMATS) {
            try {
                return format.parse(text);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return null;
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }
}
