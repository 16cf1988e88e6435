package ai.fingerprint.temporal;

import java.time.DateTimeException;
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

/**
 * Coerces temporal values to instants. Local dates and times are taken to be in UTC.
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * @return the instant, or null for a nil value
     * @throws IllegalArgumentException when the value is not a recognizable point in time
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof CharSequence) {
            return parse(value.toString().trim());
        }
        throw new IllegalArgumentException(String.format("%s is not a temporal value", value.getClass().getName()));
    }

    public static Double toEpochMillis(Object value) {
        Instant instant = toInstant(value);
        return instant == null ? null : (double) instant.toEpochMilli();
    }

    public static ZonedDateTime fromEpochMillis(double epochMillis) {
        return Instant.ofEpochMilli((long) epochMillis).atZone(ZoneOffset.UTC);
    }

    public static ZonedDateTime toUtc(Object value) {
        Instant instant = toInstant(value);
        return instant == null ? null : instant.atZone(ZoneOffset.UTC);
    }

    private static Instant parse(String text) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            return parsed instanceof ZonedDateTime
                ? ((ZonedDateTime) parsed).toInstant()
                : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeException notADate) {
                IllegalArgumentException failure = new IllegalArgumentException(String.format("Unable to parse '%s' as a date or date-time", text), e);
                failure.addSuppressed(notADate);
                throw failure;
            }
        }
    }
}
