package com.agentlog.ontology.schema;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

/**
 * ISO-8601 timestamp parsing and formatting shared by the serializer and the connectors.
 *
 * Accepted input forms, after a trailing {@code Z} is rewritten to {@code +00:00}:
 *   2024-01-01T00:00:00+00:00   offset date-time
 *   2024-01-01T00:00:00         local date-time, read as UTC
 *   2024-01-01                  date only, read as UTC midnight
 * A space may stand in for the {@code T} separator.
 */
public final class Timestamps {

    private static final DateTimeFormatter LENIENT_ISO = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    // Seconds always present, fraction only when non-zero, UTC written as +00:00.
    private static final DateTimeFormatter OUTPUT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .appendOffset("+HH:MM:ss", "+00:00")
            .toFormatter();

    private Timestamps() {}

    /**
     * Parses {@code value}, returning null for null input.
     *
     * @param value raw timestamp text
     * @param field name or path of the field being read, used in the error
     * @throws MalformedTimestampException if the text is not ISO-8601
     */
    public static OffsetDateTime parse(String value, String field) {
        if (value == null) return null;
        String normalized = normalize(value);
        try {
            TemporalAccessor parsed = LENIENT_ISO.parseBest(normalized,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) return odt;
            if (parsed instanceof LocalDateTime ldt) return ldt.atOffset(ZoneOffset.UTC);
            return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedTimestampException(field, value, e);
        }
    }

    public static String format(OffsetDateTime value) {
        return value == null ? null : OUTPUT.format(value);
    }

    /** Seconds between two instants, fractional part kept to the nanosecond. */
    public static double secondsBetween(OffsetDateTime start, OffsetDateTime end) {
        long nanos = Duration.between(start, end).toNanos();
        return nanos / 1_000_000_000.0;
    }

    private static String normalize(String value) {
        String s = value;
        if (s.endsWith("Z")) {
            s = s.substring(0, s.length() - 1) + "+00:00";
        }
        if (s.length() > 10 && s.charAt(10) == ' ') {
            s = s.substring(0, 10) + 'T' + s.substring(11);
        }
        return s;
    }
}
