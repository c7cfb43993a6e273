package com.agentlog.ontology;

import com.agentlog.ontology.schema.MalformedTimestampException;
import com.agentlog.ontology.schema.Timestamps;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    private static final OffsetDateTime MIDNIGHT_UTC = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void trailingZIsReadAsUtc() {
        assertEquals(MIDNIGHT_UTC, Timestamps.parse("2024-01-01T00:00:00Z", "f"));
    }

    @Test
    void explicitOffsetIsKept() {
        OffsetDateTime parsed = Timestamps.parse("2024-01-01T10:30:00+02:00", "f");
        assertEquals(ZoneOffset.ofHours(2), parsed.getOffset());
        assertEquals(10, parsed.getHour());
    }

    @Test
    void offsetLessValueIsReadAsUtc() {
        assertEquals(MIDNIGHT_UTC.plusHours(9), Timestamps.parse("2024-01-01T09:00:00", "f"));
    }

    @Test
    void dateOnlyIsUtcMidnight() {
        assertEquals(MIDNIGHT_UTC, Timestamps.parse("2024-01-01", "f"));
    }

    @Test
    void spaceSeparatorIsAccepted() {
        assertEquals(MIDNIGHT_UTC.plusMinutes(5), Timestamps.parse("2024-01-01 00:05:00Z", "f"));
    }

    @Test
    void fractionalSecondsAreKept() {
        OffsetDateTime parsed = Timestamps.parse("2024-01-01T00:00:00.123456Z", "f");
        assertEquals(123_456_000, parsed.getNano());
    }

    @Test
    void nullParsesToNull() {
        assertNull(Timestamps.parse(null, "f"));
    }

    @Test
    void malformedValueNamesFieldAndValue() {
        MalformedTimestampException ex = assertThrows(MalformedTimestampException.class,
                () -> Timestamps.parse("yesterday", "steps[3].timestamp"));
        assertEquals("steps[3].timestamp", ex.getPath());
        assertEquals("yesterday", ex.getValue());
        assertTrue(ex.getMessage().contains("steps[3].timestamp"));
    }

    @Test
    void formatWritesSecondsAndNumericUtcOffset() {
        assertEquals("2024-01-01T00:00:00+00:00", Timestamps.format(MIDNIGHT_UTC));
        assertEquals("2024-01-01T00:00:00.5+00:00", Timestamps.format(MIDNIGHT_UTC.plusNanos(500_000_000)));
        assertNull(Timestamps.format(null));
    }

    @Test
    void formattedValueParsesBackUnchanged() {
        OffsetDateTime value = OffsetDateTime.of(2024, 3, 9, 17, 4, 5, 120_000, ZoneOffset.ofHours(-5));
        assertEquals(value, Timestamps.parse(Timestamps.format(value), "f"));
    }

    @Test
    void secondsBetweenKeepsFraction() {
        assertEquals(1.5, Timestamps.secondsBetween(MIDNIGHT_UTC, MIDNIGHT_UTC.plusNanos(1_500_000_000L)), 1e-9);
    }
}
