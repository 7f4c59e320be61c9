package com.ecowatch.core.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimestampParserTest {
    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    @Test
    void dayFirstSlashDateIsReordered() {
        Instant expected = LocalDateTime.of(2024, 3, 15, 10, 30).atZone(IST).toInstant();

        assertEquals(expected, TimestampParser.parse("15/03/2024", "10:30", IST).orElseThrow());
    }

    @Test
    void usesTheGivenZoneForLocalTimes() {
        assertEquals(
                Instant.parse("2024-03-15T10:30:00Z"),
                TimestampParser.parse("15-03-2024", "10:30", ZoneOffset.UTC).orElseThrow()
        );
        assertEquals(
                Instant.parse("2024-03-15T05:00:00Z"),
                TimestampParser.parse("15-03-2024", "10:30", IST).orElseThrow()
        );
    }

    @Test
    void acceptsYearFirstDatesSecondsFractionsAndMarkup() {
        assertEquals(
                Instant.parse("2024-03-15T10:30:45Z"),
                TimestampParser.parse("2024-03-15", "10:30:45", ZoneOffset.UTC).orElseThrow()
        );
        assertEquals(
                Instant.parse("2024-03-15T10:30:45.500Z"),
                TimestampParser.parse("<span>15/03/2024</span>", "<b>10:30:45.5</b>", ZoneOffset.UTC).orElseThrow()
        );
    }

    @Test
    void dateWithoutTimeIsStartOfDay() {
        assertEquals(
                Instant.parse("2024-03-15T00:00:00Z"),
                TimestampParser.parse("15/03/2024", "", ZoneOffset.UTC).orElseThrow()
        );
    }

    @Test
    void explicitOffsetWinsOverZone() {
        assertEquals(
                Instant.parse("2024-03-15T10:30:00Z"),
                TimestampParser.parse("2024-03-15T10:30:00Z", null, IST).orElseThrow()
        );
    }

    @Test
    void garbledOrImpossibleValuesAreUnparsable() {
        assertTrue(TimestampParser.parse("31/02/2024", "10:00", IST).isEmpty());
        assertTrue(TimestampParser.parse("15/03/2024", "25:61", IST).isEmpty());
        assertTrue(TimestampParser.parse("yesterday", "noon", IST).isEmpty());
        assertTrue(TimestampParser.parse("", "", IST).isEmpty());
        assertTrue(TimestampParser.parse(null, null, IST).isEmpty());
    }
}
