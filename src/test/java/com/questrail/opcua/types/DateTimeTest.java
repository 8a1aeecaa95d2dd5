package com.questrail.opcua.types;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class DateTimeTest
{
    @Test
    void epochOffsets()
    {
        assertEquals("1601-01-01T00:00:00Z", DateTime.MIN_VALUE.toIsoString());
        assertEquals(DateTime.EPOCH_OFFSET_TICKS, DateTime.fromInstant(Instant.EPOCH).utcTicks());
    }

    @Test
    void keepsSevenFractionDigits()
    {
        DateTime value = DateTime.parse("2024-01-01T12:30:45.1234567Z");

        assertEquals("2024-01-01T12:30:45.1234567Z", value.toIsoString());
        assertEquals("2024-01-01T12:30:45.5Z", DateTime.parse("2024-01-01T12:30:45.500Z").toIsoString());
    }

    @Test
    void clampsOutOfRangeValues()
    {
        assertTrue(DateTime.fromTicks(-5).isMin());
        assertTrue(DateTime.fromTicks(Long.MAX_VALUE).isMax());
        assertTrue(DateTime.fromInstant(Instant.parse("1500-01-01T00:00:00Z")).isMin());
        assertTrue(DateTime.fromInstant(Instant.MAX).isMax());
        assertTrue(DateTime.fromInstant(Instant.MIN).isMin());
    }

    @Test
    void rejectsMalformedText()
    {
        assertThrows(IllegalArgumentException.class, () -> DateTime.parse("yesterday"));
    }

    @Test
    void todayIsMidnight()
    {
        assertEquals(0, DateTime.today().utcTicks() % (86_400L * DateTime.TICKS_PER_SECOND));
    }
}
