package com.questrail.opcua.types;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * OPC UA DateTime.
 *
 * <p>Stored as the number of 100 nanosecond ticks since 1601-01-01T00:00:00Z,
 * which is the binary wire representation. Values at or below the epoch
 * collapse to {@link #MIN_VALUE}; values at or beyond 9999-12-31T23:59:59.9999999Z
 * collapse to {@link #MAX_VALUE}.</p>
 */
public record DateTime(long utcTicks) implements Comparable<DateTime>
{
    /** Ticks between 1601-01-01 and 1970-01-01. */
    public static final long EPOCH_OFFSET_TICKS = 116_444_736_000_000_000L;

    public static final long TICKS_PER_SECOND = 10_000_000L;

    /** Ticks of 9999-12-31T23:59:59.9999999Z. */
    public static final long MAX_TICKS = 2_650_467_743_999_999_999L;

    public static final DateTime MIN_VALUE = new DateTime(0L);
    public static final DateTime MAX_VALUE = new DateTime(MAX_TICKS);

    public DateTime {
        if (utcTicks < 0) {
            utcTicks = 0;
        }
        else if (utcTicks > MAX_TICKS) {
            utcTicks = MAX_TICKS;
        }
    }

    public static DateTime fromTicks(long utcTicks)
    {
        return new DateTime(utcTicks);
    }

    public static DateTime fromInstant(Instant instant)
    {
        long seconds = instant.getEpochSecond();
        long minSeconds = -EPOCH_OFFSET_TICKS / TICKS_PER_SECOND;
        long maxSeconds = (MAX_TICKS - EPOCH_OFFSET_TICKS) / TICKS_PER_SECOND;
        if (seconds < minSeconds) {
            return MIN_VALUE;
        }
        if (seconds > maxSeconds) {
            return MAX_VALUE;
        }
        long ticks = (seconds - minSeconds) * TICKS_PER_SECOND + instant.getNano() / 100;
        return new DateTime(ticks);
    }

    public static DateTime now()
    {
        return fromInstant(Instant.now());
    }

    /**
     * Midnight UTC of the current day.
     */
    public static DateTime today()
    {
        return fromInstant(LocalDate.now(ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    /**
     * Parses an ISO-8601 instant such as {@code 2024-01-01T00:00:00.1234567Z}.
     *
     * @throws IllegalArgumentException if the text is not a valid instant
     */
    public static DateTime parse(String text)
    {
        try {
            return fromInstant(Instant.parse(text));
        }
        catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid DateTime: " + text, e);
        }
    }

    public Instant toInstant()
    {
        long unixTicks = utcTicks - EPOCH_OFFSET_TICKS;
        return Instant.ofEpochSecond(
                Math.floorDiv(unixTicks, TICKS_PER_SECOND),
                Math.floorMod(unixTicks, TICKS_PER_SECOND) * 100);
    }

    public boolean isMin()
    {
        return utcTicks == 0;
    }

    public boolean isMax()
    {
        return utcTicks == MAX_TICKS;
    }

    /**
     * ISO-8601 text with at most seven fraction digits and trailing zeros
     * removed, always in UTC.
     */
    public String toIsoString()
    {
        Instant instant = toInstant();
        String text = instant.truncatedTo(java.time.temporal.ChronoUnit.SECONDS).toString();
        int fraction = instant.getNano() / 100;
        if (fraction == 0) {
            return text;
        }
        String digits = String.format("%07d", fraction);
        int end = digits.length();
        while (digits.charAt(end - 1) == '0') {
            end--;
        }
        return text.substring(0, text.length() - 1) + "." + digits.substring(0, end) + "Z";
    }

    @Override
    public int compareTo(DateTime other)
    {
        return Long.compare(utcTicks, other.utcTicks);
    }

    @Override
    public String toString()
    {
        return toIsoString();
    }
}
