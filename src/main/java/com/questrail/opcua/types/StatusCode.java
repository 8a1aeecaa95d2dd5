package com.questrail.opcua.types;

/**
 * OPC UA StatusCode.
 *
 * <p>A 32-bit value held in the low bits of a {@code long}. The two most
 * significant bits carry the severity (00 Good, 01 Uncertain, 10 Bad); the
 * next 14 bits carry the sub-code. The codec treats the value as opaque.</p>
 */
public record StatusCode(long value)
{
    public static final StatusCode GOOD = new StatusCode(StatusCodes.Good);
    public static final StatusCode UNCERTAIN = new StatusCode(StatusCodes.Uncertain);
    public static final StatusCode BAD = new StatusCode(StatusCodes.Bad);

    private static final long SEVERITY_MASK = 0xC000_0000L;

    public StatusCode {
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("StatusCode out of UInt32 range: " + value);
        }
    }

    public static StatusCode of(long value)
    {
        return new StatusCode(value);
    }

    public boolean isGood()
    {
        return (value & SEVERITY_MASK) == 0;
    }

    public boolean isUncertain()
    {
        return (value & SEVERITY_MASK) == 0x4000_0000L;
    }

    public boolean isBad()
    {
        return (value & 0x8000_0000L) != 0;
    }

    /**
     * Code bits without the info bits (the upper 16 bits).
     */
    public long codeBits()
    {
        return value & 0xFFFF_0000L;
    }

    /**
     * Symbolic name of the code bits, if known.
     */
    public java.util.Optional<String> symbol()
    {
        return StatusCodes.symbolOf(codeBits());
    }

    @Override
    public String toString()
    {
        return symbol().orElse("StatusCode")
                + "[0x" + String.format("%08X", value) + "]";
    }
}
