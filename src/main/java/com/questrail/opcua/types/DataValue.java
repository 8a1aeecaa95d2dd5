package com.questrail.opcua.types;

/**
 * OPC UA DataValue: a value with its quality and timestamps.
 *
 * <p>Absent fields are represented by their defaults ({@link Variant#NULL},
 * {@link StatusCode#GOOD}, {@link DateTime#MIN_VALUE}, zero picoseconds);
 * {@code null} arguments are normalised to those defaults. Encoders omit
 * default fields.</p>
 */
public record DataValue(
        Variant value,
        StatusCode statusCode,
        DateTime sourceTimestamp,
        int sourcePicoseconds,
        DateTime serverTimestamp,
        int serverPicoseconds
) {
    public static final DataValue NULL = new DataValue(null, null, null, 0, null, 0);

    public DataValue {
        value = value == null ? Variant.NULL : value;
        statusCode = statusCode == null ? StatusCode.GOOD : statusCode;
        sourceTimestamp = sourceTimestamp == null ? DateTime.MIN_VALUE : sourceTimestamp;
        serverTimestamp = serverTimestamp == null ? DateTime.MIN_VALUE : serverTimestamp;
        checkPicoseconds(sourcePicoseconds);
        checkPicoseconds(serverPicoseconds);
    }

    public static DataValue of(Variant value)
    {
        return new DataValue(value, null, null, 0, null, 0);
    }

    public static DataValue of(Variant value, StatusCode statusCode, DateTime sourceTimestamp, DateTime serverTimestamp)
    {
        return new DataValue(value, statusCode, sourceTimestamp, 0, serverTimestamp, 0);
    }

    public boolean hasValue()
    {
        return !value.isNull();
    }

    public boolean hasStatusCode()
    {
        return statusCode.value() != StatusCodes.Good;
    }

    public boolean hasSourceTimestamp()
    {
        return !sourceTimestamp.isMin();
    }

    public boolean hasServerTimestamp()
    {
        return !serverTimestamp.isMin();
    }

    private static void checkPicoseconds(int picoseconds)
    {
        if (picoseconds < 0 || picoseconds > 0xFFFF) {
            throw new IllegalArgumentException("picoseconds out of UInt16 range: " + picoseconds);
        }
    }
}
