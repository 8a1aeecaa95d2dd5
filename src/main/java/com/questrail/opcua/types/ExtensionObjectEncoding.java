package com.questrail.opcua.types;

/**
 * How the body of an {@link ExtensionObject} is held.
 *
 * <p>{@link #wireValue()} is the encoding byte used by the binary format and
 * by the JSON {@code Encoding} field. {@link #ENCODEABLE} never appears on the
 * wire: such bodies are written in the active format.</p>
 */
public enum ExtensionObjectEncoding
{
    NONE(0),
    BINARY(1),
    XML(2),
    JSON(3),
    ENCODEABLE(-1);

    private final int wireValue;

    ExtensionObjectEncoding(int wireValue)
    {
        this.wireValue = wireValue;
    }

    public int wireValue()
    {
        return wireValue;
    }
}
