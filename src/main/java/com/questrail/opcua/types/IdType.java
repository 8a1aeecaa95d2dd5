package com.questrail.opcua.types;

/**
 * Kind of identifier held by a {@link NodeId}.
 *
 * <p>The ordinal values are the ones used by the JSON {@code IdType} field.</p>
 */
public enum IdType
{
    NUMERIC(0, "i"),
    STRING(1, "s"),
    GUID(2, "g"),
    OPAQUE(3, "b");

    private final int value;
    private final String prefix;

    IdType(int value, String prefix)
    {
        this.value = value;
        this.prefix = prefix;
    }

    public int value()
    {
        return value;
    }

    /**
     * Prefix used by the text form ({@code i=}, {@code s=}, {@code g=}, {@code b=}).
     */
    public String prefix()
    {
        return prefix;
    }

    public static IdType fromValue(int value)
    {
        for (IdType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown IdType: " + value);
    }
}
