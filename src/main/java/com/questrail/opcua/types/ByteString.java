package com.questrail.opcua.types;

import java.util.Arrays;
import java.util.Base64;

/**
 * Immutable OPC UA ByteString.
 *
 * <p>A {@code null} ByteString and an empty one are distinct on every wire
 * format; this class only represents the non-null case. Fields that may be
 * null hold a {@code null} reference.</p>
 *
 * <p>The backing array is copied on the way in and out.</p>
 */
public final class ByteString
{
    public static final ByteString EMPTY = new ByteString(new byte[0]);

    private final byte[] bytes;

    private ByteString(byte[] bytes)
    {
        this.bytes = bytes;
    }

    public static ByteString of(byte[] bytes)
    {
        return new ByteString(bytes.clone());
    }

    public static ByteString fromBase64(String text)
    {
        return new ByteString(Base64.getDecoder().decode(text));
    }

    public byte[] bytes()
    {
        return bytes.clone();
    }

    public int length()
    {
        return bytes.length;
    }

    public boolean isEmpty()
    {
        return bytes.length == 0;
    }

    public String toBase64()
    {
        return Base64.getEncoder().encodeToString(bytes);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ByteString that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString()
    {
        return "ByteString[length=" + bytes.length + "]";
    }
}
