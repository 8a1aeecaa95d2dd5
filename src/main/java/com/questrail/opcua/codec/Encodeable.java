package com.questrail.opcua.codec;

/**
 * A structured value that knows its type descriptor and can write its fields.
 *
 * <p>Fields are written in declaration order through the format-neutral
 * {@link UaEncoder} calls; the matching decode function lives on the
 * {@link EncodeableType}. Equality is value equality, which records give for
 * free.</p>
 */
public interface Encodeable
{
    EncodeableType<?> encodeableType();

    void encode(UaEncoder encoder);
}
