package com.questrail.opcua.types;

import com.questrail.opcua.codec.Encodeable;

import java.util.Objects;

/**
 * OPC UA ExtensionObject: a type id plus a body.
 *
 * <p>The body is one of:</p>
 * <ul>
 *   <li>nothing ({@link ExtensionObjectEncoding#NONE})</li>
 *   <li>an opaque payload tagged with the encoding it was received in
 *       ({@link ByteString} for binary, {@link XmlElement} for XML, JSON text)</li>
 *   <li>a decoded {@link Encodeable}</li>
 * </ul>
 *
 * <p>Opaque bodies are the result of decoding a type that is not registered;
 * they are written back unchanged so that unknown structures survive a
 * decode/re-encode cycle.</p>
 */
public record ExtensionObject(ExpandedNodeId typeId, ExtensionObjectEncoding encoding, Object body)
{
    public static final ExtensionObject NULL =
            new ExtensionObject(ExpandedNodeId.NULL, ExtensionObjectEncoding.NONE, null);

    public ExtensionObject {
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(encoding, "encoding");
        switch (encoding) {
            case NONE -> requireBody(body == null, encoding, body);
            case BINARY -> requireBody(body instanceof ByteString, encoding, body);
            case XML -> requireBody(body instanceof XmlElement, encoding, body);
            case JSON -> requireBody(body instanceof String, encoding, body);
            case ENCODEABLE -> requireBody(body instanceof Encodeable, encoding, body);
        }
    }

    /**
     * Wraps a structured value; the type id is the value's data type id.
     */
    public static ExtensionObject of(Encodeable encodeable)
    {
        Objects.requireNonNull(encodeable, "encodeable");
        return new ExtensionObject(
                encodeable.encodeableType().dataTypeId(), ExtensionObjectEncoding.ENCODEABLE, encodeable);
    }

    public static ExtensionObject binary(ExpandedNodeId typeId, ByteString body)
    {
        return new ExtensionObject(typeId, ExtensionObjectEncoding.BINARY, body);
    }

    public static ExtensionObject xml(ExpandedNodeId typeId, XmlElement body)
    {
        return new ExtensionObject(typeId, ExtensionObjectEncoding.XML, body);
    }

    public static ExtensionObject json(ExpandedNodeId typeId, String body)
    {
        return new ExtensionObject(typeId, ExtensionObjectEncoding.JSON, body);
    }

    public boolean isNull()
    {
        return encoding == ExtensionObjectEncoding.NONE && typeId.isNull();
    }

    public boolean isDecoded()
    {
        return encoding == ExtensionObjectEncoding.ENCODEABLE;
    }

    public Encodeable decodedBody()
    {
        if (!isDecoded()) {
            throw new IllegalStateException("ExtensionObject body is not decoded: " + encoding);
        }
        return (Encodeable) body;
    }

    private static void requireBody(boolean valid, ExtensionObjectEncoding encoding, Object body)
    {
        if (!valid) {
            throw new IllegalArgumentException("Body "
                    + (body == null ? "null" : body.getClass().getSimpleName())
                    + " does not match encoding " + encoding);
        }
    }
}
