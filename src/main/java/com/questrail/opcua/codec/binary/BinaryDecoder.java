package com.questrail.opcua.codec.binary;

import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.LimitsGuard;
import com.questrail.opcua.codec.NamespaceScope;
import com.questrail.opcua.codec.NamespaceStack;
import com.questrail.opcua.codec.UaDecoder;
import com.questrail.opcua.observability.OpaqueBodyEvent;
import com.questrail.opcua.types.BuiltInType;
import com.questrail.opcua.types.ByteString;
import com.questrail.opcua.types.DataValue;
import com.questrail.opcua.types.DateTime;
import com.questrail.opcua.types.DiagnosticInfo;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.ExtensionObject;
import com.questrail.opcua.types.ExtensionObjectEncoding;
import com.questrail.opcua.types.LocalizedText;
import com.questrail.opcua.types.Matrix;
import com.questrail.opcua.types.NodeId;
import com.questrail.opcua.types.QualifiedName;
import com.questrail.opcua.types.StatusCode;
import com.questrail.opcua.types.UaEnumeration;
import com.questrail.opcua.types.Variant;
import com.questrail.opcua.types.XmlElement;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * BinaryDecoder
 * -----------------------------------------------------------------------------
 * {@link UaDecoder} reading the OPC UA binary encoding (Part 6 §5.2).
 *
 * <p>Input is treated as hostile:</p>
 * <ul>
 *   <li>every declared length is checked against the configured limits
 *       before anything is allocated for it</li>
 *   <li>a length larger than the bytes left in the input fails with
 *       {@code BadDecodingError} instead of reading past the end</li>
 *   <li>a known extension object body is decoded from a slice of exactly its
 *       declared length, so a malformed body cannot consume its neighbours</li>
 * </ul>
 */
public final class BinaryDecoder implements UaDecoder
{
    private static final int MAX_DIAGNOSTIC_MASK = 0x7F;

    private final EncodingContext context;
    private final LimitsGuard guard;
    private final NamespaceStack namespaces = new NamespaceStack();
    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private ByteBuf buffer;

    public BinaryDecoder(byte[] bytes, EncodingContext context)
    {
        this.context = context;
        this.guard = new LimitsGuard(context.limits());
        guard.checkMessageSize(bytes.length);
        this.buffer = Unpooled.wrappedBuffer(bytes);
    }

    /**
     * Reads a complete message: a type id followed by the body of that type.
     *
     * @param expected the type the caller requires, or {@code null} for any
     *                 registered type
     * @throws CodecException {@code BadDecodingError} if the type id is not
     *         registered or is not {@code expected}
     */
    public Encodeable readMessage(EncodeableType<?> expected)
    {
        final NodeId typeId = readNodeId(null);
        final EncodeableType<?> type = context.factory()
                .resolve(ExpandedNodeId.of(typeId), context.namespaceTable())
                .orElseThrow(() -> CodecException.decodingError("Unknown message type " + typeId));
        if (expected != null && !expected.equals(type)) {
            throw CodecException.decodingError(
                    "Expected a " + expected.name() + " message but found " + type.name());
        }
        final Encodeable value = readEncodeable(null, type);
        if (buffer.isReadable()) {
            reportOpaque(OpaqueBodyEvent.Kind.TRAILING_BYTES, typeId.toString(), buffer.readableBytes());
        }
        return value;
    }

    public int remaining()
    {
        return buffer.readableBytes();
    }

    @Override
    public EncodingContext context()
    {
        return context;
    }

    @Override
    public boolean readBoolean(String fieldName)
    {
        require(1);
        return buffer.readByte() != 0;
    }

    @Override
    public byte readSByte(String fieldName)
    {
        require(1);
        return buffer.readByte();
    }

    @Override
    public short readByte(String fieldName)
    {
        require(1);
        return buffer.readUnsignedByte();
    }

    @Override
    public short readInt16(String fieldName)
    {
        require(2);
        return buffer.readShortLE();
    }

    @Override
    public int readUInt16(String fieldName)
    {
        require(2);
        return buffer.readUnsignedShortLE();
    }

    @Override
    public int readInt32(String fieldName)
    {
        require(4);
        return buffer.readIntLE();
    }

    @Override
    public long readUInt32(String fieldName)
    {
        require(4);
        return buffer.readUnsignedIntLE();
    }

    @Override
    public long readInt64(String fieldName)
    {
        require(8);
        return buffer.readLongLE();
    }

    @Override
    public long readUInt64(String fieldName)
    {
        require(8);
        return buffer.readLongLE();
    }

    @Override
    public float readFloat(String fieldName)
    {
        require(4);
        return buffer.readFloatLE();
    }

    @Override
    public double readDouble(String fieldName)
    {
        require(8);
        return buffer.readDoubleLE();
    }

    @Override
    public String readString(String fieldName)
    {
        int length = readLength();
        if (length < 0) {
            return null;
        }
        guard.checkStringLength(length);
        require(length);
        final String text;
        try {
            text = utf8.decode(buffer.nioBuffer(buffer.readerIndex(), length)).toString();
        }
        catch (CharacterCodingException e) {
            throw CodecException.decodingError("String is not valid UTF-8", e);
        }
        buffer.skipBytes(length);
        return text;
    }

    @Override
    public DateTime readDateTime(String fieldName)
    {
        // out-of-range ticks clamp to MIN / MAX
        return DateTime.fromTicks(readInt64(fieldName));
    }

    @Override
    public UUID readGuid(String fieldName)
    {
        require(16);
        long data1 = buffer.readUnsignedIntLE();
        long data2 = buffer.readUnsignedShortLE();
        long data3 = buffer.readUnsignedShortLE();
        long data4 = buffer.readLong();
        return new UUID((data1 << 32) | (data2 << 16) | data3, data4);
    }

    @Override
    public ByteString readByteString(String fieldName)
    {
        int length = readLength();
        if (length < 0) {
            return null;
        }
        guard.checkByteStringLength(length);
        require(length);
        byte[] bytes = new byte[length];
        buffer.readBytes(bytes);
        return ByteString.of(bytes);
    }

    @Override
    public XmlElement readXmlElement(String fieldName)
    {
        String xml = readString(fieldName);
        return xml == null ? null : XmlElement.of(xml);
    }

    @Override
    public NodeId readNodeId(String fieldName)
    {
        int encoding = readByte(fieldName);
        if ((encoding & (BinaryNodeIds.NAMESPACE_URI_FLAG | BinaryNodeIds.SERVER_INDEX_FLAG)) != 0) {
            throw CodecException.decodingError("NodeId carries ExpandedNodeId flags 0x"
                    + Integer.toHexString(encoding));
        }
        return readNodeIdBody(encoding);
    }

    @Override
    public ExpandedNodeId readExpandedNodeId(String fieldName)
    {
        int encoding = readByte(fieldName);
        NodeId nodeId = readNodeIdBody(encoding & 0x3F);
        String namespaceUri = null;
        long serverIndex = 0;
        if ((encoding & BinaryNodeIds.NAMESPACE_URI_FLAG) != 0) {
            namespaceUri = readString(null);
        }
        if ((encoding & BinaryNodeIds.SERVER_INDEX_FLAG) != 0) {
            serverIndex = readUInt32(null);
        }
        return new ExpandedNodeId(nodeId, namespaceUri, serverIndex);
    }

    private NodeId readNodeIdBody(int encoding)
    {
        switch (encoding) {
            case BinaryNodeIds.TWO_BYTE:
                return new NodeId(0, (long) readByte(null));
            case BinaryNodeIds.FOUR_BYTE: {
                int ns = readByte(null);
                return new NodeId(ns, (long) readUInt16(null));
            }
            case BinaryNodeIds.NUMERIC: {
                int ns = readUInt16(null);
                return new NodeId(ns, readUInt32(null));
            }
            case BinaryNodeIds.STRING: {
                int ns = readUInt16(null);
                String identifier = readString(null);
                if (identifier == null) {
                    throw CodecException.decodingError("String NodeId with null identifier");
                }
                return new NodeId(ns, identifier);
            }
            case BinaryNodeIds.GUID: {
                int ns = readUInt16(null);
                return new NodeId(ns, readGuid(null));
            }
            case BinaryNodeIds.OPAQUE: {
                int ns = readUInt16(null);
                ByteString identifier = readByteString(null);
                if (identifier == null) {
                    throw CodecException.decodingError("Opaque NodeId with null identifier");
                }
                return new NodeId(ns, identifier);
            }
            default:
                throw CodecException.decodingError("Invalid NodeId encoding byte 0x" + Integer.toHexString(encoding));
        }
    }

    @Override
    public StatusCode readStatusCode(String fieldName)
    {
        return StatusCode.of(readUInt32(fieldName));
    }

    @Override
    public QualifiedName readQualifiedName(String fieldName)
    {
        int namespaceIndex = readUInt16(null);
        return new QualifiedName(namespaceIndex, readString(null));
    }

    @Override
    public LocalizedText readLocalizedText(String fieldName)
    {
        int mask = readByte(null);
        String locale = (mask & 0x01) != 0 ? readString(null) : null;
        String text = (mask & 0x02) != 0 ? readString(null) : null;
        return new LocalizedText(locale, text);
    }

    @Override
    public ExtensionObject readExtensionObject(String fieldName)
    {
        try (LimitsGuard.Level level = guard.enter("ExtensionObject")) {
            final ExpandedNodeId typeId = ExpandedNodeId.of(readNodeId(null));
            final int encoding = readByte(null);
            switch (encoding) {
                case 0:
                    return new ExtensionObject(typeId, ExtensionObjectEncoding.NONE, null);
                case 1:
                    return readBinaryBody(typeId);
                case 2: {
                    String xml = readString(null);
                    if (xml == null) {
                        return new ExtensionObject(typeId, ExtensionObjectEncoding.NONE, null);
                    }
                    return ExtensionObject.xml(typeId, XmlElement.of(xml));
                }
                default:
                    throw CodecException.decodingError("Invalid ExtensionObject encoding " + encoding);
            }
        }
    }

    private ExtensionObject readBinaryBody(ExpandedNodeId typeId)
    {
        final int length = readLength();
        if (length < 0) {
            return new ExtensionObject(typeId, ExtensionObjectEncoding.NONE, null);
        }
        guard.checkByteStringLength(length);
        require(length);

        final Optional<EncodeableType<?>> type = context.factory().resolve(typeId, context.namespaceTable());
        if (type.isEmpty()) {
            byte[] bytes = new byte[length];
            buffer.readBytes(bytes);
            reportOpaque(OpaqueBodyEvent.Kind.UNKNOWN_TYPE, typeId.toString(), length);
            return ExtensionObject.binary(typeId, ByteString.of(bytes));
        }

        // the body may only read from its own slice
        final ByteBuf outer = buffer;
        final ByteBuf body = buffer.readSlice(length);
        buffer = body;
        try {
            Encodeable value = readEncodeable(null, type.get());
            if (body.isReadable()) {
                reportOpaque(OpaqueBodyEvent.Kind.TRAILING_BYTES, typeId.toString(), body.readableBytes());
            }
            return ExtensionObject.of(value);
        }
        finally {
            buffer = outer;
        }
    }

    @Override
    public DataValue readDataValue(String fieldName)
    {
        try (LimitsGuard.Level level = guard.enter("DataValue")) {
            int mask = readByte(null);
            Variant value = (mask & 0x01) != 0 ? readVariant(null) : null;
            StatusCode statusCode = (mask & 0x02) != 0 ? readStatusCode(null) : null;
            DateTime sourceTimestamp = (mask & 0x04) != 0 ? readDateTime(null) : null;
            int sourcePicoseconds = (mask & 0x10) != 0 ? readUInt16(null) : 0;
            DateTime serverTimestamp = (mask & 0x08) != 0 ? readDateTime(null) : null;
            int serverPicoseconds = (mask & 0x20) != 0 ? readUInt16(null) : 0;
            return new DataValue(value, statusCode, sourceTimestamp, sourcePicoseconds,
                    serverTimestamp, serverPicoseconds);
        }
    }

    @Override
    public Variant readVariant(String fieldName)
    {
        try (LimitsGuard.Level level = guard.enter("Variant")) {
            final int encoding = readByte(null);
            final int typeId = encoding & BinaryNodeIds.TYPE_MASK;
            final boolean isArray = (encoding & BinaryNodeIds.ARRAY_FLAG) != 0;
            final boolean hasDimensions = (encoding & BinaryNodeIds.DIMENSIONS_FLAG) != 0;

            if (typeId == 0) {
                if (encoding != 0) {
                    throw CodecException.decodingError("Null Variant with flags 0x" + Integer.toHexString(encoding));
                }
                return Variant.NULL;
            }
            final BuiltInType type = variantType(typeId);

            if (!isArray) {
                if (hasDimensions || type == BuiltInType.VARIANT) {
                    throw CodecException.decodingError("Invalid scalar Variant encoding 0x"
                            + Integer.toHexString(encoding));
                }
                Object value = readScalar(null, type);
                // a null String or ByteString scalar carries no value
                return value == null ? Variant.NULL : Variant.of(type, value);
            }

            Object[] elements = readElements(type);
            if (elements == null) {
                elements = new Object[0];
            }
            if (!hasDimensions) {
                return Variant.ofArray(type, elements);
            }
            int[] dimensions = readDimensions();
            if (dimensions.length == 1 && dimensions[0] == elements.length) {
                return Variant.ofArray(type, elements);
            }
            checkDimensions(dimensions, elements.length);
            return Variant.ofMatrix(new Matrix(type, elements, dimensions));
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid Variant: " + e.getMessage(), e);
        }
    }

    private static BuiltInType variantType(int typeId)
    {
        if (typeId > BuiltInType.DIAGNOSTIC_INFO.id()) {
            throw CodecException.decodingError("Unknown Variant type id " + typeId);
        }
        return BuiltInType.fromId(typeId)
                .orElseThrow(() -> CodecException.decodingError("Unknown Variant type id " + typeId));
    }

    @Override
    public DiagnosticInfo readDiagnosticInfo(String fieldName)
    {
        try (LimitsGuard.Level level = guard.enter("DiagnosticInfo")) {
            int mask = readByte(null);
            if ((mask & ~MAX_DIAGNOSTIC_MASK) != 0) {
                throw CodecException.decodingError("Invalid DiagnosticInfo mask 0x" + Integer.toHexString(mask));
            }
            int symbolicId = (mask & 0x01) != 0 ? readInt32(null) : -1;
            int namespaceUri = (mask & 0x02) != 0 ? readInt32(null) : -1;
            int locale = (mask & 0x08) != 0 ? readInt32(null) : -1;
            int localizedText = (mask & 0x04) != 0 ? readInt32(null) : -1;
            String additionalInfo = (mask & 0x10) != 0 ? readString(null) : null;
            StatusCode innerStatusCode = (mask & 0x20) != 0 ? readStatusCode(null) : null;
            DiagnosticInfo inner = (mask & 0x40) != 0 ? readDiagnosticInfo(null) : null;
            return new DiagnosticInfo(symbolicId, namespaceUri, locale, localizedText,
                    additionalInfo, innerStatusCode, inner);
        }
    }

    @Override
    public <E extends Enum<E> & UaEnumeration> E readEnumeration(String fieldName, Class<E> enumType)
    {
        return UaDecoder.enumerationConstant(enumType, readInt32(fieldName));
    }

    @Override
    public <T extends Encodeable> T readEncodeable(String fieldName, EncodeableType<T> type)
    {
        try (LimitsGuard.Level level = guard.enter(type.name());
             NamespaceScope scope = namespaces.push(type.xmlNamespace())) {
            return type.decode(this);
        }
    }

    @Override
    public Object[] readArray(String fieldName, BuiltInType type)
    {
        return readElements(type);
    }

    private Object[] readElements(BuiltInType type)
    {
        int length = readLength();
        if (length < 0) {
            return null;
        }
        guard.checkArrayLength(length);
        // every element occupies at least one byte
        require(length);
        Object[] elements = new Object[length];
        for (int i = 0; i < length; i++) {
            elements[i] = readScalar(null, type);
        }
        return elements;
    }

    @Override
    public <T extends Encodeable> List<T> readEncodeableArray(String fieldName, EncodeableType<T> type)
    {
        int length = readLength();
        if (length < 0) {
            return null;
        }
        guard.checkArrayLength(length);
        require(length);
        List<T> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            values.add(readEncodeable(null, type));
        }
        return values;
    }

    @Override
    public Matrix readMatrix(String fieldName, BuiltInType type)
    {
        int count = readLength();
        if (count < 0) {
            return null;
        }
        guard.checkArrayLength(count);
        require(count * 4L);
        int[] dimensions = new int[count];
        for (int i = 0; i < count; i++) {
            dimensions[i] = buffer.readIntLE();
        }
        int elementCount = checkDimensions(dimensions, -1);
        guard.checkArrayLength(elementCount);
        require(elementCount);
        Object[] elements = new Object[elementCount];
        for (int i = 0; i < elementCount; i++) {
            elements[i] = readScalar(null, type);
        }
        try {
            return new Matrix(type, elements, dimensions);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid Matrix: " + e.getMessage(), e);
        }
    }

    private int[] readDimensions()
    {
        int count = readLength();
        if (count < 1) {
            throw CodecException.decodingError("Variant dimensions flag without dimensions");
        }
        guard.checkArrayLength(count);
        require(count * 4L);
        int[] dimensions = new int[count];
        for (int i = 0; i < count; i++) {
            dimensions[i] = buffer.readIntLE();
        }
        return dimensions;
    }

    /**
     * Validates wire dimensions before a {@link Matrix} is built from them.
     *
     * @param expected element count the dimensions must describe, or -1
     * @return the element count the dimensions describe
     */
    private static int checkDimensions(int[] dimensions, int expected)
    {
        if (dimensions.length < 2) {
            throw CodecException.decodingError("Matrix needs at least two dimensions, found " + dimensions.length);
        }
        long product = 1;
        for (int dimension : dimensions) {
            if (dimension <= 0) {
                throw CodecException.decodingError("Non-positive matrix dimension " + dimension);
            }
            product *= dimension;
            if (product > Integer.MAX_VALUE) {
                throw CodecException.decodingError("Matrix dimensions overflow");
            }
        }
        if (expected >= 0 && product != expected) {
            throw CodecException.decodingError("Matrix dimensions describe " + product
                    + " elements but " + expected + " were encoded");
        }
        return (int) product;
    }

    @Override
    public NamespaceScope pushNamespace(String namespaceUri)
    {
        return namespaces.push(namespaceUri);
    }

    @Override
    public void popNamespace()
    {
        namespaces.pop();
    }

    /**
     * Int32 length prefix. Any negative length means null.
     */
    private int readLength()
    {
        return readInt32(null);
    }

    private void require(long bytes)
    {
        if (bytes > buffer.readableBytes()) {
            throw CodecException.decodingError("Unexpected end of input: need " + bytes
                    + " bytes, " + buffer.readableBytes() + " left");
        }
    }

    private void reportOpaque(OpaqueBodyEvent.Kind kind, String typeId, int length)
    {
        context.observabilitySink().onOpaqueBody(
                new OpaqueBodyEvent(Instant.now(), kind, typeId, "binary", length));
    }
}
