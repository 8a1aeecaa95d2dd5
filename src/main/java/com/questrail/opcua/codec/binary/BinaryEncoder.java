package com.questrail.opcua.codec.binary;

import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.LimitsGuard;
import com.questrail.opcua.codec.NamespaceScope;
import com.questrail.opcua.codec.NamespaceStack;
import com.questrail.opcua.codec.UaEncoder;
import com.questrail.opcua.types.BuiltInType;
import com.questrail.opcua.types.ByteString;
import com.questrail.opcua.types.DataValue;
import com.questrail.opcua.types.DateTime;
import com.questrail.opcua.types.DiagnosticInfo;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.ExtensionObject;
import com.questrail.opcua.types.LocalizedText;
import com.questrail.opcua.types.Matrix;
import com.questrail.opcua.types.NodeId;
import com.questrail.opcua.types.QualifiedName;
import com.questrail.opcua.types.StatusCode;
import com.questrail.opcua.types.StatusCodes;
import com.questrail.opcua.types.UaEnumeration;
import com.questrail.opcua.types.Variant;
import com.questrail.opcua.types.XmlElement;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * BinaryEncoder
 * -----------------------------------------------------------------------------
 * {@link UaEncoder} producing the OPC UA binary encoding (Part 6 §5.2).
 *
 * <p>All multi-byte values are little endian. Field names are ignored: the
 * binary format is positional. Length-prefixed values use an Int32 prefix
 * where {@code -1} denotes {@code null}.</p>
 *
 * <p>The encoder owns a heap {@link ByteBuf}; {@link #close()} releases it.
 * Instances are single-use and not thread safe.</p>
 */
public final class BinaryEncoder implements UaEncoder, AutoCloseable
{
    private final EncodingContext context;
    private final LimitsGuard guard;
    private final NamespaceStack namespaces = new NamespaceStack();
    private final ByteBuf buffer;

    public BinaryEncoder(EncodingContext context)
    {
        this.context = context;
        this.guard = new LimitsGuard(context.limits());
        this.buffer = Unpooled.buffer(256);
    }

    /**
     * Writes a complete message: the binary encoding id of the value's type
     * followed by the value's body.
     */
    public void writeMessage(Encodeable value)
    {
        EncodeableType<?> type = value.encodeableType();
        writeNodeId(null, BinaryNodeIds.toLocal(type.binaryEncodingId(), context.namespaceTable()));
        writeEncodeable(null, value, type);
    }

    /**
     * Bytes written so far.
     *
     * @throws CodecException {@code BadEncodingLimitsExceeded} if the output
     *         exceeds the message size limit
     */
    public byte[] toByteArray()
    {
        guard.checkMessageSize(buffer.readableBytes());
        byte[] bytes = new byte[buffer.readableBytes()];
        buffer.getBytes(buffer.readerIndex(), bytes);
        return bytes;
    }

    @Override
    public void close()
    {
        if (buffer.refCnt() > 0) {
            buffer.release();
        }
    }

    @Override
    public EncodingContext context()
    {
        return context;
    }

    @Override
    public void writeBoolean(String fieldName, boolean value)
    {
        buffer.writeByte(value ? 1 : 0);
    }

    @Override
    public void writeSByte(String fieldName, byte value)
    {
        buffer.writeByte(value);
    }

    @Override
    public void writeByte(String fieldName, short value)
    {
        checkRange("Byte", value, 0, 0xFF);
        buffer.writeByte(value);
    }

    @Override
    public void writeInt16(String fieldName, short value)
    {
        buffer.writeShortLE(value);
    }

    @Override
    public void writeUInt16(String fieldName, int value)
    {
        checkRange("UInt16", value, 0, 0xFFFF);
        buffer.writeShortLE(value);
    }

    @Override
    public void writeInt32(String fieldName, int value)
    {
        buffer.writeIntLE(value);
    }

    @Override
    public void writeUInt32(String fieldName, long value)
    {
        checkRange("UInt32", value, 0, 0xFFFF_FFFFL);
        buffer.writeIntLE((int) value);
    }

    @Override
    public void writeInt64(String fieldName, long value)
    {
        buffer.writeLongLE(value);
    }

    @Override
    public void writeUInt64(String fieldName, long value)
    {
        buffer.writeLongLE(value);
    }

    @Override
    public void writeFloat(String fieldName, float value)
    {
        buffer.writeFloatLE(value);
    }

    @Override
    public void writeDouble(String fieldName, double value)
    {
        buffer.writeDoubleLE(value);
    }

    @Override
    public void writeString(String fieldName, String value)
    {
        if (value == null) {
            buffer.writeIntLE(-1);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        guard.checkStringLength(bytes.length);
        buffer.writeIntLE(bytes.length);
        buffer.writeBytes(bytes);
    }

    @Override
    public void writeDateTime(String fieldName, DateTime value)
    {
        if (value == null || value.isMin()) {
            buffer.writeLongLE(0L);
        }
        else if (value.isMax()) {
            buffer.writeLongLE(Long.MAX_VALUE);
        }
        else {
            buffer.writeLongLE(value.utcTicks());
        }
    }

    @Override
    public void writeGuid(String fieldName, UUID value)
    {
        UUID guid = value != null ? value : new UUID(0L, 0L);
        long msb = guid.getMostSignificantBits();
        buffer.writeIntLE((int) (msb >>> 32));
        buffer.writeShortLE((int) (msb >>> 16));
        buffer.writeShortLE((int) msb);
        buffer.writeLong(guid.getLeastSignificantBits());
    }

    @Override
    public void writeByteString(String fieldName, ByteString value)
    {
        if (value == null) {
            buffer.writeIntLE(-1);
            return;
        }
        guard.checkByteStringLength(value.length());
        buffer.writeIntLE(value.length());
        buffer.writeBytes(value.bytes());
    }

    @Override
    public void writeXmlElement(String fieldName, XmlElement value)
    {
        writeString(fieldName, value == null ? null : value.xml());
    }

    @Override
    public void writeNodeId(String fieldName, NodeId value)
    {
        writeNodeId(value != null ? value : NodeId.NULL, 0);
    }

    @Override
    public void writeExpandedNodeId(String fieldName, ExpandedNodeId value)
    {
        ExpandedNodeId id = value != null ? value : ExpandedNodeId.NULL;
        int flags = 0;
        if (id.namespaceUri() != null) {
            flags |= BinaryNodeIds.NAMESPACE_URI_FLAG;
        }
        if (id.serverIndex() != 0) {
            flags |= BinaryNodeIds.SERVER_INDEX_FLAG;
        }
        writeNodeId(id.nodeId(), flags);
        if (id.namespaceUri() != null) {
            writeString(null, id.namespaceUri());
        }
        if (id.serverIndex() != 0) {
            buffer.writeIntLE((int) id.serverIndex());
        }
    }

    private void writeNodeId(NodeId id, int flags)
    {
        int ns = id.namespaceIndex();
        switch (id.idType()) {
            case NUMERIC -> {
                long identifier = (Long) id.identifier();
                if (ns == 0 && identifier <= 0xFF) {
                    buffer.writeByte(BinaryNodeIds.TWO_BYTE | flags);
                    buffer.writeByte((int) identifier);
                }
                else if (ns <= 0xFF && identifier <= 0xFFFF) {
                    buffer.writeByte(BinaryNodeIds.FOUR_BYTE | flags);
                    buffer.writeByte(ns);
                    buffer.writeShortLE((int) identifier);
                }
                else {
                    buffer.writeByte(BinaryNodeIds.NUMERIC | flags);
                    buffer.writeShortLE(ns);
                    buffer.writeIntLE((int) identifier);
                }
            }
            case STRING -> {
                buffer.writeByte(BinaryNodeIds.STRING | flags);
                buffer.writeShortLE(ns);
                writeString(null, (String) id.identifier());
            }
            case GUID -> {
                buffer.writeByte(BinaryNodeIds.GUID | flags);
                buffer.writeShortLE(ns);
                writeGuid(null, (UUID) id.identifier());
            }
            case OPAQUE -> {
                buffer.writeByte(BinaryNodeIds.OPAQUE | flags);
                buffer.writeShortLE(ns);
                writeByteString(null, (ByteString) id.identifier());
            }
        }
    }

    @Override
    public void writeStatusCode(String fieldName, StatusCode value)
    {
        buffer.writeIntLE((int) (value != null ? value : StatusCode.GOOD).value());
    }

    @Override
    public void writeQualifiedName(String fieldName, QualifiedName value)
    {
        QualifiedName name = value != null ? value : QualifiedName.NULL;
        buffer.writeShortLE(name.namespaceIndex());
        writeString(null, name.name());
    }

    @Override
    public void writeLocalizedText(String fieldName, LocalizedText value)
    {
        LocalizedText text = value != null ? value : LocalizedText.NULL;
        int mask = 0;
        if (text.locale() != null) {
            mask |= 0x01;
        }
        if (text.text() != null) {
            mask |= 0x02;
        }
        buffer.writeByte(mask);
        if (text.locale() != null) {
            writeString(null, text.locale());
        }
        if (text.text() != null) {
            writeString(null, text.text());
        }
    }

    @Override
    public void writeExtensionObject(String fieldName, ExtensionObject value)
    {
        ExtensionObject object = value != null ? value : ExtensionObject.NULL;
        try (LimitsGuard.Level level = guard.enter("ExtensionObject")) {
            switch (object.encoding()) {
                case NONE -> {
                    writeNodeId(null, BinaryNodeIds.toLocal(object.typeId(), context.namespaceTable()));
                    buffer.writeByte(0);
                }
                case BINARY -> {
                    writeNodeId(null, BinaryNodeIds.toLocal(object.typeId(), context.namespaceTable()));
                    buffer.writeByte(1);
                    writeByteString(null, (ByteString) object.body());
                }
                case XML -> {
                    writeNodeId(null, BinaryNodeIds.toLocal(object.typeId(), context.namespaceTable()));
                    buffer.writeByte(2);
                    writeString(null, ((XmlElement) object.body()).xml());
                }
                case JSON -> throw CodecException.encodingError(
                        "ExtensionObject " + object.typeId() + " holds a JSON body, which has no binary form");
                case ENCODEABLE -> {
                    Encodeable body = object.decodedBody();
                    EncodeableType<?> type = body.encodeableType();
                    writeNodeId(null, BinaryNodeIds.toLocal(type.binaryEncodingId(), context.namespaceTable()));
                    buffer.writeByte(1);
                    // length is patched once the body is written
                    int lengthIndex = buffer.writerIndex();
                    buffer.writeIntLE(0);
                    writeEncodeable(null, body, type);
                    buffer.setIntLE(lengthIndex, buffer.writerIndex() - lengthIndex - 4);
                }
            }
        }
    }

    @Override
    public void writeDataValue(String fieldName, DataValue value)
    {
        DataValue dataValue = value != null ? value : DataValue.NULL;
        try (LimitsGuard.Level level = guard.enter("DataValue")) {
            int mask = 0;
            if (dataValue.hasValue()) mask |= 0x01;
            if (dataValue.hasStatusCode()) mask |= 0x02;
            if (dataValue.hasSourceTimestamp()) mask |= 0x04;
            if (dataValue.hasServerTimestamp()) mask |= 0x08;
            if (dataValue.sourcePicoseconds() != 0) mask |= 0x10;
            if (dataValue.serverPicoseconds() != 0) mask |= 0x20;
            buffer.writeByte(mask);

            if ((mask & 0x01) != 0) writeVariant(null, dataValue.value());
            if ((mask & 0x02) != 0) writeStatusCode(null, dataValue.statusCode());
            if ((mask & 0x04) != 0) writeDateTime(null, dataValue.sourceTimestamp());
            if ((mask & 0x10) != 0) buffer.writeShortLE(dataValue.sourcePicoseconds());
            if ((mask & 0x08) != 0) writeDateTime(null, dataValue.serverTimestamp());
            if ((mask & 0x20) != 0) buffer.writeShortLE(dataValue.serverPicoseconds());
        }
    }

    @Override
    public void writeVariant(String fieldName, Variant value)
    {
        Variant variant = value != null ? value : Variant.NULL;
        try (LimitsGuard.Level level = guard.enter("Variant")) {
            BuiltInType type = variant.type();
            if (variant.isNull()) {
                buffer.writeByte(0);
            }
            else if (variant.isMatrix()) {
                Matrix matrix = (Matrix) variant.value();
                buffer.writeByte(type.id() | BinaryNodeIds.ARRAY_FLAG | BinaryNodeIds.DIMENSIONS_FLAG);
                writeElements(type, matrix.elements());
                int[] dimensions = matrix.dimensions();
                guard.checkArrayLength(dimensions.length);
                buffer.writeIntLE(dimensions.length);
                for (int dimension : dimensions) {
                    buffer.writeIntLE(dimension);
                }
            }
            else if (variant.isArray()) {
                buffer.writeByte(type.id() | BinaryNodeIds.ARRAY_FLAG);
                writeElements(type, (Object[]) variant.value());
            }
            else {
                buffer.writeByte(type.id());
                writeScalar(null, type, variant.value());
            }
        }
    }

    @Override
    public void writeDiagnosticInfo(String fieldName, DiagnosticInfo value)
    {
        DiagnosticInfo info = value != null ? value : DiagnosticInfo.NULL;
        try (LimitsGuard.Level level = guard.enter("DiagnosticInfo")) {
            int mask = 0;
            if (info.symbolicId() != -1) mask |= 0x01;
            if (info.namespaceUri() != -1) mask |= 0x02;
            if (info.localizedText() != -1) mask |= 0x04;
            if (info.locale() != -1) mask |= 0x08;
            if (info.additionalInfo() != null) mask |= 0x10;
            if (info.innerStatusCode().value() != StatusCodes.Good) mask |= 0x20;
            if (info.innerDiagnosticInfo() != null) mask |= 0x40;
            buffer.writeByte(mask);

            if ((mask & 0x01) != 0) buffer.writeIntLE(info.symbolicId());
            if ((mask & 0x02) != 0) buffer.writeIntLE(info.namespaceUri());
            if ((mask & 0x08) != 0) buffer.writeIntLE(info.locale());
            if ((mask & 0x04) != 0) buffer.writeIntLE(info.localizedText());
            if ((mask & 0x10) != 0) writeString(null, info.additionalInfo());
            if ((mask & 0x20) != 0) writeStatusCode(null, info.innerStatusCode());
            if ((mask & 0x40) != 0) writeDiagnosticInfo(null, info.innerDiagnosticInfo());
        }
    }

    @Override
    public void writeEnumeration(String fieldName, UaEnumeration value)
    {
        if (value == null) {
            throw CodecException.encodingError("Enumeration field " + fieldName + " is null");
        }
        buffer.writeIntLE(value.value());
    }

    @Override
    public void writeEncodeable(String fieldName, Encodeable value, EncodeableType<?> type)
    {
        if (value == null || !type.isInstance(value)) {
            throw CodecException.encodingError("Field " + fieldName + " requires a " + type.name()
                    + " but holds " + value);
        }
        try (LimitsGuard.Level level = guard.enter(type.name());
             NamespaceScope scope = namespaces.push(type.xmlNamespace())) {
            value.encode(this);
        }
    }

    @Override
    public void writeArray(String fieldName, BuiltInType type, Object[] values)
    {
        if (values == null) {
            buffer.writeIntLE(-1);
            return;
        }
        writeElements(type, values);
    }

    private void writeElements(BuiltInType type, Object[] values)
    {
        guard.checkArrayLength(values.length);
        buffer.writeIntLE(values.length);
        for (Object element : values) {
            if (element == null && !type.isNullable()) {
                throw CodecException.encodingError("Null element in array of " + type);
            }
            writeScalar(null, type, element);
        }
    }

    @Override
    public void writeEncodeableArray(String fieldName, List<? extends Encodeable> values, EncodeableType<?> type)
    {
        if (values == null) {
            buffer.writeIntLE(-1);
            return;
        }
        guard.checkArrayLength(values.size());
        buffer.writeIntLE(values.size());
        for (Encodeable value : values) {
            writeEncodeable(fieldName, value, type);
        }
    }

    @Override
    public void writeMatrix(String fieldName, Matrix value)
    {
        if (value == null) {
            buffer.writeIntLE(-1);
            return;
        }
        int[] dimensions = value.dimensions();
        buffer.writeIntLE(dimensions.length);
        for (int dimension : dimensions) {
            buffer.writeIntLE(dimension);
        }
        guard.checkArrayLength(value.elementCount());
        for (Object element : value.elements()) {
            writeScalar(null, value.elementType(), element);
        }
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

    private static void checkRange(String type, long value, long min, long max)
    {
        if (value < min || value > max) {
            throw CodecException.encodingError(type + " value out of range: " + value);
        }
    }
}
