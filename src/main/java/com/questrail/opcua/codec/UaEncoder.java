package com.questrail.opcua.codec;

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
import com.questrail.opcua.types.UaEnumeration;
import com.questrail.opcua.types.Variant;
import com.questrail.opcua.types.XmlElement;

import java.util.List;
import java.util.UUID;

/**
 * UaEncoder
 * -----------------------------------------------------------------------------
 * Format-neutral sink for OPC UA values.
 *
 * <p>{@link Encodeable} implementations write their fields through these
 * calls in declaration order; the binary, XML and JSON encoders decide what
 * the field name means on the wire. The binary format ignores it, XML turns
 * it into an element name, JSON into a member name. A {@code null} field
 * name means "array element" in JSON.</p>
 *
 * <p>Encoders are single-use and not thread safe. Failures are reported as
 * {@link CodecException}; misuse of the namespace stack as
 * {@link InvariantViolationException}.</p>
 */
public interface UaEncoder
{
    EncodingContext context();

    void writeBoolean(String fieldName, boolean value);

    void writeSByte(String fieldName, byte value);

    /** Unsigned byte, 0..255. */
    void writeByte(String fieldName, short value);

    void writeInt16(String fieldName, short value);

    /** Unsigned 16-bit integer, 0..65535. */
    void writeUInt16(String fieldName, int value);

    void writeInt32(String fieldName, int value);

    /** Unsigned 32-bit integer, 0..2^32-1. */
    void writeUInt32(String fieldName, long value);

    void writeInt64(String fieldName, long value);

    /** Unsigned 64-bit integer held in the raw bits of a long. */
    void writeUInt64(String fieldName, long value);

    void writeFloat(String fieldName, float value);

    void writeDouble(String fieldName, double value);

    void writeString(String fieldName, String value);

    void writeDateTime(String fieldName, DateTime value);

    void writeGuid(String fieldName, UUID value);

    void writeByteString(String fieldName, ByteString value);

    void writeXmlElement(String fieldName, XmlElement value);

    void writeNodeId(String fieldName, NodeId value);

    void writeExpandedNodeId(String fieldName, ExpandedNodeId value);

    void writeStatusCode(String fieldName, StatusCode value);

    void writeQualifiedName(String fieldName, QualifiedName value);

    void writeLocalizedText(String fieldName, LocalizedText value);

    void writeExtensionObject(String fieldName, ExtensionObject value);

    void writeDataValue(String fieldName, DataValue value);

    void writeVariant(String fieldName, Variant value);

    void writeDiagnosticInfo(String fieldName, DiagnosticInfo value);

    void writeEnumeration(String fieldName, UaEnumeration value);

    /**
     * Nested structure of the given type, written in the type's namespace.
     */
    void writeEncodeable(String fieldName, Encodeable value, EncodeableType<?> type);

    /**
     * One-dimensional array of a built-in type; {@code null} is the null array.
     */
    void writeArray(String fieldName, BuiltInType type, Object[] values);

    void writeEncodeableArray(String fieldName, List<? extends Encodeable> values, EncodeableType<?> type);

    /**
     * Multi-dimensional array field: dimensions first, then the flattened elements.
     */
    void writeMatrix(String fieldName, Matrix value);

    NamespaceScope pushNamespace(String namespaceUri);

    void popNamespace();

    /**
     * Writes one value of a built-in type, boxed the way
     * {@link BuiltInType#javaType()} describes.
     */
    default void writeScalar(String fieldName, BuiltInType type, Object value)
    {
        switch (type) {
            case BOOLEAN -> writeBoolean(fieldName, (Boolean) value);
            case SBYTE -> writeSByte(fieldName, (Byte) value);
            case BYTE -> writeByte(fieldName, (Short) value);
            case INT16 -> writeInt16(fieldName, (Short) value);
            case UINT16 -> writeUInt16(fieldName, (Integer) value);
            case INT32, ENUMERATION -> writeInt32(fieldName, (Integer) value);
            case UINT32 -> writeUInt32(fieldName, (Long) value);
            case INT64 -> writeInt64(fieldName, (Long) value);
            case UINT64 -> writeUInt64(fieldName, (Long) value);
            case FLOAT -> writeFloat(fieldName, (Float) value);
            case DOUBLE -> writeDouble(fieldName, (Double) value);
            case STRING -> writeString(fieldName, (String) value);
            case DATE_TIME -> writeDateTime(fieldName, (DateTime) value);
            case GUID -> writeGuid(fieldName, (UUID) value);
            case BYTE_STRING -> writeByteString(fieldName, (ByteString) value);
            case XML_ELEMENT -> writeXmlElement(fieldName, (XmlElement) value);
            case NODE_ID -> writeNodeId(fieldName, (NodeId) value);
            case EXPANDED_NODE_ID -> writeExpandedNodeId(fieldName, (ExpandedNodeId) value);
            case STATUS_CODE -> writeStatusCode(fieldName, (StatusCode) value);
            case QUALIFIED_NAME -> writeQualifiedName(fieldName, (QualifiedName) value);
            case LOCALIZED_TEXT -> writeLocalizedText(fieldName, (LocalizedText) value);
            case EXTENSION_OBJECT -> writeExtensionObject(fieldName, (ExtensionObject) value);
            case DATA_VALUE -> writeDataValue(fieldName, (DataValue) value);
            case VARIANT -> writeVariant(fieldName, (Variant) value);
            case DIAGNOSTIC_INFO -> writeDiagnosticInfo(fieldName, (DiagnosticInfo) value);
            case NULL -> throw CodecException.encodingError("Cannot write a value of type Null");
        }
    }
}
