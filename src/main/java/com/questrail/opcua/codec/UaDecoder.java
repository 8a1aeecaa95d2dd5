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
 * UaDecoder
 * -----------------------------------------------------------------------------
 * Format-neutral source of OPC UA values; the mirror of {@link UaEncoder}.
 *
 * <p>Decode functions read fields in the same order the matching
 * {@link Encodeable#encode(UaEncoder)} wrote them. Every read either returns
 * a fully valid value or throws {@link CodecException}; nothing partially
 * decoded escapes.</p>
 */
public interface UaDecoder
{
    EncodingContext context();

    boolean readBoolean(String fieldName);

    byte readSByte(String fieldName);

    short readByte(String fieldName);

    short readInt16(String fieldName);

    int readUInt16(String fieldName);

    int readInt32(String fieldName);

    long readUInt32(String fieldName);

    long readInt64(String fieldName);

    long readUInt64(String fieldName);

    float readFloat(String fieldName);

    double readDouble(String fieldName);

    String readString(String fieldName);

    DateTime readDateTime(String fieldName);

    UUID readGuid(String fieldName);

    ByteString readByteString(String fieldName);

    XmlElement readXmlElement(String fieldName);

    NodeId readNodeId(String fieldName);

    ExpandedNodeId readExpandedNodeId(String fieldName);

    StatusCode readStatusCode(String fieldName);

    QualifiedName readQualifiedName(String fieldName);

    LocalizedText readLocalizedText(String fieldName);

    ExtensionObject readExtensionObject(String fieldName);

    DataValue readDataValue(String fieldName);

    Variant readVariant(String fieldName);

    DiagnosticInfo readDiagnosticInfo(String fieldName);

    /**
     * @throws CodecException {@code BadDecodingError} if the wire value names
     *         no constant of {@code enumType}
     */
    <E extends Enum<E> & UaEnumeration> E readEnumeration(String fieldName, Class<E> enumType);

    <T extends Encodeable> T readEncodeable(String fieldName, EncodeableType<T> type);

    /**
     * @return the elements, or {@code null} for the null array
     */
    Object[] readArray(String fieldName, BuiltInType type);

    <T extends Encodeable> List<T> readEncodeableArray(String fieldName, EncodeableType<T> type);

    /**
     * @return the matrix, or {@code null} when the field holds no dimensions
     */
    Matrix readMatrix(String fieldName, BuiltInType type);

    NamespaceScope pushNamespace(String namespaceUri);

    void popNamespace();

    /**
     * Reads one value of a built-in type, boxed the way
     * {@link BuiltInType#javaType()} describes.
     */
    default Object readScalar(String fieldName, BuiltInType type)
    {
        return switch (type) {
            case BOOLEAN -> readBoolean(fieldName);
            case SBYTE -> readSByte(fieldName);
            case BYTE -> readByte(fieldName);
            case INT16 -> readInt16(fieldName);
            case UINT16 -> readUInt16(fieldName);
            case INT32, ENUMERATION -> readInt32(fieldName);
            case UINT32 -> readUInt32(fieldName);
            case INT64 -> readInt64(fieldName);
            case UINT64 -> readUInt64(fieldName);
            case FLOAT -> readFloat(fieldName);
            case DOUBLE -> readDouble(fieldName);
            case STRING -> readString(fieldName);
            case DATE_TIME -> readDateTime(fieldName);
            case GUID -> readGuid(fieldName);
            case BYTE_STRING -> readByteString(fieldName);
            case XML_ELEMENT -> readXmlElement(fieldName);
            case NODE_ID -> readNodeId(fieldName);
            case EXPANDED_NODE_ID -> readExpandedNodeId(fieldName);
            case STATUS_CODE -> readStatusCode(fieldName);
            case QUALIFIED_NAME -> readQualifiedName(fieldName);
            case LOCALIZED_TEXT -> readLocalizedText(fieldName);
            case EXTENSION_OBJECT -> readExtensionObject(fieldName);
            case DATA_VALUE -> readDataValue(fieldName);
            case VARIANT -> readVariant(fieldName);
            case DIAGNOSTIC_INFO -> readDiagnosticInfo(fieldName);
            case NULL -> throw CodecException.decodingError("Cannot read a value of type Null");
        };
    }

    /**
     * Looks up the constant of {@code enumType} whose wire value is {@code value}.
     */
    static <E extends Enum<E> & UaEnumeration> E enumerationConstant(Class<E> enumType, int value)
    {
        for (E constant : enumType.getEnumConstants()) {
            if (constant.value() == value) {
                return constant;
            }
        }
        throw CodecException.decodingError(
                "Value " + value + " is not defined by enumeration " + enumType.getSimpleName());
    }
}
