package com.questrail.opcua.types;

import java.util.Optional;
import java.util.UUID;

/**
 * BuiltInType
 * -----------------------------------------------------------------------------
 * Closed set of value kinds recognised by the OPC UA type system.
 *
 * <p>Each constant carries its numeric wire id (OPC UA Part 6, used by the
 * binary Variant encoding byte and the JSON {@code Type} discriminator) and the
 * Java class that carries its values in this library.</p>
 *
 * <p>Unsigned kinds are carried by the next wider signed Java type
 * ({@code Byte} by {@link Short}, {@code UInt16} by {@link Integer},
 * {@code UInt32} by {@link Long}). {@code UInt64} is carried by {@link Long}
 * holding the raw 64 bits.</p>
 */
public enum BuiltInType
{
    NULL(0, Void.class),
    BOOLEAN(1, Boolean.class),
    SBYTE(2, Byte.class),
    BYTE(3, Short.class),
    INT16(4, Short.class),
    UINT16(5, Integer.class),
    INT32(6, Integer.class),
    UINT32(7, Long.class),
    INT64(8, Long.class),
    UINT64(9, Long.class),
    FLOAT(10, Float.class),
    DOUBLE(11, Double.class),
    STRING(12, String.class),
    DATE_TIME(13, DateTime.class),
    GUID(14, UUID.class),
    BYTE_STRING(15, ByteString.class),
    XML_ELEMENT(16, XmlElement.class),
    NODE_ID(17, NodeId.class),
    EXPANDED_NODE_ID(18, ExpandedNodeId.class),
    STATUS_CODE(19, StatusCode.class),
    QUALIFIED_NAME(20, QualifiedName.class),
    LOCALIZED_TEXT(21, LocalizedText.class),
    EXTENSION_OBJECT(22, ExtensionObject.class),
    DATA_VALUE(23, DataValue.class),
    VARIANT(24, Variant.class),
    DIAGNOSTIC_INFO(25, DiagnosticInfo.class),
    ENUMERATION(29, Integer.class);

    private static final BuiltInType[] BY_ID = new BuiltInType[30];

    static {
        for (BuiltInType type : values()) {
            BY_ID[type.id] = type;
        }
    }

    private final int id;
    private final Class<?> javaType;

    BuiltInType(int id, Class<?> javaType)
    {
        this.id = id;
        this.javaType = javaType;
    }

    /**
     * Numeric id used on the wire.
     */
    public int id()
    {
        return id;
    }

    /**
     * Java class carrying values of this kind.
     */
    public Class<?> javaType()
    {
        return javaType;
    }

    /**
     * Type name used by the XML encoding ({@code Int32}, {@code ListOfInt32}...).
     */
    public String xmlName()
    {
        return switch (this) {
            case NULL -> "Null";
            case BOOLEAN -> "Boolean";
            case SBYTE -> "SByte";
            case BYTE -> "Byte";
            case INT16 -> "Int16";
            case UINT16 -> "UInt16";
            case INT32, ENUMERATION -> "Int32";
            case UINT32 -> "UInt32";
            case INT64 -> "Int64";
            case UINT64 -> "UInt64";
            case FLOAT -> "Float";
            case DOUBLE -> "Double";
            case STRING -> "String";
            case DATE_TIME -> "DateTime";
            case GUID -> "Guid";
            case BYTE_STRING -> "ByteString";
            case XML_ELEMENT -> "XmlElement";
            case NODE_ID -> "NodeId";
            case EXPANDED_NODE_ID -> "ExpandedNodeId";
            case STATUS_CODE -> "StatusCode";
            case QUALIFIED_NAME -> "QualifiedName";
            case LOCALIZED_TEXT -> "LocalizedText";
            case EXTENSION_OBJECT -> "ExtensionObject";
            case DATA_VALUE -> "DataValue";
            case VARIANT -> "Variant";
            case DIAGNOSTIC_INFO -> "DiagnosticInfo";
        };
    }

    /**
     * True for kinds whose values may be {@code null} inside arrays.
     */
    public boolean isNullable()
    {
        return switch (this) {
            case STRING, BYTE_STRING, XML_ELEMENT, NODE_ID, EXPANDED_NODE_ID,
                 QUALIFIED_NAME, LOCALIZED_TEXT, EXTENSION_OBJECT, DATA_VALUE,
                 DIAGNOSTIC_INFO -> true;
            default -> false;
        };
    }

    public static Optional<BuiltInType> fromId(int id)
    {
        if (id < 0 || id >= BY_ID.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ID[id]);
    }

    public static Optional<BuiltInType> fromXmlName(String name)
    {
        for (BuiltInType type : values()) {
            if (type != ENUMERATION && type.xmlName().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
