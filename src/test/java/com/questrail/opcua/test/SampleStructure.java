package com.questrail.opcua.test;

import com.questrail.opcua.catalog.Range;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.UaDecoder;
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
import com.questrail.opcua.types.Variant;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * SampleStructure
 * -----------------------------------------------------------------------------
 * Application structure in {@link #NAMESPACE} with one field of every
 * built-in type (except XmlElement) plus an enumeration, a nested structure,
 * arrays and a matrix.
 */
public record SampleStructure(
        boolean flag,
        byte sbyte,
        short byteValue,
        short int16,
        int uint16,
        int int32,
        long uint32,
        long int64,
        long uint64,
        float floatValue,
        double doubleValue,
        String text,
        DateTime timestamp,
        UUID guid,
        ByteString blob,
        NodeId nodeId,
        ExpandedNodeId expandedNodeId,
        StatusCode status,
        QualifiedName browseName,
        LocalizedText displayName,
        ExtensionObject payload,
        DataValue reading,
        Variant variant,
        DiagnosticInfo diagnostics,
        PumpMode mode,
        Range limits,
        List<Integer> counters,
        List<Range> ranges,
        Matrix grid
) implements Encodeable {
    public static final String NAMESPACE = "urn:questrail:test";

    public static final EncodeableType<SampleStructure> TYPE =
            EncodeableType.builder("SampleStructure", SampleStructure.class)
                    .withDataTypeId(ExpandedNodeId.numeric(NAMESPACE, 1000))
                    .withBinaryEncodingId(ExpandedNodeId.numeric(NAMESPACE, 1001))
                    .withXmlEncodingId(ExpandedNodeId.numeric(NAMESPACE, 1002))
                    .withJsonEncodingId(ExpandedNodeId.numeric(NAMESPACE, 1003))
                    .withDecoder(SampleStructure::decode)
                    .build();

    /**
     * A value with every field away from its default.
     */
    public static SampleStructure populated()
    {
        return new SampleStructure(
                true,
                (byte) -7,
                (short) 200,
                (short) -1234,
                65000,
                -123456,
                4_000_000_000L,
                -9_000_000_000L,
                0xFFFF_FFFF_FFFF_FFF0L,
                1.5f,
                -2.25,
                "pump-1",
                DateTime.fromInstant(java.time.Instant.parse("2024-01-01T12:30:45.1234567Z")),
                UUID.fromString("72962b91-fa75-4ae6-8d28-b404dc7daf63"),
                ByteString.of(new byte[] { 1, 2, 3, (byte) 0xFF }),
                NodeId.string(1, "Pump.Speed"),
                new ExpandedNodeId(NodeId.numeric(0, 42), "urn:questrail:other", 0),
                StatusCode.of(0x8034_0000L),
                new QualifiedName(1, "Pump"),
                new LocalizedText("en", "Pump 1"),
                ExtensionObject.of(new Range(0.0, 100.0)),
                DataValue.of(Variant.ofDouble(3.5), StatusCode.of(0x4000_0000L),
                        DateTime.fromInstant(java.time.Instant.parse("2024-01-01T00:00:00Z")), null),
                Variant.ofArray(BuiltInType.INT32, new Integer[] { 1, 2, 3 }),
                new DiagnosticInfo(1, -1, 2, -1, "trace", StatusCode.GOOD,
                        new DiagnosticInfo(-1, -1, -1, 3, null, StatusCode.of(0x8007_0000L), null)),
                PumpMode.FAULTED,
                new Range(-10.0, 10.0),
                List.of(5, 6, 7),
                List.of(new Range(1.0, 2.0), new Range(3.0, 4.0)),
                new Matrix(BuiltInType.INT32, new Integer[] { 1, 2, 3, 4, 5, 6 }, new int[] { 2, 3 }));
    }

    @Override
    public EncodeableType<?> encodeableType()
    {
        return TYPE;
    }

    @Override
    public void encode(UaEncoder encoder)
    {
        encoder.writeBoolean("Flag", flag);
        encoder.writeSByte("SByte", sbyte);
        encoder.writeByte("Byte", byteValue);
        encoder.writeInt16("Int16", int16);
        encoder.writeUInt16("UInt16", uint16);
        encoder.writeInt32("Int32", int32);
        encoder.writeUInt32("UInt32", uint32);
        encoder.writeInt64("Int64", int64);
        encoder.writeUInt64("UInt64", uint64);
        encoder.writeFloat("Float", floatValue);
        encoder.writeDouble("Double", doubleValue);
        encoder.writeString("Text", text);
        encoder.writeDateTime("Timestamp", timestamp);
        encoder.writeGuid("Guid", guid);
        encoder.writeByteString("Blob", blob);
        encoder.writeNodeId("NodeId", nodeId);
        encoder.writeExpandedNodeId("ExpandedNodeId", expandedNodeId);
        encoder.writeStatusCode("Status", status);
        encoder.writeQualifiedName("BrowseName", browseName);
        encoder.writeLocalizedText("DisplayName", displayName);
        encoder.writeExtensionObject("Payload", payload);
        encoder.writeDataValue("Reading", reading);
        encoder.writeVariant("Variant", variant);
        encoder.writeDiagnosticInfo("Diagnostics", diagnostics);
        encoder.writeEnumeration("Mode", mode);
        encoder.writeEncodeable("Limits", limits, Range.TYPE);
        encoder.writeArray("Counters", BuiltInType.INT32, counters == null ? null : counters.toArray());
        encoder.writeEncodeableArray("Ranges", ranges, Range.TYPE);
        encoder.writeMatrix("Grid", grid);
    }

    private static SampleStructure decode(UaDecoder decoder)
    {
        return new SampleStructure(
                decoder.readBoolean("Flag"),
                decoder.readSByte("SByte"),
                decoder.readByte("Byte"),
                decoder.readInt16("Int16"),
                decoder.readUInt16("UInt16"),
                decoder.readInt32("Int32"),
                decoder.readUInt32("UInt32"),
                decoder.readInt64("Int64"),
                decoder.readUInt64("UInt64"),
                decoder.readFloat("Float"),
                decoder.readDouble("Double"),
                decoder.readString("Text"),
                decoder.readDateTime("Timestamp"),
                decoder.readGuid("Guid"),
                decoder.readByteString("Blob"),
                decoder.readNodeId("NodeId"),
                decoder.readExpandedNodeId("ExpandedNodeId"),
                decoder.readStatusCode("Status"),
                decoder.readQualifiedName("BrowseName"),
                decoder.readLocalizedText("DisplayName"),
                decoder.readExtensionObject("Payload"),
                decoder.readDataValue("Reading"),
                decoder.readVariant("Variant"),
                decoder.readDiagnosticInfo("Diagnostics"),
                decoder.readEnumeration("Mode", PumpMode.class),
                decoder.readEncodeable("Limits", Range.TYPE),
                toIntegers(decoder.readArray("Counters", BuiltInType.INT32)),
                decoder.readEncodeableArray("Ranges", Range.TYPE),
                decoder.readMatrix("Grid", BuiltInType.INT32));
    }

    private static List<Integer> toIntegers(Object[] values)
    {
        if (values == null) {
            return null;
        }
        return Arrays.stream(values).map(Integer.class::cast).collect(Collectors.toList());
    }
}
