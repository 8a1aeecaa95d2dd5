package com.questrail.opcua.catalog;

import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.UaDecoder;
import com.questrail.opcua.codec.UaEncoder;
import com.questrail.opcua.types.BuiltInType;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.LocalizedText;
import com.questrail.opcua.types.NodeId;

import java.util.Arrays;
import java.util.Objects;

/**
 * OPC UA Argument (i=296): one input or output argument of a method.
 *
 * <p>{@code arrayDimensions} holds UInt32 lengths as {@link Long}s and may be
 * {@code null}.</p>
 */
public record Argument(
        String name,
        NodeId dataType,
        int valueRank,
        Long[] arrayDimensions,
        LocalizedText description
) implements Encodeable {
    public static final int SCALAR = -1;
    public static final int ONE_DIMENSION = 1;

    public static final EncodeableType<Argument> TYPE = EncodeableType.builder("Argument", Argument.class)
            .withDataTypeId(ExpandedNodeId.numeric(null, 296))
            .withXmlEncodingId(ExpandedNodeId.numeric(null, 297))
            .withBinaryEncodingId(ExpandedNodeId.numeric(null, 298))
            .withJsonEncodingId(ExpandedNodeId.numeric(null, 15081))
            .withDecoder(Argument::decode)
            .build();

    public Argument {
        arrayDimensions = arrayDimensions == null ? null : arrayDimensions.clone();
    }

    public static Argument scalar(String name, NodeId dataType, LocalizedText description)
    {
        return new Argument(name, dataType, SCALAR, null, description);
    }

    @Override
    public Long[] arrayDimensions()
    {
        return arrayDimensions == null ? null : arrayDimensions.clone();
    }

    @Override
    public EncodeableType<?> encodeableType()
    {
        return TYPE;
    }

    @Override
    public void encode(UaEncoder encoder)
    {
        encoder.writeString("Name", name);
        encoder.writeNodeId("DataType", dataType);
        encoder.writeInt32("ValueRank", valueRank);
        encoder.writeArray("ArrayDimensions", BuiltInType.UINT32, arrayDimensions);
        encoder.writeLocalizedText("Description", description);
    }

    private static Argument decode(UaDecoder decoder)
    {
        final String name = decoder.readString("Name");
        final NodeId dataType = decoder.readNodeId("DataType");
        final int valueRank = decoder.readInt32("ValueRank");
        final Object[] dimensions = decoder.readArray("ArrayDimensions", BuiltInType.UINT32);
        final LocalizedText description = decoder.readLocalizedText("Description");
        return new Argument(name, dataType, valueRank,
                dimensions == null ? null : Arrays.copyOf(dimensions, dimensions.length, Long[].class),
                description);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Argument)) return false;
        Argument other = (Argument) o;
        return valueRank == other.valueRank
                && Objects.equals(name, other.name)
                && Objects.equals(dataType, other.dataType)
                && Arrays.equals(arrayDimensions, other.arrayDimensions)
                && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, dataType, valueRank, Arrays.hashCode(arrayDimensions), description);
    }

    @Override
    public String toString()
    {
        return "Argument[name=" + name + ", dataType=" + dataType + ", valueRank=" + valueRank
                + ", arrayDimensions=" + Arrays.toString(arrayDimensions) + ", description=" + description + "]";
    }
}
