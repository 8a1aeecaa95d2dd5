package com.questrail.opcua.catalog;

import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.UaDecoder;
import com.questrail.opcua.codec.UaEncoder;
import com.questrail.opcua.types.ExpandedNodeId;

/**
 * OPC UA Range (i=884): the span of an analog item's EURange or
 * InstrumentRange.
 */
public record Range(double low, double high) implements Encodeable
{
    public static final EncodeableType<Range> TYPE = EncodeableType.builder("Range", Range.class)
            .withDataTypeId(ExpandedNodeId.numeric(null, 884))
            .withXmlEncodingId(ExpandedNodeId.numeric(null, 885))
            .withBinaryEncodingId(ExpandedNodeId.numeric(null, 886))
            .withJsonEncodingId(ExpandedNodeId.numeric(null, 15375))
            .withDecoder(Range::decode)
            .build();

    @Override
    public EncodeableType<?> encodeableType()
    {
        return TYPE;
    }

    @Override
    public void encode(UaEncoder encoder)
    {
        encoder.writeDouble("Low", low);
        encoder.writeDouble("High", high);
    }

    private static Range decode(UaDecoder decoder)
    {
        final double low = decoder.readDouble("Low");
        final double high = decoder.readDouble("High");
        return new Range(low, high);
    }
}
