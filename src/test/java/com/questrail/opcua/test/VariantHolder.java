package com.questrail.opcua.test;

import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.UaDecoder;
import com.questrail.opcua.codec.UaEncoder;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.Variant;

/**
 * Structure with a single Variant member, used to carry one value of any
 * built-in type through a whole message.
 */
public record VariantHolder(Variant value) implements Encodeable {

    public static final EncodeableType<VariantHolder> TYPE =
            EncodeableType.builder("VariantHolder", VariantHolder.class)
                    .withDataTypeId(ExpandedNodeId.numeric(SampleStructure.NAMESPACE, 2000))
                    .withBinaryEncodingId(ExpandedNodeId.numeric(SampleStructure.NAMESPACE, 2001))
                    .withXmlEncodingId(ExpandedNodeId.numeric(SampleStructure.NAMESPACE, 2002))
                    .withJsonEncodingId(ExpandedNodeId.numeric(SampleStructure.NAMESPACE, 2003))
                    .withDecoder(decoder -> new VariantHolder(decoder.readVariant("Value")))
                    .build();

    @Override
    public EncodeableType<?> encodeableType()
    {
        return TYPE;
    }

    @Override
    public void encode(UaEncoder encoder)
    {
        encoder.writeVariant("Value", value);
    }
}
