package com.questrail.opcua.catalog;

import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.UaDecoder;
import com.questrail.opcua.codec.UaEncoder;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.LocalizedText;

/**
 * OPC UA EUInformation (i=887): the engineering unit of an analog item.
 *
 * <p>{@code unitId} is the UNECE code packed into an Int32, {@code -1} when
 * the unit has no code.</p>
 */
public record EUInformation(
        String namespaceUri,
        int unitId,
        LocalizedText displayName,
        LocalizedText description
) implements Encodeable {
    public static final String UNECE_NAMESPACE = "http://www.opcfoundation.org/UA/units/un/cefact";

    public static final EncodeableType<EUInformation> TYPE =
            EncodeableType.builder("EUInformation", EUInformation.class)
                    .withDataTypeId(ExpandedNodeId.numeric(null, 887))
                    .withXmlEncodingId(ExpandedNodeId.numeric(null, 888))
                    .withBinaryEncodingId(ExpandedNodeId.numeric(null, 889))
                    .withJsonEncodingId(ExpandedNodeId.numeric(null, 15376))
                    .withDecoder(EUInformation::decode)
                    .build();

    /**
     * Unit from the UNECE recommendation 20 table, e.g. {@code ("CEL", "°C")}.
     */
    public static EUInformation unece(String commonCode, String symbol, String description)
    {
        int unitId = 0;
        for (char c : commonCode.toCharArray()) {
            unitId = (unitId << 8) | c;
        }
        return new EUInformation(UNECE_NAMESPACE, unitId,
                LocalizedText.english(symbol), LocalizedText.english(description));
    }

    @Override
    public EncodeableType<?> encodeableType()
    {
        return TYPE;
    }

    @Override
    public void encode(UaEncoder encoder)
    {
        encoder.writeString("NamespaceUri", namespaceUri);
        encoder.writeInt32("UnitId", unitId);
        encoder.writeLocalizedText("DisplayName", displayName);
        encoder.writeLocalizedText("Description", description);
    }

    private static EUInformation decode(UaDecoder decoder)
    {
        return new EUInformation(
                decoder.readString("NamespaceUri"),
                decoder.readInt32("UnitId"),
                decoder.readLocalizedText("DisplayName"),
                decoder.readLocalizedText("Description"));
    }
}
