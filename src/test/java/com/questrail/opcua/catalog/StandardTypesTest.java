package com.questrail.opcua.catalog;

import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.EncodingFormat;
import com.questrail.opcua.codec.UaCodec;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.LocalizedText;
import com.questrail.opcua.types.NodeId;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StandardTypesTest
 * -----------------------------------------------------------------------------
 * The built-in catalog decodes with no application types registered.
 */
final class StandardTypesTest
{
    private static EncodingContext context()
    {
        return EncodingContext.builder().withFactory(StandardTypes.factory()).build();
    }

    @Test
    void catalogTypesRoundTripInEveryFormat()
    {
        EUInformation celsius = EUInformation.unece("CEL", "°C", "degree Celsius");
        Argument setpoint = new Argument("Setpoint", NodeId.numeric(0, 11), Argument.ONE_DIMENSION,
                new Long[]{4L}, LocalizedText.english("Target values"));
        Argument scalar = Argument.scalar("Enabled", NodeId.numeric(0, 1), LocalizedText.NULL);

        for (EncodingFormat format : EncodingFormat.values()) {
            assertEquals(new Range(-5, 5), roundTrip(new Range(-5, 5), format), format.name());
            assertEquals(celsius, roundTrip(celsius, format), format.name());
            assertEquals(setpoint, roundTrip(setpoint, format), format.name());
            assertEquals(scalar, roundTrip(scalar, format), format.name());
        }
    }

    @Test
    void rangeBinaryLayout()
    {
        byte[] bytes = UaCodec.encode(new Range(1.0, 2.0), context(), EncodingFormat.BINARY);

        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(20, bytes.length);
        assertEquals(0x01, buffer.get());
        assertEquals(0x00, buffer.get());
        assertEquals(886, buffer.getShort());
        assertEquals(1.0, buffer.getDouble());
        assertEquals(2.0, buffer.getDouble());
    }

    @Test
    void uneceUnitIdPacksTheCommonCode()
    {
        EUInformation celsius = EUInformation.unece("CEL", "°C", "degree Celsius");

        assertEquals(0x43454C, celsius.unitId());
        assertEquals(EUInformation.UNECE_NAMESPACE, celsius.namespaceUri());
        assertEquals("°C", celsius.displayName().text());
    }

    @Test
    void argumentCopiesItsDimensions()
    {
        Long[] dimensions = {3L};
        Argument argument = new Argument("Values", NodeId.numeric(0, 6), 1, dimensions, LocalizedText.NULL);

        dimensions[0] = 9L;
        argument.arrayDimensions()[0] = 7L;

        assertArrayEquals(new Long[]{3L}, argument.arrayDimensions());
    }

    @Test
    void factoryAnswersToEveryRangeId()
    {
        for (long id : new long[]{884, 885, 886, 15375}) {
            assertTrue(StandardTypes.factory()
                    .resolve(ExpandedNodeId.of(NodeId.numeric(0, id)), context().namespaceTable())
                    .isPresent());
        }
        assertEquals(3, StandardTypes.factory().types().size());
    }

    private static Encodeable roundTrip(Encodeable value, EncodingFormat format)
    {
        byte[] bytes = UaCodec.encode(value, context(), format);
        return UaCodec.decode(bytes, context(), format);
    }
}
