package com.questrail.opcua.codec;

import com.questrail.opcua.catalog.Range;
import com.questrail.opcua.codec.json.JsonEncodingType;
import com.questrail.opcua.test.TestContexts;
import com.questrail.opcua.test.VariantHolder;
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
import com.questrail.opcua.types.XmlElement;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BuiltInTypeRoundTripTest
 * -----------------------------------------------------------------------------
 * Every built-in type, carried in a Variant as a scalar, a one-dimensional
 * array and a 2x2 matrix, survives every decodable wire format.
 *
 * <p>A scalar Variant cannot hold a Variant, and the null type only exists
 * as a scalar. Enumerations come back as Int32.</p>
 */
final class BuiltInTypeRoundTripTest
{
    enum Shape
    {
        SCALAR,
        ARRAY,
        MATRIX
    }

    enum Wire
    {
        BINARY,
        XML,
        JSON_REVERSIBLE,
        JSON_COMPACT,
        JSON_VERBOSE;

        byte[] encode(VariantHolder value)
        {
            return switch (this) {
                case BINARY -> UaCodec.encode(value, TestContexts.context(), EncodingFormat.BINARY);
                case XML -> UaCodec.encode(value, TestContexts.context(), EncodingFormat.XML);
                case JSON_REVERSIBLE -> UaCodec.encode(value, TestContexts.context(), EncodingFormat.JSON);
                case JSON_COMPACT -> UaCodec.encode(value, TestContexts.context(),
                        EncodingFormat.JSON, JsonEncodingType.COMPACT);
                case JSON_VERBOSE -> UaCodec.encode(value, TestContexts.context(),
                        EncodingFormat.JSON, JsonEncodingType.VERBOSE);
            };
        }

        VariantHolder decode(byte[] bytes)
        {
            return switch (this) {
                case BINARY -> UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.BINARY, VariantHolder.TYPE);
                case XML -> UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.XML, VariantHolder.TYPE);
                case JSON_REVERSIBLE -> UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.JSON, VariantHolder.TYPE);
                case JSON_COMPACT -> (VariantHolder) UaCodec.decodeJson(bytes, TestContexts.context(),
                        JsonEncodingType.COMPACT);
                case JSON_VERBOSE -> (VariantHolder) UaCodec.decodeJson(bytes, TestContexts.context(),
                        JsonEncodingType.VERBOSE);
            };
        }
    }

    static Stream<Arguments> cases()
    {
        List<Arguments> cases = new ArrayList<>();
        for (BuiltInType type : BuiltInType.values()) {
            for (Shape shape : Shape.values()) {
                if (type == BuiltInType.NULL && shape != Shape.SCALAR) continue;
                if (type == BuiltInType.VARIANT && shape == Shape.SCALAR) continue;
                for (Wire wire : Wire.values()) {
                    cases.add(Arguments.of(type, shape, wire));
                }
            }
        }
        return cases.stream();
    }

    @ParameterizedTest(name = "{0} {1} {2}")
    @MethodSource("cases")
    void variantSurvivesTheWire(BuiltInType type, Shape shape, Wire wire)
    {
        Variant original = variant(type, shape);

        VariantHolder decoded = wire.decode(wire.encode(new VariantHolder(original)));

        assertEquals(original, decoded.value());
        assertEquals(original.valueRank(), decoded.value().valueRank());
        assertArrayEquals(original.arrayDimensions(), decoded.value().arrayDimensions());
        if (type == BuiltInType.ENUMERATION) {
            assertEquals(BuiltInType.INT32, decoded.value().type());
        }
    }

    private static Variant variant(BuiltInType type, Shape shape)
    {
        if (type == BuiltInType.NULL) {
            return Variant.NULL;
        }
        switch (shape) {
            case SCALAR:
                return Variant.of(type, sample(type, 1));
            case ARRAY:
                return Variant.ofArray(type, new Object[] { sample(type, 0), sample(type, 1), sample(type, 2) });
            default:
                Object[] elements = new Object[4];
                for (int i = 0; i < elements.length; i++) {
                    elements[i] = sample(type, i);
                }
                return Variant.ofMatrix(new Matrix(type, elements, new int[] { 2, 2 }));
        }
    }

    /**
     * A value of {@code type} away from its default; {@code i} makes
     * neighbouring elements differ.
     */
    private static Object sample(BuiltInType type, int i)
    {
        return switch (type) {
            case BOOLEAN -> i % 2 == 1;
            case SBYTE -> (byte) (-5 - i);
            case BYTE -> (short) (200 + i);
            case INT16 -> (short) (-300 - i);
            case UINT16 -> 60000 + i;
            case INT32 -> -70000 - i;
            case UINT32 -> 4_000_000_000L + i;
            case INT64 -> -9_000_000_000L - i;
            case UINT64 -> 0xFFFF_FFFF_FFFF_FFF0L + i;
            case FLOAT -> 1.5f + i;
            case DOUBLE -> -2.25 - i;
            case STRING -> "pump-" + i;
            case DATE_TIME -> DateTime.fromInstant(Instant.parse("2024-01-01T12:30:45.1234567Z").plusSeconds(i));
            case GUID -> new UUID(0x72962b91fa754ae6L, 0x8d28b404dc7daf63L + i);
            case BYTE_STRING -> ByteString.of(new byte[] { 1, 2, (byte) (0xF0 + i) });
            case XML_ELEMENT -> XmlElement.of("<Note xmlns=\"urn:questrail:note\">note " + i + "</Note>");
            case NODE_ID -> i % 2 == 0 ? NodeId.string(1, "Pump.Speed" + i) : NodeId.numeric(1, 100 + i);
            case EXPANDED_NODE_ID -> new ExpandedNodeId(NodeId.numeric(0, 42 + i), "urn:questrail:other", 0);
            case STATUS_CODE -> StatusCode.of(i % 2 == 0 ? 0x8034_0000L : 0x4000_0000L);
            case QUALIFIED_NAME -> new QualifiedName(1, "Pump" + i);
            case LOCALIZED_TEXT -> new LocalizedText("en", "Pump " + i);
            case EXTENSION_OBJECT -> ExtensionObject.of(new Range(i, 100 + i));
            case DATA_VALUE -> DataValue.of(Variant.ofDouble(3.5 + i), StatusCode.of(0x4000_0000L),
                    DateTime.fromInstant(Instant.parse("2024-01-01T00:00:00Z")), null);
            case VARIANT -> i % 2 == 0 ? Variant.ofString("v" + i) : Variant.ofInt32(i);
            case DIAGNOSTIC_INFO -> new DiagnosticInfo(i, -1, 2, -1, "trace " + i, StatusCode.GOOD, null);
            case ENUMERATION -> 5 + i;
            case NULL -> throw new IllegalArgumentException("No sample for " + type);
        };
    }
}
