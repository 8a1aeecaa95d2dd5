package com.questrail.opcua.codec.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.opcua.catalog.EUInformation;
import com.questrail.opcua.catalog.Range;
import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.EncodingFormat;
import com.questrail.opcua.codec.UaCodec;
import com.questrail.opcua.config.EncodingLimits;
import com.questrail.opcua.observability.OpaqueBodyEvent;
import com.questrail.opcua.observability.RecordingObservabilitySink;
import com.questrail.opcua.test.SampleStructure;
import com.questrail.opcua.test.TestContexts;
import com.questrail.opcua.types.ByteString;
import com.questrail.opcua.types.ExtensionObject;
import com.questrail.opcua.types.ExtensionObjectEncoding;
import com.questrail.opcua.types.NodeId;
import com.questrail.opcua.types.StatusCodes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonCodecTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link JsonEncoder} and {@link JsonDecoder}.
 *
 * <p>Output shapes are checked on the parsed document rather than on the
 * text, so member order and whitespace do not matter.</p>
 */
final class JsonCodecTest
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // ---------------------------------------------------------------------
    // Round trips
    // ---------------------------------------------------------------------

    @Test
    void reversibleRoundTrip()
    {
        SampleStructure original = SampleStructure.populated();

        byte[] bytes = UaCodec.encode(original, TestContexts.context(), EncodingFormat.JSON);
        SampleStructure decoded = UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.JSON, SampleStructure.TYPE);

        assertEquals(original, decoded);
    }

    @Test
    void compactRoundTrip()
    {
        SampleStructure original = SampleStructure.populated();

        byte[] bytes = UaCodec.encode(original, TestContexts.context(), EncodingFormat.JSON, JsonEncodingType.COMPACT);

        assertEquals(original, UaCodec.decodeJson(bytes, TestContexts.context(), JsonEncodingType.COMPACT));
    }

    @Test
    void verboseRoundTrip()
    {
        SampleStructure original = SampleStructure.populated();

        byte[] bytes = UaCodec.encode(original, TestContexts.context(), EncodingFormat.JSON, JsonEncodingType.VERBOSE);

        assertEquals(original, UaCodec.decodeJson(bytes, TestContexts.context(), JsonEncodingType.VERBOSE));
    }

    @Test
    void reencodingIsIdentical()
    {
        byte[] first = UaCodec.encode(SampleStructure.populated(), TestContexts.context(), EncodingFormat.JSON);
        SampleStructure decoded = UaCodec.decode(first, TestContexts.context(), EncodingFormat.JSON, SampleStructure.TYPE);

        byte[] second = UaCodec.encode(decoded, TestContexts.context(), EncodingFormat.JSON);

        assertEquals(new String(first, StandardCharsets.UTF_8), new String(second, StandardCharsets.UTF_8));
    }

    @ParameterizedTest
    @EnumSource(value = JsonEncodingType.class, names = { "COMPACT", "VERBOSE" })
    void compactAndVerboseReencodeIdentically(JsonEncodingType type)
    {
        byte[] first = UaCodec.encode(SampleStructure.populated(), TestContexts.context(), EncodingFormat.JSON, type);
        Encodeable decoded = UaCodec.decodeJson(first, TestContexts.context(), type);

        byte[] second = UaCodec.encode(decoded, TestContexts.context(), EncodingFormat.JSON, type);

        assertEquals(new String(first, StandardCharsets.UTF_8), new String(second, StandardCharsets.UTF_8));
    }

    @Test
    void nonReversibleCannotBeDecoded()
    {
        byte[] bytes = UaCodec.encode(SampleStructure.populated(), TestContexts.context(),
                EncodingFormat.JSON, JsonEncodingType.NON_REVERSIBLE);

        CodecException e = assertThrows(CodecException.class,
                () -> UaCodec.decodeJson(bytes, TestContexts.context(), JsonEncodingType.NON_REVERSIBLE));
        assertEquals(StatusCodes.BadNotSupported, e.statusCode().value());
    }

    @Test
    void specialFloatingPointValuesRoundTrip() throws IOException
    {
        Range original = new Range(Double.NaN, Double.POSITIVE_INFINITY);

        byte[] bytes = UaCodec.encode(original, TestContexts.context(), EncodingFormat.JSON);
        JsonNode body = tree(bytes).get("Body");

        assertEquals("NaN", body.get("Low").textValue());
        assertEquals("Infinity", body.get("High").textValue());
        assertEquals(original, UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.JSON, Range.TYPE));
    }

    // ---------------------------------------------------------------------
    // Output shapes
    // ---------------------------------------------------------------------

    @Test
    void reversibleShapes() throws IOException
    {
        JsonNode root = tree(UaCodec.encode(SampleStructure.populated(), TestContexts.context(), EncodingFormat.JSON));

        assertEquals(1003, root.get("TypeId").get("Id").intValue());
        assertEquals(1, root.get("TypeId").get("Namespace").intValue());

        JsonNode body = root.get("Body");
        assertEquals("-9000000000", body.get("Int64").textValue());
        assertEquals("18446744073709551600", body.get("UInt64").textValue());
        assertEquals(2150891520L, body.get("Status").longValue());
        assertEquals(5, body.get("Mode").intValue());

        JsonNode nodeId = body.get("NodeId");
        assertEquals(1, nodeId.get("IdType").intValue());
        assertEquals("Pump.Speed", nodeId.get("Id").textValue());
        assertEquals(1, nodeId.get("Namespace").intValue());

        JsonNode variant = body.get("Variant");
        assertEquals(6, variant.get("Type").intValue());
        assertEquals(json("[1,2,3]"), variant.get("Body"));

        JsonNode payload = body.get("Payload");
        assertEquals(15375, payload.get("TypeId").get("Id").intValue());
        assertFalse(payload.get("TypeId").has("Namespace"));
        assertEquals(0.0, payload.get("Body").get("Low").doubleValue());
        assertEquals(100.0, payload.get("Body").get("High").doubleValue());

        JsonNode grid = body.get("Grid");
        assertEquals(json("[2,3]"), grid.get("Dimensions"));
        assertEquals(json("[1,2,3,4,5,6]"), grid.get("Array"));
    }

    @Test
    void compactShapes() throws IOException
    {
        JsonNode root = tree(UaCodec.encode(SampleStructure.populated(), TestContexts.context(),
                EncodingFormat.JSON, JsonEncodingType.COMPACT));

        assertEquals("ns=1;i=1003", root.get("UaTypeId").textValue());
        assertFalse(root.has("Body"));
        assertEquals("ns=1;s=Pump.Speed", root.get("NodeId").textValue());
        assertEquals("1:Pump", root.get("BrowseName").textValue());

        JsonNode variant = root.get("Variant");
        assertEquals(6, variant.get("UaType").intValue());
        assertEquals(json("[1,2,3]"), variant.get("Value"));

        JsonNode payload = root.get("Payload");
        assertEquals("i=15375", payload.get("UaTypeId").textValue());
        assertEquals(100.0, payload.get("High").doubleValue());
        assertFalse(payload.has("Low"));
    }

    @Test
    void verboseShapes() throws IOException
    {
        JsonNode body = tree(UaCodec.encode(SampleStructure.populated(), TestContexts.context(),
                EncodingFormat.JSON, JsonEncodingType.VERBOSE)).get("Body");

        assertEquals(2150891520L, body.get("Status").get("Code").longValue());
        assertEquals("BadNodeIdUnknown", body.get("Status").get("Symbol").textValue());
        assertEquals("FAULTED_5", body.get("Mode").textValue());
    }

    @Test
    void nonReversibleShapes() throws IOException
    {
        JsonNode root = tree(UaCodec.encode(SampleStructure.populated(), TestContexts.context(),
                EncodingFormat.JSON, JsonEncodingType.NON_REVERSIBLE));

        assertFalse(root.has("TypeId"));
        assertEquals("pump-1", root.get("Text").textValue());
        assertEquals(json("[1,2,3]"), root.get("Variant"));
        assertEquals("Pump 1", root.get("DisplayName").textValue());
        assertEquals(SampleStructure.NAMESPACE, root.get("NodeId").get("Namespace").textValue());
        assertEquals(json("[[1,2,3],[4,5,6]]"), root.get("Grid"));
        assertEquals(100.0, root.get("Payload").get("High").doubleValue());
    }

    @Test
    void compactLeavesOutDefaultNumbers() throws IOException
    {
        JsonNode root = tree(UaCodec.encode(new Range(0, 0), TestContexts.context(),
                EncodingFormat.JSON, JsonEncodingType.COMPACT));

        assertEquals(1, root.size());
        assertEquals("i=15375", root.get("UaTypeId").textValue());
    }

    @Test
    void defaultValuesAreIncludedOnRequest() throws IOException
    {
        EUInformation unit = new EUInformation(null, 0, null, null);

        JsonNode lean = tree(UaCodec.encode(unit, TestContexts.context(), EncodingFormat.JSON)).get("Body");
        assertEquals(0, lean.get("UnitId").intValue());
        assertFalse(lean.has("NamespaceUri"));
        assertFalse(lean.has("DisplayName"));

        JsonNode full = tree(UaCodec.encodeJson(unit, TestContexts.context(),
                JsonEncodingPolicy.REVERSIBLE.withIncludeDefaultValues(true))).get("Body");
        assertTrue(full.get("NamespaceUri").isNull());
        assertTrue(full.get("DisplayName").isNull());
        assertTrue(full.get("Description").isNull());
    }

    // ---------------------------------------------------------------------
    // Lenient and hostile input
    // ---------------------------------------------------------------------

    @Test
    void acceptsTypeIdAndNumbersAsText()
    {
        byte[] bytes = utf8("{\"TypeId\":\"i=15375\",\"Body\":{\"Low\":\"-1.5\",\"High\":2}}");

        assertEquals(new Range(-1.5, 2), UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.JSON, Range.TYPE));
    }

    @Test
    void uint64TextIsBoundedBeforeParsing()
    {
        byte[] bytes = utf8("{\"V\":\"1" + "9".repeat(1_000_000) + "\"}");

        CodecException e = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> assertThrows(CodecException.class,
                        () -> new JsonDecoder(bytes, TestContexts.context()).readUInt64("V")));
        assertTrue(e.isDecodingError());
    }

    @Test
    void uint64AcceptsFullRangeOnly()
    {
        byte[] bytes = utf8("{\"Max\":\"18446744073709551615\",\"Number\":18446744073709551615,"
                + "\"Negative\":\"-1\",\"TooBig\":\"18446744073709551616\"}");
        JsonDecoder decoder = new JsonDecoder(bytes, TestContexts.context());

        assertEquals(-1L, decoder.readUInt64("Max"));
        assertEquals(-1L, decoder.readUInt64("Number"));
        assertTrue(assertThrows(CodecException.class, () -> decoder.readUInt64("Negative")).isDecodingError());
        assertTrue(assertThrows(CodecException.class, () -> decoder.readUInt64("TooBig")).isDecodingError());
    }

    @Test
    void malformedJsonIsDecodingError()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        CodecException e = assertThrows(CodecException.class,
                () -> UaCodec.decode(utf8("{\"TypeId\":"), TestContexts.context(sink), EncodingFormat.JSON));

        assertTrue(e.isDecodingError());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void messageRootMustBeAnObject()
    {
        CodecException e = assertThrows(CodecException.class,
                () -> UaCodec.decode(utf8("[1,2]"), TestContexts.context(), EncodingFormat.JSON));

        assertTrue(e.isDecodingError());
    }

    @Test
    void stringLimitIsEnforced()
    {
        String longText = "x".repeat(100);
        byte[] bytes = utf8("{\"TypeId\":{\"Id\":15376},\"Body\":{\"NamespaceUri\":\"" + longText + "\"}}");
        EncodingLimits limits = EncodingLimits.builder()
                .withMaxStringLength(16)
                .withMaxByteStringLength(3)
                .build();

        CodecException e = assertThrows(CodecException.class,
                () -> UaCodec.decode(bytes, TestContexts.context(limits), EncodingFormat.JSON));

        assertTrue(e.isLimitsExceeded());
    }

    @Test
    void deepNestingIsRejectedWhileParsing()
    {
        String nested = "[".repeat(50) + "]".repeat(50);
        byte[] bytes = utf8("{\"TypeId\":{\"Id\":884},\"Body\":{\"Low\":" + nested + "}}");
        EncodingLimits limits = EncodingLimits.builder().withMaxNestingLevels(2).build();

        CodecException e = assertThrows(CodecException.class,
                () -> UaCodec.decode(bytes, TestContexts.context(limits), EncodingFormat.JSON));

        assertTrue(e.isLimitsExceeded());
    }

    @Test
    void remoteTypeIdIsRejected()
    {
        byte[] bytes = utf8("{\"TypeId\":{\"Id\":884,\"ServerUri\":2},\"Body\":{}}");

        CodecException e = assertThrows(CodecException.class,
                () -> UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.JSON));

        assertTrue(e.isDecodingError());
    }

    // ---------------------------------------------------------------------
    // Opaque bodies
    // ---------------------------------------------------------------------

    @Test
    void unknownTypeIsPreservedAsJson() throws IOException
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        EncodingContext context = TestContexts.context(sink);
        String unknown = "{\"TypeId\":{\"Id\":4242,\"Namespace\":1},\"Body\":{\"X\":1}}";

        ExtensionObject decoded = new JsonDecoder(utf8("[" + unknown + "]"), context).readExtensionObject(null);

        assertEquals(ExtensionObjectEncoding.JSON, decoded.encoding());
        assertEquals(new NodeId(1, 4242L), decoded.typeId().nodeId());
        assertTrue(sink.hasEventOfType(OpaqueBodyEvent.class));

        JsonEncoder encoder = new JsonEncoder(context, JsonEncodingPolicy.REVERSIBLE);
        encoder.writeExtensionObject("Payload", decoded);
        assertEquals(json(unknown), encoder.toJsonNode().get("Payload"));
    }

    @Test
    void binaryBodyInsideJsonStaysOpaque()
    {
        String message = "{\"TypeId\":{\"Id\":4242,\"Namespace\":1},\"Encoding\":1,\"Body\":\"AQID\"}";

        ExtensionObject decoded = new JsonDecoder(utf8("[" + message + "]"), TestContexts.context())
                .readExtensionObject(null);

        assertEquals(ExtensionObjectEncoding.BINARY, decoded.encoding());
        assertEquals(ByteString.of(new byte[]{1, 2, 3}), decoded.body());
    }

    @Test
    void unknownMessageTypeIsRejected()
    {
        byte[] bytes = utf8("{\"TypeId\":{\"Id\":4242,\"Namespace\":1},\"Body\":{\"X\":1}}");

        CodecException e = assertThrows(CodecException.class,
                () -> UaCodec.decode(bytes, TestContexts.context(), EncodingFormat.JSON));

        assertTrue(e.isDecodingError());
    }

    private static JsonNode tree(byte[] bytes) throws IOException
    {
        return MAPPER.readTree(bytes);
    }

    private static JsonNode json(String text) throws IOException
    {
        return MAPPER.readTree(text);
    }

    private static byte[] utf8(String text)
    {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
