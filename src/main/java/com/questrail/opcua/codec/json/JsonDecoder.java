package com.questrail.opcua.codec.json;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.LimitsGuard;
import com.questrail.opcua.codec.NamespaceScope;
import com.questrail.opcua.codec.NamespaceStack;
import com.questrail.opcua.codec.UaDecoder;
import com.questrail.opcua.config.EncodingLimits;
import com.questrail.opcua.observability.OpaqueBodyEvent;
import com.questrail.opcua.types.BuiltInType;
import com.questrail.opcua.types.ByteString;
import com.questrail.opcua.types.DataValue;
import com.questrail.opcua.types.DateTime;
import com.questrail.opcua.types.DiagnosticInfo;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.ExtensionObject;
import com.questrail.opcua.types.ExtensionObjectEncoding;
import com.questrail.opcua.types.IdType;
import com.questrail.opcua.types.LocalizedText;
import com.questrail.opcua.types.Matrix;
import com.questrail.opcua.types.NodeId;
import com.questrail.opcua.types.QualifiedName;
import com.questrail.opcua.types.StatusCode;
import com.questrail.opcua.types.StatusCodes;
import com.questrail.opcua.types.UaEnumeration;
import com.questrail.opcua.types.Variant;
import com.questrail.opcua.types.XmlElement;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * JsonDecoder
 * -----------------------------------------------------------------------------
 * {@link UaDecoder} reading the reversible OPC UA JSON encodings.
 *
 * <p>The document is parsed into a Jackson tree first, with the encoding
 * limits turned into Jackson stream constraints so that an oversized string
 * or an absurdly deep document is rejected by the parser itself. Decoding
 * then walks the tree:</p>
 * <ul>
 *   <li>a named read looks the member up in the current object; a missing
 *       member yields the type's default value</li>
 *   <li>an unnamed read ({@code fieldName == null}) takes the next element of
 *       the current array</li>
 * </ul>
 *
 * <p>Reversible, Compact and Verbose documents are all accepted, whichever of
 * them was requested. The NonReversible form drops type information and
 * cannot be decoded.</p>
 */
public final class JsonDecoder implements UaDecoder
{
    private static final UUID EMPTY_GUID = new UUID(0L, 0L);
    private static final int MAX_UINT64_DIGITS = 20;

    private final EncodingContext context;
    private final LimitsGuard guard;
    private final NamespaceStack namespaces = new NamespaceStack();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final JsonNode root;

    public JsonDecoder(byte[] bytes, EncodingContext context)
    {
        this(bytes, context, JsonEncodingType.REVERSIBLE);
    }

    /**
     * @throws CodecException {@code BadNotSupported} for
     *         {@link JsonEncodingType#NON_REVERSIBLE}; {@code BadDecodingError}
     *         if the input is not JSON; {@code BadEncodingLimitsExceeded} if
     *         it breaks a limit while being parsed
     */
    public JsonDecoder(byte[] bytes, EncodingContext context, JsonEncodingType encodingType)
    {
        if (encodingType == JsonEncodingType.NON_REVERSIBLE) {
            throw CodecException.notSupported("NonReversible JSON cannot be decoded");
        }
        this.context = context;
        this.guard = new LimitsGuard(context.limits());
        guard.checkMessageSize(bytes.length);
        this.root = parse(bytes, context.limits());
        frames.push(new Frame(root));
    }

    private static JsonNode parse(byte[] bytes, EncodingLimits limits)
    {
        try {
            JsonNode node = mapperFor(limits).readTree(bytes);
            if (node == null || node.isMissingNode()) {
                throw CodecException.decodingError("Empty JSON document");
            }
            return node;
        }
        catch (StreamConstraintsException e) {
            throw CodecException.limitsExceeded(e.getOriginalMessage(), e);
        }
        catch (JacksonException e) {
            throw CodecException.decodingError("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        catch (IOException e) {
            throw CodecException.decodingError("Cannot read JSON document", e);
        }
    }

    static ObjectMapper mapperFor(EncodingLimits limits)
    {
        final int maxString;
        if (limits.maxStringLength() == 0 || limits.maxByteStringLength() == 0) {
            maxString = Integer.MAX_VALUE;
        }
        else {
            // base64 text of the largest allowed byte string
            long base64 = ((long) limits.maxByteStringLength() + 2) / 3 * 4;
            maxString = (int) Math.min(Integer.MAX_VALUE, Math.max(limits.maxStringLength(), base64));
        }
        // each OPC UA level costs up to four JSON levels (ExtensionObject, Body, Variant, array)
        final int maxDepth = limits.maxNestingLevels() == 0
                ? Integer.MAX_VALUE
                : (int) Math.min(Integer.MAX_VALUE, (long) limits.maxNestingLevels() * 4 + 8);

        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxStringLength(maxString)
                        .maxNestingDepth(maxDepth)
                        .build())
                .build();
        return new ObjectMapper(factory);
    }

    /**
     * Reads a complete message whose root object is an extension object.
     *
     * @param expected the type the caller requires, or {@code null} for any
     *                 registered type
     * @throws CodecException {@code BadDecodingError} if the body type is not
     *         registered or is not {@code expected}
     */
    public Encodeable readMessage(EncodeableType<?> expected)
    {
        if (!(root instanceof ObjectNode)) {
            throw CodecException.decodingError("JSON message must be an object");
        }
        final ExtensionObject message = extensionObject((ObjectNode) root);
        if (!message.isDecoded()) {
            throw CodecException.decodingError("Unknown message type " + message.typeId());
        }
        final Encodeable value = message.decodedBody();
        if (expected != null && !expected.isInstance(value)) {
            throw CodecException.decodingError("Expected a " + expected.name() + " message but found "
                    + value.encodeableType().name());
        }
        return value;
    }

    @Override
    public EncodingContext context()
    {
        return context;
    }

    @Override
    public boolean readBoolean(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return false;
        }
        if (!node.isBoolean()) {
            throw mismatch(fieldName, "Boolean", node);
        }
        return node.booleanValue();
    }

    @Override
    public byte readSByte(String fieldName)
    {
        return (byte) readInteger(fieldName, "SByte", Byte.MIN_VALUE, Byte.MAX_VALUE);
    }

    @Override
    public short readByte(String fieldName)
    {
        return (short) readInteger(fieldName, "Byte", 0, 0xFF);
    }

    @Override
    public short readInt16(String fieldName)
    {
        return (short) readInteger(fieldName, "Int16", Short.MIN_VALUE, Short.MAX_VALUE);
    }

    @Override
    public int readUInt16(String fieldName)
    {
        return (int) readInteger(fieldName, "UInt16", 0, 0xFFFF);
    }

    @Override
    public int readInt32(String fieldName)
    {
        return (int) readInteger(fieldName, "Int32", Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    @Override
    public long readUInt32(String fieldName)
    {
        return readInteger(fieldName, "UInt32", 0, 0xFFFF_FFFFL);
    }

    @Override
    public long readInt64(String fieldName)
    {
        return readInteger(fieldName, "Int64", Long.MIN_VALUE, Long.MAX_VALUE);
    }

    @Override
    public long readUInt64(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return 0L;
        }
        if (node.isTextual()) {
            final String text = node.textValue().trim();
            if (text.length() > MAX_UINT64_DIGITS) {
                throw mismatch(fieldName, "UInt64", node);
            }
            try {
                return Long.parseUnsignedLong(text);
            }
            catch (NumberFormatException e) {
                throw mismatch(fieldName, "UInt64", node);
            }
        }
        if (node.isIntegralNumber()) {
            final BigInteger value = node.bigIntegerValue();
            if (value.signum() >= 0 && value.bitLength() <= 64) {
                return value.longValue();
            }
        }
        throw mismatch(fieldName, "UInt64", node);
    }

    private long readInteger(String fieldName, String typeName, long min, long max)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return 0L;
        }
        final long value;
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            value = node.longValue();
        }
        else if (node.isTextual()) {
            try {
                value = Long.parseLong(node.textValue().trim());
            }
            catch (NumberFormatException e) {
                throw mismatch(fieldName, typeName, node);
            }
        }
        else {
            throw mismatch(fieldName, typeName, node);
        }
        if (value < min || value > max) {
            throw CodecException.decodingError(typeName + " " + describe(fieldName) + " out of range: " + value);
        }
        return value;
    }

    @Override
    public float readFloat(String fieldName)
    {
        return (float) readFloatingPoint(fieldName, "Float");
    }

    @Override
    public double readDouble(String fieldName)
    {
        return readFloatingPoint(fieldName, "Double");
    }

    private double readFloatingPoint(String fieldName, String typeName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            switch (node.textValue()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    try {
                        return Double.parseDouble(node.textValue());
                    }
                    catch (NumberFormatException e) {
                        throw mismatch(fieldName, typeName, node);
                    }
            }
        }
        throw mismatch(fieldName, typeName, node);
    }

    @Override
    public String readString(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            throw mismatch(fieldName, "String", node);
        }
        guard.checkStringLength(node.textValue().length());
        return node.textValue();
    }

    @Override
    public DateTime readDateTime(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return DateTime.MIN_VALUE;
        }
        if (!node.isTextual()) {
            throw mismatch(fieldName, "DateTime", node);
        }
        try {
            return DateTime.parse(node.textValue());
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid DateTime " + describe(fieldName) + ": " + node.textValue(), e);
        }
    }

    @Override
    public UUID readGuid(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return EMPTY_GUID;
        }
        if (!node.isTextual()) {
            throw mismatch(fieldName, "Guid", node);
        }
        return parseGuid(node.textValue());
    }

    private static UUID parseGuid(String text)
    {
        try {
            return UUID.fromString(text.trim());
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid Guid: " + text, e);
        }
    }

    @Override
    public ByteString readByteString(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            throw mismatch(fieldName, "ByteString", node);
        }
        return decodeBase64(node.textValue());
    }

    private ByteString decodeBase64(String text)
    {
        guard.checkByteStringLength((long) text.length() * 3 / 4);
        try {
            return ByteString.fromBase64(text);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid base64 text", e);
        }
    }

    @Override
    public XmlElement readXmlElement(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            throw mismatch(fieldName, "XmlElement", node);
        }
        guard.checkStringLength(node.textValue().length());
        return XmlElement.of(node.textValue());
    }

    @Override
    public NodeId readNodeId(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (node == null || node.isMissingNode()) {
            return NodeId.NULL;
        }
        if (node.isNull()) {
            return null;
        }
        return nodeId(node);
    }

    private NodeId nodeId(JsonNode node)
    {
        if (node.isTextual()) {
            ExpandedNodeId parsed = parseExpandedText(node.textValue());
            if (!parsed.isLocal()) {
                throw CodecException.decodingError("NodeId cannot carry a server index: " + node.textValue());
            }
            return localize(parsed);
        }
        if (!node.isObject()) {
            throw mismatch(null, "NodeId", node);
        }
        final JsonNode namespace = node.get("Namespace");
        int index = 0;
        if (namespace != null && namespace.isTextual()) {
            index = context.namespaceTable().getOrAppend(namespace.textValue());
        }
        else if (namespace != null && !namespace.isNull()) {
            index = (int) checkedIndex(namespace, 0xFFFF, "Namespace");
        }
        return newNodeId(index, identifier(node));
    }

    private Object identifier(JsonNode node)
    {
        final JsonNode idTypeNode = node.get("IdType");
        final IdType idType;
        try {
            idType = isAbsent(idTypeNode) ? IdType.NUMERIC : IdType.fromValue(idTypeNode.asInt(-1));
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid IdType " + idTypeNode, e);
        }
        final JsonNode id = node.get("Id");
        switch (idType) {
            case NUMERIC:
                return isAbsent(id) ? 0L : checkedIndex(id, 0xFFFF_FFFFL, "Id");
            case STRING:
                if (isAbsent(id) || !id.isTextual()) {
                    throw CodecException.decodingError("String NodeId without text Id");
                }
                guard.checkStringLength(id.textValue().length());
                return id.textValue();
            case GUID:
                if (isAbsent(id) || !id.isTextual()) {
                    throw CodecException.decodingError("Guid NodeId without text Id");
                }
                return parseGuid(id.textValue());
            default:
                if (isAbsent(id) || !id.isTextual()) {
                    throw CodecException.decodingError("Opaque NodeId without base64 Id");
                }
                return decodeBase64(id.textValue());
        }
    }

    private static long checkedIndex(JsonNode node, long max, String what)
    {
        final long value;
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            value = node.longValue();
        }
        else if (node.isTextual()) {
            try {
                value = Long.parseLong(node.textValue().trim());
            }
            catch (NumberFormatException e) {
                throw CodecException.decodingError("Invalid " + what + ": " + node.textValue(), e);
            }
        }
        else {
            throw CodecException.decodingError("Invalid " + what + ": " + node);
        }
        if (value < 0 || value > max) {
            throw CodecException.decodingError(what + " out of range: " + value);
        }
        return value;
    }

    private static NodeId newNodeId(int index, Object identifier)
    {
        try {
            return new NodeId(index, identifier);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid NodeId: " + e.getMessage(), e);
        }
    }

    private static ExpandedNodeId parseExpandedText(String text)
    {
        try {
            return ExpandedNodeId.parse(text);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid NodeId text: " + text, e);
        }
    }

    /**
     * Replaces a namespace URI by its index in the namespace table, adding
     * the URI when the table does not have it yet.
     */
    private NodeId localize(ExpandedNodeId id)
    {
        if (id.namespaceUri() == null) {
            return id.nodeId();
        }
        return newNodeId(context.namespaceTable().getOrAppend(id.namespaceUri()), id.identifier());
    }

    @Override
    public ExpandedNodeId readExpandedNodeId(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (node == null || node.isMissingNode()) {
            return ExpandedNodeId.NULL;
        }
        if (node.isNull()) {
            return null;
        }
        return expandedNodeId(node);
    }

    private ExpandedNodeId expandedNodeId(JsonNode node)
    {
        if (node.isTextual()) {
            return parseExpandedText(node.textValue());
        }
        if (!node.isObject()) {
            throw mismatch(null, "ExpandedNodeId", node);
        }
        final JsonNode namespace = node.get("Namespace");
        String uri = null;
        int index = 0;
        if (namespace != null && namespace.isTextual()) {
            uri = namespace.textValue();
        }
        else if (namespace != null && !namespace.isNull()) {
            index = (int) checkedIndex(namespace, 0xFFFF, "Namespace");
        }
        final JsonNode server = node.get("ServerUri");
        long serverIndex = 0;
        if (server != null && server.isTextual()) {
            serverIndex = context.serverTable().getOrAppend(server.textValue());
        }
        else if (server != null && !server.isNull()) {
            serverIndex = checkedIndex(server, 0xFFFF_FFFFL, "ServerUri");
        }
        try {
            return new ExpandedNodeId(newNodeId(index, identifier(node)), uri, serverIndex);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid ExpandedNodeId: " + e.getMessage(), e);
        }
    }

    @Override
    public StatusCode readStatusCode(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return StatusCode.GOOD;
        }
        return statusCode(node);
    }

    private StatusCode statusCode(JsonNode node)
    {
        if (node.isObject()) {
            final JsonNode code = node.get("Code");
            if (!isAbsent(code)) {
                return StatusCode.of(checkedIndex(code, 0xFFFF_FFFFL, "StatusCode"));
            }
            final JsonNode symbol = node.get("Symbol");
            if (symbol != null && symbol.isTextual()) {
                return StatusCode.of(symbolicCode(symbol.textValue()));
            }
            return StatusCode.GOOD;
        }
        if (node.isTextual() && !node.textValue().isEmpty() && !Character.isDigit(node.textValue().charAt(0))) {
            return StatusCode.of(symbolicCode(node.textValue()));
        }
        return StatusCode.of(checkedIndex(node, 0xFFFF_FFFFL, "StatusCode"));
    }

    private static long symbolicCode(String symbol)
    {
        return StatusCodes.codeOf(symbol)
                .orElseThrow(() -> CodecException.decodingError("Unknown StatusCode symbol " + symbol));
    }

    @Override
    public QualifiedName readQualifiedName(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (node == null || node.isMissingNode()) {
            return QualifiedName.NULL;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            QualifiedName parsed;
            try {
                parsed = QualifiedName.parse(node.textValue());
            }
            catch (IllegalArgumentException e) {
                throw CodecException.decodingError("Invalid QualifiedName: " + node.textValue(), e);
            }
            guard.checkStringLength(parsed.name() == null ? 0 : parsed.name().length());
            return parsed;
        }
        if (!node.isObject()) {
            throw mismatch(fieldName, "QualifiedName", node);
        }
        final String name = within(node, () -> readString("Name"));
        final JsonNode uri = node.get("Uri");
        int index = 0;
        if (uri != null && uri.isTextual()) {
            index = context.namespaceTable().getOrAppend(uri.textValue());
        }
        else if (!isAbsent(uri)) {
            index = (int) checkedIndex(uri, 0xFFFF, "Uri");
        }
        return new QualifiedName(index, name);
    }

    @Override
    public LocalizedText readLocalizedText(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (node == null || node.isMissingNode()) {
            return LocalizedText.NULL;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            guard.checkStringLength(node.textValue().length());
            return new LocalizedText(null, node.textValue());
        }
        if (!node.isObject()) {
            throw mismatch(fieldName, "LocalizedText", node);
        }
        return within(node, () -> new LocalizedText(readString("Locale"), readString("Text")));
    }

    @Override
    public ExtensionObject readExtensionObject(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (node == null || node.isMissingNode()) {
            return ExtensionObject.NULL;
        }
        if (node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw mismatch(fieldName, "ExtensionObject", node);
        }
        return extensionObject((ObjectNode) node);
    }

    private ExtensionObject extensionObject(ObjectNode node)
    {
        try (LimitsGuard.Level level = guard.enter("ExtensionObject")) {
            // 1. Compact form: the body members sit next to UaTypeId
            if (node.has("UaTypeId")) {
                final ExpandedNodeId typeId = typeId(node.get("UaTypeId"));
                final int encoding = encodingOf(node.get("UaEncoding"));
                if (encoding == 0 && !node.has("UaBody")) {
                    ObjectNode fields = node.deepCopy();
                    fields.remove("UaTypeId");
                    return structuredBody(typeId, fields);
                }
                return body(typeId, encoding, node.get("UaBody"));
            }

            // 2. Reversible and Verbose forms
            if (node.has("TypeId")) {
                final ExpandedNodeId typeId = typeId(node.get("TypeId"));
                return body(typeId, encodingOf(node.get("Encoding")), node.get("Body"));
            }

            if (node.isEmpty()) {
                return ExtensionObject.NULL;
            }
            throw CodecException.decodingError("ExtensionObject without TypeId");
        }
    }

    private ExpandedNodeId typeId(JsonNode node)
    {
        if (isAbsent(node)) {
            return ExpandedNodeId.NULL;
        }
        final ExpandedNodeId id = expandedNodeId(node);
        if (!id.isLocal()) {
            throw CodecException.decodingError("ExtensionObject TypeId cannot be remote: " + id);
        }
        return ExpandedNodeId.of(localize(id));
    }

    private static int encodingOf(JsonNode node)
    {
        if (isAbsent(node)) {
            return 0;
        }
        final long encoding = checkedIndex(node, 2, "Encoding");
        return (int) encoding;
    }

    private ExtensionObject body(ExpandedNodeId typeId, int encoding, JsonNode body)
    {
        if (isAbsent(body)) {
            return new ExtensionObject(typeId, ExtensionObjectEncoding.NONE, null);
        }
        switch (encoding) {
            case 1: {
                if (!body.isTextual()) {
                    throw CodecException.decodingError("Binary ExtensionObject body must be base64 text");
                }
                ByteString bytes = decodeBase64(body.textValue());
                reportOpaque(typeId, bytes.length());
                return ExtensionObject.binary(typeId, bytes);
            }
            case 2: {
                if (!body.isTextual()) {
                    throw CodecException.decodingError("XML ExtensionObject body must be text");
                }
                guard.checkStringLength(body.textValue().length());
                reportOpaque(typeId, body.textValue().length());
                return ExtensionObject.xml(typeId, XmlElement.of(body.textValue()));
            }
            default:
                return structuredBody(typeId, body);
        }
    }

    private ExtensionObject structuredBody(ExpandedNodeId typeId, JsonNode body)
    {
        final Optional<EncodeableType<?>> type = context.factory().resolve(typeId, context.namespaceTable());
        if (type.isEmpty()) {
            final String json = body.toString();
            reportOpaque(typeId, json.length());
            return ExtensionObject.json(typeId, json);
        }
        if (!body.isObject()) {
            throw CodecException.decodingError("Body of " + type.get().name() + " must be an object");
        }
        return ExtensionObject.of(structure(body, type.get()));
    }

    private <T extends Encodeable> T structure(JsonNode body, EncodeableType<T> type)
    {
        try (LimitsGuard.Level level = guard.enter(type.name());
             NamespaceScope scope = namespaces.push(type.xmlNamespace())) {
            return within(body, () -> type.decode(this));
        }
    }

    @Override
    public DataValue readDataValue(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (node == null || node.isMissingNode()) {
            return DataValue.NULL;
        }
        if (node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw mismatch(fieldName, "DataValue", node);
        }
        try (LimitsGuard.Level level = guard.enter("DataValue")) {
            return within(node, () -> {
                Variant value = readVariant("Value");
                StatusCode status = readStatusCode("StatusCode");
                DateTime sourceTimestamp = readDateTime("SourceTimestamp");
                int sourcePicoseconds = readUInt16("SourcePicoseconds");
                DateTime serverTimestamp = readDateTime("ServerTimestamp");
                int serverPicoseconds = readUInt16("ServerPicoseconds");
                return new DataValue(value, status, sourceTimestamp, sourcePicoseconds,
                        serverTimestamp, serverPicoseconds);
            });
        }
    }

    @Override
    public Variant readVariant(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return Variant.NULL;
        }
        if (!node.isObject()) {
            throw CodecException.decodingError("Variant " + describe(fieldName)
                    + " carries no type information: " + node.getNodeType());
        }
        try (LimitsGuard.Level level = guard.enter("Variant")) {
            final JsonNode typeNode = node.has("UaType") ? node.get("UaType") : node.get("Type");
            if (isAbsent(typeNode)) {
                if (node.isEmpty()) {
                    return Variant.NULL;
                }
                throw CodecException.decodingError("Variant without Type");
            }
            final BuiltInType type = variantType((int) checkedIndex(typeNode, 0xFF, "Variant Type"));
            if (type == BuiltInType.NULL) {
                return Variant.NULL;
            }
            final String bodyKey = node.has("Body") ? "Body" : "Value";
            final JsonNode body = node.get(bodyKey);
            final JsonNode dimensions = node.get("Dimensions");
            try {
                return within(node, () -> {
                    if (body != null && body.isArray()) {
                        Object[] elements = readArray(bodyKey, type);
                        if (dimensions != null && dimensions.isArray() && dimensions.size() > 1) {
                            return Variant.ofMatrix(matrix(type, elements, dimensions));
                        }
                        return Variant.ofArray(type, elements);
                    }
                    if (type == BuiltInType.VARIANT) {
                        throw CodecException.decodingError("A Variant cannot hold a scalar Variant");
                    }
                    Object value = readScalar(bodyKey, type);
                    return value == null ? Variant.NULL : Variant.of(type, value);
                });
            }
            catch (IllegalArgumentException e) {
                throw CodecException.decodingError("Invalid Variant: " + e.getMessage(), e);
            }
        }
    }

    private static BuiltInType variantType(int id)
    {
        if (id == 0) {
            return BuiltInType.NULL;
        }
        return BuiltInType.fromId(id)
                .filter(type -> type.id() <= BuiltInType.DIAGNOSTIC_INFO.id())
                .orElseThrow(() -> CodecException.decodingError("Invalid Variant type " + id));
    }

    private Matrix matrix(BuiltInType type, Object[] elements, JsonNode dimensionsNode)
    {
        if (dimensionsNode.size() < 2) {
            throw CodecException.decodingError("Matrix needs at least two dimensions, found " + dimensionsNode.size());
        }
        guard.checkArrayLength(dimensionsNode.size());
        final int[] dimensions = new int[dimensionsNode.size()];
        for (int i = 0; i < dimensions.length; i++) {
            dimensions[i] = (int) checkedIndex(dimensionsNode.get(i), Integer.MAX_VALUE, "Dimension");
            if (dimensions[i] == 0) {
                throw CodecException.decodingError("Matrix dimension " + i + " is zero");
            }
        }
        long expected = 1;
        for (int dimension : dimensions) {
            expected *= dimension;
            if (expected > elements.length) {
                break;
            }
        }
        if (expected != elements.length) {
            throw CodecException.decodingError("Matrix dimensions do not match " + elements.length + " elements");
        }
        try {
            return new Matrix(type, elements, dimensions);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid Matrix: " + e.getMessage(), e);
        }
    }

    @Override
    public DiagnosticInfo readDiagnosticInfo(String fieldName)
    {
        final JsonNode node = next(fieldName);
        if (node == null || node.isMissingNode()) {
            return DiagnosticInfo.NULL;
        }
        if (node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw mismatch(fieldName, "DiagnosticInfo", node);
        }
        try (LimitsGuard.Level level = guard.enter("DiagnosticInfo")) {
            return within(node, () -> {
                int symbolicId = node.has("SymbolicId") ? readInt32("SymbolicId") : -1;
                int namespaceUri = node.has("NamespaceUri") ? readInt32("NamespaceUri") : -1;
                int locale = node.has("Locale") ? readInt32("Locale") : -1;
                int localizedText = node.has("LocalizedText") ? readInt32("LocalizedText") : -1;
                String additionalInfo = readString("AdditionalInfo");
                StatusCode innerStatus = readStatusCode("InnerStatusCode");
                JsonNode innerNode = node.get("InnerDiagnosticInfo");
                DiagnosticInfo inner = isAbsent(innerNode) ? null : readDiagnosticInfo("InnerDiagnosticInfo");
                return new DiagnosticInfo(symbolicId, namespaceUri, locale, localizedText,
                        additionalInfo, innerStatus, inner);
            });
        }
    }

    @Override
    public <E extends Enum<E> & UaEnumeration> E readEnumeration(String fieldName, Class<E> enumType)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return UaDecoder.enumerationConstant(enumType, 0);
        }
        if (node.isTextual()) {
            String text = node.textValue();
            int separator = text.lastIndexOf('_');
            try {
                return UaDecoder.enumerationConstant(enumType, Integer.parseInt(text.substring(separator + 1)));
            }
            catch (NumberFormatException e) {
                throw CodecException.decodingError("Invalid enumeration value " + text, e);
            }
        }
        return UaDecoder.enumerationConstant(enumType, (int) readIntegerNode(node, fieldName));
    }

    private static long readIntegerNode(JsonNode node, String fieldName)
    {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw mismatch(fieldName, "Int32", node);
        }
        return node.intValue();
    }

    @Override
    public <T extends Encodeable> T readEncodeable(String fieldName, EncodeableType<T> type)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            throw CodecException.decodingError("Missing " + type.name() + " " + describe(fieldName));
        }
        if (!node.isObject()) {
            throw mismatch(fieldName, type.name(), node);
        }
        return structure(node, type);
    }

    @Override
    public Object[] readArray(String fieldName, BuiltInType type)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isArray()) {
            throw mismatch(fieldName, "array of " + type, node);
        }
        guard.checkArrayLength(node.size());
        final Object[] values = new Object[node.size()];
        return within(node, () -> {
            for (int i = 0; i < values.length; i++) {
                values[i] = readScalar(null, type);
            }
            return values;
        });
    }

    @Override
    public <T extends Encodeable> List<T> readEncodeableArray(String fieldName, EncodeableType<T> type)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isArray()) {
            throw mismatch(fieldName, "array of " + type.name(), node);
        }
        guard.checkArrayLength(node.size());
        return within(node, () -> {
            List<T> values = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                values.add(readEncodeable(null, type));
            }
            return values;
        });
    }

    @Override
    public Matrix readMatrix(String fieldName, BuiltInType type)
    {
        final JsonNode node = next(fieldName);
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isObject()) {
            throw mismatch(fieldName, "Matrix", node);
        }
        final JsonNode dimensions = node.get("Dimensions");
        if (dimensions == null || !dimensions.isArray()) {
            throw CodecException.decodingError("Matrix " + describe(fieldName) + " without Dimensions");
        }
        final Object[] elements = within(node, () -> readArray("Array", type));
        return matrix(type, elements == null ? new Object[0] : elements, dimensions);
    }

    @Override
    public NamespaceScope pushNamespace(String namespaceUri)
    {
        return namespaces.push(namespaceUri);
    }

    @Override
    public void popNamespace()
    {
        namespaces.pop();
    }

    /**
     * Member {@code fieldName} of the current object, or the next element of
     * the current array. {@code null} when there is no such member.
     */
    private JsonNode next(String fieldName)
    {
        final Frame frame = frames.peek();
        if (fieldName == null) {
            if (!frame.node.isArray()) {
                throw CodecException.decodingError("Unnamed value outside a JSON array");
            }
            return frame.node.get(frame.index++);
        }
        return frame.node.isObject() ? frame.node.get(fieldName) : null;
    }

    private <R> R within(JsonNode node, Supplier<R> body)
    {
        frames.push(new Frame(node));
        try {
            return body.get();
        }
        finally {
            frames.pop();
        }
    }

    private static boolean isAbsent(JsonNode node)
    {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static CodecException mismatch(String fieldName, String expected, JsonNode node)
    {
        return CodecException.decodingError("Expected " + expected + " " + describe(fieldName)
                + " but found " + node.getNodeType());
    }

    private static String describe(String fieldName)
    {
        return fieldName == null ? "element" : "field '" + fieldName + "'";
    }

    private void reportOpaque(ExpandedNodeId typeId, int length)
    {
        context.observabilitySink().onOpaqueBody(
                new OpaqueBodyEvent(Instant.now(), OpaqueBodyEvent.Kind.UNKNOWN_TYPE, typeId.toString(), "json", length));
    }

    private static final class Frame
    {
        private final JsonNode node;
        private int index;

        private Frame(JsonNode node)
        {
            this.node = node;
        }
    }
}
