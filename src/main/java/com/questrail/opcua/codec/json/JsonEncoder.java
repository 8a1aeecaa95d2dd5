package com.questrail.opcua.codec.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.LimitsGuard;
import com.questrail.opcua.codec.NamespaceScope;
import com.questrail.opcua.codec.NamespaceStack;
import com.questrail.opcua.codec.NamespaceTable;
import com.questrail.opcua.codec.UaEncoder;
import com.questrail.opcua.types.BuiltInType;
import com.questrail.opcua.types.ByteString;
import com.questrail.opcua.types.DataValue;
import com.questrail.opcua.types.DateTime;
import com.questrail.opcua.types.DiagnosticInfo;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.ExtensionObject;
import com.questrail.opcua.types.ExtensionObjectEncoding;
import com.questrail.opcua.types.LocalizedText;
import com.questrail.opcua.types.Matrix;
import com.questrail.opcua.types.NodeId;
import com.questrail.opcua.types.QualifiedName;
import com.questrail.opcua.types.StatusCode;
import com.questrail.opcua.types.StatusCodes;
import com.questrail.opcua.types.UaEnumeration;
import com.questrail.opcua.types.Variant;
import com.questrail.opcua.types.XmlElement;

import java.util.List;
import java.util.UUID;

/**
 * JsonEncoder
 * -----------------------------------------------------------------------------
 * {@link UaEncoder} producing the OPC UA JSON encodings (Part 6 §5.4) as a
 * Jackson tree.
 *
 * <p>One encoder serves all four variants; a {@link JsonEncodingPolicy}
 * decides the shape of each value. Default-value suppression only applies to
 * named structure members: array items and the body of a Variant are always
 * written.</p>
 *
 * <table>
 *   <caption>Shapes per variant</caption>
 *   <tr><th></th><th>Reversible / Verbose</th><th>Compact</th><th>NonReversible</th></tr>
 *   <tr><td>NodeId</td><td>{@code {"IdType","Id","Namespace"}}</td><td>{@code "ns=1;i=5"}</td><td>object, URI namespace</td></tr>
 *   <tr><td>Variant</td><td>{@code {"Type","Body","Dimensions"}}</td><td>{@code {"UaType","Value","Dimensions"}}</td><td>bare value</td></tr>
 *   <tr><td>ExtensionObject</td><td>{@code {"TypeId","Encoding","Body"}}</td><td>{@code {"UaTypeId",fields...}}</td><td>bare body</td></tr>
 * </table>
 */
public final class JsonEncoder implements UaEncoder
{
    static final ObjectMapper MAPPER = new ObjectMapper();

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final UUID EMPTY_GUID = new UUID(0L, 0L);

    private final EncodingContext context;
    private final JsonEncodingPolicy policy;
    private final LimitsGuard guard;
    private final NamespaceStack namespaces = new NamespaceStack();
    private final ObjectNode root = NODES.objectNode();
    private JsonNode current = root;

    public JsonEncoder(EncodingContext context, JsonEncodingPolicy policy)
    {
        this.context = context;
        this.policy = policy;
        this.guard = new LimitsGuard(context.limits());
    }

    public JsonEncodingPolicy policy()
    {
        return policy;
    }

    /**
     * Writes a complete message: the root object is the extension object
     * wrapping {@code value}.
     */
    public void writeMessage(Encodeable value)
    {
        JsonNode message = extensionObjectNode(ExtensionObject.of(value));
        if (message instanceof ObjectNode) {
            root.setAll((ObjectNode) message);
        }
    }

    public ObjectNode toJsonNode()
    {
        return root;
    }

    /**
     * @throws CodecException {@code BadEncodingLimitsExceeded} if the output
     *         exceeds the message size limit
     */
    public byte[] toByteArray()
    {
        try {
            byte[] bytes = MAPPER.writeValueAsBytes(root);
            guard.checkMessageSize(bytes.length);
            return bytes;
        }
        catch (JsonProcessingException e) {
            throw CodecException.encodingError("Cannot serialize JSON document", e);
        }
    }

    @Override
    public EncodingContext context()
    {
        return context;
    }

    @Override
    public void writeBoolean(String fieldName, boolean value)
    {
        if (omit(fieldName, !value, true)) return;
        put(fieldName, NODES.booleanNode(value));
    }

    @Override
    public void writeSByte(String fieldName, byte value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.numberNode(value));
    }

    @Override
    public void writeByte(String fieldName, short value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.numberNode(value));
    }

    @Override
    public void writeInt16(String fieldName, short value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.numberNode(value));
    }

    @Override
    public void writeUInt16(String fieldName, int value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.numberNode(value));
    }

    @Override
    public void writeInt32(String fieldName, int value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.numberNode(value));
    }

    @Override
    public void writeUInt32(String fieldName, long value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.numberNode(value));
    }

    @Override
    public void writeInt64(String fieldName, long value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.textNode(Long.toString(value)));
    }

    @Override
    public void writeUInt64(String fieldName, long value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, NODES.textNode(Long.toUnsignedString(value)));
    }

    @Override
    public void writeFloat(String fieldName, float value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, Float.isNaN(value) || Float.isInfinite(value)
                ? NODES.textNode(specialValue(value))
                : NODES.numberNode(value));
    }

    @Override
    public void writeDouble(String fieldName, double value)
    {
        if (omit(fieldName, value == 0, true)) return;
        put(fieldName, Double.isNaN(value) || Double.isInfinite(value)
                ? NODES.textNode(specialValue(value))
                : NODES.numberNode(value));
    }

    private static String specialValue(double value)
    {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return value > 0 ? "Infinity" : "-Infinity";
    }

    @Override
    public void writeString(String fieldName, String value)
    {
        if (omit(fieldName, value == null, false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        guard.checkStringLength(value.length());
        put(fieldName, NODES.textNode(value));
    }

    @Override
    public void writeDateTime(String fieldName, DateTime value)
    {
        DateTime dateTime = value != null ? value : DateTime.MIN_VALUE;
        if (omit(fieldName, dateTime.isMin(), false)) return;
        put(fieldName, NODES.textNode(dateTime.toIsoString()));
    }

    @Override
    public void writeGuid(String fieldName, UUID value)
    {
        UUID guid = value != null ? value : EMPTY_GUID;
        if (omit(fieldName, guid.equals(EMPTY_GUID), false)) return;
        put(fieldName, NODES.textNode(guid.toString()));
    }

    @Override
    public void writeByteString(String fieldName, ByteString value)
    {
        if (omit(fieldName, value == null, false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        guard.checkByteStringLength(value.length());
        put(fieldName, NODES.textNode(value.toBase64()));
    }

    @Override
    public void writeXmlElement(String fieldName, XmlElement value)
    {
        if (omit(fieldName, value == null, false)) return;
        put(fieldName, value == null ? NODES.nullNode() : NODES.textNode(value.xml()));
    }

    @Override
    public void writeNodeId(String fieldName, NodeId value)
    {
        if (omit(fieldName, value == null || value.isNull(), false)) return;
        put(fieldName, value == null ? NODES.nullNode() : nodeIdNode(value));
    }

    private JsonNode nodeIdNode(NodeId id)
    {
        if (policy.compactIdentifiers()) {
            return NODES.textNode(id.toParseableString());
        }
        ObjectNode node = NODES.objectNode();
        putIdentifier(node, id);
        int index = id.namespaceIndex();
        if (index != 0) {
            String uri = policy.useDisplayStrings() ? context.namespaceTable().uriAt(index) : null;
            node.set("Namespace", uri != null ? NODES.textNode(uri) : NODES.numberNode(index));
        }
        return node;
    }

    private void putIdentifier(ObjectNode node, NodeId id)
    {
        int idType = id.idType().value();
        if (idType != 0) {
            node.put("IdType", idType);
        }
        switch (id.idType()) {
            case NUMERIC -> node.put("Id", (Long) id.identifier());
            case STRING -> node.put("Id", (String) id.identifier());
            case GUID -> node.put("Id", id.identifier().toString());
            case OPAQUE -> node.put("Id", ((ByteString) id.identifier()).toBase64());
        }
    }

    @Override
    public void writeExpandedNodeId(String fieldName, ExpandedNodeId value)
    {
        if (omit(fieldName, value == null || value.isNull(), false)) return;
        put(fieldName, value == null ? NODES.nullNode() : expandedNodeIdNode(value));
    }

    private JsonNode expandedNodeIdNode(ExpandedNodeId id)
    {
        if (policy.compactIdentifiers()) {
            return NODES.textNode(id.toParseableString());
        }
        ObjectNode node = NODES.objectNode();
        putIdentifier(node, id.nodeId());
        if (id.namespaceUri() != null) {
            node.put("Namespace", id.namespaceUri());
        }
        else if (id.namespaceIndex() != 0) {
            String uri = policy.useDisplayStrings() ? context.namespaceTable().uriAt(id.namespaceIndex()) : null;
            node.set("Namespace", uri != null ? NODES.textNode(uri) : NODES.numberNode(id.namespaceIndex()));
        }
        if (id.serverIndex() != 0) {
            String uri = policy.useDisplayStrings() ? context.serverTable().uriAt((int) id.serverIndex()) : null;
            node.set("ServerUri", uri != null ? NODES.textNode(uri) : NODES.numberNode(id.serverIndex()));
        }
        return node;
    }

    @Override
    public void writeStatusCode(String fieldName, StatusCode value)
    {
        StatusCode status = value != null ? value : StatusCode.GOOD;
        if (omit(fieldName, status.value() == StatusCodes.Good, true)) return;
        put(fieldName, statusCodeNode(status));
    }

    private JsonNode statusCodeNode(StatusCode status)
    {
        if (!policy.verboseExtraFields()) {
            return NODES.numberNode(status.value());
        }
        ObjectNode node = NODES.objectNode();
        node.put("Code", status.value());
        status.symbol().ifPresent(symbol -> node.put("Symbol", symbol));
        return node;
    }

    @Override
    public void writeQualifiedName(String fieldName, QualifiedName value)
    {
        if (omit(fieldName, value == null || value.isNull(), false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        if (policy.compactIdentifiers()) {
            put(fieldName, NODES.textNode(value.toParseableString()));
            return;
        }
        ObjectNode node = NODES.objectNode();
        if (value.name() != null) {
            node.put("Name", value.name());
        }
        int index = value.namespaceIndex();
        if (index != 0) {
            String uri = policy.useDisplayStrings() ? context.namespaceTable().uriAt(index) : null;
            node.set("Uri", uri != null ? NODES.textNode(uri) : NODES.numberNode(index));
        }
        put(fieldName, node);
    }

    @Override
    public void writeLocalizedText(String fieldName, LocalizedText value)
    {
        if (omit(fieldName, value == null || value.isNull(), false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        if (policy.useDisplayStrings()) {
            put(fieldName, value.text() == null ? NODES.nullNode() : NODES.textNode(value.text()));
            return;
        }
        ObjectNode node = NODES.objectNode();
        if (value.locale() != null) {
            node.put("Locale", value.locale());
        }
        if (value.text() != null) {
            node.put("Text", value.text());
        }
        put(fieldName, node);
    }

    @Override
    public void writeExtensionObject(String fieldName, ExtensionObject value)
    {
        if (omit(fieldName, value == null || value.isNull(), false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        try (LimitsGuard.Level level = guard.enter("ExtensionObject")) {
            put(fieldName, extensionObjectNode(value));
        }
    }

    private JsonNode extensionObjectNode(ExtensionObject value)
    {
        if (value.encoding() == ExtensionObjectEncoding.ENCODEABLE) {
            Encodeable body = value.decodedBody();
            EncodeableType<?> type = body.encodeableType();
            ObjectNode fields = structureNode(body, type);
            if (!policy.tagAmbiguousValues()) {
                return fields;
            }
            ObjectNode node = NODES.objectNode();
            if (policy.compactIdentifiers()) {
                node.set("UaTypeId", typeIdNode(type.jsonEncodingId()));
                node.setAll(fields);
            }
            else {
                node.set("TypeId", typeIdNode(type.jsonEncodingId()));
                node.set("Body", fields);
            }
            return node;
        }

        JsonNode body;
        int encoding;
        switch (value.encoding()) {
            case BINARY -> {
                body = NODES.textNode(((ByteString) value.body()).toBase64());
                encoding = 1;
            }
            case XML -> {
                body = NODES.textNode(((XmlElement) value.body()).xml());
                encoding = 2;
            }
            case JSON -> {
                body = parseOpaqueJson((String) value.body());
                encoding = 0;
            }
            default -> {
                body = null;
                encoding = 0;
            }
        }
        if (!policy.tagAmbiguousValues()) {
            return body != null ? body : NODES.nullNode();
        }
        ObjectNode node = NODES.objectNode();
        if (policy.compactIdentifiers()) {
            node.set("UaTypeId", typeIdNode(value.typeId()));
            if (encoding != 0) {
                node.put("UaEncoding", encoding);
            }
            if (body instanceof ObjectNode && encoding == 0) {
                node.setAll((ObjectNode) body);
            }
            else if (body != null) {
                node.set("UaBody", body);
            }
        }
        else {
            node.set("TypeId", typeIdNode(value.typeId()));
            if (encoding != 0) {
                node.put("Encoding", encoding);
            }
            if (body != null) {
                node.set("Body", body);
            }
        }
        return node;
    }

    private static JsonNode parseOpaqueJson(String json)
    {
        try {
            return MAPPER.readTree(json);
        }
        catch (JsonProcessingException e) {
            throw CodecException.encodingError("Opaque JSON body is not valid JSON", e);
        }
    }

    /**
     * Type ids travel as NodeIds; a URI already in the namespace table is
     * replaced by its index.
     */
    private JsonNode typeIdNode(ExpandedNodeId typeId)
    {
        NamespaceTable namespaces = context.namespaceTable();
        if (typeId.namespaceUri() == null) {
            return nodeIdNode(typeId.nodeId());
        }
        int index = namespaces.indexOf(typeId.namespaceUri());
        if (index < 0) {
            return expandedNodeIdNode(typeId);
        }
        return nodeIdNode(new NodeId(index, typeId.identifier()));
    }

    @Override
    public void writeDataValue(String fieldName, DataValue value)
    {
        if (omit(fieldName, value == null, false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        ObjectNode node = NODES.objectNode();
        try (LimitsGuard.Level level = guard.enter("DataValue")) {
            within(node, () -> {
                writeVariant("Value", value.value());
                writeStatusCode("StatusCode", value.statusCode());
                writeDateTime("SourceTimestamp", value.sourceTimestamp());
                writeUInt16("SourcePicoseconds", value.sourcePicoseconds());
                writeDateTime("ServerTimestamp", value.serverTimestamp());
                writeUInt16("ServerPicoseconds", value.serverPicoseconds());
            });
        }
        put(fieldName, node);
    }

    @Override
    public void writeVariant(String fieldName, Variant value)
    {
        Variant variant = value != null ? value : Variant.NULL;
        if (omit(fieldName, variant.isNull(), false)) return;
        if (variant.isNull()) {
            put(fieldName, NODES.nullNode());
            return;
        }
        try (LimitsGuard.Level level = guard.enter("Variant")) {
            put(fieldName, variantNode(variant));
        }
    }

    private JsonNode variantNode(Variant variant)
    {
        BuiltInType type = variant.type();
        if (!policy.tagAmbiguousValues()) {
            if (variant.isMatrix()) {
                return nestedArrayNode(type, ((Matrix) variant.value()).toJaggedArray());
            }
            if (variant.isArray()) {
                return arrayNode(type, (Object[]) variant.value());
            }
            return valueNode(type, variant.value());
        }

        String bodyKey = policy.compactIdentifiers() ? "Value" : "Body";
        ObjectNode node = NODES.objectNode();
        node.put(policy.compactIdentifiers() ? "UaType" : "Type", type.id());
        if (variant.isMatrix()) {
            Matrix matrix = (Matrix) variant.value();
            node.set(bodyKey, arrayNode(type, matrix.elements()));
            ArrayNode dimensions = node.putArray("Dimensions");
            for (int dimension : matrix.dimensions()) {
                dimensions.add(dimension);
            }
        }
        else if (variant.isArray()) {
            node.set(bodyKey, arrayNode(type, (Object[]) variant.value()));
        }
        else {
            node.set(bodyKey, valueNode(type, variant.value()));
        }
        return node;
    }

    @Override
    public void writeDiagnosticInfo(String fieldName, DiagnosticInfo value)
    {
        if (omit(fieldName, value == null || value.isNull(), false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        ObjectNode node = NODES.objectNode();
        try (LimitsGuard.Level level = guard.enter("DiagnosticInfo")) {
            if (value.symbolicId() != -1) node.put("SymbolicId", value.symbolicId());
            if (value.namespaceUri() != -1) node.put("NamespaceUri", value.namespaceUri());
            if (value.locale() != -1) node.put("Locale", value.locale());
            if (value.localizedText() != -1) node.put("LocalizedText", value.localizedText());
            if (value.additionalInfo() != null) node.put("AdditionalInfo", value.additionalInfo());
            if (value.innerStatusCode().value() != StatusCodes.Good) {
                node.set("InnerStatusCode", statusCodeNode(value.innerStatusCode()));
            }
            if (value.innerDiagnosticInfo() != null) {
                within(node, () -> writeDiagnosticInfo("InnerDiagnosticInfo", value.innerDiagnosticInfo()));
            }
        }
        put(fieldName, node);
    }

    @Override
    public void writeEnumeration(String fieldName, UaEnumeration value)
    {
        if (value == null) {
            throw CodecException.encodingError("Enumeration field " + fieldName + " is null");
        }
        if (omit(fieldName, value.value() == 0, true)) return;
        put(fieldName, policy.verboseExtraFields()
                ? NODES.textNode(value.name() + "_" + value.value())
                : NODES.numberNode(value.value()));
    }

    @Override
    public void writeEncodeable(String fieldName, Encodeable value, EncodeableType<?> type)
    {
        if (value == null || !type.isInstance(value)) {
            throw CodecException.encodingError("Field " + fieldName + " requires a " + type.name()
                    + " but holds " + value);
        }
        put(fieldName, structureNode(value, type));
    }

    private ObjectNode structureNode(Encodeable value, EncodeableType<?> type)
    {
        ObjectNode node = NODES.objectNode();
        try (LimitsGuard.Level level = guard.enter(type.name());
             NamespaceScope scope = namespaces.push(type.xmlNamespace())) {
            within(node, () -> value.encode(this));
        }
        return node;
    }

    @Override
    public void writeArray(String fieldName, BuiltInType type, Object[] values)
    {
        if (omit(fieldName, values == null, false)) return;
        put(fieldName, values == null ? NODES.nullNode() : arrayNode(type, values));
    }

    private ArrayNode arrayNode(BuiltInType type, Object[] values)
    {
        guard.checkArrayLength(values.length);
        ArrayNode array = NODES.arrayNode(values.length);
        within(array, () -> {
            for (Object item : values) {
                if (item == null && !type.isNullable()) {
                    throw CodecException.encodingError("Null element in array of " + type);
                }
                writeScalar(null, type, item);
            }
        });
        return array;
    }

    private ArrayNode nestedArrayNode(BuiltInType type, Object[] level)
    {
        if (level.length > 0 && level[0] instanceof Object[]) {
            ArrayNode array = NODES.arrayNode(level.length);
            for (Object item : level) {
                array.add(nestedArrayNode(type, (Object[]) item));
            }
            return array;
        }
        return arrayNode(type, level);
    }

    private JsonNode valueNode(BuiltInType type, Object value)
    {
        ArrayNode holder = NODES.arrayNode(1);
        within(holder, () -> writeScalar(null, type, value));
        return holder.get(0);
    }

    @Override
    public void writeEncodeableArray(String fieldName, List<? extends Encodeable> values, EncodeableType<?> type)
    {
        if (omit(fieldName, values == null, false)) return;
        if (values == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        guard.checkArrayLength(values.size());
        ArrayNode array = NODES.arrayNode(values.size());
        within(array, () -> {
            for (Encodeable item : values) {
                writeEncodeable(null, item, type);
            }
        });
        put(fieldName, array);
    }

    @Override
    public void writeMatrix(String fieldName, Matrix value)
    {
        if (omit(fieldName, value == null, false)) return;
        if (value == null) {
            put(fieldName, NODES.nullNode());
            return;
        }
        if (policy.useDisplayStrings()) {
            put(fieldName, nestedArrayNode(value.elementType(), value.toJaggedArray()));
            return;
        }
        ObjectNode node = NODES.objectNode();
        ArrayNode dimensions = node.putArray("Dimensions");
        for (int dimension : value.dimensions()) {
            dimensions.add(dimension);
        }
        node.set("Array", arrayNode(value.elementType(), value.elements()));
        put(fieldName, node);
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
     * True if a named member holding a default value is to be left out.
     * Array items ({@code fieldName == null}) are never left out.
     */
    private boolean omit(String fieldName, boolean isDefault, boolean isNumber)
    {
        if (fieldName == null || !isDefault) {
            return false;
        }
        return isNumber ? !policy.includeDefaultNumberValues() : !policy.includeDefaultValues();
    }

    private void put(String fieldName, JsonNode value)
    {
        if (fieldName == null) {
            if (!(current instanceof ArrayNode)) {
                throw CodecException.encodingError("JSON members need a name");
            }
            ((ArrayNode) current).add(value);
        }
        else {
            if (!(current instanceof ObjectNode)) {
                throw CodecException.encodingError("Named member " + fieldName + " inside a JSON array");
            }
            ((ObjectNode) current).set(fieldName, value);
        }
    }

    private void within(JsonNode container, Runnable body)
    {
        JsonNode saved = current;
        current = container;
        try {
            body.run();
        }
        finally {
            current = saved;
        }
    }
}
