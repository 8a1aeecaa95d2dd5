package com.questrail.opcua.codec.xml;

import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.LimitsGuard;
import com.questrail.opcua.codec.NamespaceScope;
import com.questrail.opcua.codec.NamespaceStack;
import com.questrail.opcua.codec.UaDecoder;
import com.questrail.opcua.observability.OpaqueBodyEvent;
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
import com.questrail.opcua.types.UaEnumeration;
import com.questrail.opcua.types.Variant;
import com.questrail.opcua.types.XmlElement;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.transform.TransformerException;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * XmlDecoder
 * -----------------------------------------------------------------------------
 * {@link UaDecoder} reading the OPC UA XML encoding.
 *
 * <p>Fields are located with a forward-only cursor over the children of the
 * element being decoded:</p>
 * <ul>
 *   <li>fields must appear in declaration order</li>
 *   <li>unknown elements between fields are skipped</li>
 *   <li>a structure field that cannot be found fails with
 *       {@code BadDecodingError}</li>
 *   <li>optional parts of built-in types (a missing {@code <Locale>},
 *       {@code <StatusCode>}...) take their default</li>
 * </ul>
 *
 * <p>Elements are matched by local name; their namespace is not checked.</p>
 */
public final class XmlDecoder implements UaDecoder
{
    private final EncodingContext context;
    private final LimitsGuard guard;
    private final NamespaceStack namespaces = new NamespaceStack();
    private final Element root;
    private final Deque<Cursor> cursors = new ArrayDeque<>();

    public XmlDecoder(byte[] bytes, EncodingContext context)
    {
        this.context = context;
        this.guard = new LimitsGuard(context.limits());
        guard.checkMessageSize(bytes.length);
        try {
            Document document = XmlSupport.parse(bytes, XmlSupport.elementDepth(context.limits()));
            this.root = document.getDocumentElement();
        }
        catch (SAXException e) {
            if (XmlSupport.isDepthLimit(e)) {
                throw CodecException.limitsExceeded("XML nests too deeply: " + e.getMessage(), e);
            }
            throw CodecException.decodingError("Malformed XML: " + e.getMessage(), e);
        }
        catch (IOException e) {
            throw CodecException.decodingError("Malformed XML: " + e.getMessage(), e);
        }
        cursors.push(new Cursor(root));
    }

    /**
     * Reads a complete message: the root {@code <ExtensionObject>} must hold a
     * registered type.
     *
     * @param expected the type the caller requires, or {@code null} for any
     *                 registered type
     */
    public Encodeable readMessage(EncodeableType<?> expected)
    {
        if (!XmlEncoder.MESSAGE_ROOT.equals(root.getLocalName())) {
            throw CodecException.decodingError("Message root must be <ExtensionObject>, found <"
                    + root.getLocalName() + ">");
        }
        ExtensionObject message = readExtensionObjectContent(root);
        if (!message.isDecoded()) {
            throw CodecException.decodingError("Unknown message type " + message.typeId());
        }
        Encodeable value = message.decodedBody();
        if (expected != null && !expected.equals(value.encodeableType())) {
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
        String text = text(field(fieldName)).trim();
        switch (text) {
            case "true":
            case "1":
                return true;
            case "false":
            case "0":
                return false;
            default:
                throw CodecException.decodingError("Invalid Boolean in <" + fieldName + ">: " + text);
        }
    }

    @Override
    public byte readSByte(String fieldName)
    {
        return (byte) parseLong(fieldName, Byte.MIN_VALUE, Byte.MAX_VALUE);
    }

    @Override
    public short readByte(String fieldName)
    {
        return (short) parseLong(fieldName, 0, 0xFF);
    }

    @Override
    public short readInt16(String fieldName)
    {
        return (short) parseLong(fieldName, Short.MIN_VALUE, Short.MAX_VALUE);
    }

    @Override
    public int readUInt16(String fieldName)
    {
        return (int) parseLong(fieldName, 0, 0xFFFF);
    }

    @Override
    public int readInt32(String fieldName)
    {
        return (int) parseLong(fieldName, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    @Override
    public long readUInt32(String fieldName)
    {
        return parseLong(fieldName, 0, 0xFFFF_FFFFL);
    }

    @Override
    public long readInt64(String fieldName)
    {
        return parseLong(fieldName, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    @Override
    public long readUInt64(String fieldName)
    {
        String text = text(field(fieldName)).trim();
        try {
            return Long.parseUnsignedLong(text);
        }
        catch (NumberFormatException e) {
            throw CodecException.decodingError("Invalid UInt64 in <" + fieldName + ">: " + text, e);
        }
    }

    @Override
    public float readFloat(String fieldName)
    {
        return (float) parseDouble(fieldName);
    }

    @Override
    public double readDouble(String fieldName)
    {
        return parseDouble(fieldName);
    }

    @Override
    public String readString(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        return text(element);
    }

    @Override
    public DateTime readDateTime(String fieldName)
    {
        return parseDateTime(field(fieldName));
    }

    @Override
    public UUID readGuid(String fieldName)
    {
        Element element = field(fieldName);
        Element string = XmlSupport.firstChild(element, "String");
        String text = text(string != null ? string : element).trim();
        try {
            return UUID.fromString(text);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid Guid in <" + fieldName + ">: " + text, e);
        }
    }

    @Override
    public ByteString readByteString(String fieldName)
    {
        Element element = field(fieldName);
        return XmlSupport.isNil(element) ? null : parseByteString(element);
    }

    @Override
    public XmlElement readXmlElement(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        Element content = XmlSupport.firstChildElement(element);
        return content == null ? null : XmlElement.of(serialize(content));
    }

    @Override
    public NodeId readNodeId(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        Element identifier = XmlSupport.firstChild(element, "Identifier");
        return identifier == null ? NodeId.NULL : parseNodeId(identifier);
    }

    @Override
    public ExpandedNodeId readExpandedNodeId(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        Element identifier = XmlSupport.firstChild(element, "Identifier");
        if (identifier == null) {
            return ExpandedNodeId.NULL;
        }
        String text = text(identifier).trim();
        try {
            return ExpandedNodeId.parse(text);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid ExpandedNodeId: " + text, e);
        }
    }

    @Override
    public StatusCode readStatusCode(String fieldName)
    {
        return parseStatusCode(field(fieldName));
    }

    @Override
    public QualifiedName readQualifiedName(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        return within(element, () -> {
            int namespaceIndex = 0;
            Element uri = optionalField("NamespaceUri");
            if (uri != null) {
                namespaceIndex = context.namespaceTable().getOrAppend(text(uri).trim());
            }
            else if (peek("NamespaceIndex")) {
                namespaceIndex = readUInt16("NamespaceIndex");
            }
            Element name = optionalField("Name");
            return new QualifiedName(namespaceIndex, name == null ? null : text(name));
        });
    }

    @Override
    public LocalizedText readLocalizedText(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        return within(element, () -> {
            Element locale = optionalField("Locale");
            Element text = optionalField("Text");
            return new LocalizedText(locale == null ? null : text(locale), text == null ? null : text(text));
        });
    }

    @Override
    public ExtensionObject readExtensionObject(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        try (LimitsGuard.Level level = guard.enter("ExtensionObject")) {
            return readExtensionObjectContent(element);
        }
    }

    private ExtensionObject readExtensionObjectContent(Element element)
    {
        return within(element, () -> {
            ExpandedNodeId typeId = ExpandedNodeId.NULL;
            Element typeIdElement = optionalField("TypeId");
            if (typeIdElement != null) {
                Element identifier = XmlSupport.firstChild(typeIdElement, "Identifier");
                if (identifier != null) {
                    typeId = ExpandedNodeId.of(parseNodeId(identifier));
                }
            }
            Element body = optionalField("Body");
            Element content = body == null ? null : XmlSupport.firstChildElement(body);
            if (content == null) {
                return new ExtensionObject(typeId, ExtensionObjectEncoding.NONE, null);
            }

            Optional<EncodeableType<?>> type = context.factory().resolve(typeId, context.namespaceTable());
            if (type.isPresent()) {
                EncodeableType<?> resolved = type.get();
                Encodeable value = within(body, () -> readEncodeable(resolved.name(), resolved));
                return ExtensionObject.of(value);
            }

            final ExpandedNodeId unknownType = typeId;
            if ("ByteString".equals(content.getLocalName()) && XmlSupport.TYPES_NS.equals(content.getNamespaceURI())) {
                ByteString bytes = parseByteString(content);
                reportOpaque(unknownType, bytes == null ? 0 : bytes.length());
                return ExtensionObject.binary(unknownType, bytes == null ? ByteString.EMPTY : bytes);
            }
            String xml = serialize(content);
            reportOpaque(unknownType, xml.length());
            return ExtensionObject.xml(unknownType, XmlElement.of(xml));
        });
    }

    @Override
    public DataValue readDataValue(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        try (LimitsGuard.Level level = guard.enter("DataValue")) {
            return within(element, () -> {
                Variant value = peek("Value") ? readVariant("Value") : null;
                StatusCode statusCode = peek("StatusCode") ? readStatusCode("StatusCode") : null;
                DateTime sourceTimestamp = peek("SourceTimestamp") ? readDateTime("SourceTimestamp") : null;
                int sourcePicoseconds = peek("SourcePicoseconds") ? readUInt16("SourcePicoseconds") : 0;
                DateTime serverTimestamp = peek("ServerTimestamp") ? readDateTime("ServerTimestamp") : null;
                int serverPicoseconds = peek("ServerPicoseconds") ? readUInt16("ServerPicoseconds") : 0;
                return new DataValue(value, statusCode, sourceTimestamp, sourcePicoseconds,
                        serverTimestamp, serverPicoseconds);
            });
        }
    }

    @Override
    public Variant readVariant(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return Variant.NULL;
        }
        Element valueElement = XmlSupport.firstChild(element, "Value");
        Element content = valueElement == null ? null : XmlSupport.firstChildElement(valueElement);
        if (content == null) {
            return Variant.NULL;
        }
        try (LimitsGuard.Level level = guard.enter("Variant")) {
            String name = content.getLocalName();
            if ("Matrix".equals(name)) {
                Matrix matrix = within(valueElement, () -> readMatrix("Matrix", null));
                return matrix == null ? Variant.NULL : Variant.ofMatrix(matrix);
            }
            if (name.startsWith("ListOf")) {
                BuiltInType type = variantType(name.substring("ListOf".length()));
                Object[] elements = within(valueElement, () -> readArray(name, type));
                return Variant.ofArray(type, elements == null ? new Object[0] : elements);
            }
            BuiltInType type = variantType(name);
            if (type == BuiltInType.VARIANT) {
                throw CodecException.decodingError("A Variant cannot hold a scalar Variant");
            }
            Object value = within(valueElement, () -> readScalar(name, type));
            return value == null ? Variant.NULL : Variant.of(type, value);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid Variant in <" + fieldName + ">: " + e.getMessage(), e);
        }
    }

    private static BuiltInType variantType(String xmlName)
    {
        return BuiltInType.fromXmlName(xmlName)
                .filter(type -> type != BuiltInType.NULL)
                .orElseThrow(() -> CodecException.decodingError("Unknown Variant type <" + xmlName + ">"));
    }

    @Override
    public DiagnosticInfo readDiagnosticInfo(String fieldName)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        try (LimitsGuard.Level level = guard.enter("DiagnosticInfo")) {
            return within(element, () -> {
                int symbolicId = peek("SymbolicId") ? readInt32("SymbolicId") : -1;
                int namespaceUri = peek("NamespaceUri") ? readInt32("NamespaceUri") : -1;
                int locale = peek("Locale") ? readInt32("Locale") : -1;
                int localizedText = peek("LocalizedText") ? readInt32("LocalizedText") : -1;
                String additionalInfo = peek("AdditionalInfo") ? readString("AdditionalInfo") : null;
                StatusCode innerStatusCode = peek("InnerStatusCode") ? readStatusCode("InnerStatusCode") : null;
                DiagnosticInfo inner = peek("InnerDiagnosticInfo") ? readDiagnosticInfo("InnerDiagnosticInfo") : null;
                return new DiagnosticInfo(symbolicId, namespaceUri, locale, localizedText,
                        additionalInfo, innerStatusCode, inner);
            });
        }
    }

    @Override
    public <E extends Enum<E> & UaEnumeration> E readEnumeration(String fieldName, Class<E> enumType)
    {
        String text = text(field(fieldName)).trim();
        String number = text.substring(text.lastIndexOf('_') + 1);
        try {
            return UaDecoder.enumerationConstant(enumType, Integer.parseInt(number));
        }
        catch (NumberFormatException e) {
            throw CodecException.decodingError("Invalid enumeration in <" + fieldName + ">: " + text, e);
        }
    }

    @Override
    public <T extends Encodeable> T readEncodeable(String fieldName, EncodeableType<T> type)
    {
        Element element = field(fieldName);
        try (LimitsGuard.Level level = guard.enter(type.name());
             NamespaceScope scope = namespaces.push(type.xmlNamespace())) {
            return within(element, () -> type.decode(this));
        }
    }

    @Override
    public Object[] readArray(String fieldName, BuiltInType type)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        String itemName = type.xmlName();
        int count = XmlSupport.countChildren(element, itemName);
        guard.checkArrayLength(count);
        return within(element, () -> {
            Object[] items = new Object[count];
            for (int i = 0; i < count; i++) {
                items[i] = readScalar(itemName, type);
            }
            return items;
        });
    }

    @Override
    public <T extends Encodeable> List<T> readEncodeableArray(String fieldName, EncodeableType<T> type)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        int count = XmlSupport.countChildren(element, type.name());
        guard.checkArrayLength(count);
        return within(element, () -> {
            List<T> items = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                items.add(readEncodeable(type.name(), type));
            }
            return items;
        });
    }

    /**
     * @param type element type, or {@code null} to take it from the first element
     */
    @Override
    public Matrix readMatrix(String fieldName, BuiltInType type)
    {
        Element element = field(fieldName);
        if (XmlSupport.isNil(element)) {
            return null;
        }
        return within(element, () -> {
            Object[] dimensionItems = readArray("Dimensions", BuiltInType.INT32);
            BuiltInType elementType = type;
            if (elementType == null) {
                Element elements = XmlSupport.firstChild(element, "Elements");
                Element first = elements == null ? null : XmlSupport.firstChildElement(elements);
                if (first == null) {
                    throw CodecException.decodingError("Matrix without elements");
                }
                elementType = variantType(first.getLocalName());
            }
            Object[] elements = readArray("Elements", elementType);
            if (dimensionItems == null || elements == null) {
                throw CodecException.decodingError("Matrix requires Dimensions and Elements");
            }
            int[] dimensions = new int[dimensionItems.length];
            long product = 1;
            for (int i = 0; i < dimensions.length; i++) {
                dimensions[i] = (Integer) dimensionItems[i];
                if (dimensions[i] <= 0) {
                    throw CodecException.decodingError("Non-positive matrix dimension " + dimensions[i]);
                }
                product *= dimensions[i];
                if (product > Integer.MAX_VALUE) {
                    throw CodecException.decodingError("Matrix dimensions overflow");
                }
            }
            if (dimensions.length < 2 || product != elements.length) {
                throw CodecException.decodingError("Matrix dimensions do not match its " + elements.length + " elements");
            }
            try {
                return new Matrix(elementType, elements, dimensions);
            }
            catch (IllegalArgumentException e) {
                throw CodecException.decodingError("Invalid Matrix: " + e.getMessage(), e);
            }
        });
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

    // ---------------------------------------------------------------------
    // cursor

    private Element field(String fieldName)
    {
        Element element = cursors.peek().next(fieldName);
        if (element == null) {
            throw CodecException.decodingError("Missing element <" + fieldName + "> in <"
                    + cursors.peek().parent.getLocalName() + ">");
        }
        return element;
    }

    private Element optionalField(String fieldName)
    {
        return cursors.peek().next(fieldName);
    }

    private boolean peek(String fieldName)
    {
        return cursors.peek().find(fieldName) != null;
    }

    private <R> R within(Element parent, Supplier<R> body)
    {
        cursors.push(new Cursor(parent));
        try {
            return body.get();
        }
        finally {
            cursors.pop();
        }
    }

    /**
     * Forward-only position among the child elements of one parent.
     */
    private static final class Cursor
    {
        private final Element parent;
        private Node position;

        Cursor(Element parent)
        {
            this.parent = parent;
            this.position = parent.getFirstChild();
        }

        Element find(String localName)
        {
            for (Node node = position; node != null; node = node.getNextSibling()) {
                if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                    return (Element) node;
                }
            }
            return null;
        }

        Element next(String localName)
        {
            Element found = find(localName);
            if (found != null) {
                position = found.getNextSibling();
            }
            return found;
        }
    }

    // ---------------------------------------------------------------------
    // value parsing

    /**
     * Character content of a leaf element. Child elements are not allowed.
     */
    private String text(Element element)
    {
        StringBuilder text = new StringBuilder();
        for (Node node = element.getFirstChild(); node != null; node = node.getNextSibling()) {
            switch (node.getNodeType()) {
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    text.append(node.getNodeValue());
                    guard.checkStringLength(text.length());
                    break;
                case Node.ELEMENT_NODE:
                    throw CodecException.decodingError("Unexpected element <" + node.getLocalName()
                            + "> inside <" + element.getLocalName() + ">");
                default:
                    break;
            }
        }
        return text.toString();
    }

    private long parseLong(String fieldName, long min, long max)
    {
        String text = text(field(fieldName)).trim();
        try {
            long value = Long.parseLong(text);
            if (value < min || value > max) {
                throw CodecException.decodingError("Value out of range in <" + fieldName + ">: " + text);
            }
            return value;
        }
        catch (NumberFormatException e) {
            throw CodecException.decodingError("Invalid integer in <" + fieldName + ">: " + text, e);
        }
    }

    private double parseDouble(String fieldName)
    {
        String text = text(field(fieldName)).trim();
        switch (text) {
            case "NaN":
                return Double.NaN;
            case "INF":
                return Double.POSITIVE_INFINITY;
            case "-INF":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(text);
                }
                catch (NumberFormatException e) {
                    throw CodecException.decodingError("Invalid number in <" + fieldName + ">: " + text, e);
                }
        }
    }

    private DateTime parseDateTime(Element element)
    {
        String text = text(element).trim();
        try {
            return DateTime.parse(text);
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid DateTime: " + text, e);
        }
    }

    private ByteString parseByteString(Element element)
    {
        String text = text(element).replaceAll("\\s", "");
        guard.checkByteStringLength(text.length() / 4L * 3);
        try {
            return ByteString.of(Base64.getDecoder().decode(text));
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid base64 ByteString", e);
        }
    }

    private NodeId parseNodeId(Element identifier)
    {
        String text = text(identifier);
        try {
            return XmlSupport.parseNodeId(text, context.namespaceTable());
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid NodeId: " + text, e);
        }
    }

    private StatusCode parseStatusCode(Element element)
    {
        Element code = XmlSupport.firstChild(element, "Code");
        if (code == null) {
            return StatusCode.GOOD;
        }
        String text = text(code).trim();
        try {
            return StatusCode.of(Long.parseLong(text));
        }
        catch (IllegalArgumentException e) {
            throw CodecException.decodingError("Invalid StatusCode: " + text, e);
        }
    }

    private String serialize(Element element)
    {
        try {
            return XmlSupport.serializeFragment(element);
        }
        catch (TransformerException e) {
            throw CodecException.decodingError("Cannot serialize XML body", e);
        }
    }

    private void reportOpaque(ExpandedNodeId typeId, int length)
    {
        context.observabilitySink().onOpaqueBody(new OpaqueBodyEvent(
                Instant.now(), OpaqueBodyEvent.Kind.UNKNOWN_TYPE, typeId.toString(), "xml", length));
    }
}
