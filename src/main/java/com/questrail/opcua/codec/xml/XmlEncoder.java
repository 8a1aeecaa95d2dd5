package com.questrail.opcua.codec.xml;

import com.questrail.opcua.codec.CodecException;
import com.questrail.opcua.codec.Encodeable;
import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.EncodingContext;
import com.questrail.opcua.codec.LimitsGuard;
import com.questrail.opcua.codec.NamespaceScope;
import com.questrail.opcua.codec.NamespaceStack;
import com.questrail.opcua.codec.UaEncoder;
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
import com.questrail.opcua.types.StatusCodes;
import com.questrail.opcua.types.UaEnumeration;
import com.questrail.opcua.types.Variant;
import com.questrail.opcua.types.XmlElement;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.transform.TransformerException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * XmlEncoder
 * -----------------------------------------------------------------------------
 * {@link UaEncoder} producing the OPC UA XML encoding (Part 6 §5.3) as a DOM
 * tree.
 *
 * <p>Each field becomes an element named after the field, in the namespace on
 * top of the namespace stack; built-in sub-parts ({@code <Identifier>},
 * {@code <Locale>}, {@code <Value>}...) and array items always live in the
 * OPC UA types namespace. Null references are written as empty elements
 * carrying {@code xsi:nil="true"}.</p>
 */
public final class XmlEncoder implements UaEncoder
{
    public static final String MESSAGE_ROOT = "ExtensionObject";

    private final EncodingContext context;
    private final LimitsGuard guard;
    private final NamespaceStack namespaces = new NamespaceStack();
    private final Document document;
    private Element current;

    public XmlEncoder(EncodingContext context)
    {
        this(context, MESSAGE_ROOT);
    }

    public XmlEncoder(EncodingContext context, String rootName)
    {
        this.context = context;
        this.guard = new LimitsGuard(context.limits());
        this.document = XmlSupport.newDocument();
        Element root = document.createElementNS(XmlSupport.TYPES_NS, rootName);
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:xsi", XmlSupport.XSI_NS);
        document.appendChild(root);
        this.current = root;
    }

    /**
     * Writes a complete message: the root element holds the type id and the
     * body of {@code value}, like any extension object.
     */
    public void writeMessage(Encodeable value)
    {
        writeExtensionObjectContent(ExtensionObject.of(value));
    }

    public Document document()
    {
        return document;
    }

    /**
     * @throws CodecException {@code BadEncodingLimitsExceeded} if the output
     *         exceeds the message size limit
     */
    public byte[] toByteArray()
    {
        try {
            byte[] bytes = XmlSupport.serialize(document);
            guard.checkMessageSize(bytes.length);
            return bytes;
        }
        catch (TransformerException e) {
            throw CodecException.encodingError("Cannot serialize XML document", e);
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
        text(fieldName, value ? "true" : "false");
    }

    @Override
    public void writeSByte(String fieldName, byte value)
    {
        text(fieldName, Byte.toString(value));
    }

    @Override
    public void writeByte(String fieldName, short value)
    {
        text(fieldName, Short.toString(value));
    }

    @Override
    public void writeInt16(String fieldName, short value)
    {
        text(fieldName, Short.toString(value));
    }

    @Override
    public void writeUInt16(String fieldName, int value)
    {
        text(fieldName, Integer.toString(value));
    }

    @Override
    public void writeInt32(String fieldName, int value)
    {
        text(fieldName, Integer.toString(value));
    }

    @Override
    public void writeUInt32(String fieldName, long value)
    {
        text(fieldName, Long.toString(value));
    }

    @Override
    public void writeInt64(String fieldName, long value)
    {
        text(fieldName, Long.toString(value));
    }

    @Override
    public void writeUInt64(String fieldName, long value)
    {
        text(fieldName, Long.toUnsignedString(value));
    }

    @Override
    public void writeFloat(String fieldName, float value)
    {
        text(fieldName, Float.isNaN(value) || Float.isInfinite(value)
                ? specialValue(value)
                : Float.toString(value));
    }

    @Override
    public void writeDouble(String fieldName, double value)
    {
        text(fieldName, Double.isNaN(value) || Double.isInfinite(value)
                ? specialValue(value)
                : Double.toString(value));
    }

    private static String specialValue(double value)
    {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return value > 0 ? "INF" : "-INF";
    }

    @Override
    public void writeString(String fieldName, String value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        guard.checkStringLength(value.length());
        text(fieldName, value);
    }

    @Override
    public void writeDateTime(String fieldName, DateTime value)
    {
        text(fieldName, (value != null ? value : DateTime.MIN_VALUE).toIsoString());
    }

    @Override
    public void writeGuid(String fieldName, UUID value)
    {
        Element element = field(fieldName);
        child(element, "String").setTextContent((value != null ? value : new UUID(0L, 0L)).toString());
    }

    @Override
    public void writeByteString(String fieldName, ByteString value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        guard.checkByteStringLength(value.length());
        text(fieldName, value.toBase64());
    }

    @Override
    public void writeXmlElement(String fieldName, XmlElement value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        guard.checkStringLength(value.xml().length());
        field(fieldName).appendChild(importFragment(value));
    }

    private Element importFragment(XmlElement value)
    {
        try {
            return (Element) document.importNode(
                    XmlSupport.parseFragment(value.xml(), XmlSupport.elementDepth(context.limits())), true);
        }
        catch (SAXException e) {
            if (XmlSupport.isDepthLimit(e)) {
                throw CodecException.limitsExceeded("XmlElement nests too deeply", e);
            }
            throw CodecException.encodingError("XmlElement is not well-formed XML", e);
        }
        catch (IOException e) {
            throw CodecException.encodingError("XmlElement is not well-formed XML", e);
        }
    }

    @Override
    public void writeNodeId(String fieldName, NodeId value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        child(element, "Identifier").setTextContent(XmlSupport.nodeIdText(value, context.namespaceTable()));
    }

    @Override
    public void writeExpandedNodeId(String fieldName, ExpandedNodeId value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        child(element, "Identifier").setTextContent(value.toParseableString());
    }

    @Override
    public void writeStatusCode(String fieldName, StatusCode value)
    {
        Element element = field(fieldName);
        long code = value != null ? value.value() : StatusCodes.Good;
        child(element, "Code").setTextContent(Long.toString(code));
    }

    @Override
    public void writeQualifiedName(String fieldName, QualifiedName value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        int index = value.namespaceIndex();
        if (index != 0) {
            String uri = context.namespaceTable().uriAt(index);
            if (uri != null) {
                child(element, "NamespaceUri").setTextContent(uri);
            }
            else {
                child(element, "NamespaceIndex").setTextContent(Integer.toString(index));
            }
        }
        if (value.name() != null) {
            child(element, "Name").setTextContent(value.name());
        }
    }

    @Override
    public void writeLocalizedText(String fieldName, LocalizedText value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        if (value.locale() != null) {
            child(element, "Locale").setTextContent(value.locale());
        }
        if (value.text() != null) {
            child(element, "Text").setTextContent(value.text());
        }
    }

    @Override
    public void writeExtensionObject(String fieldName, ExtensionObject value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        try (LimitsGuard.Level level = guard.enter("ExtensionObject")) {
            within(element, () -> writeExtensionObjectContent(value));
        }
    }

    private void writeExtensionObjectContent(ExtensionObject value)
    {
        try (NamespaceScope scope = namespaces.push(XmlSupport.TYPES_NS)) {
            switch (value.encoding()) {
                case NONE -> {
                    if (!value.typeId().isNull()) {
                        writeTypeId(value.typeId());
                    }
                }
                case BINARY -> {
                    writeTypeId(value.typeId());
                    Element body = child(current, "Body");
                    within(body, () -> writeByteString("ByteString", (ByteString) value.body()));
                }
                case XML -> {
                    writeTypeId(value.typeId());
                    child(current, "Body").appendChild(importFragment((XmlElement) value.body()));
                }
                case JSON -> throw CodecException.encodingError(
                        "ExtensionObject " + value.typeId() + " holds a JSON body, which has no XML form");
                case ENCODEABLE -> {
                    Encodeable body = value.decodedBody();
                    EncodeableType<?> type = body.encodeableType();
                    writeTypeId(type.xmlEncodingId());
                    Element bodyElement = child(current, "Body");
                    try (NamespaceScope typeScope = namespaces.push(type.xmlNamespace())) {
                        within(bodyElement, () -> writeEncodeable(type.name(), body, type));
                    }
                }
            }
        }
    }

    private void writeTypeId(ExpandedNodeId typeId)
    {
        Element typeIdElement = child(current, "TypeId");
        child(typeIdElement, "Identifier").setTextContent(XmlSupport.typeIdText(typeId, context.namespaceTable()));
    }

    @Override
    public void writeDataValue(String fieldName, DataValue value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        try (LimitsGuard.Level level = guard.enter("DataValue");
             NamespaceScope scope = namespaces.push(XmlSupport.TYPES_NS)) {
            within(element, () -> {
                if (value.hasValue()) writeVariant("Value", value.value());
                if (value.hasStatusCode()) writeStatusCode("StatusCode", value.statusCode());
                if (value.hasSourceTimestamp()) writeDateTime("SourceTimestamp", value.sourceTimestamp());
                if (value.sourcePicoseconds() != 0) writeUInt16("SourcePicoseconds", value.sourcePicoseconds());
                if (value.hasServerTimestamp()) writeDateTime("ServerTimestamp", value.serverTimestamp());
                if (value.serverPicoseconds() != 0) writeUInt16("ServerPicoseconds", value.serverPicoseconds());
            });
        }
    }

    @Override
    public void writeVariant(String fieldName, Variant value)
    {
        Variant variant = value != null ? value : Variant.NULL;
        Element element = field(fieldName);
        if (variant.isNull()) {
            return;
        }
        try (LimitsGuard.Level level = guard.enter("Variant");
             NamespaceScope scope = namespaces.push(XmlSupport.TYPES_NS)) {
            BuiltInType type = variant.type();
            Element valueElement = child(element, "Value");
            within(valueElement, () -> {
                if (variant.isMatrix()) {
                    Matrix matrix = (Matrix) variant.value();
                    Element matrixElement = child(current, "Matrix");
                    within(matrixElement, () -> writeMatrixContent(matrix));
                }
                else if (variant.isArray()) {
                    writeArray("ListOf" + type.xmlName(), type, (Object[]) variant.value());
                }
                else {
                    writeScalar(type.xmlName(), type, variant.value());
                }
            });
        }
    }

    @Override
    public void writeDiagnosticInfo(String fieldName, DiagnosticInfo value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        try (LimitsGuard.Level level = guard.enter("DiagnosticInfo");
             NamespaceScope scope = namespaces.push(XmlSupport.TYPES_NS)) {
            within(element, () -> {
                if (value.symbolicId() != -1) writeInt32("SymbolicId", value.symbolicId());
                if (value.namespaceUri() != -1) writeInt32("NamespaceUri", value.namespaceUri());
                if (value.locale() != -1) writeInt32("Locale", value.locale());
                if (value.localizedText() != -1) writeInt32("LocalizedText", value.localizedText());
                if (value.additionalInfo() != null) writeString("AdditionalInfo", value.additionalInfo());
                if (value.innerStatusCode().value() != StatusCodes.Good) {
                    writeStatusCode("InnerStatusCode", value.innerStatusCode());
                }
                if (value.innerDiagnosticInfo() != null) {
                    writeDiagnosticInfo("InnerDiagnosticInfo", value.innerDiagnosticInfo());
                }
            });
        }
    }

    @Override
    public void writeEnumeration(String fieldName, UaEnumeration value)
    {
        if (value == null) {
            throw CodecException.encodingError("Enumeration field " + fieldName + " is null");
        }
        text(fieldName, value.name() + "_" + value.value());
    }

    @Override
    public void writeEncodeable(String fieldName, Encodeable value, EncodeableType<?> type)
    {
        if (value == null || !type.isInstance(value)) {
            throw CodecException.encodingError("Field " + fieldName + " requires a " + type.name()
                    + " but holds " + value);
        }
        Element element = field(fieldName);
        try (LimitsGuard.Level level = guard.enter(type.name());
             NamespaceScope scope = namespaces.push(type.xmlNamespace())) {
            within(element, () -> value.encode(this));
        }
    }

    @Override
    public void writeArray(String fieldName, BuiltInType type, Object[] values)
    {
        if (values == null) {
            nil(fieldName);
            return;
        }
        guard.checkArrayLength(values.length);
        Element element = field(fieldName);
        try (NamespaceScope scope = namespaces.push(XmlSupport.TYPES_NS)) {
            within(element, () -> {
                for (Object item : values) {
                    if (item == null && !type.isNullable()) {
                        throw CodecException.encodingError("Null element in array of " + type);
                    }
                    writeScalar(type.xmlName(), type, item);
                }
            });
        }
    }

    @Override
    public void writeEncodeableArray(String fieldName, List<? extends Encodeable> values, EncodeableType<?> type)
    {
        if (values == null) {
            nil(fieldName);
            return;
        }
        guard.checkArrayLength(values.size());
        Element element = field(fieldName);
        try (NamespaceScope scope = namespaces.push(type.xmlNamespace())) {
            within(element, () -> {
                for (Encodeable item : values) {
                    writeEncodeable(type.name(), item, type);
                }
            });
        }
    }

    @Override
    public void writeMatrix(String fieldName, Matrix value)
    {
        if (value == null) {
            nil(fieldName);
            return;
        }
        Element element = field(fieldName);
        try (NamespaceScope scope = namespaces.push(XmlSupport.TYPES_NS)) {
            within(element, () -> writeMatrixContent(value));
        }
    }

    private void writeMatrixContent(Matrix matrix)
    {
        Object[] dimensions = Arrays.stream(matrix.dimensions()).boxed().toArray();
        writeArray("Dimensions", BuiltInType.INT32, dimensions);
        writeArray("Elements", matrix.elementType(), matrix.elements());
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

    private Element field(String fieldName)
    {
        if (fieldName == null) {
            throw CodecException.encodingError("XML fields need a name");
        }
        Element element = document.createElementNS(namespaces.current(XmlSupport.TYPES_NS), fieldName);
        current.appendChild(element);
        return element;
    }

    private Element child(Element parent, String name)
    {
        Element element = document.createElementNS(XmlSupport.TYPES_NS, name);
        parent.appendChild(element);
        return element;
    }

    private void text(String fieldName, String text)
    {
        field(fieldName).setTextContent(text);
    }

    private void nil(String fieldName)
    {
        field(fieldName).setAttributeNS(XmlSupport.XSI_NS, "xsi:nil", "true");
    }

    private void within(Element parent, Runnable body)
    {
        Element saved = current;
        current = parent;
        try {
            body.run();
        }
        finally {
            current = saved;
        }
    }
}
