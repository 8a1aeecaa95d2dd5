package com.questrail.opcua.codec.xml;

import com.questrail.opcua.codec.EncodeableType;
import com.questrail.opcua.codec.NamespaceTable;
import com.questrail.opcua.config.EncodingLimits;
import com.questrail.opcua.types.ExpandedNodeId;
import com.questrail.opcua.types.NodeId;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * DOM plumbing shared by {@link XmlEncoder} and {@link XmlDecoder}.
 *
 * <p>Parsers are namespace aware, run with secure processing, reject
 * DOCTYPE declarations and never resolve external entities. Element depth is
 * bounded while parsing, because the DOM serializer walks the tree
 * recursively.</p>
 */
final class XmlSupport
{
    static final String TYPES_NS = EncodeableType.TYPES_NAMESPACE;
    static final String XSI_NS = XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;

    /**
     * Element depth allowed when nesting levels are unlimited.
     */
    static final int MAX_ELEMENT_DEPTH = 4096;

    private static final String MAX_ELEMENT_DEPTH_PROPERTY =
            "http://www.oracle.com/xml/jaxp/properties/maxElementDepth";

    private static final DocumentBuilderFactory BUILDER_FACTORY = newBuilderFactory(MAX_ELEMENT_DEPTH);
    private static final Map<Integer, DocumentBuilderFactory> PARSER_FACTORIES = new ConcurrentHashMap<>();
    private static final TransformerFactory TRANSFORMER_FACTORY = newTransformerFactory();

    /**
     * Fails on every parser diagnostic instead of printing it to stderr.
     */
    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler()
    {
        @Override
        public void warning(SAXParseException exception) throws SAXException
        {
            throw exception;
        }

        @Override
        public void error(SAXParseException exception) throws SAXException
        {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException
        {
            throw exception;
        }
    };

    private XmlSupport() {}

    /**
     * Element depth for the given limits: each nesting level costs up to four
     * elements (field, ExtensionObject, Body, Value).
     */
    static int elementDepth(EncodingLimits limits)
    {
        if (limits.maxNestingLevels() == 0) {
            return MAX_ELEMENT_DEPTH;
        }
        return (int) Math.min(MAX_ELEMENT_DEPTH, (long) limits.maxNestingLevels() * 4 + 8);
    }

    /**
     * True if the parser gave up because the document nests deeper than
     * allowed.
     */
    static boolean isDepthLimit(SAXException e)
    {
        String message = e.getMessage();
        return message != null && (message.contains("maxElementDepth") || message.contains("JAXP00010006"));
    }

    private static DocumentBuilderFactory newBuilderFactory(int maxElementDepth)
    {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setAttribute(MAX_ELEMENT_DEPTH_PROPERTY, maxElementDepth);
        }
        catch (ParserConfigurationException | IllegalArgumentException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        return factory;
    }

    private static TransformerFactory newTransformerFactory()
    {
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        return factory;
    }

    private static DocumentBuilder newBuilder()
    {
        return newBuilder(BUILDER_FACTORY);
    }

    private static DocumentBuilder newBuilder(DocumentBuilderFactory factory)
    {
        try {
            // DocumentBuilderFactory is not thread safe
            synchronized (factory) {
                return factory.newDocumentBuilder();
            }
        }
        catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create XML document builder", e);
        }
    }

    static Document newDocument()
    {
        return newBuilder().newDocument();
    }

    static Document parse(byte[] bytes, int maxElementDepth) throws SAXException, IOException
    {
        DocumentBuilder builder = newBuilder(
                PARSER_FACTORIES.computeIfAbsent(maxElementDepth, XmlSupport::newBuilderFactory));
        builder.setErrorHandler(STRICT_ERRORS);
        return builder.parse(new ByteArrayInputStream(bytes));
    }

    static Element parseFragment(String xml, int maxElementDepth) throws SAXException, IOException
    {
        return parse(xml.getBytes(StandardCharsets.UTF_8), maxElementDepth).getDocumentElement();
    }

    static byte[] serialize(Document document) throws TransformerException
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        newTransformer(false).transform(new DOMSource(document), new StreamResult(out));
        return out.toByteArray();
    }

    static String serializeFragment(Node node) throws TransformerException
    {
        StringWriter out = new StringWriter();
        newTransformer(true).transform(new DOMSource(node), new StreamResult(out));
        return out.toString();
    }

    private static Transformer newTransformer(boolean omitDeclaration) throws TransformerException
    {
        Transformer transformer;
        synchronized (TRANSFORMER_FACTORY) {
            transformer = TRANSFORMER_FACTORY.newTransformer();
        }
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, omitDeclaration ? "yes" : "no");
        return transformer;
    }

    static Element firstChildElement(Element parent)
    {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                return (Element) node;
            }
        }
        return null;
    }

    static Element firstChild(Element parent, String localName)
    {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                return (Element) node;
            }
        }
        return null;
    }

    static int countChildren(Element parent, String localName)
    {
        int count = 0;
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && localName.equals(node.getLocalName())) {
                count++;
            }
        }
        return count;
    }

    static boolean isNil(Element element)
    {
        String nil = element.getAttributeNS(XSI_NS, "nil");
        return "true".equals(nil) || "1".equals(nil);
    }

    /**
     * Text form of a NodeId with its namespace index replaced by the URI,
     * when the table knows it.
     */
    static String nodeIdText(NodeId nodeId, NamespaceTable namespaces)
    {
        int index = nodeId.namespaceIndex();
        String uri = index == 0 ? null : namespaces.uriAt(index);
        if (uri == null) {
            return nodeId.toParseableString();
        }
        return new ExpandedNodeId(new NodeId(0, nodeId.identifier()), uri, 0).toParseableString();
    }

    /**
     * Text form of an extension object type id; URIs known to the table are
     * written as indices first so the output matches {@link #nodeIdText}.
     */
    static String typeIdText(ExpandedNodeId typeId, NamespaceTable namespaces)
    {
        if (typeId.namespaceUri() == null) {
            return typeId.isLocal() ? nodeIdText(typeId.nodeId(), namespaces) : typeId.toParseableString();
        }
        int index = namespaces.indexOf(typeId.namespaceUri());
        if (index < 0 || !typeId.isLocal()) {
            return typeId.toParseableString();
        }
        return nodeIdText(new NodeId(index, typeId.identifier()), namespaces);
    }

    /**
     * Parses {@code ns=}/{@code nsu=} text into a NodeId, adding unknown URIs
     * to the table.
     *
     * @throws IllegalArgumentException if the text is malformed or names a server
     */
    static NodeId parseNodeId(String text, NamespaceTable namespaces)
    {
        ExpandedNodeId parsed = ExpandedNodeId.parse(text.trim());
        if (!parsed.isLocal()) {
            throw new IllegalArgumentException("NodeId cannot reference a server: " + text);
        }
        if (parsed.namespaceUri() == null) {
            return parsed.nodeId();
        }
        return new NodeId(namespaces.getOrAppend(parsed.namespaceUri()), parsed.identifier());
    }
}
