package com.questrail.opcua.types;

import java.util.Objects;

/**
 * OPC UA ExpandedNodeId.
 *
 * <p>A {@link NodeId} that may additionally name its namespace by URI (which
 * then overrides the local namespace index) and may point at another server
 * through a server index.</p>
 *
 * <p>Ids that must survive outside a single message, such as the encoding ids
 * held by the type registry, are expressed with a namespace URI.</p>
 */
public record ExpandedNodeId(NodeId nodeId, String namespaceUri, long serverIndex)
{
    public static final ExpandedNodeId NULL = new ExpandedNodeId(NodeId.NULL, null, 0);

    public ExpandedNodeId {
        Objects.requireNonNull(nodeId, "nodeId");
        if (serverIndex < 0 || serverIndex > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("serverIndex out of UInt32 range: " + serverIndex);
        }
        if (namespaceUri != null && namespaceUri.isEmpty()) {
            namespaceUri = null;
        }
        if (namespaceUri != null && nodeId.namespaceIndex() != 0) {
            nodeId = new NodeId(0, nodeId.identifier());
        }
    }

    public static ExpandedNodeId of(NodeId nodeId)
    {
        return new ExpandedNodeId(nodeId, null, 0);
    }

    /**
     * Numeric id qualified by namespace URI.
     */
    public static ExpandedNodeId numeric(String namespaceUri, long identifier)
    {
        return new ExpandedNodeId(NodeId.numeric(0, identifier), namespaceUri, 0);
    }

    public Object identifier()
    {
        return nodeId.identifier();
    }

    public IdType idType()
    {
        return nodeId.idType();
    }

    public int namespaceIndex()
    {
        return nodeId.namespaceIndex();
    }

    public boolean isLocal()
    {
        return serverIndex == 0;
    }

    public boolean isNull()
    {
        return namespaceUri == null && serverIndex == 0 && nodeId.isNull();
    }

    /**
     * Standard text form, e.g. {@code svr=1;nsu=urn:plant;s=Pump}.
     */
    public String toParseableString()
    {
        StringBuilder sb = new StringBuilder();
        if (serverIndex != 0) {
            sb.append("svr=").append(serverIndex).append(';');
        }
        if (namespaceUri != null) {
            sb.append("nsu=").append(escapeUri(namespaceUri)).append(';');
        }
        else if (nodeId.namespaceIndex() != 0) {
            sb.append("ns=").append(nodeId.namespaceIndex()).append(';');
        }
        NodeId.appendIdentifier(sb, nodeId);
        return sb.toString();
    }

    /**
     * Parses the standard text form, accepting {@code svr=}, {@code ns=} and
     * {@code nsu=} prefixes.
     *
     * @throws IllegalArgumentException if the text is malformed
     */
    public static ExpandedNodeId parse(String text)
    {
        Objects.requireNonNull(text, "text");
        String rest = text;
        long serverIndex = 0;
        if (rest.startsWith("svr=")) {
            int semi = rest.indexOf(';');
            if (semi < 0) {
                throw new IllegalArgumentException("Invalid ExpandedNodeId: " + text);
            }
            try {
                serverIndex = Long.parseLong(rest.substring(4, semi));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid server index in: " + text, e);
            }
            rest = rest.substring(semi + 1);
        }
        if (rest.startsWith("nsu=")) {
            int semi = rest.indexOf(';', 4);
            if (semi < 0) {
                throw new IllegalArgumentException("Invalid ExpandedNodeId: " + text);
            }
            String uri = unescapeUri(rest.substring(4, semi));
            Object identifier = NodeId.parseIdentifier(rest.substring(semi + 1), text);
            return new ExpandedNodeId(new NodeId(0, identifier), uri, serverIndex);
        }
        return new ExpandedNodeId(NodeId.parse(rest), null, serverIndex);
    }

    static String escapeUri(String uri)
    {
        return uri.replace("%", "%25").replace(";", "%3B");
    }

    static String unescapeUri(String text)
    {
        return text.replace("%3B", ";").replace("%3b", ";").replace("%25", "%");
    }

    @Override
    public String toString()
    {
        return toParseableString();
    }
}
