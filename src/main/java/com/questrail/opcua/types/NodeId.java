package com.questrail.opcua.types;

import java.util.Objects;
import java.util.UUID;

/**
 * OPC UA NodeId: a namespace index plus exactly one identifier value.
 *
 * <p>The identifier is one of:</p>
 * <ul>
 *   <li>{@link Long} for numeric (UInt32) identifiers</li>
 *   <li>{@link String}</li>
 *   <li>{@link UUID}</li>
 *   <li>{@link ByteString} for opaque identifiers</li>
 * </ul>
 *
 * <p>The namespace index is local to a message and is resolved against that
 * message's namespace table.</p>
 */
public record NodeId(int namespaceIndex, Object identifier)
{
    public static final NodeId NULL = new NodeId(0, 0L);

    public NodeId {
        if (namespaceIndex < 0 || namespaceIndex > 0xFFFF) {
            throw new IllegalArgumentException("namespaceIndex out of UInt16 range: " + namespaceIndex);
        }
        Objects.requireNonNull(identifier, "identifier");
        if (identifier instanceof Long numeric) {
            if (numeric < 0 || numeric > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("numeric identifier out of UInt32 range: " + numeric);
            }
        }
        else if (!(identifier instanceof String
                || identifier instanceof UUID
                || identifier instanceof ByteString)) {
            throw new IllegalArgumentException(
                    "Unsupported identifier type: " + identifier.getClass().getName());
        }
    }

    public static NodeId numeric(int namespaceIndex, long identifier)
    {
        return new NodeId(namespaceIndex, identifier);
    }

    public static NodeId string(int namespaceIndex, String identifier)
    {
        return new NodeId(namespaceIndex, identifier);
    }

    public static NodeId guid(int namespaceIndex, UUID identifier)
    {
        return new NodeId(namespaceIndex, identifier);
    }

    public static NodeId opaque(int namespaceIndex, ByteString identifier)
    {
        return new NodeId(namespaceIndex, identifier);
    }

    public IdType idType()
    {
        if (identifier instanceof Long) return IdType.NUMERIC;
        if (identifier instanceof String) return IdType.STRING;
        if (identifier instanceof UUID) return IdType.GUID;
        return IdType.OPAQUE;
    }

    /**
     * A NodeId is null when it lives in namespace 0 and its identifier is the
     * zero value of its kind.
     */
    public boolean isNull()
    {
        if (namespaceIndex != 0) {
            return false;
        }
        return switch (idType()) {
            case NUMERIC -> (Long) identifier == 0L;
            case STRING -> ((String) identifier).isEmpty();
            case GUID -> identifier.equals(new UUID(0L, 0L));
            case OPAQUE -> ((ByteString) identifier).isEmpty();
        };
    }

    /**
     * Standard text form, e.g. {@code ns=2;s=Pump}, {@code i=85}.
     */
    public String toParseableString()
    {
        StringBuilder sb = new StringBuilder();
        if (namespaceIndex != 0) {
            sb.append("ns=").append(namespaceIndex).append(';');
        }
        appendIdentifier(sb, this);
        return sb.toString();
    }

    /**
     * Parses the standard text form. A {@code nsu=} prefix is rejected here;
     * use {@link ExpandedNodeId#parse(String)} for URI-qualified text.
     *
     * @throws IllegalArgumentException if the text is malformed
     */
    public static NodeId parse(String text)
    {
        Objects.requireNonNull(text, "text");
        int namespaceIndex = 0;
        String rest = text;
        if (rest.startsWith("ns=")) {
            int semi = rest.indexOf(';');
            if (semi < 0) {
                throw new IllegalArgumentException("Invalid NodeId: " + text);
            }
            namespaceIndex = parseIndex(rest.substring(3, semi), text);
            rest = rest.substring(semi + 1);
        }
        return new NodeId(namespaceIndex, parseIdentifier(rest, text));
    }

    static void appendIdentifier(StringBuilder sb, NodeId nodeId)
    {
        IdType idType = nodeId.idType();
        sb.append(idType.prefix()).append('=');
        switch (idType) {
            case OPAQUE -> sb.append(((ByteString) nodeId.identifier()).toBase64());
            default -> sb.append(nodeId.identifier());
        }
    }

    static Object parseIdentifier(String idText, String original)
    {
        if (idText.length() < 2 || idText.charAt(1) != '=') {
            throw new IllegalArgumentException("Invalid NodeId identifier: " + original);
        }
        String value = idText.substring(2);
        try {
            return switch (idText.charAt(0)) {
                case 'i' -> Long.parseLong(value);
                case 's' -> value;
                case 'g' -> UUID.fromString(value);
                case 'b' -> ByteString.fromBase64(value);
                default -> throw new IllegalArgumentException("Invalid NodeId identifier type: " + original);
            };
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric NodeId: " + original, e);
        }
    }

    static int parseIndex(String value, String original)
    {
        try {
            return Integer.parseInt(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid namespace index in: " + original, e);
        }
    }

    @Override
    public String toString()
    {
        return toParseableString();
    }
}
