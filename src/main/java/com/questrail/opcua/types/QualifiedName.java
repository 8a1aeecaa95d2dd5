package com.questrail.opcua.types;

/**
 * OPC UA QualifiedName: a name qualified by a namespace index.
 */
public record QualifiedName(int namespaceIndex, String name)
{
    public static final QualifiedName NULL = new QualifiedName(0, null);

    public QualifiedName {
        if (namespaceIndex < 0 || namespaceIndex > 0xFFFF) {
            throw new IllegalArgumentException("namespaceIndex out of UInt16 range: " + namespaceIndex);
        }
    }

    public boolean isNull()
    {
        return namespaceIndex == 0 && (name == null || name.isEmpty());
    }

    /**
     * Text form {@code 2:Temperature}, or just the name in namespace 0.
     */
    public String toParseableString()
    {
        String text = name == null ? "" : name;
        return namespaceIndex == 0 ? text : namespaceIndex + ":" + text;
    }

    /**
     * Parses the {@code index:name} text form.
     */
    public static QualifiedName parse(String text)
    {
        int colon = text.indexOf(':');
        if (colon > 0) {
            String prefix = text.substring(0, colon);
            if (prefix.chars().allMatch(Character::isDigit)) {
                return new QualifiedName(NodeId.parseIndex(prefix, text), text.substring(colon + 1));
            }
        }
        return new QualifiedName(0, text);
    }

    @Override
    public String toString()
    {
        return toParseableString();
    }
}
