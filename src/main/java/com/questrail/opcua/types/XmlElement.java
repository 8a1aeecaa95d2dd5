package com.questrail.opcua.types;

import java.util.Objects;

/**
 * An XML fragment carried as a value (BuiltInType {@code XmlElement}).
 *
 * <p>The fragment is kept as text. The binary and JSON encodings transport
 * the UTF-8 text; the XML encoding embeds the parsed element.</p>
 */
public record XmlElement(String xml)
{
    public XmlElement {
        Objects.requireNonNull(xml, "xml");
    }

    public static XmlElement of(String xml)
    {
        return new XmlElement(xml);
    }
}
