package com.questrail.opcua.types;

/**
 * OPC UA LocalizedText: optional locale plus optional text.
 */
public record LocalizedText(String locale, String text)
{
    public static final LocalizedText NULL = new LocalizedText(null, null);

    public static LocalizedText english(String text)
    {
        return new LocalizedText("en", text);
    }

    public boolean isNull()
    {
        return locale == null && text == null;
    }
}
