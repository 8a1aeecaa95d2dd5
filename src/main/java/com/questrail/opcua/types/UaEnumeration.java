package com.questrail.opcua.types;

/**
 * Implemented by Java enums that model OPC UA enumerated data types.
 *
 * <p>Enumerations travel as Int32 on every wire format; the verbose JSON
 * forms add the symbolic name as {@code Name_Value}.</p>
 */
public interface UaEnumeration
{
    int value();

    String name();
}
