package com.questrail.opcua.test;

import com.questrail.opcua.types.UaEnumeration;

/**
 * Enumeration used by {@link SampleStructure}; values are not contiguous.
 */
public enum PumpMode implements UaEnumeration
{
    STOPPED(0),
    RUNNING(1),
    FAULTED(5);

    private final int value;

    PumpMode(int value)
    {
        this.value = value;
    }

    @Override
    public int value()
    {
        return value;
    }
}
