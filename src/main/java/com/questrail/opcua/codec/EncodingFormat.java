package com.questrail.opcua.codec;

public enum EncodingFormat
{
    BINARY,
    XML,
    JSON
}
