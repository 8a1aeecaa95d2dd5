package com.questrail.opcua.codec.json;

/**
 * The four JSON encoding variants.
 */
public enum JsonEncodingType
{
    /** Lossless, with type discriminators; the default. */
    REVERSIBLE,
    /** Human-oriented output without discriminators; cannot be decoded. */
    NON_REVERSIBLE,
    /** Lossless with the shortest identifiers and inline structures. */
    COMPACT,
    /** Lossless, adding symbolic names and default values. */
    VERBOSE
}
