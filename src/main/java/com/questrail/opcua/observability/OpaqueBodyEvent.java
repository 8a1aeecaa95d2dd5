package com.questrail.opcua.observability;

import java.time.Instant;

/**
 * Record representing an extension object body the decoder did not interpret.
 */
public record OpaqueBodyEvent(
    Instant timestamp,
    Kind kind,
    String typeId,
    String format,
    int length
) {
    public enum Kind {
        /** No registered type for the type id; the body was kept as received. */
        UNKNOWN_TYPE,
        /** A registered type consumed fewer bytes than the body length. */
        TRAILING_BYTES
    }
}
