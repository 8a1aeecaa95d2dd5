package com.questrail.opcua.observability;

import java.time.Instant;

/**
 * Record representing a failed encode or decode.
 *
 * @param operation  {@code "encode"} or {@code "decode"}
 * @param format     wire format name
 * @param statusCode symbolic status of the failure
 */
public record CodecErrorEvent(
    Instant timestamp,
    String operation,
    String format,
    String statusCode,
    String message,
    Throwable cause
) {
}
