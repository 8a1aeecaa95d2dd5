package com.questrail.opcua.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onError(CodecErrorEvent event) {
        log.warn("OPC UA {} {} failed ({}): {}",
            event.format(),
            event.operation(),
            event.statusCode(),
            event.message(),
            event.cause());
    }

    @Override
    public void onOpaqueBody(OpaqueBodyEvent event) {
        if (event.kind() == OpaqueBodyEvent.Kind.UNKNOWN_TYPE) {
            log.debug("Kept {} body of unregistered type {} opaque ({} bytes)",
                event.format(), event.typeId(), event.length());
        }
        else {
            log.debug("Skipped {} trailing bytes after {} body of type {}",
                event.length(), event.format(), event.typeId());
        }
    }
}
