package com.questrail.opcua.observability;

/**
 * Receives codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CodecObservabilitySink {
    /**
     * Called when an encode or decode of a whole message fails.
     * @param event the error event
     */
    void onError(CodecErrorEvent event);

    /**
     * Called when a body is kept opaque because its type is not registered,
     * or when trailing bytes of a known body are skipped.
     * @param event the opaque body event
     */
    void onOpaqueBody(OpaqueBodyEvent event);
}
