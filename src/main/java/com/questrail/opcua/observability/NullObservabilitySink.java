package com.questrail.opcua.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onError(CodecErrorEvent event) {}

    @Override
    public void onOpaqueBody(OpaqueBodyEvent event) {}
}
