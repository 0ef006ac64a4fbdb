package com.questrail.diagnostics.protocol.uds.observability;

/**
 * No-op implementation of UdsObservabilitySink.
 */
public final class NullObservabilitySink implements UdsObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFrameSent(UdsFrameEvent event) {}

    @Override
    public void onFrameReceived(UdsFrameEvent event) {}

    @Override
    public void onTransportEvent(UdsTransportEvent event) {}

    @Override
    public void onError(UdsErrorEvent event) {}
}
