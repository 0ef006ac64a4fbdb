package com.questrail.diagnostics.protocol.uds.observability;

/**
 * Receives observability events from the UDS connection.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface UdsObservabilitySink {
    /**
     * Called after a payload was handed to the transport.
     */
    void onFrameSent(UdsFrameEvent event);

    /**
     * Called when the receiver queued a payload from the transport.
     */
    void onFrameReceived(UdsFrameEvent event);

    /**
     * Called when the connection opens or closes, or its receiver stops.
     */
    void onTransportEvent(UdsTransportEvent event);

    /**
     * Called when an error or anomaly occurs.
     */
    void onError(UdsErrorEvent event);
}
