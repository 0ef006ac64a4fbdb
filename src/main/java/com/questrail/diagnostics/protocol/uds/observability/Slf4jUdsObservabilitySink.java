package com.questrail.diagnostics.protocol.uds.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of UdsObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jUdsObservabilitySink implements UdsObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jUdsObservabilitySink.class);

    @Override
    public void onFrameSent(UdsFrameEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("UDS TX [0x{}] {}", Integer.toHexString(event.arbitrationId()), event.payloadHex());
        }
    }

    @Override
    public void onFrameReceived(UdsFrameEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("UDS RX [0x{}] {}", Integer.toHexString(event.arbitrationId()), event.payloadHex());
        }
    }

    @Override
    public void onTransportEvent(UdsTransportEvent event) {
        log.info("UDS Transport {}: {}", event.interfaceName(), event.kind());
    }

    @Override
    public void onError(UdsErrorEvent event) {
        log.error("UDS Error: {}", event.message(), event.cause());
    }
}
