package com.questrail.diagnostics.protocol.uds.observability;

import java.time.Instant;
import java.util.HexFormat;

/**
 * A payload crossing the transport boundary.
 *
 * @param arbitrationId CAN arbitration ID the payload was sent with or received on
 */
public record UdsFrameEvent(
    Instant timestamp,
    int arbitrationId,
    byte[] payload
) {
    public UdsFrameEvent {
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public String payloadHex() {
        return HexFormat.of().formatHex(payload);
    }

    @Override
    public String toString() {
        return "UdsFrameEvent[id=0x" + Integer.toHexString(arbitrationId) + ", payload=" + payloadHex() + "]";
    }
}
