package com.questrail.diagnostics.protocol.uds.observability;

import java.time.Instant;

/**
 * A transport lifecycle change.
 */
public record UdsTransportEvent(
    Instant timestamp,
    Kind kind,
    String interfaceName
) {
    public enum Kind {
        OPENED,
        CLOSED,
        RECEIVER_STOPPED
    }
}
