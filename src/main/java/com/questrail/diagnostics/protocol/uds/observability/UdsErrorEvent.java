package com.questrail.diagnostics.protocol.uds.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the UDS stack.
 */
public record UdsErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
