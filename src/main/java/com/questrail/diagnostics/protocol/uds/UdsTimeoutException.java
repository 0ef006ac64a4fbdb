package com.questrail.diagnostics.protocol.uds;

import java.time.Duration;

/**
 * Raised when a caller opted into strict waiting and no frame arrived
 * within the requested timeout.
 */
public final class UdsTimeoutException extends RuntimeException
{
    private final Duration timeout;

    public UdsTimeoutException(Duration timeout) {
        super("Did not receive ISO-TP frame in time (timeout=" + timeout.toMillis() + " ms)");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
