package com.questrail.diagnostics.protocol.uds.config;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of an ISO-TP connection.
 *
 * @param interfaceName      transport interface passed to the socket on bind
 * @param rxId               arbitration ID of frames addressed to this client
 * @param txId               arbitration ID used for frames this client sends
 * @param receivePollTimeout bound on each transport read; also bounds close latency
 * @param defaultFrameTimeout timeout used by {@code waitFrame()} without arguments
 * @param rxQueueCapacity    maximum number of received frames waiting for the caller
 */
public record ConnectionConfig(
    String interfaceName,
    int rxId,
    int txId,
    Duration receivePollTimeout,
    Duration defaultFrameTimeout,
    int rxQueueCapacity
) {
    /** Largest 29-bit (extended) CAN arbitration ID. */
    public static final int MAX_ARBITRATION_ID = 0x1FFFFFFF;

    public ConnectionConfig {
        Objects.requireNonNull(interfaceName, "interfaceName");
        Objects.requireNonNull(receivePollTimeout, "receivePollTimeout");
        Objects.requireNonNull(defaultFrameTimeout, "defaultFrameTimeout");

        requireArbitrationId("rxId", rxId);
        requireArbitrationId("txId", txId);
        if (rxId == txId) {
            throw new UdsConfigurationException("rxId and txId must differ (both 0x" + Integer.toHexString(rxId) + ")");
        }
        if (receivePollTimeout.isNegative() || receivePollTimeout.isZero()) {
            throw new UdsConfigurationException("receivePollTimeout must be > 0");
        }
        if (defaultFrameTimeout.isNegative()) {
            throw new UdsConfigurationException("defaultFrameTimeout must be >= 0");
        }
        if (rxQueueCapacity < 1) {
            throw new UdsConfigurationException("rxQueueCapacity must be >= 1");
        }
    }

    private static void requireArbitrationId(String field, int id) {
        if (id < 0 || id > MAX_ARBITRATION_ID) {
            throw new UdsConfigurationException(field + " must be in range 0–0x1FFFFFFF (was " + id + ")");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String interfaceName = "can0";
        private int rxId = -1;
        private int txId = -1;
        private Duration receivePollTimeout = Duration.ofMillis(100);
        private Duration defaultFrameTimeout = Duration.ofSeconds(2);
        private int rxQueueCapacity = 64;

        public Builder withInterfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
            return this;
        }

        public Builder withRxId(int rxId) {
            this.rxId = rxId;
            return this;
        }

        public Builder withTxId(int txId) {
            this.txId = txId;
            return this;
        }

        public Builder withReceivePollTimeout(Duration timeout) {
            this.receivePollTimeout = timeout;
            return this;
        }

        public Builder withDefaultFrameTimeout(Duration timeout) {
            this.defaultFrameTimeout = timeout;
            return this;
        }

        public Builder withRxQueueCapacity(int capacity) {
            this.rxQueueCapacity = capacity;
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(interfaceName, rxId, txId, receivePollTimeout, defaultFrameTimeout, rxQueueCapacity);
        }
    }
}
