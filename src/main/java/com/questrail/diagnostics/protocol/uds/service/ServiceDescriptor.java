package com.questrail.diagnostics.protocol.uds.service;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

import java.util.Objects;

/**
 * Identity of a UDS service as seen on the wire.
 *
 * <p>A descriptor carries no service semantics. It only tells the framers
 * which byte opens a request, which byte opens the matching positive or
 * negative response, whether byte 1 of a request is a subfunction, and
 * whether a positive response may carry data after the response ID.</p>
 *
 * @param name              human-readable service name
 * @param requestId         service ID used by client requests (0x00–0xFF)
 * @param responseId        service ID used by server responses (0x00–0xFF)
 * @param usesSubfunction   whether requests carry a subfunction byte
 * @param hasResponseData   whether positive responses carry data
 */
public record ServiceDescriptor(
        String name,
        int requestId,
        int responseId,
        boolean usesSubfunction,
        boolean hasResponseData
) {
    /**
     * Offset between a request ID and its positive response ID (ISO-14229).
     */
    public static final int RESPONSE_ID_OFFSET = 0x40;

    public ServiceDescriptor {
        Objects.requireNonNull(name, "name");
        requireByte("requestId", requestId);
        requireByte("responseId", responseId);
    }

    /**
     * Creates a descriptor following the standard policy
     * {@code responseId = requestId + 0x40}.
     */
    public static ServiceDescriptor of(String name, int requestId, boolean usesSubfunction, boolean hasResponseData) {
        return new ServiceDescriptor(name, requestId, requestId + RESPONSE_ID_OFFSET, usesSubfunction, hasResponseData);
    }

    private static void requireByte(String field, int value) {
        if (value < 0 || value > 0xFF) {
            throw new UdsConfigurationException(field + " must be in range 0x00–0xFF (was " + value + ")");
        }
    }

    @Override
    public String toString() {
        return name + "[0x" + Integer.toHexString(requestId) + "/0x" + Integer.toHexString(responseId) + "]";
    }
}
