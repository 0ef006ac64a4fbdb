package com.questrail.diagnostics.protocol.uds.codec;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import com.questrail.diagnostics.protocol.uds.model.Request;

/**
 * RequestFramer
 * -----------------------------------------------------------------------------
 * Byte-level codec for client-to-server UDS requests.
 *
 * <pre>
 *   [ serviceID ][ subfunction | 0x80 if suppressed ]?[ data... ]
 * </pre>
 *
 * <p>Frame boundaries belong to the ISO-TP transport: there is no padding and
 * no length field.</p>
 */
public interface RequestFramer
{
    /**
     * Serializes a request into its transport payload.
     *
     * @throws UdsConfigurationException if the request has no registered
     *         service, or lacks a subfunction its service requires
     */
    byte[] encode(Request request);

    /**
     * Rebuilds a request from a received payload.
     *
     * <p>Never throws on malformed input: an empty payload or an unknown
     * service ID yields {@link Request#unknown()}.</p>
     */
    Request decode(byte[] payload);

    /**
     * Length of the encoded request, or 0 if it cannot be encoded.
     */
    default int encodedLength(Request request) {
        try {
            return encode(request).length;
        } catch (UdsConfigurationException e) {
            return 0;
        }
    }
}
