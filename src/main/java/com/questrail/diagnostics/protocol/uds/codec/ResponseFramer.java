package com.questrail.diagnostics.protocol.uds.codec;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import com.questrail.diagnostics.protocol.uds.model.Response;

/**
 * ResponseFramer
 * -----------------------------------------------------------------------------
 * Byte-level codec for server-to-client UDS responses.
 *
 * <pre>
 *   positive:  [ responseID ][ data... ]?
 *   negative:  [ responseID ][ 0x7F ][ responseCode ]
 * </pre>
 *
 * <p>Decoding also accepts the ISO-14229 on-wire negative form
 * {@code [ 0x7F ][ requestSID ][ responseCode ]}.</p>
 */
public interface ResponseFramer
{
    /** Marker byte that identifies a negative response. */
    int NEGATIVE_RESPONSE_MARKER = 0x7F;

    /**
     * Serializes a response into its transport payload (server side).
     *
     * @throws UdsConfigurationException if the response has no registered
     *         service or no valid response code
     */
    byte[] encode(Response response);

    /**
     * Parses a received payload (client side).
     *
     * <p>Never throws on malformed input. The result must be checked with
     * {@link Response#valid()} before any other field is trusted.</p>
     */
    Response decode(byte[] payload);

    /**
     * Length of the encoded response, or 0 if it cannot be encoded.
     */
    default int encodedLength(Response response) {
        try {
            return encode(response).length;
        } catch (UdsConfigurationException e) {
            return 0;
        }
    }
}
