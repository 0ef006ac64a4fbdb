package com.questrail.diagnostics.protocol.uds.model;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import com.questrail.diagnostics.protocol.uds.service.ServiceDescriptor;

import java.util.Optional;

/**
 * A server-to-client UDS response.
 *
 * <h2>Validity</h2>
 * <p>A response obtained from
 * {@link com.questrail.diagnostics.protocol.uds.codec.ResponseFramer#decode(byte[])}
 * may be structurally invalid. Invalid responses are ordinary values, not
 * exceptions: callers must check {@link #valid()} before trusting any other
 * field, and may inspect {@link #invalidReason()}.</p>
 *
 * <h2>Positive vs. negative</h2>
 * <p>A decoded response is negative exactly when the {@code 0x7F} marker was
 * present. A directly constructed response is positive unless
 * {@link ResponseCode#isNegative(Integer)} classifies its code as negative.</p>
 *
 * <p>Instances are immutable.</p>
 */
public final class Response
{
    private final ServiceDescriptor service;
    private final boolean positive;
    private final Integer code;
    private final byte[] data;
    private final boolean valid;
    private final String invalidReason;

    private Response(ServiceDescriptor service,
                     boolean positive,
                     Integer code,
                     byte[] data,
                     boolean valid,
                     String invalidReason) {
        this.service = service;
        this.positive = positive;
        this.code = code;
        this.data = data;
        this.valid = valid;
        this.invalidReason = invalidReason;
    }

    /**
     * Builds a response to be emitted by a server.
     *
     * @param service responding service; a response without one is invalid
     * @param code    response code (0x00 for positive); a response without one is invalid
     * @param data    response data, or {@code null}
     * @throws UdsConfigurationException if {@code code} is outside 0x00–0xFF, or
     *         if data is given for a service that declares no response data
     */
    public static Response of(ServiceDescriptor service, Integer code, byte[] data) {
        if (code != null && (code < 0 || code > 0xFF)) {
            throw new UdsConfigurationException("Response code must be in range 0x00–0xFF (was " + code + ")");
        }
        if (data != null && service != null && !service.hasResponseData()) {
            throw new UdsConfigurationException(service.name() + " does not carry data in its response");
        }

        boolean positive = code != null && !ResponseCode.isNegative(code);
        final String reason;
        if (service == null) {
            reason = "Service is not set";
        } else if (code == null) {
            reason = "Response code is not set";
        } else {
            reason = "";
        }

        return new Response(service, positive, code, data == null ? null : data.clone(), reason.isEmpty(), reason);
    }

    public static Response positive(ServiceDescriptor service) {
        return of(service, ResponseCode.POSITIVE_RESPONSE.value(), null);
    }

    public static Response positive(ServiceDescriptor service, byte[] data) {
        return of(service, ResponseCode.POSITIVE_RESPONSE.value(), data);
    }

    public static Response negative(ServiceDescriptor service, ResponseCode code) {
        return of(service, code.value(), null);
    }

    /**
     * A structurally well-formed response as read from the wire. Trailing
     * bytes are kept as data whatever the service declares.
     */
    public static Response parsed(ServiceDescriptor service, boolean positive, int code, byte[] data) {
        return new Response(service, positive, code, data == null ? null : data.clone(), true, "");
    }

    /**
     * A malformed response as read from the wire.
     */
    public static Response invalid(ServiceDescriptor service, String reason) {
        return new Response(service, false, null, null, false, reason);
    }

    public Optional<ServiceDescriptor> service() {
        return Optional.ofNullable(service);
    }

    public boolean positive() {
        return positive;
    }

    public Optional<Integer> code() {
        return Optional.ofNullable(code);
    }

    public Optional<ResponseCode> responseCode() {
        return code == null ? Optional.empty() : ResponseCode.fromValue(code);
    }

    public String codeName() {
        return ResponseCode.nameOf(code);
    }

    public Optional<byte[]> data() {
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    public int dataLength() {
        return data == null ? 0 : data.length;
    }

    public boolean valid() {
        return valid;
    }

    /**
     * Why this response is invalid; empty for valid responses.
     */
    public String invalidReason() {
        return invalidReason;
    }

    @Override
    public String toString() {
        if (!valid) {
            return "InvalidResponse[" + invalidReason + "]";
        }
        String kind = positive ? ResponseCode.POSITIVE_RESPONSE.symbolicName() : "NegativeResponse(" + codeName() + ")";
        return kind + "[" + service.name() + "] - " + dataLength() + " data bytes";
    }
}
