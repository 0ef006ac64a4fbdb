package com.questrail.diagnostics.protocol.uds.codec.impl;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import com.questrail.diagnostics.protocol.uds.codec.ResponseFramer;
import com.questrail.diagnostics.protocol.uds.model.Response;
import com.questrail.diagnostics.protocol.uds.model.ResponseCode;
import com.questrail.diagnostics.protocol.uds.service.ServiceDescriptor;
import com.questrail.diagnostics.protocol.uds.service.ServiceRegistry;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultResponseFramer
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link ResponseFramer} over a {@link ServiceRegistry}.
 *
 * <p>Decode precedence:</p>
 * <ol>
 *   <li>{@code [0x7F][SID][NRC]}: ISO-14229 negative response, service resolved by request ID</li>
 *   <li>unknown response ID at byte 0: invalid</li>
 *   <li>single byte: positive if the service carries no response data, otherwise invalid</li>
 *   <li>byte 1 is not {@code 0x7F}: positive, data from byte 1</li>
 *   <li>byte 1 is {@code 0x7F}: negative, code at byte 2, trailing bytes kept as data</li>
 * </ol>
 */
public final class DefaultResponseFramer implements ResponseFramer
{
    static final String UNKNOWN_SERVICE = "Payload first byte is not a known service (unknown service)";
    static final String PAYLOAD_TOO_SHORT = "Payload too short: service declares response data";
    static final String INCOMPLETE_NEGATIVE_RESPONSE = "Incomplete negative response (7Fxx): missing response code";

    private final ServiceRegistry registry;

    public DefaultResponseFramer(ServiceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public byte[] encode(Response response) {
        Objects.requireNonNull(response, "response");

        ServiceDescriptor service = response.service()
                .orElseThrow(() -> new UdsConfigurationException(
                        "Cannot make payload from response. Response has no service"));
        if (!registry.contains(service)) {
            throw new UdsConfigurationException(
                    "Cannot make payload from response. " + service + " is not a registered service");
        }

        int code = response.code()
                .orElseThrow(() -> new UdsConfigurationException(
                        "Cannot make payload from response. Response code is not set"));
        if (code < 0 || code > 0xFF) {
            throw new UdsConfigurationException(
                    "Cannot make payload from response. Response code out of range: " + code);
        }

        if (!response.positive()) {
            return new byte[] {
                    (byte) service.responseId(),
                    (byte) NEGATIVE_RESPONSE_MARKER,
                    (byte) code
            };
        }

        byte[] data = service.hasResponseData() ? response.data().orElse(new byte[0]) : new byte[0];
        byte[] payload = new byte[1 + data.length];
        payload[0] = (byte) service.responseId();
        System.arraycopy(data, 0, payload, 1, data.length);
        return payload;
    }

    @Override
    public Response decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Response.invalid(null, UNKNOWN_SERVICE);
        }

        final int first = payload[0] & 0xFF;
        if (first == NEGATIVE_RESPONSE_MARKER) {
            return decodeStandardNegative(payload);
        }

        Optional<ServiceDescriptor> resolved = registry.byResponseId(first);
        if (resolved.isEmpty()) {
            return Response.invalid(null, UNKNOWN_SERVICE);
        }
        ServiceDescriptor service = resolved.get();

        if (payload.length == 1) {
            if (service.hasResponseData()) {
                return Response.invalid(service, PAYLOAD_TOO_SHORT);
            }
            return Response.parsed(service, true, ResponseCode.POSITIVE_RESPONSE.value(), null);
        }

        if ((payload[1] & 0xFF) != NEGATIVE_RESPONSE_MARKER) {
            return Response.parsed(service, true, ResponseCode.POSITIVE_RESPONSE.value(), tail(payload, 1));
        }

        if (payload.length < 3) {
            return Response.invalid(service, INCOMPLETE_NEGATIVE_RESPONSE);
        }
        // A negative response carries nothing after its code; extra bytes are kept, not rejected.
        return Response.parsed(service, false, payload[2] & 0xFF, tail(payload, 3));
    }

    private Response decodeStandardNegative(byte[] payload) {
        if (payload.length < 3) {
            return Response.invalid(null, INCOMPLETE_NEGATIVE_RESPONSE);
        }

        Optional<ServiceDescriptor> resolved = registry.byRequestId(payload[1] & 0xFF);
        if (resolved.isEmpty()) {
            return Response.invalid(null, UNKNOWN_SERVICE);
        }
        return Response.parsed(resolved.get(), false, payload[2] & 0xFF, tail(payload, 3));
    }

    private static byte[] tail(byte[] payload, int from) {
        return payload.length > from ? Arrays.copyOfRange(payload, from, payload.length) : null;
    }
}
