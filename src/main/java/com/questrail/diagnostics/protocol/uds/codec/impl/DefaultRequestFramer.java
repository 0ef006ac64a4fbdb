package com.questrail.diagnostics.protocol.uds.codec.impl;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import com.questrail.diagnostics.protocol.uds.codec.RequestFramer;
import com.questrail.diagnostics.protocol.uds.model.Request;
import com.questrail.diagnostics.protocol.uds.service.ServiceDescriptor;
import com.questrail.diagnostics.protocol.uds.service.ServiceRegistry;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultRequestFramer
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link RequestFramer} over a {@link ServiceRegistry}.
 */
public final class DefaultRequestFramer implements RequestFramer
{
    static final int SUPPRESS_POSITIVE_RESPONSE_BIT = 0x80;

    private final ServiceRegistry registry;

    public DefaultRequestFramer(ServiceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public byte[] encode(Request request) {
        Objects.requireNonNull(request, "request");

        ServiceDescriptor service = request.service()
                .orElseThrow(() -> new UdsConfigurationException(
                        "Cannot generate a payload. Request has no service"));
        if (!registry.contains(service)) {
            throw new UdsConfigurationException(
                    "Cannot generate a payload. " + service + " is not a registered service");
        }

        byte[] data = request.data().orElse(new byte[0]);
        int header = service.usesSubfunction() ? 2 : 1;

        byte[] payload = new byte[header + data.length];
        payload[0] = (byte) service.requestId();

        if (service.usesSubfunction()) {
            int subfunction = request.subfunction()
                    .orElseThrow(() -> new UdsConfigurationException(
                            "Cannot generate a payload. " + service.name() + " requires a subfunction"));
            if (request.suppressPositiveResponse()) {
                subfunction |= SUPPRESS_POSITIVE_RESPONSE_BIT;
            }
            payload[1] = (byte) subfunction;
        }

        System.arraycopy(data, 0, payload, header, data.length);
        return payload;
    }

    @Override
    public Request decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Request.unknown();
        }

        Optional<ServiceDescriptor> resolved = registry.byRequestId(payload[0] & 0xFF);
        if (resolved.isEmpty()) {
            return Request.unknown();
        }

        ServiceDescriptor service = resolved.get();
        Request.Builder builder = Request.builder(service);

        int dataStart = 1;
        if (service.usesSubfunction()) {
            dataStart = 2;
            if (payload.length >= 2) {
                int sub = payload[1] & 0xFF;
                builder.subfunction(sub & Request.MAX_SUBFUNCTION)
                        .suppressPositiveResponse((sub & SUPPRESS_POSITIVE_RESPONSE_BIT) != 0);
            }
        }

        if (payload.length > dataStart) {
            builder.data(Arrays.copyOfRange(payload, dataStart, payload.length));
        }
        return builder.build();
    }
}
