package com.questrail.diagnostics.protocol.uds.service;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable lookup table between wire service IDs and {@link ServiceDescriptor}s.
 *
 * <p>The registry is an explicit value handed to the framers; nothing in the
 * protocol core resolves services through global state. Several registries
 * (for example a standard catalog and a vendor variant) may be used side by
 * side in the same process.</p>
 *
 * <p>Request IDs are unique among request IDs and response IDs are unique
 * among response IDs. The builder rejects any collision, and rejects the
 * response ID {@code 0x7F}, which is reserved for the negative response
 * marker.</p>
 */
public final class ServiceRegistry
{
    /** First byte of an ISO-14229 negative response; never a service response ID. */
    public static final int NEGATIVE_RESPONSE_ID = 0x7F;

    private final Map<Integer, ServiceDescriptor> byRequestId;
    private final Map<Integer, ServiceDescriptor> byResponseId;

    private ServiceRegistry(Map<Integer, ServiceDescriptor> byRequestId,
                            Map<Integer, ServiceDescriptor> byResponseId) {
        this.byRequestId = Collections.unmodifiableMap(new LinkedHashMap<>(byRequestId));
        this.byResponseId = Collections.unmodifiableMap(new HashMap<>(byResponseId));
    }

    /**
     * Resolves the service whose requests start with {@code requestId}.
     */
    public Optional<ServiceDescriptor> byRequestId(int requestId) {
        return Optional.ofNullable(byRequestId.get(requestId));
    }

    /**
     * Resolves the service whose responses start with {@code responseId}.
     */
    public Optional<ServiceDescriptor> byResponseId(int responseId) {
        return Optional.ofNullable(byResponseId.get(responseId));
    }

    /**
     * Returns true if this exact descriptor is registered here.
     */
    public boolean contains(ServiceDescriptor service) {
        if (service == null) {
            return false;
        }
        return service.equals(byRequestId.get(service.requestId()));
    }

    public Collection<ServiceDescriptor> services() {
        return byRequestId.values();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Integer, ServiceDescriptor> byRequestId = new LinkedHashMap<>();
        private final Map<Integer, ServiceDescriptor> byResponseId = new HashMap<>();

        public Builder register(ServiceDescriptor service) {
            Objects.requireNonNull(service, "service");

            if (service.responseId() == NEGATIVE_RESPONSE_ID) {
                throw new UdsConfigurationException(service.name()
                        + ": response ID 0x7F is reserved for negative responses");
            }

            ServiceDescriptor existing = byRequestId.get(service.requestId());
            if (existing != null) {
                throw new UdsConfigurationException("Request ID 0x" + Integer.toHexString(service.requestId())
                        + " already registered by " + existing.name());
            }
            existing = byResponseId.get(service.responseId());
            if (existing != null) {
                throw new UdsConfigurationException("Response ID 0x" + Integer.toHexString(service.responseId())
                        + " already registered by " + existing.name());
            }

            byRequestId.put(service.requestId(), service);
            byResponseId.put(service.responseId(), service);
            return this;
        }

        public Builder registerAll(Collection<ServiceDescriptor> services) {
            Objects.requireNonNull(services, "services");
            services.forEach(this::register);
            return this;
        }

        public ServiceRegistry build() {
            return new ServiceRegistry(byRequestId, byResponseId);
        }
    }
}
