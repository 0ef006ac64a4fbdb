package com.questrail.diagnostics.protocol.uds.model;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import com.questrail.diagnostics.protocol.uds.service.ServiceDescriptor;

import java.util.Optional;

/**
 * A client-to-server UDS request.
 *
 * <p>Requests are immutable. They are composed by a caller issuing a
 * diagnostic call, or reconstructed from a payload by
 * {@link com.questrail.diagnostics.protocol.uds.codec.RequestFramer#decode(byte[])}
 * when acting as a server. A decoded request whose first byte did not match
 * any registered service has no service and nothing else populated.</p>
 *
 * <p>Whether the request can be put on the wire (a registered service, a
 * subfunction when the service needs one) is checked by the framer at
 * encode time.</p>
 */
public final class Request
{
    /** Largest subfunction value; bit 7 is the suppress-positive-response flag. */
    public static final int MAX_SUBFUNCTION = 0x7F;

    private final ServiceDescriptor service;
    private final Integer subfunction;
    private final boolean suppressPositiveResponse;
    private final byte[] data;

    private Request(Builder builder) {
        this.service = builder.service;
        this.subfunction = builder.subfunction;
        this.suppressPositiveResponse = builder.suppressPositiveResponse;
        this.data = builder.data;
    }

    public static Builder builder(ServiceDescriptor service) {
        return new Builder().service(service);
    }

    /**
     * A request for {@code service} without subfunction or data.
     */
    public static Request of(ServiceDescriptor service) {
        return builder(service).build();
    }

    /**
     * A request carrying no recognized service, as produced when decoding an
     * unknown service ID.
     */
    public static Request unknown() {
        return new Builder().build();
    }

    public Optional<ServiceDescriptor> service() {
        return Optional.ofNullable(service);
    }

    public Optional<Integer> subfunction() {
        return Optional.ofNullable(subfunction);
    }

    public boolean suppressPositiveResponse() {
        return suppressPositiveResponse;
    }

    /**
     * Bytes following the mandatory header (service ID and, if used, the
     * subfunction). Returns a copy.
     */
    public Optional<byte[]> data() {
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    public int dataLength() {
        return data == null ? 0 : data.length;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Request[")
                .append(service != null ? service.name() : "UnknownService")
                .append(']');
        if (subfunction != null) {
            sb.append(" (subfunction=").append(subfunction).append(')');
        }
        sb.append(" - ").append(dataLength()).append(" data bytes");
        if (suppressPositiveResponse) {
            sb.append(" [SuppressPosResponse]");
        }
        return sb.toString();
    }

    public static final class Builder {
        private ServiceDescriptor service;
        private Integer subfunction;
        private boolean suppressPositiveResponse;
        private byte[] data;

        private Builder() {}

        public Builder service(ServiceDescriptor service) {
            this.service = service;
            return this;
        }

        /**
         * @throws UdsConfigurationException if {@code subfunction} is outside 0x00–0x7F
         */
        public Builder subfunction(int subfunction) {
            if (subfunction < 0 || subfunction > MAX_SUBFUNCTION) {
                throw new UdsConfigurationException(
                        "Subfunction must be in range 0x00–0x7F (was " + subfunction + ")");
            }
            this.subfunction = subfunction;
            return this;
        }

        public Builder suppressPositiveResponse(boolean suppress) {
            this.suppressPositiveResponse = suppress;
            return this;
        }

        public Builder data(byte[] data) {
            this.data = data == null ? null : data.clone();
            return this;
        }

        public Request build() {
            return new Request(this);
        }
    }
}
