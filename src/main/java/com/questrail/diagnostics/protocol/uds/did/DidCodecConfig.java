package com.questrail.diagnostics.protocol.uds.did;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

import java.util.Objects;

/**
 * The accepted shapes of a DID codec configuration value.
 *
 * <ul>
 *   <li>{@link Instance}: a ready codec, used as is</li>
 *   <li>{@link Type}: a codec class, instantiated with no arguments</li>
 *   <li>{@link Format}: a compact layout string such as {@code ">H"}</li>
 * </ul>
 *
 * <p>Untyped values (for example read from a configuration map) are sorted
 * into one of these shapes by {@link #from(Object)}, which rejects anything
 * else up front.</p>
 */
public sealed interface DidCodecConfig
        permits DidCodecConfig.Instance, DidCodecConfig.Type, DidCodecConfig.Format
{
    record Instance(DidCodec codec) implements DidCodecConfig {
        public Instance {
            Objects.requireNonNull(codec, "codec");
        }
    }

    record Type(Class<? extends DidCodec> codecClass) implements DidCodecConfig {
        public Type {
            Objects.requireNonNull(codecClass, "codecClass");
        }
    }

    record Format(String format) implements DidCodecConfig {
        public Format {
            Objects.requireNonNull(format, "format");
        }
    }

    static DidCodecConfig of(DidCodec codec) {
        return new Instance(codec);
    }

    static DidCodecConfig of(Class<? extends DidCodec> codecClass) {
        return new Type(codecClass);
    }

    static DidCodecConfig of(String format) {
        return new Format(format);
    }

    /**
     * Classifies an untyped configuration value.
     *
     * @throws UdsConfigurationException if {@code value} is not a codec, a codec
     *         class, a format string or already a {@code DidCodecConfig}
     */
    static DidCodecConfig from(Object value) {
        if (value instanceof DidCodecConfig config) {
            return config;
        }
        if (value instanceof DidCodec codec) {
            return new Instance(codec);
        }
        if (value instanceof Class<?> cls && DidCodec.class.isAssignableFrom(cls)) {
            return new Type(cls.asSubclass(DidCodec.class));
        }
        if (value instanceof String format) {
            return new Format(format);
        }
        throw new UdsConfigurationException(
                "DID configuration must be a DidCodec instance, a DidCodec class or a format string (was "
                        + (value == null ? "null" : value.getClass().getName()) + ")");
    }
}
