package com.questrail.diagnostics.protocol.uds.did;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Encodes and decodes the value of a single Data Identifier (DID).
 *
 * <p>Subclasses provide a concrete layout by overriding {@link #encode(Object)},
 * {@link #decode(byte[])} and {@link #length()}. Methods that are not
 * overridden throw {@link UnsupportedOperationException}. Codecs hold no
 * state beyond what their constructor sets up.</p>
 *
 * <p>Every DID is bound to exactly one codec, resolved once through
 * {@link #fromConfig(DidCodecConfig)}. Codec classes referenced by a
 * {@link DidCodecConfig.Type} configuration need an accessible no-argument
 * constructor.</p>
 */
public abstract class DidCodec
{
    protected DidCodec() {}

    /**
     * Encodes a DID value into exactly {@link #length()} bytes.
     */
    public byte[] encode(Object value) {
        throw new UnsupportedOperationException(
                "Cannot encode DID to binary payload. " + getClass().getSimpleName() + " has no encode implementation");
    }

    /**
     * Decodes a DID value from a payload of {@link #length()} bytes.
     */
    public Object decode(byte[] payload) {
        throw new UnsupportedOperationException(
                "Cannot decode DID from binary payload. " + getClass().getSimpleName() + " has no decode implementation");
    }

    /**
     * Size of the encoded value in bytes, used to split multi-DID responses.
     */
    public int length() {
        throw new UnsupportedOperationException(
                "Cannot tell the payload size. " + getClass().getSimpleName() + " has no length implementation");
    }

    /**
     * Resolves the codec for one DID from its configuration.
     *
     * @throws UdsConfigurationException if the configuration is missing, names a
     *         codec class that cannot be instantiated, or holds a malformed format string
     */
    public static DidCodec fromConfig(DidCodecConfig config) {
        if (config == null) {
            throw new UdsConfigurationException("DID codec configuration is missing");
        }

        if (config instanceof DidCodecConfig.Instance instance) {
            return instance.codec();
        }
        if (config instanceof DidCodecConfig.Type type) {
            return instantiate(type.codecClass());
        }
        if (config instanceof DidCodecConfig.Format format) {
            return new StructLayoutDidCodec(format.format());
        }
        throw new UdsConfigurationException("Unsupported DID codec configuration: " + config);
    }

    private static DidCodec instantiate(Class<? extends DidCodec> codecClass) {
        Objects.requireNonNull(codecClass, "codecClass");
        if (Modifier.isAbstract(codecClass.getModifiers())) {
            throw new UdsConfigurationException("DID codec class " + codecClass.getName() + " is abstract");
        }
        try {
            return codecClass.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new UdsConfigurationException(
                    "DID codec class " + codecClass.getName() + " has no no-argument constructor", e);
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new UdsConfigurationException(
                    "Cannot instantiate DID codec class " + codecClass.getName(), e);
        }
    }
}
