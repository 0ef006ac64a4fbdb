package com.questrail.diagnostics.protocol.uds.did;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DidCodecTest
{
    /** Seventeen-character ASCII vehicle identification number. */
    public static final class VinCodec extends DidCodec
    {
        @Override
        public byte[] encode(Object value) {
            return ((String) value).getBytes(StandardCharsets.US_ASCII);
        }

        @Override
        public Object decode(byte[] payload) {
            return new String(payload, StandardCharsets.US_ASCII);
        }

        @Override
        public int length() {
            return 17;
        }
    }

    public abstract static class AbstractCodec extends DidCodec {}

    public static final class NeedsArgumentCodec extends DidCodec
    {
        public NeedsArgumentCodec(int ignored) {}
    }

    public static final class IncompleteCodec extends DidCodec {}

    @Test
    void instanceIsUsedAsIs()
    {
        VinCodec codec = new VinCodec();
        assertSame(codec, DidCodec.fromConfig(DidCodecConfig.of(codec)));
    }

    @Test
    void typeIsInstantiated()
    {
        DidCodec codec = DidCodec.fromConfig(DidCodecConfig.of(VinCodec.class));

        assertInstanceOf(VinCodec.class, codec);
        assertEquals("WP0ZZZ99ZTS392124", codec.decode(codec.encode("WP0ZZZ99ZTS392124")));
    }

    @Test
    void formatBuildsStructLayoutCodec()
    {
        DidCodec codec = DidCodec.fromConfig(DidCodecConfig.of(">H"));

        assertInstanceOf(StructLayoutDidCodec.class, codec);
        assertEquals(2, codec.length());
        assertArrayEquals(new byte[] { 0x12, 0x34 }, codec.encode(0x1234));
    }

    @Test
    void untypedValuesAreClassified()
    {
        assertInstanceOf(DidCodecConfig.Format.class, DidCodecConfig.from("<I"));
        assertInstanceOf(DidCodecConfig.Type.class, DidCodecConfig.from(VinCodec.class));
        assertInstanceOf(DidCodecConfig.Instance.class, DidCodecConfig.from(new VinCodec()));

        assertThrows(UdsConfigurationException.class, () -> DidCodecConfig.from(42));
        assertThrows(UdsConfigurationException.class, () -> DidCodecConfig.from(String.class));
        assertThrows(UdsConfigurationException.class, () -> DidCodecConfig.from(null));
    }

    @Test
    void unusableConfigurationsAreRejected()
    {
        assertThrows(UdsConfigurationException.class, () -> DidCodec.fromConfig(null));
        assertThrows(UdsConfigurationException.class, () -> DidCodec.fromConfig(DidCodecConfig.of(AbstractCodec.class)));
        assertThrows(UdsConfigurationException.class, () -> DidCodec.fromConfig(DidCodecConfig.of(NeedsArgumentCodec.class)));
        assertThrows(UdsConfigurationException.class, () -> DidCodec.fromConfig(DidCodecConfig.of("")));
        assertThrows(UdsConfigurationException.class, () -> DidCodec.fromConfig(DidCodecConfig.of(">Z")));
    }

    @Test
    void operationsNotOverriddenAreUnsupported()
    {
        DidCodec codec = DidCodec.fromConfig(DidCodecConfig.of(IncompleteCodec.class));

        assertThrows(UnsupportedOperationException.class, () -> codec.encode(1));
        assertThrows(UnsupportedOperationException.class, () -> codec.decode(new byte[0]));
        assertThrows(UnsupportedOperationException.class, codec::length);
    }

    @Test
    void structCodecDecodesMultipleFields()
    {
        DidCodec codec = DidCodec.fromConfig(DidCodecConfig.from("<BhI"));

        assertEquals(7, codec.length());
        assertEquals(List.of(0xFE, -2, 0x01020304L),
                codec.decode(new byte[] { (byte) 0xFE, (byte) 0xFE, (byte) 0xFF, 0x04, 0x03, 0x02, 0x01 }));
    }
}
