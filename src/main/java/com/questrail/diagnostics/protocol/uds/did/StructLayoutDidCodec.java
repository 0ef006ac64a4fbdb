package com.questrail.diagnostics.protocol.uds.did;

import java.util.Collections;
import java.util.List;

/**
 * {@link DidCodec} driven by a compact layout string (see {@link StructLayout}).
 *
 * <p>{@link #decode(byte[])} returns the {@code List} of field values.
 * {@link #encode(Object)} accepts that same {@code List}, or a bare value when
 * the layout holds exactly one field.</p>
 */
public final class StructLayoutDidCodec extends DidCodec
{
    private final StructLayout layout;

    /**
     * @throws com.questrail.diagnostics.protocol.uds.UdsConfigurationException
     *         if {@code format} is malformed
     */
    public StructLayoutDidCodec(String format) {
        this.layout = StructLayout.parse(format);
    }

    public String format() {
        return layout.format();
    }

    @Override
    public byte[] encode(Object value) {
        if (value instanceof List<?> values) {
            return layout.pack(values);
        }
        return layout.pack(Collections.singletonList(value));
    }

    @Override
    public List<Object> decode(byte[] payload) {
        return layout.unpack(payload);
    }

    @Override
    public int length() {
        return layout.size();
    }

    @Override
    public String toString() {
        return "StructLayoutDidCodec['" + layout.format() + "']";
    }
}
