package com.questrail.diagnostics.protocol.uds.did;

import com.questrail.diagnostics.protocol.uds.UdsConfigurationException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed binary layout described by a compact format string.
 *
 * <h2>Grammar</h2>
 * <pre>
 *   format := [order] item*
 *   order  := '&gt;' | '!'   big endian (default)
 *           | '&lt;'         little endian
 *           | '=' | '@'    platform order
 *   item   := [count] code
 * </pre>
 *
 * <table>
 *   <caption>Field codes</caption>
 *   <tr><th>code</th><th>bytes</th><th>Java value</th></tr>
 *   <tr><td>x</td><td>1</td><td>pad byte, no value</td></tr>
 *   <tr><td>c</td><td>1</td><td>{@code byte[]} of length 1</td></tr>
 *   <tr><td>b / B</td><td>1</td><td>{@code Integer} signed / unsigned</td></tr>
 *   <tr><td>?</td><td>1</td><td>{@code Boolean}</td></tr>
 *   <tr><td>h / H</td><td>2</td><td>{@code Integer} signed / unsigned</td></tr>
 *   <tr><td>i / l</td><td>4</td><td>{@code Integer}</td></tr>
 *   <tr><td>I / L</td><td>4</td><td>{@code Long} unsigned</td></tr>
 *   <tr><td>q / Q</td><td>8</td><td>{@code Long} (Q keeps the raw 64 bits)</td></tr>
 *   <tr><td>f</td><td>4</td><td>{@code Float}</td></tr>
 *   <tr><td>d</td><td>8</td><td>{@code Double}</td></tr>
 *   <tr><td>s</td><td>count</td><td>{@code byte[]}, zero-padded or truncated on encode</td></tr>
 * </table>
 *
 * <p>No alignment padding is ever inserted. Whitespace between items is ignored.</p>
 */
final class StructLayout
{
    private record Field(char code, int count) {}

    private final String format;
    private final ByteOrder order;
    private final List<Field> fields;
    private final int size;
    private final int valueCount;

    private StructLayout(String format, ByteOrder order, List<Field> fields) {
        this.format = format;
        this.order = order;
        this.fields = Collections.unmodifiableList(fields);

        int bytes = 0;
        int values = 0;
        try {
            for (Field f : fields) {
                int fieldBytes = (f.code == 's' || f.code == 'x') ? f.count : Math.multiplyExact(width(f.code), f.count);
                bytes = Math.addExact(bytes, fieldBytes);
                if (f.code == 's') {
                    values += 1;
                } else if (f.code != 'x') {
                    values += f.count;
                }
            }
        } catch (ArithmeticException e) {
            throw new UdsConfigurationException("DID format '" + format + "' describes too many bytes", e);
        }
        this.size = bytes;
        this.valueCount = values;
    }

    /**
     * @throws UdsConfigurationException if {@code format} is empty or malformed
     */
    static StructLayout parse(String format) {
        Objects.requireNonNull(format, "format");
        String trimmed = format.strip();
        if (trimmed.isEmpty()) {
            throw new UdsConfigurationException("DID format string is empty");
        }

        int pos = 0;
        ByteOrder order = ByteOrder.BIG_ENDIAN;
        switch (trimmed.charAt(0)) {
            case '>', '!' -> pos = 1;
            case '<' -> {
                order = ByteOrder.LITTLE_ENDIAN;
                pos = 1;
            }
            case '=', '@' -> {
                order = ByteOrder.nativeOrder();
                pos = 1;
            }
            default -> { }
        }

        List<Field> fields = new ArrayList<>();
        while (pos < trimmed.length()) {
            char c = trimmed.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            int count = 1;
            if (Character.isDigit(c)) {
                int start = pos;
                while (pos < trimmed.length() && Character.isDigit(trimmed.charAt(pos))) {
                    pos++;
                }
                if (pos == trimmed.length()) {
                    throw new UdsConfigurationException("Repeat count without field code in DID format '" + format + "'");
                }
                try {
                    count = Integer.parseInt(trimmed.substring(start, pos));
                } catch (NumberFormatException e) {
                    throw new UdsConfigurationException("Repeat count too large in DID format '" + format + "'", e);
                }
                c = trimmed.charAt(pos);
            }

            if (width(c) < 0) {
                throw new UdsConfigurationException("Bad field code '" + c + "' in DID format '" + format + "'");
            }
            if (count > 0) {
                fields.add(new Field(c, count));
            }
            pos++;
        }

        if (fields.isEmpty()) {
            throw new UdsConfigurationException("DID format '" + format + "' describes no bytes");
        }
        return new StructLayout(format, order, fields);
    }

    String format() {
        return format;
    }

    int size() {
        return size;
    }

    int valueCount() {
        return valueCount;
    }

    byte[] pack(List<?> values) {
        Objects.requireNonNull(values, "values");
        if (values.size() != valueCount) {
            throw new IllegalArgumentException(
                    "DID format '" + format + "' expects " + valueCount + " value(s), got " + values.size());
        }

        ByteBuffer buf = ByteBuffer.allocate(size).order(order);
        int v = 0;
        for (Field f : fields) {
            switch (f.code) {
                case 'x' -> buf.put(new byte[f.count]);
                case 's' -> {
                    byte[] bytes = asBytes(values.get(v++), 's');
                    byte[] fixed = new byte[f.count];
                    System.arraycopy(bytes, 0, fixed, 0, Math.min(bytes.length, f.count));
                    buf.put(fixed);
                }
                default -> {
                    for (int n = 0; n < f.count; n++) {
                        put(buf, f.code, values.get(v++));
                    }
                }
            }
        }
        return buf.array();
    }

    List<Object> unpack(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (payload.length != size) {
            throw new IllegalArgumentException(
                    "DID format '" + format + "' requires " + size + " byte(s), got " + payload.length);
        }

        ByteBuffer buf = ByteBuffer.wrap(payload).order(order);
        List<Object> values = new ArrayList<>(valueCount);
        for (Field f : fields) {
            switch (f.code) {
                case 'x' -> buf.position(buf.position() + f.count);
                case 's' -> {
                    byte[] bytes = new byte[f.count];
                    buf.get(bytes);
                    values.add(bytes);
                }
                default -> {
                    for (int n = 0; n < f.count; n++) {
                        values.add(get(buf, f.code));
                    }
                }
            }
        }
        return values;
    }

    private static int width(char code) {
        return switch (code) {
            case 'x', 'c', 'b', 'B', '?', 's' -> 1;
            case 'h', 'H' -> 2;
            case 'i', 'I', 'l', 'L', 'f' -> 4;
            case 'q', 'Q', 'd' -> 8;
            default -> -1;
        };
    }

    private static void put(ByteBuffer buf, char code, Object value) {
        switch (code) {
            case 'c' -> {
                byte[] bytes = asBytes(value, 'c');
                if (bytes.length != 1) {
                    throw new IllegalArgumentException("Field 'c' requires a single byte");
                }
                buf.put(bytes[0]);
            }
            case '?' -> buf.put(asBoolean(value) ? (byte) 1 : (byte) 0);
            case 'b' -> buf.put((byte) inRange(value, code, Byte.MIN_VALUE, Byte.MAX_VALUE));
            case 'B' -> buf.put((byte) inRange(value, code, 0, 0xFF));
            case 'h' -> buf.putShort((short) inRange(value, code, Short.MIN_VALUE, Short.MAX_VALUE));
            case 'H' -> buf.putShort((short) inRange(value, code, 0, 0xFFFF));
            case 'i', 'l' -> buf.putInt((int) inRange(value, code, Integer.MIN_VALUE, Integer.MAX_VALUE));
            case 'I', 'L' -> buf.putInt((int) inRange(value, code, 0, 0xFFFFFFFFL));
            case 'q', 'Q' -> buf.putLong(asNumber(value, code).longValue());
            case 'f' -> buf.putFloat(asNumber(value, code).floatValue());
            case 'd' -> buf.putDouble(asNumber(value, code).doubleValue());
            default -> throw new IllegalStateException("Unhandled field code " + code);
        }
    }

    private static Object get(ByteBuffer buf, char code) {
        return switch (code) {
            case 'c' -> new byte[] { buf.get() };
            case '?' -> buf.get() != 0;
            case 'b' -> (int) buf.get();
            case 'B' -> buf.get() & 0xFF;
            case 'h' -> (int) buf.getShort();
            case 'H' -> buf.getShort() & 0xFFFF;
            case 'i', 'l' -> buf.getInt();
            case 'I', 'L' -> buf.getInt() & 0xFFFFFFFFL;
            case 'q', 'Q' -> buf.getLong();
            case 'f' -> buf.getFloat();
            case 'd' -> buf.getDouble();
            default -> throw new IllegalStateException("Unhandled field code " + code);
        };
    }

    private static long inRange(Object value, char code, long min, long max) {
        long v = asNumber(value, code).longValue();
        if (v < min || v > max) {
            throw new IllegalArgumentException(
                    "Value " + v + " out of range for field '" + code + "' (" + min + ".." + max + ")");
        }
        return v;
    }

    private static Number asNumber(Object value, char code) {
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("Field '" + code + "' requires a number, got " + describe(value));
    }

    private static boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.longValue() != 0;
        }
        throw new IllegalArgumentException("Field '?' requires a boolean, got " + describe(value));
    }

    private static byte[] asBytes(Object value, char code) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        throw new IllegalArgumentException("Field '" + code + "' requires byte[], got " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
