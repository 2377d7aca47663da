package io.github.eutro.ljdecomp.core.bc;

import io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * A cursor over dump bytes that reports truncation as {@link MalformedBytecodeException}.
 */
final class ByteReader {
    private final ByteBuffer buf;
    private final int base;
    private boolean bigEndian;

    ByteReader(ByteBuffer buf) {
        this.buf = buf.duplicate();
        this.base = buf.position();
    }

    void setBigEndian(boolean bigEndian) {
        this.bigEndian = bigEndian;
    }

    /**
     * Get the offset of the next byte, relative to where reading started.
     *
     * @return The offset.
     */
    long offset() {
        return buf.position() - base;
    }

    boolean hasRemaining() {
        return buf.hasRemaining();
    }

    private void need(int n, String what) {
        if (n < 0 || buf.remaining() < n) {
            throw new MalformedBytecodeException(offset(), what + " (" + n + " bytes, "
                    + buf.remaining() + " remaining)");
        }
    }

    int u8() {
        need(1, "a byte");
        return buf.get() & 0xff;
    }

    int u16() {
        need(2, "a 16 bit value");
        int b0 = buf.get() & 0xff, b1 = buf.get() & 0xff;
        return bigEndian ? (b0 << 8) | b1 : (b1 << 8) | b0;
    }

    int u32() {
        need(4, "a 32 bit value");
        int b0 = buf.get() & 0xff, b1 = buf.get() & 0xff, b2 = buf.get() & 0xff, b3 = buf.get() & 0xff;
        return bigEndian
                ? (b0 << 24) | (b1 << 16) | (b2 << 8) | b3
                : (b3 << 24) | (b2 << 16) | (b1 << 8) | b0;
    }

    /**
     * Read an unsigned LEB128 value of at most 32 bits.
     *
     * @return The value, as the low 32 bits of the result.
     */
    long uleb128() {
        long start = offset();
        long value = 0;
        int shift = 0;
        int b;
        do {
            b = u8();
            if (shift > 28) throw new MalformedBytecodeException(start, "a ULEB128 value of at most 32 bits");
            value |= (long) (b & 0x7f) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);
        return value & 0xffffffffL;
    }

    /**
     * Read a ULEB128 value used as a count or length.
     *
     * @param what What the count is, for error messages.
     * @return The count.
     */
    int count(String what) {
        long start = offset();
        long value = uleb128();
        if (value > buf.remaining()) {
            throw new MalformedBytecodeException(start, what + " that fits in the remaining "
                    + buf.remaining() + " bytes, got " + value);
        }
        return (int) value;
    }

    /**
     * Read the 33 bit variant used for numeric constants, whose lowest bit is a tag.
     *
     * @return {@code [tag, low 32 bits]}.
     */
    long[] uleb128_33() {
        long start = offset();
        int first = u8();
        long value = first >>> 1;
        if (value >= 0x40) {
            value &= 0x3f;
            int shift = -1;
            int b;
            do {
                b = u8();
                shift += 7;
                if (shift > 31) throw new MalformedBytecodeException(start, "a 33 bit ULEB128 value");
                value |= (long) (b & 0x7f) << shift;
            } while ((b & 0x80) != 0);
        }
        return new long[]{first & 1, value & 0xffffffffL};
    }

    byte[] bytes(int n, String what) {
        need(n, what);
        byte[] out = new byte[n];
        buf.get(out);
        return out;
    }

    /**
     * Read a string whose length was decoded from a constant tag.
     *
     * @param length The length, which may be anything a tag can hold.
     * @param at     The offset of the tag, for error messages.
     * @return The string.
     */
    String string(long length, long at) {
        if (length > buf.remaining()) {
            throw new MalformedBytecodeException(at, "a string that fits in the remaining "
                    + buf.remaining() + " bytes, got " + length + " bytes");
        }
        return new String(bytes((int) length, "string contents"), StandardCharsets.UTF_8);
    }

    /**
     * Read a zero-terminated string, whose first byte may already have been read.
     *
     * @param first The first byte, or -1 if none was consumed.
     * @return The string.
     */
    String cstring(int first) {
        StringBuilder raw = new StringBuilder();
        int b = first == -1 ? u8() : first;
        while (b != 0) {
            raw.append((char) b);
            b = u8();
        }
        return new String(raw.toString().getBytes(StandardCharsets.ISO_8859_1), StandardCharsets.UTF_8);
    }
}
