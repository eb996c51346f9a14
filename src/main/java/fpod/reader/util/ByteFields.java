package fpod.reader.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Utility functions for reading fixed-position fields from header blocks
 * and data records.
 *
 * All multi-byte integers in the data files are big-endian. Offsets are
 * absolute; the buffer position is never changed.
 */
public final class ByteFields
{
    private ByteFields()
    {
    }

    /**
     * Read an unsigned byte.
     *
     * @param buf the buffer
     * @param offset absolute index
     * @return value in range [0:255]
     */
    public static int uint8(final ByteBuffer buf, final int offset)
    {
        return buf.get(offset) & 0xff;
    }

    /**
     * Read an unsigned 16-bit big-endian quantity.
     */
    public static int uint16(final ByteBuffer buf, final int offset)
    {
        return (uint8(buf, offset) << 8) | uint8(buf, offset + 1);
    }

    /**
     * Build an integer from <tt>size</tt> bytes, most significant byte
     * first.  Each byte is shifted in from the right, so a field shorter
     * than 8 bytes is zero-extended.  A field extending past the buffer
     * limit reads as 0.
     *
     * @param buf the buffer
     * @param offset absolute index of the first byte
     * @param size number of bytes, 1 to 8
     * @return the accumulated value
     */
    public static long constructInt(final ByteBuffer buf, final int offset,
                                    final int size)
    {
        long res = 0L;
        if (offset < 0 || offset + size > buf.limit()) {
            return res;
        }

        for (int i = 0; i < size; i++) {
            res = (res << 8) | uint8(buf, offset + i);
        }
        return res;
    }

    /**
     * Read a signed 32-bit big-endian quantity, or 0 past the limit.
     */
    public static int int32(final ByteBuffer buf, final int offset)
    {
        return (int) constructInt(buf, offset, 4);
    }

    /**
     * Copy a fixed-width text field.  Each byte becomes one character;
     * padding and control bytes are kept as they are.
     *
     * @param buf the buffer
     * @param offset absolute index of the first byte
     * @param length field width
     * @return the field text, always <tt>length</tt> characters unless
     *         the field runs past the limit, in which case it is cut short
     */
    public static String text(final ByteBuffer buf, final int offset,
                              final int length)
    {
        final int end = Math.min(offset + length, buf.limit());
        if (offset < 0 || offset >= end) {
            return "";
        }

        byte[] raw = new byte[end - offset];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = buf.get(offset + i);
        }
        return new String(raw, StandardCharsets.ISO_8859_1);
    }

    /**
     * Count the bytes of the buffer which hold the given value.
     */
    public static int count(final ByteBuffer buf, final int value)
    {
        final byte target = (byte) value;
        int n = 0;
        for (int i = 0; i < buf.limit(); i++) {
            if (buf.get(i) == target) {
                n++;
            }
        }
        return n;
    }
}
