package io.feydor.midiconvert.util;

import java.nio.ByteBuffer;

/**
 * Static functions for working with byte buffers
 */
public class ByteFns {
    /**
     * Converts a byte array into 2-digit hexadecimal representation.
     * For example, {0xF, 0xF, 0xFF, 0x5} => 0F0FFF05
     *
     * @param buf the buffer to convert
     * @return a hexadecimal representation of the buffer
     */
    public static String toHex(byte[] buf) {
        var sb = new StringBuilder();
        for (byte b : buf) {
            sb.append(String.format("%02X", b));
        }
        return sb.toString();
    }

    public static String toHex(byte n) {
        return String.format("%02X", (0xFF & n));
    }

    /**
     * Reverse of toHex. Whitespace between the digit pairs is allowed, so fixtures can be written as "4D 54 68 64".
     */
    public static byte[] fromHex(String hexString) {
        String digits = hexString.replaceAll("\\s+", "");
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Hexstring must be a valid hexadecimal number (it's length must be even). " + hexString);
        }

        byte[] buf = new byte[digits.length() / 2];
        int bp = 0;
        for (int i = 0; i <= digits.length() - 2; i += 2) {
            short b = (short) Integer.parseUnsignedInt(digits.substring(i, i + 2), 16);
            buf[bp++] = (byte) b;
        }
        return buf;
    }

    /**
     * Converts a byte buffer into an unsigned integer.
     * If the byte buffer is less than 4 bytes, the byte buffer is zero-extended & widened to 4 bytes.
     *
     * @param buf the buffer to convert
     * @return the unsigned integer value of the buffer
     * @throws ArithmeticException When the provided buffer represents a value > Integer.MAX_VALUE.
     *                             For example, {0x8F, 0xFF, 0xFF, 0xFF} is Integer.MAX_VALUE + 1 which would wrap back to Intger.MIN_VALUE.
     */
    public static int toUnsignedInt(byte[] buf) {
        if (buf.length < 4) {
            buf = widenWithZeros(buf, 4);
        }

        if ((buf[0] & 0xFF) > 0x7F) {
            throw new ArithmeticException("Attempting to convert a buffer whose value is greater than Integer.MAX_VALUE.");
        }

        int val = ByteBuffer.wrap(buf).getInt();
        return (int) (val & 0xffffffffL); // drop sign bit
    }

    /**
     * Converts a 2-byte big-endian buffer into an int in 0 to 65535
     *
     * @param buf the buffer to convert
     * @return the unsigned value of the buffer
     */
    public static int toUnsignedShort(byte[] buf) {
        if (buf.length < 2) {
            buf = widenWithZeros(buf, 2);
        }

        return ByteBuffer.wrap(buf).getShort() & 0xffff;
    }

    /**
     * Big-endian bytes of the lowest nbytes bytes of value. Reverse of toUnsignedInt/toUnsignedShort.
     * Example: toBytes(0x0001E0, 2) => [0x01, 0xE0]
     */
    public static byte[] toBytes(int value, int nbytes) {
        if (nbytes < 1 || nbytes > 4) {
            throw new IllegalArgumentException("nbytes must be between 1 and 4: nbytes=" + nbytes);
        }

        byte[] buf = new byte[nbytes];
        for (int i = nbytes - 1; i >= 0; i--) {
            buf[i] = (byte) (value & 0xFF);
            value >>>= 8;
        }
        return buf;
    }

    /**
     * Widens a buffer to a target length and zero-extends the most significant bytes.
     * Example: widenWithZeros([0xFF, 0xFF], 4) => [0, 0, 0xFF, 0xFF]
     *
     * @param buf       The buffer to widen
     * @param targetLen The length of the widened buffer
     * @return The buffer widened to targetLength and zero-extended
     */
    private static byte[] widenWithZeros(byte[] buf, int targetLen) {
        if (buf.length == targetLen) {
            return buf;
        }

        byte[] widened = new byte[targetLen];
        int offset = targetLen - buf.length;
        System.arraycopy(buf, 0, widened, offset, buf.length);
        return widened;
    }
}
