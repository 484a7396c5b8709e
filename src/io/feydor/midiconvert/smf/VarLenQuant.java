package io.feydor.midiconvert.smf;

import io.feydor.midiconvert.smf.exceptions.InvalidVarLenParseException;

import java.util.Iterator;
import java.util.stream.IntStream;

/**
 * A variable length quantity.
 * <pre>
 * Most numbers are 7 bits per byte, most significant bits first.
 * All bytes except the last have bit 7 set, and the last has bit 7 clear.
 * if the number is between 0 and 127, it is represented as 1 byte
 * Some examples:
 * Number            Variable Length Quantity
 * ------------------------------------------
 * 00000040          40
 * 0000007F (127)    7F
 * 00000080 (128)    81 00
 * 00002000 (8192)   C0 00
 * 00003FFF (16383)  FF 7F
 * 00004000 (16384)  81 80 00
 * </pre>
 */
public class VarLenQuant {
    /** The quantity itself */
    public final int value;

    /** The number of bytes used to store the quantity */
    public final int nbytes;

    private static final int MAX_BYTES = 4;

    /** The largest value that fits in 4 bytes of 7 bits */
    public static final int MAX_VALUE = 0x0FFFFFFF;

    private VarLenQuant(int value, int nbytes) {
        this.value = value;
        this.nbytes = nbytes;
    }

    static public VarLenQuant decode(int[] bytes) {
        return decode(IntStream.of(bytes).iterator());
    }

    /**
     * src: <a href="https://en.wikipedia.org/wiki/Variable-length_quantity">Variable-length quantity</a>
     * @param bytes returns bytes from MSB to LSB
     * @return the decoded value and the number of bytes it took up
     * @throws InvalidVarLenParseException When more than 4 bytes are used or the bytes run out before the last one
     */
    static public VarLenQuant decode(Iterator<Integer> bytes) {
        // Only the bottom 7 bits of each byte contributes to the value, the MSB indicates (when set) that another byte follows.
        int val = 0;
        int nbytes = 0;
        while (true) {
            if (!bytes.hasNext()) {
                throw new InvalidVarLenParseException("Failed to parse Varlen: the bytes ran out after nbytes=" + nbytes);
            }
            int b = bytes.next();

            val = (val << 7) | (b & 0x7f); // concat the 7 least significant bits
            nbytes++;

            if ((b & 0x80) == 0) {
                break;
            }
            if (nbytes == MAX_BYTES) {
                throw new InvalidVarLenParseException("The nbytes in the Varlen representation was greater than 4 bytes!");
            }
        }

        return new VarLenQuant(val, nbytes);
    }

    /**
     * Converts a number into VLQ bytes. Reverse of decode.
     */
    static public byte[] encode(int n) {
        if (n < 0 || n > MAX_VALUE) {
            throw new IllegalArgumentException("A Varlen must be between 0 and " + MAX_VALUE + ": n=" + n);
        }

        int i = 0;
        byte[] bytes = new byte[MAX_BYTES];
        while (n > 0x7f) {
            byte lsb = (byte) (n & 0x7f);
            if (i != 0) lsb |= (byte) 0x80; // set sb for all but first group
            bytes[i++] = lsb;
            n >>= 7;
        }
        if (i != 0) n |= 0x80; // set last msb, unless first
        bytes[i++] = (byte) n;

        // bytes is in reverse order
        byte[] buf = new byte[i];
        for (int j = 0; j < buf.length; ++j) {
            buf[j] = bytes[buf.length - j - 1];
        }
        return buf;
    }

    @Override
    public String toString() {
        return "VarLenQuant{" +
                "value=" + value +
                ", nbytes=" + nbytes +
                '}';
    }
}
