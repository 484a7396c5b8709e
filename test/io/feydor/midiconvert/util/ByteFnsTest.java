package io.feydor.midiconvert.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteFnsTest {
    @Test
    void toHexWorks() {
        // {0xF, 0xF, 0xFF, 0x5} => 0F0FFF05
        byte[] buf1 = new byte[]{0x0F, 0x0F, (byte)0xFF, 0x05};
        assertEquals("0F0FFF05", ByteFns.toHex(buf1));

        byte[] allOnes = new byte[]{(byte)0xFF, (byte)0xFF, (byte)0xFF, (byte)0xFF};
        assertEquals("FFFFFFFF", ByteFns.toHex(allOnes));

        byte[] allZeros = new byte[]{0, 0, 0, 0};
        assertEquals("00000000", ByteFns.toHex(allZeros));
    }

    @Test
    void toHexWorks_byte() {
        assertEquals("FF", ByteFns.toHex((byte)255));
        assertEquals("7F", ByteFns.toHex((byte)127));
        assertEquals("00", ByteFns.toHex((byte)0));
    }

    @Test
    void toUnsignedIntWorks() {
        // Test that the result is really unsigned
        assertEquals(255, ByteFns.toUnsignedInt(new byte[]{(byte)0xFF}));
        assertEquals(65535, ByteFns.toUnsignedInt(new byte[]{(byte)0xFF, (byte)0xFF}));
        assertEquals(16777215, ByteFns.toUnsignedInt(new byte[]{(byte)0xFF, (byte)0xFF, (byte)0xFF}));
        assertEquals(Integer.MAX_VALUE, ByteFns.toUnsignedInt(new byte[]{(byte)0x7F, (byte)0xFF, (byte)0xFF, (byte)0xFF}));

        // Throws an error when the value is greater than Integer.MAX_VALUE
        assertThrows(ArithmeticException.class, () -> ByteFns.toUnsignedInt(new byte[]{(byte)0xFF, (byte)0xFF, (byte)0xFF, (byte)0xFF}));
    }

    @Test
    void toUnsignedShortWorks() {
        assertEquals(0x01E0, ByteFns.toUnsignedShort(new byte[]{0x01, (byte)0xE0}));
        assertEquals(65535, ByteFns.toUnsignedShort(new byte[]{(byte)0xFF, (byte)0xFF}));
        assertEquals(5, ByteFns.toUnsignedShort(new byte[]{0x05}));
    }

    @Test
    void fromHexWorks() {
        assertArrayEquals(new byte[]{(byte)0xFF, (byte)0xFF, (byte)0xFF, (byte)0xFF}, ByteFns.fromHex("FFFFFFFF"));
        assertArrayEquals(new byte[]{(byte)0xFF, (byte)0xFF, (byte)0xFF}, ByteFns.fromHex("FFFFFF"));
        assertArrayEquals(new byte[]{0x4D, 0x54, 0x68, 0x64}, ByteFns.fromHex("4D 54\n68 64"));
        assertThrows(IllegalArgumentException.class, () -> ByteFns.fromHex("FFF"));
    }

    @Test
    void toBytesIsBigEndian() {
        assertArrayEquals(new byte[]{0x01, (byte)0xE0}, ByteFns.toBytes(0x01E0, 2));
        assertArrayEquals(new byte[]{0x07, (byte)0xA1, 0x20}, ByteFns.toBytes(500_000, 3));
        assertArrayEquals(new byte[]{0, 0, 0, 6}, ByteFns.toBytes(6, 4));
        assertThrows(IllegalArgumentException.class, () -> ByteFns.toBytes(1, 5));
    }
}
