package io.feydor.midiconvert.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextFnsTest {
    @Test
    void cleanNameRemovesControlCharactersAndTrims() {
        assertEquals("Piano", TextFns.cleanName("  Piano\u0000\u0000"));
        assertEquals("LeadGuitar", TextFns.cleanName("Lead\tGuitar"));
        assertEquals("Bass", TextFns.cleanName("\u0001Bass\r\n"));
    }

    @Test
    void cleanNameOfNullIsEmpty() {
        assertEquals("", TextFns.cleanName(null));
    }

    @Test
    void isBlankWorks() {
        assertTrue(TextFns.isBlank(null));
        assertTrue(TextFns.isBlank("  "));
        assertFalse(TextFns.isBlank("a"));
    }
}
