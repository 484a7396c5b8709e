package io.feydor.midiconvert.midi;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class ControllerIdTest {
    @Test
    void pitchBendSortsAfterEveryController() {
        var ids = new TreeSet<>(List.of(ControllerId.PITCH_BEND, ControllerId.of(127), ControllerId.of(0), ControllerId.of(64)));

        assertEquals(List.of(ControllerId.of(0), ControllerId.of(64), ControllerId.of(127), ControllerId.PITCH_BEND), List.copyOf(ids));
    }

    @Test
    void parseIsTheInverseOfToString() {
        assertEquals("7", ControllerId.of(7).toString());
        assertEquals("pitchBend", ControllerId.PITCH_BEND.toString());
        assertSame(ControllerId.of(7), ControllerId.parse("7"));
        assertSame(ControllerId.PITCH_BEND, ControllerId.parse("pitchBend"));
        assertThrows(IllegalArgumentException.class, () -> ControllerId.parse("volume"));
        assertThrows(IllegalArgumentException.class, () -> ControllerId.parse("128"));
    }

    @Test
    void pitchBendHasNoNumber() {
        assertTrue(ControllerId.PITCH_BEND.isPitchBend());
        assertThrows(IllegalStateException.class, ControllerId.PITCH_BEND::getNumber);
        assertEquals(0, ControllerId.of(0).getNumber());
    }
}
