package io.feydor.midiconvert.midi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PitchBendRangeTest {
    @Test
    void defaultRangeIsTwoSemitones() {
        var range = new PitchBendRange();

        assertEquals(2, range.semitones(0));
        assertEquals(0, range.normalize(0, PitchBendRange.CENTER));
        assertEquals(-2, range.normalize(0, 0));
        assertEquals(2 * 8191 / 8192.0, range.normalize(0, PitchBendRange.MAX_VALUE), 1e-12);
    }

    @Test
    void dataEntryAfterRpnZeroSetsTheRange() {
        var range = new PitchBendRange();
        range.onController(1, ControllerId.RPN_MSB, 0);
        range.onController(1, ControllerId.RPN_LSB, 0);
        range.onController(1, ControllerId.DATA_ENTRY, 12);

        assertEquals(12, range.semitones(1));
        assertEquals(2, range.semitones(0));
        assertEquals(-12, range.normalize(1, 0));
    }

    @Test
    void dataEntryForAnotherRpnIsIgnored() {
        var range = new PitchBendRange();
        range.onController(0, ControllerId.RPN_MSB, 0);
        range.onController(0, ControllerId.RPN_LSB, 1); // fine tuning
        range.onController(0, ControllerId.DATA_ENTRY, 12);

        assertEquals(2, range.semitones(0));

        // Without RPN 101 selected, data entry means nothing
        range.onController(2, ControllerId.DATA_ENTRY, 7);
        assertEquals(2, range.semitones(2));
    }

    @Test
    void denormalizeIsTheInverse() {
        var range = new PitchBendRange();
        for (int raw : new int[]{0, 1, 4096, 8192, 12000, 16383}) {
            assertEquals(raw, range.denormalize(0, range.normalize(0, raw)));
        }
        assertEquals(PitchBendRange.MAX_VALUE, range.denormalize(0, 5));
        assertEquals(0, range.denormalize(0, -5));
    }

    @Test
    void zeroRangeDenormalizesToCenter() {
        var range = new PitchBendRange();
        range.onController(0, ControllerId.RPN_MSB, 0);
        range.onController(0, ControllerId.DATA_ENTRY, 0);

        assertEquals(PitchBendRange.CENTER, range.denormalize(0, 1));
    }
}
