package io.feydor.midiconvert.midi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrackTest {
    @Test
    void noteOffReleasesTheOldestNoteOfThePitch() {
        var track = new Track();
        var first = track.noteOn(60, 0.0, 1, 0, 0);
        var second = track.noteOn(60, 0.5, 1, 0, 0);

        assertSame(first, track.noteOff(60, 1.0, 0).orElseThrow());
        assertSame(second, track.noteOff(60, 2.0, 0).orElseThrow());
        assertEquals(1.0, first.getDuration().getAsDouble(), 1e-9);
        assertEquals(1.5, second.getDuration().getAsDouble(), 1e-9);
    }

    @Test
    void noteOffMatchesTheChannel() {
        var track = new Track();
        track.noteOn(60, 0.0, 1, 3, 0);

        assertTrue(track.noteOff(60, 1.0, 4).isEmpty());
        assertTrue(track.noteOff(61, 1.0, 3).isEmpty());
        assertTrue(track.noteOff(60, 1.0, 3).isPresent());
        assertTrue(track.noteOff(60, 2.0, 3).isEmpty());
    }

    @Test
    void addNoteUsesTheTrackChannelAndInstrument() {
        var track = new Track(0, "Lead", 2, 81);
        var note = track.addNote("A4", 1.0, 0.5, 0.75);

        assertEquals(69, note.getPitch());
        assertEquals(2, note.getChannel().getAsInt());
        assertEquals(81, note.getInstrument().getAsInt());
        assertEquals(1, track.length());
    }

    @Test
    void derivedFieldsWork() {
        var track = new Track(0, "Drums", Track.PERCUSSION_CHANNEL, 0);

        assertTrue(track.isEmpty());
        assertEquals(0, track.getStartTime());
        assertEquals(0, track.getDuration());

        track.addNote(36, 2.0, 0.5, 1);
        track.addNote(38, 1.0, 3.0, 1);
        assertFalse(track.isEmpty());
        assertTrue(track.isPercussion());
        assertEquals(1.0, track.getStartTime());
        assertEquals(4.0, track.getDuration());
        assertEquals("acoustic grand piano", track.getInstrumentName().orElseThrow());
        assertEquals("piano", track.getInstrumentFamily().orElseThrow());
    }

    @Test
    void trackWithOnlyControlChangesIsNotEmpty() {
        var track = new Track();
        track.addControlChange(ControllerId.of(ControllerId.VOLUME), 0, 0.5);

        assertFalse(track.isEmpty());
        assertEquals(0, track.length());
        assertEquals(1, track.numControlChanges());
    }

    @Test
    void sliceKeepsNotesStartingInTheRangeAndClipsThem() {
        var track = new Track(3, "Piano", 0, 0);
        track.addNote(60, 0.5, 1.5, 1);
        track.addNote(62, 2.5, 1.5, 1);
        track.addControlChange(ControllerId.of(ControllerId.SUSTAIN), 0.5, 1);
        track.addControlChange(ControllerId.of(ControllerId.SUSTAIN), 2.0, 0);

        var sliced = track.slice(1.0, 3.0);

        assertEquals(3, sliced.getId());
        assertEquals("Piano", sliced.getName().orElseThrow());
        assertEquals(1, sliced.length());
        var note = sliced.getNotes().get(0);
        assertEquals(62, note.getPitch());
        assertEquals(2.5, note.getTime());
        assertEquals(0.5, note.getDuration().getAsDouble(), 1e-9);
        assertEquals(1, sliced.getControlChanges(ControllerId.of(ControllerId.SUSTAIN)).size());

        // The source is unchanged
        assertEquals(2, track.length());
        assertEquals(1.5, track.getNotes().get(1).getDuration().getAsDouble(), 1e-9);
    }

    @Test
    void scaleMultipliesTimesAndDurations() {
        var track = new Track();
        track.addNote(60, 1.0, 0.5, 1);
        track.addControlChange(ControllerId.PITCH_BEND, 2.0, -1.5);

        track.scale(2);

        assertEquals(2.0, track.getNotes().get(0).getTime(), 1e-9);
        assertEquals(1.0, track.getNotes().get(0).getDuration().getAsDouble(), 1e-9);
        assertEquals(4.0, track.getControlChanges(ControllerId.PITCH_BEND).get(0).getTime(), 1e-9);
        assertEquals(-1.5, track.getControlChanges(ControllerId.PITCH_BEND).get(0).getValue());
    }

    @Test
    void viewsAreUnmodifiable() {
        var track = new Track();
        track.addNote(60, 0, 1, 1);

        assertThrows(UnsupportedOperationException.class, () -> track.getNotes().clear());
        assertThrows(UnsupportedOperationException.class, () -> track.getControlChanges().clear());
    }

    @Test
    void whenChannelIsInvalid_thenThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Track(0, null, 16, 0));
        assertThrows(IllegalArgumentException.class, () -> new Track().setChannelNumber(-2));
    }
}
