package io.feydor.midiconvert.midi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrackSplitterTest {
    private static Track mixedTrack() {
        var mixed = new Track("Mixed");
        mixed.setChannelNumber(1);
        mixed.setInstrumentNumber(5);
        mixed.noteOn(60, 0.0, 1, 9, 0);
        mixed.noteOn(61, 0.1, 1, 1, 33);
        mixed.noteOn(62, 0.2, 1, 1, ChannelInstrument.UNASSIGNED);
        mixed.noteOn(63, 0.3, 1, ChannelInstrument.UNASSIGNED, ChannelInstrument.UNASSIGNED);
        mixed.noteOn(64, 0.4, 1, 9, 0);
        mixed.addControlChange(ControllerId.of(ControllerId.VOLUME), 0.0, 0.5, 1, 33);
        mixed.addControlChange(ControllerId.PITCH_BEND, 0.5, 1.0, 2, ChannelInstrument.UNASSIGNED);
        return mixed;
    }

    @Test
    void everyNoteEndsUpInExactlyOneTrack() {
        var mixed = mixedTrack();
        var tracks = new TrackSplitter().split(mixed);

        int notes = tracks.stream().mapToInt(Track::length).sum();
        int changes = tracks.stream().mapToInt(Track::numControlChanges).sum();
        assertEquals(mixed.length(), notes);
        assertEquals(mixed.numControlChanges(), changes);
    }

    @Test
    void tracksAreOrderedByChannelThenInstrument() {
        var tracks = new TrackSplitter().split(mixedTrack());

        // (1, 5) (1, 33) (2, 5) (9, 0)
        assertEquals(4, tracks.size());
        assertEquals(List.of(1, 1, 2, 9), tracks.stream().map(t -> t.getChannelNumber().getAsInt()).toList());
        assertEquals(List.of(5, 33, 5, 0), tracks.stream().map(t -> t.getInstrumentNumber().getAsInt()).toList());
        assertEquals(List.of(0, 1, 2, 3), tracks.stream().map(Track::getId).toList());
        tracks.forEach(t -> assertEquals("Mixed", t.getName().orElseThrow()));
    }

    @Test
    void elementsInheritTheTrackChannelAndInstrument() {
        var tracks = new TrackSplitter().split(mixedTrack());
        var first = tracks.get(0);

        // Pitches 62 and 63 have no instrument, 63 no channel either
        assertEquals(List.of(62, 63), first.getNotes().stream().map(Note::getPitch).toList());
        for (var note : first.getNotes()) {
            assertEquals(1, note.getChannel().getAsInt());
            assertEquals(5, note.getInstrument().getAsInt());
        }
        assertEquals(2, tracks.get(3).length());
        assertEquals(1, tracks.get(1).getControlChanges(ControllerId.of(ControllerId.VOLUME)).size());
        assertEquals(1, tracks.get(2).getControlChanges(ControllerId.PITCH_BEND).size());
    }

    @Test
    void idsContinueAcrossCalls() {
        var splitter = new TrackSplitter();
        splitter.split(mixedTrack());
        var tracks = splitter.split(mixedTrack());

        assertEquals(4, tracks.get(0).getId());
        assertEquals(8, splitter.getNextId());
    }

    @Test
    void emptyTrackGivesNoTracks() {
        var splitter = new TrackSplitter();
        assertTrue(splitter.split(new Track("Title")).isEmpty());
        assertEquals(0, splitter.getNextId());
    }

    @Test
    void instrumentFallsBackToPiano() {
        var mixed = new Track();
        mixed.noteOn(60, 0, 1, 0, ChannelInstrument.UNASSIGNED);

        var tracks = new TrackSplitter().split(mixed);

        assertEquals(0, tracks.get(0).getInstrumentNumber().getAsInt());
        assertEquals(0, tracks.get(0).getChannelNumber().getAsInt());
    }
}
