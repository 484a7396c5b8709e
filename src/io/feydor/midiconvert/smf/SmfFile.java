package io.feydor.midiconvert.smf;

import java.util.List;

/**
 * A tokenized Standard MIDI File: the header and, for each MTrk chunk, its events in file order.
 */
public record SmfFile(SmfHeader header, List<List<MidiEvent>> tracks) {
    public SmfFile {
        tracks = tracks.stream().map(List::copyOf).toList();
    }

    public int numTracks() {
        return tracks.size();
    }
}
