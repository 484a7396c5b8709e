package io.feydor.midiconvert.json;

import java.util.List;

/**
 * The JSON form of a MIDI file. startTime and duration are derived from the notes and ignored when read.
 */
public record MidiRecord(HeaderRecord header, double startTime, double duration, List<TrackRecord> tracks) {
}
