package io.feydor.midiconvert.json;

import io.feydor.midiconvert.midi.ChannelInstrument;
import io.feydor.midiconvert.midi.ControlChange;
import io.feydor.midiconvert.midi.ControllerId;
import io.feydor.midiconvert.midi.Header;
import io.feydor.midiconvert.midi.Midi;
import io.feydor.midiconvert.midi.Note;
import io.feydor.midiconvert.midi.TimeSignature;
import io.feydor.midiconvert.midi.Track;
import io.feydor.midiconvert.util.TextFns;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Converts between the model and its JSON records.
 */
public final class MidiRecords {
    private MidiRecords() {
    }

    public static MidiRecord toRecord(Midi midi) {
        var header = midi.getHeader();
        var ts = header.getTimeSignature();
        var headerRecord = new HeaderRecord(header.getName().orElse(""), header.getPulsesPerQuarter(),
                header.getBeatsPerMinute(), new int[]{ts.numerator(), ts.denominator()}, header.getFormatType());

        List<TrackRecord> tracks = new ArrayList<>(midi.numTracks());
        for (var track : midi.getTracks()) {
            tracks.add(toRecord(track));
        }
        return new MidiRecord(headerRecord, midi.getStartTime(), midi.getDuration(), tracks);
    }

    public static TrackRecord toRecord(Track track) {
        List<NoteRecord> notes = new ArrayList<>(track.length());
        for (var note : track.getNotes()) {
            notes.add(new NoteRecord(note.getName(), note.getPitch(), note.getTime(),
                    note.isReleased() ? note.getDuration().getAsDouble() : null, note.getVelocity(),
                    boxed(note.getChannel()), boxed(note.getInstrument())));
        }

        Map<String, List<ControlChangeRecord>> controlChanges = new LinkedHashMap<>();
        track.getControlChanges().forEach((id, changes) -> {
            List<ControlChangeRecord> records = new ArrayList<>(changes.size());
            for (var cc : changes) {
                records.add(new ControlChangeRecord(id.toString(), cc.getTime(), cc.getValue(),
                        boxed(cc.getChannel()), boxed(cc.getInstrument())));
            }
            controlChanges.put(id.toString(), records);
        });

        return new TrackRecord(track.getId(), track.getName().orElse(""),
                track.getChannelNumber().orElse(ChannelInstrument.UNASSIGNED),
                track.getInstrumentNumber().orElse(ChannelInstrument.UNASSIGNED),
                track.getInstrumentName().orElse(null), track.getInstrumentFamily().orElse(null),
                track.isPercussion(), track.getStartTime(), track.getDuration(), notes, controlChanges);
    }

    /**
     * Rebuilds the model. Derived fields of the records are not read.
     * @throws IllegalArgumentException When a record holds an invalid value, e.g. a pitch above 127
     */
    public static Midi fromRecord(MidiRecord record) {
        var headerRecord = record.header();
        var header = headerRecord == null ? new Header() : fromRecord(headerRecord);

        List<Track> tracks = new ArrayList<>();
        if (record.tracks() != null) {
            for (var trackRecord : record.tracks()) {
                tracks.add(fromRecord(trackRecord));
            }
        }
        return new Midi(header, tracks);
    }

    private static Header fromRecord(HeaderRecord record) {
        var name = TextFns.isBlank(record.name()) ? null : record.name();
        int[] ts = record.timeSignature();
        var timeSignature = ts == null || ts.length != 2 ? Header.DEFAULT_TIME_SIGNATURE : new TimeSignature(ts[0], ts[1]);
        int ppq = record.pulsesPerQuarter() == 0 ? Header.DEFAULT_PPQ : record.pulsesPerQuarter();
        double bpm = record.bpm() == 0 ? Header.DEFAULT_BPM : record.bpm();
        return new Header(name, ppq, bpm, timeSignature, record.formatType());
    }

    public static Track fromRecord(TrackRecord record) {
        var name = TextFns.isBlank(record.name()) ? null : record.name();
        var track = new Track(record.id(), name, record.channelNumber(), record.instrumentNumber());

        if (record.notes() != null) {
            for (var note : record.notes()) {
                track.addNote(new Note(note.midi(), note.time(), note.duration(), note.velocity(),
                        unboxed(note.channel()), unboxed(note.instrument())));
            }
        }

        if (record.controlChanges() != null) {
            record.controlChanges().forEach((key, changes) -> {
                var id = ControllerId.parse(key);
                for (var cc : changes) {
                    track.addControlChange(new ControlChange(id, cc.time(), cc.value(),
                            unboxed(cc.channel()), unboxed(cc.instrument())));
                }
            });
        }
        return track;
    }

    private static Integer boxed(OptionalInt value) {
        return value.isPresent() ? value.getAsInt() : null;
    }

    private static int unboxed(Integer value) {
        return value == null ? ChannelInstrument.UNASSIGNED : value;
    }
}
