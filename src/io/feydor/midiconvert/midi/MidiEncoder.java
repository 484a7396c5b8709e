package io.feydor.midiconvert.midi;

import io.feydor.midiconvert.smf.MidiEvent;
import io.feydor.midiconvert.smf.MidiEventSubType;
import io.feydor.midiconvert.smf.MidiFileFormat;
import io.feydor.midiconvert.smf.SmfFile;
import io.feydor.midiconvert.smf.SmfHeader;
import io.feydor.midiconvert.smf.SmfWriter;
import io.feydor.midiconvert.smf.VarLenQuant;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Encodes a {@link Midi} as a format 1 MIDI file, one MTrk chunk per track.
 * <p>
 * Every chunk starts with a Set Tempo event at the header's tempo. Tempo changes of a decoded file were already applied
 * to its times and are not written back.
 */
public class MidiEncoder {
    private static final Logger LOGGER = Logger.getLogger(MidiEncoder.class.getName());

    /** Events at the same tick are written in this order */
    private static final Comparator<TickedEvent> EVENT_ORDER =
            Comparator.comparingLong(TickedEvent::tick).thenComparingInt(TickedEvent::rank);

    /** At the same time, a parameter must be selected before Data Entry sets it */
    private static final Comparator<ControlChange> CONTROL_CHANGE_ORDER =
            Comparator.comparingDouble(ControlChange::getTime).thenComparingInt(cc -> selectsParameter(cc) ? 0 : 1);

    private final SmfWriter writer;

    public MidiEncoder() {
        this(new SmfWriter());
    }

    public MidiEncoder(SmfWriter writer) {
        this.writer = writer;
    }

    private static final int ZERO_LENGTH_NOTE_OFF_RANK = 6;

    /** Set Tempo holds 3 bytes */
    static final int MAX_MICROS_PER_BEAT = 0xFFFFFF;

    private record TickedEvent(long tick, int rank, MidiEvent event) {
        static TickedEvent of(long tick, MidiEvent event) {
            return new TickedEvent(tick, rankOf(event.subType()), event);
        }

        private static int rankOf(MidiEventSubType subType) {
            return switch (subType) {
                case PROGRAM_CHANGE -> 1;
                case CONTROLLER -> 2;
                case PITCH_BEND -> 3;
                case NOTE_OFF -> 4;
                case NOTE_ON -> 5;
                default -> 0;
            };
        }
    }

    public byte[] encode(Midi midi) {
        var header = midi.getHeader();
        List<List<TickedEvent>> chunks = new ArrayList<>();

        // The file name gets its own track unless the first track without notes already carries it
        var name = header.getName().filter(n -> !n.isEmpty());
        if (name.isPresent()) {
            var firstEmpty = midi.getTracks().stream().filter(t -> t.length() == 0).findFirst();
            boolean named = firstEmpty.flatMap(Track::getName).filter(name.get()::equals).isPresent();
            if (!named) {
                List<TickedEvent> nameChunk = new ArrayList<>();
                nameChunk.add(TickedEvent.of(0, MidiEvent.trackName(0, name.get())));
                chunks.add(nameChunk);
            }
        }

        for (var track : midi.getTracks()) {
            chunks.add(encodeTrack(track, header));
        }

        long microsPerBeat = TimeConverter.bpmToMicrosPerBeat(header.getBeatsPerMinute());
        if (microsPerBeat < 1 || microsPerBeat > MAX_MICROS_PER_BEAT) {
            throw new IllegalArgumentException("The tempo cannot be written as a Set Tempo event: bpm="
                    + header.getBeatsPerMinute() + " microsPerBeat=" + microsPerBeat);
        }
        List<List<MidiEvent>> tracks = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            var chunk = chunks.get(i);
            chunk.add(0, TickedEvent.of(0, MidiEvent.setTempo(0, (int) microsPerBeat)));
            if (i == 0) {
                var ts = header.getTimeSignature();
                chunk.add(1, TickedEvent.of(0, MidiEvent.timeSignature(0, ts.numerator(), ts.denominator())));
            }
            tracks.add(toDeltaTimes(chunk));
        }

        var smfHeader = new SmfHeader(MidiFileFormat.FORMAT_1, tracks.size(), header.getPulsesPerQuarter());
        LOGGER.log(Level.FINE, "Encoding {0} tracks: {1}", new Object[]{tracks.size(), smfHeader});
        return writer.write(new SmfFile(smfHeader, tracks));
    }

    private List<TickedEvent> encodeTrack(Track track, Header header) {
        List<TickedEvent> events = new ArrayList<>();
        int trackChannel = channelOf(OptionalInt.empty(), track);

        track.getName().filter(n -> !n.isEmpty())
                .ifPresent(n -> events.add(TickedEvent.of(0, MidiEvent.trackName(0, n))));
        track.getInstrumentNumber().stream().filter(program -> program >= 0 && program <= 127).findFirst()
                .ifPresent(program -> events.add(TickedEvent.of(0, MidiEvent.programChange(0, trackChannel, program))));

        for (var note : track.getNotes()) {
            int channel = channelOf(note.getChannel(), track);
            long on = ticks(note.getTime(), header);
            long off = ticks(note.getEnd(), header);
            // A Note On with a velocity of 0 would be read back as a Note Off
            int velocity = Math.max(1, toData(note.getVelocity()));
            events.add(TickedEvent.of(on, MidiEvent.noteOn(0, channel, note.getPitch(), velocity)));
            var noteOff = MidiEvent.noteOff(0, channel, note.getPitch(), 0);
            // A note without length still needs its Note On first
            events.add(off == on ? new TickedEvent(off, ZERO_LENGTH_NOTE_OFF_RANK, noteOff) : TickedEvent.of(off, noteOff));
        }

        // Pitch bends are scaled by the range the track's own RPN controllers set up to that point
        List<ControlChange> changes = new ArrayList<>();
        track.getControlChanges().values().forEach(changes::addAll);
        changes.sort(CONTROL_CHANGE_ORDER);
        var pitchBendRange = new PitchBendRange();
        for (var cc : changes) {
            int channel = channelOf(cc.getChannel(), track);
            long tick = ticks(cc.getTime(), header);
            if (cc.getControllerId().isPitchBend()) {
                int raw = pitchBendRange.denormalize(channel, cc.getValue());
                events.add(TickedEvent.of(tick, MidiEvent.pitchBend(0, channel, raw)));
            } else {
                int controller = cc.getControllerId().getNumber();
                int value = toData(cc.getValue());
                pitchBendRange.onController(channel, controller, value);
                events.add(TickedEvent.of(tick, MidiEvent.controller(0, channel, controller, value)));
            }
        }
        return events;
    }

    private static boolean selectsParameter(ControlChange cc) {
        var id = cc.getControllerId();
        return !id.isPitchBend() && (id.getNumber() == ControllerId.RPN_MSB || id.getNumber() == ControllerId.RPN_LSB);
    }

    private static int channelOf(OptionalInt own, Track track) {
        if (own.isPresent()) {
            return own.getAsInt();
        }
        return track.getChannelNumber().orElse(0);
    }

    private static long ticks(double seconds, Header header) {
        return Math.max(0, TimeConverter.secondsToTicks(seconds, header));
    }

    /** A value from 0 to 1 to a data byte */
    private static int toData(double value) {
        return (int) Math.max(0, Math.min(127, Math.round(value * 127)));
    }

    private static List<MidiEvent> toDeltaTimes(List<TickedEvent> events) {
        events.sort(EVENT_ORDER);
        List<MidiEvent> out = new ArrayList<>(events.size() + 1);
        long prevTick = 0;
        for (var ticked : events) {
            long delta = ticked.tick() - prevTick;
            if (delta > VarLenQuant.MAX_VALUE) {
                throw new IllegalArgumentException("An event is too far from the previous one to be written: tick=" + ticked.tick());
            }
            out.add(ticked.event().withTicks((int) delta));
            prevTick = ticked.tick();
        }
        out.add(MidiEvent.endOfTrack(0));
        return out;
    }
}
