package io.feydor.midiconvert.midi;

import io.feydor.midiconvert.smf.MidiEvent;
import io.feydor.midiconvert.util.TextFns;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the events of one MTrk chunk into a track of notes and control changes.
 * <p>
 * Times are nominal: every delta-time is converted at the header's reference tempo. Tempo events are not applied here,
 * they are collected into the {@link TempoCurve} of the {@link DemuxState} and applied by {@link TempoWarp} once every
 * track has been read.
 */
public class TrackDemuxer {
    private static final Logger LOGGER = Logger.getLogger(TrackDemuxer.class.getName());
    private static final int BANK_SELECT = 0;

    private final Header header;

    public TrackDemuxer(Header header) {
        this.header = header;
    }

    /**
     * @param events   the events of the chunk, in file order
     * @param trackNum the position of the chunk in the file, used in logs
     * @param state    the tempo curve and channel instruments of the decode, updated by this call
     * @return the track, possibly mixing several channels and instruments
     */
    public Track demux(List<MidiEvent> events, int trackNum, DemuxState state) {
        var track = new Track();
        var pitchBendRange = new PitchBendRange();
        long ticks = 0;
        int lastChannel = ChannelInstrument.UNASSIGNED;
        int unmatchedNoteOffs = 0;

        for (var event : events) {
            ticks += event.ticks();
            double absoluteTime = TimeConverter.ticksToSeconds(ticks, header);
            if (event.subType().isChannelType() && track.getChannelNumber().isEmpty()) {
                track.setChannelNumber(event.channel());
            }

            switch (event.subType()) {
                case TRACK_NAME -> track.setName(TextFns.cleanName(event.text()));
                case NOTE_ON -> {
                    int channel = event.channel();
                    lastChannel = channel;
                    track.noteOn(event.data1(), absoluteTime, event.data2() / 127.0, channel, state.instrumentOf(channel));
                }
                case NOTE_OFF -> {
                    // A Note Off without a playing note is dropped
                    if (track.noteOff(event.data1(), absoluteTime, event.channel()).isEmpty()) {
                        unmatchedNoteOffs++;
                        LOGGER.log(Level.FINE, "Ignoring a Note Off without a Note On: track#{0} pitch={1} channel={2} time={3}",
                                new Object[]{trackNum, event.data1(), event.channel(), absoluteTime});
                    }
                }
                case CONTROLLER -> {
                    // Bank select (controller 0) is not tracked
                    if (event.data1() == BANK_SELECT) {
                        break;
                    }
                    int channel = event.channel();
                    lastChannel = channel;
                    track.addControlChange(ControllerId.of(event.data1()), absoluteTime, event.data2() / 127.0,
                            channel, state.instrumentOf(channel));
                    pitchBendRange.onController(channel, event.data1(), event.data2());
                }
                case INSTRUMENT_NAME -> {
                    int channel = event.hasChannel() ? event.channel() : lastChannel;
                    lastChannel = channel;
                    int instrument = GeneralMidi.programForName(event.text()).orElse(ChannelInstrument.UNASSIGNED);
                    if (track.getInstrumentNumber().isEmpty()) {
                        track.setInstrumentNumber(instrument);
                    }
                    state.setInstrument(channel, instrument);
                }
                case PROGRAM_CHANGE -> {
                    int channel = event.channel();
                    lastChannel = channel;
                    if (track.getInstrumentNumber().isEmpty()) {
                        track.setInstrumentNumber(event.data1());
                    }
                    state.setInstrument(channel, event.data1());
                }
                case PITCH_BEND -> {
                    int channel = event.channel();
                    lastChannel = channel;
                    track.addControlChange(ControllerId.PITCH_BEND, absoluteTime, pitchBendRange.normalize(channel, event.data1()),
                            channel, state.instrumentOf(channel));
                }
                case SET_TEMPO -> state.getTempoCurve().insert(
                        new TempoBreakpoint(absoluteTime, TimeConverter.microsPerBeatToBpm(event.data1())));
                default -> {
                    // Only moves the time forward
                }
            }
        }

        // A track with nothing but a name is the title of the file
        if (header.getName().isEmpty() && track.isEmpty() && track.getName().filter(n -> !n.isEmpty()).isPresent()) {
            header.setName(track.getName().get());
        }

        LOGGER.log(Level.FINE, "Demuxed track#{0}: {1} notes, {2} control changes, {3} unmatched Note Offs",
                new Object[]{trackNum, track.length(), track.numControlChanges(), unmatchedNoteOffs});
        return track;
    }
}
