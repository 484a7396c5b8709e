package io.feydor.midiconvert.midi;

import io.feydor.midiconvert.smf.SmfFile;
import io.feydor.midiconvert.smf.SmfReader;
import io.feydor.midiconvert.smf.exceptions.MidiParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes the bytes of a MIDI file in two stages:
 * <ol>
 *     <li>every track is demuxed at nominal times, the reference tempo assumed constant, and split per channel and
 *     instrument. The tempo changes of all tracks are collected on the way.</li>
 *     <li>once the whole tempo curve is known, every time is warped to real time.</li>
 * </ol>
 */
public class MidiDecoder {
    private static final Logger LOGGER = Logger.getLogger(MidiDecoder.class.getName());

    private final SmfReader reader;

    public MidiDecoder() {
        this(new SmfReader());
    }

    public MidiDecoder(SmfReader reader) {
        this.reader = reader;
    }

    /**
     * @param bytes the whole MIDI file
     * @throws MidiParseException When the bytes are not a valid MIDI file
     */
    public Midi decode(byte[] bytes) {
        return decode(reader.read(bytes));
    }

    public Midi decode(SmfFile smf) {
        var header = Header.fromSmf(smf);
        var state = new DemuxState();
        var demuxer = new TrackDemuxer(header);
        var splitter = new TrackSplitter();

        List<Track> tracks = new ArrayList<>();
        for (int i = 0; i < smf.numTracks(); i++) {
            var mixed = demuxer.demux(smf.tracks().get(i), i, state);
            tracks.addAll(splitter.split(mixed));
        }

        var tempoCurve = state.getTempoCurve();
        LOGGER.log(Level.FINE, "Warping {0} tracks with {1}", new Object[]{tracks.size(), tempoCurve});
        new TempoWarp(tempoCurve, header.getBeatsPerMinute()).apply(tracks);

        LOGGER.log(Level.FINE, "Decoded {0}: {1} tracks", new Object[]{header, tracks.size()});
        return new Midi(header, tracks);
    }
}
