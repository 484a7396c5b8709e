package io.feydor.midiconvert.midi;

import java.util.Arrays;

/**
 * The state one decode shares between the tracks it demuxes: the tempo curve found so far and the last instrument
 * selected on every channel. Created per decode and handed to every {@link TrackDemuxer#demux} call.
 */
public class DemuxState {
    private final TempoCurve tempoCurve = new TempoCurve();
    private final int[] channelInstruments = new int[16];

    public DemuxState() {
        Arrays.fill(channelInstruments, ChannelInstrument.UNASSIGNED);
    }

    public TempoCurve getTempoCurve() {
        return tempoCurve;
    }

    /** The last instrument selected on the channel, or {@link ChannelInstrument#UNASSIGNED} */
    public int instrumentOf(int channel) {
        return channel < 0 || channel > 15 ? ChannelInstrument.UNASSIGNED : channelInstruments[channel];
    }

    public void setInstrument(int channel, int instrument) {
        if (channel >= 0 && channel <= 15) {
            channelInstruments[channel] = instrument;
        }
    }
}
