package io.feydor.midiconvert.midi;

import java.util.OptionalInt;

/**
 * A controller or pitch bend value at a point in time.
 * Controller values are 0 to 1, pitch bend values are in semitones, negative for a downward bend.
 */
public class ControlChange implements Timed<ControlChange> {
    private final ControllerId controllerId;
    private double time;
    private final double value;
    private int channel;
    private int instrument;

    public ControlChange(ControllerId controllerId, double time, double value, int channel, int instrument) {
        if (controllerId == null) {
            throw new IllegalArgumentException("A control change needs a controller");
        }
        if (!controllerId.isPitchBend() && (value < 0 || value > 1)) {
            throw new IllegalArgumentException("A controller value must be between 0 and 1: value=" + value);
        }
        if (channel < ChannelInstrument.UNASSIGNED || channel > 15) {
            throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channel);
        }
        this.controllerId = controllerId;
        this.time = time;
        this.value = value;
        this.channel = channel;
        this.instrument = instrument;
    }

    public ControllerId getControllerId() {
        return controllerId;
    }

    @Override
    public double getTime() {
        return time;
    }

    public double getValue() {
        return value;
    }

    public OptionalInt getChannel() {
        return ChannelInstrument.toOptional(channel);
    }

    public OptionalInt getInstrument() {
        return ChannelInstrument.toOptional(instrument);
    }

    void assign(ChannelInstrument channelInstrument) {
        this.channel = channelInstrument.channel();
        this.instrument = channelInstrument.instrument();
    }

    void scale(double ratio) {
        time *= ratio;
    }

    @Override
    public ControlChange retimed(double newTime, double durationScale) {
        return new ControlChange(controllerId, newTime, value, channel, instrument);
    }

    public ControlChange copy() {
        return new ControlChange(controllerId, time, value, channel, instrument);
    }

    @Override
    public String toString() {
        return "ControlChange{" +
                "controller=" + controllerId +
                ", time=" + time +
                ", value=" + value +
                ", channel=" + channel +
                ", instrument=" + instrument +
                '}';
    }
}
