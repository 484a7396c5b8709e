package io.feydor.midiconvert.smf;

/**
 * A single tokenized event of an MTrk chunk.
 * <p>
 * The meaning of the data fields depends on the sub type:
 * <ul>
 *     <li>NOTE_ON, NOTE_OFF: data1 = pitch, data2 = velocity</li>
 *     <li>CONTROLLER: data1 = controller number, data2 = value</li>
 *     <li>PROGRAM_CHANGE: data1 = program number</li>
 *     <li>PITCH_BEND: data1 = the 14-bit value, 8192 means no bend</li>
 *     <li>SET_TEMPO: data1 = microseconds per quarter-note</li>
 *     <li>TIME_SIGNATURE: data1 = numerator, data2 = denominator (4 for x/4, not the power of 2 stored in the file)</li>
 *     <li>text events (TRACK_NAME, INSTRUMENT_NAME, ...): text</li>
 * </ul>
 *
 * @param ticks   the time since the previous event of the track (in tickdiv units)
 * @param subType the specific event
 * @param channel 0 to 15, or {@link #NO_CHANNEL} for meta events not preceded by a channel prefix
 * @param text    the text of a text meta event, otherwise null
 */
public record MidiEvent(int ticks, MidiEventSubType subType, int channel, int data1, int data2, String text) {
    public static final int NO_CHANNEL = -1;

    public MidiEvent {
        if (ticks < 0) {
            throw new IllegalArgumentException("The delta-time of an event cannot be negative: ticks=" + ticks);
        }
        if (channel < NO_CHANNEL || channel > 15) {
            throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channel);
        }
    }

    public static MidiEvent noteOn(int ticks, int channel, int pitch, int velocity) {
        return new MidiEvent(ticks, MidiEventSubType.NOTE_ON, channel, pitch, velocity, null);
    }

    public static MidiEvent noteOff(int ticks, int channel, int pitch, int velocity) {
        return new MidiEvent(ticks, MidiEventSubType.NOTE_OFF, channel, pitch, velocity, null);
    }

    public static MidiEvent controller(int ticks, int channel, int controller, int value) {
        return new MidiEvent(ticks, MidiEventSubType.CONTROLLER, channel, controller, value, null);
    }

    public static MidiEvent programChange(int ticks, int channel, int program) {
        return new MidiEvent(ticks, MidiEventSubType.PROGRAM_CHANGE, channel, program, 0, null);
    }

    public static MidiEvent pitchBend(int ticks, int channel, int value) {
        return new MidiEvent(ticks, MidiEventSubType.PITCH_BEND, channel, value, 0, null);
    }

    public static MidiEvent text(int ticks, MidiEventSubType subType, int channel, String text) {
        return new MidiEvent(ticks, subType, channel, 0, 0, text);
    }

    public static MidiEvent trackName(int ticks, String name) {
        return text(ticks, MidiEventSubType.TRACK_NAME, NO_CHANNEL, name);
    }

    public static MidiEvent setTempo(int ticks, int microsecondsPerBeat) {
        return new MidiEvent(ticks, MidiEventSubType.SET_TEMPO, NO_CHANNEL, microsecondsPerBeat, 0, null);
    }

    public static MidiEvent timeSignature(int ticks, int numerator, int denominator) {
        return new MidiEvent(ticks, MidiEventSubType.TIME_SIGNATURE, NO_CHANNEL, numerator, denominator, null);
    }

    public static MidiEvent endOfTrack(int ticks) {
        return new MidiEvent(ticks, MidiEventSubType.END_OF_TRACK, NO_CHANNEL, 0, 0, null);
    }

    /** An event the converter does not interpret, kept so its delta-time still counts */
    public static MidiEvent other(int ticks, MidiEventSubType subType, int channel) {
        return new MidiEvent(ticks, subType, channel, 0, 0, null);
    }

    public MidiEvent withTicks(int withTicks) {
        return new MidiEvent(withTicks, subType, channel, data1, data2, text);
    }

    public MidiEventType type() {
        return subType.type();
    }

    public boolean hasChannel() {
        return channel != NO_CHANNEL;
    }
}
