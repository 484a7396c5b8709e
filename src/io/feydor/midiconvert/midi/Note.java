package io.feydor.midiconvert.midi;

import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * A note with a start time and, once its Note Off has been seen, a duration. Times are in seconds.
 */
public class Note implements Timed<Note> {
    private static final String[] PITCH_CLASSES = {"C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"};
    private static final Pattern PITCH_NAME = Pattern.compile("^([A-Ga-g])([#b]?)(-?\\d+)$");

    private final int pitch;
    private double time;
    private Double duration; // null until released
    private final double velocity;
    private int channel;
    private int instrument;

    /**
     * @param pitch      0 to 127, 60 is middle C
     * @param time       the start in seconds
     * @param duration   in seconds, null when the note has not been released
     * @param velocity   0 to 1
     * @param channel    0 to 15 or {@link ChannelInstrument#UNASSIGNED}
     * @param instrument a program number or {@link ChannelInstrument#UNASSIGNED}
     */
    public Note(int pitch, double time, Double duration, double velocity, int channel, int instrument) {
        if (pitch < 0 || pitch > 127) {
            throw new IllegalArgumentException("MIDI notes must be between 0 and 127: pitch=" + pitch);
        }
        if (velocity < 0 || velocity > 1) {
            throw new IllegalArgumentException("The velocity must be between 0 and 1: velocity=" + velocity);
        }
        if (duration != null && duration < 0) {
            throw new IllegalArgumentException("The duration cannot be negative: duration=" + duration);
        }
        if (channel < ChannelInstrument.UNASSIGNED || channel > 15) {
            throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channel);
        }
        this.pitch = pitch;
        this.time = time;
        this.duration = duration;
        this.velocity = velocity;
        this.channel = channel;
        this.instrument = instrument;
    }

    /** The scientific pitch name, e.g. C4 for 60 */
    public static String pitchName(int pitch) {
        int octave = Math.floorDiv(pitch, 12) - 1;
        return PITCH_CLASSES[Math.floorMod(pitch, 12)] + octave;
    }

    /** Reverse of pitchName. Accepts flats, e.g. "Bb3" */
    public static int pitchFromName(String name) {
        var matcher = PITCH_NAME.matcher(name.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a pitch name: " + name);
        }
        int pitchClass = switch (Character.toUpperCase(matcher.group(1).charAt(0))) {
            case 'C' -> 0;
            case 'D' -> 2;
            case 'E' -> 4;
            case 'F' -> 5;
            case 'G' -> 7;
            case 'A' -> 9;
            default -> 11;
        };
        if (matcher.group(2).equals("#")) pitchClass++;
        else if (matcher.group(2).equals("b")) pitchClass--;
        return (Integer.parseInt(matcher.group(3)) + 1) * 12 + pitchClass;
    }

    public int getPitch() {
        return pitch;
    }

    public String getName() {
        return pitchName(pitch);
    }

    @Override
    public double getTime() {
        return time;
    }

    /** Empty until the note has been released */
    public OptionalDouble getDuration() {
        return duration == null ? OptionalDouble.empty() : OptionalDouble.of(duration);
    }

    public boolean isReleased() {
        return duration != null;
    }

    /** When the note stops sounding. A note that was never released ends where it starts. */
    public double getEnd() {
        return duration == null ? time : time + duration;
    }

    public double getVelocity() {
        return velocity;
    }

    public OptionalInt getChannel() {
        return ChannelInstrument.toOptional(channel);
    }

    public OptionalInt getInstrument() {
        return ChannelInstrument.toOptional(instrument);
    }

    void release(double offTime) {
        this.duration = Math.max(0, offTime - time);
    }

    void assign(ChannelInstrument channelInstrument) {
        this.channel = channelInstrument.channel();
        this.instrument = channelInstrument.instrument();
    }

    void scale(double ratio) {
        time *= ratio;
        if (duration != null) {
            duration *= ratio;
        }
    }

    @Override
    public Note retimed(double newTime, double durationScale) {
        return new Note(pitch, newTime, duration == null ? null : duration * durationScale, velocity, channel, instrument);
    }

    /** A copy that ends no later than end */
    Note clippedTo(double end) {
        Double clipped = duration;
        if (clipped != null && time + clipped > end) {
            clipped = Math.max(0, end - time);
        }
        return new Note(pitch, time, clipped, velocity, channel, instrument);
    }

    public Note copy() {
        return new Note(pitch, time, duration, velocity, channel, instrument);
    }

    @Override
    public String toString() {
        return "Note{" +
                "name=" + getName() +
                ", time=" + time +
                ", duration=" + duration +
                ", velocity=" + velocity +
                ", channel=" + channel +
                ", instrument=" + instrument +
                '}';
    }
}
