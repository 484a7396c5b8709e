package io.feydor.midiconvert.midi;

import io.feydor.midiconvert.smf.MidiEventSubType;
import io.feydor.midiconvert.smf.SmfFile;

import java.util.Optional;

/**
 * The meta-data of a converted MIDI file
 */
public class Header {
    public static final int DEFAULT_PPQ = 480;
    public static final double DEFAULT_BPM = 120;
    public static final TimeSignature DEFAULT_TIME_SIGNATURE = new TimeSignature(4, 4);
    public static final int DEFAULT_FORMAT_TYPE = 1;

    private String name;
    private final int pulsesPerQuarter;
    private double beatsPerMinute;
    private TimeSignature timeSignature;
    private final int formatType;

    public Header() {
        this(null, DEFAULT_PPQ, DEFAULT_BPM, DEFAULT_TIME_SIGNATURE, DEFAULT_FORMAT_TYPE);
    }

    /**
     * @param name             the name of the file, may be null
     * @param pulsesPerQuarter the ticks in one quarter-note
     * @param beatsPerMinute   the reference tempo
     * @param timeSignature    the time signature
     * @param formatType       0, 1 or 2
     */
    public Header(String name, int pulsesPerQuarter, double beatsPerMinute, TimeSignature timeSignature, int formatType) {
        if (pulsesPerQuarter < 1) {
            throw new IllegalArgumentException("pulsesPerQuarter must be greater than 0: pulsesPerQuarter=" + pulsesPerQuarter);
        }
        this.name = name;
        this.pulsesPerQuarter = pulsesPerQuarter;
        this.beatsPerMinute = validBpm(beatsPerMinute);
        this.timeSignature = timeSignature == null ? DEFAULT_TIME_SIGNATURE : timeSignature;
        this.formatType = formatType;
    }

    /**
     * Reads the header of a tokenized MIDI file. The reference tempo is the first Set Tempo event found, scanning the
     * tracks in order, and the time signature is the first Time Signature event found the same way.
     */
    public static Header fromSmf(SmfFile smf) {
        Double bpm = null;
        TimeSignature timeSignature = null;
        for (var events : smf.tracks()) {
            for (var event : events) {
                if (bpm == null && event.subType() == MidiEventSubType.SET_TEMPO) {
                    bpm = TimeConverter.microsPerBeatToBpm(event.data1());
                } else if (timeSignature == null && event.subType() == MidiEventSubType.TIME_SIGNATURE) {
                    timeSignature = new TimeSignature(Math.max(1, event.data1()), event.data2());
                }
            }
        }
        return new Header(null, smf.header().ticksPerQuarter(), bpm == null ? DEFAULT_BPM : bpm, timeSignature,
                smf.header().format().word);
    }

    public Header copy() {
        return new Header(name, pulsesPerQuarter, beatsPerMinute, timeSignature, formatType);
    }

    static double validBpm(double bpm) {
        if (!(bpm > 0) || Double.isInfinite(bpm)) {
            throw new IllegalArgumentException("bpm must be greater than 0: bpm=" + bpm);
        }
        return bpm;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getPulsesPerQuarter() {
        return pulsesPerQuarter;
    }

    public double getBeatsPerMinute() {
        return beatsPerMinute;
    }

    /** Does not move any event, see {@link Midi#setBpm(double)} */
    void setBeatsPerMinute(double beatsPerMinute) {
        this.beatsPerMinute = validBpm(beatsPerMinute);
    }

    public TimeSignature getTimeSignature() {
        return timeSignature;
    }

    public void setTimeSignature(TimeSignature timeSignature) {
        this.timeSignature = timeSignature == null ? DEFAULT_TIME_SIGNATURE : timeSignature;
    }

    public int getFormatType() {
        return formatType;
    }

    @Override
    public String toString() {
        return "Header{" +
                "name=" + name +
                ", PPQ=" + pulsesPerQuarter +
                ", bpm=" + beatsPerMinute +
                ", timeSignature=" + timeSignature +
                ", formatType=" + formatType +
                '}';
    }
}
