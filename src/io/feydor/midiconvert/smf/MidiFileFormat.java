package io.feydor.midiconvert.smf;

import java.util.Arrays;
import java.util.Optional;

/**
 * There are three types of MIDI File formats:
 * <ul>
 *     <li>0: a single multi-channel track</li>
 *     <li>1: two or more tracks all played simultaneously</li>
 *     <li>2: one or more tracks played independently</li>
 * </ul>
 */
public enum MidiFileFormat {
    /**
     * Single multi-channel track
     */
    FORMAT_0(0),

    /**
     * The most common format in MIDI.
     * Two or more track chunks (header.ntracks) to be played simultaneously:
     * <ul>
     *     <li>the first is the tempo track,</li>
     *     <li>the second is the note data</li>
     * </ul>
     */
    FORMAT_1(1),

    /**
     * one or more Track chunks to be played independently
     */
    FORMAT_2(2);

    public final int word;

    MidiFileFormat(int word) {
        this.word = word;
    }

    public static Optional<MidiFileFormat> fromWord(int word) {
        return Arrays.stream(values()).filter(f -> f.word == word).findFirst();
    }
}
