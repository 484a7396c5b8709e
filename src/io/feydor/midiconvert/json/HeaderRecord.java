package io.feydor.midiconvert.json;

import com.google.gson.annotations.SerializedName;

/**
 * @param name             the file name, empty when the file has none
 * @param pulsesPerQuarter the ticks in one quarter-note
 * @param timeSignature    [numerator, denominator]
 */
public record HeaderRecord(String name,
                           @SerializedName("PPQ") int pulsesPerQuarter,
                           double bpm,
                           int[] timeSignature,
                           int formatType) {
}
