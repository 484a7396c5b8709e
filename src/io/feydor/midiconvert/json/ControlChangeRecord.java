package io.feydor.midiconvert.json;

/**
 * @param number the controller number or "pitchBend"
 * @param value  0 to 1, in semitones for pitch bend
 */
public record ControlChangeRecord(String number,
                                  double time,
                                  double value,
                                  Integer channel,
                                  Integer instrument) {
}
