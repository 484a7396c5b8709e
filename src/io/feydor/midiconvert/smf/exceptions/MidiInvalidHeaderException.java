package io.feydor.midiconvert.smf.exceptions;

/**
 * Thrown when the MThd header chunk of a MIDI file is invalid
 */
public class MidiInvalidHeaderException extends MidiParseException {
    public MidiInvalidHeaderException(String message) {
        super(message);
    }
}
