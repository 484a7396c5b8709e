package io.feydor.midiconvert.smf.exceptions;

/**
 * This exception is thrown when a MIDI byte stream cannot be tokenized and the parse cannot be completed
 */
public class MidiParseException extends RuntimeException {
    public MidiParseException(String msg) {
        super(msg);
    }

    public MidiParseException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
