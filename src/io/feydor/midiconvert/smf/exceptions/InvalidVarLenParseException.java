package io.feydor.midiconvert.smf.exceptions;

/**
 * Thrown when a variable length quantity is longer than 4 bytes or is cut off by the end of the stream
 */
public class InvalidVarLenParseException extends MidiParseException {
    public InvalidVarLenParseException(String msg) {
        super(msg);
    }
}
