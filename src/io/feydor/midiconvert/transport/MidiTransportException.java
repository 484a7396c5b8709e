package io.feydor.midiconvert.transport;

import java.io.IOException;

/**
 * Thrown when a server answers a request for a MIDI file with an error status
 */
public class MidiTransportException extends IOException {
    private final int statusCode;

    public MidiTransportException(String address, int statusCode) {
        super("Fetching " + address + " failed with status " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
