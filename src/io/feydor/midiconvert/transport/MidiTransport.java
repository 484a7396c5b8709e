package io.feydor.midiconvert.transport;

import java.io.IOException;

/**
 * Fetches the bytes of a MIDI file from where it is stored
 */
public interface MidiTransport {
    /**
     * @param address where the file is, e.g. a URL or a path
     * @return the whole file
     * @throws IOException When the file cannot be fetched
     */
    byte[] fetch(String address) throws IOException;
}
