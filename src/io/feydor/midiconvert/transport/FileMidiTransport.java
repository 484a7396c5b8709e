package io.feydor.midiconvert.transport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads MIDI files from the local file system
 */
public class FileMidiTransport implements MidiTransport {

    @Override
    public byte[] fetch(String address) throws IOException {
        return Files.readAllBytes(Path.of(address));
    }
}
