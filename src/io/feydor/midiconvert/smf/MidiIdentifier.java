package io.feydor.midiconvert.smf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The 2 types of MIDI Chunks
 */
public enum MidiIdentifier {
    MThd("MThd".getBytes(StandardCharsets.US_ASCII)),
    MTrk("MTrk".getBytes(StandardCharsets.US_ASCII));

    public final byte[] id;

    MidiIdentifier(byte[] id) {
        this.id = id;
    }

    public byte[] getBytes() {
        return id.clone();
    }

    public boolean matches(byte[] chunkId) {
        return Arrays.equals(id, chunkId);
    }
}
