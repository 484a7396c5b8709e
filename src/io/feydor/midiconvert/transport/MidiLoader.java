package io.feydor.midiconvert.transport;

import io.feydor.midiconvert.midi.Midi;
import io.feydor.midiconvert.smf.exceptions.MidiParseException;

import java.io.IOException;
import java.util.Locale;

/**
 * Fetches a MIDI file by URL or path and decodes it
 */
public class MidiLoader {
    private final MidiTransport http;
    private final MidiTransport file;

    public MidiLoader() {
        this(new HttpMidiTransport(), new FileMidiTransport());
    }

    public MidiLoader(MidiTransport http, MidiTransport file) {
        this.http = http;
        this.file = file;
    }

    /**
     * @param address an http(s) URL or a local path
     * @throws IOException When the file cannot be fetched
     * @throws MidiParseException When the fetched bytes are not a valid MIDI file
     */
    public Midi load(String address) throws IOException {
        return Midi.decode(fetch(address));
    }

    public byte[] fetch(String address) throws IOException {
        return transportFor(address).fetch(address);
    }

    MidiTransport transportFor(String address) {
        var lower = address.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") ? http : file;
    }
}
