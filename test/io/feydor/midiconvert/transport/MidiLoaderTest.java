package io.feydor.midiconvert.transport;

import io.feydor.midiconvert.smf.SmfFixtures;
import io.feydor.midiconvert.smf.exceptions.MidiParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static io.feydor.midiconvert.smf.SmfFixtures.bytes;
import static org.junit.jupiter.api.Assertions.*;

class MidiLoaderTest {
    @TempDir
    Path dir;

    @Test
    void transportIsChosenByScheme() {
        MidiTransport http = address -> new byte[0];
        MidiTransport file = address -> new byte[0];
        var loader = new MidiLoader(http, file);

        assertSame(http, loader.transportFor("http://example.com/a.mid"));
        assertSame(http, loader.transportFor("HTTPS://example.com/a.mid"));
        assertSame(file, loader.transportFor("/tmp/a.mid"));
        assertSame(file, loader.transportFor("songs/http.mid"));
    }

    @Test
    void loadsLocalFiles() throws IOException {
        var path = dir.resolve("song.mid");
        Files.write(path, bytes(SmfFixtures.TEMPO_CHANGE));

        var midi = new MidiLoader().load(path.toString());

        assertEquals(1.5, midi.getTracks().get(0).getNotes().get(0).getTime(), 1e-9);
    }

    @Test
    void whenFileIsMissing_thenThrowsIOException() {
        var loader = new MidiLoader();

        assertThrows(NoSuchFileException.class, () -> loader.load(dir.resolve("idk.mid").toString()));
    }

    @Test
    void whenBytesAreNotMidi_thenThrowsParseException() {
        var loader = new MidiLoader(address -> new byte[]{1, 2, 3}, address -> new byte[]{1, 2, 3});

        assertThrows(MidiParseException.class, () -> loader.load("http://example.com/a.mid"));
    }
}
