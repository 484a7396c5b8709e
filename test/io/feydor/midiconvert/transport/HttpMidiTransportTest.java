package io.feydor.midiconvert.transport;

import com.sun.net.httpserver.HttpServer;
import io.feydor.midiconvert.smf.SmfFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;

import static io.feydor.midiconvert.smf.SmfFixtures.bytes;
import static org.junit.jupiter.api.Assertions.*;

class HttpMidiTransportTest {
    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/song.mid", exchange -> {
            byte[] body = bytes(SmfFixtures.SINGLE_NOTE);
            exchange.getResponseHeaders().add("Content-Type", "audio/midi");
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.createContext("/missing.mid", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void fetchReturnsTheBody() throws IOException {
        var transport = new HttpMidiTransport();

        assertArrayEquals(bytes(SmfFixtures.SINGLE_NOTE), transport.fetch(baseUrl + "/song.mid"));
    }

    @Test
    void whenStatusIsNotOk_thenThrowsTransportException() {
        var transport = new HttpMidiTransport();

        var e = assertThrows(MidiTransportException.class, () -> transport.fetch(baseUrl + "/missing.mid"));
        assertEquals(404, e.getStatusCode());
    }

    @Test
    void loaderDecodesWhatItFetches() throws IOException {
        var midi = new MidiLoader().load(baseUrl + "/song.mid");

        assertEquals(1, midi.numTracks());
        assertEquals(60, midi.getTracks().get(0).getNotes().get(0).getPitch());
    }
}
