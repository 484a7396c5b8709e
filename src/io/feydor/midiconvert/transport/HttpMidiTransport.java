package io.feydor.midiconvert.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Downloads MIDI files with a single GET request. Failed requests are not retried.
 */
public class HttpMidiTransport implements MidiTransport {
    private static final Logger LOGGER = Logger.getLogger(HttpMidiTransport.class.getName());
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final Duration timeout;

    public HttpMidiTransport() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(DEFAULT_TIMEOUT)
                .build(), DEFAULT_TIMEOUT);
    }

    public HttpMidiTransport(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    /**
     * @throws MidiTransportException When the server answers with a status other than 2xx
     * @throws IOException When the request fails or is interrupted
     */
    @Override
    public byte[] fetch(String address) throws IOException {
        var request = HttpRequest.newBuilder(URI.create(address))
                .timeout(timeout)
                .GET()
                .build();

        LOGGER.log(Level.FINE, "GET {0}", address);
        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var ex = new InterruptedIOException("Interrupted while fetching " + address);
            ex.initCause(e);
            throw ex;
        }

        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new MidiTransportException(address, status);
        }
        LOGGER.log(Level.FINE, "Fetched {0} bytes from {1}", new Object[]{response.body().length, address});
        return response.body();
    }
}
