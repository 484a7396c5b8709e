package io.feydor.midiconvert.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

public class JsonIo {
    private static final String GM_INSTRUMENT_MENU_JSON = "gm_instrument_menu.json";

    /** The General MIDI program names grouped by instrument family, in program order */
    public static Map<String, List<String>> getGmInstrumentMenu() {
        return getJsonListMap(GM_INSTRUMENT_MENU_JSON);
    }

    public static Map<String, List<String>> getJsonListMap(String resourcePath) {
        try (InputStream inputStream = JsonIo.class.getResourceAsStream("/" + resourcePath)) {
            if (inputStream == null) {
                throw new IllegalStateException("Resource not found on the classpath: " + resourcePath);
            }
            try (InputStreamReader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
                TypeToken<Map<String, List<String>>> typeToken = new TypeToken<>() {};
                Gson gson = new GsonBuilder()
                        .enableComplexMapKeySerialization()
                        .create();
                return gson.fromJson(reader, typeToken);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
