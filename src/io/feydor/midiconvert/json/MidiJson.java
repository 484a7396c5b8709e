package io.feydor.midiconvert.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.feydor.midiconvert.midi.Midi;

/**
 * Writes and reads a {@link Midi} as JSON
 */
public final class MidiJson {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    private MidiJson() {
    }

    public static String toJson(Midi midi) {
        return GSON.toJson(MidiRecords.toRecord(midi));
    }

    /**
     * @throws JsonParseException When the text is not JSON or has the wrong shape
     * @throws IllegalArgumentException When the JSON holds an invalid value
     */
    public static Midi fromJson(String json) {
        var record = GSON.fromJson(json, MidiRecord.class);
        if (record == null) {
            throw new JsonParseException("No MIDI file in an empty JSON document");
        }
        return MidiRecords.fromRecord(record);
    }
}
