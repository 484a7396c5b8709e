package io.feydor.midiconvert.midi;

import io.feydor.midiconvert.util.JsonIo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The General MIDI instrument names and families, by program number
 */
public final class GeneralMidi {
    private static final List<String> PROGRAM_NAMES = new ArrayList<>();
    private static final List<String> PROGRAM_FAMILIES = new ArrayList<>();
    private static final Map<String, Integer> NAME_TO_PROGRAM = new HashMap<>();

    // Populate GM program names using the json resource, families are listed in program order
    static {
        for (var entry : JsonIo.getGmInstrumentMenu().entrySet()) {
            for (String name : entry.getValue()) {
                NAME_TO_PROGRAM.put(name.toLowerCase(Locale.ROOT), PROGRAM_NAMES.size());
                PROGRAM_NAMES.add(name);
                PROGRAM_FAMILIES.add(entry.getKey());
            }
        }
        if (PROGRAM_NAMES.size() != 128) {
            throw new IllegalStateException("Expected 128 General MIDI programs but found " + PROGRAM_NAMES.size());
        }
    }

    private GeneralMidi() {
    }

    public static Optional<String> programName(int program) {
        return isProgram(program) ? Optional.of(PROGRAM_NAMES.get(program)) : Optional.empty();
    }

    public static Optional<String> familyName(int program) {
        return isProgram(program) ? Optional.of(PROGRAM_FAMILIES.get(program)) : Optional.empty();
    }

    /** The program whose name matches, ignoring case and surrounding whitespace */
    public static OptionalInt programForName(String name) {
        if (name == null) {
            return OptionalInt.empty();
        }
        Integer program = NAME_TO_PROGRAM.get(name.trim().toLowerCase(Locale.ROOT));
        return program == null ? OptionalInt.empty() : OptionalInt.of(program);
    }

    private static boolean isProgram(int program) {
        return program >= 0 && program < PROGRAM_NAMES.size();
    }
}
