package io.feydor.midiconvert.json;

/**
 * @param name     the pitch name, e.g. "C4". Derived from midi and ignored when read.
 * @param midi     the pitch, 0 to 127
 * @param duration null for a note that was never released
 * @param channel  null when not known
 */
public record NoteRecord(String name,
                         int midi,
                         double time,
                         Double duration,
                         double velocity,
                         Integer channel,
                         Integer instrument) {
}
