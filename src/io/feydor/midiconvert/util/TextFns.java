package io.feydor.midiconvert.util;

/**
 * Static functions for cleaning up text read out of MIDI meta events
 */
public class TextFns {
    /**
     * Removes the control characters (including the NUL padding some sequencers write) from a name and trims it.
     *
     * @param name the raw text of a track or instrument name event, may be null
     * @return the cleaned name, "" for null
     */
    public static String cleanName(String name) {
        if (name == null) {
            return "";
        }

        var sb = new StringBuilder(name.length());
        name.codePoints()
                .filter(cp -> !Character.isISOControl(cp))
                .forEach(sb::appendCodePoint);
        return sb.toString().trim();
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
