package io.feydor.midiconvert.midi;

/**
 * Converts between ticks and seconds at a constant tempo.
 * <p>
 * The decoder only ever uses this at the header's reference tempo. The times it produces are therefore nominal: they are
 * wrong after the first tempo change until {@link TempoWarp} corrects them.
 */
public final class TimeConverter {
    private TimeConverter() {
    }

    public static double ticksToSeconds(long ticks, Header header) {
        return ticksToSeconds(ticks, header.getPulsesPerQuarter(), header.getBeatsPerMinute());
    }

    public static double ticksToSeconds(long ticks, int pulsesPerQuarter, double beatsPerMinute) {
        return ticks / (double) pulsesPerQuarter * (60 / beatsPerMinute);
    }

    /** Inverse of ticksToSeconds, rounded to the nearest tick */
    public static long secondsToTicks(double seconds, Header header) {
        return secondsToTicks(seconds, header.getPulsesPerQuarter(), header.getBeatsPerMinute());
    }

    public static long secondsToTicks(double seconds, int pulsesPerQuarter, double beatsPerMinute) {
        return Math.round(seconds * beatsPerMinute / 60 * pulsesPerQuarter);
    }

    /** Microseconds per quarter-note of a Set Tempo event to beats per minute */
    public static double microsPerBeatToBpm(int microsecondsPerBeat) {
        return 60 / (microsecondsPerBeat / 1_000_000.0);
    }

    public static long bpmToMicrosPerBeat(double beatsPerMinute) {
        return Math.round(60_000_000 / beatsPerMinute);
    }
}
