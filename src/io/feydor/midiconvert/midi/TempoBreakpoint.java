package io.feydor.midiconvert.midi;

/**
 * A point of the tempo curve where the tempo changes
 *
 * @param time           nominal seconds, i.e. measured at the reference tempo
 * @param beatsPerMinute the tempo from this point on
 */
public record TempoBreakpoint(double time, double beatsPerMinute) {
    public TempoBreakpoint {
        if (!(beatsPerMinute > 0) || Double.isInfinite(beatsPerMinute)) {
            throw new IllegalArgumentException("The tempo must be positive: beatsPerMinute=" + beatsPerMinute);
        }
    }
}
