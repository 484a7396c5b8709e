package io.feydor.midiconvert.midi;

/**
 * Something placed on the timeline of a track, which {@link TempoWarp} can move.
 *
 * @param <T> the implementing type
 */
public interface Timed<T extends Timed<T>> {
    /** In seconds */
    double getTime();

    /**
     * A copy at another time.
     *
     * @param time          the new time in seconds
     * @param durationScale the factor for the duration of the copy, ignored by elements without duration
     */
    T retimed(double time, double durationScale);
}
