package io.feydor.midiconvert.midi;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Moves nominal times, computed at the reference tempo, to real times on the tempo curve.
 * <p>
 * Between two breakpoints the tempo is constant, so real time runs at {@code referenceBpm / breakpoint bpm} times the
 * nominal time. Before the first breakpoint nominal and real time are the same.
 * Durations are scaled by the speed of the segment the element starts in, even when they reach into the next one.
 */
public class TempoWarp {
    private final TempoCurve curve;
    private final double referenceBpm;

    public TempoWarp(TempoCurve curve, double referenceBpm) {
        this.curve = curve;
        this.referenceBpm = Header.validBpm(referenceBpm);
    }

    /**
     * @param elements elements at nominal times, not modified
     * @return retimed copies, sorted by time
     */
    public <T extends Timed<T>> List<T> warp(List<T> elements) {
        List<T> sorted = new ArrayList<>(elements);
        sorted.sort(Comparator.comparingDouble(Timed::getTime));
        if (curve.isEmpty()) {
            return sorted;
        }

        // The breakpoint index only moves forward, so the elements must be in time order
        double firstTime = curve.get(0).time();
        // Both clocks start at the first breakpoint so times before it stay where they are
        double oldTime = firstTime;
        double newTime = firstTime;
        double speed = 1;
        int index = 0;

        List<T> warped = new ArrayList<>(sorted.size());
        for (T element : sorted) {
            double time = element.getTime();
            if (time < firstTime) {
                warped.add(element.retimed(time, 1));
                continue;
            }

            oldTime = curve.get(index).time();
            speed = referenceBpm / curve.get(index).beatsPerMinute();
            while (index + 1 < curve.size() && time >= curve.get(index + 1).time()) {
                newTime += (curve.get(index + 1).time() - oldTime) * speed;
                index++;
                oldTime = curve.get(index).time();
                speed = referenceBpm / curve.get(index).beatsPerMinute();
            }

            warped.add(element.retimed((time - oldTime) * speed + newTime, speed));
        }
        return warped;
    }

    /** Replaces the notes and every controller's changes of the tracks with their warped versions */
    public void apply(List<Track> tracks) {
        if (curve.isEmpty()) {
            return;
        }
        for (var track : tracks) {
            track.setNotes(warp(track.getNotes()));
            for (var entry : List.copyOf(track.getControlChanges().entrySet())) {
                track.setControlChanges(entry.getKey(), warp(entry.getValue()));
            }
        }
    }
}
