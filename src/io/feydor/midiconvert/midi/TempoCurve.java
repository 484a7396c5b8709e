package io.feydor.midiconvert.midi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The tempo changes of a MIDI file, kept sorted by time.
 * <p>
 * Tempo events can sit in any track, and every track restarts at time 0, so breakpoints arrive out of order.
 * Breakpoints with the same time stay in insertion order: the later one takes effect.
 */
public class TempoCurve {
    private final List<TempoBreakpoint> breakpoints = new ArrayList<>();

    /** Inserts after the rightmost breakpoint whose time is less than or equal to the new one's */
    public void insert(TempoBreakpoint breakpoint) {
        int lo = 0;
        int hi = breakpoints.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (breakpoints.get(mid).time() <= breakpoint.time()) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        breakpoints.add(lo, breakpoint);
    }

    public TempoBreakpoint get(int index) {
        return breakpoints.get(index);
    }

    public int size() {
        return breakpoints.size();
    }

    public boolean isEmpty() {
        return breakpoints.isEmpty();
    }

    /** Returns an unmodifiable view of the breakpoints */
    public List<TempoBreakpoint> getBreakpoints() {
        return Collections.unmodifiableList(breakpoints);
    }

    @Override
    public String toString() {
        return "TempoCurve" + breakpoints;
    }
}
