package io.feydor.midiconvert.midi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TempoWarpTest {
    private static TempoCurve curve(TempoBreakpoint... breakpoints) {
        var curve = new TempoCurve();
        for (var breakpoint : breakpoints) {
            curve.insert(breakpoint);
        }
        return curve;
    }

    private static Note note(double time, double duration) {
        return new Note(60, time, duration, 1, 0, 0);
    }

    @Test
    void emptyCurveChangesNothing() {
        var notes = List.of(note(1.0, 0.5), note(0.25, 0.25));
        var warped = new TempoWarp(new TempoCurve(), 120).warp(notes);

        assertEquals(List.of(0.25, 1.0), warped.stream().map(Note::getTime).toList());
        assertEquals(List.of(0.25, 0.5), warped.stream().map(n -> n.getDuration().getAsDouble()).toList());
    }

    @Test
    void slowerTempoStretchesTime() {
        var warp = new TempoWarp(curve(new TempoBreakpoint(0, 120), new TempoBreakpoint(0.5, 60)), 120);

        var warped = warp.warp(List.of(note(1.0, 0.25), note(0.25, 0.25)));

        // Before the change at 0.5 s nothing moves
        assertEquals(0.25, warped.get(0).getTime(), 1e-9);
        assertEquals(0.25, warped.get(0).getDuration().getAsDouble(), 1e-9);
        // 0.5 s at the original speed, then 0.5 nominal seconds at half speed
        assertEquals(1.5, warped.get(1).getTime(), 1e-9);
        assertEquals(0.5, warped.get(1).getDuration().getAsDouble(), 1e-9);
    }

    @Test
    void elementsBeforeTheFirstBreakpointAreUnchanged() {
        var warp = new TempoWarp(curve(new TempoBreakpoint(2.0, 240)), 120);

        var warped = warp.warp(List.of(note(1.0, 0.5), note(3.0, 1.0)));

        assertEquals(1.0, warped.get(0).getTime(), 1e-9);
        assertEquals(0.5, warped.get(0).getDuration().getAsDouble(), 1e-9);
        assertEquals(2.5, warped.get(1).getTime(), 1e-9);
        assertEquals(0.5, warped.get(1).getDuration().getAsDouble(), 1e-9);
    }

    @Test
    void severalSegmentsAreAccumulated() {
        var warp = new TempoWarp(curve(
                new TempoBreakpoint(0, 120),
                new TempoBreakpoint(1.0, 60),
                new TempoBreakpoint(2.0, 240)), 120);

        var warped = warp.warp(List.of(note(0.5, 0), note(1.5, 0), note(3.0, 0)));

        assertEquals(0.5, warped.get(0).getTime(), 1e-9);
        assertEquals(2.0, warped.get(1).getTime(), 1e-9);
        // 1 s + 2 s + 0.5 s
        assertEquals(3.5, warped.get(2).getTime(), 1e-9);
    }

    @Test
    void warpReturnsNewElements() {
        var original = note(1.0, 0.25);
        var warp = new TempoWarp(curve(new TempoBreakpoint(0, 60)), 120);

        var warped = warp.warp(List.of(original));

        assertEquals(1.0, original.getTime());
        assertEquals(2.0, warped.get(0).getTime(), 1e-9);
    }

    @Test
    void controlChangesAreWarpedPerController() {
        var track = new Track();
        track.addControlChange(ControllerId.of(ControllerId.VOLUME), 1.0, 0.5);
        track.addControlChange(ControllerId.PITCH_BEND, 0.5, -1);
        track.addNote(60, 1.0, 0.5, 1);

        new TempoWarp(curve(new TempoBreakpoint(0, 60)), 120).apply(List.of(track));

        assertEquals(2.0, track.getControlChanges(ControllerId.of(ControllerId.VOLUME)).get(0).getTime(), 1e-9);
        assertEquals(1.0, track.getControlChanges(ControllerId.PITCH_BEND).get(0).getTime(), 1e-9);
        assertEquals(2.0, track.getNotes().get(0).getTime(), 1e-9);
        assertEquals(1.0, track.getNotes().get(0).getDuration().getAsDouble(), 1e-9);
    }
}
