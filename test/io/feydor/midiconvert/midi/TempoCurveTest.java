package io.feydor.midiconvert.midi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TempoCurveTest {
    @Test
    void insertKeepsBreakpointsSortedByTime() {
        var curve = new TempoCurve();
        curve.insert(new TempoBreakpoint(2.0, 90));
        curve.insert(new TempoBreakpoint(0.0, 120));
        curve.insert(new TempoBreakpoint(1.0, 60));
        curve.insert(new TempoBreakpoint(3.5, 140));

        var times = curve.getBreakpoints().stream().map(TempoBreakpoint::time).toList();
        assertEquals(List.of(0.0, 1.0, 2.0, 3.5), times);
    }

    @Test
    void equalTimesKeepInsertionOrder() {
        var curve = new TempoCurve();
        curve.insert(new TempoBreakpoint(1.0, 100));
        curve.insert(new TempoBreakpoint(0.0, 120));
        curve.insert(new TempoBreakpoint(1.0, 80));

        assertEquals(3, curve.size());
        assertEquals(100, curve.get(1).beatsPerMinute());
        assertEquals(80, curve.get(2).beatsPerMinute());
    }

    @Test
    void newCurveIsEmpty() {
        var curve = new TempoCurve();
        assertTrue(curve.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> curve.getBreakpoints().add(new TempoBreakpoint(0, 120)));
    }

    @Test
    void whenBpmIsNotPositive_thenThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new TempoBreakpoint(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new TempoBreakpoint(0, Double.NaN));
    }
}
