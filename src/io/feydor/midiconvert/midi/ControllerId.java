package io.feydor.midiconvert.midi;

import java.util.Objects;

/**
 * Identifies a stream of control changes: either a controller number 0 to 127 or pitch bend.
 * Controller numbers sort first, in numerical order, pitch bend sorts last.
 */
public final class ControllerId implements Comparable<ControllerId> {
    public static final ControllerId PITCH_BEND = new ControllerId(128);
    public static final String PITCH_BEND_NAME = "pitchBend";

    public static final int DATA_ENTRY = 6;
    public static final int VOLUME = 7;
    public static final int PAN = 10;
    public static final int SUSTAIN = 64;
    public static final int RPN_LSB = 100;
    public static final int RPN_MSB = 101;

    private static final ControllerId[] CONTROLLERS = new ControllerId[128];

    static {
        for (int i = 0; i < CONTROLLERS.length; i++) {
            CONTROLLERS[i] = new ControllerId(i);
        }
    }

    private final int number;

    private ControllerId(int number) {
        this.number = number;
    }

    public static ControllerId of(int controller) {
        if (controller < 0 || controller > 127) {
            throw new IllegalArgumentException("MIDI controller must be between 0 and 127: controller=" + controller);
        }
        return CONTROLLERS[controller];
    }

    /** Reverse of toString */
    public static ControllerId parse(String s) {
        if (PITCH_BEND_NAME.equals(s)) {
            return PITCH_BEND;
        }
        try {
            return of(Integer.parseInt(s.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a controller number or \"" + PITCH_BEND_NAME + "\": " + s, e);
        }
    }

    public boolean isPitchBend() {
        return this == PITCH_BEND;
    }

    /**
     * @throws IllegalStateException for pitch bend, which has no controller number
     */
    public int getNumber() {
        if (isPitchBend()) {
            throw new IllegalStateException("Pitch bend has no controller number");
        }
        return number;
    }

    @Override
    public int compareTo(ControllerId o) {
        return Integer.compare(number, o.number);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ControllerId other && other.number == number;
    }

    @Override
    public int hashCode() {
        return Objects.hash(number);
    }

    @Override
    public String toString() {
        return isPitchBend() ? PITCH_BEND_NAME : String.valueOf(number);
    }
}
