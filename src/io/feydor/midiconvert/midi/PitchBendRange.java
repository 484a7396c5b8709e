package io.feydor.midiconvert.midi;

import java.util.Arrays;

/**
 * Follows the pitch bend range of every channel through the RPN controllers.
 * <p>
 * The range is set by selecting RPN 0 (controller 101 = 0 with controller 100 unset or 0) and then sending the number of
 * semitones with Data Entry (controller 6). Until then a channel bends by {@link #DEFAULT_SEMITONES}.
 */
public class PitchBendRange {
    public static final int DEFAULT_SEMITONES = 2;
    public static final int CENTER = 8192;
    public static final int MAX_VALUE = 16383;
    private static final int UNSET = -1;

    private final int[] rpnMsb = new int[16];
    private final int[] rpnLsb = new int[16];
    private final int[] semitones = new int[16];

    public PitchBendRange() {
        Arrays.fill(rpnMsb, UNSET);
        Arrays.fill(rpnLsb, UNSET);
        Arrays.fill(semitones, DEFAULT_SEMITONES);
    }

    /**
     * Updates the range state with a controller event
     *
     * @param channel    0 to 15
     * @param controller the controller number
     * @param value      the raw value, 0 to 127
     */
    public void onController(int channel, int controller, int value) {
        switch (controller) {
            case ControllerId.RPN_MSB -> rpnMsb[channel] = value;
            case ControllerId.RPN_LSB -> rpnLsb[channel] = value;
            case ControllerId.DATA_ENTRY -> {
                if (rpnMsb[channel] == 0 && (rpnLsb[channel] == UNSET || rpnLsb[channel] == 0)) {
                    semitones[channel] = value;
                }
            }
            default -> {
            }
        }
    }

    public int semitones(int channel) {
        return semitones[channel];
    }

    /** A raw 14-bit pitch bend to semitones */
    public double normalize(int channel, int raw) {
        return semitones[channel] * (raw - CENTER) / (double) CENTER;
    }

    /** Semitones to a raw 14-bit pitch bend, clamped to 0 to 16383. Reverse of normalize. */
    public int denormalize(int channel, double value) {
        int range = semitones[channel];
        if (range == 0) {
            return CENTER;
        }
        long raw = Math.round(value / range * CENTER + CENTER);
        return (int) Math.max(0, Math.min(MAX_VALUE, raw));
    }
}
