package io.feydor.midiconvert.midi;

/**
 * A time signature such as 3/4
 *
 * @param numerator   beats per bar
 * @param denominator the note value of one beat, a power of 2
 */
public record TimeSignature(int numerator, int denominator) {
    public TimeSignature {
        if (numerator < 1) {
            throw new IllegalArgumentException("A time signature needs at least one beat per bar: numerator=" + numerator);
        }
        if (denominator < 1 || Integer.bitCount(denominator) != 1) {
            throw new IllegalArgumentException("A time signature denominator must be a power of 2: denominator=" + denominator);
        }
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
