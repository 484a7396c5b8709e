package io.feydor.midiconvert.smf;

import io.feydor.midiconvert.smf.exceptions.MidiInvalidHeaderException;
import io.feydor.midiconvert.util.ByteFns;

import java.util.Arrays;

/**
 * The MThd chunk of a MIDI file
 *
 * @param format           One of the three possible Midi file formats
 * @param ntracks          The number of track chunks in the file
 * @param ticksPerQuarter  The # of sub-divisions of a quarter note (metrical timing)
 */
public record SmfHeader(MidiFileFormat format, int ntracks, int ticksPerQuarter) {
    /** The number of bytes in this chunk, excluding the id and the length */
    public static final int BYTES_IN_MTHD = 6;

    public SmfHeader {
        if (format == null) {
            throw new MidiInvalidHeaderException("A Midi Header chunk must have a format of 0, 1 or 2!");
        }
        if (format == MidiFileFormat.FORMAT_0 && ntracks > 1) {
            throw new MidiInvalidHeaderException("A format 0 Midi Header can only have 1 track! Given: " + ntracks);
        } else if (ntracks < 0 || ntracks > 0xFFFF) {
            throw new MidiInvalidHeaderException("The track count must fit in 2 bytes! Given: " + ntracks);
        }
        if (ticksPerQuarter < 1 || ticksPerQuarter > 0x7FFF) {
            throw new MidiInvalidHeaderException("The ticks per quarter-note must be between 1 and 32767! Given: " + ticksPerQuarter);
        }
    }

    /**
     * Validate and construct a Midi Header from its raw fields
     * @param id The first four bytes of a chunk identify it. Must be "MThd".
     * @param len The number of bytes in this chunk (excludes the id bytes)
     * @param format 0, 1 or 2
     * @param ntracks The number of track chunks in the file
     * @param tickdiv Specifies the timing interval to be used. Use metrical timing (Bar.Beat) otherwise use timecode (Hrs.Mins.Secs.Frames).
     *                If metrical timing is set, bits 0-14 of tickdivision indicates the # of sub-divisions of a quarter note.
     *                Timecode (the MSB set) is not supported.
     * @throws MidiInvalidHeaderException When any of the parameters are invalid, see message for specifics
     */
    public static SmfHeader of(byte[] id, int len, int format, int ntracks, byte[] tickdiv) {
        if (!MidiIdentifier.MThd.matches(id)) {
            throw new MidiInvalidHeaderException("Not a MIDI File: A Midi Header chunk's identifier must be the ASCII characters 'MThd'! Given: " + Arrays.toString(id));
        }

        if (len != BYTES_IN_MTHD) {
            throw new MidiInvalidHeaderException("A Midi Header chunk must be " + BYTES_IN_MTHD + " bytes in size! Given: " + len);
        }

        var validatedFormat = MidiFileFormat.fromWord(format)
                .orElseThrow(() -> new MidiInvalidHeaderException("A Midi Header chunk must have a format of 0, 1 or 2! Given: " + format));

        boolean useTicksPerBeatTimeDiv = ((tickdiv[0] >> 7) & 0x0001) == 0; // MSB of tickdiv determines time division method
        if (!useTicksPerBeatTimeDiv) {
            throw new MidiInvalidHeaderException("Cannot convert MIDIs with \"frames per second\" time division: tickdiv=" + ByteFns.toHex(tickdiv));
        }

        return new SmfHeader(validatedFormat, ntracks, ByteFns.toUnsignedShort(tickdiv));
    }

    @Override
    public String toString() {
        return "Header{" +
                "format=" + format +
                ", ntracks=" + ntracks +
                ", tickdiv=" + ticksPerQuarter +
                '}';
    }
}
