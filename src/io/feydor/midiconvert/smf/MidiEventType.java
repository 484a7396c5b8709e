package io.feydor.midiconvert.smf;

/**
 * All supported MIDI event types by status byte(s)
 */
public enum MidiEventType {
    /** 0x80 to 0xEF */
    MIDI(0x80),
    META(0xFF),
    SYSEX(0xF0),
    UNKNOWN(-1);

    public final int id;

    MidiEventType(int id) {
        this.id = id;
    }

    /**
     * Returns the event's type from its status byte. A status byte below 0x80 is a data byte, so the
     * event is using running status and can only be MIDI when the previous status was a MIDI one.
     *
     * @param status The status byte, 0 to 255
     * @param prevStatus The status of the previous MIDI event in the track, or 0 if running status is not available
     */
    public static MidiEventType fromStatusByte(int status, int prevStatus) {
        return switch (status) {
            case 0xFF -> META;
            case 0xF0, 0xF7 -> SYSEX;
            default -> {
                int upperNibble = (status >> 4) & 0xF;
                if (upperNibble >= 0x8 && upperNibble <= 0xE) {
                    yield MIDI;
                } else if (status < 0x80 && prevStatus >= 0x80) {
                    yield MIDI;
                }
                yield UNKNOWN;
            }
        };
    }
}
