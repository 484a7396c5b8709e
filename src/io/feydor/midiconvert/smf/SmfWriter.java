package io.feydor.midiconvert.smf;

import io.feydor.midiconvert.util.ByteFns;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serializes tokenized tracks into the bytes of a Standard MIDI File. Reverse of {@link SmfReader}.
 * Running status is never used, every MIDI message is written with its status byte.
 */
public class SmfWriter {

    /**
     * @param smf the header and, per track, the events with their delta-times
     * @return the bytes of the MIDI file
     * @throws IllegalArgumentException When an event cannot be written, e.g. a channel event without a channel
     */
    public byte[] write(SmfFile smf) {
        var out = new ByteArrayOutputStream();
        var header = smf.header();
        out.writeBytes(MidiIdentifier.MThd.getBytes());
        out.writeBytes(ByteFns.toBytes(SmfHeader.BYTES_IN_MTHD, 4));
        out.writeBytes(ByteFns.toBytes(header.format().word, 2));
        out.writeBytes(ByteFns.toBytes(smf.numTracks(), 2));
        out.writeBytes(ByteFns.toBytes(header.ticksPerQuarter(), 2));

        for (var events : smf.tracks()) {
            byte[] chunk = writeTrack(events);
            out.writeBytes(MidiIdentifier.MTrk.getBytes());
            out.writeBytes(ByteFns.toBytes(chunk.length, 4));
            out.writeBytes(chunk);
        }
        return out.toByteArray();
    }

    private byte[] writeTrack(List<MidiEvent> events) {
        var out = new ByteArrayOutputStream();
        for (var event : events) {
            out.writeBytes(VarLenQuant.encode(event.ticks()));
            out.writeBytes(encodeEvent(event));
        }

        // Last event in each chunk MUST be End of Track
        if (events.isEmpty() || events.get(events.size() - 1).subType() != MidiEventSubType.END_OF_TRACK) {
            out.writeBytes(VarLenQuant.encode(0));
            out.writeBytes(encodeEvent(MidiEvent.endOfTrack(0)));
        }
        return out.toByteArray();
    }

    /** The bytes of an event, without its delta-time */
    byte[] encodeEvent(MidiEvent event) {
        var subType = event.subType();
        if (event.type() == MidiEventType.MIDI) {
            if (!event.hasChannel()) {
                throw new IllegalArgumentException("A channel event needs a channel: " + event);
            }
            int status = (subType.idByte << 4) | event.channel();
            return switch (subType) {
                case NOTE_ON, NOTE_OFF, CONTROLLER -> new byte[]{(byte) status, data(event.data1()), data(event.data2())};
                case PROGRAM_CHANGE -> new byte[]{(byte) status, data(event.data1())};
                case PITCH_BEND -> {
                    int value = Math.max(0, Math.min(0x3FFF, event.data1()));
                    yield new byte[]{(byte) status, (byte) (value & 0x7F), (byte) ((value >> 7) & 0x7F)};
                }
                default -> throw new IllegalArgumentException("Cannot write event: " + event);
            };
        }

        if (event.type() != MidiEventType.META) {
            throw new IllegalArgumentException("Only MIDI and meta events can be written: " + event);
        }

        if (subType.isText()) {
            String text = event.text() == null ? "" : event.text();
            return meta(subType, text.getBytes(StandardCharsets.UTF_8));
        }

        return switch (subType) {
            case SET_TEMPO -> {
                if (event.data1() < 0 || event.data1() > 0xFFFFFF) {
                    throw new IllegalArgumentException("A Set Tempo event holds at most 3 bytes: microsPerBeat=" + event.data1());
                }
                yield meta(subType, ByteFns.toBytes(event.data1(), 3));
            }
            case TIME_SIGNATURE -> {
                // The denominator is stored as a negative power of 2, with a click every quarter note and 8 32nds per quarter
                int dd = Integer.numberOfTrailingZeros(Integer.highestOneBit(Math.max(1, event.data2())));
                yield meta(subType, new byte[]{(byte) event.data1(), (byte) dd, 24, 8});
            }
            case CHANNEL_PREFIX -> meta(subType, new byte[]{(byte) event.channel()});
            case END_OF_TRACK -> meta(subType, new byte[0]);
            default -> throw new IllegalArgumentException("Cannot write event: " + event);
        };
    }

    private static byte[] meta(MidiEventSubType subType, byte[] data) {
        var out = new ByteArrayOutputStream();
        out.write(MidiEventType.META.id);
        out.write(subType.idByte);
        out.writeBytes(VarLenQuant.encode(data.length));
        out.writeBytes(data);
        return out.toByteArray();
    }

    private static byte data(int value) {
        return (byte) (value & 0x7F);
    }
}
