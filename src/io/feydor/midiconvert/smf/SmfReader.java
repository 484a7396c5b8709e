package io.feydor.midiconvert.smf;

import io.feydor.midiconvert.smf.exceptions.MidiInvalidHeaderException;
import io.feydor.midiconvert.smf.exceptions.MidiParseException;
import io.feydor.midiconvert.util.ByteFns;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tokenizes the bytes of a Standard MIDI File.
 * <p>
 * A Midi file is a series of chunks:
 * <ul>
 *     <li>
 *         MThd: a Header chunk containing the file's meta-data
 *     </li>
 *     <li>
 *         MTrk: 1 or more Track chunks containing MIDI events
 *     </li>
 * </ul>
 * Any other chunk type is skipped.
 */
public class SmfReader {
    private static final Logger LOGGER = Logger.getLogger(SmfReader.class.getName());
    private static final int CHUNK_HEADER_LEN = 8;

    /**
     * Parses the bytes of a MIDI file
     * @param bytes the whole file
     * @return the header and the events of every track
     * @throws MidiParseException When the bytes are not a valid MIDI file
     */
    public SmfFile read(byte[] bytes) {
        var file = new ByteCursor(bytes, 0, bytes.length);

        // <Header> = <ident:4B> <len:4B> <format:2B> <ntracks:2B> <tickdiv:2B>
        if (file.remaining() < CHUNK_HEADER_LEN + SmfHeader.BYTES_IN_MTHD) {
            throw new MidiInvalidHeaderException("Not a MIDI File: only " + bytes.length + " bytes were given");
        }
        byte[] chunkId = file.readBytes(4);
        int chunklen = ByteFns.toUnsignedInt(file.readBytes(4));
        int format = ByteFns.toUnsignedShort(file.readBytes(2));
        int ntracks = ByteFns.toUnsignedShort(file.readBytes(2));
        byte[] tickdiv = file.readBytes(2);
        var header = SmfHeader.of(chunkId, chunklen, format, ntracks, tickdiv);
        LOGGER.log(Level.FINE, "Parsed the MIDI header: {0}", header);

        // Now since we know the # of tracks, we can start parsing the tracks and their events
        List<List<MidiEvent>> tracks = new ArrayList<>(header.ntracks());
        while (tracks.size() < header.ntracks()) {
            // <Track> = <header <id:4B> <chunklen:4B>> <events:1+>
            if (file.remaining() < CHUNK_HEADER_LEN) {
                throw new MidiParseException("The file ended after " + tracks.size() + " of " + header.ntracks() + " tracks");
            }
            byte[] id = file.readBytes(4);
            int len = toChunkLength(file.readBytes(4));
            if (len > file.remaining()) {
                throw new MidiParseException("A chunk claims " + len + " bytes but only " + file.remaining() + " are left: id=" + Arrays.toString(id));
            }

            if (!MidiIdentifier.MTrk.matches(id)) {
                LOGGER.log(Level.WARNING, "Skipping an unknown chunk: id={0} len={1}", new Object[]{ByteFns.toHex(id), len});
                file.skip(len);
                continue;
            }

            tracks.add(parseMidiTrack(file.slice(len), tracks.size()));
            file.skip(len);
        }

        if (file.remaining() > 0) {
            LOGGER.log(Level.WARNING, "Ignoring {0} bytes left over after the last track", file.remaining());
        }

        return new SmfFile(header, tracks);
    }

    private static int toChunkLength(byte[] buf) {
        try {
            return ByteFns.toUnsignedInt(buf);
        } catch (ArithmeticException e) {
            throw new MidiParseException("Chunk length is out of range: " + ByteFns.toHex(buf), e);
        }
    }

    /**
     * Parse the events of a Midi Track chunk
     * @param chunk the bytes of the chunk, without the id and length
     * @param trackNum used in error messages
     */
    private List<MidiEvent> parseMidiTrack(ByteCursor chunk, int trackNum) {
        var events = new ArrayList<MidiEvent>();
        int prevStatus = 0; // Used for running status, only valid after a MIDI event
        int channelPrefix = MidiEvent.NO_CHANNEL;
        while (chunk.hasNext()) {
            // Format: <MTrk event> = <delta-time:VarLen(1-4B)><event:(2+ B)>
            int ticks = VarLenQuant.decode(chunk).value;

            int status = chunk.readByte();
            MidiEventType eventType = MidiEventType.fromStatusByte(status, prevStatus);
            boolean runningStatus = eventType == MidiEventType.MIDI && status < 0x80;
            if (runningStatus) {
                chunk.unread(); // the status byte was actually the first data byte
                status = prevStatus;
            }

            MidiEvent event = switch (eventType) {
                case META -> {
                    // Meta-Event: <FF:1B> <type:1B> <len:Varlen><data:len B>
                    prevStatus = 0;
                    int type = chunk.readByte();
                    int length = VarLenQuant.decode(chunk).value;
                    if (length > chunk.remaining()) {
                        throw new MidiParseException(String.format("A meta event of track#%d claims %d bytes but only %d are left",
                                trackNum, length, chunk.remaining()));
                    }
                    byte[] data = chunk.readBytes(length);
                    var meta = parseMetaEvent(ticks, MidiEventSubType.fromTypeByte(type), data, channelPrefix, trackNum);
                    if (meta.subType() == MidiEventSubType.CHANNEL_PREFIX) {
                        channelPrefix = meta.channel();
                    }
                    yield meta;
                }
                case MIDI -> {
                    // Status byte is nibblised:
                    // Top nibble is the message type
                    // Lower nibble is the MIDI channel
                    prevStatus = status;
                    yield parseChannelEvent(ticks, status, chunk);
                }
                case SYSEX -> {
                    // SysEx event: <F0|F7> <len:VarLen> <message:len B>
                    prevStatus = 0;
                    int length = VarLenQuant.decode(chunk).value;
                    chunk.skip(Math.min(length, chunk.remaining()));
                    yield MidiEvent.other(ticks, MidiEventSubType.SYSEX, MidiEvent.NO_CHANNEL);
                }
                case UNKNOWN -> {
                    String msg = String.format("Unexpected MIDI message! trackNum=%d, status=%02X, event#=%d, prevStatus=%02X",
                            trackNum, status, events.size(), prevStatus);
                    throw new MidiParseException(msg);
                }
            };
            events.add(event);
        }

        // Last event in each chunk MUST be End of Track
        if (events.isEmpty() || events.get(events.size() - 1).subType() != MidiEventSubType.END_OF_TRACK) {
            throw new MidiParseException(String.format("The last event in track#%d was NOT the End of Track event", trackNum));
        }

        LOGGER.log(Level.FINE, "Parsed track#{0}: {1} events", new Object[]{trackNum, events.size()});
        return events;
    }

    private MidiEvent parseMetaEvent(int ticks, MidiEventSubType subType, byte[] data, int channelPrefix, int trackNum) {
        if (subType.isText()) {
            return MidiEvent.text(ticks, subType, channelPrefix, new String(data, StandardCharsets.UTF_8));
        }

        return switch (subType) {
            case SET_TEMPO -> { // Tempo FF 51 03 tt tt tt
                if (data.length != 3) {
                    throw new MidiParseException("A Set Tempo event must have 3 data bytes: track#" + trackNum + " data=" + ByteFns.toHex(data));
                }
                int microsPerBeat = ByteFns.toUnsignedInt(data);
                if (microsPerBeat == 0) {
                    throw new MidiParseException("A Set Tempo event cannot have a tempo of 0: track#" + trackNum);
                }
                yield MidiEvent.setTempo(ticks, microsPerBeat);
            }
            case TIME_SIGNATURE -> { // Time Signature FF 58 04 nn dd cc bb
                if (data.length != 4) {
                    throw new MidiParseException("A Time Signature event must have 4 data bytes: track#" + trackNum + " data=" + ByteFns.toHex(data));
                }
                if ((data[3] & 0xFF) != 0x08) {
                    LOGGER.log(Level.FINE, "A Time Signature event ({0}) specifies an unusual # of 32nd notes per quarter-note",
                            ByteFns.toHex(data));
                }
                yield MidiEvent.timeSignature(ticks, data[0] & 0xFF, 1 << Math.min(data[1] & 0xFF, 16));
            }
            case CHANNEL_PREFIX -> { // MIDI Channel Prefix FF 20 01 cc
                if (data.length != 1) {
                    throw new MidiParseException("A Channel Prefix event must have 1 data byte: track#" + trackNum);
                }
                yield MidiEvent.other(ticks, subType, data[0] & 0x0F);
            }
            case END_OF_TRACK -> MidiEvent.endOfTrack(ticks);
            default -> MidiEvent.other(ticks, subType, MidiEvent.NO_CHANNEL);
        };
    }

    private MidiEvent parseChannelEvent(int ticks, int status, ByteCursor chunk) {
        int messageType = (status >> 4) & 0xF;
        int channel = status & 0xF;
        MidiEventSubType subType = MidiEventSubType.fromStatusNibble(messageType);
        return switch (subType) {
            // 3-byte messages
            case NOTE_ON -> {
                int pitch = chunk.readData();
                int velocity = chunk.readData();
                // A Note On with a velocity of 0 is a Note Off
                yield velocity == 0 ? MidiEvent.noteOff(ticks, channel, pitch, 0)
                                    : MidiEvent.noteOn(ticks, channel, pitch, velocity);
            }
            case NOTE_OFF -> MidiEvent.noteOff(ticks, channel, chunk.readData(), chunk.readData());
            case CONTROLLER -> MidiEvent.controller(ticks, channel, chunk.readData(), chunk.readData());
            case PITCH_BEND -> {
                int lsb = chunk.readData();
                int msb = chunk.readData();
                yield MidiEvent.pitchBend(ticks, channel, (msb << 7) | lsb);
            }
            case POLYPHONIC_PRESSURE -> {
                chunk.skip(2);
                yield MidiEvent.other(ticks, subType, channel);
            }
            // 2-byte messages
            case PROGRAM_CHANGE -> MidiEvent.programChange(ticks, channel, chunk.readData());
            case CHANNEL_PRESSURE -> {
                chunk.skip(1);
                yield MidiEvent.other(ticks, subType, channel);
            }
            default -> throw new MidiParseException(String.format("Unexpected MIDI message! status=%02X", status));
        };
    }

    /** Reads a byte array from front to back, failing with a parse error instead of running past its end */
    private static final class ByteCursor implements Iterator<Integer> {
        private final byte[] buf;
        private final int end;
        private int pos;

        ByteCursor(byte[] buf, int start, int end) {
            this.buf = buf;
            this.pos = start;
            this.end = end;
        }

        int remaining() {
            return end - pos;
        }

        @Override
        public boolean hasNext() {
            return pos < end;
        }

        @Override
        public Integer next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return readByte();
        }

        int readByte() {
            if (pos >= end) {
                throw new MidiParseException("Unexpected end of the chunk at byte " + pos);
            }
            return buf[pos++] & 0xFF;
        }

        /** A data byte of a MIDI message, 0 to 127 */
        int readData() {
            return readByte() & 0x7F;
        }

        byte[] readBytes(int n) {
            if (n > remaining()) {
                throw new MidiParseException("Unexpected end of the chunk: wanted " + n + " bytes but only " + remaining() + " are left");
            }
            byte[] out = Arrays.copyOfRange(buf, pos, pos + n);
            pos += n;
            return out;
        }

        void skip(int n) {
            readBytes(n);
        }

        void unread() {
            pos--;
        }

        ByteCursor slice(int len) {
            return new ByteCursor(buf, pos, pos + len);
        }
    }
}
