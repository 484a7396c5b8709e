package io.feydor.midiconvert.midi;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * A track of notes and control changes, all on one channel and instrument once a file has been decoded.
 * <p>
 * Notes are kept in the order they were started and every controller's changes in the order they happened.
 */
public class Track {
    /** The channel General MIDI reserves for percussion (channel 10 counting from 1) */
    public static final int PERCUSSION_CHANNEL = 9;

    private int id;
    private String name;
    private int channelNumber;
    private int instrumentNumber;
    private List<Note> notes = new ArrayList<>();
    private final Map<ControllerId, List<ControlChange>> controlChanges = new TreeMap<>();

    /** Notes waiting for their Note Off, oldest first */
    private final Map<NoteKey, Deque<Note>> pendingNotes = new HashMap<>();

    private record NoteKey(int pitch, int channel) {}

    public Track() {
        this(ChannelInstrument.UNASSIGNED, null, ChannelInstrument.UNASSIGNED, ChannelInstrument.UNASSIGNED);
    }

    public Track(String name) {
        this(ChannelInstrument.UNASSIGNED, name, ChannelInstrument.UNASSIGNED, ChannelInstrument.UNASSIGNED);
    }

    /**
     * @param id               the position of the track in its file, or {@link ChannelInstrument#UNASSIGNED}
     * @param name             may be null
     * @param channelNumber    0 to 15 or {@link ChannelInstrument#UNASSIGNED}
     * @param instrumentNumber a program number or {@link ChannelInstrument#UNASSIGNED}
     */
    public Track(int id, String name, int channelNumber, int instrumentNumber) {
        if (channelNumber < ChannelInstrument.UNASSIGNED || channelNumber > 15) {
            throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channelNumber);
        }
        this.id = id;
        this.name = name;
        this.channelNumber = channelNumber;
        this.instrumentNumber = instrumentNumber;
    }

    /**
     * Starts a note. It has no duration until {@link #noteOff} releases it.
     *
     * @return the started note
     */
    public Note noteOn(int pitch, double time, double velocity, int channel, int instrument) {
        var note = new Note(pitch, time, null, velocity, channel, instrument);
        notes.add(note);
        pendingNotes.computeIfAbsent(new NoteKey(pitch, channel), k -> new ArrayDeque<>()).addLast(note);
        return note;
    }

    /**
     * Releases the oldest started note of this pitch and channel.
     *
     * @return the released note, empty when no such note is playing
     */
    public Optional<Note> noteOff(int pitch, double time, int channel) {
        var pending = pendingNotes.get(new NoteKey(pitch, channel));
        if (pending == null || pending.isEmpty()) {
            return Optional.empty();
        }
        var note = pending.removeFirst();
        note.release(time);
        return Optional.of(note);
    }

    /** Adds a complete note on the track's channel and instrument */
    public Note addNote(int pitch, double time, double duration, double velocity) {
        var note = new Note(pitch, time, duration, velocity, channelNumber, instrumentNumber);
        notes.add(note);
        return note;
    }

    /** Adds a complete note by its pitch name, e.g. "C4" */
    public Note addNote(String pitchName, double time, double duration, double velocity) {
        return addNote(Note.pitchFromName(pitchName), time, duration, velocity);
    }

    public ControlChange addControlChange(ControllerId controllerId, double time, double value, int channel, int instrument) {
        var controlChange = new ControlChange(controllerId, time, value, channel, instrument);
        controlChanges.computeIfAbsent(controllerId, k -> new ArrayList<>()).add(controlChange);
        return controlChange;
    }

    /** Adds a control change on the track's channel and instrument */
    public ControlChange addControlChange(ControllerId controllerId, double time, double value) {
        return addControlChange(controllerId, time, value, channelNumber, instrumentNumber);
    }

    /** Adds a note as is, keeping its own channel and instrument */
    public void addNote(Note note) {
        notes.add(note);
    }

    public void addControlChange(ControlChange controlChange) {
        controlChanges.computeIfAbsent(controlChange.getControllerId(), k -> new ArrayList<>()).add(controlChange);
    }

    void setNotes(List<Note> notes) {
        this.notes = new ArrayList<>(notes);
    }

    void setControlChanges(ControllerId controllerId, List<ControlChange> changes) {
        controlChanges.put(controllerId, new ArrayList<>(changes));
    }

    /** Multiplies every time and duration by ratio */
    public Track scale(double ratio) {
        notes.forEach(note -> note.scale(ratio));
        controlChanges.values().forEach(changes -> changes.forEach(cc -> cc.scale(ratio)));
        return this;
    }

    /**
     * A copy with the notes that start in [startTime, endTime), shortened to end by endTime, and the control changes
     * in [startTime, endTime). Times are not shifted.
     */
    public Track slice(double startTime, double endTime) {
        var track = new Track(id, name, channelNumber, instrumentNumber);
        for (var note : notes) {
            if (note.getTime() >= startTime && note.getTime() < endTime) {
                track.addNote(note.clippedTo(endTime));
            }
        }
        for (var changes : controlChanges.values()) {
            for (var cc : changes) {
                if (cc.getTime() >= startTime && cc.getTime() < endTime) {
                    track.addControlChange(cc.copy());
                }
            }
        }
        return track;
    }

    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public void setName(String name) {
        this.name = name;
    }

    public OptionalInt getChannelNumber() {
        return ChannelInstrument.toOptional(channelNumber);
    }

    public void setChannelNumber(int channelNumber) {
        if (channelNumber < ChannelInstrument.UNASSIGNED || channelNumber > 15) {
            throw new IllegalArgumentException("MIDI has channels 0 to 15: channel=" + channelNumber);
        }
        this.channelNumber = channelNumber;
    }

    public OptionalInt getInstrumentNumber() {
        return ChannelInstrument.toOptional(instrumentNumber);
    }

    public void setInstrumentNumber(int instrumentNumber) {
        this.instrumentNumber = instrumentNumber;
    }

    /** The General MIDI name of the track's instrument */
    public Optional<String> getInstrumentName() {
        return GeneralMidi.programName(instrumentNumber);
    }

    public Optional<String> getInstrumentFamily() {
        return GeneralMidi.familyName(instrumentNumber);
    }

    public boolean isPercussion() {
        return channelNumber == PERCUSSION_CHANNEL;
    }

    /** Returns an unmodifiable view of the notes */
    public List<Note> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    /** Returns an unmodifiable view of the control changes by controller */
    public Map<ControllerId, List<ControlChange>> getControlChanges() {
        return Collections.unmodifiableMap(controlChanges);
    }

    public List<ControlChange> getControlChanges(ControllerId controllerId) {
        return Collections.unmodifiableList(controlChanges.getOrDefault(controllerId, List.of()));
    }

    public int numControlChanges() {
        return controlChanges.values().stream().mapToInt(List::size).sum();
    }

    /** The number of notes */
    public int length() {
        return notes.size();
    }

    /** True when the track has no notes and no control changes */
    public boolean isEmpty() {
        return notes.isEmpty() && numControlChanges() == 0;
    }

    /** The start of the earliest note, 0 without notes */
    public double getStartTime() {
        return notes.stream().mapToDouble(Note::getTime).min().orElse(0);
    }

    /** The end of the latest ending note, 0 without notes */
    public double getDuration() {
        return notes.stream().mapToDouble(Note::getEnd).max().orElse(0);
    }

    @Override
    public String toString() {
        return "Track{" +
                "id=" + id +
                ", name=" + name +
                ", channelNumber=" + channelNumber +
                ", instrumentNumber=" + instrumentNumber +
                ", notes=" + notes.size() +
                ", controlChanges=" + numControlChanges() +
                '}';
    }
}
