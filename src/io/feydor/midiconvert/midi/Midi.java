package io.feydor.midiconvert.midi;

import io.feydor.midiconvert.smf.exceptions.MidiParseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A MIDI file as tracks of notes and control changes timed in seconds.
 * <p>
 * Decoded files have their tempo changes applied: every time is real time. The tempo of the header is the reference
 * tempo, the first one found in the file, and is the tempo written back by {@link #encode()}.
 */
public class Midi {
    private final Header header;
    private final List<Track> tracks;
    private final List<Track> unmodifiableTracks;

    /** An empty file with the default header */
    public Midi() {
        this(new Header(), List.of());
    }

    public Midi(Header header, List<Track> tracks) {
        this.header = header;
        this.tracks = new ArrayList<>(tracks);
        this.unmodifiableTracks = Collections.unmodifiableList(this.tracks);
    }

    /**
     * Decodes the bytes of a MIDI file
     * @throws MidiParseException When the bytes are not a valid MIDI file
     */
    public static Midi decode(byte[] bytes) {
        return new MidiDecoder().decode(bytes);
    }

    /** The bytes of a format 1 MIDI file */
    public byte[] encode() {
        return new MidiEncoder().encode(this);
    }

    /** Appends an empty track, numbered after the last one */
    public Track addTrack() {
        return addTrack(null);
    }

    public Track addTrack(String name) {
        var track = new Track(tracks.size(), name, ChannelInstrument.UNASSIGNED, ChannelInstrument.UNASSIGNED);
        tracks.add(track);
        return track;
    }

    /** The track at index, empty when out of range */
    public Optional<Track> findTrack(int index) {
        if (index < 0 || index >= tracks.size()) {
            return Optional.empty();
        }
        return Optional.of(tracks.get(index));
    }

    /** The first track with this name, empty for a null name */
    public Optional<Track> findTrack(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return tracks.stream().filter(t -> t.getName().filter(name::equals).isPresent()).findFirst();
    }

    /**
     * A copy with only what happens in [startTime, endTime).
     * @see Track#slice(double, double)
     */
    public Midi slice(double startTime, double endTime) {
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime must not be before startTime: startTime=" + startTime + " endTime=" + endTime);
        }
        List<Track> sliced = new ArrayList<>(tracks.size());
        for (var track : tracks) {
            sliced.add(track.slice(startTime, endTime));
        }
        return new Midi(header.copy(), sliced);
    }

    public Header getHeader() {
        return header;
    }

    /** Returns an unmodifiable view of the tracks */
    public List<Track> getTracks() {
        return unmodifiableTracks;
    }

    public int numTracks() {
        return tracks.size();
    }

    public double getBpm() {
        return header.getBeatsPerMinute();
    }

    /**
     * Changes the tempo, moving every note and control change so the music plays at the new tempo
     * @throws IllegalArgumentException When bpm is not a positive number
     */
    public void setBpm(double bpm) {
        Header.validBpm(bpm);
        double ratio = header.getBeatsPerMinute() / bpm;
        header.setBeatsPerMinute(bpm);
        tracks.forEach(track -> track.scale(ratio));
    }

    public TimeSignature getTimeSignature() {
        return header.getTimeSignature();
    }

    public void setTimeSignature(TimeSignature timeSignature) {
        header.setTimeSignature(timeSignature);
    }

    /** The start of the earliest note of any track, 0 without notes */
    public double getStartTime() {
        return tracks.stream()
                .filter(t -> t.length() > 0)
                .mapToDouble(Track::getStartTime)
                .min().orElse(0);
    }

    /** The end of the latest ending note of any track, 0 without notes */
    public double getDuration() {
        return tracks.stream().mapToDouble(Track::getDuration).max().orElse(0);
    }

    @Override
    public String toString() {
        return "Midi{" +
                "header=" + header +
                ", tracks=" + tracks.size() +
                '}';
    }
}
