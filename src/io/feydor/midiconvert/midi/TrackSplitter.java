package io.feydor.midiconvert.midi;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a track mixing channels and instruments into one track per (channel, instrument) pair.
 * <p>
 * The output tracks are ordered by channel, then by instrument, and numbered from the next free id, which the splitter
 * keeps across calls so the ids of a whole file are dense and in order.
 */
public class TrackSplitter {
    private int nextId;

    public TrackSplitter() {
        this(0);
    }

    public TrackSplitter(int firstId) {
        this.nextId = firstId;
    }

    /**
     * @param mixed a demuxed track, its elements are moved into the returned tracks
     * @return the tracks, empty when the mixed track has no notes and no control changes
     */
    public List<Track> split(Track mixed) {
        Map<Integer, Map<Integer, Track>> byChannel = new TreeMap<>();

        for (var note : mixed.getNotes()) {
            var key = ChannelInstrument.resolve(note.getChannel(), note.getInstrument(), mixed);
            note.assign(key);
            subTrack(byChannel, mixed, key).addNote(note);
        }

        for (var changes : mixed.getControlChanges().values()) {
            for (var cc : changes) {
                var key = ChannelInstrument.resolve(cc.getChannel(), cc.getInstrument(), mixed);
                cc.assign(key);
                subTrack(byChannel, mixed, key).addControlChange(cc);
            }
        }

        List<Track> tracks = new ArrayList<>();
        for (var byInstrument : byChannel.values()) {
            for (var track : byInstrument.values()) {
                track.setId(nextId++);
                tracks.add(track);
            }
        }
        return tracks;
    }

    private static Track subTrack(Map<Integer, Map<Integer, Track>> byChannel, Track mixed, ChannelInstrument key) {
        return byChannel
                .computeIfAbsent(key.channel(), k -> new TreeMap<>())
                .computeIfAbsent(key.instrument(), k -> new Track(ChannelInstrument.UNASSIGNED, mixed.getName().orElse(null),
                        key.channel(), key.instrument()));
    }

    public int getNextId() {
        return nextId;
    }
}
