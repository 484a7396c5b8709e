package io.feydor.midiconvert.midi;

import java.util.OptionalInt;

/**
 * The (channel, instrument) pair a note or control change ends up on after splitting.
 */
public record ChannelInstrument(int channel, int instrument) {
    /** Stored for a channel or instrument that is not known */
    public static final int UNASSIGNED = -1;

    /** The instrument used when neither the element nor its track knows one. Drum tracks often have no program. */
    public static final int FALLBACK_INSTRUMENT = 0;

    /**
     * Resolves an element's channel and instrument. The element's own value wins, then the value of the track it was
     * read from. A channel can stay unassigned, an instrument falls back to {@link #FALLBACK_INSTRUMENT}.
     */
    public static ChannelInstrument resolve(OptionalInt channel, OptionalInt instrument, Track source) {
        return new ChannelInstrument(
                firstOf(channel, source.getChannelNumber(), UNASSIGNED),
                firstOf(instrument, source.getInstrumentNumber(), FALLBACK_INSTRUMENT));
    }

    private static int firstOf(OptionalInt own, OptionalInt inherited, int fallback) {
        if (own.isPresent()) {
            return own.getAsInt();
        }
        return inherited.orElse(fallback);
    }

    static OptionalInt toOptional(int value) {
        return value == UNASSIGNED ? OptionalInt.empty() : OptionalInt.of(value);
    }
}
