package io.feydor.midiconvert.json;

import java.util.List;
import java.util.Map;

/**
 * The JSON form of a track. A channel or instrument that is not known is -1.
 * The instrument name and family, isPercussion, startTime and duration are derived and ignored when read.
 *
 * @param controlChanges the changes of every controller, keyed by controller number or "pitchBend"
 */
public record TrackRecord(int id,
                          String name,
                          int channelNumber,
                          int instrumentNumber,
                          String instrument,
                          String instrumentFamily,
                          boolean isPercussion,
                          double startTime,
                          double duration,
                          List<NoteRecord> notes,
                          Map<String, List<ControlChangeRecord>> controlChanges) {
}
