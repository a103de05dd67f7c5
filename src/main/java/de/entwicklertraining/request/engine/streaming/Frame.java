package de.entwicklertraining.request.engine.streaming;

import java.util.List;

/**
 * One complete frame cut from the stream.
 *
 * @param rawPayload the concatenated payload lines, after prefix stripping and transformation
 * @param values the values decoded from the payload; empty if decoding is off or failed
 * @param fields the frame's metadata lines
 */
public record Frame(String rawPayload, List<DecodedValue> values, FrameFields fields) {

    public Frame {
        rawPayload = rawPayload != null ? rawPayload : "";
        values = values != null ? List.copyOf(values) : List.of();
        fields = fields != null ? fields : FrameFields.NONE;
    }

    /**
     * @return true if this frame carries neither payload nor decoded values
     */
    public boolean isEmpty() {
        return rawPayload.isEmpty() && values.isEmpty();
    }
}
