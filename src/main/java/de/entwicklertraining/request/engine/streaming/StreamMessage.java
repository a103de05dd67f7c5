package de.entwicklertraining.request.engine.streaming;

import java.util.List;

/**
 * Delivered to {@link StreamingResponseHandler#onMessage(StreamMessage)} once per non-empty frame.
 *
 * <p>Both value lists are immutable snapshots taken at emission time.
 *
 * @param frame the frame that was just completed
 * @param allContent every raw payload emitted so far, concatenated, including this frame's
 * @param allValues every value decoded so far, including this frame's
 */
public record StreamMessage(Frame frame, String allContent, List<DecodedValue> allValues) {

    public StreamMessage {
        allValues = List.copyOf(allValues);
    }

    /**
     * @return this frame's raw payload
     */
    public String currentContent() {
        return frame.rawPayload();
    }

    /**
     * @return this frame's decoded values
     */
    public List<DecodedValue> currentValues() {
        return frame.values();
    }
}
