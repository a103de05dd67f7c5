package de.entwicklertraining.request.engine.streaming;

import java.util.Optional;

/**
 * The optional {@code event:}, {@code id:} and {@code retry:} fields of one SSE frame.
 *
 * @param event the event name, or null
 * @param id the event id, or null
 * @param retryMs the reconnection interval in milliseconds, or null
 */
public record FrameFields(String event, String id, Integer retryMs) {

    /** A frame without any metadata lines. */
    public static final FrameFields NONE = new FrameFields(null, null, null);

    public Optional<String> getEvent() {
        return Optional.ofNullable(event);
    }

    public Optional<String> getId() {
        return Optional.ofNullable(id);
    }

    public Optional<Integer> getRetryMs() {
        return Optional.ofNullable(retryMs);
    }

    /**
     * @return true if none of the fields is set
     */
    public boolean isEmpty() {
        return event == null && id == null && retryMs == null;
    }
}
