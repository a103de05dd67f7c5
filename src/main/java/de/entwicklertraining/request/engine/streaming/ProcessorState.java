package de.entwicklertraining.request.engine.streaming;

/**
 * Lifecycle of an {@link SSEStreamProcessor}. Transitions only move forward:
 * IDLE to ACCUMULATING, then to COMPLETED or ABORTED.
 */
public enum ProcessorState {
    /** No chunk received yet. */
    IDLE,
    /** At least one chunk received, sentinel not seen. */
    ACCUMULATING,
    /** Sentinel seen; further input is ignored. */
    COMPLETED,
    /** Abandoned by the consumer; further input is ignored. */
    ABORTED;

    boolean isFinished() {
        return this == COMPLETED || this == ABORTED;
    }
}
