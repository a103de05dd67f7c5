package de.entwicklertraining.request.engine.streaming;

/**
 * Handler interface for consuming a streamed response.
 *
 * <p>The methods are invoked synchronously on the thread that reads the response body, except for
 * {@link #onError(Throwable)} after a cancellation, which runs on the cancelling thread. The
 * typical lifecycle is:
 * <ol>
 *   <li>{@link #onStreamStart()} once the response status has been accepted</li>
 *   <li>For every chunk read: {@link #onRawChunk(String)}, then {@link #onMessage(StreamMessage)}
 *       for each frame completed by that chunk, then {@link #onProgress(double)}</li>
 *   <li>Either {@link #onComplete(ChunkResult)} or {@link #onError(Throwable)}, exactly once</li>
 * </ol>
 *
 * <p>An exception thrown from a callback aborts the stream and is reported through {@link #onError(Throwable)}.
 */
@FunctionalInterface
public interface StreamingResponseHandler {

    /**
     * Called for each frame that carries a payload or decoded values.
     *
     * @param message the frame together with the accumulated state
     */
    void onMessage(StreamMessage message);

    /**
     * Called with every chunk of text as it was read, before framing.
     *
     * <p>Default implementation does nothing.
     *
     * @param chunk the text chunk
     */
    default void onRawChunk(String chunk) {
        // Default implementation does nothing
    }

    /**
     * Called after each chunk with the fraction of the body read so far.
     *
     * <p>Default implementation does nothing.
     *
     * @param progress a value between 0 and 1, or -1 if the response length is unknown
     */
    default void onProgress(double progress) {
        // Default implementation does nothing
    }

    /**
     * Called once the response has been accepted, before the first chunk.
     *
     * <p>Default implementation does nothing.
     */
    default void onStreamStart() {
        // Default implementation does nothing
    }

    /**
     * Called when the stream ended, either by the sentinel or by the end of the body.
     *
     * <p>Default implementation does nothing.
     *
     * @param finalState the accumulated state of the stream
     */
    default void onComplete(ChunkResult finalState) {
        // Default implementation does nothing
    }

    /**
     * Called when the stream failed or was cancelled. No messages, chunks or progress reports are
     * delivered after the session has ended, though a callback already running on the reader thread
     * when {@code cancel()} is called may still finish after this one.
     *
     * <p>Default implementation does nothing.
     *
     * @param throwable the failure; a {@code StreamCancelledException} if the consumer cancelled
     */
    default void onError(Throwable throwable) {
        // Default implementation does nothing
    }
}
