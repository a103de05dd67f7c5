package de.entwicklertraining.request.engine;

import de.entwicklertraining.request.engine.streaming.ChunkResult;
import de.entwicklertraining.request.engine.streaming.StreamingResponseHandler;
import de.entwicklertraining.request.engine.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for an in-flight streamed request.
 *
 * <p>The session ends exactly once: completed with the final {@link ChunkResult}, or failed. The
 * handler's {@code onComplete} or {@code onError} runs before {@link #completion()} settles.
 */
public final class StreamSession {

    private static final Logger logger = LoggerFactory.getLogger(StreamSession.class);

    private final StreamingResponseHandler handler;
    private final CompletableFuture<ChunkResult> completion = new CompletableFuture<>();
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile TransportResponse response;

    StreamSession(StreamingResponseHandler handler) {
        this.handler = handler;
    }

    /**
     * @return a future of the final accumulated state; fails with {@link StreamCancelledException}
     *         after {@link #cancel()}
     */
    public CompletableFuture<ChunkResult> completion() {
        return completion;
    }

    /**
     * Stops reading, releases the connection and fails the session with {@link StreamCancelledException}.
     * A response that is still on its way is closed when it arrives. Does nothing once the session has ended.
     */
    public void cancel() {
        if (finished.get()) {
            return;
        }
        cancelled = true;
        fail(new StreamCancelledException("Stream was cancelled"));
        TransportResponse current = response;
        if (current != null) {
            closeQuietly(current);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDone() {
        return finished.get();
    }

    /**
     * @return false if the session was cancelled meanwhile; the response has then been closed
     */
    boolean attachResponse(TransportResponse response) {
        this.response = response;
        if (cancelled) {
            closeQuietly(response);
            return false;
        }
        return true;
    }

    boolean hasResponse() {
        return response != null;
    }

    void complete(ChunkResult finalState) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            handler.onComplete(finalState);
        } catch (RuntimeException e) {
            logger.error("Stream completion handler failed", e);
        }
        completion.complete(finalState);
    }

    void fail(Throwable error) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            handler.onError(error);
        } catch (RuntimeException e) {
            logger.error("Stream error handler failed", e);
        }
        completion.completeExceptionally(error);
    }

    private static void closeQuietly(TransportResponse response) {
        try {
            response.close();
        } catch (RuntimeException e) {
            logger.debug("Closing cancelled stream failed: {}", e.getMessage());
        }
    }
}
