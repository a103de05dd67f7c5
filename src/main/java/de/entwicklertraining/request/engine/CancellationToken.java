package de.entwicklertraining.request.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Cooperative cancellation signal handed to requests and streams.
 *
 * <p>A token is cancelled through the {@link CancellationTokenSource} that created it. Work that
 * observes the token either polls {@link #isCancelled()} or registers a listener.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    CancellationToken() {
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws StreamCancelledException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new StreamCancelledException("Operation was cancelled");
        }
    }

    /**
     * Registers a listener that runs once on cancellation, immediately if already cancelled.
     *
     * @param listener the action to run
     * @return an action that unregisters the listener
     */
    public Runnable onCancel(Runnable listener) {
        if (this == NONE) {
            return () -> { };
        }
        listeners.add(listener);
        if (cancelled && listeners.remove(listener)) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        for (Runnable listener : listeners) {
            if (!listeners.remove(listener)) {
                continue;
            }
            try {
                listener.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation listener failed", e);
            }
        }
    }
}
