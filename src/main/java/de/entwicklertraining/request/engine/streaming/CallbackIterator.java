package de.entwicklertraining.request.engine.streaming;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Turns a push-style callback subscription into a blocking {@link Iterator}.
 *
 * <p>The subscription function receives a {@link Sink} and may return a cleanup action that is
 * run by {@link #close()}. Values pushed before anybody iterates are buffered.
 *
 * <pre>{@code
 * try (CallbackIterator<StreamMessage> messages = CallbackIterator.subscribe(sink -> {
 *     StreamSession session = engine.stream(options, config, new StreamingResponseHandler() {
 *         public void onMessage(StreamMessage m) { sink.next(m); }
 *         public void onComplete(ChunkResult r) { sink.end(); }
 *         public void onError(Throwable t) { sink.error(t); }
 *     });
 *     return session::cancel;
 * })) {
 *     while (messages.hasNext()) {
 *         handle(messages.next());
 *     }
 * }
 * }</pre>
 *
 * @param <T> the element type
 */
public final class CallbackIterator<T> implements Iterator<T>, AutoCloseable {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private volatile Runnable cleanup;
    private volatile boolean closed;
    private Object lookahead;

    private CallbackIterator() {
    }

    /**
     * Subscribes and returns the iterator over the pushed values.
     *
     * @param subscription registers the sink with the producer; may return a cleanup action or null
     * @param <T> the element type
     * @return the iterator
     */
    public static <T> CallbackIterator<T> subscribe(Function<Sink<T>, Runnable> subscription) {
        CallbackIterator<T> iterator = new CallbackIterator<>();
        try {
            iterator.cleanup = subscription.apply(iterator.new QueueSink());
        } catch (RuntimeException e) {
            iterator.queue.add(new Failure(e));
        }
        return iterator;
    }

    /**
     * Convenience overload for subscriptions without cleanup.
     *
     * @param subscription registers the sink with the producer
     * @param <T> the element type
     * @return the iterator
     */
    public static <T> CallbackIterator<T> subscribing(Consumer<Sink<T>> subscription) {
        return subscribe(sink -> {
            subscription.accept(sink);
            return null;
        });
    }

    /**
     * Blocks until a value, the end signal or an error is available.
     *
     * @return true if another value is available
     * @throws StreamIterationException if the producer reported an error
     */
    @Override
    public boolean hasNext() {
        if (lookahead == null) {
            if (closed && queue.isEmpty()) {
                return false;
            }
            try {
                lookahead = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StreamIterationException("Interrupted while waiting for the next value", e);
            }
        }
        if (lookahead == END) {
            return false;
        }
        if (lookahead instanceof Failure failure) {
            lookahead = END;
            throw new StreamIterationException("Producer failed", failure.error());
        }
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T value = (T) lookahead;
        lookahead = null;
        return value;
    }

    /**
     * Runs the cleanup action and ends the iteration. Buffered values are dropped.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.clear();
        queue.add(END);
        Runnable action = cleanup;
        cleanup = null;
        if (action != null) {
            action.run();
        }
    }

    /**
     * Receives values from the producer.
     *
     * @param <T> the element type
     */
    public interface Sink<T> {

        void next(T value);

        /** Signals that no more values follow. */
        void end();

        void error(Throwable error);
    }

    private final class QueueSink implements Sink<T> {

        @Override
        public void next(T value) {
            if (!closed && value != null) {
                queue.add(value);
            }
        }

        @Override
        public void end() {
            if (!closed) {
                queue.add(END);
            }
        }

        @Override
        public void error(Throwable error) {
            if (!closed) {
                queue.add(new Failure(error));
            }
        }
    }

    /**
     * Thrown from {@link #hasNext()} when the producer reported an error or the wait was interrupted.
     */
    public static class StreamIterationException extends RuntimeException {
        public StreamIterationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private record Failure(Throwable error) {
    }
}
