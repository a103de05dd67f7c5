package de.entwicklertraining.request.engine.concurrent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for working with deferred operations.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * {@link CompletableFuture} adds around the real failure.
     *
     * @param error the failure as reported by a future
     * @return the underlying failure
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Invokes the operation, turning a synchronous throw or a null future into a failed future.
     *
     * @param operation the deferred operation
     * @param <T> the result type
     * @return the operation's future, never null
     */
    public static <T> CompletableFuture<T> invoke(Supplier<? extends CompletableFuture<T>> operation) {
        try {
            CompletableFuture<T> future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("Operation returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
