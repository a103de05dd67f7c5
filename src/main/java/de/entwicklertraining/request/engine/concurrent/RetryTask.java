package de.entwicklertraining.request.engine.concurrent;

import de.entwicklertraining.request.engine.RetryExhaustedException;
import de.entwicklertraining.request.engine.StreamCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Re-invokes a failing deferred operation up to a fixed number of additional attempts.
 *
 * <p>Any failure counts as retryable: a failed future, a synchronous exception, a non-success
 * status surfaced as an exception. Deciding that a particular status is not worth retrying is left
 * to the operation itself. Cancellation is the one exception: a {@link StreamCancelledException}
 * is passed through on the first occurrence.
 *
 * <p>Attempts follow each other without delay. Use {@link #withBackoff(Supplier, long, double, boolean)}
 * to build the delay into the operation.
 */
public final class RetryTask {

    private static final Logger logger = LoggerFactory.getLogger(RetryTask.class);

    private RetryTask() {
    }

    /**
     * Runs the operation, retrying up to {@code retry} more times on failure.
     *
     * @param operation the deferred operation; invoked afresh for every attempt
     * @param retry number of additional attempts; 0 means exactly one attempt, negative values count as 0
     * @param <T> the result type
     * @return a future completing with the first success, or exceptionally with a
     *         {@link RetryExhaustedException} carrying the attempt count and the last error
     */
    public static <T> CompletableFuture<T> run(Supplier<CompletableFuture<T>> operation, int retry) {
        if (retry < 0) {
            logger.warn("Invalid retry count {}, using 0", retry);
            retry = 0;
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, 1, retry + 1, result);
        return result;
    }

    private static <T> void attempt(Supplier<CompletableFuture<T>> operation,
                                    int firstAttempt,
                                    int maxAttempts,
                                    CompletableFuture<T> result) {
        // Attempts that settle synchronously are retried in this loop; only an asynchronous
        // failure re-enters from its completion callback.
        int attempt = firstAttempt;
        while (true) {
            CompletableFuture<T> future = Futures.invoke(operation);
            if (!future.isDone()) {
                int current = attempt;
                future.whenComplete((value, error) -> {
                    if (settle(value, error, current, maxAttempts, result)) {
                        attempt(operation, current + 1, maxAttempts, result);
                    }
                });
                return;
            }
            T value = null;
            Throwable error = null;
            try {
                value = future.join();
            } catch (RuntimeException e) {
                error = e;
            }
            if (!settle(value, error, attempt, maxAttempts, result)) {
                return;
            }
            attempt++;
        }
    }

    /**
     * Settles {@code result} for a finished attempt.
     *
     * @return true if another attempt should follow
     */
    private static <T> boolean settle(T value, Throwable error, int attempt, int maxAttempts,
                                      CompletableFuture<T> result) {
        if (error == null) {
            result.complete(value);
            return false;
        }
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof StreamCancelledException) {
            result.completeExceptionally(cause);
            return false;
        }
        if (attempt >= maxAttempts) {
            result.completeExceptionally(new RetryExhaustedException(attempt, cause));
            return false;
        }
        logger.debug("Attempt {}/{} failed, retrying: {}", attempt, maxAttempts, cause.getMessage());
        return true;
    }

    /**
     * Wraps an operation so that every invocation after the first is delayed by exponential backoff.
     *
     * <p>The n-th invocation (n &ge; 2) waits {@code initialDelayMs * exponentialBase^(n-2)}
     * milliseconds, multiplied by a random factor between 1 and 2 if jitter is enabled.
     *
     * @param operation the operation to delay
     * @param initialDelayMs delay before the second invocation
     * @param exponentialBase growth factor per attempt
     * @param useJitter whether to randomize the delays
     * @param <T> the result type
     * @return the delayed operation; keeps its own invocation counter
     */
    public static <T> Supplier<CompletableFuture<T>> withBackoff(Supplier<CompletableFuture<T>> operation,
                                                                 long initialDelayMs,
                                                                 double exponentialBase,
                                                                 boolean useJitter) {
        AtomicInteger invocations = new AtomicInteger();
        return () -> {
            int invocation = invocations.incrementAndGet();
            if (invocation == 1) {
                return operation.get();
            }
            long delayMs = calculateDelay(initialDelayMs, exponentialBase, useJitter, invocation);
            Executor delayed = CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS);
            return CompletableFuture.supplyAsync(() -> null, delayed)
                    .thenCompose(ignored -> operation.get());
        };
    }

    static long calculateDelay(long initialDelayMs, double exponentialBase, boolean useJitter, int invocation) {
        double factor = Math.pow(exponentialBase, invocation - 2);
        if (useJitter) {
            factor *= (1.0 + Math.random());
        }
        return Math.max(0, (long) (initialDelayMs * factor));
    }
}
