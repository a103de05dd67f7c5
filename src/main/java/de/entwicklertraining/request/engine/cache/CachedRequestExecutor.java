package de.entwicklertraining.request.engine.cache;

import de.entwicklertraining.request.engine.StreamCancelledException;
import de.entwicklertraining.request.engine.concurrent.Futures;
import de.entwicklertraining.request.engine.concurrent.RetryTask;
import de.entwicklertraining.request.engine.concurrent.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Executes operations cache-first on top of a {@link ResponseCache}.
 *
 * <p>On a hit the memoized outcome is replayed: a stored success completes the returned future with
 * the value, a stored failure completes it exceptionally with the same error. On a miss the operation
 * runs through {@link RetryTask} and its settled outcome is stored before it is returned.
 * Cancellations are never stored.
 *
 * <p>Concurrent misses for the same key are not coalesced. Each runs the operation and the last one
 * to settle wins the entry.
 *
 * @param <T> the result type
 */
public class CachedRequestExecutor<T> {

    private static final Logger logger = LoggerFactory.getLogger(CachedRequestExecutor.class);

    private final ResponseCache<TaskResult<T>> cache;

    public CachedRequestExecutor(ResponseCache<TaskResult<T>> cache) {
        this.cache = cache;
    }

    /**
     * @see #execute(String, Map, Supplier, int, Long)
     */
    public CompletableFuture<T> execute(String url, Map<String, ?> params, Supplier<CompletableFuture<T>> operation) {
        return execute(url, params, operation, 0, null);
    }

    /**
     * Returns the cached outcome for {@code url} and {@code params}, or runs the operation and caches its outcome.
     *
     * @param url the cache key
     * @param params the parameters the outcome belongs to
     * @param operation the deferred operation to run on a miss
     * @param retry additional attempts on a miss
     * @param ttlOverrideMs TTL for the stored outcome, or null for the cache's TTL
     * @return the live or replayed outcome
     */
    public CompletableFuture<T> execute(String url,
                                        Map<String, ?> params,
                                        Supplier<CompletableFuture<T>> operation,
                                        int retry,
                                        Long ttlOverrideMs) {
        Optional<TaskResult<T>> cached = cache.get(url, params);
        if (cached.isPresent()) {
            logger.debug("Cache hit for {}", url);
            return replay(cached.get());
        }

        logger.debug("Cache miss for {}", url);
        CompletableFuture<T> live = retry > 0 ? RetryTask.run(operation, retry) : Futures.invoke(operation);
        return live.handle((value, error) -> {
            TaskResult<T> outcome = error == null
                    ? TaskResult.fulfilled(value)
                    : TaskResult.rejected(Futures.unwrap(error));
            if (!(outcome.getError().orElse(null) instanceof StreamCancelledException)) {
                cache.set(url, params, outcome, ttlOverrideMs);
            }
            return outcome;
        }).thenCompose(CachedRequestExecutor::replay);
    }

    public ResponseCache<TaskResult<T>> getCache() {
        return cache;
    }

    private static <T> CompletableFuture<T> replay(TaskResult<T> outcome) {
        if (outcome.isFulfilled()) {
            return CompletableFuture.completedFuture(outcome.getValue().orElse(null));
        }
        return CompletableFuture.failedFuture(outcome.getError().orElseThrow());
    }
}
