package de.entwicklertraining.request.engine.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Supplier;

/**
 * Runs deferred operations with a bound on how many are in flight at once.
 *
 * <p>Key properties:
 * <ul>
 *   <li>At most {@code maxConcurrency} operations have been started and not yet settled</li>
 *   <li>When one settles, the next not-yet-started operation is launched immediately</li>
 *   <li>Every operation gets its own {@link TaskResult}; a failure never stops the others</li>
 *   <li>{@code results.get(i)} always belongs to {@code tasks.get(i)}, whatever the completion order</li>
 * </ul>
 *
 * <p>The bound limits in-flight work only. It is not a thread pool: operations run wherever their
 * futures complete.
 *
 * <p>Example usage:
 * <pre>{@code
 * List<Supplier<CompletableFuture<String>>> tasks = urls.stream()
 *     .map(url -> (Supplier<CompletableFuture<String>>) () -> engine.get(url).thenApply(EngineResponse::body))
 *     .toList();
 *
 * List<TaskResult<String>> results = ConcurrentTaskRunner.run(tasks, 4).join();
 * }</pre>
 */
public final class ConcurrentTaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrentTaskRunner.class);

    /** Default number of operations in flight. */
    public static final int DEFAULT_MAX_CONCURRENCY = 4;

    private ConcurrentTaskRunner() {
    }

    /**
     * Runs the tasks with {@link #DEFAULT_MAX_CONCURRENCY}.
     *
     * @param tasks the deferred operations
     * @param <T> the result type
     * @return a future of the index-aligned outcomes
     */
    public static <T> CompletableFuture<List<TaskResult<T>>> run(List<Supplier<CompletableFuture<T>>> tasks) {
        return run(tasks, DEFAULT_MAX_CONCURRENCY);
    }

    /**
     * Runs the tasks with at most {@code maxConcurrency} in flight.
     *
     * <p>The returned future never completes exceptionally. It completes once every task has settled,
     * immediately for an empty list.
     *
     * @param tasks the deferred operations; each is invoked at most once
     * @param maxConcurrency the in-flight bound; values below 1 are treated as 1
     * @param <T> the result type
     * @return a future of the index-aligned outcomes
     */
    public static <T> CompletableFuture<List<TaskResult<T>>> run(List<Supplier<CompletableFuture<T>>> tasks,
                                                                  int maxConcurrency) {
        if (tasks == null || tasks.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        if (maxConcurrency < 1) {
            logger.warn("Invalid max concurrency {}, using 1", maxConcurrency);
            maxConcurrency = 1;
        }

        Run<T> run = new Run<>(List.copyOf(tasks));
        int initial = Math.min(maxConcurrency, tasks.size());
        logger.debug("Running {} tasks with max concurrency {}", tasks.size(), initial);
        for (int i = 0; i < initial; i++) {
            run.requestLaunch();
        }
        return run.done;
    }

    private static final class Run<T> {

        private final List<Supplier<CompletableFuture<T>>> tasks;
        private final AtomicReferenceArray<TaskResult<T>> results;
        private final AtomicInteger nextIndex = new AtomicInteger();
        private final AtomicInteger settled = new AtomicInteger();
        private final AtomicInteger pendingLaunches = new AtomicInteger();
        private final CompletableFuture<List<TaskResult<T>>> done = new CompletableFuture<>();

        Run(List<Supplier<CompletableFuture<T>>> tasks) {
            this.tasks = tasks;
            this.results = new AtomicReferenceArray<>(tasks.size());
        }

        /**
         * Launches one more task. Tasks that settle synchronously request their successor from
         * inside this loop, so the loop drains them iteratively instead of recursing.
         */
        void requestLaunch() {
            if (pendingLaunches.getAndIncrement() != 0) {
                return;
            }
            do {
                launchNext();
            } while (pendingLaunches.decrementAndGet() > 0);
        }

        private void launchNext() {
            int index = nextIndex.getAndIncrement();
            if (index >= tasks.size()) {
                return;
            }
            Futures.invoke(tasks.get(index))
                    .whenComplete((value, error) -> settle(index, value, error));
        }

        private void settle(int index, T value, Throwable error) {
            results.set(index, error == null
                    ? TaskResult.fulfilled(value)
                    : TaskResult.rejected(Futures.unwrap(error)));

            if (settled.incrementAndGet() == tasks.size()) {
                List<TaskResult<T>> ordered = new ArrayList<>(tasks.size());
                for (int i = 0; i < tasks.size(); i++) {
                    ordered.add(results.get(i));
                }
                done.complete(List.copyOf(ordered));
            } else {
                requestLaunch();
            }
        }
    }
}
