package de.entwicklertraining.request.engine.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class ConcurrentTaskRunnerTest {

    @Test
    @DisplayName("Results are aligned with tasks regardless of completion order")
    @Timeout(10)
    void testIndexStability() {
        List<Supplier<CompletableFuture<Integer>>> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            int value = i;
            long delay = (6 - i) * 20L;
            tasks.add(() -> CompletableFuture.supplyAsync(() -> value,
                    CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS)));
        }

        List<TaskResult<Integer>> results = ConcurrentTaskRunner.run(tasks, 3).join();

        assertEquals(6, results.size());
        for (int i = 0; i < 6; i++) {
            assertTrue(results.get(i).isFulfilled());
            assertEquals(i, results.get(i).getValue().orElseThrow());
        }
    }

    @Test
    @DisplayName("No more than maxConcurrency tasks are in flight")
    @Timeout(10)
    void testInFlightBound() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxSeen = new AtomicInteger();
        List<Supplier<CompletableFuture<String>>> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tasks.add(() -> {
                int now = inFlight.incrementAndGet();
                maxSeen.accumulateAndGet(now, Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    inFlight.decrementAndGet();
                    return "done";
                }, CompletableFuture.delayedExecutor(30, TimeUnit.MILLISECONDS));
            });
        }

        List<TaskResult<String>> results = ConcurrentTaskRunner.run(tasks, 2).join();

        assertEquals(10, results.size());
        assertTrue(maxSeen.get() <= 2, "max in flight was " + maxSeen.get());
        assertTrue(results.stream().allMatch(TaskResult::isFulfilled));
    }

    @Test
    @DisplayName("A bound above the task count launches everything at once")
    void testBoundAboveTaskCount() {
        List<CompletableFuture<Integer>> pending = new ArrayList<>();
        List<Supplier<CompletableFuture<Integer>>> tasks = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            CompletableFuture<Integer> future = new CompletableFuture<>();
            pending.add(future);
            tasks.add(() -> future);
        }
        AtomicInteger started = new AtomicInteger();
        List<Supplier<CompletableFuture<Integer>>> counted = new ArrayList<>();
        for (Supplier<CompletableFuture<Integer>> task : tasks) {
            counted.add(() -> {
                started.incrementAndGet();
                return task.get();
            });
        }

        CompletableFuture<List<TaskResult<Integer>>> run = ConcurrentTaskRunner.run(counted, 10);

        assertEquals(3, started.get());
        assertFalse(run.isDone());
        for (int i = 0; i < 3; i++) {
            pending.get(i).complete(i * 10);
        }
        assertEquals(20, run.join().get(2).getValue().orElseThrow());
    }

    @Test
    @DisplayName("Empty input completes immediately with an empty list")
    void testEmptyInput() {
        CompletableFuture<List<TaskResult<Object>>> run = ConcurrentTaskRunner.run(List.of(), 4);

        assertTrue(run.isDone());
        assertTrue(run.join().isEmpty());
    }

    @Test
    @DisplayName("Failures are isolated to their own slot")
    void testRejectionIsolation() {
        List<Supplier<CompletableFuture<String>>> tasks = List.of(
                () -> CompletableFuture.completedFuture("ok"),
                () -> CompletableFuture.failedFuture(new IllegalStateException("async failure")),
                () -> {
                    throw new IllegalArgumentException("sync failure");
                },
                () -> null,
                () -> CompletableFuture.completedFuture("also ok"));

        List<TaskResult<String>> results = ConcurrentTaskRunner.run(tasks, 2).join();

        assertEquals("ok", results.get(0).getValue().orElseThrow());
        assertInstanceOf(IllegalStateException.class, results.get(1).getError().orElseThrow());
        assertInstanceOf(IllegalArgumentException.class, results.get(2).getError().orElseThrow());
        assertInstanceOf(NullPointerException.class, results.get(3).getError().orElseThrow());
        assertEquals("also ok", results.get(4).getValue().orElseThrow());
    }

    @Test
    @DisplayName("Many synchronously completing tasks do not overflow the stack")
    void testSynchronousTasks() {
        List<Supplier<CompletableFuture<Integer>>> tasks = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            int value = i;
            tasks.add(() -> CompletableFuture.completedFuture(value));
        }

        List<TaskResult<Integer>> results = ConcurrentTaskRunner.run(tasks, 1).join();

        assertEquals(20_000, results.size());
        assertEquals(19_999, results.get(19_999).getValue().orElseThrow());
    }

    @Test
    @DisplayName("Invalid concurrency falls back to one")
    void testInvalidConcurrency() {
        AtomicInteger started = new AtomicInteger();
        CompletableFuture<String> gate = new CompletableFuture<>();
        List<Supplier<CompletableFuture<String>>> tasks = List.of(
                () -> {
                    started.incrementAndGet();
                    return gate;
                },
                () -> {
                    started.incrementAndGet();
                    return CompletableFuture.completedFuture("second");
                });

        CompletableFuture<List<TaskResult<String>>> run = ConcurrentTaskRunner.run(tasks, 0);

        assertEquals(1, started.get());
        gate.complete("first");
        assertEquals(2, started.get());
        assertEquals(2, run.join().size());
    }
}
