package de.entwicklertraining.request.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CancellationTokenTest {

    @Test
    @DisplayName("Listeners run once on cancellation")
    void testListenersRunOnce() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger runs = new AtomicInteger();
        source.getToken().onCancel(runs::incrementAndGet);

        source.cancel();
        source.cancel();

        assertTrue(source.isCancelled());
        assertEquals(1, runs.get());
    }

    @Test
    @DisplayName("Listeners registered after cancellation run immediately")
    void testLateListener() {
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel();
        AtomicInteger runs = new AtomicInteger();

        source.getToken().onCancel(runs::incrementAndGet);

        assertEquals(1, runs.get());
        assertThrows(StreamCancelledException.class, source.getToken()::throwIfCancelled);
    }

    @Test
    @DisplayName("Unregistered listeners do not run")
    void testUnregister() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger runs = new AtomicInteger();
        Runnable unregister = source.getToken().onCancel(runs::incrementAndGet);

        unregister.run();
        source.cancel();

        assertEquals(0, runs.get());
    }

    @Test
    @DisplayName("A failing listener does not stop the others")
    void testFailingListener() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger runs = new AtomicInteger();
        source.getToken().onCancel(() -> {
            throw new IllegalStateException("listener failed");
        });
        source.getToken().onCancel(runs::incrementAndGet);

        source.cancel();

        assertEquals(1, runs.get());
    }

    @Test
    @DisplayName("The NONE token is never cancelled")
    void testNone() {
        assertFalse(CancellationToken.NONE.isCancelled());
        assertDoesNotThrow(CancellationToken.NONE::throwIfCancelled);
    }
}
