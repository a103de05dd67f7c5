package de.entwicklertraining.request.engine.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

public class TaskResultTest {

    @Test
    @DisplayName("Fulfilled results expose the value")
    void testFulfilled() {
        TaskResult<String> result = TaskResult.fulfilled("value");

        assertTrue(result.isFulfilled());
        assertEquals(TaskResult.Status.FULFILLED, result.getStatus());
        assertEquals("value", result.getOrThrow());
        assertTrue(result.getError().isEmpty());
    }

    @Test
    @DisplayName("Rejected results rethrow their error")
    void testRejected() {
        IllegalStateException error = new IllegalStateException("boom");
        TaskResult<String> result = TaskResult.rejected(error);

        assertTrue(result.isRejected());
        assertSame(error, assertThrows(IllegalStateException.class, result::getOrThrow));
        assertTrue(result.getValue().isEmpty());
        assertTrue(result.toString().contains("boom"));
    }

    @Test
    @DisplayName("Checked errors are wrapped and missing errors are replaced")
    void testErrorNormalization() {
        TaskResult<String> checked = TaskResult.rejected(new IOException("io"));
        IllegalStateException wrapped = assertThrows(IllegalStateException.class, checked::getOrThrow);
        assertInstanceOf(IOException.class, wrapped.getCause());

        TaskResult<String> missing = TaskResult.rejected(null);
        assertInstanceOf(IllegalStateException.class, missing.getError().orElseThrow());
    }
}
