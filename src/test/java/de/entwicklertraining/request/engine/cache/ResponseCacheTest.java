package de.entwicklertraining.request.engine.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class ResponseCacheTest {

    private static final String URL = "https://api.example.com/items";

    private AtomicLong now;
    private ResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(10_000);
        cache = new ResponseCache<>(1000, 60_000, now::get);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    @DisplayName("A value is returned for the same URL and parameters")
    void testHit() {
        cache.set(URL, Map.of("page", 1), "body");

        assertEquals(Optional.of("body"), cache.get(URL, Map.of("page", 1)));
    }

    @Test
    @DisplayName("Parameters are compared deeply")
    void testDeepParameterEquality() {
        Map<String, Object> stored = new HashMap<>();
        stored.put("filter", Map.of("tags", List.of("a", "b")));
        cache.set(URL, stored, "body");

        assertEquals(Optional.of("body"), cache.get(URL, Map.of("filter", Map.of("tags", List.of("a", "b")))));
        assertEquals(Optional.empty(), cache.get(URL, Map.of("filter", Map.of("tags", List.of("b", "a")))));
        assertEquals(Optional.empty(), cache.get(URL, Map.of("page", 2)));
    }

    @Test
    @DisplayName("Null parameters equal empty parameters")
    void testNullParams() {
        cache.set(URL, null, "body");

        assertEquals(Optional.of("body"), cache.get(URL, Map.of()));
    }

    @Test
    @DisplayName("Stored parameters are isolated from later changes")
    void testParamsCopied() {
        Map<String, Object> params = new HashMap<>();
        params.put("page", 1);
        cache.set(URL, params, "body");
        params.put("page", 2);

        assertEquals(Optional.of("body"), cache.get(URL, Map.of("page", 1)));
    }

    @Test
    @DisplayName("Entries expire after the TTL and are removed on lookup")
    void testExpiry() {
        cache.set(URL, null, "body");

        now.addAndGet(999);
        assertTrue(cache.get(URL, null).isPresent());

        now.addAndGet(1);
        assertEquals(Optional.empty(), cache.get(URL, null));
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("A per-entry TTL overrides the cache TTL")
    void testTtlOverride() {
        cache.set(URL, null, "long", 5000L);
        cache.set(URL + "/short", null, "short", 10L);

        now.addAndGet(2000);

        assertEquals(Optional.of("long"), cache.get(URL, null));
        assertEquals(Optional.empty(), cache.get(URL + "/short", null));
    }

    @Test
    @DisplayName("Invalid TTL values are ignored")
    void testInvalidTtl() {
        cache.setTtl(0);
        cache.setTtl(-5);
        assertEquals(1000, cache.getTtl());

        cache.set(URL, null, "body", -1L);
        now.addAndGet(500);
        assertTrue(cache.get(URL, null).isPresent());

        ResponseCache<String> fallback = new ResponseCache<>(0, 60_000, now::get);
        assertEquals(ResponseCache.DEFAULT_TTL_MS, fallback.getTtl());
        fallback.close();
    }

    @Test
    @DisplayName("setTtl applies to existing entries")
    void testSetTtl() {
        cache.set(URL, null, "body");
        cache.setTtl(5000);

        now.addAndGet(3000);
        assertTrue(cache.get(URL, null).isPresent());
    }

    @Test
    @DisplayName("Storing replaces the entry for the URL")
    void testReplace() {
        cache.set(URL, Map.of("page", 1), "first");
        cache.set(URL, Map.of("page", 2), "second");

        assertEquals(1, cache.size());
        assertEquals(Optional.empty(), cache.get(URL, Map.of("page", 1)));
        assertEquals(Optional.of("second"), cache.get(URL, Map.of("page", 2)));
    }

    @Test
    @DisplayName("delete() and clear() remove entries")
    void testDeleteAndClear() {
        cache.set(URL, null, "a");
        cache.set(URL + "/2", null, "b");

        cache.delete(URL);
        assertEquals(Optional.empty(), cache.get(URL, null));
        assertEquals(1, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    @DisplayName("sweep() removes only expired entries")
    void testSweep() {
        cache.set(URL, null, "old");
        now.addAndGet(800);
        cache.set(URL + "/new", null, "new");
        now.addAndGet(300);

        cache.sweep();

        assertEquals(1, cache.size());
        assertTrue(cache.get(URL + "/new", null).isPresent());
    }

    @Test
    @Timeout(5)
    @DisplayName("The periodic sweep runs in the background")
    void testBackgroundSweep() throws InterruptedException {
        try (ResponseCache<String> fast = new ResponseCache<>(20, 20)) {
            fast.set(URL, null, "body");
            while (fast.size() > 0) {
                Thread.sleep(10);
            }
            assertEquals(0, fast.size());
        }
    }
}
