package de.entwicklertraining.request.engine.cache;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * In-memory cache of responses keyed by URL, valid only for the exact parameters they were stored with.
 *
 * <p>Each URL holds at most one entry. A lookup hits only if the entry has not expired and its
 * parameters are deeply equal to the requested ones; {@code null} parameters count as empty.
 * Storing under a URL replaces whatever was there, regardless of parameters.
 *
 * <p>Expired entries are removed lazily on lookup and by a periodic sweep that runs on a daemon
 * thread owned by this instance. {@link #close()} stops the sweep.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (ResponseCache<String> cache = new ResponseCache<>(5_000)) {
 *     cache.set("https://api.example.com/items", Map.of("page", 1), body);
 *     Optional<String> hit = cache.get("https://api.example.com/items", Map.of("page", 1));
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @param <V> the type of the cached values
 */
public class ResponseCache<V> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResponseCache.class);

    /** Default time-to-live of an entry in milliseconds. */
    public static final long DEFAULT_TTL_MS = 1000;

    /** Default interval of the expiry sweep in milliseconds. */
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 2000;

    private final Map<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final LongSupplier clock;
    private final ScheduledExecutorService sweeper;
    private volatile long ttlMs;

    public ResponseCache() {
        this(DEFAULT_TTL_MS);
    }

    public ResponseCache(long ttlMs) {
        this(ttlMs, DEFAULT_SWEEP_INTERVAL_MS);
    }

    /**
     * @param ttlMs default time-to-live of entries; values below 1 fall back to {@link #DEFAULT_TTL_MS}
     * @param sweepIntervalMs interval of the expiry sweep; values below 1 fall back to {@link #DEFAULT_SWEEP_INTERVAL_MS}
     */
    public ResponseCache(long ttlMs, long sweepIntervalMs) {
        this(ttlMs, sweepIntervalMs, System::currentTimeMillis);
    }

    ResponseCache(long ttlMs, long sweepIntervalMs, LongSupplier clock) {
        this.clock = clock;
        if (ttlMs < 1) {
            logger.warn("Invalid cache TTL {}ms, using {}ms", ttlMs, DEFAULT_TTL_MS);
            ttlMs = DEFAULT_TTL_MS;
        }
        this.ttlMs = ttlMs;
        if (sweepIntervalMs < 1) {
            logger.warn("Invalid sweep interval {}ms, using {}ms", sweepIntervalMs, DEFAULT_SWEEP_INTERVAL_MS);
            sweepIntervalMs = DEFAULT_SWEEP_INTERVAL_MS;
        }
        this.sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "response-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        this.sweeper.scheduleAtFixedRate(this::sweep, sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Looks up the value stored for the URL.
     *
     * @param url the cache key
     * @param params the parameters the value must have been stored with; null means none
     * @return the value, or empty if there is no entry, it expired, or the parameters differ
     */
    public Optional<V> get(String url, Map<String, ?> params) {
        CacheEntry<V> entry = entries.get(url);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.getAsLong(), ttlMs)) {
            entries.remove(url, entry);
            logger.debug("Cache entry for {} expired", url);
            return Optional.empty();
        }
        if (!entry.matches(toJson(params))) {
            logger.debug("Cache entry for {} stored with different parameters", url);
            return Optional.empty();
        }
        return Optional.ofNullable(entry.getValue());
    }

    /**
     * Stores a value under the default TTL, replacing any entry for the URL.
     */
    public void set(String url, Map<String, ?> params, V value) {
        set(url, params, value, null);
    }

    /**
     * Stores a value, replacing any entry for the URL.
     *
     * <p>The parameters are copied, so later changes to the map do not affect the entry.
     *
     * @param url the cache key
     * @param params the parameters the value belongs to; null means none
     * @param value the value
     * @param ttlOverrideMs TTL for this entry only; null, or a value below 1, uses the cache's TTL
     */
    public void set(String url, Map<String, ?> params, V value, Long ttlOverrideMs) {
        if (ttlOverrideMs != null && ttlOverrideMs < 1) {
            logger.warn("Invalid TTL override {}ms for {}, using cache TTL", ttlOverrideMs, url);
            ttlOverrideMs = null;
        }
        entries.put(url, new CacheEntry<>(clock.getAsLong(), toJson(params), value, ttlOverrideMs));
    }

    /**
     * Removes the entry for the URL, if any.
     */
    public void delete(String url) {
        entries.remove(url);
    }

    public void clear() {
        entries.clear();
    }

    /**
     * @return the number of entries, including expired ones not yet swept
     */
    public int size() {
        return entries.size();
    }

    /**
     * Changes the default TTL. Applies to existing entries without an override as well.
     *
     * @param ttlMs the new TTL; values below 1 are logged and ignored
     */
    public void setTtl(long ttlMs) {
        if (ttlMs < 1) {
            logger.warn("Ignoring invalid cache TTL {}ms, keeping {}ms", ttlMs, this.ttlMs);
            return;
        }
        this.ttlMs = ttlMs;
    }

    public long getTtl() {
        return ttlMs;
    }

    /**
     * Removes every expired entry.
     */
    void sweep() {
        try {
            long now = clock.getAsLong();
            int before = entries.size();
            entries.entrySet().removeIf(e -> e.getValue().isExpired(now, ttlMs));
            int removed = before - entries.size();
            if (removed > 0) {
                logger.debug("Swept {} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            // an exception here would cancel all future sweeps
            logger.error("Cache sweep failed", e);
        }
    }

    /**
     * Stops the periodic sweep. Entries stay readable until they expire.
     */
    @Override
    public void close() {
        sweeper.shutdownNow();
    }

    private static JSONObject toJson(Map<String, ?> params) {
        return params == null ? new JSONObject() : new JSONObject(params);
    }
}
