package de.entwicklertraining.request.engine.cache;

import org.json.JSONObject;

import java.util.Map;
import java.util.Optional;

/**
 * One cached value together with the parameters it was stored for.
 *
 * @param <V> the type of the cached value
 */
public final class CacheEntry<V> {

    private final long capturedAtMillis;
    private final JSONObject params;
    private final V value;
    private final Long ttlMs;

    CacheEntry(long capturedAtMillis, JSONObject params, V value, Long ttlMs) {
        this.capturedAtMillis = capturedAtMillis;
        this.params = params;
        this.value = value;
        this.ttlMs = ttlMs;
    }

    public long getCapturedAtMillis() {
        return capturedAtMillis;
    }

    /**
     * @return a copy of the parameters the value was stored for
     */
    public Map<String, Object> getParams() {
        return params.toMap();
    }

    public V getValue() {
        return value;
    }

    /**
     * @return the per-entry TTL, empty if the cache's TTL applies
     */
    public Optional<Long> getTtlMs() {
        return Optional.ofNullable(ttlMs);
    }

    boolean isExpired(long nowMillis, long defaultTtlMs) {
        long effectiveTtl = ttlMs != null ? ttlMs : defaultTtlMs;
        return nowMillis - capturedAtMillis >= effectiveTtl;
    }

    boolean matches(JSONObject otherParams) {
        return params.similar(otherParams);
    }

    @Override
    public String toString() {
        return "CacheEntry{" +
            "capturedAt=" + capturedAtMillis +
            ", params=" + params +
            ", ttlMs=" + (ttlMs != null ? ttlMs : "default") +
            '}';
    }
}
