package de.entwicklertraining.request.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine-wide defaults for timeouts, retries, caching, concurrency and streaming.
 *
 * <p>Per-request values in {@link RequestOptions} take precedence. Example usage:
 * <pre>
 * RequestEngineSettings settings = RequestEngineSettings.builder()
 *     .baseUrl("https://api.example.com/v1")
 *     .header("Authorization", "Bearer your-token")
 *     .timeoutMs(10_000)
 *     .retry(2)
 *     .cacheTtlMs(5_000)
 *     .build();
 * </pre>
 */
public final class RequestEngineSettings {

    private final String baseUrl;
    private final Map<String, String> headers;
    private final long timeoutMs;
    private final int retry;
    private final long initialDelayMs;
    private final double exponentialBase;
    private final boolean useJitter;
    private final long cacheTtlMs;
    private final long sweepIntervalMs;
    private final int maxConcurrency;
    private final int bufferSize;

    private RequestEngineSettings(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.headers = Map.copyOf(builder.headers);
        this.timeoutMs = builder.timeoutMs;
        this.retry = builder.retry;
        this.initialDelayMs = builder.initialDelayMs;
        this.exponentialBase = builder.exponentialBase;
        this.useJitter = builder.useJitter;
        this.cacheTtlMs = builder.cacheTtlMs;
        this.sweepIntervalMs = builder.sweepIntervalMs;
        this.maxConcurrency = builder.maxConcurrency;
        this.bufferSize = builder.bufferSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new Builder pre-populated with the current settings.
     *
     * @return A new Builder instance with current settings
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .baseUrl(baseUrl)
                .timeoutMs(timeoutMs)
                .retry(retry)
                .initialDelayMs(initialDelayMs)
                .exponentialBase(exponentialBase)
                .useJitter(useJitter)
                .cacheTtlMs(cacheTtlMs)
                .sweepIntervalMs(sweepIntervalMs)
                .maxConcurrency(maxConcurrency)
                .bufferSize(bufferSize);
        builder.headers.putAll(headers);
        return builder;
    }

    /**
     * @return prefix for relative request paths; empty if requests use absolute URLs
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * @return headers sent with every request
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return default request timeout in milliseconds; 0 disables the timeout
     */
    public long getTimeoutMs() {
        return timeoutMs;
    }

    /**
     * @return default number of additional attempts for failed requests
     */
    public int getRetry() {
        return retry;
    }

    /**
     * @return delay before the first retry in milliseconds; 0 retries immediately
     */
    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public double getExponentialBase() {
        return exponentialBase;
    }

    public boolean isUseJitter() {
        return useJitter;
    }

    public long getCacheTtlMs() {
        return cacheTtlMs;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * @return number of characters read from a streamed body per chunk
     */
    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Builder for {@link RequestEngineSettings}.
     */
    public static final class Builder {
        private String baseUrl = "";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private long timeoutMs = 30_000;
        private int retry = 0;
        private long initialDelayMs = 0;
        private double exponentialBase = 2.0;
        private boolean useJitter = true;
        private long cacheTtlMs = 1000;
        private long sweepIntervalMs = 2000;
        private int maxConcurrency = 4;
        private int bufferSize = 8192;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl != null ? baseUrl : "";
            return this;
        }

        public Builder header(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Header name cannot be null or blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("Header value cannot be null");
            }
            this.headers.put(name, value);
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs < 0) {
                throw new IllegalArgumentException("Timeout cannot be negative");
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder retry(int retry) {
            if (retry < 0) {
                throw new IllegalArgumentException("Retry count cannot be negative");
            }
            this.retry = retry;
            return this;
        }

        public Builder initialDelayMs(long initialDelayMs) {
            if (initialDelayMs < 0) {
                throw new IllegalArgumentException("Initial delay cannot be negative");
            }
            this.initialDelayMs = initialDelayMs;
            return this;
        }

        public Builder exponentialBase(double exponentialBase) {
            if (exponentialBase < 1.0) {
                throw new IllegalArgumentException("Exponential base must be at least 1.0");
            }
            this.exponentialBase = exponentialBase;
            return this;
        }

        public Builder useJitter(boolean useJitter) {
            this.useJitter = useJitter;
            return this;
        }

        public Builder cacheTtlMs(long cacheTtlMs) {
            if (cacheTtlMs < 1) {
                throw new IllegalArgumentException("Cache TTL must be at least 1ms");
            }
            this.cacheTtlMs = cacheTtlMs;
            return this;
        }

        public Builder sweepIntervalMs(long sweepIntervalMs) {
            if (sweepIntervalMs < 1) {
                throw new IllegalArgumentException("Sweep interval must be at least 1ms");
            }
            this.sweepIntervalMs = sweepIntervalMs;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("Max concurrency must be at least 1");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            if (bufferSize < 1) {
                throw new IllegalArgumentException("Buffer size must be positive");
            }
            this.bufferSize = bufferSize;
            return this;
        }

        public RequestEngineSettings build() {
            return new RequestEngineSettings(this);
        }
    }
}
