package de.entwicklertraining.request.engine;

import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Describes a single request.
 *
 * <p>Unset values fall back to the engine's {@link RequestEngineSettings}.
 * <pre>
 * RequestOptions options = RequestOptions.builder()
 *     .method("POST")
 *     .path("/chat/completions")
 *     .jsonBody(new JSONObject().put("stream", true))
 *     .retry(1)
 *     .build();
 * </pre>
 */
public final class RequestOptions {

    private final String method;
    private final String path;
    private final Map<String, Object> query;
    private final Map<String, String> headers;
    private final String body;
    private final Long timeoutMs;
    private final Integer retry;
    private final Long cacheTtlMs;
    private final CancellationToken cancellationToken;

    private RequestOptions(Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(builder.query));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.timeoutMs = builder.timeoutMs;
        this.retry = builder.retry;
        this.cacheTtlMs = builder.cacheTtlMs;
        this.cancellationToken = builder.cancellationToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .method(method)
                .path(path)
                .body(body)
                .cancellationToken(cancellationToken);
        builder.query.putAll(query);
        builder.headers.putAll(headers);
        builder.timeoutMs = timeoutMs;
        builder.retry = retry;
        builder.cacheTtlMs = cacheTtlMs;
        return builder;
    }

    public String getMethod() {
        return method;
    }

    /**
     * @return a path relative to the base URL, or an absolute http(s) URL
     */
    public String getPath() {
        return path;
    }

    /**
     * @return query parameters in insertion order; null values are skipped when the URL is built
     */
    public Map<String, Object> getQuery() {
        return query;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<String> getBody() {
        return Optional.ofNullable(body);
    }

    public Optional<Long> getTimeoutMs() {
        return Optional.ofNullable(timeoutMs);
    }

    public Optional<Integer> getRetry() {
        return Optional.ofNullable(retry);
    }

    public Optional<Long> getCacheTtlMs() {
        return Optional.ofNullable(cacheTtlMs);
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Builder for {@link RequestOptions}.
     */
    public static final class Builder {
        private String method = "GET";
        private String path = "";
        private final Map<String, Object> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private Long timeoutMs;
        private Integer retry;
        private Long cacheTtlMs;
        private CancellationToken cancellationToken = CancellationToken.NONE;

        private Builder() {
        }

        public Builder method(String method) {
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("Method cannot be null or blank");
            }
            this.method = method.trim().toUpperCase();
            return this;
        }

        public Builder path(String path) {
            this.path = path != null ? path : "";
            return this;
        }

        public Builder query(String name, Object value) {
            this.query.put(name, value);
            return this;
        }

        public Builder query(Map<String, ?> query) {
            if (query != null) {
                this.query.putAll(query);
            }
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        /**
         * Sets a JSON body and the matching content type.
         */
        public Builder jsonBody(JSONObject json) {
            this.body = json.toString();
            this.headers.put("Content-Type", "application/json");
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

        public Builder cacheTtlMs(long cacheTtlMs) {
            this.cacheTtlMs = cacheTtlMs;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.NONE;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
