package de.entwicklertraining.request.engine.streaming;

import java.util.function.UnaryOperator;

/**
 * Configuration for {@link SSEStreamProcessor}.
 *
 * <p>Provides settings that control how incoming text chunks are split into frames:
 * <ul>
 *   <li>Whether SSE framing is stripped at all</li>
 *   <li>Whether payloads are decoded as JSON</li>
 *   <li>The frame delimiter, data line prefix and terminal sentinel</li>
 *   <li>An optional transformer applied to every payload line</li>
 * </ul>
 *
 * <p>Instances are immutable. Use {@link #builder()} or {@link #defaults()}.
 */
public class StreamProcessorConfig {

    /** Default frame delimiter: one blank line. */
    public static final String DEFAULT_DELIMITER = "\n\n";

    /** Default prefix of payload lines. */
    public static final String DEFAULT_DATA_PREFIX = "data:";

    /** Default payload that ends the stream. */
    public static final String DEFAULT_SENTINEL = "[DONE]";

    private static final StreamProcessorConfig DEFAULTS = builder().build();

    private final boolean parseData;
    private final boolean parseJson;
    private final boolean ignoreInvalidDataPrefix;
    private final String delimiter;
    private final String dataPrefix;
    private final String sentinel;
    private final UnaryOperator<String> payloadTransformer;

    private StreamProcessorConfig(Builder builder) {
        this.parseData = builder.parseData;
        this.parseJson = builder.parseJson;
        this.ignoreInvalidDataPrefix = builder.ignoreInvalidDataPrefix;
        this.delimiter = builder.delimiter;
        this.dataPrefix = builder.dataPrefix;
        this.sentinel = builder.sentinel;
        this.payloadTransformer = builder.payloadTransformer;
    }

    /**
     * Returns the shared default configuration.
     *
     * @return the default configuration
     */
    public static StreamProcessorConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Whether SSE framing (delimiter, prefixes, metadata lines) is interpreted.
     * When {@code false}, every chunk is treated as one raw payload.
     *
     * @return true if framing is parsed
     */
    public boolean isParseData() {
        return parseData;
    }

    /**
     * Whether payloads are decoded as JSON.
     *
     * @return true if payloads are decoded
     */
    public boolean isParseJson() {
        return parseJson;
    }

    /**
     * Whether lines that are neither metadata nor prefixed with {@link #getDataPrefix()} are dropped.
     *
     * @return true if such lines are dropped
     */
    public boolean isIgnoreInvalidDataPrefix() {
        return ignoreInvalidDataPrefix;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public String getDataPrefix() {
        return dataPrefix;
    }

    public String getSentinel() {
        return sentinel;
    }

    public UnaryOperator<String> getPayloadTransformer() {
        return payloadTransformer;
    }

    public Builder toBuilder() {
        return new Builder()
                .parseData(parseData)
                .parseJson(parseJson)
                .ignoreInvalidDataPrefix(ignoreInvalidDataPrefix)
                .delimiter(delimiter)
                .dataPrefix(dataPrefix)
                .sentinel(sentinel)
                .payloadTransformer(payloadTransformer);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link StreamProcessorConfig}.
     */
    public static class Builder {

        private boolean parseData = true;
        private boolean parseJson = true;
        private boolean ignoreInvalidDataPrefix = true;
        private String delimiter = DEFAULT_DELIMITER;
        private String dataPrefix = DEFAULT_DATA_PREFIX;
        private String sentinel = DEFAULT_SENTINEL;
        private UnaryOperator<String> payloadTransformer = UnaryOperator.identity();

        public Builder() {}

        public Builder parseData(boolean parseData) {
            this.parseData = parseData;
            return this;
        }

        public Builder parseJson(boolean parseJson) {
            this.parseJson = parseJson;
            return this;
        }

        public Builder ignoreInvalidDataPrefix(boolean ignore) {
            this.ignoreInvalidDataPrefix = ignore;
            return this;
        }

        public Builder delimiter(String delimiter) {
            if (delimiter == null || delimiter.isEmpty()) {
                throw new IllegalArgumentException("Delimiter must not be empty");
            }
            this.delimiter = delimiter;
            return this;
        }

        public Builder dataPrefix(String dataPrefix) {
            if (dataPrefix == null || dataPrefix.isEmpty()) {
                throw new IllegalArgumentException("Data prefix must not be empty");
            }
            this.dataPrefix = dataPrefix;
            return this;
        }

        public Builder sentinel(String sentinel) {
            if (sentinel == null) {
                throw new IllegalArgumentException("Sentinel must not be null");
            }
            this.sentinel = sentinel;
            return this;
        }

        public Builder payloadTransformer(UnaryOperator<String> transformer) {
            this.payloadTransformer = transformer != null ? transformer : UnaryOperator.identity();
            return this;
        }

        public StreamProcessorConfig build() {
            return new StreamProcessorConfig(this);
        }
    }
}
