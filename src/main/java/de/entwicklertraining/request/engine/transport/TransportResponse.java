package de.entwicklertraining.request.engine.transport;

import de.entwicklertraining.request.engine.TransportException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A received HTTP response whose body has not been read yet.
 *
 * <p>The body stream must be closed, either directly or through {@link #close()}.
 */
public class TransportResponse implements AutoCloseable {

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final InputStream body;
    private final long contentLength;

    /**
     * @param statusCode the HTTP status code
     * @param headers response headers
     * @param body the unread body
     * @param contentLength declared body length in bytes, or -1 if unknown
     */
    public TransportResponse(int statusCode, Map<String, List<String>> headers, InputStream body, long contentLength) {
        this.statusCode = statusCode;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.body = body != null ? body : InputStream.nullInputStream();
        this.contentLength = contentLength;
    }

    /**
     * Creates a response with a fully known text body.
     */
    public static TransportResponse ofString(int statusCode, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return new TransportResponse(statusCode, Map.of(), new ByteArrayInputStream(bytes), bytes.length);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    /**
     * Looks up a header case-insensitively.
     *
     * @param name the header name
     * @return the first value, if present
     */
    public Optional<String> firstHeader(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    public InputStream getBody() {
        return body;
    }

    /**
     * @return the declared body length in bytes, or -1 if unknown
     */
    public long getContentLength() {
        return contentLength;
    }

    /**
     * Reads the whole body as UTF-8 text and closes it.
     *
     * @return the body text
     * @throws TransportException if the body cannot be read
     */
    public String readBodyAsString() {
        try (InputStream in = body) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransportException("Failed to read response body: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            throw new TransportException("Failed to close response body", e);
        }
    }
}
