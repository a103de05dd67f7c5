package de.entwicklertraining.request.engine.transport;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * An HTTP request as handed to the {@link HttpTransport}.
 *
 * @param method upper-case HTTP method
 * @param uri the absolute target URI
 * @param headers request headers
 * @param body request body, or null for none
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, String body) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public boolean hasBody() {
        return body != null;
    }
}
