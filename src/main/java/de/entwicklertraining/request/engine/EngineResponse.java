package de.entwicklertraining.request.engine;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A completed response with a successful status and its body read as text.
 *
 * @param statusCode the HTTP status code
 * @param headers the response headers
 * @param body the body text, empty for responses without a body
 */
public record EngineResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public EngineResponse {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        body = body != null ? body : "";
    }

    /**
     * Looks up a header case-insensitively.
     */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    /**
     * Parses the body as a JSON object.
     *
     * @return the parsed object
     * @throws RequestEngineException if the body is not a JSON object
     */
    public JSONObject bodyAsJson() {
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new RequestEngineException("Response body is not a JSON object: " + e.getMessage(), e);
        }
    }
}
