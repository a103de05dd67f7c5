package de.entwicklertraining.request.engine;

/**
 * Thrown when the server answers with a status outside 200-299.
 */
public class HttpStatusException extends RequestEngineException {

    private final int statusCode;
    private final String body;

    /**
     * @param statusCode the HTTP status code
     * @param body the response body, possibly truncated; may be empty
     */
    public HttpStatusException(int statusCode, String body) {
        super("Unexpected HTTP status " + statusCode + (body == null || body.isEmpty() ? "" : " - " + body));
        this.statusCode = statusCode;
        this.body = body != null ? body : "";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    /**
     * @return true for 5xx statuses
     */
    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }
}
