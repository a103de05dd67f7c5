package de.entwicklertraining.request.engine;

/**
 * Thrown when a request did not complete within its configured timeout.
 * The underlying transport call is aborted when this happens.
 */
public class RequestTimeoutException extends RequestEngineException {

    private final long timeoutMs;

    public RequestTimeoutException(String url, long timeoutMs) {
        super(url + " timed out after " + timeoutMs + "ms");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
