package de.entwicklertraining.request.engine;

/**
 * Base exception class for all errors raised by the request engine.
 *
 * <p>Subclasses distinguish the failure categories callers usually branch on:
 * <ul>
 *   <li>{@link TransportException}: the request could not be sent or the body could not be read</li>
 *   <li>{@link HttpStatusException}: the server answered with a non-success status</li>
 *   <li>{@link RequestTimeoutException}: the request did not finish within its timeout</li>
 *   <li>{@link RetryExhaustedException}: every attempt of a retried operation failed</li>
 *   <li>{@link StreamCancelledException}: the consumer cancelled the request or stream</li>
 * </ul>
 */
public class RequestEngineException extends RuntimeException {

    public RequestEngineException(String message) {
        super(message);
    }

    public RequestEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
