package de.entwicklertraining.request.engine;

/**
 * Thrown when a request cannot be sent or its body cannot be read.
 *
 * <p>This is different from {@link HttpStatusException}, which means a response was received
 * but its status was not a success.
 */
public class TransportException extends RequestEngineException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
