package de.entwicklertraining.request.engine;

/**
 * Thrown when the consumer cancelled a request or an in-flight stream.
 *
 * <p>Callers can tell a deliberate cancellation from an ordinary failure by this type alone.
 */
public class StreamCancelledException extends RequestEngineException {

    public StreamCancelledException(String message) {
        super(message);
    }

    public StreamCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
