package de.entwicklertraining.request.engine;

/**
 * Thrown when a retried operation failed on every attempt.
 *
 * <p>The last failure is available as {@link #getCause()}.
 */
public class RetryExhaustedException extends RequestEngineException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + (attempts == 1 ? " attempt" : " attempts")
                + (lastError != null ? ": " + lastError.getMessage() : ""), lastError);
        this.attempts = attempts;
    }

    /**
     * @return the number of invocations that were made
     */
    public int getAttempts() {
        return attempts;
    }
}
