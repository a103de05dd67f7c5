package de.entwicklertraining.request.engine.concurrent;

import java.util.Optional;

/**
 * Settled outcome of one deferred operation: either fulfilled with a value or rejected with an error.
 *
 * @param <T> the type of the result value
 */
public final class TaskResult<T> {

    /**
     * Settlement status.
     */
    public enum Status {
        FULFILLED,
        REJECTED
    }

    private final Status status;
    private final T value;
    private final Throwable error;

    private TaskResult(Status status, T value, Throwable error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> TaskResult<T> fulfilled(T value) {
        return new TaskResult<>(Status.FULFILLED, value, null);
    }

    public static <T> TaskResult<T> rejected(Throwable error) {
        if (error == null) {
            error = new IllegalStateException("Task rejected without a reason");
        }
        return new TaskResult<>(Status.REJECTED, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFulfilled() {
        return status == Status.FULFILLED;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    /**
     * @return the value; empty if rejected or if the task fulfilled with null
     */
    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Gets the value or rethrows the error.
     *
     * @return the value
     * @throws RuntimeException the error itself if unchecked, otherwise wrapped
     */
    public T getOrThrow() {
        if (status == Status.FULFILLED) {
            return value;
        }
        if (error instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (error instanceof Error e) {
            throw e;
        }
        throw new IllegalStateException(error);
    }

    @Override
    public String toString() {
        if (status == Status.FULFILLED) {
            return "TaskResult[fulfilled, value=" + value + "]";
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return "TaskResult[rejected, error=" + message + "]";
    }
}
