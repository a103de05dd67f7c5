package de.entwicklertraining.request.engine;

/**
 * Creates a {@link CancellationToken} and cancels it.
 *
 * <pre>{@code
 * CancellationTokenSource source = new CancellationTokenSource();
 * engine.request(RequestOptions.builder().path("/slow").cancellationToken(source.getToken()).build());
 * source.cancel();
 * }</pre>
 */
public final class CancellationTokenSource {

    private final CancellationToken token = new CancellationToken();

    public CancellationToken getToken() {
        return token;
    }

    /**
     * Cancels the token and runs its listeners on the calling thread. Later calls do nothing.
     */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
