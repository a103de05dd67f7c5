package de.entwicklertraining.request.engine.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Sends one HTTP request and hands back the response with an unread body.
 *
 * <p>Implementations complete the future as soon as the status and headers are available. Reading,
 * and closing, the body is up to the caller, including a response that arrives after the caller
 * has given up on it. Cancelling the returned future aborts the exchange.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * @param request the request to send
     * @return the response; completes exceptionally with a {@code TransportException} if nothing was received
     */
    CompletableFuture<TransportResponse> send(TransportRequest request);
}
