package de.entwicklertraining.request.engine.transport;

import de.entwicklertraining.request.engine.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link HttpTransport} on top of {@link HttpClient}.
 *
 * <p>The body is delivered as an {@link InputStream} so that streamed responses can be consumed
 * while they arrive.
 */
public class JdkHttpTransport implements HttpTransport, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final ExecutorService executor;
    private final HttpClient httpClient;

    public JdkHttpTransport() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "http-transport-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.httpClient = HttpClient.newBuilder()
                .executor(executor)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Uses the given client. Its executor is not managed by this transport.
     */
    public JdkHttpTransport(HttpClient httpClient) {
        this.executor = null;
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri());
        request.headers().forEach(builder::header);

        HttpRequest.BodyPublisher publisher = request.hasBody()
                ? HttpRequest.BodyPublishers.ofString(request.body())
                : HttpRequest.BodyPublishers.noBody();
        switch (request.method()) {
            case "GET" -> builder.GET();
            case "DELETE" -> builder.DELETE();
            case "POST" -> builder.POST(publisher);
            case "PUT" -> builder.PUT(publisher);
            case "HEAD", "PATCH" -> builder.method(request.method(), publisher);
            default -> {
                return CompletableFuture.failedFuture(
                        new TransportException("Unsupported HTTP method: " + request.method()));
            }
        }

        HttpRequest httpRequest;
        try {
            httpRequest = builder.build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new TransportException("Invalid request: " + e.getMessage(), e));
        }

        logger.debug("{} {}", request.method(), request.uri());
        CompletableFuture<HttpResponse<InputStream>> exchange =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
        CompletableFuture<TransportResponse> result = new CompletableFuture<>();
        exchange.whenComplete((response, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                result.completeExceptionally(new TransportException(
                        "Request to " + request.uri() + " failed: " + cause.getMessage(), cause));
                return;
            }
            long contentLength = response.headers().firstValueAsLong("content-length").orElse(-1L);
            TransportResponse transportResponse = new TransportResponse(response.statusCode(),
                    response.headers().map(), response.body(), contentLength);
            if (!result.complete(transportResponse)) {
                // cancelled while the headers were on their way
                try {
                    transportResponse.close();
                } catch (TransportException e) {
                    logger.debug("Closing unwanted response from {} failed: {}", request.uri(), e.getMessage());
                }
            }
        });
        result.whenComplete((response, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
