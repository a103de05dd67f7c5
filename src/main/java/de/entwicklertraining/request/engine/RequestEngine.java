package de.entwicklertraining.request.engine;

import de.entwicklertraining.request.engine.cache.CachedRequestExecutor;
import de.entwicklertraining.request.engine.cache.ResponseCache;
import de.entwicklertraining.request.engine.concurrent.ConcurrentTaskRunner;
import de.entwicklertraining.request.engine.concurrent.Futures;
import de.entwicklertraining.request.engine.concurrent.RetryTask;
import de.entwicklertraining.request.engine.concurrent.TaskResult;
import de.entwicklertraining.request.engine.streaming.CallbackIterator;
import de.entwicklertraining.request.engine.streaming.ChunkResult;
import de.entwicklertraining.request.engine.streaming.SSEStreamProcessor;
import de.entwicklertraining.request.engine.streaming.StreamMessage;
import de.entwicklertraining.request.engine.streaming.StreamProcessorConfig;
import de.entwicklertraining.request.engine.streaming.StreamingResponseHandler;
import de.entwicklertraining.request.engine.transport.HttpTransport;
import de.entwicklertraining.request.engine.transport.JdkHttpTransport;
import de.entwicklertraining.request.engine.transport.TransportRequest;
import de.entwicklertraining.request.engine.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Client-side request engine.
 *
 * <p>Wires the transport to the building blocks of this library:
 * <ul>
 *   <li>{@link #request(RequestOptions)} sends one request with timeout, retry and cancellation</li>
 *   <li>{@link #cacheRequest(RequestOptions)} answers from a {@link ResponseCache} when it can</li>
 *   <li>{@link #requestAll(List, int)} runs many requests through {@link ConcurrentTaskRunner}</li>
 *   <li>{@link #stream(RequestOptions, StreamProcessorConfig, StreamingResponseHandler)} feeds a
 *       streamed body through an {@link SSEStreamProcessor}</li>
 * </ul>
 *
 * <p>Non-2xx statuses fail with {@link HttpStatusException}. With a retry count of 1 or more the
 * final failure is wrapped in a {@link RetryExhaustedException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (RequestEngine engine = new RequestEngine(RequestEngineSettings.builder()
 *         .baseUrl("https://api.example.com")
 *         .build())) {
 *     EngineResponse response = engine.get("/items").join();
 * }
 * }</pre>
 */
public class RequestEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RequestEngine.class);

    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final RequestEngineSettings settings;
    private final HttpTransport transport;
    private final JdkHttpTransport ownedTransport;
    private final ResponseCache<TaskResult<EngineResponse>> cache;
    private final CachedRequestExecutor<EngineResponse> cachedExecutor;
    private final ExecutorService streamExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    /**
     * Creates an engine on top of {@link JdkHttpTransport}.
     */
    public RequestEngine(RequestEngineSettings settings) {
        this(settings, new JdkHttpTransport(), true);
    }

    /**
     * Creates an engine on top of the given transport. Closing the engine does not close the transport.
     */
    public RequestEngine(RequestEngineSettings settings, HttpTransport transport) {
        this(settings, transport, false);
    }

    private RequestEngine(RequestEngineSettings settings, HttpTransport transport, boolean ownsTransport) {
        this.settings = settings != null ? settings : RequestEngineSettings.builder().build();
        this.transport = transport;
        this.ownedTransport = ownsTransport ? (JdkHttpTransport) transport : null;
        this.cache = new ResponseCache<>(this.settings.getCacheTtlMs(), this.settings.getSweepIntervalMs());
        this.cachedExecutor = new CachedRequestExecutor<>(cache);
        AtomicInteger counter = new AtomicInteger();
        this.streamExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "stream-reader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "request-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }

    public RequestEngineSettings getSettings() {
        return settings;
    }

    /**
     * @return the cache used by {@link #cacheRequest(RequestOptions)}
     */
    public ResponseCache<TaskResult<EngineResponse>> getCache() {
        return cache;
    }

    // --- PLAIN REQUESTS ---

    /**
     * Sends a request.
     *
     * @param options the request
     * @return the response; fails with a {@link RequestEngineException} subtype
     */
    public CompletableFuture<EngineResponse> request(RequestOptions options) {
        int retry = options.getRetry().orElse(settings.getRetry());
        Supplier<CompletableFuture<EngineResponse>> operation = withBackoff(() -> executeOnce(options));
        return retry > 0 ? RetryTask.run(operation, retry) : Futures.invoke(operation);
    }

    public CompletableFuture<EngineResponse> get(String path) {
        return request(RequestOptions.builder().method("GET").path(path).build());
    }

    public CompletableFuture<EngineResponse> get(String path, Map<String, ?> query) {
        return request(RequestOptions.builder().method("GET").path(path).query(query).build());
    }

    public CompletableFuture<EngineResponse> post(String path, String body) {
        return request(RequestOptions.builder().method("POST").path(path).body(body).build());
    }

    public CompletableFuture<EngineResponse> put(String path, String body) {
        return request(RequestOptions.builder().method("PUT").path(path).body(body).build());
    }

    public CompletableFuture<EngineResponse> patch(String path, String body) {
        return request(RequestOptions.builder().method("PATCH").path(path).body(body).build());
    }

    public CompletableFuture<EngineResponse> delete(String path) {
        return request(RequestOptions.builder().method("DELETE").path(path).build());
    }

    public CompletableFuture<EngineResponse> head(String path) {
        return request(RequestOptions.builder().method("HEAD").path(path).build());
    }

    /**
     * Sends a request unless an equal one was answered within the cache TTL.
     *
     * <p>The cache key is the full URL; method, query and body must match as well. Failures are
     * cached like successes, cancellations are not.
     *
     * @param options the request
     * @return the live or cached response
     */
    public CompletableFuture<EngineResponse> cacheRequest(RequestOptions options) {
        String url;
        try {
            url = buildUri(options).toString();
        } catch (RequestEngineException e) {
            return CompletableFuture.failedFuture(e);
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("method", options.getMethod());
        params.put("query", options.getQuery());
        options.getBody().ifPresent(body -> params.put("body", body));

        int retry = options.getRetry().orElse(settings.getRetry());
        return cachedExecutor.execute(url, params, withBackoff(() -> executeOnce(options)),
                retry, options.getCacheTtlMs().orElse(null));
    }

    /**
     * Sends the requests with {@link RequestEngineSettings#getMaxConcurrency()} in flight.
     */
    public CompletableFuture<List<TaskResult<EngineResponse>>> requestAll(List<RequestOptions> requests) {
        return requestAll(requests, settings.getMaxConcurrency());
    }

    /**
     * Sends the requests with at most {@code maxConcurrency} in flight.
     *
     * @param requests the requests
     * @param maxConcurrency the in-flight bound
     * @return one outcome per request, in request order; never fails
     */
    public CompletableFuture<List<TaskResult<EngineResponse>>> requestAll(List<RequestOptions> requests,
                                                                            int maxConcurrency) {
        List<Supplier<CompletableFuture<EngineResponse>>> tasks = new ArrayList<>(requests.size());
        for (RequestOptions options : requests) {
            tasks.add(() -> request(options));
        }
        return ConcurrentTaskRunner.run(tasks, maxConcurrency);
    }

    private CompletableFuture<EngineResponse> executeOnce(RequestOptions options) {
        CancellationToken token = options.getCancellationToken();
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(new StreamCancelledException("Request was cancelled before sending"));
        }
        TransportRequest transportRequest = toTransportRequest(options);
        String url = transportRequest.uri().toString();

        CompletableFuture<TransportResponse> sent = Futures.invoke(() -> transport.send(transportRequest));
        CompletableFuture<EngineResponse> guarded = new CompletableFuture<>();
        sent.whenComplete((response, error) -> {
            if (error != null) {
                guarded.completeExceptionally(Futures.unwrap(error));
                return;
            }
            // a response arriving after a timeout or cancellation is released unread
            if (guarded.isDone()) {
                closeLate(response, url);
                return;
            }
            try {
                guarded.complete(toEngineResponse(response));
            } catch (RuntimeException e) {
                guarded.completeExceptionally(e);
            }
        });

        long timeoutMs = options.getTimeoutMs().orElse(settings.getTimeoutMs());
        if (timeoutMs > 0) {
            ScheduledFuture<?> timer = scheduleTimeout(() -> {
                if (guarded.completeExceptionally(new RequestTimeoutException(url, timeoutMs))) {
                    logger.debug("{} {} timed out after {}ms", options.getMethod(), url, timeoutMs);
                }
            }, timeoutMs);
            if (timer != null) {
                guarded.whenComplete((response, error) -> timer.cancel(false));
            }
        }

        Runnable unregister = token.onCancel(() ->
                guarded.completeExceptionally(new StreamCancelledException("Request to " + url + " was cancelled")));
        guarded.whenComplete((response, error) -> unregister.run());
        return guarded;
    }

    private ScheduledFuture<?> scheduleTimeout(Runnable onTimeout, long timeoutMs) {
        try {
            return timeoutScheduler.schedule(onTimeout, timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Engine is closed, request runs without timeout");
            return null;
        }
    }

    private static void closeLate(TransportResponse response, String url) {
        try {
            response.close();
        } catch (RuntimeException e) {
            logger.debug("Closing late response from {} failed: {}", url, e.getMessage());
        }
    }

    private EngineResponse toEngineResponse(TransportResponse response) {
        String body = response.readBodyAsString();
        if (!response.isSuccess()) {
            throw new HttpStatusException(response.getStatusCode(), abbreviate(body));
        }
        return new EngineResponse(response.getStatusCode(), response.getHeaders(), body);
    }

    private Supplier<CompletableFuture<EngineResponse>> withBackoff(Supplier<CompletableFuture<EngineResponse>> operation) {
        if (settings.getInitialDelayMs() <= 0) {
            return operation;
        }
        return RetryTask.withBackoff(operation, settings.getInitialDelayMs(),
                settings.getExponentialBase(), settings.isUseJitter());
    }

    // --- STREAMING ---

    /**
     * Streams with the default processor configuration.
     */
    public StreamSession stream(RequestOptions options, StreamingResponseHandler handler) {
        return stream(options, StreamProcessorConfig.defaults(), handler);
    }

    /**
     * Sends a request and processes its body incrementally as it arrives.
     *
     * <p>The body is read on a dedicated thread in chunks of {@link RequestEngineSettings#getBufferSize()}
     * characters. Every chunk is passed to {@link StreamingResponseHandler#onRawChunk(String)}, fed to
     * a fresh {@link SSEStreamProcessor} and followed by a progress report. Reading stops at the
     * sentinel or the end of the body; an unterminated remainder is flushed. The timeout, if any,
     * applies until the response headers arrive. Streams are never retried.
     *
     * @param options the request
     * @param config framing and decoding configuration
     * @param handler receives the stream's callbacks
     * @return the session, to await or cancel the stream
     */
    public StreamSession stream(RequestOptions options, StreamProcessorConfig config, StreamingResponseHandler handler) {
        StreamSession session = new StreamSession(handler);
        CancellationToken token = options.getCancellationToken();
        if (token.isCancelled()) {
            session.fail(new StreamCancelledException("Stream was cancelled before sending"));
            return session;
        }

        RequestOptions.Builder streamOptions = options.toBuilder();
        if (options.getHeaders().keySet().stream().noneMatch("Accept"::equalsIgnoreCase)) {
            streamOptions.header("Accept", "text/event-stream");
        }
        TransportRequest transportRequest;
        try {
            transportRequest = toTransportRequest(streamOptions.build());
        } catch (RequestEngineException e) {
            session.fail(e);
            return session;
        }
        String url = transportRequest.uri().toString();

        CompletableFuture<TransportResponse> sent = Futures.invoke(() -> transport.send(transportRequest));

        long timeoutMs = options.getTimeoutMs().orElse(settings.getTimeoutMs());
        if (timeoutMs > 0) {
            ScheduledFuture<?> timer = scheduleTimeout(() -> {
                if (!session.hasResponse() && !session.isDone()) {
                    session.fail(new RequestTimeoutException(url, timeoutMs));
                }
            }, timeoutMs);
            if (timer != null) {
                sent.whenComplete((response, error) -> timer.cancel(false));
                session.completion().whenComplete((result, error) -> timer.cancel(false));
            }
        }

        Runnable unregister = token.onCancel(session::cancel);
        session.completion().whenComplete((result, error) -> unregister.run());

        sent.whenComplete((response, error) -> {
            if (error != null) {
                session.fail(Futures.unwrap(error));
                return;
            }
            if (session.isDone()) {
                closeLate(response, url);
                return;
            }
            if (!session.attachResponse(response)) {
                return;
            }
            try {
                streamExecutor.execute(() -> readStream(response, config, handler, session));
            } catch (RejectedExecutionException e) {
                response.close();
                session.fail(new RequestEngineException("Engine is closed", e));
            }
        });
        return session;
    }

    /**
     * Streams and exposes the messages as a blocking iterator. Closing the iterator cancels the stream.
     *
     * @param options the request
     * @param config framing and decoding configuration
     * @return the messages in arrival order; iteration fails if the stream fails
     */
    public CallbackIterator<StreamMessage> streamMessages(RequestOptions options, StreamProcessorConfig config) {
        return CallbackIterator.subscribe(sink -> {
            StreamSession session = stream(options, config, new StreamingResponseHandler() {
                @Override
                public void onMessage(StreamMessage message) {
                    sink.next(message);
                }

                @Override
                public void onComplete(ChunkResult finalState) {
                    sink.end();
                }

                @Override
                public void onError(Throwable throwable) {
                    sink.error(throwable);
                }
            });
            return session::cancel;
        });
    }

    private void readStream(TransportResponse response,
                            StreamProcessorConfig config,
                            StreamingResponseHandler handler,
                            StreamSession session) {
        SSEStreamProcessor processor = new SSEStreamProcessor(config, message -> {
            if (!session.isDone()) {
                handler.onMessage(message);
            }
        });
        try (response) {
            if (!response.isSuccess()) {
                String body = response.readBodyAsString();
                session.fail(new HttpStatusException(response.getStatusCode(), abbreviate(body)));
                return;
            }
            handler.onStreamStart();

            Reader reader = new InputStreamReader(response.getBody(), StandardCharsets.UTF_8);
            char[] buffer = new char[settings.getBufferSize()];
            long total = response.getContentLength();
            long loaded = 0;
            int read;
            while (!session.isCancelled() && (read = reader.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, read);
                loaded += chunk.getBytes(StandardCharsets.UTF_8).length;
                if (session.isDone()) {
                    break;
                }
                handler.onRawChunk(chunk);
                ChunkResult result = processor.processChunk(chunk);
                if (session.isDone()) {
                    break;
                }
                handler.onProgress(total > 0 ? Math.min(1.0, (double) loaded / total) : -1);
                if (result.terminal()) {
                    break;
                }
            }

            if (session.isCancelled()) {
                processor.abort();
                return;
            }
            processor.flush();
            session.complete(processor.getCurrentState());
        } catch (IOException e) {
            processor.abort();
            if (!session.isCancelled()) {
                session.fail(new TransportException("Failed to read stream: " + e.getMessage(), e));
            }
        } catch (RuntimeException e) {
            processor.abort();
            if (!session.isCancelled()) {
                logger.warn("Stream processing failed", e);
                session.fail(e);
            }
        }
    }

    // --- URL BUILDING ---

    private TransportRequest toTransportRequest(RequestOptions options) {
        Map<String, String> headers = new LinkedHashMap<>(settings.getHeaders());
        headers.putAll(options.getHeaders());
        return new TransportRequest(options.getMethod(), buildUri(options), headers, options.getBody().orElse(null));
    }

    URI buildUri(RequestOptions options) {
        String path = options.getPath();
        String url;
        if (path.startsWith("http://") || path.startsWith("https://")) {
            url = path;
        } else {
            String base = settings.getBaseUrl();
            if (base.endsWith("/") && path.startsWith("/")) {
                url = base + path.substring(1);
            } else if (!base.isEmpty() && !path.isEmpty() && !base.endsWith("/") && !path.startsWith("/")) {
                url = base + "/" + path;
            } else {
                url = base + path;
            }
        }

        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, Object> entry : options.getQuery().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            query.append(query.length() == 0 ? "" : "&")
                    .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(String.valueOf(entry.getValue()), StandardCharsets.UTF_8));
        }
        if (query.length() > 0) {
            url = url + (url.contains("?") ? "&" : "?") + query;
        }

        try {
            URI uri = URI.create(url);
            if (!uri.isAbsolute()) {
                throw new RequestEngineException("Request URL is not absolute: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new RequestEngineException("Invalid request URL: " + url, e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > MAX_ERROR_BODY_LENGTH ? text.substring(0, MAX_ERROR_BODY_LENGTH) + "..." : text;
    }

    /**
     * Stops the cache sweep and the stream readers, and closes the transport if the engine created it.
     */
    @Override
    public void close() {
        cache.close();
        streamExecutor.shutdownNow();
        timeoutScheduler.shutdownNow();
        if (ownedTransport != null) {
            ownedTransport.close();
        }
    }
}
