package de.entwicklertraining.request.engine.streaming;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONTokener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Consumer;

/**
 * Stream processor for Server-Sent Events (SSE) style text streams.
 *
 * <p>Handles the framing used by most streaming APIs:
 * <pre>
 * event: chunk
 * id: event_123
 * data: {"content": "Hello"}
 *
 * data: {"content": " World"}
 *
 * data: [DONE]
 * </pre>
 *
 * <p>Chunks may be split anywhere, including inside a delimiter or a JSON value. Incoming text is
 * appended to an internal buffer and only complete frames are drained from it. For each frame this processor:
 * <ul>
 *   <li>Concatenates the payload lines (prefix stripped, no separator between lines)</li>
 *   <li>Collects {@code event:}, {@code id:} and {@code retry:} fields and attaches them to decoded objects</li>
 *   <li>Decodes the payload as JSON if enabled; arrays are flattened into their elements</li>
 *   <li>Detects the terminal sentinel ({@code [DONE]} by default)</li>
 * </ul>
 *
 * <p>Malformed JSON never fails the stream: the frame is still emitted with its raw payload and no values.
 *
 * <p>An instance owns its buffer and serves exactly one stream. It is not thread-safe.
 */
public class SSEStreamProcessor {

    private static final Logger logger = LoggerFactory.getLogger(SSEStreamProcessor.class);

    private static final String EVENT_FIELD = "event:";
    private static final String ID_FIELD = "id:";
    private static final String RETRY_FIELD = "retry:";

    private final StreamProcessorConfig config;
    private final Consumer<StreamMessage> onMessage;

    private final StringBuilder buffer = new StringBuilder();
    private int scanFrom = 0;

    private final StringBuilder allContent = new StringBuilder();
    private final List<DecodedValue> allValues = new ArrayList<>();
    private final List<String> decodedPayloads = new ArrayList<>();

    private ProcessorState state = ProcessorState.IDLE;

    /**
     * Creates a processor with default configuration and no message callback.
     */
    public SSEStreamProcessor() {
        this(StreamProcessorConfig.defaults(), message -> { });
    }

    /**
     * Creates a new SSE stream processor.
     *
     * @param config the framing and decoding configuration
     * @param onMessage called synchronously for every frame with payload or decoded values
     */
    public SSEStreamProcessor(StreamProcessorConfig config, Consumer<StreamMessage> onMessage) {
        this.config = config != null ? config : StreamProcessorConfig.defaults();
        this.onMessage = onMessage != null ? onMessage : message -> { };
    }

    /**
     * Feeds the next chunk of the stream.
     *
     * <p>Every frame completed by this chunk is emitted in arrival order. After the sentinel, the
     * remaining buffer is discarded and further calls return the last state unchanged.
     *
     * @param chunk the next piece of text as read from the transport
     * @return the frames' content from this call together with the accumulated state
     */
    public ChunkResult processChunk(String chunk) {
        if (state.isFinished()) {
            logger.warn("Stream is {}, ignoring chunk of {} chars", state, chunk != null ? chunk.length() : 0);
            return snapshot("", List.of());
        }
        state = ProcessorState.ACCUMULATING;
        if (chunk == null || chunk.isEmpty()) {
            return snapshot("", List.of());
        }

        if (!config.isParseData()) {
            return processUnframed(chunk);
        }

        buffer.append(chunk);
        StringBuilder currentContent = new StringBuilder();
        List<DecodedValue> currentValues = new ArrayList<>();
        String delimiter = config.getDelimiter();

        int index;
        while ((index = buffer.indexOf(delimiter, scanFrom)) >= 0) {
            String block = buffer.substring(0, index);
            buffer.delete(0, index + delimiter.length());
            scanFrom = 0;

            ParsedBlock parsed = parseBlock(block);
            emit(parsed.frame(), currentContent, currentValues);
            if (parsed.terminal()) {
                complete();
                break;
            }
        }
        // a delimiter may straddle the next chunk boundary
        scanFrom = Math.max(0, buffer.length() - delimiter.length() + 1);

        return snapshot(currentContent.toString(), currentValues);
    }

    /**
     * Processes whatever is left in the buffer after the transport reported end of stream.
     *
     * <p>Best-effort recovery for servers that omit the final delimiter. Runs at most once.
     *
     * @return the result for the remainder, or empty if nothing was buffered or the stream already finished
     */
    public Optional<ChunkResult> flush() {
        if (state.isFinished() || buffer.toString().isBlank()) {
            buffer.setLength(0);
            scanFrom = 0;
            return Optional.empty();
        }

        String remainder = buffer.toString();
        buffer.setLength(0);
        scanFrom = 0;
        logger.warn("Processing unterminated remainder of stream: {}", abbreviate(remainder));

        StringBuilder currentContent = new StringBuilder();
        List<DecodedValue> currentValues = new ArrayList<>();
        ParsedBlock parsed = parseBlock(remainder);
        emit(parsed.frame(), currentContent, currentValues);
        if (parsed.terminal()) {
            complete();
        }
        return Optional.of(snapshot(currentContent.toString(), currentValues));
    }

    /**
     * Abandons the stream. Buffered text is dropped and further input is ignored.
     */
    public void abort() {
        if (state.isFinished()) {
            return;
        }
        state = ProcessorState.ABORTED;
        buffer.setLength(0);
        scanFrom = 0;
        logger.debug("Stream processing aborted after {} values", allValues.size());
    }

    public ProcessorState getState() {
        return state;
    }

    /**
     * @return true once the sentinel has been seen
     */
    public boolean isTerminal() {
        return state == ProcessorState.COMPLETED;
    }

    /**
     * Returns the accumulated state without feeding new input.
     *
     * @return the current accumulated state
     */
    public ChunkResult getCurrentState() {
        return snapshot("", List.of());
    }

    /**
     * Builds a single JSON array string holding everything decoded so far.
     *
     * <p>Built from the retained payload text of each successfully decoded frame; values are not
     * re-serialized. Array payloads contribute their elements, so parsing the result yields the same
     * sequence as {@link ChunkResult#allValues()}.
     *
     * @return a JSON array string, {@code []} if nothing was decoded
     */
    public String getAllJsonString() {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (String payload : decodedPayloads) {
            if (payload.startsWith("[")) {
                String inner = payload.substring(1, payload.length() - 1).trim();
                if (!inner.isEmpty()) {
                    joiner.add(inner);
                }
            } else {
                joiner.add(payload);
            }
        }
        return joiner.toString();
    }

    private ChunkResult processUnframed(String chunk) {
        if (chunk.trim().equals(config.getSentinel())) {
            complete();
            return snapshot("", List.of());
        }

        List<DecodedValue> values = List.of();
        String trimmed = chunk.trim();
        boolean looksLikeJson = (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (config.isParseJson() && looksLikeJson) {
            values = decode(trimmed, FrameFields.NONE);
        }

        StringBuilder currentContent = new StringBuilder();
        List<DecodedValue> currentValues = new ArrayList<>();
        emit(new Frame(chunk, values, FrameFields.NONE), currentContent, currentValues);
        return snapshot(currentContent.toString(), currentValues);
    }

    private ParsedBlock parseBlock(String block) {
        StringBuilder payload = new StringBuilder();
        String event = null;
        String id = null;
        Integer retryMs = null;
        boolean terminal = false;

        for (String rawLine : block.split("\n", -1)) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith(EVENT_FIELD)) {
                event = line.substring(EVENT_FIELD.length()).trim();
            } else if (line.startsWith(ID_FIELD)) {
                id = line.substring(ID_FIELD.length()).trim();
            } else if (line.startsWith(RETRY_FIELD)) {
                retryMs = parseRetry(line, retryMs);
            } else if (line.startsWith(config.getDataPrefix())) {
                String part = line.substring(config.getDataPrefix().length()).trim();
                if (part.equals(config.getSentinel())) {
                    terminal = true;
                } else {
                    payload.append(config.getPayloadTransformer().apply(part));
                }
            } else if (!config.isIgnoreInvalidDataPrefix()) {
                payload.append(config.getPayloadTransformer().apply(line));
            } else {
                logger.debug("Ignoring SSE line without data prefix: {}", abbreviate(line));
            }
        }

        FrameFields fields = new FrameFields(event, id, retryMs);
        String raw = payload.toString();
        List<DecodedValue> values = config.isParseJson() && !raw.isBlank()
                ? decode(raw, fields)
                : List.of();
        return new ParsedBlock(new Frame(raw, values, fields), terminal);
    }

    private Integer parseRetry(String line, Integer previous) {
        String value = line.substring(RETRY_FIELD.length()).trim();
        try {
            int retryMs = Integer.parseInt(value);
            if (retryMs < 0) {
                logger.warn("Ignoring negative retry value in SSE: {}", line);
                return previous;
            }
            return retryMs;
        } catch (NumberFormatException e) {
            logger.warn("Invalid retry value in SSE: {}", line);
            return previous;
        }
    }

    private List<DecodedValue> decode(String payload, FrameFields fields) {
        String text = payload.trim();
        Object parsed;
        try {
            StrictJsonSyntax.check(text);
            parsed = new JSONTokener(text).nextValue();
        } catch (JSONException e) {
            logger.warn("Failed to parse SSE payload as JSON: {} - {}", abbreviate(text), e.getMessage());
            return List.of();
        }

        List<DecodedValue> values = new ArrayList<>();
        if (parsed instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                values.add(DecodedValue.of(array.opt(i), fields));
            }
        } else {
            values.add(DecodedValue.of(parsed, fields));
        }
        decodedPayloads.add(text);
        return values;
    }

    private void emit(Frame frame, StringBuilder currentContent, List<DecodedValue> currentValues) {
        if (frame.isEmpty()) {
            return;
        }
        currentContent.append(frame.rawPayload());
        currentValues.addAll(frame.values());
        allContent.append(frame.rawPayload());
        allValues.addAll(frame.values());
        onMessage.accept(new StreamMessage(frame, allContent.toString(), allValues));
    }

    private void complete() {
        state = ProcessorState.COMPLETED;
        buffer.setLength(0);
        scanFrom = 0;
        logger.debug("Stream completed after {} values", allValues.size());
    }

    private ChunkResult snapshot(String currentContent, List<DecodedValue> currentValues) {
        return new ChunkResult(currentContent, currentValues, allContent.toString(), allValues, isTerminal());
    }

    private static String abbreviate(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }

    private record ParsedBlock(Frame frame, boolean terminal) {
    }
}
