package de.entwicklertraining.request.engine.streaming;

import org.json.JSONArray;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SSEStreamProcessorTest {

    private static final String TWO_FRAMES = "data: {\"a\":1}\n\ndata: {\"b\":2}\n\ndata: [DONE]\n\n";

    private List<StreamMessage> messages;
    private SSEStreamProcessor processor;

    @BeforeEach
    void setUp() {
        messages = new ArrayList<>();
        processor = new SSEStreamProcessor(StreamProcessorConfig.defaults(), messages::add);
    }

    @Test
    @DisplayName("Two frames and the sentinel in one chunk")
    void testTwoFramesAndSentinel() {
        ChunkResult result = processor.processChunk(TWO_FRAMES);

        assertEquals(2, result.currentValues().size());
        assertEquals(1, result.currentValues().get(0).asObject().getInt("a"));
        assertEquals(2, result.currentValues().get(1).asObject().getInt("b"));
        assertEquals("{\"a\":1}{\"b\":2}", result.allContent());
        assertTrue(result.terminal());
        assertTrue(processor.isTerminal());
        assertEquals(ProcessorState.COMPLETED, processor.getState());
        assertEquals(2, messages.size());
    }

    @Test
    @DisplayName("A frame split across chunks is emitted once complete")
    void testSplitFrame() {
        ChunkResult first = processor.processChunk("data: {\"a\":");
        assertTrue(first.currentValues().isEmpty());
        assertEquals("", first.allContent());
        assertEquals(ProcessorState.ACCUMULATING, processor.getState());

        ChunkResult second = processor.processChunk("1}\n\n");
        assertEquals(1, second.currentValues().size());
        assertEquals(1, second.currentValues().get(0).asObject().getInt("a"));
        assertFalse(second.terminal());
    }

    @Test
    @DisplayName("Output does not depend on where chunks are split")
    void testChunkBoundaryIndependence() {
        String input = "event: first\ndata: {\"a\":1}\n\ndata: [1, 2]\n\ndata: \"text\"\n\ndata: [DONE]\n\n";
        ChunkResult whole = new SSEStreamProcessor().processChunk(input);

        SSEStreamProcessor charByChar = new SSEStreamProcessor();
        ChunkResult last = null;
        for (char c : input.toCharArray()) {
            last = charByChar.processChunk(String.valueOf(c));
        }

        assertNotNull(last);
        assertEquals(whole.allValues(), last.allValues());
        assertEquals(whole.allContent(), last.allContent());
        assertTrue(last.terminal());
        assertEquals(4, last.allValues().size());
    }

    @Test
    @DisplayName("Input after the sentinel changes nothing")
    void testIgnoresInputAfterSentinel() {
        ChunkResult done = processor.processChunk(TWO_FRAMES);
        ChunkResult after = processor.processChunk("data: {\"c\":3}\n\n");

        assertEquals(done.allValues(), after.allValues());
        assertEquals(done.allContent(), after.allContent());
        assertTrue(after.currentValues().isEmpty());
        assertTrue(after.terminal());
        assertEquals(2, messages.size());
        assertEquals(Optional.empty(), processor.flush());
    }

    @Test
    @DisplayName("Frames in the same chunk after the sentinel are dropped")
    void testStopsAtSentinelWithinChunk() {
        ChunkResult result = processor.processChunk("data: {\"a\":1}\n\ndata: [DONE]\n\ndata: {\"b\":2}\n\n");

        assertEquals(1, result.allValues().size());
        assertTrue(result.terminal());
    }

    @Test
    @DisplayName("Frame fields are attached to objects only")
    void testFrameFieldsOnObjectsOnly() {
        ChunkResult result = processor.processChunk(
                "event: chunk\nid: 7\nretry: 1500\ndata: {\"x\":1}\n\nevent: list\ndata: [1, \"s\", {\"k\":true}]\n\n");

        List<DecodedValue> values = result.allValues();
        assertEquals(4, values.size());

        FrameFields fields = values.get(0).getFields();
        assertEquals(Optional.of("chunk"), fields.getEvent());
        assertEquals(Optional.of("7"), fields.getId());
        assertEquals(Optional.of(1500), fields.getRetryMs());

        assertEquals(DecodedValue.Kind.NUMBER, values.get(1).getKind());
        assertTrue(values.get(1).getFields().isEmpty());
        assertEquals(Optional.of("s"), values.get(2).asString());
        assertTrue(values.get(2).getFields().isEmpty());
        assertTrue(values.get(3).isObject());
        assertEquals(Optional.of("list"), values.get(3).getFields().getEvent());
    }

    @Test
    @DisplayName("Invalid retry values are ignored")
    void testInvalidRetryIgnored() {
        ChunkResult result = processor.processChunk("retry: soon\ndata: {\"x\":1}\n\n");

        assertEquals(Optional.empty(), result.allValues().get(0).getFields().getRetryMs());
    }

    @Test
    @DisplayName("Malformed JSON keeps the stream alive")
    void testMalformedJson() {
        ChunkResult bad = processor.processChunk("data: {bad json\n\n");
        assertTrue(bad.currentValues().isEmpty());
        assertEquals("{bad json", bad.currentContent());
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).currentValues().isEmpty());

        ChunkResult good = processor.processChunk("data: {\"ok\":true}\n\n");
        assertEquals(1, good.allValues().size());
        assertEquals("{bad json{\"ok\":true}", good.allContent());
    }

    @Test
    @DisplayName("Bare words are not treated as JSON")
    void testBareWordIsNotJson() {
        ChunkResult result = processor.processChunk("data: hello\n\n");

        assertEquals("hello", result.currentContent());
        assertTrue(result.currentValues().isEmpty());
    }

    @Test
    @DisplayName("Lenient JSON forms are rejected and left out of the combined array")
    void testLenientJsonRejected() {
        ChunkResult result = processor.processChunk(
                "data: {a:1}\n\ndata: 'x'\n\ndata: {\"b\":2,}\n\ndata: {\"c\":3}\n\n");

        assertEquals(1, result.allValues().size());
        assertEquals(3, result.allValues().get(0).asObject().getInt("c"));
        assertEquals(4, messages.size());
        assertEquals("[{\"c\":3}]", processor.getAllJsonString());
        new JSONArray(processor.getAllJsonString());
    }

    @Test
    @DisplayName("Payload lines of one frame are concatenated")
    void testMultiLinePayload() {
        ChunkResult result = processor.processChunk("data: {\"a\":\ndata: 1}\n\n");

        assertEquals("{\"a\":1}", result.currentContent());
        assertEquals(1, result.currentValues().get(0).asObject().getInt("a"));
    }

    @Test
    @DisplayName("Lines without data prefix are dropped unless configured otherwise")
    void testInvalidDataPrefix() {
        ChunkResult dropped = processor.processChunk("noise\ndata: {\"a\":1}\n\n");
        assertEquals("{\"a\":1}", dropped.currentContent());

        SSEStreamProcessor lenient = new SSEStreamProcessor(
                StreamProcessorConfig.builder().ignoreInvalidDataPrefix(false).parseJson(false).build(), null);
        ChunkResult kept = lenient.processChunk("plain text\n\n");
        assertEquals("plain text", kept.currentContent());
        assertTrue(kept.currentValues().isEmpty());
    }

    @Test
    @DisplayName("Custom delimiter, prefix and sentinel")
    void testCustomFraming() {
        StreamProcessorConfig config = StreamProcessorConfig.builder()
                .delimiter("\r\n\r\n")
                .dataPrefix("payload:")
                .sentinel("END")
                .build();
        SSEStreamProcessor custom = new SSEStreamProcessor(config, null);

        ChunkResult result = custom.processChunk("payload: {\"a\":1}\r\n\r\npayload: END\r\n\r\n");

        assertEquals(1, result.allValues().size());
        assertTrue(result.terminal());
    }

    @Test
    @DisplayName("Payload transformer is applied to every payload line")
    void testPayloadTransformer() {
        SSEStreamProcessor custom = new SSEStreamProcessor(
                StreamProcessorConfig.builder().payloadTransformer(s -> s.replace("'", "\"")).build(), null);

        ChunkResult result = custom.processChunk("data: {'a':'b'}\n\n");

        assertEquals("b", result.currentValues().get(0).asObject().getString("a"));
    }

    @Test
    @DisplayName("flush() processes an unterminated remainder once")
    void testFlushRemainder() {
        ChunkResult partial = processor.processChunk("data: {\"a\":1}\n\ndata: {\"tail\":true}");
        assertEquals(1, partial.allValues().size());

        Optional<ChunkResult> flushed = processor.flush();
        assertTrue(flushed.isPresent());
        assertEquals(1, flushed.get().currentValues().size());
        assertTrue(flushed.get().currentValues().get(0).asObject().getBoolean("tail"));
        assertEquals(2, flushed.get().allValues().size());

        assertEquals(Optional.empty(), processor.flush());
    }

    @Test
    @DisplayName("flush() of a remainder holding the sentinel completes the stream")
    void testFlushSentinel() {
        processor.processChunk("data: [DONE]");
        assertFalse(processor.isTerminal());

        processor.flush();
        assertTrue(processor.isTerminal());
    }

    @Test
    @DisplayName("abort() drops the buffer and ignores further input")
    void testAbort() {
        processor.processChunk("data: {\"a\":1}\n\ndata: {\"partial\":");
        processor.abort();

        assertEquals(ProcessorState.ABORTED, processor.getState());
        ChunkResult after = processor.processChunk("1}\n\n");
        assertEquals(1, after.allValues().size());
        assertFalse(after.terminal());
        assertEquals(Optional.empty(), processor.flush());
    }

    @Test
    @DisplayName("getAllJsonString() rebuilds one array from all decoded frames")
    void testGetAllJsonString() {
        assertEquals("[]", processor.getAllJsonString());

        processor.processChunk("data: {\"a\":1}\n\ndata: [2, 3]\n\ndata: []\n\ndata: {broken\n\n");

        JSONArray array = new JSONArray(processor.getAllJsonString());
        assertEquals(3, array.length());
        assertEquals(1, array.getJSONObject(0).getInt("a"));
        assertEquals(2, array.getInt(1));
        assertEquals(3, array.getInt(2));
    }

    @Test
    @DisplayName("Without framing every chunk is one payload")
    void testUnframedMode() {
        SSEStreamProcessor raw = new SSEStreamProcessor(
                StreamProcessorConfig.builder().parseData(false).build(), messages::add);

        ChunkResult text = raw.processChunk("hello ");
        assertEquals("hello ", text.currentContent());
        assertTrue(text.currentValues().isEmpty());

        ChunkResult json = raw.processChunk("{\"k\":1}");
        assertEquals(1, json.currentValues().size());
        assertEquals("hello {\"k\":1}", json.allContent());

        ChunkResult done = raw.processChunk("[DONE]");
        assertTrue(done.terminal());
        assertEquals(2, messages.size());
    }

    @Test
    @DisplayName("Empty chunks are harmless")
    void testEmptyChunk() {
        ChunkResult result = processor.processChunk("");

        assertTrue(result.allValues().isEmpty());
        assertFalse(result.terminal());
        assertTrue(messages.isEmpty());
    }

    @Test
    @DisplayName("Messages carry the accumulated state at emission time")
    void testMessageSnapshots() {
        processor.processChunk(TWO_FRAMES);

        assertEquals(1, messages.get(0).allValues().size());
        assertEquals("{\"a\":1}", messages.get(0).allContent());
        assertEquals(2, messages.get(1).allValues().size());
        assertEquals("{\"b\":2}", messages.get(1).currentContent());
    }
}
