package de.entwicklertraining.request.engine.streaming;

import java.util.List;

/**
 * State of an {@link SSEStreamProcessor} after one call to
 * {@link SSEStreamProcessor#processChunk(String)} or {@link SSEStreamProcessor#flush()}.
 *
 * @param currentContent raw payload produced by this call
 * @param currentValues values decoded during this call
 * @param allContent every raw payload produced so far
 * @param allValues every value decoded so far
 * @param terminal whether the sentinel has been seen
 */
public record ChunkResult(String currentContent,
                          List<DecodedValue> currentValues,
                          String allContent,
                          List<DecodedValue> allValues,
                          boolean terminal) {

    public ChunkResult {
        currentValues = List.copyOf(currentValues);
        allValues = List.copyOf(allValues);
    }
}
