package org.example.mystery.service.context;

import java.io.IOException;
import java.util.List;

/**
 * Ranks the chunks of one source against a free-text query.
 * {@link ContextIndex} calls it while holding its own monitor, so implementations need no locking of their own.
 */
public interface SimilarityBackend {

    /**
     * Replace everything indexed for {@code sourceId} with the given chunks.
     */
    void index(String sourceId, List<TextChunk> chunks) throws IOException;

    /**
     * Up to {@code limit} chunks of the source, most similar first. Empty when nothing matches.
     */
    List<TextChunk> mostSimilar(String sourceId, String query, int limit) throws IOException;

    void remove(String sourceId) throws IOException;

    void clear() throws IOException;

    /**
     * Name of this backend for logging/debugging.
     */
    String getBackendName();
}
