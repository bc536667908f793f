package org.example.mystery.service.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Chunked character backgrounds with bounded, query-relevant retrieval.
 *
 * <p>Without a {@link SimilarityBackend}, or when the backend fails or finds nothing, queries
 * fall back to the first chunks in sequence order. That degraded mode is logged, never thrown.
 *
 * <p>All operations synchronize on the index, so a query never observes a source whose chunks
 * are being replaced.
 */
public class ContextIndex {

    private static final Logger log = LoggerFactory.getLogger(ContextIndex.class);

    static final int CHARS_PER_TOKEN = 4;
    static final String CHUNK_SEPARATOR = "\n\n";
    static final String TRUNCATION_MARKER = "...";

    private final TextChunker chunker;
    private final int maxChunksPerQuery;
    private final SimilarityBackend similarityBackend;
    private final Map<String, List<TextChunk>> chunksBySource = new HashMap<>();

    /**
     * @param similarityBackend nullable; {@code null} selects sequence-order retrieval
     */
    public ContextIndex(TextChunker chunker, int maxChunksPerQuery, SimilarityBackend similarityBackend) {
        if (maxChunksPerQuery < 1) {
            throw new IllegalArgumentException("maxChunksPerQuery must be at least 1");
        }
        this.chunker = chunker;
        this.maxChunksPerQuery = maxChunksPerQuery;
        this.similarityBackend = similarityBackend;
        log.info("Context index initialized: chunkSize={}, overlap={}, k={}, similarity={}",
                chunker.getChunkSize(), chunker.getOverlap(), maxChunksPerQuery,
                similarityBackend != null ? similarityBackend.getBackendName() : "none");
    }

    public void addSource(String sourceId, String fullText) {
        List<TextChunk> chunks = chunker.chunk(sourceId, fullText);

        synchronized (this) {
            chunksBySource.put(sourceId, List.copyOf(chunks));
            if (similarityBackend != null) {
                try {
                    similarityBackend.index(sourceId, chunks);
                } catch (IOException | RuntimeException e) {
                    log.warn("Similarity indexing failed for {}, queries will use sequence order: {}",
                            sourceId, e.getMessage());
                }
            }
        }
        log.debug("Added source {} as {} chunks", sourceId, chunks.size());
    }

    /**
     * Adds a text with labelled extra fields appended after it, e.g. a backstory plus the
     * character's name and role.
     */
    public void addSource(String sourceId, String text, Map<String, String> extraFields) {
        StringBuilder fullText = new StringBuilder(text == null ? "" : text);
        if (extraFields != null) {
            new LinkedHashMap<>(extraFields).forEach((key, value) ->
                    fullText.append("\n\n").append(key).append(": ").append(value));
        }
        addSource(sourceId, fullText.toString());
    }

    /**
     * The most relevant slice of a source, at most roughly {@code maxTokens} tokens long.
     * Returns an empty string for an unknown source; callers then use the full text themselves.
     */
    public String query(String sourceId, String queryText, int maxTokens) {
        List<String> selected;

        synchronized (this) {
            List<TextChunk> chunks = chunksBySource.get(sourceId);
            if (chunks == null || chunks.isEmpty()) {
                return "";
            }
            selected = selectChunks(sourceId, chunks, queryText).stream()
                    .map(TextChunk::content)
                    .toList();
        }

        return bound(String.join(CHUNK_SEPARATOR, selected), maxTokens);
    }

    public String fullContext(String sourceId) {
        synchronized (this) {
            List<TextChunk> chunks = chunksBySource.get(sourceId);
            if (chunks == null) {
                return "";
            }
            return chunks.stream().map(TextChunk::content).collect(Collectors.joining("\n"));
        }
    }

    public List<TextChunk> chunksOf(String sourceId) {
        synchronized (this) {
            return chunksBySource.getOrDefault(sourceId, List.of());
        }
    }

    public void removeSource(String sourceId) {
        synchronized (this) {
            chunksBySource.remove(sourceId);
            if (similarityBackend != null) {
                try {
                    similarityBackend.remove(sourceId);
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to remove {} from similarity index: {}", sourceId, e.getMessage());
                }
            }
        }
    }

    /**
     * Removes every source whose id starts with the prefix (all characters of one session).
     */
    public int removeSourcesWithPrefix(String prefix) {
        List<String> matching;
        synchronized (this) {
            matching = chunksBySource.keySet().stream()
                    .filter(id -> id.startsWith(prefix))
                    .toList();
            matching.forEach(this::removeSource);
        }
        return matching.size();
    }

    public void clear() {
        synchronized (this) {
            chunksBySource.clear();
            if (similarityBackend != null) {
                try {
                    similarityBackend.clear();
                } catch (IOException | RuntimeException e) {
                    log.warn("Failed to clear similarity index: {}", e.getMessage());
                }
            }
        }
    }

    public ContextIndexStats stats() {
        synchronized (this) {
            int sources = chunksBySource.size();
            int chunks = chunksBySource.values().stream().mapToInt(List::size).sum();
            double average = sources > 0 ? (double) chunks / sources : 0.0;
            return new ContextIndexStats(sources, chunks, average, similarityBackend != null);
        }
    }

    private List<TextChunk> selectChunks(String sourceId, List<TextChunk> chunks, String queryText) {
        if (similarityBackend != null && queryText != null && !queryText.isBlank()) {
            try {
                List<TextChunk> ranked = similarityBackend.mostSimilar(sourceId, queryText, maxChunksPerQuery);
                if (!ranked.isEmpty()) {
                    return ranked;
                }
                log.debug("No similar chunks for {}, using sequence order", sourceId);
            } catch (IOException | RuntimeException e) {
                log.warn("Similarity search failed for {}, using sequence order: {}", sourceId, e.getMessage());
            }
        }
        return chunks.subList(0, Math.min(maxChunksPerQuery, chunks.size()));
    }

    static String bound(String combined, int maxTokens) {
        int maxChars = Math.max(0, maxTokens) * CHARS_PER_TOKEN;
        if (combined.length() > maxChars) {
            return combined.substring(0, maxChars) + TRUNCATION_MARKER;
        }
        return combined;
    }
}
