package org.example.mystery.service.context;

public record ContextIndexStats(
    int totalSources,
    int totalChunks,
    double averageChunksPerSource,
    boolean similarityEnabled
) {
}
