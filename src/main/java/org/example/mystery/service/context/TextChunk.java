package org.example.mystery.service.context;

public record TextChunk(
    String content,
    String id,
    String sourceId,
    int startOffset,
    int endOffset,
    int sequenceIndex
) {
}
