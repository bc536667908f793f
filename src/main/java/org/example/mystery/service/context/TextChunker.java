package org.example.mystery.service.context;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Splits text into overlapping windows, preferring to break after a sentence and then at
 * whitespace so chunks do not end mid-word.
 */
public class TextChunker {

    private static final String SENTENCE_BREAK = ". ";
    private static final int ID_PREFIX_LENGTH = 50;

    private final int chunkSize;
    private final int overlap;

    public TextChunker(int chunkSize, int overlap) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize)");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<TextChunk> chunk(String sourceId, String text) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            if (end < length) {
                end = findBreak(text, start, end);
            }

            String content = text.substring(start, end).strip();
            if (!content.isEmpty()) {
                chunks.add(new TextChunk(
                        content,
                        chunkId(sourceId, start, content),
                        sourceId,
                        start,
                        end,
                        chunks.size()
                ));
            }

            if (end >= length) {
                break;
            }
            int next = end - overlap;
            start = next > start ? next : end;
        }
        return chunks;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    private int findBreak(String text, int start, int windowEnd) {
        // the whole ". " must sit inside the window; keep the period in this chunk
        int sentence = text.lastIndexOf(SENTENCE_BREAK, windowEnd - SENTENCE_BREAK.length());
        if (sentence > start) {
            return sentence + 1;
        }
        int space = text.lastIndexOf(' ', windowEnd - 1);
        if (space > start) {
            return space;
        }
        return windowEnd;
    }

    private static String chunkId(String sourceId, int start, String content) {
        String seed = sourceId + "_" + start + "_" + content.substring(0, Math.min(ID_PREFIX_LENGTH, content.length()));
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(seed.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
