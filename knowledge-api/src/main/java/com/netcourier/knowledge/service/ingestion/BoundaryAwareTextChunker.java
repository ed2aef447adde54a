package com.netcourier.knowledge.service.ingestion;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed-size windows that prefer to end on a paragraph break, then on a sentence end, as long as
 * the cut stays in the second half of the window.
 */
@Component
public class BoundaryAwareTextChunker implements TextChunker {

    private static final Pattern CRLF = Pattern.compile("\r\n");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");
    private static final String PARAGRAPH_BREAK = "\n\n";
    private static final String SENTENCE_END = ". ";

    private final int chunkSize;
    private final int overlap;

    public BoundaryAwareTextChunker(@Value("${knowledge.ingest.chunk-size:1000}") int chunkSize,
                                    @Value("${knowledge.ingest.chunk-overlap:200}") int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, " + chunkSize + "): " + overlap);
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    @Override
    public List<String> chunk(String text) {
        String clean = clean(text);
        if (clean.isEmpty()) {
            return List.of();
        }
        if (clean.length() <= chunkSize) {
            return List.of(clean);
        }
        List<String> chunks = new ArrayList<>();
        int length = clean.length();
        int start = 0;
        while (start < length) {
            int end = start + chunkSize;
            if (end < length) {
                end = snapToBoundary(clean, start, end);
            }
            String chunk = clean.substring(start, Math.min(end, length)).trim();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            start = Math.max(end - overlap, start + 1);
            if (start >= length - overlap) {
                break;
            }
        }
        return chunks;
    }

    private int snapToBoundary(String text, int start, int end) {
        int midpoint = start + chunkSize / 2;
        int paragraphEnd = text.lastIndexOf(PARAGRAPH_BREAK, end);
        if (paragraphEnd > midpoint) {
            return paragraphEnd;
        }
        int sentenceEnd = text.lastIndexOf(SENTENCE_END, end);
        if (sentenceEnd > midpoint) {
            return sentenceEnd + 1;
        }
        return end;
    }

    static String clean(String text) {
        if (text == null) {
            return "";
        }
        String normalized = CRLF.matcher(text).replaceAll("\n");
        return EXCESS_NEWLINES.matcher(normalized).replaceAll(PARAGRAPH_BREAK).trim();
    }
}
