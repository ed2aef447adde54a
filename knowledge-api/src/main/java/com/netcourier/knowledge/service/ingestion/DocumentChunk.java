package com.netcourier.knowledge.service.ingestion;

import com.netcourier.knowledge.service.vectorstore.PayloadFields;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record DocumentChunk(String id, String content, ChunkMetadata metadata) {

    /**
     * Numbers the segments of one document 0..N-1, each carrying {@code totalChunks == N}.
     */
    public static List<DocumentChunk> forDocument(ParsedDocument document, List<String> segments) {
        List<DocumentChunk> chunks = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            ChunkMetadata metadata = new ChunkMetadata(
                    document.documentId(),
                    document.name(),
                    document.path(),
                    i,
                    segments.size(),
                    document.category(),
                    document.title());
            chunks.add(new DocumentChunk(document.documentId() + "-chunk-" + i, segments.get(i), metadata));
        }
        return List.copyOf(chunks);
    }

    /**
     * Store identifier: a name-based UUID of document id and position, so that re-ingesting the
     * same file overwrites the vectors of the previous run.
     */
    public String pointId() {
        String key = metadata.documentId() + "#" + metadata.chunkIndex();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(PayloadFields.CHUNK_ID, id);
        payload.put(PayloadFields.CONTENT, content);
        payload.put(PayloadFields.DOCUMENT_ID, metadata.documentId());
        payload.put(PayloadFields.DOCUMENT_NAME, metadata.documentName());
        payload.put(PayloadFields.DOCUMENT_PATH, metadata.documentPath());
        payload.put(PayloadFields.CHUNK_INDEX, metadata.chunkIndex());
        payload.put(PayloadFields.TOTAL_CHUNKS, metadata.totalChunks());
        payload.put(PayloadFields.CATEGORY, metadata.category());
        payload.put(PayloadFields.TITLE, metadata.title());
        return payload;
    }
}
