package com.netcourier.knowledge.service.vectorstore;

import java.util.List;
import java.util.Map;
import java.util.Set;

public final class PayloadFields {

    public static final String CHUNK_ID = "chunkId";
    public static final String CONTENT = "content";
    public static final String DOCUMENT_ID = "documentId";
    public static final String DOCUMENT_NAME = "documentName";
    public static final String DOCUMENT_PATH = "documentPath";
    public static final String CHUNK_INDEX = "chunkIndex";
    public static final String TOTAL_CHUNKS = "totalChunks";
    public static final String CATEGORY = "category";
    public static final String TITLE = "title";

    public static final Set<String> FILTERABLE = Set.of(DOCUMENT_ID, CATEGORY);

    public static final List<String> DOCUMENT_SUMMARY = List.of(DOCUMENT_ID, DOCUMENT_NAME, CATEGORY, TITLE);

    private PayloadFields() {
    }

    public static String string(Map<String, Object> payload, String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    public static int integer(Map<String, Object> payload, String key) {
        if (payload == null) {
            return 0;
        }
        Object value = payload.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Integer.parseInt(text.trim());
        }
        return 0;
    }
}
