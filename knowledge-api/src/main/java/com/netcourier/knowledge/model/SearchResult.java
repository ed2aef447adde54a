package com.netcourier.knowledge.model;

public record SearchResult(String content,
                           double score,
                           String documentId,
                           String documentName,
                           String documentPath,
                           int chunkIndex,
                           int totalChunks,
                           String category,
                           String title) {
}
