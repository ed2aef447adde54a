package com.netcourier.knowledge.service.ingestion;

public record ChunkMetadata(String documentId,
                            String documentName,
                            String documentPath,
                            int chunkIndex,
                            int totalChunks,
                            String category,
                            String title) {
}
