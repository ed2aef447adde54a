package com.netcourier.knowledge.service.ingestion;

public record ParsedDocument(String documentId,
                             String name,
                             String path,
                             String content,
                             String category,
                             String title) {
}
