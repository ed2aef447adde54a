package com.netcourier.knowledge.model;

public record AssembledDocument(String documentId,
                                String documentName,
                                String title,
                                String category,
                                int totalChunks,
                                String content) {
}
