package com.netcourier.knowledge.model;

public record DocumentSummary(String documentId,
                              String documentName,
                              String category,
                              String title) {
}
