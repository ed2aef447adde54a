package com.netcourier.knowledge.service.retrieval;

import com.netcourier.knowledge.model.AssembledDocument;
import com.netcourier.knowledge.model.SearchResult;

import java.util.List;
import java.util.Optional;

public interface RetrievalService {

    /**
     * @param topK maximum number of results, the configured default when null
     * @param category exact category to restrict to, or null
     * @return results above the score threshold, highest score first
     * @throws SearchUnavailableException when the embedding endpoint or the store fails
     */
    List<SearchResult> search(String query, Integer topK, String category);

    /**
     * Rebuilds a document from its chunks; empty when no chunk carries {@code documentId}.
     */
    Optional<AssembledDocument> getDocument(String documentId);
}
