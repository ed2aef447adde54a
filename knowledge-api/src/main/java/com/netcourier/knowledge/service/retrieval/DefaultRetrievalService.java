package com.netcourier.knowledge.service.retrieval;

import com.netcourier.knowledge.model.AssembledDocument;
import com.netcourier.knowledge.model.SearchResult;
import com.netcourier.knowledge.service.embedding.EmbeddingServiceException;
import com.netcourier.knowledge.service.embedding.EmbeddingsClient;
import com.netcourier.knowledge.service.vectorstore.PayloadFields;
import com.netcourier.knowledge.service.vectorstore.PayloadFilter;
import com.netcourier.knowledge.service.vectorstore.PointRecord;
import com.netcourier.knowledge.service.vectorstore.ScoredPoint;
import com.netcourier.knowledge.service.vectorstore.ScrollPage;
import com.netcourier.knowledge.service.vectorstore.VectorIndex;
import com.netcourier.knowledge.service.vectorstore.VectorStoreException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class DefaultRetrievalService implements RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(DefaultRetrievalService.class);

    static final int DOCUMENT_PAGE_SIZE = 1000;
    static final String CHUNK_SEPARATOR = "\n\n";

    private final EmbeddingsClient embeddingsClient;
    private final VectorIndex vectorIndex;
    private final int defaultTopK;
    private final double scoreThreshold;
    private final MeterRegistry meterRegistry;
    private final Timer searchTimer;

    public DefaultRetrievalService(EmbeddingsClient embeddingsClient,
                                   VectorIndex vectorIndex,
                                   MeterRegistry meterRegistry,
                                   @Value("${knowledge.search.top-k:5}") int defaultTopK,
                                   @Value("${knowledge.search.score-threshold:0.5}") double scoreThreshold) {
        this.embeddingsClient = embeddingsClient;
        this.vectorIndex = vectorIndex;
        this.meterRegistry = meterRegistry;
        this.defaultTopK = defaultTopK;
        this.scoreThreshold = scoreThreshold;
        this.searchTimer = meterRegistry.timer("knowledge.search.duration");
    }

    @Override
    public List<SearchResult> search(String query, Integer topK, String category) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be empty");
        }
        int limit = topK == null || topK <= 0 ? defaultTopK : topK;
        PayloadFilter filter = category == null || category.isBlank() ? null : PayloadFilter.byCategory(category.trim());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            if (!vectorIndex.exists()) {
                throw new SearchUnavailableException("Knowledge base is not set up or unreachable");
            }
            float[] vector = embeddingsClient.embed(query);
            List<ScoredPoint> hits = vectorIndex.search(vector, limit, scoreThreshold, filter);
            log.debug("Query '{}' (category {}) matched {} chunks", query, category, hits.size());
            return hits.stream()
                    .map(hit -> toResult(hit.score(), hit.payload()))
                    .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
                    .toList();
        } catch (EmbeddingServiceException | VectorStoreException ex) {
            log.warn("Knowledge base search failed: {}", ex.getMessage());
            throw new SearchUnavailableException("Knowledge base search is unavailable", ex);
        } finally {
            sample.stop(searchTimer);
        }
    }

    @Override
    public Optional<AssembledDocument> getDocument(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            return Optional.empty();
        }
        ScrollPage page;
        try {
            page = vectorIndex.scroll(PayloadFilter.byDocument(documentId), List.of(), DOCUMENT_PAGE_SIZE, null);
        } catch (VectorStoreException ex) {
            log.warn("Failed to load chunks of document {}: {}", documentId, ex.getMessage());
            throw new SearchUnavailableException("Knowledge base is unavailable", ex);
        }
        if (page.points().isEmpty()) {
            return Optional.empty();
        }
        List<Map<String, Object>> ordered = page.points().stream()
                .map(PointRecord::payload)
                .sorted(Comparator.comparingInt(payload -> PayloadFields.integer(payload, PayloadFields.CHUNK_INDEX)))
                .toList();
        String content = ordered.stream()
                .map(payload -> PayloadFields.string(payload, PayloadFields.CONTENT))
                .map(text -> text == null ? "" : text)
                .collect(Collectors.joining(CHUNK_SEPARATOR));
        Map<String, Object> first = ordered.get(0);
        return Optional.of(new AssembledDocument(
                documentId,
                PayloadFields.string(first, PayloadFields.DOCUMENT_NAME),
                PayloadFields.string(first, PayloadFields.TITLE),
                PayloadFields.string(first, PayloadFields.CATEGORY),
                PayloadFields.integer(first, PayloadFields.TOTAL_CHUNKS),
                content));
    }

    private SearchResult toResult(double score, Map<String, Object> payload) {
        return new SearchResult(
                PayloadFields.string(payload, PayloadFields.CONTENT),
                score,
                PayloadFields.string(payload, PayloadFields.DOCUMENT_ID),
                PayloadFields.string(payload, PayloadFields.DOCUMENT_NAME),
                PayloadFields.string(payload, PayloadFields.DOCUMENT_PATH),
                PayloadFields.integer(payload, PayloadFields.CHUNK_INDEX),
                PayloadFields.integer(payload, PayloadFields.TOTAL_CHUNKS),
                PayloadFields.string(payload, PayloadFields.CATEGORY),
                PayloadFields.string(payload, PayloadFields.TITLE));
    }
}
