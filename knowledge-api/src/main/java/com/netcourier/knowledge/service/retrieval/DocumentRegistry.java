package com.netcourier.knowledge.service.retrieval;

import com.netcourier.knowledge.model.DocumentSummary;
import com.netcourier.knowledge.model.KnowledgeBaseStatus;
import com.netcourier.knowledge.service.vectorstore.CollectionStats;
import com.netcourier.knowledge.service.vectorstore.PayloadFields;
import com.netcourier.knowledge.service.vectorstore.PointRecord;
import com.netcourier.knowledge.service.vectorstore.VectorIndex;
import com.netcourier.knowledge.service.vectorstore.VectorStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Document and category listings derived from a full scan of the collection.
 */
@Service
public class DocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    static final int SCAN_PAGE_SIZE = 100;

    private final VectorIndex vectorIndex;

    public DocumentRegistry(VectorIndex vectorIndex) {
        this.vectorIndex = vectorIndex;
    }

    /**
     * One entry per document id, taken from the first chunk seen, in scan order.
     */
    public List<DocumentSummary> listDocuments() {
        if (!vectorIndex.exists()) {
            return List.of();
        }
        List<DocumentSummary> documents;
        try {
            documents = vectorIndex.scrollAll(PayloadFields.DOCUMENT_SUMMARY, SCAN_PAGE_SIZE)
                    .filter(record -> PayloadFields.string(record.payload(), PayloadFields.DOCUMENT_ID) != null)
                    .distinct(record -> PayloadFields.string(record.payload(), PayloadFields.DOCUMENT_ID))
                    .map(this::toSummary)
                    .collectList()
                    .block();
        } catch (VectorStoreException ex) {
            throw unavailable("list documents", ex);
        }
        return documents == null ? List.of() : List.copyOf(documents);
    }

    public List<DocumentSummary> listDocuments(String category) {
        if (category == null || category.isBlank()) {
            return listDocuments();
        }
        String wanted = category.trim();
        return listDocuments().stream()
                .filter(document -> document.category() != null && document.category().equalsIgnoreCase(wanted))
                .toList();
    }

    public List<String> listCategories() {
        return listDocuments().stream()
                .map(DocumentSummary::category)
                .filter(Objects::nonNull)
                .filter(category -> !category.isBlank())
                .distinct()
                .sorted()
                .toList();
    }

    public boolean collectionExists() {
        return vectorIndex.exists();
    }

    public CollectionStats collectionStats() {
        try {
            return vectorIndex.stats();
        } catch (VectorStoreException ex) {
            throw unavailable("read collection stats", ex);
        }
    }

    public KnowledgeBaseStatus status() {
        CollectionStats stats = collectionStats();
        boolean exists = !CollectionStats.NOT_CREATED.equals(stats.status());
        return new KnowledgeBaseStatus(exists, stats.pointsCount(), stats.status());
    }

    private SearchUnavailableException unavailable(String action, VectorStoreException ex) {
        log.warn("Failed to {}: {}", action, ex.getMessage());
        return new SearchUnavailableException("Knowledge base is unavailable", ex);
    }

    private DocumentSummary toSummary(PointRecord record) {
        return new DocumentSummary(
                PayloadFields.string(record.payload(), PayloadFields.DOCUMENT_ID),
                PayloadFields.string(record.payload(), PayloadFields.DOCUMENT_NAME),
                PayloadFields.string(record.payload(), PayloadFields.CATEGORY),
                PayloadFields.string(record.payload(), PayloadFields.TITLE));
    }
}
