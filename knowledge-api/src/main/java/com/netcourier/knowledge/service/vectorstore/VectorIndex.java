package com.netcourier.knowledge.service.vectorstore;

import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Lifecycle and query operations on the knowledge base collection. Write and query failures are
 * reported as {@link VectorStoreException}; an absent collection is a state, not an error.
 */
public interface VectorIndex {

    /**
     * @return false when the collection is absent or the store cannot be reached
     */
    boolean exists();

    /**
     * Creates the collection with its payload indexes unless it is already present.
     */
    void create();

    void delete();

    /**
     * Writes points in fixed-size batches. Batches written before a failing one stay committed.
     */
    void upsert(List<VectorPoint> points);

    void deleteByFilter(PayloadFilter filter);

    default void deleteByDocument(String documentId) {
        deleteByFilter(PayloadFilter.byDocument(documentId));
    }

    /**
     * @param filter optional, null searches the whole collection
     * @return points scoring at least {@code scoreThreshold}, most similar first
     */
    List<ScoredPoint> search(float[] vector, int limit, double scoreThreshold, PayloadFilter filter);

    /**
     * Reads one page of payloads.
     *
     * @param payloadFields fields to return, all fields when empty
     * @param offset cursor from a previous page, null for the first page
     */
    ScrollPage scroll(PayloadFilter filter, List<String> payloadFields, int limit, Object offset);

    /**
     * Lazily pages through the whole collection. Each subscription starts a new scan.
     */
    Flux<PointRecord> scrollAll(List<String> payloadFields, int pageSize);

    /**
     * @return {@link CollectionStats#notCreated()} when the collection is absent
     */
    CollectionStats stats();
}
