package com.netcourier.knowledge.model;

import java.util.List;

/**
 * Outcome of one ingestion run.
 *
 * @param documents documents parsed and chunked successfully
 * @param chunks chunks embedded and indexed
 * @param categories sorted distinct categories of the indexed documents
 * @param skippedDocuments documents that failed to parse and were left out
 */
public record IngestionStats(int documents,
                             int chunks,
                             List<String> categories,
                             int skippedDocuments) {

    public static IngestionStats empty(int skippedDocuments) {
        return new IngestionStats(0, 0, List.of(), skippedDocuments);
    }
}
