package com.netcourier.knowledge.service.ingestion;

import com.netcourier.knowledge.model.IngestionStats;

import java.nio.file.Path;

public interface IngestionService {

    /**
     * Indexes every supported document below {@code root}. Documents that fail to parse are
     * skipped; embedding or vector store failures abort the run.
     *
     * @param reset drop the collection first
     */
    IngestionStats ingest(Path root, boolean reset);

    /**
     * Removes every indexed chunk of one document.
     */
    void removeDocument(String documentId);
}
