package com.netcourier.knowledge.model;

/**
 * @param rootPath directory to ingest, the configured documents path when null
 * @param reset drop the collection before indexing
 */
public record IngestRequest(String rootPath, boolean reset) {
}
