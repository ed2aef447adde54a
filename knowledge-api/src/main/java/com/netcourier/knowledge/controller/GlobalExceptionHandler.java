package com.netcourier.knowledge.controller;

import com.netcourier.knowledge.service.embedding.EmbeddingServiceException;
import com.netcourier.knowledge.service.ingestion.IngestionException;
import com.netcourier.knowledge.service.retrieval.SearchUnavailableException;
import com.netcourier.knowledge.service.vectorstore.VectorStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<Map<String, Object>> handleIngestionException(IngestionException exception) {
        return error(exception.status(), exception.getMessage());
    }

    @ExceptionHandler(SearchUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleSearchUnavailable(SearchUnavailableException exception) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, exception.getMessage());
    }

    @ExceptionHandler({EmbeddingServiceException.class, VectorStoreException.class})
    public ResponseEntity<Map<String, Object>> handleUpstreamFailure(RuntimeException exception) {
        log.error("Upstream failure: {}", exception.getMessage());
        return error(HttpStatus.BAD_GATEWAY, exception.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException exception) {
        return error(HttpStatus.BAD_REQUEST, exception.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
