package com.netcourier.knowledge.service.retrieval;

/**
 * The knowledge base could not answer a query, as opposed to answering with no results.
 */
public class SearchUnavailableException extends RuntimeException {

    public SearchUnavailableException(String message) {
        super(message);
    }

    public SearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
