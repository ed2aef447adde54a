package com.netcourier.knowledge.service.embedding;

public class EmbeddingServiceException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public EmbeddingServiceException(int statusCode, String responseBody, Throwable cause) {
        super("Embedding API error: " + statusCode + " - " + responseBody, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public EmbeddingServiceException(String message) {
        super(message);
        this.statusCode = 0;
        this.responseBody = "";
    }

    public EmbeddingServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = "";
    }

    /**
     * HTTP status of the failed response, 0 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
